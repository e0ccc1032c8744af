package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.GrammarView;
import net.grammarc.grammar.Rule;

/**
 * The validated, indexed form of a grammar.
 * Rules are addressed by their declaration index; the reference edges are
 * index arrays, deduplicated and kept in first-occurrence order. A
 * RuleGraph is only ever produced from a grammar that passed validation, so
 * every edge target exists.
 */
public final class RuleGraph {

    private final GrammarView grammar;
    private final List<Rule> rules;
    private final Map<String, Integer> indices;
    private final int[][] references;
    private final String entryRule;
    private final List<Diagnostic> diagnostics;

    RuleGraph(GrammarView grammar, List<Rule> rules, int[][] references,
              String entryRule, List<Diagnostic> diagnostics) {
        this.grammar = grammar;
        this.rules = Collections.unmodifiableList(
            new ArrayList<Rule>(rules));
        this.indices = new HashMap<String, Integer>();
        for (int i = 0; i < rules.size(); i++)
            indices.put(rules.get(i).getName(), i);
        this.references = references;
        this.entryRule = entryRule;
        this.diagnostics = Collections.unmodifiableList(
            new ArrayList<Diagnostic>(diagnostics));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName());
        sb.append('@');
        sb.append(Integer.toHexString(hashCode()));
        sb.append("[grammar=").append(grammar.getName());
        for (int i = 0; i < rules.size(); i++) {
            sb.append(',').append(rules.get(i).getName()).append("->")
              .append(getReferences(i));
        }
        return sb.append(']').toString();
    }

    /**
     * The grammar this graph was built from.
     */
    public GrammarView getGrammar() {
        return grammar;
    }

    /**
     * All rules in declaration order.
     */
    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public Rule getRule(int index) {
        return rules.get(index);
    }
    public Rule getRule(String name) {
        Integer idx = indices.get(name);
        return (idx == null) ? null : rules.get(idx);
    }

    /**
     * The declaration index of the named rule, or -1 if there is none.
     */
    public int indexOf(String name) {
        Integer idx = indices.get(name);
        return (idx == null) ? -1 : idx;
    }

    public boolean contains(String name) {
        return indices.containsKey(name);
    }

    /**
     * The indices of the rules referenced by the rule at index, as a
     * fresh array.
     */
    public int[] getSuccessors(int index) {
        return references[index].clone();
    }

    public Set<String> getReferences(int index) {
        Set<String> ret = new LinkedHashSet<String>();
        for (int s : references[index]) ret.add(rules.get(s).getName());
        return Collections.unmodifiableSet(ret);
    }
    public Set<String> getReferences(String name) {
        int idx = indexOf(name);
        if (idx == -1)
            throw new IllegalArgumentException("No rule named " + name);
        return getReferences(idx);
    }

    /**
     * The rule analysis starts from, or null if the grammar has no parser
     * rules and no designated entry rule.
     */
    public String getEntryRule() {
        return entryRule;
    }

    /**
     * The (non-fatal) diagnostics found while building the graph.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

}
