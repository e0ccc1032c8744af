package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;
import net.grammarc.grammar.Rule;
import net.grammarc.util.Formats;
import net.grammarc.util.Util;
import org.json.JSONObject;

/**
 * The converged First, Follow and nullable tables of a grammar.
 * Terminals are named the way they are written in the grammar: literals
 * as quoted strings ('else'), character classes in bracket notation
 * ([a-z], ~[\n]), the wildcard as ".", the EOF token as "EOF", and tokens
 * referenced from parser rules by their rule name (ID).
 */
public final class FirstFollowSets {

    /**
     * Marks a First set whose rule (or sequence) can derive the empty
     * string.
     */
    public static final String EPSILON = "ε";

    /**
     * Seeded into the Follow set of the entry rule.
     */
    public static final String END_OF_INPUT = "$";

    private final RuleGraph graph;
    private final Map<String, Set<String>> first;
    private final Map<String, Set<String>> follow;
    private final List<Integer> firstSizes;
    private final List<Integer> followSizes;
    private final FirstSetCalculator calculator;

    FirstFollowSets(RuleGraph graph, Map<String, ? extends Set<String>> first,
                    Map<String, ? extends Set<String>> follow,
                    List<Integer> firstSizes, List<Integer> followSizes) {
        this.graph = graph;
        this.first = freeze(first);
        this.follow = freeze(follow);
        this.firstSizes = Collections.unmodifiableList(
            new ArrayList<Integer>(firstSizes));
        this.followSizes = Collections.unmodifiableList(
            new ArrayList<Integer>(followSizes));
        this.calculator = new FirstSetCalculator(graph, this.first);
    }

    private static Map<String, Set<String>> freeze(
            Map<String, ? extends Set<String>> sets) {
        Map<String, Set<String>> ret =
            new LinkedHashMap<String, Set<String>>();
        for (Map.Entry<String, ? extends Set<String>> ent : sets.entrySet())
            ret.put(ent.getKey(), Collections.unmodifiableSet(
                new TreeSet<String>(ent.getValue())));
        return Collections.unmodifiableMap(ret);
    }

    public static String terminalName(Element.Literal elem) {
        return Formats.formatLiteral(elem.getValue());
    }
    public static String terminalName(Element.CharClass elem) {
        return elem.toString();
    }
    public static String terminalName(Element.Wildcard elem) {
        return elem.toString();
    }
    public static String terminalName(Element.EndOfInput elem) {
        return elem.toString();
    }

    public RuleGraph getGraph() {
        return graph;
    }

    /**
     * The First set of the named rule (sorted), possibly containing
     * EPSILON.
     */
    public Set<String> getFirst(String ruleName) {
        Set<String> ret = first.get(ruleName);
        if (ret == null)
            throw new IllegalArgumentException("No rule named " + ruleName);
        return ret;
    }

    /**
     * The Follow set of the named rule (sorted), possibly containing
     * END_OF_INPUT.
     */
    public Set<String> getFollow(String ruleName) {
        Set<String> ret = follow.get(ruleName);
        if (ret == null)
            throw new IllegalArgumentException("No rule named " + ruleName);
        return ret;
    }

    public boolean isNullable(String ruleName) {
        return getFirst(ruleName).contains(EPSILON);
    }

    /**
     * The names of all nullable rules, in declaration order.
     */
    public List<String> getNullable() {
        List<String> ret = new ArrayList<String>();
        for (Map.Entry<String, Set<String>> ent : first.entrySet()) {
            if (ent.getValue().contains(EPSILON)) ret.add(ent.getKey());
        }
        return ret;
    }

    public Map<String, Set<String>> getFirstSets() {
        return first;
    }

    public Map<String, Set<String>> getFollowSets() {
        return follow;
    }

    /**
     * The First set of an alternative of the given rule.
     * References are interpreted in the context of the rule, i.e. token
     * references from parser rules are terminals.
     */
    public Set<String> firstOf(Rule container, Alternative alt) {
        return firstOf(container, alt.getElements());
    }
    public synchronized Set<String> firstOf(Rule container,
                                            List<Element> elems) {
        calculator.enterRule(container);
        return Collections.unmodifiableSet(
            new TreeSet<String>(calculator.ofSequence(elems)));
    }

    public boolean isNullable(Rule container, Element elem) {
        return firstOf(container, Collections.singletonList(elem))
            .contains(EPSILON);
    }

    /**
     * The number of passes the First fixed point took, including the final
     * pass that changed nothing.
     */
    public int getFirstPasses() {
        return firstSizes.size();
    }

    public int getFollowPasses() {
        return followSizes.size();
    }

    /**
     * The total size of all First sets after each pass.
     */
    public List<Integer> getFirstSizeHistory() {
        return firstSizes;
    }

    public List<Integer> getFollowSizeHistory() {
        return followSizes;
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("first", Util.sortedSetMap(first),
            "follow", Util.sortedSetMap(follow), "nullable",
            Util.sortedJSONArray(getNullable()));
    }

}
