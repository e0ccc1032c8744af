package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.api.GrammarView;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;
import net.grammarc.grammar.InvalidGrammarException;
import net.grammarc.grammar.LexerCommand;
import net.grammarc.grammar.Rule;

/* Validates a grammar and indexes it into a RuleGraph. All fatal conditions
 * found are reported together in one InvalidGrammarException. */
public class RuleGraphBuilder implements Callable<RuleGraph> {

    private static final Logger LOGGER = Logger.getLogger("RuleGraph");

    protected static class ReferenceCollector extends ElementWalker {

        private final List<String> names = new ArrayList<String>();
        private boolean sawEndOfInput;

        public Void visitRuleRef(Element.RuleRef elem) {
            names.add(elem.getName());
            return null;
        }

        public Void visitEndOfInput(Element.EndOfInput elem) {
            sawEndOfInput = true;
            return null;
        }

        public List<String> getNames() {
            return names;
        }

        public boolean sawEndOfInput() {
            return sawEndOfInput;
        }

    }

    private final GrammarView grammar;
    private final String entryOverride;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;

    public RuleGraphBuilder(GrammarView grammar, String entryOverride) {
        if (grammar == null)
            throw new NullPointerException("Grammar may not be null");
        this.grammar = grammar;
        this.entryOverride = entryOverride;
        this.errors = new ArrayList<Diagnostic>();
        this.warnings = new ArrayList<Diagnostic>();
    }
    public RuleGraphBuilder(GrammarView grammar) {
        this(grammar, null);
    }

    public GrammarView getGrammar() {
        return grammar;
    }

    protected void error(DiagnosticCode code, String message,
                         String ruleName) {
        errors.add(new Diagnostic(code, message, ruleName));
    }

    protected Map<String, Rule> indexRules() {
        Map<String, Rule> ret = new HashMap<String, Rule>();
        for (Rule r : grammar.getRules()) {
            if (ret.containsKey(r.getName())) {
                error(DiagnosticCode.DUPLICATE_RULE, "rule " + r.getName() +
                      " is defined more than once", r.getName());
            } else {
                ret.put(r.getName(), r);
            }
        }
        return ret;
    }

    protected List<String> collectReferences(Rule rule) {
        ReferenceCollector coll = new ReferenceCollector();
        for (Alternative alt : rule.getAlternatives()) coll.walk(alt);
        if (coll.sawEndOfInput() && rule.getKind().isLexical())
            error(DiagnosticCode.INVALID_GRAMMAR, "lexer rule " +
                  rule.getName() + " may not match EOF", rule.getName());
        return coll.getNames();
    }

    protected void checkRule(Rule rule, List<String> refs,
                             Map<String, Rule> table, Set<String> modes) {
        String name = rule.getName();
        if (rule.getAlternatives().isEmpty())
            error(DiagnosticCode.INVALID_GRAMMAR, "rule " + name +
                  " has no alternatives", name);
        Set<String> reported = new HashSet<String>();
        for (String ref : refs) {
            Rule target = table.get(ref);
            if (target == null) {
                if (reported.add(ref))
                    error(DiagnosticCode.UNDEFINED_RULE, "rule " + name +
                          " references undefined rule " + ref, name);
            } else if (rule.getKind().isLexical() &&
                       target.isParserRule()) {
                if (reported.add(ref))
                    error(DiagnosticCode.INVALID_GRAMMAR, "lexer rule " +
                          name + " references parser rule " + ref, name);
            }
        }
        List<Alternative> alts = rule.getAlternatives();
        for (int i = 0; i < alts.size(); i++) {
            Alternative alt = alts.get(i);
            if (alt.isEmpty())
                warnings.add(new Diagnostic(
                    DiagnosticCode.EMPTY_ALTERNATIVE, "alternative " + i +
                    " of rule " + name + " is empty", name, i));
            for (LexerCommand cmd : alt.getCommands()) {
                if (cmd.entersMode() && ! modes.contains(cmd.getArgument()))
                    error(DiagnosticCode.INVALID_GRAMMAR, "rule " + name +
                          " switches to undefined mode " +
                          cmd.getArgument(), name);
            }
        }
    }

    private String formatCyclicalRules(Collection<String> ruleNames,
                                       String lastRule) {
        StringBuilder sb = new StringBuilder();
        for (String r : ruleNames) {
            sb.append(r).append(" -> ");
        }
        sb.append(lastRule);
        return sb.toString();
    }
    /* Lexer rules are inlined into the automaton, so any recursion among
     * them (in any position) is fatal. */
    protected void checkLexicalRecursion(String name,
            Map<String, List<String>> lexicalRefs, Set<String> path,
            Set<String> done) {
        if (done.contains(name)) return;
        if (path.contains(name)) {
            error(DiagnosticCode.INVALID_GRAMMAR, "lexer rule " + name +
                  " is recursive (" + formatCyclicalRules(path, name) + ")",
                  name);
            return;
        }
        path.add(name);
        for (String ref : lexicalRefs.get(name)) {
            checkLexicalRecursion(ref, lexicalRefs, path, done);
        }
        path.remove(name);
        done.add(name);
    }

    protected String findEntryRule(Map<String, Rule> table) {
        String designated = (entryOverride != null) ? entryOverride :
            grammar.getStartRule();
        if (designated != null) {
            if (! table.containsKey(designated))
                error(DiagnosticCode.INVALID_GRAMMAR, "entry rule " +
                      designated + " is not defined", designated);
            return designated;
        }
        for (Rule r : grammar.getRules()) {
            if (r.isParserRule()) return r.getName();
        }
        return null;
    }

    public RuleGraph call() throws InvalidGrammarException {
        errors.clear();
        warnings.clear();
        if (grammar.getName() == null || grammar.getName().isEmpty())
            error(DiagnosticCode.INVALID_GRAMMAR, "grammar has no name",
                  null);
        if (grammar.getRules().isEmpty()) {
            error(DiagnosticCode.INVALID_GRAMMAR, "grammar " +
                  grammar.getName() + " contains no rules", null);
            throw new InvalidGrammarException(errors);
        }
        Map<String, Rule> table = indexRules();
        Set<String> modes = new HashSet<String>();
        modes.add(Rule.DEFAULT_MODE);
        for (Rule r : table.values()) {
            if (r.getMode() != null) modes.add(r.getMode());
        }
        // Only the first definition of a duplicated name is indexed.
        List<Rule> rules = new ArrayList<Rule>();
        Map<String, List<String>> refs =
            new HashMap<String, List<String>>();
        Map<String, List<String>> lexicalRefs =
            new HashMap<String, List<String>>();
        for (Rule r : grammar.getRules()) {
            if (table.get(r.getName()) != r) continue;
            rules.add(r);
            List<String> rr = collectReferences(r);
            refs.put(r.getName(), rr);
            checkRule(r, rr, table, modes);
            List<String> lr = new ArrayList<String>();
            if (r.getKind().isLexical()) {
                for (String ref : rr) {
                    Rule target = table.get(ref);
                    if (target != null && target.getKind().isLexical())
                        lr.add(ref);
                }
            }
            lexicalRefs.put(r.getName(), lr);
        }
        Set<String> done = new HashSet<String>();
        for (Rule r : rules) {
            if (r.getKind().isLexical())
                checkLexicalRecursion(r.getName(), lexicalRefs,
                                      new LinkedHashSet<String>(), done);
        }
        String entry = findEntryRule(table);
        if (! errors.isEmpty()) {
            LOGGER.fine("Grammar " + grammar.getName() + " rejected with " +
                        errors.size() + " error(s)");
            throw new InvalidGrammarException(errors);
        }
        Map<String, Integer> indices = new HashMap<String, Integer>();
        for (int i = 0; i < rules.size(); i++)
            indices.put(rules.get(i).getName(), i);
        int[][] edges = new int[rules.size()][];
        for (int i = 0; i < rules.size(); i++) {
            Set<Integer> targets = new LinkedHashSet<Integer>();
            for (String ref : refs.get(rules.get(i).getName()))
                targets.add(indices.get(ref));
            edges[i] = new int[targets.size()];
            int j = 0;
            for (Integer t : targets) edges[i][j++] = t;
        }
        LOGGER.fine("Indexed " + rules.size() + " rules of grammar " +
                    grammar.getName() + " (entry rule " + entry + ")");
        return new RuleGraph(grammar, rules, edges, entry, warnings);
    }

}
