package net.grammarc.lexgen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import net.grammarc.analysis.RuleGraph;
import net.grammarc.grammar.Rule;

/* Compiles the token rules of a validated grammar into a LexerAutomaton.
 * The NFAs of all modes are built first so that the lookup table sees
 * every character set; then each mode is determinized against it. */
public class LexerSynthesizer implements Callable<LexerAutomaton> {

    private static final Logger LOGGER = Logger.getLogger("LexerSynth");

    private final RuleGraph graph;
    private final int maxStates;

    public LexerSynthesizer(RuleGraph graph, int maxStates) {
        if (graph == null)
            throw new NullPointerException("Rule graph may not be null");
        this.graph = graph;
        this.maxStates = maxStates;
    }
    public LexerSynthesizer(RuleGraph graph) {
        this(graph, 0);
    }

    public RuleGraph getGraph() {
        return graph;
    }

    /* Token (non-fragment lexer) rules grouped by mode, in declaration
     * order, with the default mode first. */
    protected Map<String, List<Rule>> groupByMode() {
        Map<String, List<Rule>> ret = new LinkedHashMap<String, List<Rule>>();
        for (Rule r : graph.getRules()) {
            if (r.isLexerRule() && Rule.DEFAULT_MODE.equals(r.getMode())) {
                ret.put(Rule.DEFAULT_MODE, new ArrayList<Rule>());
                break;
            }
        }
        for (Rule r : graph.getRules()) {
            if (! r.isLexerRule()) continue;
            List<Rule> rules = ret.get(r.getMode());
            if (rules == null) {
                rules = new ArrayList<Rule>();
                ret.put(r.getMode(), rules);
            }
            rules.add(r);
        }
        return ret;
    }

    public LexerAutomaton call() throws LexerSynthesisException {
        Map<String, Nfa> nfas = new LinkedHashMap<String, Nfa>();
        LookupTableBuilder tb = new LookupTableBuilder();
        for (Map.Entry<String, List<Rule>> ent : groupByMode().entrySet()) {
            Nfa nfa = new NfaBuilder(graph).build(ent.getValue());
            nfas.put(ent.getKey(), nfa);
            tb.addAll(nfa.getLabels());
        }
        LookupTable table = tb.build();
        Map<String, Dfa> dfas = new LinkedHashMap<String, Dfa>();
        for (Map.Entry<String, Nfa> ent : nfas.entrySet()) {
            DfaBuilder db = new DfaBuilder(ent.getValue(), table, maxStates);
            dfas.put(ent.getKey(), db.build(ent.getKey()));
        }
        LOGGER.fine("Synthesized " + dfas.size() + " mode(s) over " +
                    table.getClassCount() + " character classes");
        return new LexerAutomaton(table, dfas);
    }

}
