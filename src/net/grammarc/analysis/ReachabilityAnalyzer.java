package net.grammarc.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.LexerCommand;
import net.grammarc.grammar.Rule;

/**
 * Finds the rules that can never take part in a parse or a scan.
 * The traversal starts from the entry rule. Lexer rules are live on their
 * own when the scanner can try them without any parser rule referencing
 * them: in a grammar without parser rules every default-mode token is a
 * root, in a combined grammar the default-mode tokens carrying a lexer
 * command (skip, channel, mode switches, ...) are, and once a reachable
 * rule switches to a mode every token of that mode is.
 */
public class ReachabilityAnalyzer implements Callable<ReachabilityReport> {

    private static final Logger LOGGER = Logger.getLogger("Reachability");

    private final RuleGraph graph;

    public ReachabilityAnalyzer(RuleGraph graph) {
        if (graph == null)
            throw new NullPointerException("Rule graph may not be null");
        this.graph = graph;
    }

    public RuleGraph getGraph() {
        return graph;
    }

    protected static boolean hasCommands(Rule rule) {
        for (Alternative alt : rule.getAlternatives()) {
            if (! alt.getCommands().isEmpty()) return true;
        }
        return false;
    }

    protected List<Integer> findRoots() {
        List<Integer> ret = new ArrayList<Integer>();
        boolean hasParserRules = false;
        for (Rule r : graph.getRules()) {
            if (r.isParserRule()) hasParserRules = true;
        }
        String entry = graph.getEntryRule();
        if (entry != null) ret.add(graph.indexOf(entry));
        for (int i = 0; i < graph.size(); i++) {
            Rule r = graph.getRule(i);
            if (! r.isLexerRule() ||
                    ! Rule.DEFAULT_MODE.equals(r.getMode()))
                continue;
            if (! hasParserRules || hasCommands(r)) ret.add(i);
        }
        return ret;
    }

    protected void enterMode(String mode, Deque<Integer> queue) {
        for (int i = 0; i < graph.size(); i++) {
            Rule r = graph.getRule(i);
            if (r.isLexerRule() && mode.equals(r.getMode())) queue.add(i);
        }
    }

    public ReachabilityReport call() {
        boolean[] visited = new boolean[graph.size()];
        Set<String> enteredModes = new HashSet<String>();
        Deque<Integer> queue = new ArrayDeque<Integer>(findRoots());
        while (! queue.isEmpty()) {
            int idx = queue.poll();
            if (visited[idx]) continue;
            visited[idx] = true;
            for (int s : graph.getSuccessors(idx)) {
                if (! visited[s]) queue.add(s);
            }
            for (Alternative alt : graph.getRule(idx).getAlternatives()) {
                for (LexerCommand cmd : alt.getCommands()) {
                    if (cmd.entersMode() &&
                            enteredModes.add(cmd.getArgument()))
                        enterMode(cmd.getArgument(), queue);
                }
            }
        }
        List<String> reachable = new ArrayList<String>();
        List<String> unreachable = new ArrayList<String>();
        for (int i = 0; i < graph.size(); i++) {
            String name = graph.getRule(i).getName();
            if (visited[i]) {
                reachable.add(name);
            } else {
                unreachable.add(name);
            }
        }
        LOGGER.fine(reachable.size() + " of " + graph.size() +
                    " rules reachable");
        return new ReachabilityReport(reachable, unreachable);
    }

}
