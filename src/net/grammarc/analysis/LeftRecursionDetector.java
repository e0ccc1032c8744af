package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;
import net.grammarc.grammar.Rule;

/* Finds left-recursive cycles in the "can start with" graph: A -> B if some
 * alternative of A begins, after a nullable prefix, with a reference to B.
 * References from parser rules to tokens are not edges.
 * A cycle is reported when the DFS closes it with a back edge, so every
 * left-recursive group of rules is reported at least once, but not every
 * elementary cycle in it: with A -> B -> C -> A and A -> C, only
 * A -> B -> C -> A is listed. */
public class LeftRecursionDetector implements Callable<LeftRecursionReport> {

    private static final Logger LOGGER = Logger.getLogger("LeftRecursion");

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    protected class LeftCornerCollector implements Element.Visitor<Void> {

        private final Set<Integer> corners = new LinkedHashSet<Integer>();
        private Rule container;

        public Set<Integer> collect(Rule rule) {
            container = rule;
            corners.clear();
            for (Alternative alt : rule.getAlternatives())
                collect(alt.getElements());
            return corners;
        }

        protected void collect(List<Element> elems) {
            for (Element e : elems) {
                e.accept(this);
                if (! sets.isNullable(container, e)) break;
            }
        }

        public Void visitRuleRef(Element.RuleRef elem) {
            Rule target = graph.getRule(elem.getName());
            if (target.isParserRule() == container.isParserRule())
                corners.add(graph.indexOf(elem.getName()));
            return null;
        }

        public Void visitLiteral(Element.Literal elem) {
            return null;
        }

        public Void visitCharClass(Element.CharClass elem) {
            return null;
        }

        public Void visitWildcard(Element.Wildcard elem) {
            return null;
        }

        public Void visitEndOfInput(Element.EndOfInput elem) {
            return null;
        }

        public Void visitGroup(Element.Group elem) {
            for (Alternative alt : elem.getAlternatives())
                collect(alt.getElements());
            return null;
        }

        public Void visitQuantified(Element.Quantified elem) {
            return elem.getBody().accept(this);
        }

        public Void visitAction(Element.Action elem) {
            return null;
        }

        public Void visitPredicate(Element.Predicate elem) {
            return null;
        }

    }

    private final RuleGraph graph;
    private final FirstFollowSets sets;

    public LeftRecursionDetector(FirstFollowSets sets) {
        if (sets == null)
            throw new NullPointerException(
                "First/Follow sets may not be null");
        this.graph = sets.getGraph();
        this.sets = sets;
    }

    public RuleGraph getGraph() {
        return graph;
    }

    /* The "can start with" successors of every rule, by index. */
    protected int[][] buildLeftCornerGraph() {
        LeftCornerCollector coll = new LeftCornerCollector();
        int[][] ret = new int[graph.size()][];
        for (int i = 0; i < graph.size(); i++) {
            Set<Integer> corners = coll.collect(graph.getRule(i));
            ret[i] = new int[corners.size()];
            int j = 0;
            for (Integer c : corners) ret[i][j++] = c;
        }
        return ret;
    }

    /* The cycle rotated to start at its lowest index; used to report each
     * cycle only once. */
    private static List<Integer> canonicalize(List<Integer> cycle) {
        int minPos = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i) < cycle.get(minPos)) minPos = i;
        }
        List<Integer> ret = new ArrayList<Integer>(cycle.size());
        for (int i = 0; i < cycle.size(); i++)
            ret.add(cycle.get((minPos + i) % cycle.size()));
        return ret;
    }

    public LeftRecursionReport call() {
        int[][] edges = buildLeftCornerGraph();
        int n = edges.length;
        int[] color = new int[n];
        int[] stack = new int[n];
        int[] nextEdge = new int[n];
        int[] stackPos = new int[n];
        Set<List<Integer>> seen = new HashSet<List<Integer>>();
        List<LeftRecursion> found = new ArrayList<LeftRecursion>();
        for (int root = 0; root < n; root++) {
            if (color[root] != WHITE) continue;
            int sp = 0;
            color[root] = GRAY;
            stackPos[root] = sp;
            nextEdge[sp] = 0;
            stack[sp++] = root;
            while (sp > 0) {
                int u = stack[sp - 1];
                if (nextEdge[sp - 1] == edges[u].length) {
                    color[u] = BLACK;
                    sp--;
                    continue;
                }
                int v = edges[u][nextEdge[sp - 1]++];
                if (color[v] == WHITE) {
                    color[v] = GRAY;
                    stackPos[v] = sp;
                    nextEdge[sp] = 0;
                    stack[sp++] = v;
                } else if (color[v] == GRAY) {
                    // Back edge; the cycle is the stack suffix from v.
                    List<Integer> cycle = new ArrayList<Integer>();
                    for (int i = stackPos[v]; i < sp; i++)
                        cycle.add(stack[i]);
                    if (! seen.add(canonicalize(cycle))) continue;
                    List<String> names = new ArrayList<String>();
                    for (Integer c : cycle)
                        names.add(graph.getRule(c).getName());
                    LeftRecursion lr = new LeftRecursion(names);
                    LOGGER.fine("Found left recursion " + lr);
                    found.add(lr);
                }
            }
        }
        return new LeftRecursionReport(found);
    }

}
