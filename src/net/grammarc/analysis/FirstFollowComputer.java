package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;
import net.grammarc.grammar.Rule;

/* Fixed-point computation of the First, nullable and Follow tables. Each
 * table is recomputed in full passes over all rules until a pass changes
 * nothing; sets are only ever added to. */
public class FirstFollowComputer implements Callable<FirstFollowSets> {

    private static final Logger LOGGER = Logger.getLogger("FirstFollow");

    /* Walks a sequence right to left, carrying the set of terminals that
     * can follow the current position. EPSILON in that set stands for
     * "the end of the containing rule". */
    protected class FollowPropagator implements Element.Visitor<Boolean> {

        private Rule container;
        private Set<String> trailer;

        public boolean propagate(Rule rule, List<Element> elems) {
            container = rule;
            calculator.enterRule(rule);
            Set<String> end = new HashSet<String>();
            end.add(FirstFollowSets.EPSILON);
            return propagate(elems, end);
        }

        protected boolean propagate(List<Element> elems,
                                    Set<String> after) {
            boolean changed = false;
            Set<String> t = after;
            for (int i = elems.size() - 1; i >= 0; i--) {
                Element e = elems.get(i);
                Set<String> saved = trailer;
                trailer = t;
                if (e.accept(this)) changed = true;
                trailer = saved;
                Set<String> ef = calculator.ofElement(e);
                Set<String> next = new HashSet<String>(ef);
                if (next.remove(FirstFollowSets.EPSILON)) next.addAll(t);
                t = next;
            }
            return changed;
        }

        public Boolean visitRuleRef(Element.RuleRef elem) {
            if (calculator.isTerminalReference(elem)) return false;
            Set<String> target = follow.get(elem.getName());
            boolean changed = false;
            for (String s : trailer) {
                if (s.equals(FirstFollowSets.EPSILON)) {
                    Set<String> outer = follow.get(container.getName());
                    if (outer != target &&
                            target.addAll(outer))
                        changed = true;
                } else if (target.add(s)) {
                    changed = true;
                }
            }
            return changed;
        }

        public Boolean visitLiteral(Element.Literal elem) {
            return false;
        }

        public Boolean visitCharClass(Element.CharClass elem) {
            return false;
        }

        public Boolean visitWildcard(Element.Wildcard elem) {
            return false;
        }

        public Boolean visitEndOfInput(Element.EndOfInput elem) {
            return false;
        }

        public Boolean visitGroup(Element.Group elem) {
            boolean changed = false;
            for (Alternative alt : elem.getAlternatives()) {
                if (propagate(alt.getElements(), trailer)) changed = true;
            }
            return changed;
        }

        public Boolean visitQuantified(Element.Quantified elem) {
            Set<String> after = trailer;
            if (elem.getQuantifier().isRepeating()) {
                // Another iteration may follow the body.
                after = new HashSet<String>(
                    calculator.ofElement(elem.getBody()));
                after.remove(FirstFollowSets.EPSILON);
                after.addAll(trailer);
            }
            List<Element> body = new ArrayList<Element>(1);
            body.add(elem.getBody());
            return propagate(body, after);
        }

        public Boolean visitAction(Element.Action elem) {
            return false;
        }

        public Boolean visitPredicate(Element.Predicate elem) {
            return false;
        }

    }

    private final RuleGraph graph;
    private final Map<String, Set<String>> first;
    private final Map<String, Set<String>> follow;
    private final FirstSetCalculator calculator;

    public FirstFollowComputer(RuleGraph graph) {
        if (graph == null)
            throw new NullPointerException("Rule graph may not be null");
        this.graph = graph;
        this.first = new LinkedHashMap<String, Set<String>>();
        this.follow = new LinkedHashMap<String, Set<String>>();
        this.calculator = new FirstSetCalculator(graph, first);
    }

    public RuleGraph getGraph() {
        return graph;
    }

    private static int totalSize(Map<String, Set<String>> sets) {
        int ret = 0;
        for (Set<String> s : sets.values()) ret += s.size();
        return ret;
    }

    protected List<Integer> computeFirst() {
        List<Integer> sizes = new ArrayList<Integer>();
        for (Rule r : graph.getRules())
            first.put(r.getName(), new HashSet<String>());
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Rule r : graph.getRules()) {
                Set<String> cur = first.get(r.getName());
                calculator.enterRule(r);
                for (Alternative alt : r.getAlternatives()) {
                    if (cur.addAll(calculator.ofSequence(alt.getElements())))
                        changed = true;
                }
            }
            sizes.add(totalSize(first));
        }
        return sizes;
    }

    protected List<Integer> computeFollow() {
        List<Integer> sizes = new ArrayList<Integer>();
        for (Rule r : graph.getRules())
            follow.put(r.getName(), new HashSet<String>());
        String entry = graph.getEntryRule();
        if (entry != null)
            follow.get(entry).add(FirstFollowSets.END_OF_INPUT);
        FollowPropagator prop = new FollowPropagator();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Rule r : graph.getRules()) {
                for (Alternative alt : r.getAlternatives()) {
                    if (prop.propagate(r, alt.getElements()))
                        changed = true;
                }
            }
            sizes.add(totalSize(follow));
        }
        return sizes;
    }

    public FirstFollowSets call() {
        first.clear();
        follow.clear();
        List<Integer> firstSizes = computeFirst();
        List<Integer> followSizes = computeFollow();
        LOGGER.fine("First sets converged after " + firstSizes.size() +
                    " passes, Follow sets after " + followSizes.size() +
                    " passes (" + graph.size() + " rules)");
        return new FirstFollowSets(graph, first, follow, firstSizes,
                                   followSizes);
    }

}
