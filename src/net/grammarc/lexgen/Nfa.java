package net.grammarc.lexgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/* A nondeterministic automaton over code points with epsilon moves. States
 * are dense indices; state 0 is created first and is the start state
 * unless set otherwise. */
public class Nfa {

    public static final class Transition {

        private final CharSet label;
        private final int target;

        public Transition(CharSet label, int target) {
            this.label = label;
            this.target = target;
        }

        public String toString() {
            return label + " -> " + target;
        }

        public CharSet getLabel() {
            return label;
        }

        public int getTarget() {
            return target;
        }

    }

    private final List<List<Integer>> epsilons;
    private final List<List<Transition>> transitions;
    private final List<TokenAccept> accepts;
    private int start;

    public Nfa() {
        this.epsilons = new ArrayList<List<Integer>>();
        this.transitions = new ArrayList<List<Transition>>();
        this.accepts = new ArrayList<TokenAccept>();
        this.start = 0;
    }

    public int size() {
        return accepts.size();
    }

    public int newState() {
        epsilons.add(new ArrayList<Integer>(2));
        transitions.add(new ArrayList<Transition>(1));
        accepts.add(null);
        return accepts.size() - 1;
    }

    public int getStart() {
        return start;
    }
    public void setStart(int state) {
        start = state;
    }

    public void addEpsilon(int from, int to) {
        epsilons.get(from).add(to);
    }

    public void addTransition(int from, CharSet label, int to) {
        if (label.isEmpty()) return;
        transitions.get(from).add(new Transition(label, to));
    }

    public List<Integer> getEpsilons(int state) {
        return Collections.unmodifiableList(epsilons.get(state));
    }

    public List<Transition> getTransitions(int state) {
        return Collections.unmodifiableList(transitions.get(state));
    }

    /* May be null. */
    public TokenAccept getAccept(int state) {
        return accepts.get(state);
    }
    public void setAccept(int state, TokenAccept tag) {
        accepts.set(state, tag);
    }

    /**
     * The distinct transition labels, in order of creation.
     */
    public Set<CharSet> getLabels() {
        Set<CharSet> ret = new LinkedHashSet<CharSet>();
        for (List<Transition> tl : transitions) {
            for (Transition t : tl) ret.add(t.getLabel());
        }
        return ret;
    }

}
