package net.grammarc.lexgen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/* Subset construction over character classes. Each DFA state is the
 * epsilon closure of a set of NFA states; its accept tag is the least tag
 * among them. A state whose winning tag is non-greedy keeps no outgoing
 * transitions, so the scanner stops at the shortest match. */
public class DfaBuilder {

    private static final Logger LOGGER = Logger.getLogger("DfaBuilder");

    private final Nfa nfa;
    private final LookupTable table;
    private final int maxStates;
    private final Map<CharSet, BitSet> labelClasses;

    public DfaBuilder(Nfa nfa, LookupTable table, int maxStates) {
        this.nfa = nfa;
        this.table = table;
        this.maxStates = maxStates;
        this.labelClasses = new HashMap<CharSet, BitSet>();
    }
    public DfaBuilder(Nfa nfa, LookupTable table) {
        this(nfa, table, 0);
    }

    /* The classes a transition label covers. The table's boundaries
     * include every label's, so a class is either fully inside a label or
     * fully outside. */
    protected BitSet classesOf(CharSet label) {
        BitSet ret = labelClasses.get(label);
        if (ret == null) {
            ret = new BitSet(table.getClassCount());
            for (int c = 0; c < table.getClassCount(); c++) {
                if (label.contains(table.getMembers(c).first())) ret.set(c);
            }
            labelClasses.put(label, ret);
        }
        return ret;
    }

    protected BitSet closure(BitSet states) {
        BitSet ret = (BitSet) states.clone();
        Deque<Integer> pending = new ArrayDeque<Integer>();
        for (int s = states.nextSetBit(0); s >= 0;
                s = states.nextSetBit(s + 1))
            pending.push(s);
        while (! pending.isEmpty()) {
            int s = pending.pop();
            for (int t : nfa.getEpsilons(s)) {
                if (! ret.get(t)) {
                    ret.set(t);
                    pending.push(t);
                }
            }
        }
        return ret;
    }

    protected TokenAccept resolveAccept(BitSet states) {
        TokenAccept ret = null;
        for (int s = states.nextSetBit(0); s >= 0;
                s = states.nextSetBit(s + 1)) {
            TokenAccept tag = nfa.getAccept(s);
            if (tag != null && (ret == null || tag.compareTo(ret) < 0))
                ret = tag;
        }
        return ret;
    }

    public Dfa build(String mode) throws LexerSynthesisException {
        int classCount = table.getClassCount();
        Map<BitSet, Integer> ids = new HashMap<BitSet, Integer>();
        List<BitSet> states = new ArrayList<BitSet>();
        List<int[]> rows = new ArrayList<int[]>();
        List<TokenAccept> accepts = new ArrayList<TokenAccept>();
        BitSet init = new BitSet(nfa.size());
        init.set(nfa.getStart());
        BitSet start = closure(init);
        ids.put(start, 0);
        states.add(start);
        for (int cur = 0; cur < states.size(); cur++) {
            BitSet set = states.get(cur);
            int[] row = new int[classCount];
            Arrays.fill(row, Dfa.NO_STATE);
            TokenAccept accept = resolveAccept(set);
            rows.add(row);
            accepts.add(accept);
            if (accept != null && accept.isNonGreedy()) continue;
            BitSet[] moves = new BitSet[classCount];
            for (int s = set.nextSetBit(0); s >= 0;
                    s = set.nextSetBit(s + 1)) {
                for (Nfa.Transition t : nfa.getTransitions(s)) {
                    BitSet cls = classesOf(t.getLabel());
                    for (int c = cls.nextSetBit(0); c >= 0;
                            c = cls.nextSetBit(c + 1)) {
                        if (moves[c] == null) moves[c] = new BitSet();
                        moves[c].set(t.getTarget());
                    }
                }
            }
            for (int c = 0; c < classCount; c++) {
                if (moves[c] == null) continue;
                BitSet target = closure(moves[c]);
                Integer id = ids.get(target);
                if (id == null) {
                    id = states.size();
                    if (maxStates > 0 && id >= maxStates)
                        throw new LexerSynthesisException("Automaton of " +
                            "mode " + mode + " exceeds the limit of " +
                            maxStates + " states");
                    ids.put(target, id);
                    states.add(target);
                }
                row[c] = id;
            }
        }
        LOGGER.fine("Mode " + mode + ": " + nfa.size() + " NFA states, " +
                    states.size() + " DFA states, " + classCount +
                    " classes");
        return new Dfa(mode, rows.toArray(new int[rows.size()][]),
                       accepts.toArray(new TokenAccept[accepts.size()]),
                       classCount);
    }

}
