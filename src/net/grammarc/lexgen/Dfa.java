package net.grammarc.lexgen;

import java.util.Arrays;
import net.grammarc.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A deterministic automaton over character classes.
 * State 0 is the start state. Each state has at most one successor per
 * class id (NO_STATE if there is none) and at most one accept tag, already
 * resolved by rule priority.
 * <p>
 * A scanner runs the automaton for as long as there are transitions,
 * remembering the last accepting state it passed, and then backtracks to
 * the end of that match.
 */
public final class Dfa {

    public static final int NO_STATE = -1;

    private final String mode;
    private final int[][] transitions;
    private final TokenAccept[] accepts;
    private final int classCount;

    Dfa(String mode, int[][] transitions, TokenAccept[] accepts,
        int classCount) {
        this.mode = mode;
        this.transitions = transitions;
        this.accepts = accepts;
        this.classCount = classCount;
    }

    public String toString() {
        return getClass().getName() + "@" +
            Integer.toHexString(hashCode()) + "[mode=" + mode + ",states=" +
            transitions.length + "]";
    }

    /**
     * The lexer mode this automaton scans.
     */
    public String getMode() {
        return mode;
    }

    public int getStart() {
        return 0;
    }

    public int getStateCount() {
        return transitions.length;
    }

    public int getClassCount() {
        return classCount;
    }

    /**
     * The successor of state on classId, or NO_STATE.
     */
    public int step(int state, int classId) {
        return transitions[state][classId];
    }

    /**
     * A copy of the transition row of state.
     */
    public int[] getTransitions(int state) {
        return Arrays.copyOf(transitions[state], classCount);
    }

    /**
     * The token accepted in state, or null.
     */
    public TokenAccept getAccept(int state) {
        return accepts[state];
    }

    public boolean isAccepting(int state) {
        return accepts[state] != null;
    }

    public JSONObject toJSON() {
        JSONArray states = new JSONArray();
        for (int i = 0; i < transitions.length; i++) {
            JSONObject edges = new JSONObject();
            for (int c = 0; c < classCount; c++) {
                if (transitions[i][c] != NO_STATE)
                    edges.put(String.valueOf(c), transitions[i][c]);
            }
            states.put(Util.createJSONObject("id", i, "accept",
                (accepts[i] == null) ? null : accepts[i].toJSON(),
                "transitions", edges));
        }
        return Util.createJSONObject("mode", mode, "start", 0,
            "classCount", classCount, "states", states);
    }

}
