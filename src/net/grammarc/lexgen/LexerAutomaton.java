package net.grammarc.lexgen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.grammarc.grammar.Rule;
import net.grammarc.util.Util;
import org.json.JSONObject;

/**
 * The synthesized lexer: one DFA per mode, all keyed on the class ids of
 * one shared lookup table.
 */
public final class LexerAutomaton {

    private final LookupTable table;
    private final Map<String, Dfa> modes;

    LexerAutomaton(LookupTable table, Map<String, Dfa> modes) {
        this.table = table;
        this.modes = Collections.unmodifiableMap(
            new LinkedHashMap<String, Dfa>(modes));
    }

    public String toString() {
        return getClass().getName() + "@" +
            Integer.toHexString(hashCode()) + "[modes=" + modes.keySet() +
            ",classes=" + table.getClassCount() + "]";
    }

    public LookupTable getTable() {
        return table;
    }

    /**
     * The mode names, default mode first, then in declaration order.
     */
    public Set<String> getModes() {
        return modes.keySet();
    }

    /**
     * The automaton of the given mode, or null if there is no such mode.
     */
    public Dfa getDfa(String mode) {
        return modes.get(mode);
    }

    public Dfa getDefaultDfa() {
        return modes.get(Rule.DEFAULT_MODE);
    }

    public boolean isEmpty() {
        return modes.isEmpty();
    }

    /**
     * Create a scanner that tokenizes input with this automaton.
     */
    public Scanner scanner(CharSequence input) {
        return new Scanner(this, input);
    }

    public JSONObject toJSON() {
        JSONObject dfas = new JSONObject();
        for (Map.Entry<String, Dfa> ent : modes.entrySet())
            dfas.put(ent.getKey(), ent.getValue().toJSON());
        return Util.createJSONObject("table", table.toJSON(), "modes",
                                     dfas);
    }

}
