package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.util.Formats;
import net.grammarc.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A cycle of rules that can start with themselves without consuming input.
 * The cycle is listed starting from the rule the search entered it at; the
 * rule is not repeated at the end.
 */
public final class LeftRecursion {

    private final List<String> cycle;

    public LeftRecursion(List<String> cycle) {
        if (cycle == null)
            throw new NullPointerException("Cycle may not be null");
        if (cycle.isEmpty())
            throw new IllegalArgumentException("Cycle may not be empty");
        this.cycle = Collections.unmodifiableList(
            new ArrayList<String>(cycle));
    }

    public String toString() {
        return formatPath();
    }

    public boolean equals(Object other) {
        return ((other instanceof LeftRecursion) &&
                cycle.equals(((LeftRecursion) other).cycle));
    }

    public int hashCode() {
        return cycle.hashCode();
    }

    public List<String> getCycle() {
        return cycle;
    }

    /**
     * The rule the cycle was reported at.
     */
    public String getRuleName() {
        return cycle.get(0);
    }

    /**
     * Whether a rule starts with (a nullable prefix and) itself.
     */
    public boolean isDirect() {
        return cycle.size() == 1;
    }

    public boolean contains(String ruleName) {
        return cycle.contains(ruleName);
    }

    /**
     * The cycle as a path returning to its start, e.g. "A -> B -> A".
     */
    public String formatPath() {
        List<String> path = new ArrayList<String>(cycle);
        path.add(cycle.get(0));
        return Formats.join(path, " -> ");
    }

    public Diagnostic toDiagnostic() {
        if (isDirect())
            return new Diagnostic(DiagnosticCode.DIRECT_LEFT_RECURSION,
                "rule " + getRuleName() + " is directly left-recursive",
                getRuleName());
        return new Diagnostic(DiagnosticCode.INDIRECT_LEFT_RECURSION,
            "rule " + getRuleName() + " is indirectly left-recursive (" +
            formatPath() + ")", getRuleName());
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("cycle", new JSONArray(cycle),
                                     "direct", isDirect());
    }

}
