package net.grammarc.analysis;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.util.Formats;
import net.grammarc.util.Util;
import org.json.JSONObject;

/**
 * Two alternatives of one rule whose First sets overlap.
 * This is a one-token heuristic: alternatives disambiguated by further
 * lookahead or by semantic predicates are still reported.
 */
public final class Ambiguity {

    private final String ruleName;
    private final int first;
    private final int second;
    private final Set<String> overlap;

    public Ambiguity(String ruleName, int first, int second,
                     Set<String> overlap) {
        if (ruleName == null)
            throw new NullPointerException("Rule name may not be null");
        if (first >= second)
            throw new IllegalArgumentException("Alternative indices " +
                "must be ascending");
        this.ruleName = ruleName;
        this.first = first;
        this.second = second;
        this.overlap = Collections.unmodifiableSet(
            new TreeSet<String>(overlap));
    }

    public String toString() {
        return ruleName + "[" + first + "," + second + "]" + overlap;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Ambiguity)) return false;
        Ambiguity ao = (Ambiguity) other;
        return (ruleName.equals(ao.ruleName) && first == ao.first &&
                second == ao.second && overlap.equals(ao.overlap));
    }

    public int hashCode() {
        return ruleName.hashCode() ^ (first * 31 + second);
    }

    public String getRuleName() {
        return ruleName;
    }

    public int getFirstAlternative() {
        return first;
    }

    public int getSecondAlternative() {
        return second;
    }

    /**
     * The terminals both alternatives can start with (sorted).
     */
    public Set<String> getOverlap() {
        return overlap;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(DiagnosticCode.AMBIGUOUS_ALTERNATIVES,
            "alternatives " + first + " and " + second + " of rule " +
            ruleName + " can both start with " +
            Formats.join(overlap, ", "), ruleName, first);
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("rule", ruleName, "alternatives",
            Util.toJSONArray(new int[] { first, second }), "overlap",
            Util.sortedJSONArray(overlap));
    }

}
