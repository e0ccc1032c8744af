package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.util.Util;
import org.json.JSONObject;

/* The outcome of a reachability traversal. Both lists are in rule
 * declaration order. */
public final class ReachabilityReport {

    private final List<String> reachable;
    private final List<String> unreachable;

    public ReachabilityReport(List<String> reachable,
                              List<String> unreachable) {
        this.reachable = Collections.unmodifiableList(
            new ArrayList<String>(reachable));
        this.unreachable = Collections.unmodifiableList(
            new ArrayList<String>(unreachable));
    }

    public List<String> getReachable() {
        return reachable;
    }

    public List<String> getUnreachable() {
        return unreachable;
    }

    public boolean isReachable(String ruleName) {
        return reachable.contains(ruleName);
    }

    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> ret = new ArrayList<Diagnostic>();
        for (String name : unreachable)
            ret.add(new Diagnostic(DiagnosticCode.UNREACHABLE_RULE,
                "rule " + name + " is never used", name));
        return ret;
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("reachable",
            Util.sortedJSONArray(reachable), "unreachable",
            Util.sortedJSONArray(unreachable));
    }

}
