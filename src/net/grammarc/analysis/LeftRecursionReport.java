package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.api.Diagnostic;
import org.json.JSONArray;

/* The left-recursive cycles of a grammar, in discovery order. */
public final class LeftRecursionReport {

    private final List<LeftRecursion> cycles;

    public LeftRecursionReport(List<LeftRecursion> cycles) {
        this.cycles = Collections.unmodifiableList(
            new ArrayList<LeftRecursion>(cycles));
    }

    public List<LeftRecursion> getCycles() {
        return cycles;
    }

    public boolean isEmpty() {
        return cycles.isEmpty();
    }

    /* The first cycle reported at the given rule, or null. */
    public LeftRecursion getCycle(String ruleName) {
        for (LeftRecursion lr : cycles) {
            if (lr.getRuleName().equals(ruleName)) return lr;
        }
        return null;
    }

    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> ret = new ArrayList<Diagnostic>();
        for (LeftRecursion lr : cycles) ret.add(lr.toDiagnostic());
        return ret;
    }

    public JSONArray toJSON() {
        JSONArray ret = new JSONArray();
        for (LeftRecursion lr : cycles) ret.put(lr.toJSON());
        return ret;
    }

}
