package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.api.Diagnostic;
import org.json.JSONArray;

/* The overlapping alternative pairs of a grammar, by rule declaration order
 * and then by alternative indices. */
public final class AmbiguityReport {

    private final List<Ambiguity> ambiguities;

    public AmbiguityReport(List<Ambiguity> ambiguities) {
        this.ambiguities = Collections.unmodifiableList(
            new ArrayList<Ambiguity>(ambiguities));
    }

    public List<Ambiguity> getAmbiguities() {
        return ambiguities;
    }

    public boolean isEmpty() {
        return ambiguities.isEmpty();
    }

    public List<Ambiguity> getAmbiguities(String ruleName) {
        List<Ambiguity> ret = new ArrayList<Ambiguity>();
        for (Ambiguity a : ambiguities) {
            if (a.getRuleName().equals(ruleName)) ret.add(a);
        }
        return ret;
    }

    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> ret = new ArrayList<Diagnostic>();
        for (Ambiguity a : ambiguities) ret.add(a.toDiagnostic());
        return ret;
    }

    public JSONArray toJSON() {
        JSONArray ret = new JSONArray();
        for (Ambiguity a : ambiguities) ret.put(a.toJSON());
        return ret;
    }

}
