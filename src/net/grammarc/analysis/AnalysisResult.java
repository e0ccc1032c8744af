package net.grammarc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.api.Diagnostic;
import net.grammarc.lexgen.LexerAutomaton;
import net.grammarc.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Everything one analysis run produces.
 * The diagnostics are the concatenation of those of the individual passes,
 * in pass order: grammar structure, left recursion, ambiguity,
 * reachability. Since any error aborts the run, they are all warnings.
 */
public final class AnalysisResult {

    private final RuleGraph graph;
    private final FirstFollowSets sets;
    private final LeftRecursionReport leftRecursion;
    private final AmbiguityReport ambiguities;
    private final ReachabilityReport reachability;
    private final LexerAutomaton lexer;
    private final List<Diagnostic> diagnostics;

    public AnalysisResult(RuleGraph graph, FirstFollowSets sets,
                          LeftRecursionReport leftRecursion,
                          AmbiguityReport ambiguities,
                          ReachabilityReport reachability,
                          LexerAutomaton lexer) {
        this.graph = graph;
        this.sets = sets;
        this.leftRecursion = leftRecursion;
        this.ambiguities = ambiguities;
        this.reachability = reachability;
        this.lexer = lexer;
        List<Diagnostic> diags = new ArrayList<Diagnostic>();
        diags.addAll(graph.getDiagnostics());
        diags.addAll(leftRecursion.getDiagnostics());
        diags.addAll(ambiguities.getDiagnostics());
        diags.addAll(reachability.getDiagnostics());
        this.diagnostics = Collections.unmodifiableList(diags);
    }

    public RuleGraph getGraph() {
        return graph;
    }

    public FirstFollowSets getSets() {
        return sets;
    }

    public LeftRecursionReport getLeftRecursion() {
        return leftRecursion;
    }

    public AmbiguityReport getAmbiguities() {
        return ambiguities;
    }

    public ReachabilityReport getReachability() {
        return reachability;
    }

    public LexerAutomaton getLexer() {
        return lexer;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public JSONObject toJSON() {
        JSONArray diags = new JSONArray();
        for (Diagnostic d : diagnostics) diags.put(d.toJSON());
        return Util.createJSONObject("grammar",
            graph.getGrammar().getName(), "entryRule",
            graph.getEntryRule(), "diagnostics", diags, "sets",
            sets.toJSON(), "leftRecursion", leftRecursion.toJSON(),
            "ambiguities", ambiguities.toJSON(), "reachability",
            reachability.toJSON(), "lexer", lexer.toJSON());
    }

}
