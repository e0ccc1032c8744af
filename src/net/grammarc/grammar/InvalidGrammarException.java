package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.api.Diagnostic;
import net.grammarc.util.Formats;

public class InvalidGrammarException extends GrammarException {

    private final List<Diagnostic> diagnostics;

    public InvalidGrammarException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics));
        this.diagnostics = Collections.unmodifiableList(
            new ArrayList<Diagnostic>(diagnostics));
    }
    public InvalidGrammarException(Diagnostic diagnostic) {
        this(Collections.singletonList(diagnostic));
    }

    /* The fatal diagnostics that caused this exception. */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty())
            throw new IllegalArgumentException(
                "InvalidGrammarException needs at least one diagnostic");
        List<String> messages = new ArrayList<String>();
        for (Diagnostic d : diagnostics) messages.add(d.getMessage());
        return Formats.join(messages, "; ");
    }

}
