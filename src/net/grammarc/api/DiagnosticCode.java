package net.grammarc.api;

/**
 * Stable identifiers of the conditions the analysis reports.
 * Emitters and tools may match on these; the numbering never changes.
 */
public enum DiagnosticCode {

    UNDEFINED_RULE("E001", "undefined rule", Diagnostic.Severity.ERROR),
    DUPLICATE_RULE("E002", "duplicate rule", Diagnostic.Severity.ERROR),
    INVALID_GRAMMAR("E003", "invalid grammar", Diagnostic.Severity.ERROR),
    EMPTY_ALTERNATIVE("W001", "empty alternative",
                      Diagnostic.Severity.WARNING),
    DIRECT_LEFT_RECURSION("W002", "direct left recursion",
                          Diagnostic.Severity.WARNING),
    INDIRECT_LEFT_RECURSION("W003", "indirect left recursion",
                            Diagnostic.Severity.WARNING),
    AMBIGUOUS_ALTERNATIVES("W004", "ambiguous alternatives",
                           Diagnostic.Severity.WARNING),
    UNREACHABLE_RULE("W005", "unreachable rule",
                     Diagnostic.Severity.WARNING);

    private final String id;
    private final String title;
    private final Diagnostic.Severity severity;

    DiagnosticCode(String id, String title, Diagnostic.Severity severity) {
        this.id = id;
        this.title = title;
        this.severity = severity;
    }

    /**
     * The short identifier, e.g. "E001".
     */
    public String getId() {
        return id;
    }

    /**
     * A human-readable name of the condition, e.g. "undefined rule".
     */
    public String getTitle() {
        return title;
    }

    /**
     * The severity every diagnostic with this code has.
     */
    public Diagnostic.Severity getSeverity() {
        return severity;
    }

}
