package net.grammarc.api;

import net.grammarc.util.Util;
import org.json.JSONObject;

/**
 * An (immutable) report of a condition detected in a grammar.
 * Errors are fatal and stop the analysis before any derived structure is
 * built; warnings are collected alongside the results.
 */
public final class Diagnostic {

    public enum Severity { ERROR, WARNING }

    private final DiagnosticCode code;
    private final String message;
    private final String ruleName;
    private final int alternative;

    /**
     * Create a new diagnostic.
     * ruleName may be null if the condition is not tied to a rule;
     * alternative is a zero-based alternative index, or -1 if not
     * applicable.
     */
    public Diagnostic(DiagnosticCode code, String message, String ruleName,
                      int alternative) {
        if (code == null)
            throw new NullPointerException(
                "Diagnostic code may not be null");
        if (message == null)
            throw new NullPointerException(
                "Diagnostic message may not be null");
        this.code = code;
        this.message = message;
        this.ruleName = ruleName;
        this.alternative = alternative;
    }
    public Diagnostic(DiagnosticCode code, String message, String ruleName) {
        this(code, message, ruleName, -1);
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getSeverity().name().toLowerCase()).append('[')
          .append(code.getId()).append("]: ").append(message);
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Diagnostic)) return false;
        Diagnostic od = (Diagnostic) other;
        return (code == od.code && message.equals(od.message) &&
                alternative == od.alternative &&
                ((ruleName == null) ? od.ruleName == null :
                    ruleName.equals(od.ruleName)));
    }

    public int hashCode() {
        return code.hashCode() ^ message.hashCode() ^ alternative;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public Severity getSeverity() {
        return code.getSeverity();
    }

    public boolean isError() {
        return getSeverity() == Severity.ERROR;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The rule the condition was found in, or null.
     */
    public String getRuleName() {
        return ruleName;
    }

    /**
     * The zero-based alternative index the condition was found at, or -1.
     */
    public int getAlternative() {
        return alternative;
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("severity",
            getSeverity().name().toLowerCase(), "code", code.getId(),
            "title", code.getTitle(), "message", message, "rule", ruleName,
            "alternative", (alternative < 0) ? null : alternative);
    }

}
