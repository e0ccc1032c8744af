package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import net.grammarc.api.NamedValue;
import net.grammarc.util.Formats;

public final class Rule implements NamedValue {

    public static final Pattern NAME_PATTERN = Pattern.compile(
        "[a-zA-Z_][A-Za-z0-9_]*");

    public static final String DEFAULT_MODE = "DEFAULT_MODE";

    private final String name;
    private final RuleKind kind;
    private final List<Alternative> alternatives;
    private final String mode;
    private final List<RuleParameter> arguments;
    private final List<RuleParameter> returns;
    private final List<RuleParameter> locals;

    public Rule(String name, RuleKind kind, List<Alternative> alternatives,
                String mode, List<RuleParameter> arguments,
                List<RuleParameter> returns, List<RuleParameter> locals) {
        if (name == null)
            throw new NullPointerException("Rule name may not be null");
        if (kind == null)
            throw new NullPointerException("Rule kind may not be null");
        if (alternatives == null)
            throw new NullPointerException(
                "Rule alternatives may not be null");
        if (! NAME_PATTERN.matcher(name).matches())
            throw new IllegalArgumentException("Invalid rule name " +
                Formats.formatString(name));
        this.name = name;
        this.kind = kind;
        this.alternatives = Collections.unmodifiableList(
            new ArrayList<Alternative>(alternatives));
        this.mode = (! kind.isLexical()) ? null :
            (mode == null) ? DEFAULT_MODE : mode;
        this.arguments = copy(arguments);
        this.returns = copy(returns);
        this.locals = copy(locals);
    }
    public Rule(String name, RuleKind kind, List<Alternative> alternatives) {
        this(name, kind, alternatives, null, null, null, null);
    }
    public Rule(String name, RuleKind kind, Alternative... alternatives) {
        this(name, kind, Arrays.asList(alternatives));
    }

    private static List<RuleParameter> copy(List<RuleParameter> params) {
        if (params == null) return Collections.emptyList();
        return Collections.unmodifiableList(
            new ArrayList<RuleParameter>(params));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (kind == RuleKind.FRAGMENT) sb.append("fragment ");
        sb.append(name).append(" : ");
        sb.append(Formats.join(alternatives, " | "));
        return sb.append(" ;").toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Rule)) return false;
        Rule ro = (Rule) other;
        return (name.equals(ro.name) && kind == ro.kind &&
                alternatives.equals(ro.alternatives) &&
                ((mode == null) ? ro.mode == null : mode.equals(ro.mode)));
    }

    public int hashCode() {
        return name.hashCode() ^ alternatives.hashCode();
    }

    public String getName() {
        return name;
    }

    public RuleKind getKind() {
        return kind;
    }

    public boolean isParserRule() {
        return kind == RuleKind.PARSER;
    }

    public boolean isLexerRule() {
        return kind == RuleKind.LEXER;
    }

    public boolean isFragment() {
        return kind == RuleKind.FRAGMENT;
    }

    public List<Alternative> getAlternatives() {
        return alternatives;
    }

    /* The lexer mode of a lexer or fragment rule; null for parser rules. */
    public String getMode() {
        return mode;
    }

    public List<RuleParameter> getArguments() {
        return arguments;
    }

    public List<RuleParameter> getReturns() {
        return returns;
    }

    public List<RuleParameter> getLocals() {
        return locals;
    }

    public Rule inMode(String newMode) {
        return new Rule(name, kind, alternatives, newMode, arguments,
                        returns, locals);
    }

    public Rule withParameters(List<RuleParameter> newArguments,
                               List<RuleParameter> newReturns,
                               List<RuleParameter> newLocals) {
        return new Rule(name, kind, alternatives, mode, newArguments,
                        newReturns, newLocals);
    }

}
