package net.grammarc.grammar;

public enum RuleKind {

    PARSER, LEXER, FRAGMENT;

    /* Lexer and fragment rules both describe character sequences. */
    public boolean isLexical() {
        return this != PARSER;
    }

}
