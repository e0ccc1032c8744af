package net.grammarc.grammar;

public enum GrammarType { LEXER, PARSER, COMBINED }
