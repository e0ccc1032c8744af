package net.grammarc.lexgen;

import net.grammarc.grammar.GrammarException;

public class LexerSynthesisException extends GrammarException {

    public LexerSynthesisException() {
        super();
    }
    public LexerSynthesisException(String message) {
        super(message);
    }
    public LexerSynthesisException(Throwable cause) {
        super(cause);
    }
    public LexerSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }

}
