package net.grammarc.grammar;

import static net.grammarc.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

public class GrammarsTest {

    @Test
    public void parsesRangesAndEscapes() {
        List<CharRange> ranges = Grammars.parseRanges("a-z_\\n\\u0041");
        assertEquals(Arrays.asList(new CharRange('a', 'z'), CharRange.of('_'),
                                   CharRange.of('\n'), CharRange.of('A')),
                     ranges);
    }

    @Test
    public void trailingDashIsLiteral() {
        assertEquals(Arrays.asList(CharRange.of('+'), CharRange.of('-')),
                     Grammars.parseRanges("+-"));
    }

    @Test
    public void danglingEscapeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> Grammars.parseRanges("a\\"));
    }

    @Test
    public void formatsRulesInGrammarNotation() {
        Rule r = parser("expr", alt(ref("term"),
            star(group(alt(lit("+"), ref("term"))))));
        assertEquals("expr : term ('+' term)* ;", r.toString());
        assertEquals("~[\\n]", notCls("\\n").toString());
        assertEquals("[a-z]+?", lazyPlus(cls("a-z")).toString());
    }

    @Test
    public void lexerRulesDefaultToDefaultMode() {
        assertEquals(Rule.DEFAULT_MODE, lexer("A", alt(lit("a"))).getMode());
        assertNull(parser("a", alt(ref("A"))).getMode());
        assertEquals("STR", lexer("A", alt(lit("a"))).inMode("STR")
                                                       .getMode());
    }

    @Test
    public void rejectsMalformedNodes() {
        assertThrows(IllegalArgumentException.class,
                     () -> new CharRange('z', 'a'));
        assertThrows(IllegalArgumentException.class, () -> lit(""));
        assertThrows(IllegalArgumentException.class,
                     () -> parser("1bad", alt()));
        assertThrows(NullPointerException.class, () -> ref(null));
        assertThrows(IllegalArgumentException.class,
                     () -> new LexerCommand(LexerCommand.Type.MODE, null));
    }

    @Test
    public void commandsAttachToAlternatives() {
        Alternative a = alt(cls(" \\t")).withCommands(LexerCommand.SKIP);
        assertEquals(Arrays.asList(LexerCommand.SKIP), a.getCommands());
        assertTrue(LexerCommand.pushMode("X").entersMode());
        assertFalse(LexerCommand.POP_MODE.entersMode());
        assertEquals("channel(HIDDEN)",
                     LexerCommand.channel("HIDDEN").toString());
    }

}
