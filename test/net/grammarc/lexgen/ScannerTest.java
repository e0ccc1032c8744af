package net.grammarc.lexgen;

import static net.grammarc.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import net.grammarc.analysis.RuleGraphBuilder;
import net.grammarc.grammar.Grammar;
import net.grammarc.grammar.GrammarType;
import net.grammarc.grammar.LexerCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ScannerTest {

    private LexerAutomaton automaton;

    @BeforeEach
    public void setUp() throws Exception {
        Grammar g = grammar("S", GrammarType.LEXER,
            lexer("KW_IF", alt(lit("if")).withCommands(
                LexerCommand.type("IF"))),
            lexer("ID", alt(plus(cls("a-z")))),
            lexer("NUM", alt(plus(cls("0-9")))),
            lexer("WS", alt(plus(cls(" \\t\\n"))).withCommands(
                LexerCommand.SKIP)),
            lexer("LC", alt(lit("//"), star(notCls("\\n"))).withCommands(
                LexerCommand.channel("HIDDEN"))),
            lexer("QUOTE", alt(lit("\"")).withCommands(
                LexerCommand.pushMode("STR"), LexerCommand.MORE)),
            lexer("RPAREN", alt(lit(")")).withCommands(
                LexerCommand.POP_MODE)),
            lexer("STR_TEXT", alt(plus(notCls("\""))).withCommands(
                LexerCommand.MORE)).inMode("STR"),
            lexer("STR_END", alt(lit("\"")).withCommands(
                LexerCommand.POP_MODE, LexerCommand.type("STRING")))
                .inMode("STR"));
        automaton = new LexerSynthesizer(new RuleGraphBuilder(g).call())
            .call();
    }

    @Test
    public void appliesLexerCommands() throws Exception {
        List<Token> toks = automaton.scanner("if x1 \"ab c\" // hi\n")
            .tokenize();
        assertEquals(6, toks.size());
        assertEquals("IF", toks.get(0).getType());
        assertEquals("ID", toks.get(1).getType());
        assertEquals("x", toks.get(1).getText());
        assertEquals("NUM", toks.get(2).getType());
        assertEquals(4, toks.get(2).getOffset());
        Token str = toks.get(3);
        assertEquals("STRING", str.getType());
        assertEquals("\"ab c\"", str.getText());
        assertEquals(6, str.getOffset());
        Token comment = toks.get(4);
        assertEquals("LC", comment.getType());
        assertEquals("// hi", comment.getText());
        assertEquals(Token.HIDDEN_CHANNEL, comment.getChannel());
        assertEquals(Token.DEFAULT_CHANNEL, str.getChannel());
        assertTrue(toks.get(5).isEOF());
        assertEquals(19, toks.get(5).getOffset());
    }

    @Test
    public void backtracksToLastAcceptingPrefix() throws Exception {
        Grammar g = grammar("B", GrammarType.LEXER,
            lexer("A", alt(lit("ab"))),
            lexer("B", alt(lit("abcd"))),
            lexer("C", alt(lit("c"))));
        LexerAutomaton la = new LexerSynthesizer(
            new RuleGraphBuilder(g).call()).call();
        List<Token> toks = la.scanner("abcab").tokenize();
        assertEquals(Arrays.asList(
            new Token("A", "ab", 0, null, null),
            new Token("C", "c", 2, null, null),
            new Token("A", "ab", 3, null, null),
            new Token(Token.EOF_TYPE, "", 5, null, null)), toks);
    }

    @Test
    public void tracksModeStack() throws Exception {
        Scanner sc = automaton.scanner("\"q\" x");
        assertEquals("DEFAULT_MODE", sc.getMode());
        assertEquals("STRING", sc.next().getType());
        assertEquals("DEFAULT_MODE", sc.getMode());
        assertEquals("ID", sc.next().getType());
        assertTrue(sc.next().isEOF());
        assertTrue(sc.isAtEnd());
        assertTrue(sc.next().isEOF());
    }

    @Test
    public void unmatchableInputReportsOffset() {
        ScanException exc = assertThrows(ScanException.class,
            () -> automaton.scanner("ab ?").tokenize());
        assertEquals(3, exc.getOffset());
    }

    @Test
    public void popModeOnEmptyStackFails() {
        assertThrows(ScanException.class,
                     () -> automaton.scanner(")").tokenize());
    }

    @Test
    public void emptyInputYieldsOnlyEOF() throws Exception {
        List<Token> toks = automaton.scanner("").tokenize();
        assertEquals(1, toks.size());
        assertTrue(toks.get(0).isEOF());
    }

}
