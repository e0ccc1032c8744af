package net.grammarc.analysis;

import static net.grammarc.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.grammar.Grammar;
import net.grammarc.grammar.GrammarType;
import net.grammarc.grammar.LexerCommand;
import org.junit.jupiter.api.Test;

public class ReachabilityAnalyzerTest {

    private static ReachabilityReport analyze(Grammar g) throws Exception {
        return new ReachabilityAnalyzer(new RuleGraphBuilder(g).call())
            .call();
    }

    @Test
    public void reportsRuleNotReachableFromEntry() throws Exception {
        Grammar g = combined("G",
            parser("start", alt(ref("foo"))),
            parser("foo", alt(lit("a"))),
            parser("bar", alt(lit("b"))));
        g.setStartRule("start");
        ReachabilityReport rep = analyze(g);
        assertEquals(Arrays.asList("bar"), rep.getUnreachable());
        assertTrue(rep.isReachable("start"));
        assertTrue(rep.isReachable("foo"));
        assertEquals(DiagnosticCode.UNREACHABLE_RULE,
                     rep.getDiagnostics().get(0).getCode());
        assertEquals("bar", rep.getDiagnostics().get(0).getRuleName());
    }

    @Test
    public void followsTokenAndFragmentReferences() throws Exception {
        ReachabilityReport rep = analyze(combined("G",
            parser("s", alt(ref("NUM"))),
            lexer("NUM", alt(plus(ref("DIGIT")))),
            fragment("DIGIT", alt(cls("0-9"))),
            fragment("HEX", alt(cls("0-9a-f"))),
            lexer("WORD", alt(plus(cls("a-z"))))));
        assertEquals(Arrays.asList("HEX", "WORD"), rep.getUnreachable());
    }

    @Test
    public void tokensWithCommandsAreLiveInCombinedGrammars()
            throws Exception {
        ReachabilityReport rep = analyze(combined("G",
            parser("s", alt(ref("ID"))),
            lexer("ID", alt(plus(cls("a-z")))),
            lexer("WS", alt(plus(cls(" \\t"))).withCommands(
                LexerCommand.SKIP))));
        assertEquals(Collections.emptyList(), rep.getUnreachable());
    }

    @Test
    public void lexerGrammarRootsAreDefaultModeTokens() throws Exception {
        ReachabilityReport rep = analyze(grammar("L", GrammarType.LEXER,
            lexer("A", alt(ref("F"))),
            fragment("F", alt(lit("f"))),
            fragment("G", alt(lit("g"))),
            lexer("OPEN", alt(lit("\"")).withCommands(
                LexerCommand.pushMode("STR"))),
            lexer("TEXT", alt(plus(notCls("\"")))).inMode("STR"),
            lexer("CLOSE", alt(lit("\"")).withCommands(
                LexerCommand.POP_MODE)).inMode("STR"),
            lexer("ORPHAN", alt(lit("o"))).inMode("ISLAND")));
        assertEquals(Arrays.asList("G", "ORPHAN"), rep.getUnreachable());
        assertTrue(rep.isReachable("TEXT"));
        assertTrue(rep.isReachable("CLOSE"));
    }

    @Test
    public void exportsReachability() throws Exception {
        ReachabilityReport rep = analyze(combined("G",
            parser("s", alt(lit("x"))), parser("t", alt(lit("y")))));
        assertEquals("t", rep.toJSON().getJSONArray("unreachable")
                             .getString(0));
        assertEquals("s", rep.toJSON().getJSONArray("reachable")
                             .getString(0));
    }

}
