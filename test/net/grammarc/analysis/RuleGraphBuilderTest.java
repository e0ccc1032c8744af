package net.grammarc.analysis;

import static net.grammarc.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.grammar.Grammar;
import net.grammarc.grammar.GrammarType;
import net.grammarc.grammar.InvalidGrammarException;
import net.grammarc.grammar.LexerCommand;
import org.junit.jupiter.api.Test;

public class RuleGraphBuilderTest {

    private static List<Diagnostic> errorsOf(Grammar g) {
        InvalidGrammarException exc = assertThrows(
            InvalidGrammarException.class,
            () -> new RuleGraphBuilder(g).call());
        for (Diagnostic d : exc.getDiagnostics()) assertTrue(d.isError());
        return exc.getDiagnostics();
    }

    @Test
    public void indexesReferencesWithoutDuplicates() throws Exception {
        Grammar g = combined("T",
            parser("expr", alt(ref("term"), star(group(alt(lit("+"),
                                                  ref("term"))))),
                           alt(ref("expr"), ref("NUM"))),
            parser("term", alt(ref("NUM"))),
            lexer("NUM", alt(plus(ref("DIGIT")))),
            fragment("DIGIT", alt(cls("0-9"))));
        RuleGraph graph = new RuleGraphBuilder(g).call();
        assertEquals(4, graph.size());
        assertEquals(new LinkedHashSet<String>(Arrays.asList("term", "expr",
                                                             "NUM")),
                     graph.getReferences("expr"));
        assertEquals(3, graph.getSuccessors(0).length);
        graph.getSuccessors(0)[0] = 3;
        assertEquals(1, graph.getSuccessors(0)[0]);
        assertEquals(1, graph.indexOf("term"));
        assertEquals(-1, graph.indexOf("nope"));
        assertEquals("expr", graph.getEntryRule());
        assertTrue(graph.getDiagnostics().isEmpty());
    }

    @Test
    public void undefinedReferenceIsFatal() {
        List<Diagnostic> errs = errorsOf(combined("T",
            parser("a", alt(ref("b"), ref("c"), ref("b")))));
        assertEquals(2, errs.size());
        assertEquals(DiagnosticCode.UNDEFINED_RULE, errs.get(0).getCode());
        assertEquals("a", errs.get(0).getRuleName());
        assertTrue(errs.get(0).getMessage().contains("b"));
        assertTrue(errs.get(1).getMessage().contains("c"));
    }

    @Test
    public void duplicateRuleIsFatal() {
        List<Diagnostic> errs = errorsOf(combined("T",
            parser("a", alt(lit("x"))), parser("a", alt(lit("y")))));
        assertEquals(1, errs.size());
        assertEquals(DiagnosticCode.DUPLICATE_RULE, errs.get(0).getCode());
        assertEquals("E002", errs.get(0).getCode().getId());
    }

    @Test
    public void emptyOrUnnamedGrammarIsFatal() {
        assertEquals(DiagnosticCode.INVALID_GRAMMAR,
                     errorsOf(combined("T")).get(0).getCode());
        assertEquals(DiagnosticCode.INVALID_GRAMMAR,
                     errorsOf(combined("", parser("a", alt(lit("x")))))
                         .get(0).getCode());
    }

    @Test
    public void invalidLexerRulesAreFatal() {
        List<Diagnostic> errs = errorsOf(combined("T",
            parser("a", alt(ref("A"))),
            lexer("A", alt(ref("a"))),
            lexer("B", alt(lit("b"), ref("C"))),
            fragment("C", alt(lit("c"), ref("B"))),
            lexer("D", alt(lit("d"), eof()))));
        assertEquals(3, errs.size());
        assertTrue(errs.get(0).getMessage().contains("parser rule a"));
        assertTrue(errs.get(1).getMessage().contains("EOF"));
        assertTrue(errs.get(2).getMessage().contains("B -> C -> B"),
                   errs.get(2).getMessage());
    }

    @Test
    public void unknownModeIsFatal() {
        List<Diagnostic> errs = errorsOf(grammar("L", GrammarType.LEXER,
            lexer("Q", alt(lit("\"")).withCommands(
                LexerCommand.pushMode("STRING")))));
        assertTrue(errs.get(0).getMessage().contains("STRING"));
    }

    @Test
    public void designatedEntryRuleMustExist() throws Exception {
        Grammar g = combined("T", parser("a", alt(lit("x"))),
                             parser("b", alt(ref("a"))));
        g.setStartRule("b");
        assertEquals("b", new RuleGraphBuilder(g).call().getEntryRule());
        assertEquals("a", new RuleGraphBuilder(g, "a").call()
                              .getEntryRule());
        g.setStartRule("c");
        assertEquals(DiagnosticCode.INVALID_GRAMMAR,
                     errorsOf(g).get(0).getCode());
    }

    @Test
    public void lexerGrammarHasNoEntryRule() throws Exception {
        Grammar g = grammar("L", GrammarType.LEXER,
                            lexer("A", alt(lit("a"))));
        assertNull(new RuleGraphBuilder(g).call().getEntryRule());
    }

    @Test
    public void emptyAlternativesAreWarnings() throws Exception {
        RuleGraph graph = new RuleGraphBuilder(combined("T",
            parser("a", alt(lit("x")), alt()),
            parser("b", alt()))).call();
        List<Diagnostic> warns = graph.getDiagnostics();
        assertEquals(2, warns.size());
        assertEquals(DiagnosticCode.EMPTY_ALTERNATIVE, warns.get(0).getCode());
        assertEquals(1, warns.get(0).getAlternative());
        assertEquals("b", warns.get(1).getRuleName());
        assertFalse(warns.get(0).isError());
    }

}
