package net.grammarc.analysis;

import static net.grammarc.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.grammar.Grammar;
import org.junit.jupiter.api.Test;

public class LeftRecursionDetectorTest {

    private static LeftRecursionReport detect(Grammar g) throws Exception {
        RuleGraph graph = new RuleGraphBuilder(g).call();
        return new LeftRecursionDetector(
            new FirstFollowComputer(graph).call()).call();
    }

    @Test
    public void reportsIndirectCycleWithPath() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("A", alt(ref("B"), lit("x"))),
            parser("B", alt(ref("A"), lit("y")), alt(lit("z")))));
        assertEquals(1, rep.getCycles().size());
        LeftRecursion lr = rep.getCycles().get(0);
        assertFalse(lr.isDirect());
        assertEquals(Arrays.asList("A", "B"), lr.getCycle());
        Diagnostic d = lr.toDiagnostic();
        assertEquals(DiagnosticCode.INDIRECT_LEFT_RECURSION, d.getCode());
        assertTrue(d.getMessage().contains("A -> B -> A"), d.getMessage());
    }

    @Test
    public void reportsOneCycleThroughFinishedRules() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("A", alt(ref("B"), lit("x")), alt(ref("C"), lit("w"))),
            parser("B", alt(ref("C"), lit("y"))),
            parser("C", alt(ref("A"), lit("z")), alt(lit("v")))));
        assertEquals(1, rep.getCycles().size());
        assertEquals(Arrays.asList("A", "B", "C"),
                     rep.getCycles().get(0).getCycle());
        assertEquals("A -> B -> C -> A", rep.getCycles().get(0).formatPath());
    }

    @Test
    public void reportsDirectRecursionAlone() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("A", alt(ref("A"), lit("x")), alt(lit("y")))));
        assertEquals(1, rep.getCycles().size());
        assertTrue(rep.getCycles().get(0).isDirect());
        assertEquals(Arrays.asList("A"), rep.getCycles().get(0).getCycle());
        assertEquals(DiagnosticCode.DIRECT_LEFT_RECURSION,
                     rep.getDiagnostics().get(0).getCode());
    }

    @Test
    public void acyclicGrammarReportsNothing() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("A", alt(lit("x"), ref("A")), alt(ref("B"))),
            parser("B", alt(lit("y"), ref("B")))));
        assertTrue(rep.isEmpty());
        assertTrue(rep.getDiagnostics().isEmpty());
    }

    @Test
    public void seesThroughNullablePrefixes() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("A", alt(opt(lit("x")), action("a"), ref("N"), ref("A"),
                            lit("y")), alt(lit("z"))),
            parser("N", alt(star(lit("n"))))));
        assertEquals(1, rep.getCycles().size());
        assertEquals("A", rep.getCycles().get(0).getRuleName());
        assertTrue(rep.getCycles().get(0).isDirect());
    }

    @Test
    public void looksIntoGroupsAndQuantifiers() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("A", alt(plus(group(alt(lit("q")), alt(ref("B")))))),
            parser("B", alt(ref("A"), lit("b")))));
        assertEquals(1, rep.getCycles().size());
        assertEquals(Arrays.asList("A", "B"),
                     rep.getCycles().get(0).getCycle());
    }

    @Test
    public void tokenReferencesAreNotEdges() throws Exception {
        LeftRecursionReport rep = detect(combined("G",
            parser("a", alt(ref("ID"), ref("a")), alt(ref("ID"))),
            lexer("ID", alt(plus(cls("a-z"))))));
        assertTrue(rep.isEmpty());
    }

    @Test
    public void reportsEachCycleOnce() throws Exception {
        // Two cycles sharing B, reached from several origins.
        LeftRecursionReport rep = detect(combined("G",
            parser("S", alt(ref("A"))),
            parser("A", alt(ref("B"), lit("a"))),
            parser("B", alt(ref("A")), alt(ref("C")), alt(lit("b"))),
            parser("C", alt(ref("B"), lit("c"))),
            parser("D", alt(ref("C"), lit("d")))));
        assertEquals(2, rep.getCycles().size());
        assertEquals(Arrays.asList("A", "B"),
                     rep.getCycles().get(0).getCycle());
        assertEquals(Arrays.asList("B", "C"),
                     rep.getCycles().get(1).getCycle());
        assertEquals(2, rep.getDiagnostics().size());
    }

}
