package net.grammarc.analysis;

import static net.grammarc.grammar.Grammars.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Grammar;
import net.grammarc.grammar.Rule;
import net.grammarc.grammar.RuleKind;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

public class FirstFollowComputerTest {

    private static final String EPS = FirstFollowSets.EPSILON;
    private static final String END = FirstFollowSets.END_OF_INPUT;

    private static FirstFollowSets compute(Grammar g) throws Exception {
        return new FirstFollowComputer(new RuleGraphBuilder(g).call()).call();
    }

    private static Set<String> set(String... items) {
        return new HashSet<String>(Arrays.asList(items));
    }

    @Test
    public void computesFirstSetsOfExpressionGrammar() throws Exception {
        FirstFollowSets sets = compute(combined("Expr",
            parser("expr", alt(ref("term"), star(group(alt(lit("+"),
                                                           ref("term")))))),
            parser("term", alt(ref("factor"), star(group(alt(lit("*"),
                                                             ref("factor")))))),
            parser("factor", alt(lit("("), ref("expr"), lit(")")),
                             alt(ref("NUM"))),
            lexer("NUM", alt(plus(cls("0-9"))))));
        assertEquals(set("'('", "NUM"), sets.getFirst("expr"));
        assertEquals(set("'('", "NUM"), sets.getFirst("factor"));
        assertEquals(set("[0-9]"), sets.getFirst("NUM"));
        assertEquals(set(END, "')'"), sets.getFollow("expr"));
        assertEquals(set(END, "'+'", "')'"), sets.getFollow("term"));
        assertEquals(set(END, "'+'", "'*'", "')'"), sets.getFollow("factor"));
        assertTrue(sets.getNullable().isEmpty());
    }

    @Test
    public void nullablePropagatesThroughGroupsAndQuantifiers()
            throws Exception {
        FirstFollowSets sets = compute(combined("N",
            parser("s", alt(ref("a"), ref("b"), lit("z"))),
            parser("a", alt(opt(lit("x")))),
            parser("b", alt(star(ref("c")), action("log()")),
                        alt(group(alt(ref("a")), alt(lit("q"))))),
            parser("c", alt(lit("y"))),
            parser("d", alt(plus(ref("a"))), alt(pred("p()"), lit("w")))));
        assertEquals(Arrays.asList("a", "b", "d"), sets.getNullable());
        assertEquals(set("'x'", EPS), sets.getFirst("a"));
        assertEquals(set("'y'", "'x'", "'q'", EPS), sets.getFirst("b"));
        assertEquals(set("'x'", "'y'", "'q'", "'z'"), sets.getFirst("s"));
        assertEquals(set("'x'", "'w'", EPS), sets.getFirst("d"));
        assertFalse(sets.isNullable("s"));
    }

    @Test
    public void followSeesThroughNullableRemainder() throws Exception {
        FirstFollowSets sets = compute(combined("F",
            parser("s", alt(ref("a"), ref("b"), ref("c"), lit(";"))),
            parser("a", alt(lit("a"))),
            parser("b", alt(opt(lit("b")))),
            parser("c", alt(star(lit("c")))),
            parser("t", alt(ref("s"), ref("a")))));
        assertEquals(set("'b'", "'c'", "';'"), sets.getFollow("a"));
        assertEquals(set("'c'", "';'"), sets.getFollow("b"));
        assertEquals(set(END, "'a'"), sets.getFollow("s"));
        assertTrue(sets.getFollow("t").isEmpty());
    }

    @Test
    public void followOfTrailingReferenceIncludesContainerFollow()
            throws Exception {
        FirstFollowSets sets = compute(combined("F",
            parser("s", alt(ref("x"), lit("!"))),
            parser("x", alt(lit("x"), ref("y"))),
            parser("y", alt(lit("y"), opt(ref("z")))),
            parser("z", alt(plus(group(alt(lit("z"), ref("w")))))),
            parser("w", alt(lit("w")))));
        assertEquals(set("'!'"), sets.getFollow("y"));
        assertEquals(set("'!'"), sets.getFollow("z"));
        assertEquals(set("'!'", "'z'", "'w'"), sets.getFollow("w"));
    }

    @Test
    public void explicitStartRuleIsSeeded() throws Exception {
        Grammar g = combined("S", parser("a", alt(ref("b"))),
                             parser("b", alt(lit("b"))));
        g.setStartRule("b");
        FirstFollowSets sets = compute(g);
        assertEquals(set(END), sets.getFollow("b"));
        assertTrue(sets.getFollow("a").isEmpty());
    }

    @Test
    public void leftRecursionDoesNotPreventConvergence() throws Exception {
        FirstFollowSets sets = compute(combined("L",
            parser("e", alt(ref("e"), lit("+"), ref("t")), alt(ref("t"))),
            parser("t", alt(lit("n")))));
        assertEquals(set("'n'"), sets.getFirst("e"));
        assertEquals(set(END, "'+'"), sets.getFollow("e"));
        assertEquals(set(END, "'+'"), sets.getFollow("t"));
    }

    @Test
    public void convergesMonotonicallyWithinRuleCount() throws Exception {
        // r0 -> r1 -> ... -> r(n-1) -> r0, each with its own terminal, plus
        // nullable links so that every set ends up holding every terminal.
        int n = 12;
        List<Rule> rules = new ArrayList<Rule>();
        for (int i = 0; i < n; i++) {
            String next = "r" + ((i + 1) % n);
            List<Alternative> alts = new ArrayList<Alternative>();
            alts.add(alt(opt(ref(next)), lit("t" + i)));
            alts.add(alt(opt(lit("u" + i)), ref("r" + ((i + 5) % n))));
            rules.add(new Rule("r" + i, RuleKind.PARSER, alts));
        }
        Grammar g = combined("Deep");
        for (int i = n - 1; i >= 0; i--) g.addRule(rules.get(i));
        FirstFollowSets sets = compute(g);
        assertTrue(sets.getFirstPasses() <= n + 1,
                   "took " + sets.getFirstPasses() + " passes");
        assertTrue(sets.getFollowPasses() <= n + 1,
                   "took " + sets.getFollowPasses() + " passes");
        assertNonDecreasing(sets.getFirstSizeHistory());
        assertNonDecreasing(sets.getFollowSizeHistory());
        for (int i = 0; i < n; i++) {
            assertTrue(sets.getFirst("r0").contains("'t" + i + "'"));
            assertTrue(sets.getFirst("r0").contains("'u" + i + "'"));
        }
    }

    private static void assertNonDecreasing(List<Integer> sizes) {
        for (int i = 1; i < sizes.size(); i++)
            assertTrue(sizes.get(i) >= sizes.get(i - 1), sizes.toString());
    }

    @Test
    public void exportsSortedJSON() throws Exception {
        FirstFollowSets sets = compute(combined("J",
            parser("s", alt(opt(lit("b")), lit("a")))));
        JSONObject json = sets.toJSON();
        assertEquals("'a'", json.getJSONObject("first").getJSONArray("s")
                                .getString(0));
        assertEquals("'b'", json.getJSONObject("first").getJSONArray("s")
                                .getString(1));
        assertEquals(0, json.getJSONArray("nullable").length());
    }

}
