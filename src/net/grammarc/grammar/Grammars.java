package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Construction helpers for grammar ASTs.
 * A grammar reader (or a test) can build the AST of
 *     expr : term ('+' term)* ;
 * as
 *     parser("expr", alt(ref("term"), star(group(alt(lit("+"),
 *         ref("term"))))))
 */
public final class Grammars {

    private Grammars() {}

    public static Element.RuleRef ref(String name) {
        return new Element.RuleRef(name);
    }
    public static Element.RuleRef ref(String label, String name) {
        return new Element.RuleRef(name, label, false);
    }
    public static Element.RuleRef listRef(String label, String name) {
        return new Element.RuleRef(name, label, true);
    }

    public static Element.Literal lit(String value) {
        return new Element.Literal(value);
    }

    public static Element.CharClass cls(String spec) {
        return new Element.CharClass(parseRanges(spec), false);
    }
    public static Element.CharClass notCls(String spec) {
        return new Element.CharClass(parseRanges(spec), true);
    }
    public static Element.CharClass range(int lo, int hi) {
        return new Element.CharClass(false, new CharRange(lo, hi));
    }

    public static Element.Wildcard any() {
        return new Element.Wildcard();
    }

    public static Element.EndOfInput eof() {
        return new Element.EndOfInput();
    }

    public static Element.Group group(Alternative... alts) {
        return new Element.Group(alts);
    }

    public static Element.Quantified opt(Element body) {
        return new Element.Quantified(body, Element.Quantifier.OPTIONAL,
                                      true);
    }
    public static Element.Quantified star(Element body) {
        return new Element.Quantified(body, Element.Quantifier.ZERO_OR_MORE,
                                      true);
    }
    public static Element.Quantified plus(Element body) {
        return new Element.Quantified(body, Element.Quantifier.ONE_OR_MORE,
                                      true);
    }
    public static Element.Quantified lazyOpt(Element body) {
        return new Element.Quantified(body, Element.Quantifier.OPTIONAL,
                                      false);
    }
    public static Element.Quantified lazyStar(Element body) {
        return new Element.Quantified(body, Element.Quantifier.ZERO_OR_MORE,
                                      false);
    }
    public static Element.Quantified lazyPlus(Element body) {
        return new Element.Quantified(body, Element.Quantifier.ONE_OR_MORE,
                                      false);
    }

    public static Element.Action action(String code) {
        return new Element.Action(code);
    }

    public static Element.Predicate pred(String code) {
        return new Element.Predicate(code);
    }

    public static Alternative alt(Element... elements) {
        return new Alternative(elements);
    }

    public static Rule parser(String name, Alternative... alts) {
        return new Rule(name, RuleKind.PARSER, alts);
    }
    public static Rule lexer(String name, Alternative... alts) {
        return new Rule(name, RuleKind.LEXER, alts);
    }
    public static Rule fragment(String name, Alternative... alts) {
        return new Rule(name, RuleKind.FRAGMENT, alts);
    }

    public static Grammar grammar(String name, GrammarType type,
                                  Rule... rules) {
        Grammar ret = new Grammar(name, type);
        for (Rule r : rules) ret.addRule(r);
        return ret;
    }
    public static Grammar combined(String name, Rule... rules) {
        return grammar(name, GrammarType.COMBINED, rules);
    }

    private static int readCodePoint(String spec, int[] pos) {
        int cp = spec.codePointAt(pos[0]);
        pos[0] += Character.charCount(cp);
        if (cp != '\\') return cp;
        if (pos[0] >= spec.length())
            throw new IllegalArgumentException("Dangling escape in " +
                "character class " + spec);
        cp = spec.codePointAt(pos[0]);
        pos[0] += Character.charCount(cp);
        switch (cp) {
            case 'n': return '\n';
            case 'r': return '\r';
            case 't': return '\t';
            case 'f': return '\f';
            case 'b': return '\b';
            case 'u':
                if (pos[0] + 4 > spec.length())
                    throw new IllegalArgumentException("Truncated " +
                        "\\u escape in character class " + spec);
                int ret = Integer.parseInt(
                    spec.substring(pos[0], pos[0] + 4), 16);
                pos[0] += 4;
                return ret;
            default:
                return cp;
        }
    }

    /* Parses the body of a character class as written between brackets,
     * e.g. "a-zA-Z_" or "\\t\\n ". */
    public static List<CharRange> parseRanges(String spec) {
        List<CharRange> ret = new ArrayList<CharRange>();
        int[] pos = new int[] { 0 };
        while (pos[0] < spec.length()) {
            int lo = readCodePoint(spec, pos);
            int hi = lo;
            if (pos[0] + 1 < spec.length() && spec.charAt(pos[0]) == '-') {
                pos[0]++;
                hi = readCodePoint(spec, pos);
            }
            ret.add(new CharRange(lo, hi));
        }
        return ret;
    }

}
