package net.grammarc.lexgen;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.grammarc.analysis.RuleGraph;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;
import net.grammarc.grammar.Rule;

/* Thompson construction of the combined NFA of one lexer mode. Every
 * element becomes a fragment with one entry and one exit state; referenced
 * lexer rules and fragments are inlined at each use. */
public class NfaBuilder implements Element.Visitor<int[]> {

    private final RuleGraph graph;
    private final Nfa nfa;
    private final Set<String> inlining;
    private boolean sawNonGreedy;

    public NfaBuilder(RuleGraph graph) {
        this.graph = graph;
        this.nfa = new Nfa();
        this.inlining = new HashSet<String>();
    }

    public Nfa getNfa() {
        return nfa;
    }

    /* Adds the token rules (in the given order) as alternatives of the
     * start state. */
    public Nfa build(List<Rule> tokenRules) {
        int start = nfa.newState();
        nfa.setStart(start);
        for (Rule r : tokenRules) addToken(start, r);
        return nfa;
    }

    protected void addToken(int start, Rule rule) {
        int priority = graph.indexOf(rule.getName());
        List<Alternative> alts = rule.getAlternatives();
        inlining.add(rule.getName());
        for (int i = 0; i < alts.size(); i++) {
            Alternative alt = alts.get(i);
            sawNonGreedy = false;
            int[] frag = sequence(alt.getElements());
            nfa.addEpsilon(start, frag[0]);
            nfa.setAccept(frag[1], new TokenAccept(rule.getName(), priority,
                i, alt.getCommands(), sawNonGreedy));
        }
        inlining.remove(rule.getName());
    }

    protected int[] sequence(List<Element> elems) {
        int first = nfa.newState();
        int last = first;
        for (Element e : elems) {
            int[] frag = e.accept(this);
            nfa.addEpsilon(last, frag[0]);
            last = frag[1];
        }
        return new int[] { first, last };
    }

    protected int[] single(CharSet label) {
        int s = nfa.newState(), e = nfa.newState();
        nfa.addTransition(s, label, e);
        return new int[] { s, e };
    }

    protected int[] empty() {
        int s = nfa.newState();
        return new int[] { s, s };
    }

    public int[] visitRuleRef(Element.RuleRef elem) {
        Rule target = graph.getRule(elem.getName());
        if (target == null || ! target.getKind().isLexical())
            throw new IllegalStateException("Cannot inline " + elem +
                " into a lexer rule");
        if (! inlining.add(target.getName()))
            throw new IllegalStateException("Lexer rule " +
                target.getName() + " is recursive");
        int s = nfa.newState(), e = nfa.newState();
        for (Alternative alt : target.getAlternatives()) {
            int[] frag = sequence(alt.getElements());
            nfa.addEpsilon(s, frag[0]);
            nfa.addEpsilon(frag[1], e);
        }
        inlining.remove(target.getName());
        return new int[] { s, e };
    }

    public int[] visitLiteral(Element.Literal elem) {
        String value = elem.getValue();
        int first = nfa.newState();
        int last = first;
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            int next = nfa.newState();
            nfa.addTransition(last, CharSet.of(cp), next);
            last = next;
            i += Character.charCount(cp);
        }
        return new int[] { first, last };
    }

    public int[] visitCharClass(Element.CharClass elem) {
        CharSet set = CharSet.of(elem.getRanges());
        if (elem.isNegated()) set = set.complement();
        return single(set);
    }

    public int[] visitWildcard(Element.Wildcard elem) {
        return single(CharSet.ALL);
    }

    public int[] visitEndOfInput(Element.EndOfInput elem) {
        throw new IllegalStateException("EOF cannot occur in a lexer rule");
    }

    public int[] visitGroup(Element.Group elem) {
        int s = nfa.newState(), e = nfa.newState();
        for (Alternative alt : elem.getAlternatives()) {
            int[] frag = sequence(alt.getElements());
            nfa.addEpsilon(s, frag[0]);
            nfa.addEpsilon(frag[1], e);
        }
        return new int[] { s, e };
    }

    public int[] visitQuantified(Element.Quantified elem) {
        if (! elem.isGreedy()) sawNonGreedy = true;
        int[] body = elem.getBody().accept(this);
        int s = nfa.newState(), e = nfa.newState();
        nfa.addEpsilon(s, body[0]);
        nfa.addEpsilon(body[1], e);
        if (elem.getQuantifier().isRepeating())
            nfa.addEpsilon(body[1], body[0]);
        if (elem.getQuantifier().isOptional())
            nfa.addEpsilon(s, e);
        return new int[] { s, e };
    }

    // Actions and predicates do not affect what a token matches.
    public int[] visitAction(Element.Action elem) {
        return empty();
    }

    public int[] visitPredicate(Element.Predicate elem) {
        return empty();
    }

}
