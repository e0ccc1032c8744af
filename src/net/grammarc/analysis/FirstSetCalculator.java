package net.grammarc.analysis;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;
import net.grammarc.grammar.Rule;

/* Computes first(element) against a (possibly still growing) table of rule
 * First sets. Inside parser rules a reference to a lexer rule is a terminal
 * named after the token; every other reference stays within its own world
 * and resolves to the referenced rule's First set. */
final class FirstSetCalculator implements Element.Visitor<Set<String>> {

    private final RuleGraph graph;
    private final Map<String, ? extends Set<String>> first;
    private boolean parserContext;

    public FirstSetCalculator(RuleGraph graph,
                              Map<String, ? extends Set<String>> first) {
        this.graph = graph;
        this.first = first;
    }

    public void enterRule(Rule rule) {
        parserContext = rule.isParserRule();
    }

    public boolean isParserContext() {
        return parserContext;
    }

    /* Whether a reference from the current rule names a token rather than
     * a rule whose derivations are part of this one. */
    public boolean isTerminalReference(Element.RuleRef ref) {
        if (! parserContext) return false;
        Rule target = graph.getRule(ref.getName());
        return target.getKind().isLexical();
    }

    public Set<String> ofElement(Element elem) {
        return elem.accept(this);
    }

    /* The result is a fresh set. */
    public Set<String> ofSequence(List<Element> elems) {
        Set<String> ret = new HashSet<String>();
        for (Element e : elems) {
            Set<String> ef = e.accept(this);
            boolean nullable = false;
            for (String t : ef) {
                if (t.equals(FirstFollowSets.EPSILON)) {
                    nullable = true;
                } else {
                    ret.add(t);
                }
            }
            if (! nullable) return ret;
        }
        ret.add(FirstFollowSets.EPSILON);
        return ret;
    }

    public Set<String> visitRuleRef(Element.RuleRef elem) {
        if (isTerminalReference(elem))
            return Collections.singleton(elem.getName());
        Set<String> ret = first.get(elem.getName());
        return (ret == null) ? Collections.<String>emptySet() : ret;
    }

    public Set<String> visitLiteral(Element.Literal elem) {
        return Collections.singleton(FirstFollowSets.terminalName(elem));
    }

    public Set<String> visitCharClass(Element.CharClass elem) {
        return Collections.singleton(FirstFollowSets.terminalName(elem));
    }

    public Set<String> visitWildcard(Element.Wildcard elem) {
        return Collections.singleton(FirstFollowSets.terminalName(elem));
    }

    public Set<String> visitEndOfInput(Element.EndOfInput elem) {
        return Collections.singleton(FirstFollowSets.terminalName(elem));
    }

    public Set<String> visitGroup(Element.Group elem) {
        Set<String> ret = new HashSet<String>();
        for (Alternative alt : elem.getAlternatives())
            ret.addAll(ofSequence(alt.getElements()));
        return ret;
    }

    public Set<String> visitQuantified(Element.Quantified elem) {
        Set<String> ret = new HashSet<String>(elem.getBody().accept(this));
        if (elem.getQuantifier().isOptional())
            ret.add(FirstFollowSets.EPSILON);
        return ret;
    }

    // Actions and predicates consume no input.
    public Set<String> visitAction(Element.Action elem) {
        return Collections.singleton(FirstFollowSets.EPSILON);
    }

    public Set<String> visitPredicate(Element.Predicate elem) {
        return Collections.singleton(FirstFollowSets.EPSILON);
    }

}
