package net.grammarc.analysis;

import net.grammarc.grammar.Alternative;
import net.grammarc.grammar.Element;

/* Visits every element of a tree in source order. Subclasses override the
 * leaf callbacks they care about. */
abstract class ElementWalker implements Element.Visitor<Void> {

    public void walk(Alternative alt) {
        for (Element e : alt.getElements()) e.accept(this);
    }

    public Void visitRuleRef(Element.RuleRef elem) {
        return null;
    }

    public Void visitLiteral(Element.Literal elem) {
        return null;
    }

    public Void visitCharClass(Element.CharClass elem) {
        return null;
    }

    public Void visitWildcard(Element.Wildcard elem) {
        return null;
    }

    public Void visitEndOfInput(Element.EndOfInput elem) {
        return null;
    }

    public Void visitGroup(Element.Group elem) {
        for (Alternative alt : elem.getAlternatives()) walk(alt);
        return null;
    }

    public Void visitQuantified(Element.Quantified elem) {
        return elem.getBody().accept(this);
    }

    public Void visitAction(Element.Action elem) {
        return null;
    }

    public Void visitPredicate(Element.Predicate elem) {
        return null;
    }

}
