package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.grammarc.util.Formats;

/**
 * An (immutable) element of an Alternative.
 * The set of element kinds is closed: every kind is one of the nested
 * classes below, and every pass dispatches over them through a Visitor, so
 * adding a kind makes the compiler point at every pass that has to handle
 * it.
 */
public abstract class Element {

    /**
     * Exhaustive dispatch over the element kinds.
     */
    public interface Visitor<R> {

        R visitRuleRef(RuleRef elem);

        R visitLiteral(Literal elem);

        R visitCharClass(CharClass elem);

        R visitWildcard(Wildcard elem);

        R visitEndOfInput(EndOfInput elem);

        R visitGroup(Group elem);

        R visitQuantified(Quantified elem);

        R visitAction(Action elem);

        R visitPredicate(Predicate elem);

    }

    public enum Quantifier {

        OPTIONAL("?"), ZERO_OR_MORE("*"), ONE_OR_MORE("+");

        private final String symbol;

        Quantifier(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /* Whether the quantified element may match nothing. */
        public boolean isOptional() {
            return this != ONE_OR_MORE;
        }

        /* Whether the quantified element may match more than once. */
        public boolean isRepeating() {
            return this != OPTIONAL;
        }

    }

    /* Base class for the elements that may carry a label (x=ID, xs+=ID). */
    public static abstract class LabeledElement extends Element {

        private final String label;
        private final boolean listLabel;

        protected LabeledElement(String label, boolean listLabel) {
            if (label == null && listLabel)
                throw new IllegalArgumentException(
                    "List label requires a label name");
            this.label = label;
            this.listLabel = listLabel;
        }

        protected String formatLabel() {
            if (label == null) return "";
            return label + (listLabel ? "+=" : "=");
        }

        /* May be null. */
        public String getLabel() {
            return label;
        }

        public boolean isListLabel() {
            return listLabel;
        }

    }

    public static final class RuleRef extends LabeledElement {

        private final String name;

        public RuleRef(String name, String label, boolean listLabel) {
            super(label, listLabel);
            if (name == null)
                throw new NullPointerException(
                    "RuleRef name may not be null");
            this.name = name;
        }
        public RuleRef(String name) {
            this(name, null, false);
        }

        public String toString() {
            return formatLabel() + name;
        }

        public boolean equals(Object other) {
            return ((other instanceof RuleRef) &&
                    name.equals(((RuleRef) other).name));
        }

        public int hashCode() {
            return name.hashCode();
        }

        public String getName() {
            return name;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitRuleRef(this);
        }

    }

    public static final class Literal extends LabeledElement {

        private final String value;

        public Literal(String value, String label, boolean listLabel) {
            super(label, listLabel);
            if (value == null)
                throw new NullPointerException(
                    "Literal value may not be null");
            if (value.isEmpty())
                throw new IllegalArgumentException(
                    "Literal value may not be empty");
            this.value = value;
        }
        public Literal(String value) {
            this(value, null, false);
        }

        public String toString() {
            return formatLabel() + Formats.formatLiteral(value);
        }

        public boolean equals(Object other) {
            return ((other instanceof Literal) &&
                    value.equals(((Literal) other).value));
        }

        public int hashCode() {
            return value.hashCode() ^ 0x5A5A;
        }

        /* The literal text with all escapes resolved. */
        public String getValue() {
            return value;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitLiteral(this);
        }

    }

    public static final class CharClass extends Element {

        private final List<CharRange> ranges;
        private final boolean negated;

        public CharClass(List<CharRange> ranges, boolean negated) {
            if (ranges == null)
                throw new NullPointerException(
                    "CharClass ranges may not be null");
            if (ranges.isEmpty())
                throw new IllegalArgumentException(
                    "CharClass must contain at least one range");
            this.ranges = Collections.unmodifiableList(
                new ArrayList<CharRange>(ranges));
            this.negated = negated;
        }
        public CharClass(boolean negated, CharRange... ranges) {
            this(Arrays.asList(ranges), negated);
        }

        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (negated) sb.append('~');
            sb.append('[');
            for (CharRange r : ranges) sb.append(r);
            return sb.append(']').toString();
        }

        public boolean equals(Object other) {
            if (! (other instanceof CharClass)) return false;
            CharClass co = (CharClass) other;
            return (negated == co.negated && ranges.equals(co.ranges));
        }

        public int hashCode() {
            return ranges.hashCode() ^ (negated ? 1 : 0);
        }

        /* The ranges as written; they may overlap. */
        public List<CharRange> getRanges() {
            return ranges;
        }

        public boolean isNegated() {
            return negated;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitCharClass(this);
        }

    }

    public static final class Wildcard extends Element {

        public String toString() {
            return ".";
        }

        public boolean equals(Object other) {
            return (other instanceof Wildcard);
        }

        public int hashCode() {
            return 0x2E;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitWildcard(this);
        }

    }

    /* The EOF token of parser rules. */
    public static final class EndOfInput extends Element {

        public String toString() {
            return "EOF";
        }

        public boolean equals(Object other) {
            return (other instanceof EndOfInput);
        }

        public int hashCode() {
            return 0xE0F;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitEndOfInput(this);
        }

    }

    public static final class Group extends Element {

        private final List<Alternative> alternatives;

        public Group(List<Alternative> alternatives) {
            if (alternatives == null)
                throw new NullPointerException(
                    "Group alternatives may not be null");
            if (alternatives.isEmpty())
                throw new IllegalArgumentException(
                    "Group must contain at least one alternative");
            this.alternatives = Collections.unmodifiableList(
                new ArrayList<Alternative>(alternatives));
        }
        public Group(Alternative... alternatives) {
            this(Arrays.asList(alternatives));
        }

        public String toString() {
            return "(" + Formats.join(alternatives, " | ") + ")";
        }

        public boolean equals(Object other) {
            return ((other instanceof Group) &&
                alternatives.equals(((Group) other).alternatives));
        }

        public int hashCode() {
            return alternatives.hashCode();
        }

        public List<Alternative> getAlternatives() {
            return alternatives;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitGroup(this);
        }

    }

    public static final class Quantified extends Element {

        private final Element body;
        private final Quantifier quantifier;
        private final boolean greedy;

        public Quantified(Element body, Quantifier quantifier,
                          boolean greedy) {
            if (body == null)
                throw new NullPointerException(
                    "Quantified body may not be null");
            if (quantifier == null)
                throw new NullPointerException(
                    "Quantifier may not be null");
            this.body = body;
            this.quantifier = quantifier;
            this.greedy = greedy;
        }

        public String toString() {
            return body + quantifier.getSymbol() + (greedy ? "" : "?");
        }

        public boolean equals(Object other) {
            if (! (other instanceof Quantified)) return false;
            Quantified qo = (Quantified) other;
            return (quantifier == qo.quantifier && greedy == qo.greedy &&
                    body.equals(qo.body));
        }

        public int hashCode() {
            return body.hashCode() * 3 + quantifier.ordinal() +
                (greedy ? 0 : 7);
        }

        public Element getBody() {
            return body;
        }

        public Quantifier getQuantifier() {
            return quantifier;
        }

        public boolean isGreedy() {
            return greedy;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitQuantified(this);
        }

    }

    public static final class Action extends Element {

        private final String code;

        public Action(String code) {
            if (code == null)
                throw new NullPointerException(
                    "Action code may not be null");
            this.code = code;
        }

        public String toString() {
            return "{" + code + "}";
        }

        public boolean equals(Object other) {
            return ((other instanceof Action) &&
                    code.equals(((Action) other).code));
        }

        public int hashCode() {
            return code.hashCode() ^ 0xAC;
        }

        public String getCode() {
            return code;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitAction(this);
        }

    }

    public static final class Predicate extends Element {

        private final String code;

        public Predicate(String code) {
            if (code == null)
                throw new NullPointerException(
                    "Predicate code may not be null");
            this.code = code;
        }

        public String toString() {
            return "{" + code + "}?";
        }

        public boolean equals(Object other) {
            return ((other instanceof Predicate) &&
                    code.equals(((Predicate) other).code));
        }

        public int hashCode() {
            return code.hashCode() ^ 0x9E;
        }

        public String getCode() {
            return code;
        }

        public <R> R accept(Visitor<R> v) {
            return v.visitPredicate(this);
        }

    }

    // Only the nested classes may extend Element.
    private Element() {}

    public abstract <R> R accept(Visitor<R> v);

}
