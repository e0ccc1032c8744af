package net.grammarc.grammar;

import net.grammarc.api.NamedValue;

/* An argument, return value, or local variable declaration of a rule.
 * Only emitters look at these. */
public final class RuleParameter implements NamedValue {

    private final String name;
    private final String type;

    public RuleParameter(String name, String type) {
        if (name == null)
            throw new NullPointerException(
                "RuleParameter name may not be null");
        this.name = name;
        this.type = type;
    }

    public String toString() {
        return (type == null) ? name : type + " " + name;
    }

    public boolean equals(Object other) {
        if (! (other instanceof RuleParameter)) return false;
        RuleParameter po = (RuleParameter) other;
        return (name.equals(po.name) &&
                ((type == null) ? po.type == null : type.equals(po.type)));
    }

    public int hashCode() {
        return name.hashCode() ^ ((type == null) ? 0 : type.hashCode());
    }

    public String getName() {
        return name;
    }

    /* May be null if the declaration is untyped. */
    public String getType() {
        return type;
    }

}
