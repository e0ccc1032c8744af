package net.grammarc.api;

/**
 * A generic interface for marking grammar objects with textual names.
 * Rule names, mode names, and token names are all compared by value.
 */
public interface NamedValue {

    /**
     * The name of this object.
     */
    String getName();

}
