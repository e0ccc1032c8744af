package net.grammarc.api;

import java.util.List;
import java.util.Map;
import java.util.Set;
import net.grammarc.grammar.GrammarType;
import net.grammarc.grammar.Rule;

/**
 * A read-only view of a Grammar.
 * The collections returned by the methods in this interface are
 * unmodifiable. Analysis passes only ever consume grammars through this
 * interface.
 */
public interface GrammarView extends NamedValue {

    /**
     * Whether this is a lexer, parser, or combined grammar.
     */
    GrammarType getType();

    /**
     * All rules, in declaration order.
     * Declaration order is significant; it is used as the priority of
     * lexer rules.
     */
    List<Rule> getRules();

    /**
     * The explicitly designated entry rule, or null if there is none.
     * If there is none, the first parser rule serves as the entry rule.
     */
    String getStartRule();

    /**
     * Grammar-level options (e.g. "tokenVocab").
     */
    Map<String, String> getOptions();

    /**
     * Names of imported grammars, in import order.
     */
    List<String> getImports();

    /**
     * Named actions (e.g. "header", "members") mapped to their code.
     */
    Map<String, String> getNamedActions();

    /**
     * Names of declared token channels.
     */
    Set<String> getChannels();

}
