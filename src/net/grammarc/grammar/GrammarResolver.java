package net.grammarc.grammar;

import net.grammarc.api.GrammarView;

/* Looks up imported grammars by name. Returns null for unknown names. */
public interface GrammarResolver {

    GrammarView resolve(String grammarName);

}
