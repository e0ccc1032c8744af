package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.grammarc.api.Diagnostic;
import net.grammarc.api.DiagnosticCode;
import net.grammarc.api.GrammarView;
import net.grammarc.util.Formats;

/* Merges the grammars named in import statements into the importing
 * grammar. */
public class GrammarComposer {

    private static final Logger LOGGER = Logger.getLogger("Composer");

    private final GrammarResolver resolver;

    public GrammarComposer(GrammarResolver resolver) {
        if (resolver == null)
            throw new NullPointerException(
                "GrammarComposer resolver may not be null");
        this.resolver = resolver;
    }

    public GrammarResolver getResolver() {
        return resolver;
    }

    protected InvalidGrammarException error(String message) {
        return new InvalidGrammarException(new Diagnostic(
            DiagnosticCode.INVALID_GRAMMAR, message, null));
    }

    private String formatImportChain(Set<String> chain, String last) {
        List<String> names = new ArrayList<String>(chain);
        names.add(last);
        return Formats.join(names, " -> ");
    }

    protected void mergeInto(Grammar target, GrammarView source,
                             Map<String, String> ruleOrigins) throws
            InvalidGrammarException {
        for (Rule r : source.getRules()) {
            String origin = ruleOrigins.get(r.getName());
            if (origin != null)
                throw new InvalidGrammarException(new Diagnostic(
                    DiagnosticCode.DUPLICATE_RULE, "rule " + r.getName() +
                    " of imported grammar " + source.getName() +
                    " conflicts with grammar " + origin, r.getName()));
            ruleOrigins.put(r.getName(), source.getName());
            target.addRule(r);
        }
        for (Map.Entry<String, String> ent : source.getOptions().entrySet()) {
            if (! target.getOptions().containsKey(ent.getKey()))
                target.putOption(ent.getKey(), ent.getValue());
        }
        for (Map.Entry<String, String> ent :
                source.getNamedActions().entrySet()) {
            if (! target.getNamedActions().containsKey(ent.getKey()))
                target.putNamedAction(ent.getKey(), ent.getValue());
        }
        for (String ch : source.getChannels()) target.addChannel(ch);
    }

    protected void resolveImports(Grammar target, GrammarView current,
                                  LinkedHashSet<String> chain,
                                  Set<String> merged,
                                  Map<String, String> ruleOrigins)
            throws InvalidGrammarException {
        for (String imp : current.getImports()) {
            if (chain.contains(imp))
                throw error("circular import " +
                            formatImportChain(chain, imp));
            if (merged.contains(imp)) continue;
            GrammarView imported = resolver.resolve(imp);
            if (imported == null)
                throw error("imported grammar " + imp + " not found " +
                            "(imported by " + current.getName() + ")");
            merged.add(imp);
            LOGGER.fine("Merging grammar " + imp + " into " +
                        target.getName());
            mergeInto(target, imported, ruleOrigins);
            chain.add(imp);
            resolveImports(target, imported, chain, merged, ruleOrigins);
            chain.remove(imp);
        }
    }

    /* Returns a new grammar; root is not modified. The result keeps the
     * root's import list for reference. */
    public Grammar compose(GrammarView root) throws InvalidGrammarException {
        Grammar ret = new Grammar(root);
        Map<String, String> ruleOrigins = new HashMap<String, String>();
        for (Rule r : root.getRules()) {
            if (! ruleOrigins.containsKey(r.getName()))
                ruleOrigins.put(r.getName(), root.getName());
        }
        LinkedHashSet<String> chain = new LinkedHashSet<String>();
        chain.add(root.getName());
        Set<String> merged = new LinkedHashSet<String>();
        resolveImports(ret, root, chain, merged, ruleOrigins);
        return ret;
    }

}
