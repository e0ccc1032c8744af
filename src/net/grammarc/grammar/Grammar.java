package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.grammarc.api.GrammarView;

/* Mutable grammar AST as produced by a grammar reader. Rules may be added
 * with clashing names; detecting that is up to the analysis. */
public class Grammar implements GrammarView {

    private final String name;
    private final GrammarType type;
    private final List<Rule> rules;
    private final Map<String, String> options;
    private final List<String> imports;
    private final Map<String, String> namedActions;
    private final Set<String> channels;
    private String startRule;

    public Grammar(String name, GrammarType type) {
        if (type == null)
            throw new NullPointerException("Grammar type may not be null");
        this.name = name;
        this.type = type;
        this.rules = new ArrayList<Rule>();
        this.options = new LinkedHashMap<String, String>();
        this.imports = new ArrayList<String>();
        this.namedActions = new LinkedHashMap<String, String>();
        this.channels = new LinkedHashSet<String>();
        this.startRule = null;
    }
    public Grammar(GrammarView other) {
        this(other.getName(), other.getType());
        rules.addAll(other.getRules());
        options.putAll(other.getOptions());
        imports.addAll(other.getImports());
        namedActions.putAll(other.getNamedActions());
        channels.addAll(other.getChannels());
        startRule = other.getStartRule();
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName());
        sb.append('@');
        sb.append(Integer.toHexString(hashCode()));
        sb.append("[name=").append(name).append(",type=").append(type);
        for (Rule r : rules) {
            sb.append(',').append(r);
        }
        return sb.append(']').toString();
    }

    // Immutable GrammarView interface.
    public String getName() {
        return name;
    }

    public GrammarType getType() {
        return type;
    }

    public List<Rule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public String getStartRule() {
        return startRule;
    }

    public Map<String, String> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public List<String> getImports() {
        return Collections.unmodifiableList(imports);
    }

    public Map<String, String> getNamedActions() {
        return Collections.unmodifiableMap(namedActions);
    }

    public Set<String> getChannels() {
        return Collections.unmodifiableSet(channels);
    }

    // Mutable direct interface.
    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /* The first rule with the given name, or null. */
    public Rule getRule(String ruleName) {
        for (Rule r : rules) {
            if (r.getName().equals(ruleName)) return r;
        }
        return null;
    }

    public Grammar addRule(Rule rule) {
        if (rule == null)
            throw new NullPointerException("Cannot add null rule");
        rules.add(rule);
        return this;
    }
    public boolean removeRule(Rule rule) {
        return rules.remove(rule);
    }

    public void setStartRule(String ruleName) {
        startRule = ruleName;
    }

    public void putOption(String key, String value) {
        options.put(key, value);
    }

    public void addImport(String grammarName) {
        imports.add(grammarName);
    }

    public void putNamedAction(String actionName, String code) {
        namedActions.put(actionName, code);
    }

    public void addChannel(String channelName) {
        channels.add(channelName);
    }

}
