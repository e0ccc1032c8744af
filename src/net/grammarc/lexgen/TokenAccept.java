package net.grammarc.lexgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.grammarc.grammar.LexerCommand;
import net.grammarc.util.Formats;
import net.grammarc.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * What an accepting automaton state matches: an alternative of a token
 * rule.
 * Tags are ordered by rule declaration index and then by alternative
 * index; when a state accepts several tags, the least one wins.
 */
public final class TokenAccept implements Comparable<TokenAccept> {

    private final String tokenName;
    private final int priority;
    private final int alternative;
    private final List<LexerCommand> commands;
    private final boolean nonGreedy;

    public TokenAccept(String tokenName, int priority, int alternative,
                       List<LexerCommand> commands, boolean nonGreedy) {
        if (tokenName == null)
            throw new NullPointerException("Token name may not be null");
        this.tokenName = tokenName;
        this.priority = priority;
        this.alternative = alternative;
        this.commands = (commands == null) ?
            Collections.<LexerCommand>emptyList() :
            Collections.unmodifiableList(
                new ArrayList<LexerCommand>(commands));
        this.nonGreedy = nonGreedy;
    }

    public String toString() {
        StringBuilder sb = new StringBuilder(tokenName);
        sb.append('#').append(priority).append('.').append(alternative);
        if (! commands.isEmpty())
            sb.append(" -> ").append(Formats.join(commands, ", "));
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof TokenAccept)) return false;
        TokenAccept to = (TokenAccept) other;
        return (tokenName.equals(to.tokenName) &&
                priority == to.priority && alternative == to.alternative &&
                commands.equals(to.commands) && nonGreedy == to.nonGreedy);
    }

    public int hashCode() {
        return tokenName.hashCode() ^ (priority * 1009 + alternative);
    }

    public int compareTo(TokenAccept other) {
        if (priority != other.priority)
            return Integer.compare(priority, other.priority);
        return Integer.compare(alternative, other.alternative);
    }

    public String getTokenName() {
        return tokenName;
    }

    /**
     * The declaration index of the token rule; lower wins.
     */
    public int getPriority() {
        return priority;
    }

    public int getAlternative() {
        return alternative;
    }

    public List<LexerCommand> getCommands() {
        return commands;
    }

    /**
     * Whether the matched alternative contains a non-greedy loop, in
     * which case the shortest match is taken.
     */
    public boolean isNonGreedy() {
        return nonGreedy;
    }

    public JSONObject toJSON() {
        JSONArray cmds = new JSONArray();
        for (LexerCommand c : commands) cmds.put(c.toString());
        return Util.createJSONObject("token", tokenName, "priority",
            priority, "alternative", alternative, "commands", cmds,
            "nonGreedy", nonGreedy);
    }

}
