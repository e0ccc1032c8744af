package net.grammarc.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.grammarc.util.Formats;

public final class Alternative {

    private final List<Element> elements;
    private final String label;
    private final List<LexerCommand> commands;

    public Alternative(List<Element> elements, String label,
                       List<LexerCommand> commands) {
        if (elements == null)
            throw new NullPointerException(
                "Alternative elements may not be null");
        if (commands == null)
            throw new NullPointerException(
                "Alternative commands may not be null");
        this.elements = Collections.unmodifiableList(
            new ArrayList<Element>(elements));
        this.label = label;
        this.commands = Collections.unmodifiableList(
            new ArrayList<LexerCommand>(commands));
    }
    public Alternative(List<Element> elements) {
        this(elements, null, Collections.<LexerCommand>emptyList());
    }
    public Alternative(Element... elements) {
        this(Arrays.asList(elements));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder(Formats.join(elements, " "));
        if (! commands.isEmpty())
            sb.append(" -> ").append(Formats.join(commands, ", "));
        if (label != null) sb.append(" # ").append(label);
        return sb.toString();
    }

    public boolean equals(Object other) {
        if (! (other instanceof Alternative)) return false;
        Alternative ao = (Alternative) other;
        return (elements.equals(ao.elements) &&
                commands.equals(ao.commands) &&
                ((label == null) ? ao.label == null :
                    label.equals(ao.label)));
    }

    public int hashCode() {
        return elements.hashCode() ^ commands.hashCode();
    }

    public List<Element> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /* May be null. */
    public String getLabel() {
        return label;
    }

    public List<LexerCommand> getCommands() {
        return commands;
    }

    public Alternative withLabel(String newLabel) {
        return new Alternative(elements, newLabel, commands);
    }

    public Alternative withCommands(LexerCommand... newCommands) {
        return new Alternative(elements, label, Arrays.asList(newCommands));
    }

}
