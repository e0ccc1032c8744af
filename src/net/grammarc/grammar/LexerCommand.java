package net.grammarc.grammar;

/* A trailing lexer command of an alternative, e.g. -> pushMode(STRING). */
public final class LexerCommand {

    public enum Type {

        SKIP("skip", false),
        MORE("more", false),
        POP_MODE("popMode", false),
        CHANNEL("channel", true),
        TYPE("type", true),
        MODE("mode", true),
        PUSH_MODE("pushMode", true);

        private final String keyword;
        private final boolean takesArgument;

        Type(String keyword, boolean takesArgument) {
            this.keyword = keyword;
            this.takesArgument = takesArgument;
        }

        public String getKeyword() {
            return keyword;
        }

        public boolean takesArgument() {
            return takesArgument;
        }

        public static Type forKeyword(String keyword) {
            for (Type t : values()) {
                if (t.keyword.equals(keyword)) return t;
            }
            return null;
        }

    }

    public static final LexerCommand SKIP = new LexerCommand(Type.SKIP, null);
    public static final LexerCommand MORE = new LexerCommand(Type.MORE, null);
    public static final LexerCommand POP_MODE =
        new LexerCommand(Type.POP_MODE, null);

    private final Type type;
    private final String argument;

    public LexerCommand(Type type, String argument) {
        if (type == null)
            throw new NullPointerException(
                "LexerCommand type may not be null");
        if (type.takesArgument() != (argument != null))
            throw new IllegalArgumentException("Lexer command " +
                type.getKeyword() + (type.takesArgument() ?
                    " requires" : " does not take") + " an argument");
        this.type = type;
        this.argument = argument;
    }

    public static LexerCommand channel(String name) {
        return new LexerCommand(Type.CHANNEL, name);
    }
    public static LexerCommand type(String tokenName) {
        return new LexerCommand(Type.TYPE, tokenName);
    }
    public static LexerCommand mode(String modeName) {
        return new LexerCommand(Type.MODE, modeName);
    }
    public static LexerCommand pushMode(String modeName) {
        return new LexerCommand(Type.PUSH_MODE, modeName);
    }

    public String toString() {
        if (argument == null) return type.getKeyword();
        return type.getKeyword() + "(" + argument + ")";
    }

    public boolean equals(Object other) {
        if (! (other instanceof LexerCommand)) return false;
        LexerCommand co = (LexerCommand) other;
        return (type == co.type && ((argument == null) ?
            co.argument == null : argument.equals(co.argument)));
    }

    public int hashCode() {
        return type.hashCode() ^ ((argument == null) ? 0 :
            argument.hashCode());
    }

    public Type getType() {
        return type;
    }

    public String getArgument() {
        return argument;
    }

    /* Whether this command enters the mode it names. */
    public boolean entersMode() {
        return (type == Type.MODE || type == Type.PUSH_MODE);
    }

}
