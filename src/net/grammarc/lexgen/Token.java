package net.grammarc.lexgen;

import net.grammarc.util.Formats;

/* A token produced by the Scanner. */
public final class Token {

    public static final String EOF_TYPE = "EOF";
    public static final String DEFAULT_CHANNEL = "DEFAULT_TOKEN_CHANNEL";
    public static final String HIDDEN_CHANNEL = "HIDDEN";

    private final String type;
    private final String text;
    private final int offset;
    private final String channel;
    private final String mode;

    public Token(String type, String text, int offset, String channel,
                 String mode) {
        if (type == null)
            throw new NullPointerException("Token type may not be null");
        if (text == null)
            throw new NullPointerException("Token text may not be null");
        this.type = type;
        this.text = text;
        this.offset = offset;
        this.channel = (channel == null) ? DEFAULT_CHANNEL : channel;
        this.mode = mode;
    }

    public String toString() {
        return type + " " + Formats.formatString(text) + " @" + offset;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token to = (Token) other;
        return (type.equals(to.type) && text.equals(to.text) &&
                offset == to.offset && channel.equals(to.channel));
    }

    public int hashCode() {
        return type.hashCode() ^ text.hashCode() ^ offset;
    }

    public String getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /* The char index the token text starts at. */
    public int getOffset() {
        return offset;
    }

    public String getChannel() {
        return channel;
    }

    /* The mode the token was matched in. */
    public String getMode() {
        return mode;
    }

    public boolean isEOF() {
        return type.equals(EOF_TYPE);
    }

}
