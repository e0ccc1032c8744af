package net.grammarc.lexgen;

/* Thrown when no token matches the input at some position. */
public class ScanException extends Exception {

    private final int offset;

    public ScanException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /* The char index scanning failed at. */
    public int getOffset() {
        return offset;
    }

}
