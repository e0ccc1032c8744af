package net.grammarc.grammar;

import net.grammarc.util.Formats;

/* An inclusive range of Unicode code points. */
public final class CharRange implements Comparable<CharRange> {

    public static final int MAX_CODE_POINT = Character.MAX_CODE_POINT;

    private final int lo;
    private final int hi;

    public CharRange(int lo, int hi) {
        if (lo < 0 || hi > MAX_CODE_POINT || lo > hi)
            throw new IllegalArgumentException("Invalid character range " +
                lo + "-" + hi);
        this.lo = lo;
        this.hi = hi;
    }

    public static CharRange of(int cp) {
        return new CharRange(cp, cp);
    }

    public String toString() {
        return Formats.formatRange(lo, hi);
    }

    public boolean equals(Object other) {
        if (! (other instanceof CharRange)) return false;
        CharRange co = (CharRange) other;
        return (lo == co.lo && hi == co.hi);
    }

    public int hashCode() {
        return lo * 31 + hi;
    }

    public int compareTo(CharRange other) {
        if (lo != other.lo) return Integer.compare(lo, other.lo);
        return Integer.compare(hi, other.hi);
    }

    public int getLow() {
        return lo;
    }

    public int getHigh() {
        return hi;
    }

    public boolean contains(int cp) {
        return (cp >= lo && cp <= hi);
    }

}
