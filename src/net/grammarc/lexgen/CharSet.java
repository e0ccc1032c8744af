package net.grammarc.lexgen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import net.grammarc.grammar.CharRange;

/**
 * An immutable set of code points, stored as sorted, disjoint, non-adjacent
 * inclusive intervals.
 */
public final class CharSet {

    public static final CharSet EMPTY = new CharSet(new int[0]);
    public static final CharSet ALL = new CharSet(
        new int[] { 0, CharRange.MAX_CODE_POINT });

    // lo0, hi0, lo1, hi1, ...
    private final int[] bounds;

    private CharSet(int[] bounds) {
        this.bounds = bounds;
    }

    public static CharSet of(int cp) {
        return range(cp, cp);
    }
    public static CharSet range(int lo, int hi) {
        if (lo > hi || lo < 0 || hi > CharRange.MAX_CODE_POINT)
            throw new IllegalArgumentException("Invalid code point range " +
                lo + ".." + hi);
        return new CharSet(new int[] { lo, hi });
    }
    public static CharSet of(Collection<CharRange> ranges) {
        List<CharRange> sorted = new ArrayList<CharRange>(ranges);
        Collections.sort(sorted);
        int[] buf = new int[sorted.size() * 2];
        int n = 0;
        for (CharRange r : sorted) {
            // Merge overlapping and adjacent ranges.
            if (n > 0 && r.getLow() <= buf[n - 1] + 1) {
                if (r.getHigh() > buf[n - 1]) buf[n - 1] = r.getHigh();
            } else {
                buf[n++] = r.getLow();
                buf[n++] = r.getHigh();
            }
        }
        return new CharSet(Arrays.copyOf(buf, n));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (CharRange r : getRanges()) sb.append(r);
        return sb.append(']').toString();
    }

    public boolean equals(Object other) {
        return ((other instanceof CharSet) &&
                Arrays.equals(bounds, ((CharSet) other).bounds));
    }

    public int hashCode() {
        return Arrays.hashCode(bounds);
    }

    public boolean isEmpty() {
        return bounds.length == 0;
    }

    public List<CharRange> getRanges() {
        List<CharRange> ret = new ArrayList<CharRange>(bounds.length / 2);
        for (int i = 0; i < bounds.length; i += 2)
            ret.add(new CharRange(bounds[i], bounds[i + 1]));
        return ret;
    }

    /**
     * The smallest member, or -1 if the set is empty.
     */
    public int first() {
        return isEmpty() ? -1 : bounds[0];
    }

    public boolean contains(int cp) {
        int lo = 0, hi = bounds.length / 2 - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (cp < bounds[mid * 2]) {
                hi = mid - 1;
            } else if (cp > bounds[mid * 2 + 1]) {
                lo = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    public CharSet union(CharSet other) {
        List<CharRange> all = getRanges();
        all.addAll(other.getRanges());
        return of(all);
    }

    public CharSet complement() {
        int[] buf = new int[bounds.length + 2];
        int n = 0;
        int next = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            if (bounds[i] > next) {
                buf[n++] = next;
                buf[n++] = bounds[i] - 1;
            }
            next = bounds[i + 1] + 1;
        }
        if (next <= CharRange.MAX_CODE_POINT) {
            buf[n++] = next;
            buf[n++] = CharRange.MAX_CODE_POINT;
        }
        return new CharSet(Arrays.copyOf(buf, n));
    }

    /**
     * Every code point at which membership changes: the low end of every
     * interval and the code point just past its high end.
     */
    public List<Integer> getBoundaries() {
        List<Integer> ret = new ArrayList<Integer>(bounds.length);
        for (int i = 0; i < bounds.length; i += 2) {
            ret.add(bounds[i]);
            if (bounds[i + 1] < CharRange.MAX_CODE_POINT)
                ret.add(bounds[i + 1] + 1);
        }
        return ret;
    }

}
