package net.grammarc.lexgen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.grammarc.grammar.CharRange;
import net.grammarc.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Maps code points to character equivalence classes.
 * Code points below TABLE_SIZE are looked up directly in a fixed table.
 * Code points at or above it are looked up in a sorted list of intervals;
 * if the grammar never distinguishes characters in that range the list
 * has a single entry and every such code point falls into the fallback
 * class (the class of the highest code point, i.e. of all characters no
 * declared range singles out).
 */
public final class LookupTable {

    public static final int TABLE_SIZE = 256;

    private final int[] table;
    private final int[] highStarts;
    private final int[] highClasses;
    private final List<CharSet> members;

    LookupTable(int[] table, int[] highStarts, int[] highClasses,
                List<CharSet> members) {
        this.table = table;
        this.highStarts = highStarts;
        this.highClasses = highClasses;
        this.members = Collections.unmodifiableList(
            new ArrayList<CharSet>(members));
    }

    public String toString() {
        return getClass().getName() + "@" +
            Integer.toHexString(hashCode()) + "[classes=" + members.size() +
            ",table=" + Arrays.toString(table) + "]";
    }

    public int getClassCount() {
        return members.size();
    }

    public int classOf(int cp) {
        if (cp < 0 || cp > CharRange.MAX_CODE_POINT)
            throw new IllegalArgumentException("Invalid code point " + cp);
        if (cp < TABLE_SIZE) return table[cp];
        int lo = 0, hi = highStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (highStarts[mid] <= cp) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return highClasses[lo];
    }

    /**
     * A copy of the direct table.
     */
    public int[] getTable() {
        return Arrays.copyOf(table, table.length);
    }

    public int getFallbackClass() {
        return classOf(CharRange.MAX_CODE_POINT);
    }

    /**
     * Whether every code point at or above TABLE_SIZE maps to the
     * fallback class.
     */
    public boolean isCompact() {
        return highStarts.length == 1;
    }

    /**
     * The code points making up a class.
     */
    public CharSet getMembers(int classId) {
        return members.get(classId);
    }

    public JSONObject toJSON() {
        JSONArray high = new JSONArray();
        for (int i = 0; i < highStarts.length; i++) {
            int end = (i + 1 < highStarts.length) ? highStarts[i + 1] - 1 :
                CharRange.MAX_CODE_POINT;
            high.put(Util.toJSONArray(new int[] { highStarts[i], end,
                                                  highClasses[i] }));
        }
        return Util.createJSONObject("classCount", members.size(),
            "table", Util.toJSONArray(table), "fallback",
            getFallbackClass(), "high", high);
    }

}
