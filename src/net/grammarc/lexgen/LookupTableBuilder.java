package net.grammarc.lexgen;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import net.grammarc.grammar.CharRange;

/* Partitions the code space at every boundary of the added character sets
 * and merges the intervals no set tells apart into one class. Class ids
 * are handed out in order of first appearance from code point 0 up. */
public class LookupTableBuilder {

    private final List<CharSet> sets;

    public LookupTableBuilder() {
        this.sets = new ArrayList<CharSet>();
    }

    public LookupTableBuilder add(CharSet set) {
        sets.add(set);
        return this;
    }
    public LookupTableBuilder addAll(Collection<CharSet> sets) {
        for (CharSet s : sets) add(s);
        return this;
    }

    protected BitSet signature(int cp) {
        BitSet ret = new BitSet(sets.size());
        for (int i = 0; i < sets.size(); i++) {
            if (sets.get(i).contains(cp)) ret.set(i);
        }
        return ret;
    }

    public LookupTable build() {
        TreeSet<Integer> boundaries = new TreeSet<Integer>();
        boundaries.add(0);
        boundaries.add(LookupTable.TABLE_SIZE);
        for (CharSet s : sets) boundaries.addAll(s.getBoundaries());
        List<Integer> starts = new ArrayList<Integer>(boundaries);
        Map<BitSet, Integer> classIds = new HashMap<BitSet, Integer>();
        List<List<CharRange>> memberRanges = new ArrayList<List<CharRange>>();
        int[] intervalClasses = new int[starts.size()];
        for (int i = 0; i < starts.size(); i++) {
            int lo = starts.get(i);
            int hi = (i + 1 < starts.size()) ? starts.get(i + 1) - 1 :
                CharRange.MAX_CODE_POINT;
            BitSet sig = signature(lo);
            Integer id = classIds.get(sig);
            if (id == null) {
                id = memberRanges.size();
                classIds.put(sig, id);
                memberRanges.add(new ArrayList<CharRange>());
            }
            memberRanges.get(id).add(new CharRange(lo, hi));
            intervalClasses[i] = id;
        }
        int[] table = new int[LookupTable.TABLE_SIZE];
        List<Integer> highStarts = new ArrayList<Integer>();
        List<Integer> highClasses = new ArrayList<Integer>();
        for (int i = 0; i < starts.size(); i++) {
            int lo = starts.get(i);
            int cls = intervalClasses[i];
            if (lo < LookupTable.TABLE_SIZE) {
                int hi = Math.min(LookupTable.TABLE_SIZE,
                    (i + 1 < starts.size()) ? starts.get(i + 1) :
                        LookupTable.TABLE_SIZE);
                for (int cp = lo; cp < hi; cp++) table[cp] = cls;
            } else if (highClasses.isEmpty() ||
                       highClasses.get(highClasses.size() - 1) != cls) {
                highStarts.add(lo);
                highClasses.add(cls);
            }
        }
        List<CharSet> members = new ArrayList<CharSet>();
        for (List<CharRange> mr : memberRanges) members.add(CharSet.of(mr));
        return new LookupTable(table, toArray(highStarts),
                               toArray(highClasses), members);
    }

    private static int[] toArray(List<Integer> values) {
        int[] ret = new int[values.size()];
        for (int i = 0; i < ret.length; i++) ret[i] = values.get(i);
        return ret;
    }

}
