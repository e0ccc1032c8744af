package net.grammarc.lexgen;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import net.grammarc.grammar.CharRange;
import net.grammarc.grammar.Grammars;
import org.junit.jupiter.api.Test;

public class CharSetTest {

    @Test
    public void mergesOverlappingAndAdjacentRanges() {
        CharSet set = CharSet.of(Grammars.parseRanges("a-mc-zA-Z0"));
        assertEquals(Arrays.asList(CharRange.of('0'),
                                   new CharRange('A', 'Z'),
                                   new CharRange('a', 'z')),
                     set.getRanges());
        assertEquals(CharSet.range('a', 'c'),
                     CharSet.of('a').union(CharSet.range('b', 'c')));
    }

    @Test
    public void membership() {
        CharSet set = CharSet.of(Grammars.parseRanges("a-fx"));
        assertTrue(set.contains('a'));
        assertTrue(set.contains('f'));
        assertTrue(set.contains('x'));
        assertFalse(set.contains('g'));
        assertFalse(set.contains('y'));
        assertFalse(CharSet.EMPTY.contains('a'));
        assertTrue(CharSet.ALL.contains(CharRange.MAX_CODE_POINT));
    }

    @Test
    public void complement() {
        CharSet set = CharSet.range('b', 'y');
        CharSet inv = set.complement();
        assertTrue(inv.contains('a'));
        assertTrue(inv.contains('z'));
        assertFalse(inv.contains('m'));
        assertEquals(set, inv.complement());
        assertEquals(CharSet.EMPTY, CharSet.ALL.complement());
        assertEquals(CharSet.ALL, CharSet.EMPTY.complement());
    }

    @Test
    public void boundariesMarkMembershipChanges() {
        CharSet set = CharSet.of(Grammars.parseRanges("0-9a-z"));
        assertEquals(Arrays.asList((int) '0', '9' + 1, (int) 'a', 'z' + 1),
                     set.getBoundaries());
        assertEquals(Arrays.asList(0), CharSet.ALL.getBoundaries());
    }

}
