package com.fnparser.grammar;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestTempVecs {

    @Test
    void testPoppedListsAreEmpty() {
        TempVecs temps = new TempVecs();
        List<String> strings = temps.pop(String.class);
        assertTrue(strings.isEmpty());
        strings.add("a");
        temps.push(String.class, strings);

        List<String> again = temps.pop(String.class);
        assertSame(strings, again);
        assertTrue(again.isEmpty());
    }

    @Test
    void testPoolsAreSeparatedByKind() {
        TempVecs temps = new TempVecs();
        temps.push(String.class, temps.pop(String.class));
        assertEquals(1, temps.pooled(String.class));
        assertEquals(0, temps.pooled(Integer.class));

        List<Integer> ints = temps.pop(Integer.class);
        ints.add(1);
        assertEquals(1, temps.pooled(String.class));
    }

    @Test
    void testNestedUseHandsOutDistinctLists() {
        TempVecs temps = new TempVecs();
        temps.push(String.class, temps.pop(String.class));
        List<String> outer = temps.pop(String.class);
        List<String> inner = temps.pop(String.class);
        assertNotSame(outer, inner);
        temps.push(String.class, inner);
        temps.push(String.class, outer);
        assertEquals(2, temps.pooled(String.class));
    }
}
