package com.lakeindex.benchmark;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeletionCursorTest {

    @Test
    void testSequentialOrder() {
        DeletionCursor cursor = new DeletionCursor(List.of(5, 1, 3, 2, 4), false, 1L);

        assertEquals(List.of(1, 2), cursor.next(2));
        assertEquals(List.of(3, 4), cursor.next(2));
        assertEquals(List.of(5), cursor.next(2));
        assertTrue(cursor.isExhausted());
        assertEquals(List.of(), cursor.next(2));
        assertEquals(5, cursor.consumed());
    }

    @Test
    void testRandomOrderIsSeededPermutation() {
        List<Integer> docIds = new ArrayList<>();
        for (int docId = 1; docId <= 50; docId++) {
            docIds.add(docId);
        }
        DeletionCursor first = new DeletionCursor(docIds, true, 99L);
        DeletionCursor second = new DeletionCursor(docIds, true, 99L);

        List<Integer> drawn = new ArrayList<>(first.next(50));
        assertEquals(drawn, second.next(50));
        assertEquals(new HashSet<>(docIds), new HashSet<>(drawn));
        assertNotEquals(docIds, drawn);
    }
}
