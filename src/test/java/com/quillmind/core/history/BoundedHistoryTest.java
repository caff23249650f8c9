package com.quillmind.core.history;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedHistoryTest {

    @Test
    @DisplayName("rejects a non-positive capacity")
    void rejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedHistory<String>(0));
    }

    @Test
    @DisplayName("evicts the oldest entry once full")
    void evictsOldest() {
        var history = new BoundedHistory<Integer>(3);
        history.append(1);
        history.append(2);
        history.append(3);

        history.append(4);
        assertEquals(List.of(2, 3, 4), history.snapshot());
        assertEquals(3, history.size());
    }

    @Test
    @DisplayName("latest and previous follow insertion order")
    void latestAndPrevious() {
        var history = new BoundedHistory<String>(5);
        assertTrue(history.latest().isEmpty());
        history.append("a");
        assertTrue(history.previous().isEmpty());
        history.append("b");

        assertEquals("b", history.latest().orElseThrow());
        assertEquals("a", history.previous().orElseThrow());
    }

    @Test
    @DisplayName("recent returns at most n entries, oldest first")
    void recent() {
        var history = new BoundedHistory<Integer>(10);
        for (int i = 1; i <= 5; i++) {
            history.append(i);
        }
        assertEquals(List.of(4, 5), history.recent(2));
        assertEquals(List.of(1, 2, 3, 4, 5), history.recent(50));
    }

    @Test
    @DisplayName("snapshot is detached from later appends")
    void snapshotDetached() {
        var history = new BoundedHistory<Integer>(10);
        history.append(1);
        var snapshot = history.snapshot();
        history.append(2);
        assertEquals(List.of(1), snapshot);
        assertEquals(2, history.size());
    }
}
