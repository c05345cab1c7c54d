package org.Resq.core.id;

import org.Resq.planning.ObjectNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObjectIndexTest {

    private record Item(String id, int weight) {
    }

    private static ObjectIndex<Item> sample() {
        return ObjectIndex.of("item", List.of(new Item("alpha", 1), new Item("beta", 2), new Item("gamma", 3)), Item::id);
    }

    @Test
    @DisplayName("Baseline Correctness: ids resolve to objects and dense indices in input order")
    void testLookup() {
        ObjectIndex<Item> index = sample();

        assertEquals(2, index.require("beta").weight());
        assertEquals(0, index.indexOf("alpha"));
        assertEquals(2, index.indexOf("gamma"));
        assertEquals(3, index.size());
        assertSame(index.values().get(1), index.require("beta"));
        assertTrue(index.contains("alpha"));
        assertFalse(index.contains("delta"));
        assertTrue(index.find("gamma").isPresent());
        assertTrue(index.find("delta").isEmpty());
        assertTrue(index.find(null).isEmpty());
    }

    @Test
    @DisplayName("Exception Path: unknown id raises ObjectNotFoundException with kind and id")
    void testUnknownId() {
        ObjectIndex<Item> index = sample();

        ObjectNotFoundException ex = assertThrows(ObjectNotFoundException.class, () -> index.require("delta"));
        assertEquals("item", ex.getObjectKind());
        assertEquals("delta", ex.getObjectId());
        assertEquals(ObjectNotFoundException.REASON_OBJECT_NOT_FOUND, ex.getReasonCode());
        assertThrows(ObjectNotFoundException.class, () -> index.indexOf(null));
    }

    @Test
    @DisplayName("Constructor Validation: duplicate ids are rejected")
    void testDuplicateIdsRejected() {
        List<Item> items = List.of(new Item("alpha", 1), new Item("alpha", 2));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ObjectIndex.of("item", items, Item::id));
        assertTrue(ex.getMessage().contains("Duplicate"));
    }

    @Test
    @DisplayName("Constructor Validation: blank ids are rejected")
    void testBlankIdsRejected() {
        List<Item> items = List.of(new Item(" ", 1));
        assertThrows(IllegalArgumentException.class, () -> ObjectIndex.of("item", items, Item::id));
    }

    @Test
    @DisplayName("Immutability: values view cannot be modified")
    void testValuesImmutable() {
        ObjectIndex<Item> index = sample();
        assertThrows(UnsupportedOperationException.class, () -> index.values().add(new Item("delta", 4)));
    }
}
