package org.dxworks.ouxml.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeferredOutputQueueTest {

    @Test
    void blocks_keepInsertionOrder() {
        DeferredOutputQueue queue = new DeferredOutputQueue();
        assertTrue(queue.isEmpty());
        queue.defer(List.of("a", ""));
        queue.defer(List.of("b", ""));
        assertEquals(List.of("a", "", "b", ""), queue.lines());
    }

    @Test
    void keyedBlock_isQueuedOnce() {
        DeferredOutputQueue queue = new DeferredOutputQueue();
        assertTrue(queue.defer("icon.png", List.of(".. |icon.png| image:: icon.png", "")));
        assertFalse(queue.defer("icon.png", List.of(".. |icon.png| image:: icon.png", "")));
        assertEquals(2, queue.lines().size());
    }
}
