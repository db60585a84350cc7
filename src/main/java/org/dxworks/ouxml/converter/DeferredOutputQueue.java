package org.dxworks.ouxml.converter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Blocks that must be written after the main body of one output unit, in the order they were
 * deferred. Owned by a single output unit; never shared.
 */
public class DeferredOutputQueue {

    private final List<String> lines = new ArrayList<>();
    private final Set<String> keys = new HashSet<>();

    public void defer(List<String> block) {
        lines.addAll(block);
    }

    /**
     * Defers {@code block} unless a block with the same key was already deferred.
     *
     * @return true if the block was queued
     */
    public boolean defer(String key, List<String> block) {
        if (!keys.add(key)) {
            return false;
        }
        defer(block);
        return true;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }
}
