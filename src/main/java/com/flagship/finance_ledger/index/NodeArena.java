package com.flagship.finance_ledger.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Slot arena backing the linked ledger structures.
 *
 * Nodes are addressed by stable integer handles instead of object references.
 * A released slot is recycled by a later allocation; reading a released handle
 * is rejected rather than returning whatever now lives in the slot's place.
 *
 * @param <N> node type
 */
public final class NodeArena<N> {

    /**
     * Handle value meaning "no node".
     */
    public static final int NIL = -1;

    private final List<N> slots = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    private int live;

    public int allocate(N node) {
        if (node == null) {
            throw new IllegalArgumentException("Arena node cannot be null");
        }
        live++;
        if (!freeSlots.isEmpty()) {
            int handle = freeSlots.pop();
            slots.set(handle, node);
            return handle;
        }
        slots.add(node);
        return slots.size() - 1;
    }

    public N get(int handle) {
        if (handle < 0 || handle >= slots.size() || slots.get(handle) == null) {
            throw new IllegalStateException("Stale or unknown arena handle: " + handle);
        }
        return slots.get(handle);
    }

    public void release(int handle) {
        get(handle);
        slots.set(handle, null);
        freeSlots.push(handle);
        live--;
    }

    public int size() {
        return live;
    }

    public void clear() {
        slots.clear();
        freeSlots.clear();
        live = 0;
    }
}
