package com.flagship.finance_ledger.undo;

import com.flagship.finance_ledger.index.NodeArena;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.flagship.finance_ledger.index.NodeArena.NIL;

/**
 * Bounded LIFO log of reversible actions.
 *
 * When full, a push evicts the oldest entry (the bottom of the stack), so
 * only the most recent {@code capacity} actions can be undone. Eviction walks
 * to the second-to-last node, O(n); pop and peek are O(1).
 */
@Slf4j
public class ActionLog {

    private static final class Node {
        final Action action;
        int next = NIL;

        Node(Action action) {
            this.action = action;
        }
    }

    private final NodeArena<Node> arena = new NodeArena<>();
    private final int capacity;
    private int top = NIL;

    public ActionLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Action log capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void push(Action action) {
        if (arena.size() >= capacity) {
            evictOldest();
        }
        Node node = new Node(action);
        node.next = top;
        top = arena.allocate(node);
    }

    public Optional<Action> pop() {
        if (top == NIL) {
            return Optional.empty();
        }
        int handle = top;
        Node node = arena.get(handle);
        top = node.next;
        arena.release(handle);
        return Optional.of(node.action);
    }

    public Optional<Action> peek() {
        return top == NIL ? Optional.empty() : Optional.of(arena.get(top).action);
    }

    /**
     * Logged actions, most recent first.
     */
    public List<Action> getAll() {
        List<Action> result = new ArrayList<>(arena.size());
        for (int h = top; h != NIL; h = arena.get(h).next) {
            result.add(arena.get(h).action);
        }
        return result;
    }

    public int size() {
        return arena.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return top == NIL;
    }

    public void clear() {
        arena.clear();
        top = NIL;
    }

    private void evictOldest() {
        Node current = arena.get(top);
        if (current.next == NIL) {
            log.debug("Evicting oldest action {}", current.action.getType());
            arena.release(top);
            top = NIL;
            return;
        }
        while (arena.get(current.next).next != NIL) {
            current = arena.get(current.next);
        }
        log.debug("Evicting oldest action {}", arena.get(current.next).action.getType());
        arena.release(current.next);
        current.next = NIL;
    }
}
