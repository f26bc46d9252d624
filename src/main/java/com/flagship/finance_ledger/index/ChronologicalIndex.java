package com.flagship.finance_ledger.index;

import com.flagship.finance_ledger.ledger.Transaction;
import com.flagship.finance_ledger.ledger.TransactionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static com.flagship.finance_ledger.index.NodeArena.NIL;

/**
 * Transactions in insertion order, traversable from either end.
 *
 * New transactions go to the front (most recent first); historical ones
 * (loaded or restored) go to the back. Every read returns a snapshot list.
 */
public class ChronologicalIndex {

    private static final class Node {
        final Transaction transaction;
        int prev = NIL;
        int next = NIL;

        Node(Transaction transaction) {
            this.transaction = transaction;
        }
    }

    private final NodeArena<Node> arena = new NodeArena<>();
    private int head = NIL;
    private int tail = NIL;

    // O(1)
    public void addFront(Transaction transaction) {
        int handle = arena.allocate(new Node(transaction));
        if (head == NIL) {
            head = tail = handle;
        } else {
            arena.get(handle).next = head;
            arena.get(head).prev = handle;
            head = handle;
        }
    }

    // O(1)
    public void addBack(Transaction transaction) {
        int handle = arena.allocate(new Node(transaction));
        if (tail == NIL) {
            head = tail = handle;
        } else {
            arena.get(handle).prev = tail;
            arena.get(tail).next = handle;
            tail = handle;
        }
    }

    /**
     * Unlinks the transaction with the given id. Linear scan.
     *
     * @return false if no such transaction is present
     */
    public boolean deleteById(String id) {
        int handle = locate(id);
        if (handle == NIL) {
            return false;
        }
        Node node = arena.get(handle);
        if (node.prev != NIL) {
            arena.get(node.prev).next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != NIL) {
            arena.get(node.next).prev = node.prev;
        } else {
            tail = node.prev;
        }
        arena.release(handle);
        return true;
    }

    public Optional<Transaction> findById(String id) {
        int handle = locate(id);
        return handle == NIL ? Optional.empty() : Optional.of(arena.get(handle).transaction);
    }

    public boolean contains(String id) {
        return locate(id) != NIL;
    }

    /**
     * Front to back: newest additions first.
     */
    public List<Transaction> traverseForward() {
        return filter(t -> true);
    }

    /**
     * Back to front.
     */
    public List<Transaction> traverseBackward() {
        List<Transaction> result = new ArrayList<>(arena.size());
        for (int h = tail; h != NIL; h = arena.get(h).prev) {
            result.add(arena.get(h).transaction);
        }
        return result;
    }

    /**
     * The first {@code count} transactions from the front.
     */
    public List<Transaction> first(int count) {
        List<Transaction> result = new ArrayList<>(Math.max(0, Math.min(count, arena.size())));
        for (int h = head; h != NIL && result.size() < count; h = arena.get(h).next) {
            result.add(arena.get(h).transaction);
        }
        return result;
    }

    public List<Transaction> filter(Predicate<Transaction> predicate) {
        List<Transaction> result = new ArrayList<>();
        for (int h = head; h != NIL; h = arena.get(h).next) {
            Transaction transaction = arena.get(h).transaction;
            if (predicate.test(transaction)) {
                result.add(transaction);
            }
        }
        return result;
    }

    public List<Transaction> filterByCategory(String category) {
        return filter(t -> t.getCategory().equals(category));
    }

    public List<Transaction> filterByType(TransactionType type) {
        return filter(t -> t.getType() == type);
    }

    public int size() {
        return arena.size();
    }

    public boolean isEmpty() {
        return head == NIL;
    }

    public void clear() {
        arena.clear();
        head = tail = NIL;
    }

    private int locate(String id) {
        for (int h = head; h != NIL; h = arena.get(h).next) {
            if (arena.get(h).transaction.getId().equals(id)) {
                return h;
            }
        }
        return NIL;
    }
}
