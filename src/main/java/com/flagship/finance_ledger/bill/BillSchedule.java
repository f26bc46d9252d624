package com.flagship.finance_ledger.bill;

import com.flagship.finance_ledger.index.NodeArena;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;

import static com.flagship.finance_ledger.index.NodeArena.NIL;

/**
 * FIFO queue of bills in arrival order.
 *
 * Enqueue and dequeue are O(1). Lookups by id scan the queue, since bills are
 * expected to be handled in arrival order.
 */
public class BillSchedule {

    private static final class Node {
        Bill bill;
        int next = NIL;

        Node(Bill bill) {
            this.bill = bill;
        }
    }

    private final NodeArena<Node> arena = new NodeArena<>();
    private int front = NIL;
    private int rear = NIL;

    public void enqueue(Bill bill) {
        int handle = arena.allocate(new Node(bill));
        if (rear == NIL) {
            front = rear = handle;
        } else {
            arena.get(rear).next = handle;
            rear = handle;
        }
    }

    public Optional<Bill> dequeue() {
        if (front == NIL) {
            return Optional.empty();
        }
        int handle = front;
        Node node = arena.get(handle);
        front = node.next;
        if (front == NIL) {
            rear = NIL;
        }
        arena.release(handle);
        return Optional.of(node.bill);
    }

    public Optional<Bill> peek() {
        return front == NIL ? Optional.empty() : Optional.of(arena.get(front).bill);
    }

    public Optional<Bill> findById(String id) {
        for (int h = front; h != NIL; h = arena.get(h).next) {
            if (arena.get(h).bill.getId().equals(id)) {
                return Optional.of(arena.get(h).bill);
            }
        }
        return Optional.empty();
    }

    /**
     * Zero-based position of the bill counted from the front.
     */
    public OptionalInt positionOf(String id) {
        int position = 0;
        for (int h = front; h != NIL; h = arena.get(h).next) {
            if (arena.get(h).bill.getId().equals(id)) {
                return OptionalInt.of(position);
            }
            position++;
        }
        return OptionalInt.empty();
    }

    /**
     * Splices the bill out of the queue. Removing the front is a dequeue.
     */
    public boolean removeById(String id) {
        if (front == NIL) {
            return false;
        }
        if (arena.get(front).bill.getId().equals(id)) {
            return dequeue().isPresent();
        }
        int previous = front;
        int current = arena.get(front).next;
        while (current != NIL) {
            Node node = arena.get(current);
            if (node.bill.getId().equals(id)) {
                arena.get(previous).next = node.next;
                if (current == rear) {
                    rear = previous;
                }
                arena.release(current);
                return true;
            }
            previous = current;
            current = node.next;
        }
        return false;
    }

    public boolean markAsPaid(String id) {
        return setPaid(id, true);
    }

    /**
     * Sets the paid flag in place, keeping the bill's queue position.
     */
    public boolean setPaid(String id, boolean paid) {
        for (int h = front; h != NIL; h = arena.get(h).next) {
            Node node = arena.get(h);
            if (node.bill.getId().equals(id)) {
                node.bill = node.bill.withPaid(paid);
                return true;
            }
        }
        return false;
    }

    public List<Bill> getAllBills() {
        return collect(b -> true);
    }

    public List<Bill> getUnpaidBills() {
        return collect(b -> !b.isPaid());
    }

    public List<Bill> getOverdueBills(String referenceDate) {
        return collect(b -> b.isOverdueOn(referenceDate));
    }

    public int size() {
        return arena.size();
    }

    public boolean isEmpty() {
        return front == NIL;
    }

    public void clear() {
        arena.clear();
        front = rear = NIL;
    }

    private List<Bill> collect(Predicate<Bill> predicate) {
        List<Bill> result = new ArrayList<>();
        for (int h = front; h != NIL; h = arena.get(h).next) {
            Bill bill = arena.get(h).bill;
            if (predicate.test(bill)) {
                result.add(bill);
            }
        }
        return result;
    }
}
