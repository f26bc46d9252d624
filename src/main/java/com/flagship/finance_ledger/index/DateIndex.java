package com.flagship.finance_ledger.index;

import com.flagship.finance_ledger.ledger.Transaction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static com.flagship.finance_ledger.index.NodeArena.NIL;

/**
 * Binary search tree of transactions keyed by date string.
 *
 * Each key holds a bucket of every transaction on that date, kept in insertion
 * order. The tree is not rebalanced: dates inserted in sorted order degrade it
 * to a list, making insert and range queries O(n). Traversals are iterative so
 * a degenerate tree cannot overflow the call stack.
 *
 * A bucket emptied by deletion keeps its node; empty buckets contribute nothing
 * to traversals.
 */
public class DateIndex {

    private static final class Node {
        final String date;
        final List<Transaction> bucket = new ArrayList<>();
        int left = NIL;
        int right = NIL;

        Node(String date) {
            this.date = date;
        }
    }

    private final NodeArena<Node> arena = new NodeArena<>();
    private int root = NIL;
    private int count;

    /**
     * Appends the transaction to its date bucket, creating the node if needed.
     * Average O(log n), worst case O(n).
     */
    public void insert(Transaction transaction) {
        String date = transaction.getDate();
        if (root == NIL) {
            root = newNode(date, transaction);
            count++;
            return;
        }
        int current = root;
        while (true) {
            Node node = arena.get(current);
            int cmp = date.compareTo(node.date);
            if (cmp == 0) {
                node.bucket.add(transaction);
                break;
            }
            int child = cmp < 0 ? node.left : node.right;
            if (child == NIL) {
                int created = newNode(date, transaction);
                if (cmp < 0) {
                    node.left = created;
                } else {
                    node.right = created;
                }
                break;
            }
            current = child;
        }
        count++;
    }

    /**
     * Removes the transaction from its date bucket, descending by its date.
     *
     * @return false if the bucket does not hold a transaction with that id
     */
    public boolean remove(Transaction transaction) {
        int handle = findNode(transaction.getDate());
        return handle != NIL && removeFromBucket(arena.get(handle), transaction.getId());
    }

    /**
     * Removes a transaction when only its id is known. Visits every bucket.
     */
    public boolean deleteById(String id) {
        for (Node node : nodesInOrder()) {
            if (removeFromBucket(node, id)) {
                return true;
            }
        }
        return false;
    }

    public Optional<Transaction> findById(String id) {
        for (Node node : nodesInOrder()) {
            for (Transaction t : node.bucket) {
                if (t.getId().equals(id)) {
                    return Optional.of(t);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All transactions, ascending by date.
     */
    public List<Transaction> inorderTraversal() {
        List<Transaction> result = new ArrayList<>(count);
        for (Node node : nodesInOrder()) {
            result.addAll(node.bucket);
        }
        return result;
    }

    /**
     * All transactions, descending by date. Within a date, insertion order is kept.
     */
    public List<Transaction> reverseInorderTraversal() {
        List<Transaction> result = new ArrayList<>(count);
        Deque<Integer> stack = new ArrayDeque<>();
        int current = root;
        while (current != NIL || !stack.isEmpty()) {
            while (current != NIL) {
                stack.push(current);
                current = arena.get(current).right;
            }
            Node node = arena.get(stack.pop());
            result.addAll(node.bucket);
            current = node.left;
        }
        return result;
    }

    /**
     * Transactions with {@code startDate <= date <= endDate}, ascending.
     *
     * Subtrees that lie entirely outside the bounds are never entered.
     * Average O(log n + k).
     */
    public List<Transaction> rangeQuery(String startDate, String endDate) {
        List<Transaction> result = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        int current = root;
        while (current != NIL || !stack.isEmpty()) {
            while (current != NIL) {
                stack.push(current);
                Node node = arena.get(current);
                current = node.date.compareTo(startDate) > 0 ? node.left : NIL;
            }
            Node node = arena.get(stack.pop());
            if (node.date.compareTo(startDate) >= 0 && node.date.compareTo(endDate) <= 0) {
                result.addAll(node.bucket);
            }
            current = node.date.compareTo(endDate) < 0 ? node.right : NIL;
        }
        return result;
    }

    /**
     * Transactions of one month, given as {@code YYYY-MM}.
     * The range ends at day 31 for every month; string comparison makes that
     * correct for shorter months.
     */
    public List<Transaction> getByMonth(String yearMonth) {
        return rangeQuery(yearMonth + "-01", yearMonth + "-31");
    }

    /**
     * Number of levels in the tree; equals the number of distinct dates when
     * they were inserted in sorted order.
     */
    public int height() {
        if (root == NIL) {
            return 0;
        }
        int height = 0;
        Deque<Integer> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                Node node = arena.get(level.poll());
                if (node.left != NIL) {
                    level.add(node.left);
                }
                if (node.right != NIL) {
                    level.add(node.right);
                }
            }
        }
        return height;
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public void clear() {
        arena.clear();
        root = NIL;
        count = 0;
    }

    private int newNode(String date, Transaction first) {
        Node node = new Node(date);
        node.bucket.add(first);
        return arena.allocate(node);
    }

    private int findNode(String date) {
        int current = root;
        while (current != NIL) {
            Node node = arena.get(current);
            int cmp = date.compareTo(node.date);
            if (cmp == 0) {
                return current;
            }
            current = cmp < 0 ? node.left : node.right;
        }
        return NIL;
    }

    private boolean removeFromBucket(Node node, String id) {
        Iterator<Transaction> it = node.bucket.iterator();
        while (it.hasNext()) {
            if (it.next().getId().equals(id)) {
                it.remove();
                count--;
                return true;
            }
        }
        return false;
    }

    private List<Node> nodesInOrder() {
        List<Node> nodes = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        int current = root;
        while (current != NIL || !stack.isEmpty()) {
            while (current != NIL) {
                stack.push(current);
                current = arena.get(current).left;
            }
            Node node = arena.get(stack.pop());
            nodes.add(node);
            current = node.right;
        }
        return nodes;
    }
}
