package com.flagship.finance_ledger.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.flagship.finance_ledger.index.NodeArena.NIL;

/**
 * Case-insensitive prefix tree for category and payee suggestions.
 *
 * Keys are folded to lower case; the terminal node keeps the spelling of the
 * first insertion for display, so "FOOD" after "Food" is not a new word.
 * Suggestion order follows child traversal and is not sorted.
 */
public class AutocompleteIndex {

    private static final class Node {
        final Map<Character, Integer> children = new HashMap<>();
        String word;
    }

    private final NodeArena<Node> arena = new NodeArena<>();
    private int root;
    private int wordCount;

    public AutocompleteIndex() {
        root = arena.allocate(new Node());
    }

    /**
     * O(length).
     *
     * @return true if the word was not already present
     */
    public boolean insert(String word) {
        if (word == null || word.isBlank()) {
            return false;
        }
        int current = root;
        for (char c : fold(word).toCharArray()) {
            Node node = arena.get(current);
            Integer child = node.children.get(c);
            if (child == null) {
                child = arena.allocate(new Node());
                node.children.put(c, child);
            }
            current = child;
        }
        Node terminal = arena.get(current);
        if (terminal.word != null) {
            return false;
        }
        terminal.word = word;
        wordCount++;
        return true;
    }

    public boolean contains(String word) {
        int node = descend(word);
        return node != NIL && arena.get(node).word != null;
    }

    public boolean startsWith(String prefix) {
        return descend(prefix) != NIL;
    }

    /**
     * Up to {@code limit} stored words starting with {@code prefix}, in no
     * particular order. An empty prefix matches every word.
     */
    public List<String> getWordsWithPrefix(String prefix, int limit) {
        List<String> result = new ArrayList<>();
        int start = descend(prefix == null ? "" : prefix);
        if (start == NIL || limit <= 0) {
            return result;
        }
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty() && result.size() < limit) {
            Node node = arena.get(stack.pop());
            if (node.word != null) {
                result.add(node.word);
            }
            node.children.values().forEach(stack::push);
        }
        return result;
    }

    public List<String> getAllWords() {
        return getWordsWithPrefix("", Integer.MAX_VALUE);
    }

    public int size() {
        return wordCount;
    }

    public boolean isEmpty() {
        return wordCount == 0;
    }

    public void clear() {
        arena.clear();
        root = arena.allocate(new Node());
        wordCount = 0;
    }

    private int descend(String key) {
        int current = root;
        for (char c : fold(key).toCharArray()) {
            Integer child = arena.get(current).children.get(c);
            if (child == null) {
                return NIL;
            }
            current = child;
        }
        return current;
    }

    private static String fold(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
