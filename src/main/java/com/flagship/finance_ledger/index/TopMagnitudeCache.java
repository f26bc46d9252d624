package com.flagship.finance_ledger.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Binary max-heap used for top-K queries.
 *
 * This is a derived, disposable view: callers rebuild it from authoritative
 * data before each query instead of keeping it in sync with mutations.
 * Order among elements of equal magnitude is unspecified.
 *
 * @param <T> element type, ranked by the supplied comparator
 */
public class TopMagnitudeCache<T> {

    private final Comparator<? super T> magnitude;
    private List<T> heap = new ArrayList<>();

    public TopMagnitudeCache(Comparator<? super T> magnitude) {
        this.magnitude = magnitude;
    }

    /**
     * Replaces the contents with {@code elements}, heapified bottom-up in O(n).
     */
    public void buildHeap(Collection<? extends T> elements) {
        heap = new ArrayList<>(elements);
        for (int i = heap.size() / 2 - 1; i >= 0; i--) {
            siftDown(heap, i);
        }
    }

    // O(log n)
    public void insert(T element) {
        heap.add(element);
        siftUp(heap, heap.size() - 1);
    }

    /**
     * Removes and returns the largest element, promoting the last one to the root.
     */
    public Optional<T> extractMax() {
        return extractMax(heap);
    }

    public Optional<T> peek() {
        return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0));
    }

    /**
     * The {@code k} largest elements in descending order.
     *
     * Extraction runs against a copy, so the cache is unchanged and repeated
     * calls return the same elements. O(n) copy plus O(k log n).
     */
    public List<T> getTopK(int k) {
        List<T> working = new ArrayList<>(heap);
        List<T> result = new ArrayList<>(Math.max(0, Math.min(k, working.size())));
        for (int i = 0; i < k; i++) {
            Optional<T> next = extractMax(working);
            if (next.isEmpty()) {
                break;
            }
            result.add(next.get());
        }
        return result;
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public void clear() {
        heap = new ArrayList<>();
    }

    private Optional<T> extractMax(List<T> array) {
        if (array.isEmpty()) {
            return Optional.empty();
        }
        T max = array.get(0);
        T last = array.remove(array.size() - 1);
        if (!array.isEmpty()) {
            array.set(0, last);
            siftDown(array, 0);
        }
        return Optional.of(max);
    }

    private void siftUp(List<T> array, int i) {
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (magnitude.compare(array.get(parent), array.get(i)) >= 0) {
                return;
            }
            Collections.swap(array, parent, i);
            i = parent;
        }
    }

    private void siftDown(List<T> array, int i) {
        int size = array.size();
        while (true) {
            int largest = i;
            int left = 2 * i + 1;
            int right = 2 * i + 2;
            if (left < size && magnitude.compare(array.get(left), array.get(largest)) > 0) {
                largest = left;
            }
            if (right < size && magnitude.compare(array.get(right), array.get(largest)) > 0) {
                largest = right;
            }
            if (largest == i) {
                return;
            }
            Collections.swap(array, i, largest);
            i = largest;
        }
    }
}
