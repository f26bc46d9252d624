package com.flagship.finance_ledger.index;

import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed-size chained hash table keyed by category name.
 *
 * The bucket count is set at construction and never changes: there is no
 * resizing, so heavy collision degrades lookups to O(n).
 *
 * @param <V> value type
 */
public class CategoryTable<V> {

    private static final int POLYNOMIAL_BASE = 31;

    private static final class Entry<V> {
        final String key;
        V value;

        Entry(String key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private final List<List<Entry<V>>> buckets;
    private int count;

    public CategoryTable(int bucketCount) {
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("Bucket count must be positive: " + bucketCount);
        }
        this.buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new ArrayList<>());
        }
    }

    /**
     * Inserts the key or replaces its value.
     */
    public void put(String key, V value) {
        List<Entry<V>> chain = chainFor(key);
        for (Entry<V> entry : chain) {
            if (entry.key.equals(key)) {
                entry.value = value;
                return;
            }
        }
        chain.add(new Entry<>(key, value));
        count++;
    }

    /**
     * Replaces the value of an existing key.
     *
     * @return false if the key is absent (nothing is inserted)
     */
    public boolean update(String key, V value) {
        for (Entry<V> entry : chainFor(key)) {
            if (entry.key.equals(key)) {
                entry.value = value;
                return true;
            }
        }
        return false;
    }

    public Optional<V> get(String key) {
        for (Entry<V> entry : chainFor(key)) {
            if (entry.key.equals(key)) {
                return Optional.of(entry.value);
            }
        }
        return Optional.empty();
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    public boolean remove(String key) {
        Iterator<Entry<V>> it = chainFor(key).iterator();
        while (it.hasNext()) {
            if (it.next().key.equals(key)) {
                it.remove();
                count--;
                return true;
            }
        }
        return false;
    }

    /**
     * All entries in bucket order.
     */
    public List<Map.Entry<String, V>> entries() {
        List<Map.Entry<String, V>> result = new ArrayList<>(count);
        for (List<Entry<V>> chain : buckets) {
            for (Entry<V> entry : chain) {
                result.add(new AbstractMap.SimpleImmutableEntry<>(entry.key, entry.value));
            }
        }
        return result;
    }

    public List<V> values() {
        List<V> result = new ArrayList<>(count);
        for (List<Entry<V>> chain : buckets) {
            for (Entry<V> entry : chain) {
                result.add(entry.value);
            }
        }
        return result;
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public void clear() {
        buckets.forEach(List::clear);
        count = 0;
    }

    /**
     * Polynomial rolling hash over the key's UTF-8 bytes, modulo the bucket count.
     */
    int indexFor(String key) {
        int m = buckets.size();
        long hash = 0;
        long power = 1;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            hash = Math.floorMod(hash + (long) (b - 'a' + 1) * power, (long) m);
            power = (power * POLYNOMIAL_BASE) % m;
        }
        return (int) hash;
    }

    private List<Entry<V>> chainFor(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Category key cannot be null");
        }
        return buckets.get(indexFor(key));
    }
}
