package br.edu.ifba.wikicorpus.storage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers ids of categories and images a writer has already resolved.
 *
 * <p>Owned by exactly one writer and never shared between threads. The store's
 * unique constraints stay authoritative; a miss only costs a lookup. Must be
 * cleared whenever the owning writer rolls back, since ids created inside the
 * aborted transaction no longer exist.</p>
 */
public final class DedupCache {

    public static final int DEFAULT_CAPACITY = 100_000;

    private final Map<String, Long> categories;
    private final Map<String, Long> images;

    public DedupCache() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity entries kept per kind before the least recently used is evicted
     */
    public DedupCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.categories = boundedMap(capacity);
        this.images = boundedMap(capacity);
    }

    public Long categoryId(String name) {
        return categories.get(name);
    }

    public void putCategory(String name, long id) {
        categories.put(name, id);
    }

    /**
     * @param hash image content hash
     */
    public Long imageId(String hash) {
        return images.get(hash);
    }

    public void putImage(String hash, long id) {
        images.put(hash, id);
    }

    public void clear() {
        categories.clear();
        images.clear();
    }

    public int categoryCount() {
        return categories.size();
    }

    public int imageCount() {
        return images.size();
    }

    private static Map<String, Long> boundedMap(final int capacity) {
        return new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
                return size() > capacity;
            }
        };
    }
}
