package com.sitecraft.render;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressed cache for expensive fragments repeated across pages, such as a rendered partial.
 * <p>
 * One instance lives for one build cycle and is handed to renderers through the {@link RenderContext}.
 * A single lock guards the map; fragments are computed outside the lock, so two workers missing the same
 * key may both compute it and the first stored value wins.
 */
public class FragmentCache {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, String> fragments = new HashMap<>();
    private long hits;
    private long misses;

    public String computeIfAbsent(String key, FragmentLoader loader) throws RenderException {
        lock.lock();
        try {
            String cached = fragments.get(key);
            if (cached != null) {
                hits++;
                return cached;
            }
            misses++;
        } finally {
            lock.unlock();
        }

        String computed = loader.load();
        lock.lock();
        try {
            String existing = fragments.putIfAbsent(key, computed);
            return existing != null ? existing : computed;
        } finally {
            lock.unlock();
        }
    }

    public Stats stats() {
        lock.lock();
        try {
            return new Stats(fragments.size(), hits, misses);
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    public interface FragmentLoader {
        String load() throws RenderException;
    }

    public record Stats(int entries, long hits, long misses) {
    }
}
