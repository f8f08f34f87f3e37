package com.ragkit.store;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One read/write lock per physical collection, shared by a store and every view created from it.
 */
final class CollectionLocks {
    private final ConcurrentMap<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    ReentrantReadWriteLock forCollection(String physicalName) {
        return locks.computeIfAbsent(physicalName, ignored -> new ReentrantReadWriteLock());
    }
}
