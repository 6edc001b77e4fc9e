package io.mistral.core.database;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Semaphore;

/**
 * Process-wide locks keyed by resource name and owned by a database session.
 *
 * Used when the database doesn't make concurrent writers on different connections
 * wait for each other's row locks. A lock is held from {@link #acquire} until the
 * owner calls {@link #releaseAll}, which happens when its transaction commits,
 * rolls back or ends.
 */
public class LocalLockMap
{
    private static class Entry
    {
        private final Semaphore semaphore = new Semaphore(1);
        // guarded by LocalLockMap.this
        private Object owner;
        private int waiters;
    }

    private final Map<String, Entry> locks = new HashMap<>();
    private final Map<Object, List<String>> ownedKeys = new IdentityHashMap<>();

    /**
     * Blocks until the lock is available. Returns immediately if the owner already holds it.
     */
    public void acquire(String key, Object owner)
    {
        Entry entry;
        synchronized (this) {
            entry = locks.computeIfAbsent(key, k -> new Entry());
            if (entry.owner == owner) {
                return;
            }
            entry.waiters++;
        }

        entry.semaphore.acquireUninterruptibly();

        synchronized (this) {
            entry.waiters--;
            entry.owner = owner;
            ownedKeys.computeIfAbsent(owner, o -> new ArrayList<>()).add(key);
        }
    }

    public void releaseAll(Object owner)
    {
        List<Entry> released = new ArrayList<>();
        synchronized (this) {
            List<String> keys = ownedKeys.remove(owner);
            if (keys == null) {
                return;
            }
            for (String key : keys) {
                Entry entry = locks.get(key);
                if (entry != null && entry.owner == owner) {
                    entry.owner = null;
                    released.add(entry);
                }
            }
        }
        for (Entry entry : released) {
            entry.semaphore.release();
        }
    }

    /**
     * Forgets all tracked locks. Sessions blocked in {@link #acquire} return, and a
     * later {@link #releaseAll} of a former owner does nothing. Used by tests and at
     * shutdown, when no transaction depends on the locks any more.
     */
    public void cleanup()
    {
        List<Entry> dropped;
        synchronized (this) {
            dropped = new ArrayList<>(locks.values());
            for (Entry entry : dropped) {
                entry.owner = null;
            }
            locks.clear();
            ownedKeys.clear();
        }
        // a dropped semaphore is never reused, so surplus permits are harmless
        for (Entry entry : dropped) {
            int waiters;
            synchronized (this) {
                waiters = entry.waiters;
            }
            entry.semaphore.release(waiters + 1);
        }
    }

    @VisibleForTesting
    public synchronized Set<String> getLocks()
    {
        return ImmutableSet.copyOf(locks.keySet());
    }
}
