package io.invoicebot.server.claim;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local mutex per key. Entries are reference counted and dropped once no thread holds or waits on them.
 */
public class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    @FunctionalInterface
    public interface LockedCallback<T> {
        T run();
    }

    public <T> T withLock(String key, Duration wait, LockedCallback<T> callback, LockedCallback<T> onTimeout) {
        Entry entry = acquireEntry(key);
        boolean locked = false;
        try {
            locked = entry.lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
            if (!locked) {
                return onTimeout.run();
            }
            return callback.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for local lock on " + key, e);
        } finally {
            if (locked) {
                entry.lock.unlock();
            }
            releaseEntry(key, entry);
        }
    }

    int size() {
        return entries.size();
    }

    private Entry acquireEntry(String key) {
        return entries.compute(key, (k, existing) -> {
            Entry entry = existing == null ? new Entry() : existing;
            entry.references++;
            return entry;
        });
    }

    private void releaseEntry(String key, Entry entry) {
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing != entry) {
                return existing;
            }
            existing.references--;
            return existing.references == 0 ? null : existing;
        });
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}
