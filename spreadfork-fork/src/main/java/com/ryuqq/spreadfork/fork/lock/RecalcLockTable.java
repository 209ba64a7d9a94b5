package com.ryuqq.spreadfork.fork.lock;

import com.ryuqq.spreadfork.core.model.ForkId;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Per-fork recalculation locks (lock striping).
 *
 * <p>Each fork gets its own fair {@link ReentrantLock}, so recalculations on one fork run
 * one at a time while different forks proceed in parallel. Entries are reference counted:
 * {@link #acquire(ForkId)} increments the count inside {@link ConcurrentHashMap#compute},
 * and closing the returned {@link RecalcLease} decrements it inside
 * {@link ConcurrentHashMap#computeIfPresent}. Because both run under the map's per-key
 * lock, a prune can never remove an entry another thread has just acquired.</p>
 *
 * <p><strong>Entry lifecycle:</strong></p>
 * <ul>
 *   <li>Created lazily on first acquire.</li>
 *   <li>Kept while the fork lives, so repeated recalculations reuse the same lock.</li>
 *   <li>Removed by {@link #prune(ForkId)} when unreferenced, or by {@link #retire(ForkId)}
 *       when the fork is deleted. A retired entry that is still held is removed when its
 *       last lease closes.</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class RecalcLockTable {

    private final ConcurrentHashMap<ForkId, Stripe> stripes = new ConcurrentHashMap<>();

    /**
     * Takes a reference on the fork's lock entry, creating it if needed.
     *
     * <p>The lock itself is not taken; call {@link RecalcLease#lock(java.time.Duration)}.</p>
     *
     * @param forkId fork ID
     * @return lease holding one reference
     */
    public RecalcLease acquire(ForkId forkId) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        Stripe stripe = stripes.compute(forkId, (id, existing) -> {
            Stripe s = existing != null ? existing : new Stripe();
            s.refs++;
            return s;
        });
        return new RecalcLease(forkId, stripe, this);
    }

    /**
     * Removes the entry if nothing references it.
     *
     * @param forkId fork ID
     * @return true if the fork no longer has an entry after the call
     */
    public boolean prune(ForkId forkId) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        stripes.computeIfPresent(forkId, (id, s) -> s.refs == 0 ? null : s);
        return !stripes.containsKey(forkId);
    }

    /**
     * Marks the fork as gone: removes the entry now if unreferenced, otherwise when the
     * last lease closes.
     *
     * @param forkId deleted fork ID
     */
    public void retire(ForkId forkId) {
        if (forkId == null) {
            throw new IllegalArgumentException("forkId cannot be null");
        }
        stripes.computeIfPresent(forkId, (id, s) -> {
            if (s.refs == 0) {
                return null;
            }
            s.retired = true;
            return s;
        });
    }

    void release(ForkId forkId, Stripe stripe) {
        stripes.computeIfPresent(forkId, (id, s) -> {
            if (s != stripe) {
                return s;
            }
            s.refs--;
            return s.refs == 0 && s.retired ? null : s;
        });
    }

    public boolean contains(ForkId forkId) {
        return stripes.containsKey(forkId);
    }

    /**
     * @param forkId fork ID
     * @return live reference count, 0 if absent
     */
    public int referenceCount(ForkId forkId) {
        Stripe s = stripes.get(forkId);
        return s == null ? 0 : s.refs;
    }

    public int size() {
        return stripes.size();
    }

    /**
     * @return snapshot of entries that no lease references
     */
    public Set<ForkId> unreferencedKeys() {
        return stripes.entrySet().stream()
            .filter(e -> e.getValue().refs == 0)
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Lock plus reference count. {@code refs} and {@code retired} are only written inside
     * the map's compute functions.
     */
    static final class Stripe {
        final ReentrantLock lock = new ReentrantLock(true);
        volatile int refs;
        volatile boolean retired;
    }
}
