package com.ryuqq.spreadfork.testkit.contract;

import com.ryuqq.spreadfork.core.spi.RecalcBackend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Recalculation engine double that records concurrency.
 *
 * <p>Each run appends {@code "="} to the working copy, so the number of completed
 * recalculations is visible in the file itself. {@link #maxConcurrent()} reports the highest
 * number of runs that overlapped across all forks, {@link #maxConcurrentOnSameFile()} the
 * highest overlap on any single working copy.</p>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class ScriptedRecalcBackend implements RecalcBackend {

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final AtomicInteger maxSameFile = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final Map<Path, AtomicInteger> activeByFile = new ConcurrentHashMap<>();
    private final AtomicReference<IOException> nextFailure = new AtomicReference<>();
    private volatile long durationMs;
    private volatile boolean available = true;

    @Override
    public void recalculate(Path workPath) throws IOException {
        IOException failure = nextFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        AtomicInteger onFile = activeByFile.computeIfAbsent(workPath, k -> new AtomicInteger());
        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
        maxSameFile.accumulateAndGet(onFile.incrementAndGet(), Math::max);
        try {
            if (durationMs > 0) {
                Thread.sleep(durationMs);
            }
            Files.writeString(workPath, "=", StandardOpenOption.APPEND);
            completed.incrementAndGet();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("recalculation interrupted", e);
        } finally {
            onFile.decrementAndGet();
            active.decrementAndGet();
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String name() {
        return "scripted";
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * The next run throws {@code failure} without touching the file.
     */
    public void failNext(IOException failure) {
        nextFailure.set(failure);
    }

    public int maxConcurrent() {
        return maxActive.get();
    }

    public int maxConcurrentOnSameFile() {
        return maxSameFile.get();
    }

    public int completedRuns() {
        return completed.get();
    }
}
