package com.ryuqq.spreadfork.testkit.contract;

import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.spi.WorkbookLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for a workbook parser.
 *
 * <p>The "parsed handle" is simply the file content read as a string, which lets tests
 * observe exactly which bytes a cached entry was loaded from.</p>
 *
 * <p><strong>Scripting:</strong></p>
 * <ul>
 *   <li>{@link #failOn(String)}: every load whose file name matches throws IOException</li>
 *   <li>{@link #setLoadDelayMs(long)}: slows each load, widening concurrent-miss windows</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class FakeWorkbookLoader implements WorkbookLoader<String> {

    private final Map<WorkbookId, AtomicInteger> loadsById = new ConcurrentHashMap<>();
    private final AtomicInteger totalLoads = new AtomicInteger();
    private final Set<String> failingFileNames = ConcurrentHashMap.newKeySet();
    private volatile long loadDelayMs;

    @Override
    public String load(WorkbookId workbookId, Path path) throws IOException {
        if (loadDelayMs > 0) {
            try {
                Thread.sleep(loadDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("load interrupted", e);
            }
        }
        if (failingFileNames.contains(path.getFileName().toString())) {
            throw new IOException("corrupt workbook: " + path.getFileName());
        }
        String content = Files.readString(path);
        loadsById.computeIfAbsent(workbookId, k -> new AtomicInteger()).incrementAndGet();
        totalLoads.incrementAndGet();
        return content;
    }

    /**
     * @param fileName file name whose loads should fail
     */
    public void failOn(String fileName) {
        failingFileNames.add(fileName);
    }

    public void setLoadDelayMs(long loadDelayMs) {
        this.loadDelayMs = loadDelayMs;
    }

    /**
     * @return successful loads of {@code workbookId}
     */
    public int loadCount(WorkbookId workbookId) {
        AtomicInteger count = loadsById.get(workbookId);
        return count == null ? 0 : count.get();
    }

    public int totalLoads() {
        return totalLoads.get();
    }
}
