package com.ryuqq.spreadfork.cache;

import com.ryuqq.spreadfork.cache.locator.WorkbookIds;
import com.ryuqq.spreadfork.core.config.CacheConfig;
import com.ryuqq.spreadfork.core.error.IoFailureException;
import com.ryuqq.spreadfork.core.error.NotFoundException;
import com.ryuqq.spreadfork.core.model.LocatedWorkbook;
import com.ryuqq.spreadfork.core.model.WorkbookId;
import com.ryuqq.spreadfork.core.spi.ForkPathResolver;
import com.ryuqq.spreadfork.core.spi.SourceResolver;
import com.ryuqq.spreadfork.core.spi.WorkbookLoader;
import com.ryuqq.spreadfork.core.spi.WorkbookLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded LRU cache of parsed workbooks.
 *
 * <p><strong>Locking:</strong></p>
 * <ul>
 *   <li>{@code cacheLock} guards the entry map. Hits take only the read lock and promote
 *       recency through the entry's atomic stamp; the write lock is taken only to insert or
 *       remove.</li>
 *   <li>{@code indexLock} guards the id→path and alias→id maps.</li>
 *   <li>No lock is held while loading a workbook or scanning the workspace.</li>
 * </ul>
 *
 * <p><strong>Miss path:</strong> after the unlocked load, the write lock is taken and the
 * map is checked again. If a concurrent miss inserted the same key first, that entry is
 * returned and the redundant handle is dropped, so one key never has two entries.</p>
 *
 * <p><strong>Eviction:</strong> at capacity the entry with the oldest recency stamp is
 * removed. Evicted handles are not closed; readers holding them keep a valid document
 * until they release it.</p>
 *
 * <p>Counters are {@link AtomicLong}s and never take a lock.</p>
 *
 * @param <H> parsed workbook handle type
 * @author Spreadfork Team
 * @since 1.0.0
 */
public final class WorkbookCache<H> implements SourceResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkbookCache.class);

    private static final String OP_OPEN = "open_workbook";
    private static final String OP_CLOSE = "close_workbook";
    private static final String OP_RESOLVE = "resolve_workbook_path";
    private static final String OP_LIST = "list_workbooks";

    private final int capacity;
    private final WorkbookLoader<H> loader;
    private final WorkbookLocator locator;
    private final ForkPathResolver forkPaths;

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final Map<WorkbookId, CacheEntry<H>> entries = new HashMap<>();

    private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();
    private final Map<WorkbookId, Path> index = new HashMap<>();
    private final Map<String, WorkbookId> aliases = new HashMap<>();

    private final AtomicLong clock = new AtomicLong();
    private final AtomicLong operations = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param config capacity settings (validated on construction)
     * @param loader parses a workbook file into a handle
     * @param locator workspace discovery
     * @param forkPaths resolves fork ids to working copies, {@link ForkPathResolver#NONE} if none
     * @throws IllegalArgumentException if any dependency is null
     */
    public WorkbookCache(CacheConfig config, WorkbookLoader<H> loader, WorkbookLocator locator,
                         ForkPathResolver forkPaths) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        if (locator == null) {
            throw new IllegalArgumentException("locator cannot be null");
        }
        if (forkPaths == null) {
            throw new IllegalArgumentException("forkPaths cannot be null");
        }
        this.capacity = config.capacity();
        this.loader = loader;
        this.locator = locator;
        this.forkPaths = forkPaths;
    }

    public int capacity() {
        return capacity;
    }

    // ========================================
    // open / close
    // ========================================

    /**
     * Returns the cached workbook, loading it on a miss.
     *
     * @param idOrAlias canonical id, short alias (case-insensitive) or fork id
     * @return cached workbook
     * @throws NotFoundException if nothing matches
     * @throws IoFailureException if the load or workspace scan fails
     */
    public CachedWorkbook<H> openWorkbook(String idOrAlias) {
        operations.incrementAndGet();
        WorkbookId key = canonicalize(OP_OPEN, idOrAlias);

        cacheLock.readLock().lock();
        try {
            CacheEntry<H> entry = entries.get(key);
            if (entry != null) {
                entry.touch(clock.incrementAndGet());
                hits.incrementAndGet();
                log.debug("cache hit: {}", key.getValue());
                return entry.workbook();
            }
        } finally {
            cacheLock.readLock().unlock();
        }

        misses.incrementAndGet();
        log.debug("cache miss: {}", key.getValue());
        Path path = resolvePath(OP_OPEN, key);
        H handle;
        try {
            handle = loader.load(key, path);
        } catch (IOException e) {
            throw new IoFailureException(OP_OPEN, "cannot load workbook " + key.getValue() + " from " + path, e);
        }
        CachedWorkbook<H> loaded = new CachedWorkbook<>(key, shortIdFor(key), path, handle);

        cacheLock.writeLock().lock();
        try {
            CacheEntry<H> raced = entries.get(key);
            if (raced != null) {
                raced.touch(clock.incrementAndGet());
                log.debug("concurrent load of {} already cached, discarding duplicate", key.getValue());
                return raced.workbook();
            }
            if (entries.size() >= capacity) {
                evictLeastRecentlyUsed();
            }
            entries.put(key, new CacheEntry<>(loaded, clock.incrementAndGet()));
        } finally {
            cacheLock.writeLock().unlock();
        }
        log.debug("workbook {} loaded and cached ({})", key.getValue(), path);
        return loaded;
    }

    /**
     * @param idOrAlias canonical id, alias or fork id
     * @return true if an entry was removed
     * @throws NotFoundException if the id cannot be resolved at all
     */
    public boolean closeWorkbook(String idOrAlias) {
        WorkbookId key = canonicalize(OP_CLOSE, idOrAlias);
        boolean removed = remove(key);
        log.debug("workbook {} closed (cached={})", key.getValue(), removed);
        return removed;
    }

    /**
     * Drops the entry loaded from {@code path}, typically after the file was overwritten.
     *
     * @param path workbook location
     * @return true if an entry was removed, false if none was cached
     */
    public boolean evictByPath(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        Path normalized = normalize(path);
        Optional<WorkbookId> key = findIndexedId(normalized);
        if (key.isEmpty()) {
            key = findCachedId(normalized);
        }
        if (key.isEmpty()) {
            return false;
        }
        boolean removed = remove(key.get());
        if (removed) {
            log.debug("evicted workbook {} by path {}", key.get().getValue(), path);
        }
        return removed;
    }

    // ========================================
    // resolution
    // ========================================

    /**
     * Resolution order: fork working copy, index, alias, then a workspace scan run without
     * any lock held; a scanned location is registered for later lookups.
     *
     * @param idOrAlias canonical id, alias or fork id
     * @return workbook location
     */
    public Path resolveWorkbookPath(String idOrAlias) {
        if (idOrAlias == null) {
            throw new IllegalArgumentException("idOrAlias cannot be null");
        }
        Optional<Path> fork = forkPaths.findForkPath(idOrAlias);
        if (fork.isPresent()) {
            return fork.get();
        }
        indexLock.readLock().lock();
        try {
            Path indexed = index.get(WorkbookId.of(idOrAlias));
            if (indexed != null) {
                return indexed;
            }
            WorkbookId aliased = lookupAlias(idOrAlias);
            if (aliased != null && index.containsKey(aliased)) {
                return index.get(aliased);
            }
        } finally {
            indexLock.readLock().unlock();
        }
        return scan(OP_RESOLVE, idOrAlias).path();
    }

    @Override
    public Path resolveSource(WorkbookId workbookId) {
        if (workbookId == null) {
            throw new IllegalArgumentException("workbookId cannot be null");
        }
        return resolveWorkbookPath(workbookId.getValue());
    }

    /**
     * Maps a short alias (any case) to its canonical {@code wb-} id. Canonical ids and fork
     * ids are returned as given.
     *
     * @param idOrAlias canonical id, alias or fork id
     * @return canonical id
     * @throws NotFoundException if nothing matches
     */
    public WorkbookId canonicalId(String idOrAlias) {
        return canonicalize(OP_RESOLVE, idOrAlias);
    }

    /**
     * Scans the whole workspace and registers every workbook found.
     *
     * @return located workbooks, most recently modified first
     */
    public List<LocatedWorkbook> listWorkbooks() {
        List<LocatedWorkbook> found;
        try {
            found = new ArrayList<>(locator.discover());
        } catch (IOException e) {
            throw new IoFailureException(OP_LIST, "workspace scan failed", e);
        }
        indexLock.writeLock().lock();
        try {
            for (LocatedWorkbook located : found) {
                registerLocked(located);
            }
        } finally {
            indexLock.writeLock().unlock();
        }
        found.sort(Comparator.comparing(LocatedWorkbook::modifiedAt).reversed());
        return List.copyOf(found);
    }

    // ========================================
    // stats
    // ========================================

    public CacheStats cacheStats() {
        int size;
        cacheLock.readLock().lock();
        try {
            size = entries.size();
        } finally {
            cacheLock.readLock().unlock();
        }
        return new CacheStats(operations.get(), hits.get(), misses.get(), size, capacity);
    }

    public double hitRate() {
        return cacheStats().hitRate();
    }

    /**
     * @param workbookId canonical id or fork id
     * @return true if currently resident
     */
    public boolean isCached(WorkbookId workbookId) {
        cacheLock.readLock().lock();
        try {
            return entries.containsKey(workbookId);
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    /**
     * @return resident ids, most recently used first
     */
    public List<WorkbookId> residentIds() {
        List<Map.Entry<WorkbookId, CacheEntry<H>>> snapshot;
        cacheLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(entries.entrySet());
        } finally {
            cacheLock.readLock().unlock();
        }
        snapshot.sort(Comparator.comparingLong(
            (Map.Entry<WorkbookId, CacheEntry<H>> e) -> e.getValue().lastAccess()).reversed());
        List<WorkbookId> ids = new ArrayList<>(snapshot.size());
        for (Map.Entry<WorkbookId, CacheEntry<H>> e : snapshot) {
            ids.add(e.getKey());
        }
        return ids;
    }

    // ========================================
    // internals
    // ========================================

    private WorkbookId canonicalize(String operation, String idOrAlias) {
        if (idOrAlias == null) {
            throw new IllegalArgumentException("idOrAlias cannot be null");
        }
        if (forkPaths.findForkPath(idOrAlias).isPresent()) {
            return WorkbookId.of(idOrAlias);
        }
        WorkbookId candidate = WorkbookId.of(idOrAlias);
        indexLock.readLock().lock();
        try {
            if (index.containsKey(candidate)) {
                return candidate;
            }
            WorkbookId aliased = lookupAlias(idOrAlias);
            if (aliased != null) {
                return aliased;
            }
        } finally {
            indexLock.readLock().unlock();
        }
        return scan(operation, idOrAlias).workbookId();
    }

    /**
     * Caller holds the index lock (read or write).
     */
    private WorkbookId lookupAlias(String alias) {
        WorkbookId mapped = aliases.get(alias);
        if (mapped == null) {
            mapped = aliases.get(alias.toLowerCase(Locale.ROOT));
        }
        return mapped;
    }

    private Path resolvePath(String operation, WorkbookId key) {
        Optional<Path> fork = forkPaths.findForkPath(key.getValue());
        if (fork.isPresent()) {
            return fork.get();
        }
        indexLock.readLock().lock();
        try {
            Path indexed = index.get(key);
            if (indexed != null) {
                return indexed;
            }
        } finally {
            indexLock.readLock().unlock();
        }
        return scan(operation, key.getValue()).path();
    }

    private LocatedWorkbook scan(String operation, String idOrAlias) {
        log.debug("scanning workspace for {}", idOrAlias);
        Optional<LocatedWorkbook> located;
        try {
            located = locator.locate(idOrAlias);
        } catch (IOException e) {
            throw new IoFailureException(operation, "workspace scan failed for " + idOrAlias, e);
        }
        LocatedWorkbook found = located.orElseThrow(() -> NotFoundException.workbook(operation, idOrAlias));
        indexLock.writeLock().lock();
        try {
            registerLocked(found);
        } finally {
            indexLock.writeLock().unlock();
        }
        return found;
    }

    private void registerLocked(LocatedWorkbook located) {
        index.put(located.workbookId(), normalize(located.path()));
        aliases.put(located.shortId().toLowerCase(Locale.ROOT), located.workbookId());
        log.debug("registered workbook {} (alias {}) at {}",
            located.workbookId().getValue(), located.shortId(), located.path());
    }

    private String shortIdFor(WorkbookId key) {
        return key.getValue().startsWith(WorkbookIds.PREFIX) ? WorkbookIds.shortIdOf(key) : key.getValue();
    }

    private Optional<WorkbookId> findIndexedId(Path path) {
        indexLock.readLock().lock();
        try {
            for (Map.Entry<WorkbookId, Path> e : index.entrySet()) {
                if (e.getValue().equals(path)) {
                    return Optional.of(e.getKey());
                }
            }
            return Optional.empty();
        } finally {
            indexLock.readLock().unlock();
        }
    }

    private Optional<WorkbookId> findCachedId(Path path) {
        cacheLock.readLock().lock();
        try {
            for (Map.Entry<WorkbookId, CacheEntry<H>> e : entries.entrySet()) {
                if (normalize(e.getValue().workbook().path()).equals(path)) {
                    return Optional.of(e.getKey());
                }
            }
            return Optional.empty();
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    private boolean remove(WorkbookId key) {
        cacheLock.writeLock().lock();
        try {
            return entries.remove(key) != null;
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    /**
     * Caller holds the write lock.
     */
    private void evictLeastRecentlyUsed() {
        WorkbookId victim = null;
        long oldest = Long.MAX_VALUE;
        for (Map.Entry<WorkbookId, CacheEntry<H>> e : entries.entrySet()) {
            long stamp = e.getValue().lastAccess();
            if (stamp < oldest) {
                oldest = stamp;
                victim = e.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            log.debug("evicted least recently used workbook {}", victim.getValue());
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
