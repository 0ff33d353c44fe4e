package io.agentflow.compiler.cache;

import io.agentflow.compiler.model.CompilationResult;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least-recently-used cache of successful compilations, keyed by content hash.
 *
 * <p>
 * Results with error diagnostics are handed back to the caller but never stored, so a fixed
 * file is always recompiled. Concurrent lookups of the same uncached key are coalesced: one
 * caller runs the pipeline and the others wait for and share its outcome, including a failure.
 *
 * <p>
 * Thread-safe. Recency comes from the injected {@link Clock}; entries with equal timestamps
 * are ordered by access.
 */
public final class CompilationCache {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationCache.class);

    private final int capacity;
    private final Clock clock;
    private final Object lock = new Object();
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ConcurrentHashMap<String, CompletableFuture<CompilationResult>> inFlight =
            new ConcurrentHashMap<>();

    private long hits;
    private long misses;
    private long coalesced;
    private long evictions;

    /** A stored result and the instant it was last returned. */
    private static final class Entry {
        private final CompilationResult result;
        private Instant lastAccess;

        private Entry(CompilationResult result, Instant lastAccess) {
            this.result = result;
            this.lastAccess = lastAccess;
        }
    }

    public CompilationCache(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CompilationCache(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    /**
     * Cache key of a source text: hex SHA-256 over the text normalised to end with a newline,
     * followed by the file id, which determines the generated class name.
     */
    public static String key(String sourceText, String fileId) {
        String normalized = sourceText.endsWith("\n") ? sourceText : sourceText + "\n";
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        digest.update(normalized.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(fileId.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Returns the stored result for {@code key}, or runs {@code compile} once and stores its
     * result if it has no errors.
     *
     * @throws RuntimeException whatever {@code compile} throws, for the caller that ran it and
     *                          for every caller that waited on it
     */
    public CompilationResult getOrCompile(String key, Supplier<CompilationResult> compile) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(compile, "compile must not be null");
        CompilationResult stored = lookup(key);
        if (stored != null) {
            return stored;
        }
        CompletableFuture<CompilationResult> mine = new CompletableFuture<>();
        CompletableFuture<CompilationResult> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            synchronized (lock) {
                coalesced++;
            }
            LOG.debug("Cache wait: key={}", key);
            return await(running);
        }
        try {
            // A run that finished between the lookup and the claim has already stored its result.
            stored = lookup(key);
            if (stored != null) {
                mine.complete(stored);
                return stored;
            }
            synchronized (lock) {
                misses++;
            }
            LOG.debug("Cache miss: key={}", key);
            CompilationResult result = compile.get();
            if (result.isSuccess()) {
                store(key, result);
            }
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private CompilationResult lookup(String key) {
        synchronized (lock) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            entry.lastAccess = clock.instant();
            hits++;
            LOG.debug("Cache hit: key={}, file={}", key, entry.result.fileId());
            return entry.result;
        }
    }

    private void store(String key, CompilationResult result) {
        synchronized (lock) {
            entries.put(key, new Entry(result, clock.instant()));
            while (entries.size() > capacity) {
                evictLeastRecentlyUsed();
            }
        }
    }

    private void evictLeastRecentlyUsed() {
        String victim = null;
        Instant oldest = null;
        for (Map.Entry<String, Entry> candidate : entries.entrySet()) {
            Instant access = candidate.getValue().lastAccess;
            if (oldest == null || access.isBefore(oldest)) {
                victim = candidate.getKey();
                oldest = access;
            }
        }
        Entry removed = entries.remove(victim);
        evictions++;
        LOG.info("Evicted cache entry: key={}, file={}, idle_ms={}, capacity={}",
                victim, removed.result.fileId(), Duration.between(oldest, clock.instant()).toMillis(), capacity);
    }

    private static CompilationResult await(CompletableFuture<CompilationResult> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /** Drops one entry; returns whether it was present. */
    public boolean invalidate(String key) {
        synchronized (lock) {
            return entries.remove(key) != null;
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public boolean contains(String key) {
        synchronized (lock) {
            return entries.containsKey(key);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public CacheStats stats() {
        synchronized (lock) {
            return new CacheStats(hits, misses, coalesced, evictions, entries.size());
        }
    }

    @Override
    public String toString() {
        return "CompilationCache[" + stats() + ", capacity=" + capacity + "]";
    }
}
