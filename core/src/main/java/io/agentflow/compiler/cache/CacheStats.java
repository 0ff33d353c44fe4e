package io.agentflow.compiler.cache;

/**
 * Counters of a {@link CompilationCache}.
 *
 * @param hits      lookups answered from stored results
 * @param misses    lookups that ran the pipeline
 * @param coalesced lookups that waited for another caller's run of the same key
 * @param evictions entries dropped to stay within capacity
 * @param size      entries currently stored
 */
public record CacheStats(long hits, long misses, long coalesced, long evictions, int size) {}
