/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.fsmregex.cache;

import com.axonops.fsmregex.api.Pattern;
import com.axonops.fsmregex.metrics.FsmRegexMetricsRegistry;
import com.axonops.fsmregex.metrics.MetricNames;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled patterns keyed by pattern string.
 *
 * <p>A cached {@link Pattern} is an immutable automaton, so it can be handed to any number of
 * threads and dropping it from the cache never affects callers that still hold it. Two rules keep
 * the cache bounded:
 *
 * <ul>
 *   <li>size: an insert that pushes the cache past {@code maxCacheSize} evicts the least recently
 *       used entries before returning
 *   <li>idle time: a daemon scheduler drops entries unused for {@code idleTimeoutSeconds}, checking
 *       every {@code evictionScanIntervalSeconds}
 * </ul>
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private volatile FsmRegexConfig config;
  private volatile ConcurrentHashMap<String, Entry> entries;
  private volatile ScheduledExecutorService idleScanner;

  private final Object evictionLock = new Object();

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong lruEvictions = new AtomicLong();
  private final AtomicLong idleEvictions = new AtomicLong();

  public PatternCache(FsmRegexConfig config) {
    this.config = config;
    start(config);
  }

  public FsmRegexConfig getConfig() {
    return config;
  }

  /**
   * Returns the cached pattern for {@code patternString}, compiling it on a miss.
   *
   * <p>Each key is compiled by one thread at most; concurrent callers for the same key wait for
   * that compilation and share its result. A compiler that throws leaves the cache unchanged.
   *
   * @param patternString cache key
   * @param compiler invoked on a miss
   * @return the shared compiled pattern
   */
  public Pattern getOrCompile(String patternString, Supplier<Pattern> compiler) {
    FsmRegexMetricsRegistry metrics = config.metricsRegistry();
    ConcurrentHashMap<String, Entry> current = entries;

    if (current == null) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    Entry entry = current.get(patternString);
    if (entry != null) {
      entry.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      return entry.pattern;
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    entry = current.computeIfAbsent(patternString, k -> new Entry(compiler.get()));

    if (current.size() > config.maxCacheSize()) {
      trimToSize(current, patternString);
    }
    return entry.pattern;
  }

  private void trimToSize(ConcurrentHashMap<String, Entry> current, String justAdded) {
    synchronized (evictionLock) {
      int excess = current.size() - config.maxCacheSize();
      if (excess <= 0) {
        return;
      }

      Map.Entry<String, Entry>[] victims = current.entrySet().stream()
          .filter(e -> !e.getKey().equals(justAdded))
          .sorted(Comparator.comparingLong(e -> e.getValue().lastUsedNanos.get()))
          .limit(excess)
          .toArray(Map.Entry[]::new);

      int removed = 0;
      for (Map.Entry<String, Entry> victim : victims) {
        if (current.remove(victim.getKey(), victim.getValue())) {
          removed++;
        }
      }
      lruEvictions.addAndGet(removed);
      config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU, removed);
      logger.debug("FsmRegex: LRU eviction - evicted: {}, cacheSize: {}/{}",
          removed, current.size(), config.maxCacheSize());
    }
  }

  /**
   * Drops every entry unused for longer than the idle timeout. Runs on the scheduler and may also
   * be called directly.
   *
   * @return number of entries dropped
   */
  public int evictIdlePatterns() {
    ConcurrentHashMap<String, Entry> current = entries;
    if (current == null) {
      return 0;
    }

    long cutoffNanos = System.nanoTime() - TimeUnit.SECONDS.toNanos(config.idleTimeoutSeconds());
    int removed = 0;
    for (Map.Entry<String, Entry> e : current.entrySet()) {
      if (e.getValue().lastUsedNanos.get() < cutoffNanos && current.remove(e.getKey(), e.getValue())) {
        removed++;
      }
    }

    if (removed > 0) {
      idleEvictions.addAndGet(removed);
      config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE, removed);
      logger.debug("FsmRegex: Idle eviction - evicted: {}, cacheSize: {}", removed, current.size());
    }
    return removed;
  }

  /** Takes a consistent-enough snapshot of the counters and the cached automata. */
  public Statistics getStatistics() {
    ConcurrentHashMap<String, Entry> current = entries;
    int size = 0;
    long states = 0;
    if (current != null) {
      for (Entry entry : current.values()) {
        size++;
        states += entry.pattern.stateCount();
      }
    }
    return new Statistics(
        hits.get(),
        misses.get(),
        lruEvictions.get(),
        idleEvictions.get(),
        size,
        config.cacheEnabled() ? config.maxCacheSize() : 0,
        states);
  }

  /** Drops every entry. Patterns already handed out stay usable. */
  public void clear() {
    ConcurrentHashMap<String, Entry> current = entries;
    if (current != null) {
      logger.debug("FsmRegex: Clearing cache - {} cached patterns", current.size());
      current.clear();
    }
  }

  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    lruEvictions.set(0);
    idleEvictions.set(0);
  }

  /** {@link #clear()} plus {@link #resetStatistics()}. */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Swaps in a new configuration: stops the scanner, empties the cache, zeroes the counters and
   * starts again under {@code newConfig}. Gauges move to the new metrics registry.
   */
  public synchronized void reconfigure(FsmRegexConfig newConfig) {
    logger.info("FsmRegex: Reconfiguring cache");
    stopScanner();
    reset();
    unregisterGauges(config.metricsRegistry());

    this.config = newConfig;
    start(newConfig);
  }

  /** Stops the idle scanner and empties the cache. */
  public synchronized void shutdown() {
    logger.info("FsmRegex: Shutting down cache");
    stopScanner();
    clear();
  }

  boolean isEvictionTaskRunning() {
    ScheduledExecutorService scanner = idleScanner;
    return scanner != null && !scanner.isShutdown();
  }

  private void start(FsmRegexConfig cfg) {
    if (!cfg.cacheEnabled()) {
      entries = null;
      idleScanner = null;
      logger.info("FsmRegex: Pattern caching disabled");
      return;
    }

    entries = new ConcurrentHashMap<>(Math.min(cfg.maxCacheSize(), 1024));

    idleScanner = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "FsmRegex-IdleEviction");
      t.setDaemon(true);
      t.setPriority(Thread.MIN_PRIORITY);
      return t;
    });
    long interval = cfg.evictionScanIntervalSeconds();
    idleScanner.scheduleWithFixedDelay(this::scanQuietly, interval, interval, TimeUnit.SECONDS);

    cfg.metricsRegistry().registerGauge(MetricNames.CACHE_PATTERNS_COUNT, () -> getStatistics().size());
    cfg.metricsRegistry().registerGauge(MetricNames.CACHE_STATES_COUNT, () -> getStatistics().cachedStates());

    logger.debug("FsmRegex: Pattern cache initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s",
        cfg.maxCacheSize(), cfg.idleTimeoutSeconds(), interval);
  }

  // A task that throws is never rescheduled, so scan failures are logged here
  private void scanQuietly() {
    try {
      evictIdlePatterns();
    } catch (RuntimeException e) {
      logger.error("FsmRegex: Idle eviction scan failed", e);
    }
  }

  private void stopScanner() {
    ScheduledExecutorService scanner = idleScanner;
    if (scanner != null) {
      scanner.shutdownNow();
      idleScanner = null;
    }
  }

  private static void unregisterGauges(FsmRegexMetricsRegistry metrics) {
    metrics.removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    metrics.removeGauge(MetricNames.CACHE_STATES_COUNT);
  }

  private static final class Entry {
    final Pattern pattern;
    final AtomicLong lastUsedNanos = new AtomicLong(System.nanoTime());

    Entry(Pattern pattern) {
      this.pattern = pattern;
    }

    void touch() {
      lastUsedNanos.set(System.nanoTime());
    }
  }

  /**
   * Point-in-time view of a {@link PatternCache}.
   *
   * @param hits lookups answered from the cache
   * @param misses lookups that compiled (every lookup when caching is disabled)
   * @param lruEvictions entries dropped to stay within {@code capacity}
   * @param idleEvictions entries dropped by the idle scan
   * @param size entries currently cached
   * @param capacity configured maximum, 0 when caching is disabled
   * @param cachedStates automaton states held by the cached patterns, start and termination
   *     included
   */
  public record Statistics(
      long hits,
      long misses,
      long lruEvictions,
      long idleEvictions,
      int size,
      int capacity,
      long cachedStates) {

    /** Share of lookups served from the cache, 0.0 before the first lookup. */
    public double hitRate() {
      long lookups = hits + misses;
      return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    /** Mean automaton size of the cached patterns, 0.0 for an empty cache. */
    public double meanStatesPerPattern() {
      return size == 0 ? 0.0 : (double) cachedStates / size;
    }
  }
}
