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

package com.axonops.fsmregex.metrics;

/**
 * Metric name constants, relative to the prefix of the configured registry.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Cache Hit Rate:</b> PATTERNS_CACHE_HITS / (PATTERNS_CACHE_HITS + PATTERNS_CACHE_MISSES)
 *   <li><b>Search Cost:</b> MATCHING_PARTIAL_MATCH_LATENCY grows with the square of the input
 *       length in the worst case; compare it with MATCHING_FULL_MATCH_LATENCY
 *   <li><b>Eviction Balance:</b> CACHE_EVICTIONS_IDLE should dominate CACHE_EVICTIONS_LRU once the
 *       cache is sized for the workload
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.fsmregex.cache.PatternCache
 * @see com.axonops.fsmregex.api.Pattern
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation
  // ========================================

  /** Counter: patterns compiled into automata (cache misses that succeeded). */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /** Counter: compile requests answered from the cache. */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /** Counter: compile requests that had to build an automaton. */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /** Timer: pattern to automaton compilation time. */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /** Histogram: automaton states per compiled pattern, start and termination included. */
  public static final String PATTERNS_AUTOMATON_STATES = "patterns.automaton.states";

  // ========================================
  // Cache
  // ========================================

  /** Gauge: patterns currently cached. */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  /** Gauge: automaton states held by all cached patterns. */
  public static final String CACHE_STATES_COUNT = "cache.automaton.states.current.count";

  /** Counter: patterns evicted because the cache exceeded its size. */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /** Counter: patterns evicted after sitting unused past the idle timeout. */
  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========================================
  // Matching
  // ========================================

  /** Counter: matching operations of every kind; bulk calls count once per input. */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /** Timer: latency of every matching operation (per input for bulk calls). */
  public static final String MATCHING_LATENCY = "matching.latency";

  /** Timer: anchored full-match latency. */
  public static final String MATCHING_FULL_MATCH_LATENCY = "matching.full_match.latency";

  /** Timer: substring search latency. */
  public static final String MATCHING_PARTIAL_MATCH_LATENCY = "matching.partial_match.latency";

  /**
   * Histogram: start offsets one substring search tried, which is the matching offset plus one, or
   * the input length when nothing matched.
   */
  public static final String MATCHING_SEARCH_ATTEMPTS = "matching.search.attempts";

  /** Counter: bulk calls (matchAll, findAll, filter, filterNot). */
  public static final String MATCHING_BULK_OPERATIONS = "matching.bulk.operations.total.count";

  /** Counter: inputs processed by bulk calls. */
  public static final String MATCHING_BULK_ITEMS = "matching.bulk.items.total.count";

  /** Timer: per-input latency of bulk calls. */
  public static final String MATCHING_BULK_LATENCY = "matching.bulk.latency";

  // ========================================
  // Errors
  // ========================================

  /** Counter: patterns rejected by the compiler. */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";
}
