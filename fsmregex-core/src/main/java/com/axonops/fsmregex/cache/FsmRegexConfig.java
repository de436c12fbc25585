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

import com.axonops.fsmregex.metrics.FsmRegexMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the pattern cache, compilation limits and metrics.
 *
 * <p>Immutable; validated on construction.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>Compiled patterns are cached by pattern string. Two eviction rules keep the cache bounded:
 *
 * <ol>
 *   <li><b>LRU Eviction</b> - When the cache exceeds {@code maxCacheSize}, least-recently-used
 *       patterns are evicted
 *   <li><b>Idle Eviction</b> - A background thread scans every {@code evictionScanIntervalSeconds}
 *       and evicts patterns unused for {@code idleTimeoutSeconds}
 * </ol>
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults (50K cache, 5min idle, metrics disabled)
 * FsmRegexConfig config = FsmRegexConfig.DEFAULT;
 *
 * // Smaller cache with Dropwizard metrics
 * FsmRegexConfig config = FsmRegexConfig.builder()
 *     .maxCacheSize(1_000)
 *     .idleTimeoutSeconds(60)
 *     .evictionScanIntervalSeconds(15)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regex"))
 *     .build();
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * @param cacheEnabled whether compiled patterns are cached
 * @param maxCacheSize maximum cached patterns (ignored when the cache is disabled)
 * @param idleTimeoutSeconds unused time after which a pattern is evicted (ignored when disabled)
 * @param evictionScanIntervalSeconds idle scan period (ignored when disabled)
 * @param maxPatternLength longest pattern accepted by the compiler
 * @param metricsRegistry metrics sink
 * @since 1.0.0
 */
public record FsmRegexConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    int maxPatternLength,
    FsmRegexMetricsRegistry metricsRegistry) {

  /** Default configuration: cache on, 50K patterns, 5 minute idle timeout, no metrics. */
  public static final FsmRegexConfig DEFAULT =
      new FsmRegexConfig(
          true, // Cache enabled
          50000, // Max 50K cached patterns
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          10000, // Max pattern length
          FsmRegexMetricsRegistry.NONE);

  /** Configuration with caching disabled; every compile builds a new automaton. */
  public static final FsmRegexConfig NO_CACHE =
      new FsmRegexConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          10000, // Still enforce pattern length
          FsmRegexMetricsRegistry.NONE);

  /** Compact constructor with validation. */
  public FsmRegexConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (maxPatternLength <= 0) {
      throw new IllegalArgumentException("maxPatternLength must be positive");
    }

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException("idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds ("
                + evictionScanIntervalSeconds
                + "s) must be <= idleTimeoutSeconds ("
                + idleTimeoutSeconds
                + "s)");
      }
    }
  }

  /** Creates a builder starting from the {@link #DEFAULT} values. */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link FsmRegexConfig}. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 50000;
    private long idleTimeoutSeconds = 300;
    private long evictionScanIntervalSeconds = 60;
    private int maxPatternLength = 10000;
    private FsmRegexMetricsRegistry metricsRegistry = FsmRegexMetricsRegistry.NONE;

    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    public Builder maxPatternLength(int length) {
      this.maxPatternLength = length;
      return this;
    }

    public Builder metricsRegistry(FsmRegexMetricsRegistry registry) {
      this.metricsRegistry = registry;
      return this;
    }

    public FsmRegexConfig build() {
      return new FsmRegexConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          maxPatternLength,
          metricsRegistry);
    }
  }
}
