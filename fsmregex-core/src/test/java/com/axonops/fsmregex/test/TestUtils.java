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

package com.axonops.fsmregex.test;

import com.axonops.fsmregex.api.Pattern;
import com.axonops.fsmregex.cache.FsmRegexConfig;
import com.axonops.fsmregex.cache.PatternCache;
import com.axonops.fsmregex.metrics.DropwizardMetricsAdapter;
import com.axonops.fsmregex.metrics.FsmRegexMetricsRegistry;
import com.codahale.metrics.MetricRegistry;

/**
 * Runs a test against its own global pattern cache.
 *
 * <pre>{@code
 * try (TestUtils.CacheScope scope = TestUtils.useCache(TestUtils.testConfigBuilder().maxCacheSize(3).build())) {
 *     Pattern.compile("a+");
 *     assertThat(scope.statistics().size()).isEqualTo(1);
 * }
 * }</pre>
 */
public final class TestUtils {
    private TestUtils() {
    }

    /**
     * Config for tests: a few thousand cached automata, a scan interval well under the idle
     * timeout, no metrics.
     */
    public static FsmRegexConfig.Builder testConfigBuilder() {
        return FsmRegexConfig.builder()
            .maxCacheSize(5000)
            .idleTimeoutSeconds(60)
            .evictionScanIntervalSeconds(15)
            .metricsRegistry(FsmRegexMetricsRegistry.NONE);
    }

    public static FsmRegexConfig.Builder testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder().metricsRegistry(new DropwizardMetricsAdapter(registry, prefix));
    }

    /**
     * Installs a fresh global cache built from {@code config} until the scope is closed.
     */
    public static CacheScope useCache(FsmRegexConfig config) {
        PatternCache previous = Pattern.getGlobalCache();
        PatternCache scoped = new PatternCache(config);
        Pattern.setGlobalCache(scoped);
        return new CacheScope(previous, scoped);
    }

    /** Shuts the scoped cache down and puts the previous global cache back on close. */
    public static final class CacheScope implements AutoCloseable {
        private final PatternCache previous;
        private final PatternCache scoped;

        private CacheScope(PatternCache previous, PatternCache scoped) {
            this.previous = previous;
            this.scoped = scoped;
        }

        public PatternCache cache() {
            return scoped;
        }

        public PatternCache.Statistics statistics() {
            return scoped.getStatistics();
        }

        @Override
        public void close() {
            // Tests may have reconfigured or replaced the global cache; shut down whatever is there
            PatternCache current = Pattern.getGlobalCache();
            if (current != scoped && current != previous) {
                current.shutdown();
            }
            scoped.shutdown();
            Pattern.setGlobalCache(previous);
        }
    }
}
