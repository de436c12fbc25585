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

package com.axonops.fsmregex.dropwizard;

import com.axonops.fsmregex.cache.FsmRegexConfig;
import com.axonops.fsmregex.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds an {@link FsmRegexConfig} that reports into a Dropwizard {@link MetricRegistry}.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * FsmRegexConfig config = FsmRegexMetricsConfig.withMetrics(registry, "com.mycompany.search.regex");
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * <p>Unless disabled, a {@link JmxReporter} is started for the registry the first time this
 * class is used, so every metric is also visible as an MBean in the {@code metrics} domain.
 * Only one reporter is ever started per JVM and it stays bound to that first registry; later
 * registries are reported to but not exposed via JMX. Call {@link #shutdown()} to release it.
 *
 * @since 1.0.0
 */
public final class FsmRegexMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(FsmRegexMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;
    private static volatile MetricRegistry jmxRegistry;

    private FsmRegexMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config with Dropwizard metrics under {@link DropwizardMetricsAdapter#DEFAULT_PREFIX}
     * and JMX exposure.
     *
     * @param registry the registry to report into
     * @return default config with metrics enabled
     */
    public static FsmRegexConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config with Dropwizard metrics and JMX exposure.
     *
     * @param registry the registry to report into
     * @param metricPrefix namespace prepended to every metric name
     * @return default config with metrics enabled
     */
    public static FsmRegexConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config with Dropwizard metrics.
     *
     * @param registry the registry to report into
     * @param metricPrefix namespace prepended to every metric name
     * @param enableJmx whether to start a JmxReporter for the registry
     * @return default config with metrics enabled
     */
    public static FsmRegexConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builder(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Starts a config builder that already carries the Dropwizard registry, for callers that also
     * want to tune cache settings.
     *
     * @param registry the registry to report into
     * @param metricPrefix namespace prepended to every metric name
     * @param enableJmx whether to start a JmxReporter for the registry
     * @return builder with the metrics registry set
     */
    public static FsmRegexConfig.Builder builder(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return FsmRegexConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter != null) {
            if (jmxRegistry != registry) {
                logger.debug("FsmRegex: JmxReporter already bound to another MetricRegistry - "
                    + "metrics of this registry are not exposed via JMX");
            }
            return;
        }
        try {
            jmxReporter = JmxReporter.forRegistry(registry).build();
            jmxReporter.start();
            jmxRegistry = registry;
            logger.info("FsmRegex: JmxReporter started - metrics available via JMX");
        } catch (RuntimeException e) {
            // Not fatal: metrics still reach the registry
            jmxReporter = null;
            jmxRegistry = null;
            logger.warn("FsmRegex: Failed to start JmxReporter (may already be configured)", e);
        }
    }

    /**
     * Tests whether the JMX reporter started by this class exposes {@code registry}.
     */
    static boolean isExposedViaJmx(MetricRegistry registry) {
        return jmxReporter != null && jmxRegistry == registry;
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("FsmRegex: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
            jmxRegistry = null;
        }
    }
}
