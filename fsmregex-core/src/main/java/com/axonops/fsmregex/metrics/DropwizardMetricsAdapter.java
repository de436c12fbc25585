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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link FsmRegexMetricsRegistry} backed by a Dropwizard {@link MetricRegistry}.
 *
 * <p>Each engine metric maps onto one Dropwizard type named {@code <prefix>.<name>}:
 * <ul>
 *   <li>counters such as {@link MetricNames#PATTERNS_COMPILED} become {@code Counter}s</li>
 *   <li>latencies such as {@link MetricNames#MATCHING_PARTIAL_MATCH_LATENCY} become
 *       {@code Timer}s</li>
 *   <li>size samples ({@link MetricNames#PATTERNS_AUTOMATON_STATES},
 *       {@link MetricNames#MATCHING_SEARCH_ATTEMPTS}) become {@code Histogram}s</li>
 *   <li>cache gauges become {@code Gauge}s read on demand</li>
 * </ul>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * FsmRegexMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.regex");
 * // -> com.myapp.regex.patterns.automaton.states, com.myapp.regex.matching.latency, ...
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements FsmRegexMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.fsmregex";

    private final MetricRegistry registry;
    private final String prefix;

    // Engine names are a small fixed set; resolve each full name once
    private final Map<String, String> fullNames = new ConcurrentHashMap<>();

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry registry that receives every metric
     * @param prefix prepended to every {@link MetricNames} name, e.g. {@code "com.myapp.regex"}
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(fullName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(fullName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordValue(String name, long value) {
        registry.histogram(fullName(name)).update(value);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String gaugeName = fullName(name);
        // A reconfigured cache registers the same gauge again
        registry.remove(gaugeName);
        registry.register(gaugeName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(fullName(name));
    }

    public MetricRegistry registry() {
        return registry;
    }

    public String prefix() {
        return prefix;
    }

    private String fullName(String name) {
        return fullNames.computeIfAbsent(name, n -> MetricRegistry.name(prefix, n));
    }
}
