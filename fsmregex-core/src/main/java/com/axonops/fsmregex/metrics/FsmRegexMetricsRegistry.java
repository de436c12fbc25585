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

import java.util.function.Supplier;

/**
 * Sink for the engine's counters, timers, histograms and gauges.
 *
 * <p>Every method defaults to doing nothing, so an implementation overrides only the metric kinds
 * it records. {@link #NONE} is the registry used when metrics are not configured. Names come from
 * {@link MetricNames}.
 *
 * @since 1.0.0
 */
public interface FsmRegexMetricsRegistry {

    /** Registry that records nothing. */
    FsmRegexMetricsRegistry NONE = new FsmRegexMetricsRegistry() {
        @Override
        public String toString() {
            return "FsmRegexMetricsRegistry.NONE";
        }
    };

    default void incrementCounter(String name) {
        incrementCounter(name, 1);
    }

    /**
     * @param delta non-negative amount
     */
    default void incrementCounter(String name, long delta) {
    }

    /**
     * Records a duration, e.g. the time to compile one pattern or search one input.
     */
    default void recordTimer(String name, long durationNanos) {
    }

    /**
     * Records one sample of a size distribution, e.g. the automaton states of a compiled pattern
     * or the start offsets tried by one search.
     */
    default void recordValue(String name, long value) {
    }

    /**
     * Registers a gauge read on demand, replacing any gauge under the same name.
     *
     * @param valueSupplier called on every read; must not block
     */
    default void registerGauge(String name, Supplier<Number> valueSupplier) {
    }

    /** No-op when no gauge is registered under the name. */
    default void removeGauge(String name) {
    }
}
