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

package com.axonops.fsmregex.api;

import com.axonops.fsmregex.cache.FsmRegexConfig;
import com.axonops.fsmregex.cache.PatternCache;
import com.axonops.fsmregex.metrics.FsmRegexMetricsRegistry;
import com.axonops.fsmregex.metrics.MetricNames;
import com.axonops.fsmregex.nfa.AutomatonMatcher;
import com.axonops.fsmregex.nfa.PatternCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A compiled pattern.
 *
 * <p>Grammar: literal characters, {@code .} (any character), bracketed classes with ranges such
 * as {@code [a-z0-9]}, and the postfix quantifiers {@code *} and {@code +} on the preceding atom.
 * There is no escaping, grouping, alternation or anchoring syntax.
 *
 * <p>Thread-safe: the compiled automaton is immutable and every match runs in its own simulation,
 * so one Pattern can serve any number of threads and consecutive calls never influence each
 * other.
 *
 * <p>Patterns from {@link #compile(String)} are cached by pattern string; see
 * {@link PatternCache}.
 *
 * @since 1.0.0
 */
public final class Pattern {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    // Global pattern cache (mutable for testing only)
    private static volatile PatternCache cache = new PatternCache(FsmRegexConfig.DEFAULT);

    private final String patternString;
    private final AutomatonMatcher engine;

    private Pattern(String patternString, AutomatonMatcher engine) {
        this.patternString = patternString;
        this.engine = engine;
    }

    /**
     * Compiles a pattern, returning the cached instance when there is one.
     *
     * @param pattern pattern string; the empty pattern matches only the empty string
     * @return compiled pattern
     * @throws PatternCompilationException if the pattern is malformed or too long
     * @throws NullPointerException if pattern is null
     */
    public static Pattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return cache.getOrCompile(pattern, () -> doCompile(pattern));
    }

    /**
     * Compiles a pattern without using the cache.
     *
     * @param pattern pattern string
     * @return a new, uncached pattern
     */
    public static Pattern compileWithoutCache(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return doCompile(pattern);
    }

    private static Pattern doCompile(String pattern) {
        FsmRegexConfig config = cache.getConfig();
        FsmRegexMetricsRegistry metrics = config.metricsRegistry();

        try {
            if (pattern.length() > config.maxPatternLength()) {
                throw new PatternCompilationException(pattern,
                    "Pattern length " + pattern.length() + " exceeds maximum " + config.maxPatternLength());
            }

            long startNanos = System.nanoTime();
            AutomatonMatcher engine = new AutomatonMatcher(PatternCompiler.compile(pattern));
            long durationNanos = System.nanoTime() - startNanos;

            int states = engine.automaton().stateCount();
            metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);
            metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
            metrics.recordValue(MetricNames.PATTERNS_AUTOMATON_STATES, states);

            logger.trace("FsmRegex: Pattern compiled - length: {}, states: {}, took: {}ns",
                pattern.length(), states, durationNanos);
            return new Pattern(pattern, engine);
        } catch (PatternCompilationException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("FsmRegex: Pattern compilation failed - length: {}, index: {}",
                pattern.length(), e.getIndex());
            throw e;
        }
    }

    public Matcher matcher(String input) {
        return new Matcher(this, input);
    }

    /**
     * Tests whether the entire input matches this pattern.
     *
     * @param input text to test
     * @return true if the whole input matches
     */
    public boolean matches(String input) {
        return matcher(input).matches();
    }

    /**
     * Tests whether some substring of the input matches this pattern.
     *
     * @param input text to search
     * @return true if a match exists anywhere in the input
     */
    public boolean find(String input) {
        return matcher(input).find();
    }

    boolean fullMatch(String input) {
        long startNanos = System.nanoTime();
        boolean result = engine.matches(input);
        long durationNanos = System.nanoTime() - startNanos;

        FsmRegexMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);
        metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, durationNanos);
        return result;
    }

    boolean partialMatch(String input) {
        long startNanos = System.nanoTime();
        int offset = engine.findOffset(input);
        long durationNanos = System.nanoTime() - startNanos;

        FsmRegexMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);
        metrics.recordTimer(MetricNames.MATCHING_PARTIAL_MATCH_LATENCY, durationNanos);
        metrics.recordValue(MetricNames.MATCHING_SEARCH_ATTEMPTS, searchAttempts(offset, input));
        return offset >= 0;
    }

    private static int searchAttempts(int offset, String input) {
        return offset >= 0 ? offset + 1 : input.length();
    }

    /**
     * Full-matches every input.
     *
     * <p><b>Example:</b>
     * <pre>{@code
     * Pattern ids = Pattern.compile("[a-z]+[0-9]+");
     * boolean[] results = ids.matchAll(List.of("abc123", "123abc", "x9"));
     * // results = [true, false, true]
     * }</pre>
     *
     * @param inputs collection of strings to match (List, Set, Queue, etc.)
     * @return boolean array parallel to inputs (same size and iteration order)
     * @throws NullPointerException if inputs or any element is null
     * @throws IllegalArgumentException if the collection holds non-String elements
     * @see #filter(Collection) to extract only matching elements
     */
    public boolean[] matchAll(Collection<String> inputs) {
        return matchAll(toArray(inputs));
    }

    /**
     * Full-matches every input (array variant).
     *
     * @param inputs array of strings to match
     * @return boolean array parallel to inputs
     * @throws NullPointerException if inputs or any element is null
     */
    public boolean[] matchAll(String[] inputs) {
        return bulk(inputs, false);
    }

    /**
     * Searches every input for a matching substring.
     *
     * <p><b>Example:</b>
     * <pre>{@code
     * Pattern errors = Pattern.compile("ERR[0-9]+");
     * boolean[] results = errors.findAll(new String[] {"boot ok", "disk ERR42 at 10:00"});
     * // results = [false, true]
     * }</pre>
     *
     * @param inputs array of strings to search
     * @return boolean array parallel to inputs
     * @throws NullPointerException if inputs or any element is null
     * @see #matchAll(String[]) full-match variant
     */
    public boolean[] findAll(String[] inputs) {
        return bulk(inputs, true);
    }

    /**
     * Searches every input for a matching substring (collection variant).
     *
     * @param inputs collection of strings to search
     * @return boolean array parallel to inputs
     */
    public boolean[] findAll(Collection<String> inputs) {
        return findAll(toArray(inputs));
    }

    /**
     * Returns the inputs that fully match, in input order. The collection is not modified.
     *
     * @param inputs collection to filter
     * @return new list of matching elements
     * @see #filterNot(Collection) inverse operation
     */
    public List<String> filter(Collection<String> inputs) {
        return select(inputs, true);
    }

    /**
     * Returns the inputs that do NOT fully match, in input order. The collection is not modified.
     *
     * @param inputs collection to filter
     * @return new list of non-matching elements
     * @see #filter(Collection) inverse operation
     */
    public List<String> filterNot(Collection<String> inputs) {
        return select(inputs, false);
    }

    private List<String> select(Collection<String> inputs, boolean keepMatches) {
        String[] array = toArray(inputs);
        boolean[] matches = matchAll(array);

        List<String> result = new ArrayList<>();
        for (int i = 0; i < array.length; i++) {
            if (matches[i] == keepMatches) {
                result.add(array[i]);
            }
        }
        return result;
    }

    private boolean[] bulk(String[] inputs, boolean partial) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        if (inputs.length == 0) {
            return new boolean[0];
        }

        FsmRegexMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        boolean[] results = new boolean[inputs.length];
        long startNanos = System.nanoTime();
        for (int i = 0; i < inputs.length; i++) {
            String input = Objects.requireNonNull(inputs[i], "inputs cannot contain null elements");
            if (partial) {
                int offset = engine.findOffset(input);
                metrics.recordValue(MetricNames.MATCHING_SEARCH_ATTEMPTS, searchAttempts(offset, input));
                results[i] = offset >= 0;
            } else {
                results[i] = engine.matches(input);
            }
        }
        long durationNanos = System.nanoTime() - startNanos;

        long perItemNanos = durationNanos / inputs.length;

        // Global metrics use per-item latency so they stay comparable with single calls
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS, inputs.length);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, perItemNanos);
        metrics.recordTimer(partial
            ? MetricNames.MATCHING_PARTIAL_MATCH_LATENCY
            : MetricNames.MATCHING_FULL_MATCH_LATENCY, perItemNanos);

        metrics.incrementCounter(MetricNames.MATCHING_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.MATCHING_BULK_ITEMS, inputs.length);
        metrics.recordTimer(MetricNames.MATCHING_BULK_LATENCY, perItemNanos);

        return results;
    }

    private static String[] toArray(Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        try {
            return inputs.toArray(new String[0]);
        } catch (ArrayStoreException e) {
            throw new IllegalArgumentException(
                "Collection contains non-String elements. Use stream().map(Object::toString).toList() to convert.", e);
        }
    }

    public String pattern() {
        return patternString;
    }

    /**
     * Number of states in the compiled automaton, start and termination included.
     */
    public int stateCount() {
        return engine.automaton().stateCount();
    }

    @Override
    public String toString() {
        return patternString;
    }

    /**
     * Gets the global pattern cache (for internal use).
     */
    public static PatternCache getGlobalCache() {
        return cache;
    }

    /**
     * Replaces the global pattern cache (for testing only). The previous cache is not shut down.
     *
     * @param newCache the cache to use from now on
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "newCache cannot be null");
    }

    /**
     * Gets cache statistics (for monitoring).
     */
    public static PatternCache.Statistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the pattern cache (for testing/maintenance).
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Fully resets the cache including statistics (for testing only).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Reconfigures the global cache with new settings. All cached patterns are cleared.
     *
     * @param config the new configuration
     */
    public static void configureCache(FsmRegexConfig config) {
        cache.reconfigure(config);
    }

    /**
     * Gets the current cache configuration.
     */
    public static FsmRegexConfig getCacheConfig() {
        return cache.getConfig();
    }
}
