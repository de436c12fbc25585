package com.axonops.fsmregex.metrics;

import com.axonops.fsmregex.api.Pattern;
import com.axonops.fsmregex.api.PatternCompilationException;
import com.axonops.fsmregex.cache.FsmRegexConfig;
import com.axonops.fsmregex.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during operations.
 *
 * Injects a test cache with Dropwizard metrics, performs real operations and
 * checks the registry.
 */
class MetricsIntegrationTest {

    private MetricRegistry registry;
    private TestUtils.CacheScope scope;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        scope = TestUtils.useCache(TestUtils.testConfigWithMetrics(registry, "test.fsm").build());
    }

    @AfterEach
    void cleanup() {
        scope.close();
    }

    @Test
    void testPatternCompilationMetrics() {
        Pattern.compile("test.*");

        Counter compiled = registry.counter("test.fsm.patterns.compiled.total.count");
        Timer compilationTime = registry.timer("test.fsm.patterns.compilation.latency");
        assertThat(compiled.getCount()).isEqualTo(1);
        assertThat(compilationTime.getCount()).isEqualTo(1);

        Pattern.compile("other.*");

        assertThat(compiled.getCount()).isEqualTo(2);
        assertThat(compilationTime.getCount()).isEqualTo(2);
    }

    @Test
    void testAutomatonStatesHistogram() {
        Pattern literal = Pattern.compile("abc");
        Pattern starred = Pattern.compile("a*b*c*");
        Pattern.compile("abc");

        Histogram states = registry.histogram("test.fsm.patterns.automaton.states");
        assertThat(states.getCount()).isEqualTo(2);
        assertThat(states.getSnapshot().getMin()).isEqualTo(literal.stateCount());
        assertThat(states.getSnapshot().getMax()).isEqualTo(starred.stateCount());
    }

    @Test
    void testCachedStatesGauge() {
        Pattern p = Pattern.compile("[a-z]+[0-9]*");

        @SuppressWarnings("unchecked")
        Gauge<Number> states = (Gauge<Number>) registry.getGauges().get("test.fsm.cache.automaton.states.current.count");
        assertThat(states).isNotNull();
        assertThat(states.getValue().longValue()).isEqualTo(p.stateCount());
    }

    @Test
    void testSearchAttemptsHistogram() {
        Pattern p = Pattern.compile("ab");

        p.find("ab");      // whole text matches on the first attempt
        p.find("zzab");    // third start offset
        p.find("zzzzz");   // every offset tried
        p.matches("ab");   // full match records no search attempts

        Histogram attempts = registry.histogram("test.fsm.matching.search.attempts");
        assertThat(attempts.getCount()).isEqualTo(3);
        assertThat(attempts.getSnapshot().getValues()).containsExactly(1, 3, 5);
    }

    @Test
    void testBulkFindRecordsAttemptsPerInput() {
        Pattern.compile("[0-9]").findAll(List.of("7", "ab7", "abc"));

        Histogram attempts = registry.histogram("test.fsm.matching.search.attempts");
        assertThat(attempts.getSnapshot().getValues()).containsExactly(1, 3, 3);
    }

    @Test
    void testCacheHitMissMetrics() {
        Pattern.compile("test.*");
        Pattern.compile("test.*");
        Pattern.compile("test.*");

        assertThat(registry.counter("test.fsm.patterns.cache.misses.total.count").getCount()).isEqualTo(1);
        assertThat(registry.counter("test.fsm.patterns.cache.hits.total.count").getCount()).isEqualTo(2);
        // Hits do not recompile
        assertThat(registry.counter("test.fsm.patterns.compiled.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testCacheSizeGauge() {
        Pattern.compile("p1");
        Pattern.compile("p2");

        @SuppressWarnings("unchecked")
        Gauge<Number> size = (Gauge<Number>) registry.getGauges().get("test.fsm.cache.patterns.current.count");
        assertThat(size).isNotNull();
        assertThat(size.getValue().intValue()).isEqualTo(2);

        Pattern.clearCache();
        assertThat(size.getValue().intValue()).isZero();
    }

    @Test
    void testMatchingMetrics() {
        Pattern p = Pattern.compile("a+b");

        p.matches("aab");
        p.matches("b");
        p.find("xxabyy");

        assertThat(registry.counter("test.fsm.matching.operations.total.count").getCount()).isEqualTo(3);
        assertThat(registry.timer("test.fsm.matching.latency").getCount()).isEqualTo(3);
        assertThat(registry.timer("test.fsm.matching.full_match.latency").getCount()).isEqualTo(2);
        assertThat(registry.timer("test.fsm.matching.partial_match.latency").getCount()).isEqualTo(1);
    }

    @Test
    void testBulkMetrics() {
        Pattern p = Pattern.compile("[0-9]+");

        p.matchAll(List.of("1", "x", "22"));
        p.findAll(new String[] {"a1", "bb"});

        assertThat(registry.counter("test.fsm.matching.bulk.operations.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.fsm.matching.bulk.items.total.count").getCount()).isEqualTo(5);
        assertThat(registry.counter("test.fsm.matching.operations.total.count").getCount()).isEqualTo(5);
        assertThat(registry.timer("test.fsm.matching.bulk.latency").getCount()).isEqualTo(2);
    }

    @Test
    void testCompilationErrorMetrics() {
        assertThatThrownBy(() -> Pattern.compile("[broken"))
            .isInstanceOf(PatternCompilationException.class);
        assertThatThrownBy(() -> Pattern.compile("+"))
            .isInstanceOf(PatternCompilationException.class);

        assertThat(registry.counter("test.fsm.errors.compilation.failed.total.count").getCount()).isEqualTo(2);
        assertThat(registry.counter("test.fsm.patterns.compiled.total.count").getCount()).isZero();
    }

    @Test
    void testLruEvictionMetrics() {
        Pattern.configureCache(TestUtils.testConfigWithMetrics(registry, "test.fsm").maxCacheSize(2).build());

        Pattern.compile("e1");
        Pattern.compile("e2");
        Pattern.compile("e3");

        assertThat(registry.counter("test.fsm.cache.evictions.lru.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testIdleEvictionMetrics() throws InterruptedException {
        Pattern.configureCache(TestUtils.testConfigWithMetrics(registry, "test.fsm")
            .idleTimeoutSeconds(1)
            .evictionScanIntervalSeconds(1)
            .build());

        Pattern.compile("idle");
        Thread.sleep(1200);
        Pattern.getGlobalCache().evictIdlePatterns();

        assertThat(registry.counter("test.fsm.cache.evictions.idle.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testRegistryNoneIsDefault() {
        assertThat(FsmRegexConfig.DEFAULT.metricsRegistry()).isSameAs(FsmRegexMetricsRegistry.NONE);
        assertThat(FsmRegexConfig.NO_CACHE.metricsRegistry()).isSameAs(FsmRegexMetricsRegistry.NONE);

        FsmRegexMetricsRegistry.NONE.incrementCounter(MetricNames.PATTERNS_COMPILED);
        FsmRegexMetricsRegistry.NONE.recordValue(MetricNames.PATTERNS_AUTOMATON_STATES, 4);
        FsmRegexMetricsRegistry.NONE.registerGauge(MetricNames.CACHE_PATTERNS_COUNT, () -> 1);
        FsmRegexMetricsRegistry.NONE.removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    }

    @Test
    void testPartialRegistryOverridesOnlyWhatItRecords() {
        List<String> counted = new ArrayList<>();
        FsmRegexMetricsRegistry countersOnly = new FsmRegexMetricsRegistry() {
            @Override
            public void incrementCounter(String name, long delta) {
                counted.add(name + "+" + delta);
            }
        };

        try (TestUtils.CacheScope ignored = TestUtils.useCache(
                TestUtils.testConfigBuilder().metricsRegistry(countersOnly).build())) {
            Pattern.compile("a+").find("xa");
        }

        assertThat(counted).contains(
            MetricNames.PATTERNS_CACHE_MISSES + "+1",
            MetricNames.PATTERNS_COMPILED + "+1",
            MetricNames.MATCHING_OPERATIONS + "+1");
    }

    @Test
    void testAdapterPrefixing() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);

        adapter.incrementCounter(MetricNames.PATTERNS_COMPILED, 3);

        assertThat(adapter.prefix()).isEqualTo(DropwizardMetricsAdapter.DEFAULT_PREFIX);
        assertThat(registry.counter("com.axonops.fsmregex.patterns.compiled.total.count").getCount()).isEqualTo(3);
    }

    @Test
    void testGaugeReRegistrationReplaces() {
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "gauge.test");

        adapter.registerGauge("value", () -> 1);
        adapter.registerGauge("value", () -> 2);

        assertThat(registry.getGauges().get("gauge.test.value").getValue()).isEqualTo(2);

        adapter.removeGauge("value");
        assertThat(registry.getGauges()).doesNotContainKey("gauge.test.value");
    }
}
