package net.cratedigger.support.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.cratedigger.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoundedCacheTest {

    private MutableClock clock;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BoundedCache<String, String> cache(int maxSize) {
        return new BoundedCache<>("test", maxSize, Duration.ofMinutes(10), clock);
    }

    @Test
    void should_EvictLeastRecentlyUsed_When_SetExceedsCapacity() {
        BoundedCache<String, String> cache = cache(2);
        cache.set("a", "1");
        cache.set("b", "2");
        assertThat(cache.get("a")).contains("1");

        cache.set("c", "3");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1");
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.statistics().evictions()).isEqualTo(1);
    }

    @Test
    void should_EvictLeastRecentlyUsed_When_ComputedValueExceedsCapacity() {
        BoundedCache<String, String> cache = cache(2);
        cache.set("a", "1");
        cache.set("b", "2");

        String computed = cache.getOrCompute("c", null, key -> CompletableFuture.completedFuture("3")).join();

        assertThat(computed).isEqualTo("3");
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    void should_RecomputeOnce_When_ComputedEntryOutlivesItsTtl() {
        BoundedCache<String, String> cache = cache(2);
        AtomicInteger computations = new AtomicInteger();

        String first = cache.getOrCompute("k", Duration.ofSeconds(30),
            key -> CompletableFuture.completedFuture("v" + computations.incrementAndGet())).join();
        clock.advance(Duration.ofSeconds(29));
        String beforeExpiry = cache.getOrCompute("k", Duration.ofSeconds(30),
            key -> CompletableFuture.completedFuture("v" + computations.incrementAndGet())).join();
        clock.advance(Duration.ofSeconds(1));
        String afterExpiry = cache.getOrCompute("k", Duration.ofSeconds(30),
            key -> CompletableFuture.completedFuture("v" + computations.incrementAndGet())).join();

        assertThat(first).isEqualTo("v1");
        assertThat(beforeExpiry).isEqualTo("v1");
        assertThat(afterExpiry).isEqualTo("v2");
        assertThat(computations).hasValue(2);
        assertThat(cache.get("k")).contains("v2");
    }

    @Test
    void should_KeepSize_When_KeyIsOverwritten() {
        BoundedCache<String, String> cache = cache(3);
        cache.set("a", "1");
        cache.set("a", "2");

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("a")).contains("2");
    }

    @Test
    void should_ReadAsAbsent_When_EntryExpired() {
        BoundedCache<String, String> cache = cache(3);
        cache.set("a", "1", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertThat(cache.get("a")).contains("1");

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void should_RemoveOnlyExpiredEntries_When_Swept() {
        BoundedCache<String, String> cache = cache(5);
        cache.set("short", "1", Duration.ofSeconds(10));
        cache.set("long", "2", Duration.ofHours(1));

        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.cleanupExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("long")).contains("2");
    }

    @Test
    void should_RunFactoryOnce_When_ConcurrentCallersShareKey() throws Exception {
        BoundedCache<String, String> cache = cache(10);
        AtomicInteger invocations = new AtomicInteger();
        CompletableFuture<String> gate = new CompletableFuture<>();
        CountDownLatch started = new CountDownLatch(8);

        List<Future<CompletableFuture<String>>> callers = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            callers.add(executor.submit(() -> {
                started.countDown();
                return cache.getOrCompute("k", null, key -> {
                    invocations.incrementAndGet();
                    return gate;
                });
            }));
        }
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        List<CompletableFuture<String>> results = new ArrayList<>();
        for (Future<CompletableFuture<String>> caller : callers) {
            results.add(caller.get(5, TimeUnit.SECONDS));
        }

        gate.complete("value");

        for (CompletableFuture<String> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("value");
        }
        assertThat(invocations).hasValue(1);
        assertThat(cache.get("k")).contains("value");
    }

    @Test
    void should_LeaveOtherCallersRunning_When_OneCallerCancels() {
        BoundedCache<String, String> cache = cache(10);
        CompletableFuture<String> gate = new CompletableFuture<>();

        CompletableFuture<String> first = cache.getOrCompute("k", null, key -> gate);
        CompletableFuture<String> second = cache.getOrCompute("k", null, key -> gate);
        first.cancel(true);
        gate.complete("value");

        assertThat(second.join()).isEqualTo("value");
        assertThat(cache.get("k")).contains("value");
    }

    @Test
    void should_PropagateAndNotStore_When_FactoryFails() {
        BoundedCache<String, String> cache = cache(10);
        AtomicInteger invocations = new AtomicInteger();

        CompletableFuture<String> failed = cache.getOrCompute("k", null, key -> {
            invocations.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("provider down"));
        });

        assertThatThrownBy(failed::get)
            .isInstanceOf(ExecutionException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("provider down");
        assertThat(cache.size()).isZero();

        String retried = cache.getOrCompute("k", null, key -> {
            invocations.incrementAndGet();
            return CompletableFuture.completedFuture("recovered");
        }).join();

        assertThat(retried).isEqualTo("recovered");
        assertThat(invocations).hasValue(2);
    }

    @Test
    void should_FailAndNotStore_When_FactoryProducesNull() {
        BoundedCache<String, String> cache = cache(10);

        CompletableFuture<String> result = cache.getOrCompute("k", null, key -> CompletableFuture.completedFuture(null));

        assertThat(result).isCompletedExceptionally();
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void should_ServeCachedValueWithoutFactory_When_EntryIsLive() {
        BoundedCache<String, String> cache = cache(10);
        cache.set("k", "cached");

        String value = cache.getOrCompute("k", null, key -> {
            throw new AssertionError("factory must not run on a hit");
        }).join();

        assertThat(value).isEqualTo("cached");
        assertThat(cache.statistics().hits()).isEqualTo(1);
    }

    @Test
    void should_ReportHitRate_When_LookupsRecorded() {
        BoundedCache<String, String> cache = cache(10);
        cache.set("a", "1");
        cache.get("a");
        cache.get("missing");

        CacheStatistics stats = cache.statistics();

        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(stats.maxSize()).isEqualTo(10);
    }

    @Test
    void should_Reject_When_MaxSizeNotPositive() {
        assertThatThrownBy(() -> new BoundedCache<String, String>("bad", 0, Duration.ofMinutes(1), clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxSize");
    }
}
