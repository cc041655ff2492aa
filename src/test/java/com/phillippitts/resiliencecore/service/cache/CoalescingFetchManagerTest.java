package com.phillippitts.resiliencecore.service.cache;

import com.phillippitts.resiliencecore.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoalescingFetchManagerTest {

    private static final int CALLERS = 8;

    private MutableClock clock;
    private LruExpiringCache<String, Object> cache;
    private CoalescingFetchManager manager;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new LruExpiringCache<>(100, Duration.ofSeconds(300), clock);
        manager = new CoalescingFetchManager(cache);
        pool = Executors.newFixedThreadPool(CALLERS);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldComputeOnceForConcurrentCallersAndShareValue() throws Exception {
        AtomicInteger computations = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Object shared = new Object();
        Supplier<Object> compute = () -> {
            computations.incrementAndGet();
            started.countDown();
            await(release);
            return shared;
        };

        List<Future<Object>> results = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            results.add(pool.submit(() -> manager.getOrFetch("key", compute, Duration.ofSeconds(60))));
        }
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        release.countDown();

        for (Future<Object> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(shared);
        }
        assertThat(computations.get()).isEqualTo(1);
        assertThat(manager.inFlightCount()).isZero();
    }

    @Test
    void shouldBroadcastSameFailureToEveryWaiterAndNotCache() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        IllegalStateException failure = new IllegalStateException("upstream down");
        Supplier<Object> compute = () -> {
            started.countDown();
            await(release);
            throw failure;
        };

        List<Future<Throwable>> results = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            results.add(pool.submit(() -> {
                try {
                    manager.getOrFetch("key", compute, Duration.ofSeconds(60));
                    return null;
                } catch (RuntimeException e) {
                    return e;
                }
            }));
        }
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        release.countDown();

        for (Future<Throwable> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(failure);
        }
        assertThat(cache.get("key")).isEmpty();
        assertThat(manager.inFlightCount()).isZero();
    }

    @Test
    void shouldPassLeaderCancellationToWaitersAndLetNextCallerRecompute() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CancellationException cancelled = new CancellationException("leader interrupted");
        Supplier<Object> compute = () -> {
            started.countDown();
            await(release);
            throw cancelled;
        };

        Future<Object> leader = pool.submit(() -> manager.getOrFetch("key", compute, Duration.ofSeconds(60)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Future<Throwable> waiter = pool.submit(() -> {
            try {
                manager.getOrFetch("key", () -> "unused", Duration.ofSeconds(60));
                return null;
            } catch (RuntimeException e) {
                return e;
            }
        });
        Thread.sleep(100);
        release.countDown();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isSameAs(cancelled);
        assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS)).hasCause(cancelled);
        assertThat(manager.getOrFetch("key", () -> "fresh", Duration.ofSeconds(60))).isEqualTo("fresh");
    }

    @Test
    void shouldRecomputeAfterFailure() {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<String> flaky = () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
            return "ok";
        };

        assertThatThrownBy(() -> manager.getOrFetch("key", flaky, Duration.ofSeconds(60)))
                .hasMessage("first attempt fails");
        assertThat(manager.getOrFetch("key", flaky, Duration.ofSeconds(60))).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void shouldServeCachedValueWithoutComputing() {
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = () -> "v" + computations.incrementAndGet();

        assertThat(manager.getOrFetch("key", compute, Duration.ofSeconds(60))).isEqualTo("v1");
        assertThat(manager.getOrFetch("key", compute, Duration.ofSeconds(60))).isEqualTo("v1");
        assertThat(computations.get()).isEqualTo(1);
    }

    @Test
    void shouldComputeAgainAfterTtlExpires() {
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = () -> "v" + computations.incrementAndGet();

        manager.getOrFetch("key", compute, Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(11));

        assertThat(manager.getOrFetch("key", compute, Duration.ofSeconds(10))).isEqualTo("v2");
    }

    @Test
    void shouldNotCacheNullByDefault() {
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = () -> {
            computations.incrementAndGet();
            return null;
        };

        assertThat(manager.getOrFetch("key", compute, FetchOptions.defaults())).isNull();
        assertThat(manager.getOrFetch("key", compute, FetchOptions.defaults())).isNull();
        assertThat(computations.get()).isEqualTo(2);
    }

    @Test
    void shouldCacheNullWhenPolicyAllows() {
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = () -> {
            computations.incrementAndGet();
            return null;
        };
        FetchOptions options = FetchOptions.defaults().cachingNulls();

        assertThat(manager.getOrFetch("key", compute, options)).isNull();
        assertThat(manager.getOrFetch("key", compute, options)).isNull();
        assertThat(computations.get()).isEqualTo(1);
    }

    @Test
    void shouldNamespaceKeysWithPrefixAndInvalidateByPrefix() {
        FetchOptions chat = FetchOptions.ttl(Duration.ofSeconds(60)).withPrefix("chat");
        FetchOptions search = FetchOptions.ttl(Duration.ofSeconds(60)).withPrefix("search");
        manager.getOrFetch("a", () -> "chat-a", chat);
        manager.getOrFetch("a", () -> "search-a", search);

        assertThat(cache.get("chat:a")).contains("chat-a");

        int removed = manager.invalidate("chat:");

        assertThat(removed).isEqualTo(1);
        assertThat(manager.getOrFetch("a", () -> "chat-a2", chat)).isEqualTo("chat-a2");
        assertThat(manager.getOrFetch("a", () -> "unused", search)).isEqualTo("search-a");
    }

    @Test
    void shouldNotBlockOtherKeysWhileComputing() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Object> slow = pool.submit(() -> manager.getOrFetch("slow", () -> {
            started.countDown();
            await(release);
            return "slow";
        }, Duration.ofSeconds(60)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(manager.getOrFetch("fast", () -> "fast", Duration.ofSeconds(60))).isEqualTo("fast");

        release.countDown();
        assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
    }

    @Test
    void shouldServeCachedValueToCallerThatMissedBeforeLeaderFinished() throws Exception {
        CountDownLatch missed = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        PausingCache pausing = new PausingCache(cache, missed, resume);
        CoalescingFetchManager pausingManager = new CoalescingFetchManager(pausing);
        AtomicInteger computations = new AtomicInteger();
        Supplier<Object> compute = () -> "value-" + computations.incrementAndGet();

        Future<Object> late = pool.submit(() -> {
            pausing.pauseAfterMiss(Thread.currentThread());
            return pausingManager.getOrFetch("key", compute, Duration.ofSeconds(60));
        });
        assertThat(missed.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(pausingManager.getOrFetch("key", compute, Duration.ofSeconds(60))).isEqualTo("value-1");
        resume.countDown();

        assertThat(late.get(5, TimeUnit.SECONDS)).isEqualTo("value-1");
        assertThat(computations.get()).isEqualTo(1);
        assertThat(pausingManager.inFlightCount()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Holds one chosen thread between its cache miss and the in-flight registration. */
    private static final class PausingCache implements ExpiringCache<String, Object> {

        private final ExpiringCache<String, Object> delegate;
        private final CountDownLatch missed;
        private final CountDownLatch resume;
        private volatile Thread paused;

        PausingCache(ExpiringCache<String, Object> delegate, CountDownLatch missed, CountDownLatch resume) {
            this.delegate = delegate;
            this.missed = missed;
            this.resume = resume;
        }

        void pauseAfterMiss(Thread thread) {
            paused = thread;
        }

        @Override
        public Optional<Object> get(String key) {
            Optional<Object> result = delegate.get(key);
            if (result.isEmpty() && Thread.currentThread() == paused) {
                paused = null;
                missed.countDown();
                await(resume);
            }
            return result;
        }

        @Override
        public Optional<Object> peek(String key) {
            return delegate.peek(key);
        }

        @Override
        public void set(String key, Object value, Duration ttl) {
            delegate.set(key, value, ttl);
        }

        @Override
        public boolean invalidate(String key) {
            return delegate.invalidate(key);
        }

        @Override
        public int invalidatePrefix(String prefix) {
            return delegate.invalidatePrefix(prefix);
        }

        @Override
        public void clear() {
            delegate.clear();
        }

        @Override
        public CacheStats stats() {
            return delegate.stats();
        }
    }
}
