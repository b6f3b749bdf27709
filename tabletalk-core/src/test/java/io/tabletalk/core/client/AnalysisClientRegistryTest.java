package io.tabletalk.core.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AnalysisClientRegistryTest {

    @Test
    void shouldConstructSingleClientForConcurrentCallers() throws Exception {
        AtomicInteger factoryCalls = new AtomicInteger();
        AnalysisClientRegistry registry = new AnalysisClientRegistry(() -> {
            factoryCalls.incrementAndGet();
            sleep(50);
            return request -> AnalysisResult.text("ok");
        });

        int callers = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<AnalysisClient>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return registry.get();
                }));
            }
            start.countDown();

            AnalysisClient first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<AnalysisClient> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(factoryCalls).hasValue(1);
        assertThat(registry.constructionCount()).isEqualTo(1);
        assertThat(registry.isInitialized()).isTrue();
    }

    @Test
    void shouldRetryConstructionAfterFailure() {
        AtomicInteger factoryCalls = new AtomicInteger();
        AnalysisClientRegistry registry = new AnalysisClientRegistry(() -> {
            if (factoryCalls.incrementAndGet() == 1) {
                throw new IllegalStateException("no credentials yet");
            }
            return request -> AnalysisResult.text("ok");
        });

        assertThatThrownBy(registry::get)
            .isInstanceOf(ClientConstructionException.class)
            .hasRootCauseMessage("no credentials yet");
        assertThat(registry.isInitialized()).isFalse();

        AnalysisClient client = registry.get();

        assertThat(client).isNotNull();
        assertThat(registry.get()).isSameAs(client);
        assertThat(factoryCalls).hasValue(2);
    }

    @Test
    void shouldRejectFactoryReturningNull() {
        AnalysisClientRegistry registry = new AnalysisClientRegistry(() -> null);

        assertThatThrownBy(registry::get).isInstanceOf(ClientConstructionException.class);
        assertThat(registry.constructionCount()).isZero();
    }

    @Test
    void shouldSwapClientOnResetAndKeepOldOneOnFailedReset() {
        AtomicInteger factoryCalls = new AtomicInteger();
        AnalysisClientRegistry registry = new AnalysisClientRegistry(() -> {
            int call = factoryCalls.incrementAndGet();
            if (call == 3) {
                throw new ClientConstructionException("rotated key rejected");
            }
            return request -> AnalysisResult.text("client-" + call);
        });

        AnalysisClient original = registry.get();
        AnalysisClient replacement = registry.reset();

        assertThat(replacement).isNotSameAs(original);
        assertThat(registry.get()).isSameAs(replacement);

        assertThatThrownBy(registry::reset).isInstanceOf(ClientConstructionException.class);
        assertThat(registry.get()).isSameAs(replacement);
        assertThat(registry.constructionCount()).isEqualTo(2);
    }

    @Test
    void shouldLetInFlightCallFinishOnPreviousClientWhileResetSwaps() throws Exception {
        AtomicInteger factoryCalls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AnalysisClientRegistry registry = new AnalysisClientRegistry(() -> {
            int generation = factoryCalls.incrementAndGet();
            return request -> {
                if (generation == 1) {
                    entered.countDown();
                    await(release);
                }
                return AnalysisResult.text("client-" + generation);
            };
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<AnalysisResult> inFlight = pool.submit(() -> registry.get().analyze(null));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            AnalysisClient replacement = registry.reset();

            assertThat(registry.get()).isSameAs(replacement);
            assertThat(replacement.analyze(null).text()).isEqualTo("client-2");
            assertThat(inFlight).isNotDone();

            release.countDown();
            assertThat(inFlight.get(5, TimeUnit.SECONDS).text()).isEqualTo("client-1");
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
        assertThat(registry.constructionCount()).isEqualTo(2);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
