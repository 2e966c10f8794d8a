package dev.flowsync.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLanesTest {

    private ExecutorService pool;
    private SessionLanes lanes;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        lanes = new SessionLanes(pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("tasks of one session run one at a time in submission order")
    void serialPerSession() throws Exception {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 50; i++) {
            int n = i;
            futures.add(lanes.run("s1", () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(n);
                running.decrementAndGet();
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(order).isSorted().hasSize(50);
    }

    @Test
    @DisplayName("different sessions do not wait for each other")
    void parallelAcrossSessions() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> blocked = lanes.run("s1", () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        String other = lanes.submit("s2", () -> "done").get(5, TimeUnit.SECONDS);

        assertThat(other).isEqualTo("done");
        assertThat(blocked).isNotDone();
        release.countDown();
        blocked.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("a failing task fails its future and the lane keeps going")
    void failureIsIsolated() throws Exception {
        CompletableFuture<String> failed = lanes.submit("s1", () -> {
            throw new IllegalStateException("boom");
        });
        String next = lanes.submit("s1", () -> "next").get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next).isEqualTo("next");
    }

    @Test
    @DisplayName("the session id is in the MDC while a task runs")
    void mdc() throws Exception {
        String seen = lanes.submit("s7", () -> MDC.get("sessionId")).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("s7");
    }

    @Test
    @DisplayName("released lanes are forgotten once idle")
    void release() {
        SessionLanes direct = new SessionLanes(Runnable::run);
        direct.submit("s1", () -> 1).join();
        assertThat(direct.laneCount()).isEqualTo(1);

        direct.release("s1");

        assertThat(direct.laneCount()).isZero();
    }

    @Test
    @DisplayName("work submitted after a release still waits for the queued work of the session")
    void releaseWhileBusy() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        CompletableFuture<Void> closing = lanes.run("s1", () -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            order.add("close");
            running.decrementAndGet();
        });
        CompletableFuture<Void> queued = lanes.run("s1", () -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            order.add("queued");
            running.decrementAndGet();
        });
        lanes.release("s1");
        CompletableFuture<Void> reopened = lanes.run("s1", () -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            order.add("reopen");
            running.decrementAndGet();
        });

        assertThat(lanes.laneCount()).isEqualTo(1);
        release.countDown();
        CompletableFuture.allOf(closing, queued, reopened).get(5, TimeUnit.SECONDS);

        assertThat(order).containsExactly("close", "queued", "reopen");
        assertThat(maxRunning.get()).isEqualTo(1);
    }
}
