package com.clan.clears.actor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorMailboxTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void tasksRunOneAtATimeInSubmissionOrder() throws Exception {
        ActorMailbox mailbox = new ActorMailbox("member-1", pool);
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        CompletableFuture<?>[] futures = new CompletableFuture<?>[20];
        for (int i = 0; i < futures.length; i++) {
            int n = i;
            futures[i] = mailbox.submit(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(2);
                order.add(n);
                running.decrementAndGet();
                return n;
            });
        }
        CompletableFuture.allOf(futures).get(5, TimeUnit.SECONDS);

        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(order).hasSize(20).isSorted();
    }

    @Test
    void failingTaskDoesNotBlockTheQueue() {
        ActorMailbox mailbox = new ActorMailbox("member-1", pool);

        CompletableFuture<Object> failed = mailbox.submit(() -> {
            throw new IllegalStateException("boom");
        });
        String next = mailbox.call(() -> "next");

        assertThat(failed).isCompletedExceptionally();
        assertThat(next).isEqualTo("next");
    }

    @Test
    void callRethrowsTheTaskException() {
        ActorMailbox mailbox = new ActorMailbox("member-1", pool);

        assertThatThrownBy(() -> mailbox.call(() -> {
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad input");
    }

    @Test
    void laterTaskWaitsForBlockedOne() throws Exception {
        ActorMailbox mailbox = new ActorMailbox("member-1", pool);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> first = mailbox.submit(() -> {
            release.await(5, TimeUnit.SECONDS);
            return "first";
        });
        CompletableFuture<String> second = mailbox.submit(() -> "second");

        Thread.sleep(50);
        assertThat(second).isNotDone();
        release.countDown();
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
        assertThat(first).isCompletedWithValue("first");
    }

    @Test
    void checkedTaskExceptionSurfacesAsCompletionFailure() {
        ActorMailbox mailbox = new ActorMailbox("member-1", pool);

        assertThatThrownBy(() -> mailbox.call(() -> {
            throw new java.io.IOException("disk gone");
        }))
                .isInstanceOf(CompletionException.class)
                .hasRootCauseInstanceOf(java.io.IOException.class);
        assertThat(mailbox.call(() -> 42)).isEqualTo(42);
    }
}
