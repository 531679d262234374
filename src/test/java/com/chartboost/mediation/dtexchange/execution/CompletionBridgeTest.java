package com.chartboost.mediation.dtexchange.execution;

import io.vertx.core.Promise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.chartboost.mediation.dtexchange.assertion.FutureAssertion.assertThat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

public class CompletionBridgeTest {

    private Promise<String> promise;

    private CompletionBridge<String> target;

    @BeforeEach
    public void setUp() {
        promise = Promise.promise();
        target = CompletionBridge.begin("test", promise);
    }

    @Test
    public void completeShouldDeliverValueToCaller() {
        // when
        final CompletionBridge.Resolution resolution = target.complete("value");

        // then
        assertThat(resolution).isEqualTo(CompletionBridge.Resolution.DELIVERED);
        assertThat(promise.future()).succeededWith("value");
        assertThat(target.getState()).isEqualTo(CompletionBridge.State.RESOLVED);
    }

    @Test
    public void failShouldDeliverCauseToCaller() {
        // given
        final RuntimeException cause = new RuntimeException("failed");

        // when
        final CompletionBridge.Resolution resolution = target.fail(cause);

        // then
        assertThat(resolution).isEqualTo(CompletionBridge.Resolution.DELIVERED);
        assertThat(promise.future()).isFailed().isSameAs(cause);
    }

    @Test
    public void resolveShouldIgnoreEveryOutcomeAfterTheFirst() {
        // given
        target.complete("first");

        // when
        final CompletionBridge.Resolution second = target.complete("second");
        final CompletionBridge.Resolution third = target.fail(new RuntimeException("late"));

        // then
        assertThat(second).isEqualTo(CompletionBridge.Resolution.IGNORED);
        assertThat(third).isEqualTo(CompletionBridge.Resolution.IGNORED);
        assertThat(promise.future()).succeededWith("first");
    }

    @Test
    public void cancelShouldFailCallerWithCancellationException() {
        // when
        final boolean cancelled = target.cancel();

        // then
        assertThat(cancelled).isTrue();
        assertThat(promise.future()).isFailed()
                .isInstanceOf(CancellationException.class)
                .hasMessage("test was cancelled");
        assertThat(target.getState()).isEqualTo(CompletionBridge.State.CANCELLED);
    }

    @Test
    public void cancelShouldReturnFalseWhenAlreadyResolved() {
        // given
        target.complete("value");

        // when
        final boolean cancelled = target.cancel();

        // then
        assertThat(cancelled).isFalse();
        assertThat(promise.future()).succeededWith("value");
    }

    @Test
    public void cancelShouldReturnFalseWhenCalledTwice() {
        // given
        target.cancel();

        // when and then
        assertThat(target.cancel()).isFalse();
    }

    @Test
    public void resolveShouldReportAbandonedAfterCancel() {
        // given
        target.cancel();

        // when
        final CompletionBridge.Resolution resolution = target.complete("late");

        // then
        assertThat(resolution).isEqualTo(CompletionBridge.Resolution.ABANDONED);
        assertThat(promise.future()).isFailed().isInstanceOf(CancellationException.class);
    }

    @Test
    public void resolveShouldReachHandlerWhenCallerKeptNoReferenceToFuture() {
        // given
        final AtomicReference<String> received = new AtomicReference<>();
        target = beginWithHandlerOnly(received);
        for (int i = 0; i < 5; i++) {
            System.gc();
        }

        // when
        final CompletionBridge.Resolution resolution = target.complete("value");

        // then
        assertThat(resolution).isEqualTo(CompletionBridge.Resolution.DELIVERED);
        assertThat(received.get()).isEqualTo("value");
    }

    @Test
    public void resolveShouldNotThrowWhenCalledAfterCancel() {
        // given
        target.cancel();

        // when and then
        assertThatCode(() -> target.fail(new RuntimeException("late"))).doesNotThrowAnyException();
        assertThat(target.getState()).isEqualTo(CompletionBridge.State.CANCELLED);
        assertThat(target.isPending()).isFalse();
    }

    @Test
    public void isPendingShouldReturnFalseWhenCallerCompletedPromiseElsewhere() {
        // given
        promise.complete("elsewhere");

        // when and then
        assertThat(target.isPending()).isFalse();
        assertThat(target.complete("value")).isEqualTo(CompletionBridge.Resolution.ABANDONED);
        assertThat(promise.future()).succeededWith("elsewhere");
    }

    @Test
    public void isPendingShouldReturnTrueUntilResolved() {
        // when and then
        assertThat(target.isPending()).isTrue();
        target.fail(new RuntimeException());
        assertThat(target.isPending()).isFalse();
    }

    @Test
    public void resolveShouldDeliverExactlyOnceWhenCalledConcurrently() throws InterruptedException {
        // given
        final int threads = 16;
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<CompletionBridge.Resolution>> tasks = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            final String value = "value" + i;
            tasks.add(executor.submit(() -> {
                start.await();
                return target.complete(value);
            }));
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        final long delivered = tasks.stream()
                .map(CompletionBridgeTest::join)
                .filter(resolution -> resolution == CompletionBridge.Resolution.DELIVERED)
                .count();
        assertThat(delivered).isEqualTo(1);
        assertThat(promise.future()).isSucceeded();
    }

    private static CompletionBridge<String> beginWithHandlerOnly(AtomicReference<String> received) {
        final Promise<String> handlerOnly = Promise.promise();
        handlerOnly.future().onSuccess(received::set);
        return CompletionBridge.begin("handlers-only", handlerOnly);
    }

    private static CompletionBridge.Resolution join(Future<CompletionBridge.Resolution> task) {
        try {
            return task.get();
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
