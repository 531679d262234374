package com.chartboost.mediation.dtexchange.execution;

import com.chartboost.mediation.dtexchange.log.Logger;
import com.chartboost.mediation.dtexchange.log.LoggerFactory;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Delivers the outcome of a callback-style operation to a caller awaiting a single {@link Future}.
 * <p>
 * Only the first {@link #resolve(AsyncResult)} reaches the caller, every later call is ignored. The caller's
 * {@link Promise} is held until the operation leaves {@link State#PENDING}, so a caller that only attached
 * handlers still receives the outcome. A finished bridge keeps no reference to the promise. Callbacks arriving
 * after {@link #cancel()} report {@link Resolution#ABANDONED}.
 */
public class CompletionBridge<T> {

    private static final Logger logger = LoggerFactory.getLogger(CompletionBridge.class);

    private final String name;
    private final AtomicReference<Promise<T>> promiseRef;
    private final AtomicReference<State> state;

    private CompletionBridge(String name, Promise<T> promise) {
        this.name = Objects.requireNonNull(name);
        this.promiseRef = new AtomicReference<>(Objects.requireNonNull(promise));
        this.state = new AtomicReference<>(State.PENDING);
    }

    /**
     * Starts a pending operation around the caller's promise.
     */
    public static <T> CompletionBridge<T> begin(String name, Promise<T> promise) {
        return new CompletionBridge<>(name, promise);
    }

    public Resolution complete(T value) {
        return resolve(Future.succeededFuture(value));
    }

    public Resolution fail(Throwable cause) {
        return resolve(Future.failedFuture(cause));
    }

    public Resolution resolve(AsyncResult<T> outcome) {
        releaseIfCompletedElsewhere();

        if (!state.compareAndSet(State.PENDING, State.RESOLVED)) {
            final State current = state.get();
            logger.debug("{0}: ignoring outcome in state {1}", name, current);
            return current == State.CANCELLED ? Resolution.ABANDONED : Resolution.IGNORED;
        }

        // only the winner of the state transition reaches here, so the promise is still held
        final Promise<T> promise = promiseRef.getAndSet(null);
        final boolean delivered = promise != null && (outcome.succeeded()
                ? promise.tryComplete(outcome.result())
                : promise.tryFail(outcome.cause()));

        return delivered ? Resolution.DELIVERED : Resolution.ABANDONED;
    }

    /**
     * Tears down the pending operation. The caller sees a {@link CancellationException}.
     *
     * @return true if this call moved the operation out of {@link State#PENDING}
     */
    public boolean cancel() {
        if (!state.compareAndSet(State.PENDING, State.CANCELLED)) {
            return false;
        }

        final Promise<T> promise = promiseRef.getAndSet(null);
        if (promise != null) {
            promise.tryFail(new CancellationException("%s was cancelled".formatted(name)));
        }
        return true;
    }

    public boolean isPending() {
        releaseIfCompletedElsewhere();
        return state.get() == State.PENDING;
    }

    public State getState() {
        releaseIfCompletedElsewhere();
        return state.get();
    }

    /**
     * A promise completed by someone else, e.g. a caller-side timeout, counts as a cancellation.
     */
    private void releaseIfCompletedElsewhere() {
        final Promise<T> promise = promiseRef.get();
        if (promise != null && promise.future().isComplete()
                && state.compareAndSet(State.PENDING, State.CANCELLED)) {

            promiseRef.set(null);
            logger.debug("{0}: caller completed the operation elsewhere, outcome dropped", name);
        }
    }

    public enum State {

        PENDING,

        RESOLVED,

        CANCELLED
    }

    /**
     * What a {@link #resolve(AsyncResult)} call did.
     */
    public enum Resolution {

        /**
         * The outcome reached the caller.
         */
        DELIVERED,

        /**
         * The operation had already been resolved; nothing happened.
         */
        IGNORED,

        /**
         * The operation was cancelled or completed elsewhere. Only caller-independent cleanup, such as
         * releasing the ad, should follow.
         */
        ABANDONED
    }
}
