package com.chartboost.mediation.dtexchange.assertion;

import com.chartboost.mediation.dtexchange.exception.MediationAdException;
import com.chartboost.mediation.dtexchange.partner.model.MediationError;
import io.vertx.core.Future;
import org.assertj.core.api.AbstractAssert;
import org.assertj.core.api.ThrowableAssert;
import org.assertj.core.util.Preconditions;

import java.util.Objects;

public class FutureAssertion<VALUE> extends AbstractAssert<FutureAssertion<VALUE>, Future<VALUE>> {

    private FutureAssertion(Future<VALUE> actual) {
        super(actual, FutureAssertion.class);
    }

    public static <VALUE> FutureAssertion<VALUE> assertThat(Future<VALUE> actual) {
        return new FutureAssertion<>(actual);
    }

    public FutureAssertion<VALUE> isPending() {
        isNotNull();
        if (actual.isComplete()) {
            failWithMessage("Expected future to be pending but it was completed with <%s>",
                    actual.succeeded() ? actual.result() : actual.cause());
        }
        return myself;
    }

    public FutureAssertion<VALUE> isSucceeded() {
        isNotNull();
        if (!actual.succeeded()) {
            failWithMessage("Expected future to be succeeded but was <%s>", actual.cause());
        }
        return myself;
    }

    public ThrowableAssert<Throwable> isFailed() {
        isNotNull();
        if (!actual.failed()) {
            failWithMessage("Expected future to be failed");
        }
        return new ThrowableAssert<>(actual.cause());
    }

    public FutureAssertion<VALUE> succeededWith(VALUE expectedValue) {
        isSucceeded();
        Preconditions.checkArgument(expectedValue != null, "The expected value should not be <null>.");

        final VALUE actualValue = actual.result();
        if (!Objects.equals(actualValue, expectedValue)) {
            failWithMessage("Expected future to contain <%s> but was <%s>", expectedValue, actualValue);
        }

        return myself;
    }

    public FutureAssertion<VALUE> failedWith(MediationError expectedError) {
        isFailed().isInstanceOf(MediationAdException.class);

        final MediationError actualError = ((MediationAdException) actual.cause()).getError();
        if (actualError != expectedError) {
            failWithMessage("Expected future to fail with <%s> but was <%s>", expectedError, actualError);
        }

        return myself;
    }
}
