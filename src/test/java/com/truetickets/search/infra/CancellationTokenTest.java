package com.truetickets.search.infra;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatNoException;

class CancellationTokenTest {

    @Test
    void cancelRunsRegisteredCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void closedRegistrationIsNotCalled() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        try (CancellationToken.Registration ignored = token.onCancel(calls::incrementAndGet)) {
            assertThat(token.isCancelled()).isFalse();
        }
        token.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void throwIfCancelled() {
        CancellationToken token = CancellationToken.none();
        assertThatNoException().isThrownBy(token::throwIfCancelled);

        token.cancel();

        assertThatThrownBy(token::throwIfCancelled).isInstanceOf(CancellationException.class);
    }
}
