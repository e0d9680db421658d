package org.nowstart.fundrank.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.exception.UpstreamUnavailableException;
import org.nowstart.fundrank.data.property.NavSourceProperties;
import org.nowstart.fundrank.data.type.NavSourceProvider;

class UpstreamCallExecutorTest {

    private final UpstreamCallExecutor executor = new UpstreamCallExecutor(
            new NavSourceProperties(NavSourceProvider.DATABASE, "https://api.mfapi.in", 3, Duration.ZERO, 2.0)
    );

    @Test
    void call_retriesTransientFailureUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.call("nav_series fund=A", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("timeout");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void call_wrapsFailureAfterLastAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.call("nav_series fund=A", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("connection refused");
        }))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("after 3 attempts")
                .hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void call_doesNotRetryDomainFailure() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.call("fund_attributes fund=Z", () -> {
            attempts.incrementAndGet();
            throw new InvalidInputException(InvalidInputException.UNKNOWN_FUND, "Unknown fund id: Z");
        }))
                .isInstanceOf(InvalidInputException.class);
        assertThat(attempts).hasValue(1);
    }
}
