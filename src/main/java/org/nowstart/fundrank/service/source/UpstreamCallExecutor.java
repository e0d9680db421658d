package org.nowstart.fundrank.service.source;

import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.fundrank.data.exception.FundrankException;
import org.nowstart.fundrank.data.exception.UpstreamUnavailableException;
import org.nowstart.fundrank.data.property.NavSourceProperties;
import org.springframework.stereotype.Component;

/**
 * Runs reader calls with bounded retries and exponential backoff.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpstreamCallExecutor {

    private final NavSourceProperties navSourceProperties;

    public <T> T call(String operation, Supplier<T> call) {
        int maxAttempts = Math.max(1, navSourceProperties.maxAttempts());
        long backoffMillis = navSourceProperties.initialBackoff().toMillis();
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (FundrankException e) {
                throw e;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn(
                        "event=upstream_call_failed operation={} attempt={} maxAttempts={} reason={}",
                        operation,
                        attempt,
                        maxAttempts,
                        e.toString()
                );
                if (attempt < maxAttempts) {
                    pause(operation, backoffMillis);
                    backoffMillis = Math.round(backoffMillis * navSourceProperties.backoffMultiplier());
                }
            }
        }

        throw new UpstreamUnavailableException(
                "Upstream call failed after " + maxAttempts + " attempts. operation=" + operation,
                lastFailure
        );
    }

    private void pause(String operation, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while waiting to retry. operation=" + operation, e);
        }
    }
}
