package tech.noetzold.devpulse_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Retries an operation on any exception, waiting {@code baseDelay * attempt} between attempts (linear backoff).
 * Once every attempt has failed the last error is rethrown; checked exceptions are wrapped in
 * {@link RetryExhaustedException}.
 */
@Slf4j
@Component
public class RetryExecutor {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);

    private final Sleeper sleeper;

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T withRetry(Callable<T> operation) {
        return withRetry(operation, DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }

    public <T> T withRetry(Callable<T> operation, int maxRetries, Duration baseDelay) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }

        Exception lastError = null;
        int attempt = 1;
        for (; attempt <= maxRetries; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastError = e;
                if (attempt == maxRetries) {
                    break;
                }

                Duration wait = baseDelay.multipliedBy(attempt); // backoff linear
                log.debug("Attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, maxRetries, e.getMessage(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        if (lastError instanceof RuntimeException re) {
            throw re;
        }
        throw new RetryExhaustedException(Math.min(attempt, maxRetries), lastError);
    }
}
