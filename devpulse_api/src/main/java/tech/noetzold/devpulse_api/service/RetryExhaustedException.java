package tech.noetzold.devpulse_api.service;

public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
