package com.archforge.core.external;

/**
 * Failure of a text-generation call.
 *
 * <p>Non-retryable failures (missing credentials, no provider configured) tell callers
 * to skip the retry budget and fall back immediately.
 */
public class TextGenerationException extends RuntimeException {

    private final boolean retryable;

    public TextGenerationException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TextGenerationException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
