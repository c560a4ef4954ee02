package com.autocoin.infrastructure.exchange;

import java.time.Duration;

/**
 * Exception thrown by exchange REST calls.
 *
 * The {@link ErrorKind} decides whether the call is worth retrying and how long to
 * wait before the first retry.
 */
public class ExchangeException extends RuntimeException {

    public enum ErrorKind {
        RATE_LIMITED(true, Duration.ofSeconds(5)),          // HTTP 429
        NETWORK(true, Duration.ofSeconds(2)),               // I/O failure or timeout
        SERVER_ERROR(true, Duration.ofSeconds(1)),          // HTTP 5xx
        INVALID_CREDENTIALS(false, Duration.ZERO),          // HTTP 401/403
        REJECTED(false, Duration.ZERO),                     // Other 4xx, exchange error body
        MALFORMED_RESPONSE(false, Duration.ZERO);           // Unparseable or incomplete body

        private final boolean retryable;
        private final Duration retryDelay;

        ErrorKind(boolean retryable, Duration retryDelay) {
            this.retryable = retryable;
            this.retryDelay = retryDelay;
        }

        public boolean isRetryable() {
            return retryable;
        }

        public Duration retryDelay() {
            return retryDelay;
        }
    }

    private final ErrorKind kind;
    private final String operation;
    private final int httpStatus;

    public ExchangeException(ErrorKind kind, String operation, String message) {
        this(kind, operation, 0, message, null);
    }

    public ExchangeException(ErrorKind kind, String operation, int httpStatus, String message) {
        this(kind, operation, httpStatus, message, null);
    }

    public ExchangeException(ErrorKind kind, String operation, String message, Throwable cause) {
        this(kind, operation, 0, message, cause);
    }

    private ExchangeException(ErrorKind kind, String operation, int httpStatus, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", kind, operation, message), cause);
        this.kind = kind;
        this.operation = operation;
        this.httpStatus = httpStatus;
    }

    /**
     * Classify a non-2xx HTTP status.
     */
    public static ExchangeException fromHttpStatus(String operation, int status, String detail) {
        ErrorKind kind;
        if (status == 429) {
            kind = ErrorKind.RATE_LIMITED;
        } else if (status == 401 || status == 403) {
            kind = ErrorKind.INVALID_CREDENTIALS;
        } else if (status >= 500) {
            kind = ErrorKind.SERVER_ERROR;
        } else {
            kind = ErrorKind.REJECTED;
        }
        return new ExchangeException(kind, operation, status, "HTTP " + status + ": " + detail);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return HTTP status, or 0 when the failure happened before a response
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public Duration retryDelay() {
        return kind.retryDelay();
    }
}
