package com.autocoin.infrastructure.stream;

/**
 * Market data stream failure.
 *
 * Connection loss, timeouts and peer closes are retryable. A fatal exception means
 * the stream has given up and will not reconnect.
 */
public class StreamException extends RuntimeException {

    private final boolean fatal;

    public StreamException(String message) {
        this(message, null, false);
    }

    public StreamException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private StreamException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    public static StreamException fatal(String message, Throwable cause) {
        return new StreamException(message, cause, true);
    }

    public boolean isFatal() {
        return fatal;
    }
}
