package com.williamcallahan.llmrouter.service;

/**
 * Raised for calls that produced no HTTP response at all.
 *
 * <p>The dispatcher hands every instance to the provider's response normalizer.</p>
 */
public class TransportException extends Exception {

    private final boolean timedOut;
    private final boolean cancelled;

    /**
     * @param message human-readable failure description
     * @param timedOut true when the deadline elapsed before a response arrived
     * @param cause underlying client failure
     */
    public TransportException(String message, boolean timedOut, Throwable cause) {
        this(message, timedOut, false, cause);
    }

    /**
     * @param message human-readable failure description
     * @param timedOut true when the deadline elapsed before a response arrived
     * @param cancelled true when the calling thread was interrupted while waiting
     * @param cause underlying client failure
     */
    public TransportException(String message, boolean timedOut, boolean cancelled, Throwable cause) {
        super(message, cause);
        this.timedOut = timedOut;
        this.cancelled = cancelled;
    }

    /**
     * @return true when the failure was a connect or read timeout
     */
    public boolean isTimedOut() {
        return timedOut;
    }

    /**
     * @return true when the caller abandoned the call by interrupting its thread
     */
    public boolean isCancelled() {
        return cancelled;
    }
}
