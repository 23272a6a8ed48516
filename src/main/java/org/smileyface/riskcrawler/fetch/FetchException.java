package org.smileyface.riskcrawler.fetch;

/**
 * Failure of a single fetch attempt. Subclasses tell whether retrying is worthwhile.
 */
public abstract class FetchException extends Exception {

    protected FetchException(String message) {
        super(message);
    }

    protected FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
