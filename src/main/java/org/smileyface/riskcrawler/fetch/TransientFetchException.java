package org.smileyface.riskcrawler.fetch;

/**
 * Network errors, timeouts, throttling and server errors.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
