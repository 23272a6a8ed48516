package org.smileyface.riskcrawler.fetch;

/**
 * Target unreachable, gone, forbidden or blocked by policy.
 */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(String message) {
        super(message);
    }

    public PermanentFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
