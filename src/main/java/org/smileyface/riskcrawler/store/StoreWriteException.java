package org.smileyface.riskcrawler.store;

/**
 * A State Store write did not complete. The caller rolls the target back to pending so the work is
 * retried on a later cycle.
 */
public class StoreWriteException extends RuntimeException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
