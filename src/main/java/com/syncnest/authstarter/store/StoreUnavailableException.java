package com.syncnest.authstarter.store;

/**
 * The key-value store could not be reached after the retry policy ran out.
 * Internal only: callers map it to their own fail-open / fail-closed behaviour.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
