package com.hits.service.core.counter;

/**
 * The counter store could not be reached or did not answer in time. The operation had no
 * effect or an unknown effect; callers own the retry policy.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
