package com.hits.service.core.counter;

/** A counter key was missing, blank or longer than the configured limit. */
public class InvalidKeyException extends IllegalArgumentException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
