package com.github.dimitryivaniuta.gatekeeper.ratelimit;

public class CounterStoreException extends RuntimeException {

    public CounterStoreException(String message) {
        super(message);
    }

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
