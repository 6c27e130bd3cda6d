package com.pubsub.engine.store;

public class StreamStoreException extends RuntimeException {
    public StreamStoreException(String message) {
        super(message);
    }

    public StreamStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
