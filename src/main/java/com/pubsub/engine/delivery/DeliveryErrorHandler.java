package com.pubsub.engine.delivery;

import com.pubsub.engine.store.StreamEntry;

/**
 * Callback invoked for every listener failure.
 * <p>
 * Replace the default {@link LoggingDeliveryErrorHandler} by declaring an application bean
 * implementing this interface (error trackers, alerting).
 */
public interface DeliveryErrorHandler {

    /**
     * @param stream   base name of the stream the entry was read from
     * @param listener name of the listener that failed
     * @param entry    the raw entry being delivered
     * @param error    what the listener threw
     */
    void onError(String stream, String listener, StreamEntry entry, Throwable error);
}
