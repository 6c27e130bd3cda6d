package com.pubsub.engine.listener;

import com.pubsub.engine.store.StreamEntry;

/**
 * Receives the events of one stream.
 * <p>
 * A new instance is created for every delivered message, so implementations may keep
 * per-message state in fields. Throwing from {@link #handleEvent} leaves the message
 * unacknowledged; it will be redelivered once it becomes eligible for reclamation.
 */
public interface StreamListener {

    /**
     * Base name of the stream this listener consumes.
     */
    String streamName();

    void handleEvent(StreamEntry entry) throws Exception;
}
