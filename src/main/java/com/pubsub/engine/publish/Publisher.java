package com.pubsub.engine.publish;

/**
 * Publishes events as single-field stream entries: {@code eventName -> JSON(data)}.
 */
public interface Publisher {

    /**
     * Publishes to this publisher's default stream.
     *
     * @return id of the new stream entry
     */
    String publish(String eventName, Object data);

    /**
     * Publishes to {@code stream}, or to the default stream when {@code stream} is null.
     *
     * @return id of the new stream entry
     */
    String publish(String eventName, Object data, String stream);

    /**
     * Base name of the stream used when none is given.
     */
    String streamName();
}
