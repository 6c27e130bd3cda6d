package com.pubsub.engine.store;

import java.util.Objects;

/**
 * One entry read from a stream: the store-assigned id plus its single
 * {@code eventName -> payload} field.
 */
public class StreamEntry {

    private final String id;
    private final String eventName;
    private final String payload;

    public StreamEntry(String id, String eventName, String payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.eventName = Objects.requireNonNull(eventName, "eventName");
        this.payload = payload;
    }

    public String getId() {
        return id;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * Raw field value, normally a JSON document.
     */
    public String getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamEntry)) {
            return false;
        }
        StreamEntry that = (StreamEntry) o;
        return id.equals(that.id)
                && eventName.equals(that.eventName)
                && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, eventName, payload);
    }

    @Override
    public String toString() {
        return "[" + id + ", {" + eventName + "=" + payload + "}]";
    }
}
