package com.pubsub.engine.store;

/**
 * Raised when an acknowledgement removed anything other than exactly one pending entry.
 * The group's bookkeeping can no longer be trusted for that entry, so this is never retried.
 */
public class AckMismatchException extends StreamStoreException {

    private final String stream;
    private final String group;
    private final String entryId;
    private final long acknowledged;

    public AckMismatchException(String stream, String group, String entryId, long acknowledged) {
        super("Message could not be ACKed: " + stream + " " + group + " " + entryId
                + ". Return value: " + acknowledged);
        this.stream = stream;
        this.group = group;
        this.entryId = entryId;
        this.acknowledged = acknowledged;
    }

    public String getStream() {
        return stream;
    }

    public String getGroup() {
        return group;
    }

    public String getEntryId() {
        return entryId;
    }

    public long getAcknowledged() {
        return acknowledged;
    }
}
