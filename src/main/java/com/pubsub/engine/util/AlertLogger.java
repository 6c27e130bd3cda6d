package com.pubsub.engine.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured alerts for conditions operators must act on.
 * <p>
 * The {@code ALERT:} prefix and the debug-level detail map are what log aggregators
 * (Datadog, Splunk, Loki) match on.
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void deadLettered(String stream, String group, String entryId, int deliveries, String dlqStream) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "MESSAGE_DEAD_LETTERED");
        alertData.put("severity", "WARNING");
        alertData.put("stream", stream);
        alertData.put("group", group);
        alertData.put("entry_id", entryId);
        alertData.put("deliveries", deliveries);
        alertData.put("dlq_stream", dlqStream);

        LOG.warnf("ALERT: Moving message %s from stream %s to DLQ %s after %d deliveries",
                entryId, stream, dlqStream, deliveries);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void ackMismatch(String stream, String group, String entryId, long acknowledged) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "ACK_MISMATCH");
        alertData.put("severity", "CRITICAL");
        alertData.put("stream", stream);
        alertData.put("group", group);
        alertData.put("entry_id", entryId);
        alertData.put("acknowledged", acknowledged);

        LOG.errorf("ALERT: Ack of %s on %s/%s returned %d instead of 1. Entry may be redelivered or lost.",
                entryId, stream, group, acknowledged);
        LOG.debugf("Alert details: %s", alertData);
    }
}
