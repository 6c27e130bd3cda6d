package com.pubsub.engine.delivery;

import com.pubsub.engine.store.StreamEntry;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Default error handler: records the failure in the log only.
 */
@DefaultBean
@ApplicationScoped
public class LoggingDeliveryErrorHandler implements DeliveryErrorHandler {

    private static final Logger LOG = Logger.getLogger(LoggingDeliveryErrorHandler.class);

    @Override
    public void onError(String stream, String listener, StreamEntry entry, Throwable error) {
        LOG.debugf("Listener %s failed on stream %s for entry %s: %s", listener, stream, entry.getId(), error.getMessage());
    }
}
