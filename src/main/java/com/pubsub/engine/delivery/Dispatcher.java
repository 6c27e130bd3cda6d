package com.pubsub.engine.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pubsub.engine.listener.EventListener;
import com.pubsub.engine.listener.ListenerRegistration;
import com.pubsub.engine.listener.StreamListener;
import com.pubsub.engine.store.StreamEntry;
import com.pubsub.engine.util.DeliveryMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Delivers one entry to every listener of its stream.
 * <p>
 * Listeners run sequentially in registration order, each on a fresh instance. A failing
 * listener does not stop the ones after it, but any failure fails the entry as a whole.
 * This includes {@link Error}s thrown by a listener, such as a {@code StackOverflowError}.
 * {@link EventListener}s decode payloads with the application's {@link ObjectMapper}.
 */
@ApplicationScoped
public class Dispatcher {

    private static final Logger LOG = Logger.getLogger(Dispatcher.class);

    private final DeliveryErrorHandler errorHandler;
    private final DeliveryMetrics metrics;
    private final ObjectMapper objectMapper;

    @Inject
    public Dispatcher(DeliveryErrorHandler errorHandler, DeliveryMetrics metrics, ObjectMapper objectMapper) {
        this.errorHandler = errorHandler;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    public DispatchResult dispatch(String stream, StreamEntry entry, List<ListenerRegistration> listeners) {
        int failed = 0;
        for (ListenerRegistration registration : listeners) {
            try {
                invokeListener(stream, entry, registration);
            } catch (Throwable e) {
                failed++;
                metrics.incrementListenerFailure();
                LOG.errorf(e, "Listener %s failed on stream %s for message %s",
                        registration.getListenerName(), stream, entry.getId());
                notifyErrorHandler(stream, registration, entry, e);
            }
        }
        metrics.incrementDelivered();
        return new DispatchResult(listeners.size(), failed);
    }

    private void invokeListener(String stream, StreamEntry entry, ListenerRegistration registration) throws Exception {
        LOG.infof("Invoking listener %s for stream %s with message %s",
                registration.getListenerName(), stream, entry);
        StreamListener listener = registration.newListener();
        if (listener instanceof EventListener) {
            ((EventListener) listener).useObjectMapper(objectMapper);
        }
        listener.handleEvent(entry);
    }

    private void notifyErrorHandler(String stream, ListenerRegistration registration, StreamEntry entry, Throwable error) {
        try {
            errorHandler.onError(stream, registration.getListenerName(), entry, error);
        } catch (Throwable handlerError) {
            LOG.warnf(handlerError, "Error handler failed while reporting message %s on stream %s",
                    entry.getId(), stream);
        }
    }
}
