package com.pubsub.engine.listener;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pubsub.engine.config.JacksonConfig;
import com.pubsub.engine.store.StreamEntry;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for listeners that route events by name.
 * <p>
 * Subclasses declare their handlers in the constructor:
 * <pre>{@code
 * public OrderListener() {
 *     super("orders");
 *     on("order_placed", OrderPlaced.class, this::orderPlaced);
 * }
 * }</pre>
 * An event without a registered handler is ignored. Payloads are decoded with the
 * application's {@link ObjectMapper}, which the dispatcher hands over before delivery;
 * a listener used on its own falls back to a mapper customized the same way.
 */
public abstract class EventListener implements StreamListener {

    private static final Logger LOG = Logger.getLogger(EventListener.class);
    private static final ObjectMapper DEFAULT_MAPPER = defaultMapper();

    private final String streamName;
    private final Map<String, EventHandler<JsonNode>> routes = new LinkedHashMap<>();
    private ObjectMapper objectMapper = DEFAULT_MAPPER;

    protected EventListener(String streamName) {
        this.streamName = streamName;
    }

    @Override
    public String streamName() {
        return streamName;
    }

    protected void on(String eventName, EventHandler<JsonNode> handler) {
        routes.put(eventName, handler);
    }

    protected <T> void on(String eventName, Class<T> type, EventHandler<T> handler) {
        routes.put(eventName, node -> handler.handle(objectMapper.treeToValue(node, type)));
    }

    public void useObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    protected ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Event names this listener has handlers for.
     */
    public Set<String> handledEvents() {
        return routes.keySet();
    }

    @Override
    public void handleEvent(StreamEntry entry) throws Exception {
        LOG.debugf("Received %s", entry);
        EventHandler<JsonNode> handler = routes.get(entry.getEventName());
        if (handler == null) {
            return;
        }
        JsonNode data = entry.getPayload() != null ? objectMapper.readTree(entry.getPayload()) : null;
        handler.handle(data);
    }

    private static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        new JacksonConfig().customize(mapper);
        return mapper;
    }
}
