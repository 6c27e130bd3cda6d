package com.pubsub.engine.delivery;

import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.listener.ListenerRegistration;
import com.pubsub.engine.store.AckMismatchException;
import com.pubsub.engine.store.StreamEntry;
import com.pubsub.engine.store.StreamStore;
import com.pubsub.engine.util.AlertLogger;
import com.pubsub.engine.util.DeliveryMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.List;

/**
 * Decides what one consumer works on next for a stream, hands it to the listeners, and
 * settles the outcome with the store.
 * <p>
 * One poll cycle:
 * <ol>
 *   <li>Skip the stream if its consumer group does not exist.</li>
 *   <li>Claim the oldest stuck entry (idle for at least {@code min-idle-time-ms}). If its
 *       delivery count exceeds {@code max-retries} it is moved to the dead-letter stream and
 *       the next stuck entry is claimed; otherwise it is this cycle's only unit of work.</li>
 *   <li>With nothing stuck, read the batch of new entries instead.</li>
 *   <li>Dispatch each entry; ack the ones every listener accepted, leave the rest pending.</li>
 * </ol>
 * Stuck entries are always drained before new ones are read.
 */
@ApplicationScoped
public class DeliveryEngine {

    private static final Logger LOG = Logger.getLogger(DeliveryEngine.class);

    static final int CLAIM_COUNT = 1;

    private final StreamStore store;
    private final PubSubConfig config;
    private final DeadLetterRouter deadLetterRouter;
    private final Dispatcher dispatcher;
    private final DeliveryMetrics metrics;

    @Inject
    public DeliveryEngine(StreamStore store,
                          PubSubConfig config,
                          DeadLetterRouter deadLetterRouter,
                          Dispatcher dispatcher,
                          DeliveryMetrics metrics) {
        this.store = store;
        this.config = config;
        this.deadLetterRouter = deadLetterRouter;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    /**
     * Runs one poll cycle for {@code stream} on behalf of {@code consumer}.
     *
     * @return number of entries acknowledged
     * @throws AckMismatchException if the store reports an inconsistent acknowledgement
     */
    public int pollStream(String stream, List<ListenerRegistration> listeners, String consumer) {
        String group = config.getGroupName();
        if (!store.groupExists(stream, group)) {
            return 0;
        }

        List<StreamEntry> work = nextWork(stream, consumer);
        int acked = 0;
        for (StreamEntry entry : work) {
            DispatchResult result = dispatcher.dispatch(stream, entry, listeners);
            if (!result.isSuccess()) {
                LOG.debugf("Leaving %s pending on %s: %d of %d listener(s) failed",
                        entry.getId(), stream, result.getFailed(), result.getInvoked());
                continue;
            }
            markProcessed(stream, group, entry);
            acked++;
        }
        return acked;
    }

    /**
     * Picks this cycle's unit of work: one reclaimed entry, or else the new entries.
     * Entries over the retry limit met along the way are dead-lettered.
     */
    List<StreamEntry> nextWork(String stream, String consumer) {
        StreamEntry stuck = claimNextStuckEntry(stream, consumer);
        if (stuck != null) {
            return List.of(stuck);
        }
        List<StreamEntry> fresh = store.readNext(stream, config.getGroupName(), consumer);
        return fresh != null ? fresh : Collections.emptyList();
    }

    /**
     * Claims stuck entries one at a time until one is within the retry budget or none is left.
     */
    StreamEntry claimNextStuckEntry(String stream, String consumer) {
        String group = config.getGroupName();
        while (true) {
            List<StreamEntry> claimed = store.claimStuck(stream, group, consumer, config.getMinIdleTimeMs(), CLAIM_COUNT);
            if (claimed == null || claimed.isEmpty()) {
                return null;
            }
            StreamEntry entry = claimed.get(0);
            int deliveries = store.retryCount(stream, group, entry.getId());
            if (deliveries > config.getMaxRetries()) {
                deadLetterRouter.route(stream, entry, deliveries);
                continue;
            }
            metrics.incrementReclaimed();
            LOG.infof("Reclaimed stuck message %s on stream %s for %s (delivery %d)",
                    entry.getId(), stream, consumer, deliveries);
            return entry;
        }
    }

    private void markProcessed(String stream, String group, StreamEntry entry) {
        try {
            store.ack(stream, group, entry.getId());
            metrics.incrementAcked();
        } catch (AckMismatchException e) {
            AlertLogger.ackMismatch(e.getStream(), e.getGroup(), e.getEntryId(), e.getAcknowledged());
            throw e;
        }
    }
}
