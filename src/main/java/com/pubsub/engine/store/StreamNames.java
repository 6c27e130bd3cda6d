package com.pubsub.engine.store;

import org.jboss.logging.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Naming conventions for streams, consumer groups and consumers.
 * <p>
 * Stream names may carry an environment suffix ({@code orders-test}); groups are always
 * {@code <stream>-<group>} on the resolved stream name; consumers are {@code <host>-<worker-id>}.
 */
public final class StreamNames {

    private static final Logger LOG = Logger.getLogger(StreamNames.class);

    private final String suffix;

    public StreamNames(Optional<String> suffix) {
        this.suffix = suffix.orElse(null);
    }

    public String stream(String base) {
        if (suffix == null) {
            return base;
        }
        return base + "-" + suffix;
    }

    public String group(String baseStream, String group) {
        return stream(baseStream) + "-" + group;
    }

    public static String consumer(String host, String workerId) {
        return host + "-" + workerId;
    }

    public static String localConsumer(String workerId) {
        return consumer(localHostName(), workerId);
    }

    static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            LOG.debugf("Local host name not resolvable (%s), falling back to %s", e.getMessage(), env);
            return env != null && !env.isBlank() ? env : "localhost";
        }
    }
}
