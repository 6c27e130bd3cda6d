package com.pubsub.engine.store;

import com.pubsub.engine.config.PubSubConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamStoreFacadeTest {

    @Mock
    RedisStreamStore redisStore;

    @Mock
    InMemoryStreamStore inMemoryStore;

    private PubSubConfig config;
    private StreamStoreFacade facade;

    @BeforeEach
    void setUp() {
        config = new PubSubConfig();
        facade = new StreamStoreFacade();
        facade.config = config;
        facade.redisStore = redisStore;
        facade.inMemoryStore = inMemoryStore;
    }

    @Test
    void delegatesToRedisByDefault() {
        when(redisStore.publish("orders", "order_placed", "{}")).thenReturn("1-0");

        assertThat(facade.publish("orders", "order_placed", "{}")).isEqualTo("1-0");
        verifyNoInteractions(inMemoryStore);
    }

    @Test
    void delegatesToInMemoryStoreWhenConfigured() {
        config.setStoreMode(PubSubConfig.MODE_IN_MEMORY);
        when(inMemoryStore.groupExists("orders", "workers")).thenReturn(true);

        assertThat(facade.groupExists("orders", "workers")).isTrue();
        facade.ack("orders", "workers", "1-0");

        verify(inMemoryStore).ack("orders", "workers", "1-0");
        verifyNoInteractions(redisStore);
    }
}
