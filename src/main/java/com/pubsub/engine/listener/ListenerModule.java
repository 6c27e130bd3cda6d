package com.pubsub.engine.listener;

/**
 * CDI bean that contributes listeners at startup.
 * <p>
 * Every {@code ListenerModule} bean is asked once to register its listeners with the registry.
 */
public interface ListenerModule {

    void register(ListenerRegistry registry);
}
