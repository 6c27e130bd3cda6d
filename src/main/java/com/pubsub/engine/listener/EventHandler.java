package com.pubsub.engine.listener;

@FunctionalInterface
public interface EventHandler<T> {

    void handle(T data) throws Exception;
}
