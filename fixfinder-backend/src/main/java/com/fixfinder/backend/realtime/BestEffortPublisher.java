package com.fixfinder.backend.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Log-and-continue wrapper around the transport. A push is an optimization on top of the store write
 * that preceded it, so a failed push is logged at warn and dropped.
 */
@Component
@Primary
@Slf4j
public class BestEffortPublisher implements RealtimePublisher {

    private final RealtimePublisher delegate;

    public BestEffortPublisher(@Qualifier("webSocketRealtimePublisher") RealtimePublisher delegate) {
        this.delegate = delegate;
    }

    @Override
    public void publish(Channel channel, RealtimeEvent event) {
        try {
            delegate.publish(channel, event);
        } catch (RuntimeException ex) {
            log.warn("Dropped {} for {}: {}", event.name(), channel.key(), ex.getMessage(), ex);
        }
    }

    @Override
    public void publishExcept(Channel channel, RealtimeEvent event, String excludedSessionId) {
        try {
            delegate.publishExcept(channel, event, excludedSessionId);
        } catch (RuntimeException ex) {
            log.warn("Dropped relay {} for {}: {}", event.name(), channel.key(), ex.getMessage(), ex);
        }
    }

    @Override
    public void broadcast(RealtimeEvent event) {
        try {
            delegate.broadcast(event);
        } catch (RuntimeException ex) {
            log.warn("Dropped broadcast {}: {}", event.name(), ex.getMessage(), ex);
        }
    }
}
