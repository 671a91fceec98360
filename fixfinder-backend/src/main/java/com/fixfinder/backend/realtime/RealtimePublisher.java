package com.fixfinder.backend.realtime;

/**
 * Outbound side of the realtime gateway. The lifecycle and message engines publish against this
 * interface only; the transport behind it is replaceable.
 *
 * <p>The injectable bean is {@link BestEffortPublisher}: publishing never throws to the caller.
 */
public interface RealtimePublisher {

    void publish(Channel channel, RealtimeEvent event);

    /** Publishes to a channel, skipping one session (the sender of a relayed event). */
    void publishExcept(Channel channel, RealtimeEvent event, String excludedSessionId);

    /** Publishes to every connected session. */
    void broadcast(RealtimeEvent event);
}
