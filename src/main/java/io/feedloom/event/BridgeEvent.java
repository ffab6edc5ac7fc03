package io.feedloom.event;

public interface BridgeEvent {
    EventKey key();

    long occurredAtMs();

    /**
     * Whether the event is queued even while no consumer is bound. Mutation notifications are not.
     */
    default boolean retainedWithoutConsumer() {
        return false;
    }
}
