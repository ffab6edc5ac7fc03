package io.feedloom.event;

public record CacheInvalidatedEvent(int removed, long occurredAtMs) implements BridgeEvent {
    @Override
    public EventKey key() {
        return new EventKey(EventKey.CACHE, "digests");
    }
}
