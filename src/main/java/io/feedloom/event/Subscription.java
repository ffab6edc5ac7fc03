package io.feedloom.event;

@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
