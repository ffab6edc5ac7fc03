package io.feedloom.event;

import io.feedloom.task.TaskOutcome;

/**
 * Terminal outcome of a background task. Published exactly once per task.
 */
public record TaskEvent(TaskOutcome outcome) implements BridgeEvent {
    @Override
    public EventKey key() {
        return EventKey.of(outcome.key());
    }

    @Override
    public long occurredAtMs() {
        return outcome.finishedAtMs();
    }

    @Override
    public boolean retainedWithoutConsumer() {
        return true;
    }
}
