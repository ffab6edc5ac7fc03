package io.feedloom.event;

import io.feedloom.model.TaskKey;
import io.feedloom.model.TaskKind;
import io.feedloom.model.TaskStatus;
import io.feedloom.task.TaskOutcome;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class EventBridgeTest {

    @Test
    void deliversOnConsumerThreadInPublishOrder() throws Exception {
        EventBridge bridge = new EventBridge();
        bridge.bindConsumer();
        try {
            List<String> seen = new ArrayList<>();
            List<Thread> threads = new ArrayList<>();
            bridge.subscribe(EventKey.article("a1"), event -> {
                seen.add(((ArticleEvent) event).type().name());
                threads.add(Thread.currentThread());
            });

            Thread producer = new Thread(() -> {
                bridge.publish(new ArticleEvent(ArticleEvent.Type.BOOKMARK_ADDED, "a1", 1L));
                bridge.publish(new ArticleEvent(ArticleEvent.Type.TAGS_CHANGED, "a1", 2L));
                bridge.publish(new ArticleEvent(ArticleEvent.Type.MEMO_CHANGED, "a2", 3L));
                bridge.publish(new ArticleEvent(ArticleEvent.Type.BOOKMARK_REMOVED, "a1", 4L));
            }, "producer");
            producer.start();
            producer.join();

            Assertions.assertEquals(4, bridge.pendingCount());
            Assertions.assertEquals(4, bridge.dispatchPending());
            Assertions.assertEquals(List.of("BOOKMARK_ADDED", "TAGS_CHANGED", "BOOKMARK_REMOVED"), seen);
            Assertions.assertTrue(threads.stream().allMatch(t -> t == Thread.currentThread()));
            Assertions.assertEquals(0, bridge.dispatchPending());
        } finally {
            bridge.unbindConsumer();
        }
    }

    @Test
    void dispatchOffTheConsumerThreadIsRejected() throws Exception {
        EventBridge bridge = new EventBridge();
        Assertions.assertThrows(IllegalStateException.class, bridge::dispatchPending);

        bridge.bindConsumer();
        try {
            AtomicReference<Throwable> fromOther = new AtomicReference<>();
            Thread other = new Thread(() -> {
                try {
                    bridge.dispatchPending();
                } catch (Throwable t) {
                    fromOther.set(t);
                }
                try {
                    bridge.bindConsumer();
                } catch (Throwable t) {
                    fromOther.compareAndSet(null, t);
                }
            });
            other.start();
            other.join();
            Assertions.assertInstanceOf(IllegalStateException.class, fromOther.get());
            Assertions.assertTrue(bridge.isConsumerThread());
        } finally {
            bridge.unbindConsumer();
        }
        Assertions.assertFalse(bridge.isConsumerThread());
    }

    @Test
    void awaitWakesOnPublishAndTimesOutWhenIdle() throws Exception {
        EventBridge bridge = new EventBridge();
        bridge.bindConsumer();
        try {
            Assertions.assertEquals(0, bridge.awaitAndDispatch(Duration.ofMillis(20)));

            List<BridgeEvent> all = new ArrayList<>();
            Subscription sub = bridge.subscribeAll(all::add);
            CountDownLatch started = new CountDownLatch(1);
            Thread producer = new Thread(() -> {
                started.countDown();
                try {
                    Thread.sleep(50L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                bridge.publish(new CacheInvalidatedEvent(2, 5L));
            });
            producer.start();
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(1, bridge.awaitAndDispatch(Duration.ofSeconds(5)));
            producer.join();
            Assertions.assertEquals(1, all.size());
            Assertions.assertEquals("cache:digests", all.get(0).key().toString());

            sub.close();
            bridge.publish(new CacheInvalidatedEvent(0, 6L));
            Assertions.assertEquals(1, bridge.dispatchPending());
            Assertions.assertEquals(1, all.size());
        } finally {
            bridge.unbindConsumer();
        }
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        EventBridge bridge = new EventBridge();
        bridge.bindConsumer();
        try {
            List<String> seen = new ArrayList<>();
            bridge.subscribe(EventKey.article("x"), event -> {
                throw new IllegalStateException("boom");
            });
            bridge.subscribe(EventKey.article("x"), event -> seen.add("second"));
            bridge.subscribeAll(event -> seen.add("all"));
            bridge.publish(new ArticleEvent(ArticleEvent.Type.READ_CHANGED, "x", 1L));
            Assertions.assertEquals(1, bridge.dispatchPending());
            Assertions.assertEquals(List.of("second", "all"), seen);
        } finally {
            bridge.unbindConsumer();
        }
    }

    @Test
    void notificationsWithoutConsumerAreDroppedButTaskOutcomesKept() {
        EventBridge bridge = new EventBridge();
        TaskKey key = new TaskKey(TaskKind.INGEST, "feed");
        bridge.publish(new ArticleEvent(ArticleEvent.Type.UPSERTED, "a1", 1L));
        bridge.publish(new CacheInvalidatedEvent(1, 2L));
        bridge.publish(new TaskEvent(new TaskOutcome(key, TaskStatus.DONE, "ok", null, 1, 1L, 2L, 3L)));
        Assertions.assertEquals(1, bridge.pendingCount());
        Assertions.assertEquals(2L, bridge.droppedCount());

        bridge.bindConsumer();
        try {
            List<TaskStatus> seen = new ArrayList<>();
            bridge.subscribe(EventKey.of(key), event -> seen.add(((TaskEvent) event).outcome().status()));
            bridge.publish(new ArticleEvent(ArticleEvent.Type.UPSERTED, "a1", 4L));
            Assertions.assertEquals(2, bridge.dispatchPending());
            Assertions.assertEquals(List.of(TaskStatus.DONE), seen);
            Assertions.assertEquals(2L, bridge.droppedCount());
        } finally {
            bridge.unbindConsumer();
        }
    }

    @Test
    void keysNormalizeKind() {
        Assertions.assertEquals(new EventKey("article", "1"), new EventKey(" ARTICLE ", "1"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EventKey(" ", "1"));
    }
}
