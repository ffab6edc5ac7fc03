/**
 * Background task execution: a fixed worker pool, at most one in-flight task per key, a deadline
 * per task and one retry for transient failures. Terminal outcomes are published to the
 * {@link io.feedloom.event.EventBridge}.
 */
package io.feedloom.task;
