/**
 * Runtime orchestration package.
 *
 * <p>{@link io.feedloom.runtime.FeedloomRuntime} wires the store, digest cache, task coordinator,
 * event bridge and AI provider together, and owns the task bodies for insight, translation, digest
 * and ingestion requests.
 */
package io.feedloom.runtime;
