/**
 * Feedloom: persistence, digest cache and background AI work for a feed reader.
 *
 * <p>Main entry points:
 * <ul>
 *   <li>{@link io.feedloom.runtime.FeedloomRuntime}: facade used by the interactive layer and CLI</li>
 *   <li>{@link io.feedloom.storage.ArticleStore}: articles, feeds, bookmarks and tags in SQLite</li>
 *   <li>{@link io.feedloom.cache.ArtifactCache}: fingerprint-validated digest cache</li>
 *   <li>{@link io.feedloom.task.TaskCoordinator}: single-flight worker pool with timeouts</li>
 *   <li>{@link io.feedloom.event.EventBridge}: hand-off of outcomes to the consumer thread</li>
 * </ul>
 */
package io.feedloom;
