package io.feedloom.ai;

import io.feedloom.task.CancellationSignal;

import java.time.Duration;

/**
 * A text generation backend. Implementations never throw for backend failures; they report them
 * as a failed {@link AiResult} with a structured kind.
 */
public interface AiProvider {
    String id();

    boolean isAvailable();

    AiResult generate(String prompt, Duration timeout, CancellationSignal signal);
}
