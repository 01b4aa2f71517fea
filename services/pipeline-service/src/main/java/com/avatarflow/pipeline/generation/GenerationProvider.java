package com.avatarflow.pipeline.generation;

import java.time.Duration;

/**
 * Produces one piece of media for an avatar from a prompt.
 */
public interface GenerationProvider {

    /**
     * Generate synchronously within {@code timeout}.
     *
     * @throws com.avatarflow.pipeline.exception.TransientProviderException on timeouts, rate
     *         limits and provider outages; the caller may retry
     * @throws com.avatarflow.pipeline.exception.PermanentProviderException when the request
     *         itself is refused
     */
    GenerationResult generate(GenerationRequest request, Duration timeout);
}
