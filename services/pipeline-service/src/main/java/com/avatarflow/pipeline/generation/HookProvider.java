package com.avatarflow.pipeline.generation;

import java.util.List;
import java.util.Optional;

/**
 * Writes the caption a post goes out with. The dispatcher sends whatever ends up under the
 * artifact's {@code caption} metadata key.
 */
@FunctionalInterface
public interface HookProvider {

    /**
     * @param category template category, or {@code custom} for units without a template
     * @param tags     template tags, possibly empty
     * @return empty when no caption could be written; the artifact is then posted without one
     */
    Optional<String> hookFor(String category, List<String> tags);
}
