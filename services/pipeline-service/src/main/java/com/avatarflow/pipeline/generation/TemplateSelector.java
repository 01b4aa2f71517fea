package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.model.ContentTier;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Strategy that picks the template for one unit of a batch.
 */
@FunctionalInterface
public interface TemplateSelector {

    /**
     * @param usedTemplateIds templates already assigned in the current batch, in assignment
     *                        order; implementations avoid repeating them while alternatives remain
     * @return empty when no template suits the tier
     */
    Optional<ContentTemplate> select(UUID avatarId, ContentTier tier, List<String> usedTemplateIds);
}
