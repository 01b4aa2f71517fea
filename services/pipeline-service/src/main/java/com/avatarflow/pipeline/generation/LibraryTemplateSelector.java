package com.avatarflow.pipeline.generation;

import com.avatarflow.pipeline.model.ContentTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Walks the template library in order, taking the first template not yet used in the batch.
 * Once every template of the tier has been used it rotates through them again.
 */
@Component
@RequiredArgsConstructor
public class LibraryTemplateSelector implements TemplateSelector {

    private final TemplateLibrary library;

    @Override
    public Optional<ContentTemplate> select(UUID avatarId, ContentTier tier, List<String> usedTemplateIds) {
        List<ContentTemplate> candidates = library.byTier(tier);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Set<String> tierIds = candidates.stream().map(ContentTemplate::getId).collect(Collectors.toSet());
        long usedInTier = usedTemplateIds.stream().filter(tierIds::contains).count();

        return candidates.stream()
                .filter(t -> !usedTemplateIds.contains(t.getId()))
                .findFirst()
                .or(() -> Optional.of(candidates.get((int) (usedInTier % candidates.size()))));
    }
}
