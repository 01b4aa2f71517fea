package com.avatarflow.pipeline.store;

import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.StorageConflictException;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.ContentTier;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Checks shared by the store implementations.
 */
final class StoreGuards {

    private StoreGuards() {
    }

    static void applyArtifactMutation(ContentArtifact artifact, ArtifactStatus expectedStatus,
                                      Consumer<ContentArtifact> mutation) {
        UUID id = artifact.getId();
        if (artifact.getStatus() != expectedStatus) {
            throw new StorageConflictException(String.format(
                    "Artifact %s is %s, expected %s", id, artifact.getStatus(), expectedStatus));
        }
        ContentTier tier = artifact.getTier();
        mutation.accept(artifact);

        if (artifact.getTier() != tier) {
            throw new InvalidRequestException("Tier of artifact " + id + " cannot change");
        }
        ArtifactStatus target = artifact.getStatus();
        if (target != expectedStatus && !expectedStatus.canTransitionTo(target)) {
            throw new InvalidRequestException(String.format(
                    "Artifact %s cannot move from %s to %s", id, expectedStatus, target));
        }
    }
}
