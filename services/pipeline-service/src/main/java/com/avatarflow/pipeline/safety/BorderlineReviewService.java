package com.avatarflow.pipeline.safety;

import com.avatarflow.pipeline.config.PipelineProperties;
import com.avatarflow.pipeline.dto.ReviewRequest;
import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.exception.InvalidRequestException;
import com.avatarflow.pipeline.exception.PipelineException;
import com.avatarflow.pipeline.exception.ResourceNotFoundException;
import com.avatarflow.pipeline.model.ArtifactStatus;
import com.avatarflow.pipeline.model.BorderlinePolicy;
import com.avatarflow.pipeline.store.ContentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Resolves artifacts the safety gate classified as borderline, either by an operator decision
 * or, under {@link BorderlinePolicy#AUTO_APPROVE}, once they have waited long enough.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BorderlineReviewService {

    private final ContentStore store;
    private final PipelineProperties properties;
    private final Clock clock;

    public ContentArtifact approve(UUID artifactId, ReviewRequest review) {
        requireBorderline(artifactId);
        ContentArtifact approved = store.updateArtifact(artifactId, ArtifactStatus.BORDERLINE, a -> {
            a.setStatus(ArtifactStatus.ELIGIBLE);
            a.getMetadata().put("review_decision", "approved");
            recordReviewer(a, review);
            a.setUpdatedAt(OffsetDateTime.now(clock));
        });
        log.info("Borderline artifact {} approved by {}", artifactId, reviewer(review));
        return approved;
    }

    public ContentArtifact reject(UUID artifactId, ReviewRequest review) {
        requireBorderline(artifactId);
        ContentArtifact rejected = store.updateArtifact(artifactId, ArtifactStatus.BORDERLINE, a -> {
            a.setStatus(ArtifactStatus.REJECTED);
            a.getMetadata().put("review_decision", "rejected");
            recordReviewer(a, review);
            a.setUpdatedAt(OffsetDateTime.now(clock));
        });
        log.info("Borderline artifact {} rejected by {}", artifactId, reviewer(review));
        return rejected;
    }

    @Scheduled(fixedDelayString = "${pipeline.safety.review-sweep-ms:300000}")
    public void scheduledSweep() {
        if (properties.getSafety().getBorderlinePolicy() == BorderlinePolicy.AUTO_APPROVE) {
            autoApproveExpired();
        }
    }

    /**
     * Promote every borderline artifact older than the review window.
     *
     * @return number of artifacts promoted
     */
    public int autoApproveExpired() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(properties.getSafety().getAutoApproveAfter());
        int promoted = 0;
        for (ContentArtifact artifact : store.listArtifactsByStatus(ArtifactStatus.BORDERLINE)) {
            OffsetDateTime classifiedAt = artifact.getSafetyCheckedAt() != null
                    ? artifact.getSafetyCheckedAt()
                    : artifact.getCreatedAt();
            if (classifiedAt.isAfter(cutoff)) {
                continue;
            }
            try {
                store.updateArtifact(artifact.getId(), ArtifactStatus.BORDERLINE, a -> {
                    a.setStatus(ArtifactStatus.ELIGIBLE);
                    a.getMetadata().put("review_decision", "auto_approved");
                    a.setUpdatedAt(OffsetDateTime.now(clock));
                });
                promoted++;
            } catch (PipelineException e) {
                // Reviewed concurrently
                log.debug("Skipping auto-approval of {}: {}", artifact.getId(), e.getMessage());
            }
        }
        if (promoted > 0) {
            log.info("Auto-approved {} borderline artifacts", promoted);
        }
        return promoted;
    }

    private void requireBorderline(UUID artifactId) {
        ContentArtifact artifact = store.findArtifact(artifactId)
                .orElseThrow(() -> ResourceNotFoundException.of("Artifact", artifactId));
        if (artifact.getStatus() != ArtifactStatus.BORDERLINE) {
            throw new InvalidRequestException(String.format(
                    "Artifact %s is %s, only BORDERLINE artifacts can be reviewed", artifactId, artifact.getStatus()));
        }
    }

    private static void recordReviewer(ContentArtifact artifact, ReviewRequest review) {
        if (review == null) {
            return;
        }
        if (review.getReviewer() != null) {
            artifact.getMetadata().put("reviewer", review.getReviewer());
        }
        if (review.getNote() != null) {
            artifact.getMetadata().put("review_note", review.getNote());
        }
    }

    private static String reviewer(ReviewRequest review) {
        return review != null && review.getReviewer() != null ? review.getReviewer() : "operator";
    }
}
