package com.avatarflow.pipeline.repository;

import com.avatarflow.pipeline.entity.ContentArtifact;
import com.avatarflow.pipeline.model.ArtifactStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ContentArtifactRepository extends JpaRepository<ContentArtifact, UUID> {

    List<ContentArtifact> findByAvatarIdAndStatusOrderByCreatedAtAsc(UUID avatarId, ArtifactStatus status);

    List<ContentArtifact> findByBatchIdOrderByCreatedAtAsc(UUID batchId);

    List<ContentArtifact> findByAvatarIdOrderByCreatedAtAsc(UUID avatarId);

    List<ContentArtifact> findByStatusOrderByCreatedAtAsc(ArtifactStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ContentArtifact a WHERE a.id = :id")
    Optional<ContentArtifact> findByIdForUpdate(@Param("id") UUID id);
}
