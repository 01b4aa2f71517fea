package com.avatarflow.pipeline.repository;

import com.avatarflow.pipeline.entity.ScheduledPost;
import com.avatarflow.pipeline.model.PostStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ScheduledPostRepository extends JpaRepository<ScheduledPost, UUID> {

    Optional<ScheduledPost> findByActiveKey(String activeKey);

    List<ScheduledPost> findByPlatformAccountIdOrderByScheduledAtAsc(UUID platformAccountId);

    List<ScheduledPost> findByPlatformAccountIdAndStatusInOrderByScheduledAtAsc(UUID platformAccountId,
                                                                                Collection<PostStatus> statuses);

    List<ScheduledPost> findByArtifactIdOrderByScheduledAtAsc(UUID artifactId);

    @Query("SELECT p FROM ScheduledPost p WHERE p.status = :status AND p.scheduledAt <= :now ORDER BY p.scheduledAt ASC")
    List<ScheduledPost> findDue(@Param("status") PostStatus status, @Param("now") OffsetDateTime now, Pageable page);

    @Query("SELECT p FROM ScheduledPost p WHERE p.status = :status AND p.publishStartedAt < :before ORDER BY p.scheduledAt ASC")
    List<ScheduledPost> findStartedBefore(@Param("status") PostStatus status, @Param("before") OffsetDateTime before);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ScheduledPost p WHERE p.id = :id")
    Optional<ScheduledPost> findByIdForUpdate(@Param("id") UUID id);
}
