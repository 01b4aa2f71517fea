package com.avatarflow.pipeline.repository;

import com.avatarflow.pipeline.entity.GenerationBatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

public interface GenerationBatchRepository extends JpaRepository<GenerationBatch, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM GenerationBatch b WHERE b.id = :id")
    Optional<GenerationBatch> findByIdForUpdate(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GenerationBatch b SET b.completedCount = b.completedCount + 1 " +
           "WHERE b.id = :id AND b.completedCount + b.failedCount < b.requestedCount")
    int incrementCompleted(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GenerationBatch b SET b.failedCount = b.failedCount + 1 " +
           "WHERE b.id = :id AND b.completedCount + b.failedCount < b.requestedCount")
    int incrementFailed(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GenerationBatch b SET b.totalCostUsd = b.totalCostUsd + :cost WHERE b.id = :id")
    int addCost(@Param("id") UUID id, @Param("cost") BigDecimal cost);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GenerationBatch b SET b.cancelRequested = true WHERE b.id = :id")
    int markCancelRequested(@Param("id") UUID id);
}
