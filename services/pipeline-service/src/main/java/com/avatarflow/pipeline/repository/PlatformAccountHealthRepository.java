package com.avatarflow.pipeline.repository;

import com.avatarflow.pipeline.entity.PlatformAccountHealth;
import com.avatarflow.pipeline.model.AccountHealth;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PlatformAccountHealthRepository extends JpaRepository<PlatformAccountHealth, UUID> {

    List<PlatformAccountHealth> findByHealth(AccountHealth health);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM PlatformAccountHealth h WHERE h.platformAccountId = :id")
    Optional<PlatformAccountHealth> findByIdForUpdate(@Param("id") UUID id);
}
