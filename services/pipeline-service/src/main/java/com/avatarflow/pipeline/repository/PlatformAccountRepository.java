package com.avatarflow.pipeline.repository;

import com.avatarflow.pipeline.entity.PlatformAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PlatformAccountRepository extends JpaRepository<PlatformAccount, UUID> {
}
