package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.BlacklistEntryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BlacklistEntryRepository extends JpaRepository<BlacklistEntryEntity, String> {

  List<BlacklistEntryEntity> findAllByOrderByBlockedAtDesc();
}
