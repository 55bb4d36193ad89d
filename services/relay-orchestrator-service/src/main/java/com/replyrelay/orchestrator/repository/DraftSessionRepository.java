package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.DraftSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DraftSessionRepository extends JpaRepository<DraftSessionEntity, String> {}
