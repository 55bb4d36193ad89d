package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.PollCursorEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PollCursorRepository extends JpaRepository<PollCursorEntity, String> {}
