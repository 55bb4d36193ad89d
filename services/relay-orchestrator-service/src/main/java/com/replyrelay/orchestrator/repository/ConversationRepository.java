package com.replyrelay.orchestrator.repository;

import com.replyrelay.orchestrator.domain.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {}
