package com.flamingo.ai.knowledgehub.domain.repository;

import com.flamingo.ai.knowledgehub.domain.entity.WebhookLog;
import com.flamingo.ai.knowledgehub.domain.enums.WebhookStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the webhook audit trail. */
@Repository
public interface WebhookLogRepository extends JpaRepository<WebhookLog, UUID> {

  /** Most recent deliveries first. */
  List<WebhookLog> findTop50ByOrderByCreatedAtDesc();

  /** Counts deliveries by outcome. */
  long countByStatus(WebhookStatus status);
}
