package com.flamingo.ai.knowledgehub.domain.entity;

import com.flamingo.ai.knowledgehub.domain.converter.JsonMapConverter;
import com.flamingo.ai.knowledgehub.domain.enums.WebhookDirection;
import com.flamingo.ai.knowledgehub.domain.enums.WebhookStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Append-only audit row: one per webhook delivery outcome, not one per attempt. */
@Entity
@Table(name = "webhook_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private WebhookDirection direction;

  @Column(nullable = false)
  private String endpoint;

  @Column(nullable = false)
  private String eventType;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Object> payload;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Object> response;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private WebhookStatus status = WebhookStatus.PENDING;

  /** Attempts made before the outcome was reached. */
  private int attempts;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
