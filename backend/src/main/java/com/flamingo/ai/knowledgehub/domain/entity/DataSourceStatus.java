package com.flamingo.ai.knowledgehub.domain.entity;

import com.flamingo.ai.knowledgehub.domain.enums.SourceConnectionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Last sync snapshot of an external source. One row per source, overwritten by every run. */
@Entity
@Table(name = "data_source_status")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DataSourceStatus {

  @Id private String source;

  @Column(nullable = false)
  private Instant lastSync;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceConnectionStatus status;

  private int itemCount;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  private String baseId;

  private int tablesSynced;
}
