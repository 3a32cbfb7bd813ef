package com.flamingo.ai.knowledgehub.domain.repository;

import com.flamingo.ai.knowledgehub.domain.entity.DataSourceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for per-source sync snapshots, keyed by source name. */
@Repository
public interface DataSourceStatusRepository extends JpaRepository<DataSourceStatus, String> {}
