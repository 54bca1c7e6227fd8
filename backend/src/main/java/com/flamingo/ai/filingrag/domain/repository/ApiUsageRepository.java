package com.flamingo.ai.filingrag.domain.repository;

import com.flamingo.ai.filingrag.domain.entity.ApiUsage;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ApiUsage entities. */
@Repository
public interface ApiUsageRepository extends JpaRepository<ApiUsage, UUID> {

  List<ApiUsage> findByRecordedAtAfter(LocalDateTime since);

  /** Rows of {@code [apiName, totalCost]} since the given time. */
  @Query(
      "SELECT u.apiName, COALESCE(SUM(u.costUsd), 0) FROM ApiUsage u "
          + "WHERE u.recordedAt > :since GROUP BY u.apiName")
  List<Object[]> sumCostByApiSince(@Param("since") LocalDateTime since);
}
