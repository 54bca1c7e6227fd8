package com.flamingo.ai.filingrag.domain.repository;

import com.flamingo.ai.filingrag.domain.entity.FinancialMetric;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for FinancialMetric entities. Reads on the query path go through JDBC instead. */
@Repository
public interface FinancialMetricRepository extends JpaRepository<FinancialMetric, UUID> {

  long countByFilingId(String filingId);

  @Modifying
  @Query("DELETE FROM FinancialMetric m WHERE m.filingId = :filingId")
  int deleteByFilingId(@Param("filingId") String filingId);
}
