package com.flamingo.ai.filingrag.domain.repository;

import com.flamingo.ai.filingrag.domain.entity.StructuredRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for StructuredRecord entities. */
@Repository
public interface StructuredRecordRepository extends JpaRepository<StructuredRecord, UUID> {

  List<StructuredRecord> findByFilingIdOrderByPageNumberAsc(String filingId);

  long countByFilingId(String filingId);

  @Modifying
  @Query("DELETE FROM StructuredRecord r WHERE r.filingId = :filingId")
  int deleteByFilingId(@Param("filingId") String filingId);
}
