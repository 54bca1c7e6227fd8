package com.flamingo.ai.filingrag.domain.repository;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Filing entities. */
@Repository
public interface FilingRepository extends JpaRepository<Filing, String> {

  List<Filing> findByEntityIdOrderByFiscalPeriodDesc(String entityId);

  List<Filing> findByStatus(FilingStatus status);

  List<Filing> findByEntityIdAndStatus(String entityId, FilingStatus status);
}
