package com.flamingo.ai.filingrag.domain.repository;

import com.flamingo.ai.filingrag.domain.entity.FilingChunk;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for FilingChunk entities. */
@Repository
public interface FilingChunkRepository extends JpaRepository<FilingChunk, String> {

  List<FilingChunk> findByFilingIdOrderByOrdinalAsc(String filingId);

  long countByFilingId(String filingId);

  @Query("SELECT c.id FROM FilingChunk c WHERE c.filingId = :filingId")
  List<String> findIdsByFilingId(@Param("filingId") String filingId);

  @Query("SELECT c.id FROM FilingChunk c")
  List<String> findAllIds();

  @Modifying
  @Query("DELETE FROM FilingChunk c WHERE c.filingId = :filingId")
  int deleteByFilingId(@Param("filingId") String filingId);

  @Modifying
  @Query("DELETE FROM FilingChunk c WHERE c.id IN :ids")
  int deleteByIdIn(@Param("ids") Collection<String> ids);
}
