package com.flamingo.ai.filingrag.domain.repository;

import com.flamingo.ai.filingrag.domain.entity.PipelineExecution;
import com.flamingo.ai.filingrag.domain.enums.PipelineStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for PipelineExecution entities. */
@Repository
public interface PipelineExecutionRepository extends JpaRepository<PipelineExecution, UUID> {

  List<PipelineExecution> findByPipelineNameAndExecutedAtAfter(
      String pipelineName, LocalDateTime since);

  List<PipelineExecution> findTop50ByStatusOrderByExecutedAtDesc(PipelineStatus status);

  List<PipelineExecution> findTop50ByPipelineNameAndStatusOrderByExecutedAtDesc(
      String pipelineName, PipelineStatus status);

  @Query("SELECT DISTINCT e.pipelineName FROM PipelineExecution e WHERE e.executedAt > :since")
  List<String> findPipelineNamesSince(@Param("since") LocalDateTime since);
}
