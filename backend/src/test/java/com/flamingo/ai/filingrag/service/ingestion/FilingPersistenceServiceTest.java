package com.flamingo.ai.filingrag.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;
import com.flamingo.ai.filingrag.domain.repository.FilingChunkRepository;
import com.flamingo.ai.filingrag.domain.repository.FilingRepository;
import com.flamingo.ai.filingrag.domain.repository.FinancialMetricRepository;
import com.flamingo.ai.filingrag.domain.repository.StructuredRecordRepository;
import com.flamingo.ai.filingrag.exception.DuplicateFilingException;
import com.flamingo.ai.filingrag.service.acquisition.FilingLocation;
import com.flamingo.ai.filingrag.service.chunking.TextChunk;
import com.flamingo.ai.filingrag.service.structured.FinancialMetricMapper;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FilingPersistenceService Tests")
class FilingPersistenceServiceTest {

  private static final String FILING_ID = "TSLA:10-K:2020";
  private static final String OLD_URL = "https://filings.example.com/tsla-10k-2020-v1.htm";
  private static final String NEW_URL = "https://filings.example.com/tsla-10k-2020-v2.htm";

  @Mock private FilingRepository filingRepository;
  @Mock private FilingChunkRepository chunkRepository;
  @Mock private StructuredRecordRepository structuredRecordRepository;
  @Mock private FinancialMetricRepository financialMetricRepository;
  @Mock private FinancialMetricMapper financialMetricMapper;

  private FilingPersistenceService service;

  private final FilingLocation location =
      new FilingLocation(FILING_ID, "TSLA", "10-K", "2020", NEW_URL);

  @BeforeEach
  void setUp() {
    service =
        new FilingPersistenceService(
            filingRepository,
            chunkRepository,
            structuredRecordRepository,
            financialMetricRepository,
            financialMetricMapper);
  }

  private static Filing readyFiling() {
    Filing filing =
        Filing.builder()
            .id(FILING_ID)
            .entityId("TSLA")
            .documentType("10-K")
            .fiscalPeriod("2020")
            .sourceUrl(OLD_URL)
            .contentType("text/html")
            .build();
    filing.markReady(12, 3, false);
    return filing;
  }

  @Nested
  @DisplayName("Claim Tests")
  class ClaimTests {

    @Test
    @DisplayName("Should keep the old rows and remember the READY state when replacing")
    void shouldSnapshotReadyFiling_whenReplacing() {
      // Given
      when(filingRepository.findById(FILING_ID)).thenReturn(Optional.of(readyFiling()));
      when(filingRepository.saveAndFlush(any(Filing.class))).thenAnswer(i -> i.getArgument(0));

      // When
      FilingClaim claim = service.claim(location, true);

      // Then
      assertThat(claim.replacedExisting()).isTrue();
      assertThat(claim.filing().getStatus()).isEqualTo(FilingStatus.INGESTING);
      assertThat(claim.previousReady().sourceUrl()).isEqualTo(OLD_URL);
      assertThat(claim.previousReady().chunkCount()).isEqualTo(12);
      verify(chunkRepository, never()).deleteByFilingId(anyString());
      verify(financialMetricRepository, never()).deleteByFilingId(anyString());
    }

    @Test
    @DisplayName("Should replace a FAILED filing without a READY state to restore")
    void shouldReplaceFailedFiling() {
      // Given
      Filing failed = readyFiling();
      failed.markFailed(IngestionStage.EMBED, "Embedding model unavailable");
      when(filingRepository.findById(FILING_ID)).thenReturn(Optional.of(failed));
      when(filingRepository.saveAndFlush(any(Filing.class))).thenAnswer(i -> i.getArgument(0));

      // When
      FilingClaim claim = service.claim(location, false);

      // Then
      assertThat(claim.replacedExisting()).isTrue();
      assertThat(claim.previousReady()).isNull();
      assertThat(claim.filing().getFailedStage()).isNull();
    }

    @Test
    @DisplayName("Should reject a READY filing unless replacing")
    void shouldReject_whenReadyAndNotReplacing() {
      when(filingRepository.findById(FILING_ID)).thenReturn(Optional.of(readyFiling()));

      assertThatThrownBy(() -> service.claim(location, false))
          .isInstanceOf(DuplicateFilingException.class);
    }
  }

  @Test
  @DisplayName("Should purge the previous rows inside the structured write")
  void shouldPurgeBeforeWriting() {
    // Given
    Filing filing = Filing.builder().id(FILING_ID).entityId("TSLA").build();
    List<TextChunk> chunks = List.of(new TextChunk(0, "Item 7", "Revenue grew.", 0, 13, 1));

    // When
    int records = service.writeStructuredStore(filing, chunks, List.of());

    // Then
    assertThat(records).isZero();
    InOrder order = inOrder(financialMetricRepository, chunkRepository);
    order.verify(financialMetricRepository).deleteByFilingId(FILING_ID);
    order.verify(chunkRepository).deleteByFilingId(FILING_ID);
    order.verify(chunkRepository).saveAll(anyList());
  }

  @Test
  @DisplayName("Should put the previous READY fields back")
  void shouldRestoreReady() {
    // Given
    Filing ingesting = readyFiling();
    LocalDateTime completedAt = ingesting.getCompletedAt();
    FilingClaim.ReadyState previous = FilingClaim.ReadyState.of(ingesting);
    ingesting.setStatus(FilingStatus.INGESTING);
    ingesting.setSourceUrl(NEW_URL);
    ingesting.setChunkCount(null);
    ingesting.setCompletedAt(null);
    when(filingRepository.findById(FILING_ID)).thenReturn(Optional.of(ingesting));
    when(filingRepository.save(any(Filing.class))).thenAnswer(i -> i.getArgument(0));

    // When
    Filing restored = service.restoreReady(FILING_ID, previous);

    // Then
    assertThat(restored.getStatus()).isEqualTo(FilingStatus.READY);
    assertThat(restored.getSourceUrl()).isEqualTo(OLD_URL);
    assertThat(restored.getChunkCount()).isEqualTo(12);
    assertThat(restored.getStructuredRecordCount()).isEqualTo(3);
    assertThat(restored.getCompletedAt()).isEqualTo(completedAt);
  }
}
