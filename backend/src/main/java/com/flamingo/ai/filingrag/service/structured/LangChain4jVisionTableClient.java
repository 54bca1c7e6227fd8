package com.flamingo.ai.filingrag.service.structured;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.filingrag.exception.StructuredExtractionException;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link VisionTableClient} backed by a multimodal LangChain4j {@link ChatModel} in JSON mode.
 *
 * <p>Expected answer: {@code {"regions":[{"caption":..,"columns":[..],"rows":[[..]],
 * "confidence":..}]}}. Model and parse failures are retried through the {@code vision} retry.
 */
@Service
@Slf4j
public class LangChain4jVisionTableClient implements VisionTableClient {

  static final String PROMPT =
      """
      Extract every financial table on this page of a company filing.
      Return ONLY valid JSON of the form
      {"regions": [{"caption": "...", "columns": ["...", "..."], "rows": [["...", 1.0]],
      "confidence": 0.0}]}
      The first column holds the row label. Numbers are written without currency symbols or
      thousands separators; negative values in parentheses become negative numbers.
      Put the unit of the table (for example "in millions") in the caption.
      Confidence is between 0 and 1. Return {"regions": []} when the page has no table.
      """;

  private final ChatModel visionChatModel;
  private final Retry visionRetry;
  private final ObjectMapper objectMapper;
  private final ApiUsageService apiUsageService;
  private final MeterRegistry meterRegistry;

  public LangChain4jVisionTableClient(
      @Qualifier("visionChatModel") ChatModel visionChatModel,
      @Qualifier("visionRetry") Retry visionRetry,
      ObjectMapper objectMapper,
      ApiUsageService apiUsageService,
      MeterRegistry meterRegistry) {
    this.visionChatModel = visionChatModel;
    this.visionRetry = visionRetry;
    this.objectMapper = objectMapper;
    this.apiUsageService = apiUsageService;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public List<ExtractedRegion> extractTables(byte[] pngImage, int pageNumber) {
    String base64 = Base64.getEncoder().encodeToString(pngImage);
    UserMessage message =
        UserMessage.from(TextContent.from(PROMPT), ImageContent.from(base64, "image/png"));

    List<ExtractedRegion> regions =
        visionRetry.executeSupplier(() -> parseRegions(callModel(message, pageNumber), pageNumber));

    apiUsageService.track(ApiUsageService.VISION, "page-tables", regions.size());
    meterRegistry.counter("vision.regions").increment(regions.size());
    log.debug("Vision model found {} tables on page {}", regions.size(), pageNumber);
    return regions;
  }

  private String callModel(UserMessage message, int pageNumber) {
    try {
      ChatResponse response = visionChatModel.chat(message);
      return response.aiMessage().text();
    } catch (RuntimeException e) {
      meterRegistry.counter("vision.requests.failure").increment();
      throw new StructuredExtractionException(
          "Vision model call failed on page " + pageNumber + ": " + e.getMessage(), e);
    }
  }

  List<ExtractedRegion> parseRegions(String json, int pageNumber) {
    if (json == null || json.isBlank()) {
      throw new StructuredExtractionException(
          "Vision model returned an empty answer for page " + pageNumber, null);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new StructuredExtractionException(
          "Vision model returned invalid JSON for page " + pageNumber, e);
    }

    List<ExtractedRegion> regions = new ArrayList<>();
    for (JsonNode region : root.path("regions")) {
      List<String> columns = new ArrayList<>();
      region.path("columns").forEach(column -> columns.add(column.asText()));
      List<List<Object>> rows = new ArrayList<>();
      for (JsonNode row : region.path("rows")) {
        List<Object> cells = new ArrayList<>();
        row.forEach(cell -> cells.add(toCell(cell)));
        rows.add(cells);
      }
      regions.add(
          new ExtractedRegion(
              pageNumber,
              region.path("caption").asText(null),
              columns,
              rows,
              region.path("confidence").asDouble(0.0)));
    }
    return regions;
  }

  private static Object toCell(JsonNode cell) {
    if (cell.isNumber()) {
      return cell.doubleValue();
    }
    if (cell.isNull()) {
      return null;
    }
    return cell.asText();
  }
}
