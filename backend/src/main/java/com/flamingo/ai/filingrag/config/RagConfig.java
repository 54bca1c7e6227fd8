package com.flamingo.ai.filingrag.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and query pipelines. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Acquisition acquisition = new Acquisition();
  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Vision vision = new Vision();
  private Retrieval retrieval = new Retrieval();
  private Query query = new Query();
  private Costs costs = new Costs();
  private Monitoring monitoring = new Monitoring();

  @Getter
  @Setter
  public static class Acquisition {
    /** Sent with every request; public filing archives reject anonymous clients. */
    private String userAgent = "filing-rag research-bot admin@example.com";

    /**
     * Locator template used when an ingestion request carries no explicit URL. Placeholders:
     * {entity}, {type}, {period}.
     */
    private String locatorTemplate = "";

    /** Fixed locators keyed by filing id ({@code ENTITY:TYPE:PERIOD}). */
    private Map<String, String> locators = new HashMap<>();

    private int timeoutSeconds = 30;
    private int maxDocumentBytes = 64 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int chunkSizeTokens = 800;
    private int overlapTokens = 100;
    private int charsPerToken = 4;

    /** Section markers searched in order; 10-K/10-Q item headings by default. */
    private List<String> sectionMarkers =
        new ArrayList<>(
            List.of(
                "Item 1.",
                "Item 1A.",
                "Item 1B.",
                "Item 2.",
                "Item 3.",
                "Item 4.",
                "Item 5.",
                "Item 6.",
                "Item 7.",
                "Item 7A.",
                "Item 8.",
                "Item 9.",
                "Item 9A.",
                "Item 9B.",
                "Item 10.",
                "Item 11.",
                "Item 12.",
                "Item 13.",
                "Item 14.",
                "Item 15."));
  }

  @Getter
  @Setter
  public static class Embedding {
    private int dimensions = 384;
    private int batchSize = 64;
    private int timeoutSeconds = 30;
  }

  @Getter
  @Setter
  public static class Vision {
    private boolean enabled = true;

    /** Pages whose digit ratio reaches this value are sent for table extraction. */
    private double minNumericDensity = 0.12;

    private int maxPagesPerDocument = 25;
    private float renderDpi = 150f;
    private double minRegionConfidence = 0.5;
    private int timeoutSeconds = 60;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 6;
    private int rrfK = 60;
    private int candidatesMultiplier = 4;
    private int timeoutMillis = 2000;
  }

  @Getter
  @Setter
  public static class Query {
    /** SELECTs nested deeper than this produce a performance warning. */
    private int maxNestingDepth = 2;

    private int sqlTimeoutSeconds = 5;
    private int maxRows = 200;

    /** Company names mapped to entity ids, used when a question names no ticker. */
    private Map<String, String> entityAliases = new HashMap<>();
  }

  @Getter
  @Setter
  public static class Costs {
    /** Estimated USD per unit (a region for vision, a token otherwise), keyed by API name. */
    private Map<String, Double> unitCosts = new HashMap<>();

    /** Budget in USD per API name over {@link #budgetWindowHours}. */
    private Map<String, Double> budgets = new HashMap<>();

    private int budgetWindowHours = 24;
  }

  @Getter
  @Setter
  public static class Monitoring {
    private long bottleneckThresholdMillis = 5000;
    private int metricsWindowHours = 24;
  }
}
