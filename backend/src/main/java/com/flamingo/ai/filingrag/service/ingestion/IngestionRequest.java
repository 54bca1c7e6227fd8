package com.flamingo.ai.filingrag.service.ingestion;

/**
 * A filing to ingest.
 *
 * @param locator explicit source URL; when null the filing is located through discovery
 * @param replaceExisting re-ingest a filing that is already {@code READY}
 */
public record IngestionRequest(
    String entityId,
    String documentType,
    String fiscalPeriod,
    String locator,
    boolean replaceExisting) {

  public static IngestionRequest of(String entityId, String documentType, String fiscalPeriod) {
    return new IngestionRequest(entityId, documentType, fiscalPeriod, null, false);
  }
}
