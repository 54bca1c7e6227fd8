package com.flamingo.ai.filingrag.service.acquisition;

/** Where a filing's source document lives, plus the identity it will be stored under. */
public record FilingLocation(
    String filingId, String entityId, String documentType, String fiscalPeriod, String locator) {}
