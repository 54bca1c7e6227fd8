package com.flamingo.ai.filingrag.service.acquisition;

import java.util.Optional;

/** Resolves a filing identity to its source locator. */
public interface FilingDiscovery {

  Optional<FilingLocation> locate(String entityId, String documentType, String fiscalPeriod);
}
