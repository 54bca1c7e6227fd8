package com.flamingo.ai.filingrag.service.acquisition;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.domain.entity.Filing;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves locators from configuration: an explicit entry in {@code rag.acquisition.locators}
 * wins, otherwise {@code rag.acquisition.locator-template} is expanded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfiguredFilingDiscovery implements FilingDiscovery {

  private final RagConfig ragConfig;

  @Override
  public Optional<FilingLocation> locate(
      String entityId, String documentType, String fiscalPeriod) {
    String filingId = Filing.identifier(entityId, documentType, fiscalPeriod);
    RagConfig.Acquisition config = ragConfig.getAcquisition();

    String locator = config.getLocators().get(filingId);
    if (locator == null && config.getLocatorTemplate() != null
        && !config.getLocatorTemplate().isBlank()) {
      locator =
          config
              .getLocatorTemplate()
              .replace("{entity}", entityId.trim().toUpperCase())
              .replace("{type}", documentType.trim().toUpperCase())
              .replace("{period}", fiscalPeriod.trim());
    }
    if (locator == null) {
      log.debug("No locator configured for {}", filingId);
      return Optional.empty();
    }
    return Optional.of(
        new FilingLocation(
            filingId,
            entityId.trim().toUpperCase(),
            documentType.trim().toUpperCase(),
            fiscalPeriod.trim(),
            locator));
  }
}
