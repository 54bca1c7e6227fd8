package com.flamingo.ai.filingrag.service.acquisition;

import com.flamingo.ai.filingrag.exception.AcquisitionException;

/** Fetches raw source documents. */
public interface DocumentAcquirer {

  /**
   * Fetches the document behind a locator.
   *
   * @throws AcquisitionException classified as not-found, rate-limited, timeout or transport
   */
  AcquiredDocument acquire(FilingLocation location);
}
