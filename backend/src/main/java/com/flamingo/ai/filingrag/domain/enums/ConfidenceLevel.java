package com.flamingo.ai.filingrag.domain.enums;

/** Ordinal answer confidence, highest first. */
public enum ConfidenceLevel {
  VERY_HIGH,
  HIGH,
  MEDIUM,
  LOW;

  /** One step down the scale; LOW stays LOW. */
  public ConfidenceLevel lower() {
    return this == LOW ? LOW : values()[ordinal() + 1];
  }
}
