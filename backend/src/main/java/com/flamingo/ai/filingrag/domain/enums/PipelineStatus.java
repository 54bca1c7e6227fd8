package com.flamingo.ai.filingrag.domain.enums;

public enum PipelineStatus {
  SUCCESS,
  FAILURE
}
