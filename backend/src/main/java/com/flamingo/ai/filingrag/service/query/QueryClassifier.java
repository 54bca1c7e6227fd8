package com.flamingo.ai.filingrag.service.query;

/** Decides whether a question is answered from structured data or from filing text. */
public interface QueryClassifier {

  QueryClassification classify(String question);
}
