package com.flamingo.ai.filingrag.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.filingrag.domain.model.TablePayload;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** JPA converter storing a {@link TablePayload} as JSON in a TEXT column. */
@Converter
public class TablePayloadConverter implements AttributeConverter<TablePayload, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Override
  public String convertToDatabaseColumn(TablePayload attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Table payload is not serializable", e);
    }
  }

  @Override
  public TablePayload convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(dbData, TablePayload.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored table payload is not valid JSON", e);
    }
  }
}
