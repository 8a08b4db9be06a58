package com.flamingo.ai.kbanalytics.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converter for persisting an embedding vector as a JSON array in a TEXT column. A corrupt
 * vector fails the load instead of degrading to an empty array.
 */
@Converter
public class FloatArrayConverter implements AttributeConverter<float[], String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Override
  public String convertToDatabaseColumn(float[] vector) {
    if (vector == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(vector);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize embedding vector", e);
    }
  }

  @Override
  public float[] convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(dbData, float[].class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored embedding vector is not a JSON float array", e);
    }
  }
}
