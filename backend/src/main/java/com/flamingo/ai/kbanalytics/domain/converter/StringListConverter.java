package com.flamingo.ai.kbanalytics.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for persisting extracted labels as a JSON array in a TEXT column. */
@Converter
@Slf4j
public class StringListConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> labels) {
    if (labels == null || labels.isEmpty()) {
      return "[]";
    }
    try {
      return MAPPER.writeValueAsString(labels);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize label list", e);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return new ArrayList<>(MAPPER.readValue(dbData, LIST_TYPE));
    } catch (JsonProcessingException e) {
      // Unreadable metadata degrades to "no labels" rather than failing the whole corpus load.
      log.error("Failed to deserialize label list: {}", e.getMessage());
      return new ArrayList<>();
    }
  }
}
