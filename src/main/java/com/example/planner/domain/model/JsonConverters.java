package com.example.planner.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converters storing the typed detail and context variants as JSON text columns.
 */
public final class JsonConverters {

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .findAndAddModules()
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .build();

  private JsonConverters() {}

  abstract static class TypedJsonConverter<T> implements AttributeConverter<T, String> {

    private final Class<T> type;

    TypedJsonConverter(Class<T> type) {
      this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
      if (attribute == null) {
        return null;
      }
      try {
        return MAPPER.writeValueAsString(attribute);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Cannot serialize " + type.getSimpleName(), e);
      }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
      if (dbData == null || dbData.isBlank()) {
        return null;
      }
      try {
        return MAPPER.readValue(dbData, type);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Cannot deserialize " + type.getSimpleName(), e);
      }
    }
  }

  @Converter
  public static class ActivityDetailConverter extends TypedJsonConverter<ActivityDetail> {
    public ActivityDetailConverter() {
      super(ActivityDetail.class);
    }
  }

  @Converter
  public static class HelpRequestContextConverter extends TypedJsonConverter<HelpRequestContext> {
    public HelpRequestContextConverter() {
      super(HelpRequestContext.class);
    }
  }
}
