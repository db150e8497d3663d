package com.flamingo.ai.newscopilot.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/** Loads the expected answer schema of every kind from {@code classpath:schemas/{id}.json}. */
@Component
@Slf4j
public class AnalysisSchemaRegistry {

  private static final String SCHEMA_LOCATION = "schemas/%s.json";

  private final Map<AnalysisKind, JsonNode> schemas;

  public AnalysisSchemaRegistry(ObjectMapper objectMapper) {
    Map<AnalysisKind, JsonNode> loaded = new EnumMap<>(AnalysisKind.class);
    for (AnalysisKind kind : AnalysisKind.values()) {
      loaded.put(kind, load(objectMapper, kind));
    }
    this.schemas = Collections.unmodifiableMap(loaded);
    log.info("Loaded {} analysis schemas", schemas.size());
  }

  public JsonNode schemaFor(AnalysisKind kind) {
    return schemas.get(kind);
  }

  private static JsonNode load(ObjectMapper objectMapper, AnalysisKind kind) {
    ClassPathResource resource =
        new ClassPathResource(String.format(SCHEMA_LOCATION, kind.getId()));
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load schema for " + kind.getId(), e);
    }
  }
}
