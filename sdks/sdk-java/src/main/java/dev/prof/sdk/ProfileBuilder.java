package dev.prof.sdk;

import tools.jackson.core.JacksonException;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ProfileBuilder {
  private final Map<String, Object> data = new LinkedHashMap<>();

  public ProfileBuilder name(String name) {
    data.put("name", name);
    return this;
  }

  public ProfileBuilder email(String email) {
    data.put("email", email);
    return this;
  }

  public ProfileBuilder field(String key, Object value) {
    if (Prof.isBlank(key)) {
      throw new IllegalArgumentException("field name is required");
    }
    data.put(key, toJsonValue(key, value));
    return this;
  }

  public Map<String, Object> build() {
    return new LinkedHashMap<>(data);
  }

  private static Object toJsonValue(String key, Object value) {
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    try {
      return Prof.MAPPER.convertValue(value, Object.class);
    } catch (JacksonException | IllegalArgumentException e) {
      throw new ProfException.SerializationException("field '" + key + "' is not JSON-representable", e);
    }
  }
}
