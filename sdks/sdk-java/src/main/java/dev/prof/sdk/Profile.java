package dev.prof.sdk;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Profile {
  @JsonProperty("uuid")
  private String uuid;
  @JsonProperty("name")
  private String name;
  @JsonProperty("email")
  private String email;
  @JsonProperty("imageFilename")
  private String imageFilename;
  @JsonProperty("createdAt")
  private String createdAt;
  @JsonProperty("updatedAt")
  private String updatedAt;

  private final Map<String, Object> additionalFields = new LinkedHashMap<>();

  Profile() {}

  public String getUuid() {
    return uuid;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getImageFilename() {
    return imageFilename;
  }

  public String getCreatedAt() {
    return createdAt;
  }

  public String getUpdatedAt() {
    return updatedAt;
  }

  @JsonAnyGetter
  public Map<String, Object> additionalFields() {
    return Collections.unmodifiableMap(additionalFields);
  }

  @JsonAnySetter
  void putAdditionalField(String key, Object value) {
    additionalFields.put(key, value);
  }

  @Override
  public String toString() {
    return "Profile{uuid=" + uuid + ", name=" + name + ", imageFilename=" + imageFilename + "}";
  }
}
