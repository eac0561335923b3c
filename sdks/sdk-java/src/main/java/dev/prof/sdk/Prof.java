package dev.prof.sdk;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class Prof {
  private Prof() {}

  public static final String DEFAULT_BASE_URL = "http://localhost:3007";

  static final ObjectMapper MAPPER = new ObjectMapper();

  public static ProfClient createClient() {
    return createClient(new ClientOptions());
  }

  public static ProfClient createClient(String baseUrl) {
    ClientOptions options = new ClientOptions();
    options.baseUrl = baseUrl;
    return createClient(options);
  }

  public static ProfClient createClient(ClientOptions options) {
    return new ProfClient(
        resolveBaseUrl(options.baseUrl),
        options.signer,
        options.httpClient != null ? options.httpClient : HttpClient.newHttpClient(),
        options.clock != null ? options.clock : Clock.systemUTC());
  }

  static String resolveBaseUrl(String explicit) {
    if (isBlank(explicit)) {
      return DEFAULT_BASE_URL;
    }
    return explicit.endsWith("/") ? explicit.substring(0, explicit.length() - 1) : explicit;
  }

  static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }

  public static class ClientOptions {
    public String baseUrl;
    public ProfSigner signer;
    public HttpClient httpClient;
    public Clock clock;
  }

  public static class ImageUpload {
    public final byte[] bytes;
    public final String filename;

    public ImageUpload(byte[] bytes, String filename) {
      if (bytes == null) {
        throw new IllegalArgumentException("image bytes are required");
      }
      if (isBlank(filename)) {
        throw new IllegalArgumentException("image filename is required");
      }
      if (filename.indexOf('\r') >= 0 || filename.indexOf('\n') >= 0) {
        throw new IllegalArgumentException("image filename must not contain line breaks");
      }
      this.bytes = bytes;
      this.filename = filename;
    }

    public static ImageUpload fromPath(Path path) {
      try {
        return new ImageUpload(Files.readAllBytes(path), path.getFileName().toString());
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read image " + path, e);
      }
    }

    public String contentType() {
      return guessMimeType(filename);
    }
  }

  static String guessMimeType(String filename) {
    String extension = filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    switch (extension) {
      case "jpg":
      case "jpeg":
        return "image/jpeg";
      case "png":
        return "image/png";
      case "webp":
        return "image/webp";
      default:
        return "application/octet-stream";
    }
  }

  public static class ProfileResponse {
    public boolean success;
    public Profile profile;
    public String error;
    public List<String> details;

    public ProfileResponse() {}

    ProfileResponse(boolean success, Profile profile, String error, List<String> details) {
      this.success = success;
      this.profile = profile;
      this.error = error;
      this.details = details;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class HealthResponse {
    public String status;
    public String service;
    public String version;
    public String timestamp;
  }

  public static class MagicResponse {
    public boolean success;
    public String error;
    private final Map<String, Object> data = new LinkedHashMap<>();

    @JsonAnySetter
    public void putData(String name, Object value) {
      data.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> data() {
      return data;
    }
  }
}
