package dev.prof.sdk;

import tools.jackson.core.JacksonException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

public final class ProfClient {
  private final String baseUrl;
  private final HttpClient httpClient;
  private final Clock clock;
  private volatile ProfSigner signer;

  public ProfClient(String baseUrl) {
    this(Prof.resolveBaseUrl(baseUrl), null, HttpClient.newHttpClient(), Clock.systemUTC());
  }

  ProfClient(String baseUrl, ProfSigner signer, HttpClient httpClient, Clock clock) {
    this.baseUrl = baseUrl;
    this.signer = signer;
    this.httpClient = httpClient;
    this.clock = clock;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public ProfClient withSigner(ProfSigner signer) {
    return new ProfClient(baseUrl, signer, httpClient, clock);
  }

  public void setSigner(ProfSigner signer) {
    this.signer = signer;
  }

  public Map<String, String> getAuthParams() {
    ProfSigner current = signer;
    if (current == null) {
      throw new ProfException.AuthException("Signer not configured");
    }

    String timestamp = Long.toString(clock.millis());
    String hash = UUID.randomUUID().toString();
    String uuid = current.publicKeyHex();
    String signature = HexFormat.of().formatHex(current.sign(timestamp));

    Map<String, String> params = new LinkedHashMap<>();
    params.put("uuid", uuid);
    params.put("timestamp", timestamp);
    params.put("hash", hash);
    params.put("signature", signature);
    return params;
  }

  public CompletableFuture<Profile> createProfile(Map<String, Object> profileData) {
    return createProfile(profileData, null);
  }

  public CompletableFuture<Profile> createProfile(Map<String, Object> profileData, Prof.ImageUpload image) {
    return deferFailures(() -> sendProfile("POST", profileData, image, "Not found"));
  }

  public CompletableFuture<Profile> updateProfile(Map<String, Object> profileData) {
    return updateProfile(profileData, null);
  }

  public CompletableFuture<Profile> updateProfile(Map<String, Object> profileData, Prof.ImageUpload image) {
    return deferFailures(() -> sendProfile("PUT", profileData, image, "Profile not found"));
  }

  public CompletableFuture<Profile> getProfile() {
    return getProfile(null);
  }

  public CompletableFuture<Profile> getProfile(String uuid) {
    return deferFailures(() -> {
      Map<String, String> auth = getAuthParams();
      String url = withQuery(profileUrl(target(uuid, auth)), auth);
      HttpRequest request = HttpRequest.newBuilder(requestUri(url)).GET().build();
      return exchange(request, HttpResponse.BodyHandlers.ofString(), response ->
          ResponseInterpreter.profile(
              ResponseInterpreter.parse(response.body()), response.statusCode(), "Profile not found"));
    });
  }

  public CompletableFuture<Void> deleteProfile() {
    return deferFailures(() -> {
      Map<String, String> auth = getAuthParams();
      HttpRequest request = HttpRequest.newBuilder(requestUri(profileUrl(auth.get("uuid"))))
          .header("content-type", "application/json")
          .method("DELETE", HttpRequest.BodyPublishers.ofString(toJson(auth)))
          .build();
      return exchange(request, HttpResponse.BodyHandlers.ofString(), response -> {
        if (!isSuccess(response.statusCode())) {
          throw ResponseInterpreter.deleteFailure(ResponseInterpreter.parse(response.body()));
        }
        return null;
      });
    });
  }

  public CompletableFuture<byte[]> getProfileImage() {
    return getProfileImage(null);
  }

  public CompletableFuture<byte[]> getProfileImage(String uuid) {
    return deferFailures(() -> {
      String url = getProfileImageUrl(uuid);
      HttpRequest request = HttpRequest.newBuilder(requestUri(url)).GET().build();
      return exchange(request, HttpResponse.BodyHandlers.ofByteArray(), response -> {
        if (!isSuccess(response.statusCode())) {
          throw new ProfException.NotFoundException("Image not found");
        }
        return response.body();
      });
    });
  }

  public String getProfileImageUrl() {
    return getProfileImageUrl(null);
  }

  public String getProfileImageUrl(String uuid) {
    Map<String, String> auth = getAuthParams();
    return withQuery(profileUrl(target(uuid, auth)) + "/image", auth);
  }

  public CompletableFuture<Prof.HealthResponse> healthCheck() {
    return deferFailures(() -> {
      HttpRequest request = HttpRequest.newBuilder(requestUri(baseUrl + "/health")).GET().build();
      return exchange(request, HttpResponse.BodyHandlers.ofString(),
          response -> ResponseInterpreter.health(response.body()));
    });
  }

  public CompletableFuture<Prof.MagicResponse> executeSpell(String spellName, Map<String, Object> spellData) {
    return deferFailures(() -> {
      if (Prof.isBlank(spellName)) {
        throw new ProfException.HttpException("spell name is required");
      }
      Map<String, Object> requestData = new LinkedHashMap<>();
      if (spellData != null) {
        requestData.putAll(spellData);
      }
      requestData.putAll(getAuthParams());

      HttpRequest request = HttpRequest.newBuilder(requestUri(baseUrl + "/magic/spell/" + spellName))
          .header("content-type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(toJson(requestData)))
          .build();
      return exchange(request, HttpResponse.BodyHandlers.ofString(),
          response -> ResponseInterpreter.spell(ResponseInterpreter.parse(response.body())));
    });
  }

  private CompletableFuture<Profile> sendProfile(
      String method,
      Map<String, Object> profileData,
      Prof.ImageUpload image,
      String notFoundDefault
  ) {
    Map<String, String> auth = getAuthParams();

    MultipartForm form = new MultipartForm()
        .text("profileData", toJson(profileData != null ? profileData : Map.of()));
    for (Map.Entry<String, String> entry : auth.entrySet()) {
      form.text(entry.getKey(), entry.getValue());
    }
    if (image != null) {
      form.file("image", image.filename, image.contentType(), image.bytes);
    }

    HttpRequest request = HttpRequest.newBuilder(requestUri(profileUrl(auth.get("uuid"))))
        .header("content-type", form.contentType())
        .method(method, form.publisher())
        .build();
    return exchange(request, HttpResponse.BodyHandlers.ofString(), response ->
        ResponseInterpreter.profile(
            ResponseInterpreter.parse(response.body()), response.statusCode(), notFoundDefault));
  }

  private <B, T> CompletableFuture<T> exchange(
      HttpRequest request,
      HttpResponse.BodyHandler<B> handler,
      Function<HttpResponse<B>, T> interpret
  ) {
    return httpClient.sendAsync(request, handler).handle((response, error) -> {
      if (error != null) {
        throw new ProfException.HttpException(unwrap(error));
      }
      return interpret.apply(response);
    });
  }

  // The query carries the signature, so it stays out of the error message.
  private static URI requestUri(String url) {
    try {
      return URI.create(url);
    } catch (IllegalArgumentException e) {
      int query = url.indexOf('?');
      String target = query >= 0 ? url.substring(0, query) : url;
      throw new ProfException.HttpException("invalid request URL " + target);
    }
  }

  private String profileUrl(String uuid) {
    return baseUrl + "/user/" + uuid + "/profile";
  }

  private static String target(String uuid, Map<String, String> auth) {
    return uuid != null ? uuid : auth.get("uuid");
  }

  // Values are not percent-encoded; the service reads them back verbatim.
  private static String withQuery(String url, Map<String, String> params) {
    if (params.isEmpty()) {
      return url;
    }
    List<String> pairs = new ArrayList<>();
    for (Map.Entry<String, String> entry : params.entrySet()) {
      pairs.add(entry.getKey() + "=" + entry.getValue());
    }
    return url + "?" + String.join("&", pairs);
  }

  private static String toJson(Object value) {
    try {
      return Prof.MAPPER.writeValueAsString(value);
    } catch (JacksonException e) {
      throw new ProfException.SerializationException("request body could not be encoded", e);
    }
  }

  private static boolean isSuccess(int status) {
    return status >= 200 && status < 300;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private static <T> CompletableFuture<T> deferFailures(Supplier<CompletableFuture<T>> call) {
    try {
      return call.get();
    } catch (ProfException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
