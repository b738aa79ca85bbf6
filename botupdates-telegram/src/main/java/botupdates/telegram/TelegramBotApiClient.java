package botupdates.telegram;

import botupdates.BotUpdate;
import botupdates.UpstreamConflictException;
import botupdates.UpstreamFailureException;
import botupdates.UpstreamRateLimitedException;
import botupdates.spi.BotApiClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * {@link BotApiClient} backed by the JDK {@link HttpClient} and Jackson.
 *
 * <p>Each call is a single {@code GET /bot<token>/getUpdates}. The request timeout is the
 * long-poll timeout plus {@link Builder#requestTimeoutMargin(Duration)}. Interrupting the
 * calling thread cancels the in-flight exchange. Tokens never appear in log records or
 * exception messages.
 */
public final class TelegramBotApiClient implements BotApiClient {
  private static final Logger logger = Logger.getLogger(TelegramBotApiClient.class.getName());

  public static final String DEFAULT_BASE_URL = "https://api.telegram.org";

  private static final int HTTP_CONFLICT = 409;
  private static final int HTTP_TOO_MANY_REQUESTS = 429;
  private static final long DEFAULT_RETRY_AFTER_SECONDS = 1;

  private final String baseUrl;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeoutMargin;

  private TelegramBotApiClient(Builder builder) {
    this.baseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
    this.requestTimeoutMargin = builder.requestTimeoutMargin != null
        ? builder.requestTimeoutMargin : Duration.ofSeconds(10);
    if (requestTimeoutMargin.isNegative()) {
      throw new IllegalArgumentException("requestTimeoutMargin must not be negative");
    }
    Duration connectTimeout = builder.connectTimeout != null
        ? builder.connectTimeout : Duration.ofSeconds(10);
    this.httpClient = builder.httpClient != null
        ? builder.httpClient
        : HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public List<BotUpdate> getUpdates(String token, long offset, Duration timeout, int limit,
      Set<String> allowedUpdates) throws InterruptedException {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(allowedUpdates, "allowedUpdates");

    Map<String, String> params = new LinkedHashMap<>();
    params.put("offset", Long.toString(offset));
    params.put("limit", Integer.toString(limit));
    params.put("timeout", Long.toString(timeout.toSeconds()));
    params.put("allowed_updates", toJsonArray(allowedUpdates));

    HttpRequest request = HttpRequest.newBuilder(methodUri(token, "getUpdates", params))
        .timeout(timeout.plus(requestTimeoutMargin))
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<String> response = send(request);
    return parseUpdates(response.statusCode(), response.body());
  }

  URI methodUri(String token, String method, Map<String, String> params) {
    StringBuilder sb = new StringBuilder(baseUrl)
        .append("/bot").append(encode(token))
        .append('/').append(method);
    char sep = '?';
    for (Map.Entry<String, String> e : params.entrySet()) {
      sb.append(sep).append(encode(e.getKey())).append('=').append(encode(e.getValue()));
      sep = '&';
    }
    return URI.create(sb.toString());
  }

  private HttpResponse<String> send(HttpRequest request) throws InterruptedException {
    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new UpstreamFailureException(
          "getUpdates transport failure: " + cause.getClass().getSimpleName(), cause);
    }
  }

  List<BotUpdate> parseUpdates(int status, String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException e) {
      throwForStatus(status, "HTTP " + status, DEFAULT_RETRY_AFTER_SECONDS);
      throw new UpstreamFailureException("Malformed getUpdates response (HTTP " + status + ")", status, e);
    }
    if (root == null || !root.isObject()) {
      throwForStatus(status, "HTTP " + status, DEFAULT_RETRY_AFTER_SECONDS);
      throw new UpstreamFailureException("getUpdates response is not a JSON object (HTTP " + status + ")", status, null);
    }

    if (!root.path("ok").asBoolean(false)) {
      int code = root.path("error_code").asInt(status);
      String description = root.path("description").asText("no description");
      long retryAfter = root.path("parameters").path("retry_after").asLong(DEFAULT_RETRY_AFTER_SECONDS);
      throwForStatus(code, description, retryAfter);
      throw new UpstreamFailureException("getUpdates failed (" + code + "): " + description, code, null);
    }

    JsonNode result = root.get("result");
    if (result == null || !result.isArray()) {
      throw new UpstreamFailureException("getUpdates response has no result array", status, null);
    }

    List<BotUpdate> updates = new ArrayList<>(result.size());
    for (JsonNode node : result) {
      JsonNode id = node.get("update_id");
      if (id == null || !id.isIntegralNumber() || !id.canConvertToLong()) {
        logger.fine("Skipping update without a numeric update_id");
        continue;
      }
      updates.add(new BotUpdate(id.asLong(), typeOf(node), node.toString()));
    }
    return Collections.unmodifiableList(updates);
  }

  private static void throwForStatus(int code, String description, long retryAfterSeconds) {
    if (code == HTTP_CONFLICT) {
      throw new UpstreamConflictException("getUpdates conflict: " + description);
    }
    if (code == HTTP_TOO_MANY_REQUESTS) {
      throw new UpstreamRateLimitedException(
          Duration.ofSeconds(Math.max(0, retryAfterSeconds)),
          "getUpdates rate limited: " + description);
    }
  }

  private static String typeOf(JsonNode update) {
    Iterator<String> names = update.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!"update_id".equals(name)) {
        return name;
      }
    }
    return "unknown";
  }

  private String toJsonArray(Set<String> values) {
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      throw new UpstreamFailureException("Failed to serialize allowed_updates", e);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String stripTrailingSlash(String url) {
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("baseUrl must not be blank");
    }
    return trimmed;
  }

  /**
   * Builder for {@link TelegramBotApiClient}. Every setting is optional.
   */
  public static final class Builder {
    private String baseUrl;
    private HttpClient httpClient;
    private ObjectMapper objectMapper;
    private Duration requestTimeoutMargin;
    private Duration connectTimeout;

    private Builder() {}

    /** Bot API root. Defaults to {@link TelegramBotApiClient#DEFAULT_BASE_URL}. */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /** Pre-configured client, e.g. with a proxy. {@link #connectTimeout} is ignored when set. */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /** Added to the long-poll timeout to form the hard request timeout. Defaults to 10 seconds. */
    public Builder requestTimeoutMargin(Duration requestTimeoutMargin) {
      this.requestTimeoutMargin = requestTimeoutMargin;
      return this;
    }

    /** Defaults to 10 seconds. */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public TelegramBotApiClient build() {
      return new TelegramBotApiClient(this);
    }
  }
}
