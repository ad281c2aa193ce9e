package siorgsync.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import siorgsync.model.EntityType;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RegistryClient} over the registry's REST API using {@link HttpClient} and Jackson.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>2xx: the body is decoded as a JSON object into a {@link RemoteRecord}
 *   <li>404: empty
 *   <li>408, 429, 5xx, I/O failures and timeouts: {@link RegistryUnavailableException}
 *   <li>other 4xx and undecodable bodies: {@link RegistryRejectedException}
 * </ul>
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class HttpRegistryClient implements RegistryClient {
  private static final Logger logger = Logger.getLogger(HttpRegistryClient.class.getName());

  public static final String DEFAULT_BASE_URL = "https://api.siorg.gov.br";

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final String baseUrl;
  private final String token;
  private final Duration requestTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  private HttpRegistryClient(Builder builder) {
    String url = Objects.requireNonNull(builder.baseUrl, "baseUrl").trim();
    if (url.isEmpty()) {
      throw new IllegalArgumentException("baseUrl cannot be empty");
    }
    if (builder.requestTimeout.isNegative() || builder.requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    if (builder.connectTimeout.isNegative() || builder.connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be positive");
    }
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.token = builder.token == null || builder.token.isBlank() ? null : builder.token;
    this.requestTimeout = builder.requestTimeout;
    this.httpClient = builder.httpClient != null
        ? builder.httpClient
        : HttpClient.newBuilder().connectTimeout(builder.connectTimeout).build();
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
  }

  public static Builder builder() {
    return new Builder();
  }

  static String pathFor(EntityType entityType) {
    return switch (entityType) {
      case ORGANIZATION -> "/api/v1/organizacoes/";
      case UNIT -> "/api/v1/unidades/";
      case CATEGORY -> "/api/v1/categorias/";
      case TYPE -> "/api/v1/tipos-unidade/";
    };
  }

  @Override
  public Optional<RemoteRecord> fetch(EntityType entityType, String externalCode) throws RegistryException {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(externalCode, "externalCode");
    String path = pathFor(entityType) + URLEncoder.encode(externalCode, StandardCharsets.UTF_8);

    HttpResponse<String> response = send(path);
    int status = response.statusCode();
    if (status == 404) {
      return Optional.empty();
    }
    if (status == 408 || status == 429 || status >= 500) {
      throw new RegistryUnavailableException("Registry returned " + status + " for " + path);
    }
    if (status >= 400) {
      throw new RegistryRejectedException("Registry rejected " + path + " with " + status, status);
    }
    if (status < 200 || status >= 300) {
      throw new RegistryRejectedException("Unexpected registry status " + status + " for " + path, status);
    }
    return Optional.of(new RemoteRecord(entityType, externalCode, decode(path, response.body())));
  }

  @Override
  public boolean healthCheck() {
    try {
      int status = send("/health").statusCode();
      return status >= 200 && status < 300;
    } catch (RegistryUnavailableException e) {
      logger.log(Level.WARNING, "Registry health check failed", e);
      return false;
    }
  }

  private HttpResponse<String> send(String path) throws RegistryUnavailableException {
    HttpRequest.Builder request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .header("Accept", "application/json")
        .timeout(requestTimeout)
        .GET();
    if (token != null) {
      request.header("Authorization", "Bearer " + token);
    }
    try {
      return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new RegistryUnavailableException("Failed to call registry: GET " + path, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RegistryUnavailableException("Interrupted calling registry: GET " + path, e);
    }
  }

  private LinkedHashMap<String, Object> decode(String path, String body) throws RegistryRejectedException {
    try {
      JsonNode node = objectMapper.readTree(body);
      if (node == null || !node.isObject()) {
        throw new RegistryRejectedException("Registry response for " + path + " is not a JSON object", 200);
      }
      return objectMapper.convertValue(node, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new RegistryRejectedException("Undecodable registry response for " + path, e);
    }
  }

  /** Builder for {@link HttpRegistryClient}. */
  public static final class Builder {
    private String baseUrl = DEFAULT_BASE_URL;
    private String token;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private HttpClient httpClient;
    private ObjectMapper objectMapper;

    private Builder() {}

    /**
     * Sets the registry base URL.
     *
     * <p>Optional. Defaults to {@value HttpRegistryClient#DEFAULT_BASE_URL}.
     */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /**
     * Sets the bearer token sent with every request.
     *
     * <p>Optional. No {@code Authorization} header is sent when unset or blank.
     */
    public Builder token(String token) {
      this.token = token;
      return this;
    }

    /**
     * Optional. Defaults to 10 seconds. Ignored when {@link #httpClient} is set.
     */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
      return this;
    }

    /**
     * Optional. Defaults to 30 seconds.
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    public HttpRegistryClient build() {
      return new HttpRegistryClient(this);
    }
  }
}
