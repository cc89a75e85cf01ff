package com.ibprovider.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link IbConnector} backed by the WAPI REST endpoint. */
public class WapiConnector implements IbConnector {
  private static final Logger log = LoggerFactory.getLogger(WapiConnector.class);
  private static final String PROXY_SEARCH_GRID_MASTER = "GM";

  private final WapiEndpointProvider endpointProvider;
  private final AuthConfig authConfig;
  private final Duration requestTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer requestTimer;
  private final Counter requestSuccessCounter;
  private final Counter requestClientErrorCounter;
  private final Counter requestServerErrorCounter;
  private final Counter requestExceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public WapiConnector(
      WapiEndpointProvider endpointProvider,
      AuthConfig authConfig,
      TransportConfig transportConfig,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    this.endpointProvider = endpointProvider;
    this.authConfig = authConfig;
    this.requestTimeout = transportConfig == null ? null : transportConfig.requestTimeout();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.requestTimer = Timer.builder("infoblox.wapi.http.duration")
        .description("WAPI HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);

    // Outcome is the only tag: object types and URLs would blow up cardinality.
    this.requestSuccessCounter = outcomeCounter(meterRegistry, "success");
    this.requestClientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.requestServerErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.requestExceptionCounter = outcomeCounter(meterRegistry, "exception");

    meterRegistry.gauge("infoblox.wapi.http.last_status", lastStatusCode);
  }

  @Override
  public <T> List<T> getObject(IbObject<T> object, String ref, QueryParams queryParams) {
    long httpStartNs = -1L;
    boolean recorded = false;
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(URI.create(buildUrl(object, ref, queryParams)))
          .header("Authorization", basicAuthorization())
          .header("Accept", "application/json")
          .GET();
      if (requestTimeout != null) {
        builder.timeout(requestTimeout);
      }
      HttpRequest request = builder.build();

      httpStartNs = System.nanoTime();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      lastStatusCode.set(response.statusCode());
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      recorded = true;

      if (response.statusCode() >= 400) {
        if (response.statusCode() >= 500) {
          requestServerErrorCounter.increment();
        } else {
          requestClientErrorCounter.increment();
        }
        log.warn("WAPI request for '{}' failed: status={}", object.objectType(), response.statusCode());
        throw errorFromResponse(response);
      }

      List<T> results = decode(object, response.body());
      requestSuccessCounter.increment();
      return results;
    } catch (InterruptedException ex) {
      lastStatusCode.set(0);
      if (!recorded && httpStartNs > 0) {
        requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      }
      requestExceptionCounter.increment();
      Thread.currentThread().interrupt();
      log.error("WAPI request for '{}' interrupted", object.objectType(), ex);
      throw new WapiException("WAPI request interrupted", ex);
    } catch (IOException ex) {
      // Keep the status of a response whose body could not be decoded.
      if (!recorded) {
        lastStatusCode.set(0);
      }
      if (!recorded && httpStartNs > 0) {
        requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      }
      requestExceptionCounter.increment();
      log.error("WAPI request for '{}' failed", object.objectType(), ex);
      throw new WapiException("WAPI request failed: " + ex.getMessage(), ex);
    }
  }

  String buildUrl(IbObject<?> object, String ref, QueryParams queryParams) {
    String baseUrl = endpointProvider.baseUrl();
    boolean byRef = ref != null && !ref.isBlank();
    StringBuilder url = new StringBuilder(baseUrl).append(byRef ? ref.trim() : object.objectType());

    List<String> params = new ArrayList<>();
    LinkedHashSet<String> returnFields = new LinkedHashSet<>(object.returnFields());
    if (!returnFields.isEmpty()) {
      params.add("_return_fields=" + returnFields.stream().map(this::encode).collect(Collectors.joining(",")));
    }
    if (queryParams != null) {
      if (queryParams.forceProxy()) {
        params.add("_proxy_search=" + PROXY_SEARCH_GRID_MASTER);
      }
      if (!byRef) {
        for (Map.Entry<String, String> field : queryParams.searchFields().entrySet()) {
          params.add(encode(field.getKey()) + "=" + encode(field.getValue()));
        }
      }
    }
    if (!params.isEmpty()) {
      url.append('?').append(String.join("&", params));
    }
    return url.toString();
  }

  private <T> List<T> decode(IbObject<T> object, String body) throws JsonProcessingException {
    if (body == null || body.isBlank()) {
      return null;
    }
    JsonNode root = objectMapper.readTree(body);
    if (root.isObject()) {
      // Fetch by reference answers with the bare object.
      return List.of(objectMapper.treeToValue(root, object.resultType()));
    }
    if (!root.isArray()) {
      log.warn("WAPI returned no result set for '{}'", object.objectType());
      return null;
    }

    List<T> results = new ArrayList<>(root.size());
    for (JsonNode row : root) {
      results.add(objectMapper.treeToValue(row, object.resultType()));
    }
    return results;
  }

  private WapiException errorFromResponse(HttpResponse<String> response) {
    String code = null;
    String text = null;
    try {
      JsonNode error = objectMapper.readTree(response.body());
      code = textOrNull(error, "code");
      text = textOrNull(error, "text");
      if (text == null) {
        text = textOrNull(error, "Error");
      }
    } catch (Exception ex) {
      log.debug("Unable to parse WAPI error body", ex);
    }

    StringBuilder message = new StringBuilder("WAPI request failed: status=").append(response.statusCode());
    if (code != null) {
      message.append(", code=").append(code);
    }
    if (text != null) {
      message.append(", text=").append(text);
    }
    return new WapiException(message.toString(), response.statusCode(), code);
  }

  private String textOrNull(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private String basicAuthorization() {
    if (authConfig == null || authConfig.username() == null || authConfig.username().isBlank()) {
      throw new IllegalStateException("Infoblox credentials missing (INFOBLOX_USERNAME, INFOBLOX_PASSWORD)");
    }
    String password = authConfig.password() == null ? "" : authConfig.password();
    String token = authConfig.username() + ":" + password;
    return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
  }

  private String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("infoblox.wapi.http.requests.total")
        .description("WAPI HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
