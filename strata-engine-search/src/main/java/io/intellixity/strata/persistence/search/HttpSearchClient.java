package io.intellixity.strata.persistence.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * {@link SearchClient} over the engine's REST API.
 * <p>
 * Writes pass {@code refresh=true} so they are searchable on return. Filters are sent as
 * {@code {"query": {"constant_score": {"filter": ...}}}}. Searches read every hit through the
 * scroll API, {@value #PAGE_SIZE} hits per round trip, and clear the scroll afterwards.
 * Floating-point numbers in responses are read as {@code BigDecimal}.
 */
public final class HttpSearchClient implements SearchClient {
  private static final Logger log = LoggerFactory.getLogger(HttpSearchClient.class);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  public static final int PAGE_SIZE = 1000;
  static final String SCROLL_KEEP_ALIVE = "1m";

  private final HttpClient httpClient;
  private final ObjectMapper json;
  private final ObjectReader reader;
  private final String baseUrl;
  private final Duration timeout;

  public HttpSearchClient(String baseUrl, int requestTimeoutMs) {
    this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(Math.max(requestTimeoutMs, 500))).build(),
        new ObjectMapper(), baseUrl, requestTimeoutMs);
  }

  public HttpSearchClient(HttpClient httpClient, ObjectMapper json, String baseUrl, int requestTimeoutMs) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.json = Objects.requireNonNull(json, "json");
    this.reader = json.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    Objects.requireNonNull(baseUrl, "baseUrl");
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.timeout = Duration.ofMillis(Math.max(requestTimeoutMs, 500));
  }

  @Override
  public Optional<Map<String, Object>> get(String index, String type, String id) {
    HttpResponse<String> r = send("GET", docPath(index, type, id), null);
    if (r.statusCode() == 404) return Optional.empty();
    check(r);
    JsonNode root = read(r);
    if (!root.path("found").asBoolean(true)) return Optional.empty();
    return Optional.of(source(root));
  }

  @Override
  public boolean create(String index, String type, String id, Map<String, Object> document) {
    HttpResponse<String> r = send("PUT", docPath(index, type, id) + "/_create?refresh=true", document);
    if (r.statusCode() == 409) return false;
    check(r);
    return true;
  }

  @Override
  public void index(String index, String type, String id, Map<String, Object> document) {
    check(send("PUT", docPath(index, type, id) + "?refresh=true", document));
  }

  @Override
  public List<Map<String, Object>> search(String index, String type, Map<String, Object> body) {
    String path = typePath(index, type) + "/_search?scroll=" + SCROLL_KEEP_ALIVE + "&size=" + PAGE_SIZE;
    JsonNode page = post(path, query(body));
    String scrollId = page.path("_scroll_id").asText(null);
    long total = total(page);
    List<Map<String, Object>> out = new ArrayList<>();
    try {
      while (true) {
        JsonNode hits = page.path("hits").path("hits");
        for (JsonNode hit : hits) out.add(source(hit));
        if (hits.isEmpty() || out.size() >= total) break;
        if (scrollId == null) throw new SearchClientException(path + " returned no scroll id");
        page = post("/_search/scroll", Map.of("scroll", SCROLL_KEEP_ALIVE, "scroll_id", scrollId));
        scrollId = page.path("_scroll_id").asText(scrollId);
      }
    } finally {
      if (scrollId != null) clearScroll(scrollId);
    }
    if (total != Long.MAX_VALUE && out.size() < total) {
      throw new SearchClientException("Scroll over " + typePath(index, type) + " ended after " + out.size()
          + " of " + total + " hits");
    }
    log.debug("search {} read {} hit(s)", typePath(index, type), out.size());
    return out;
  }

  @Override
  public long deleteByQuery(String index, String type, Map<String, Object> body) {
    HttpResponse<String> r = send("POST", typePath(index, type) + "/_delete_by_query?refresh=true", query(body));
    check(r);
    return read(r).path("deleted").asLong(0);
  }

  @Override
  public void refresh(String index) {
    check(send("POST", "/" + encode(index) + "/_refresh", null));
  }

  private static Map<String, Object> query(Map<String, Object> body) {
    return Map.of("query", Map.of("constant_score", body));
  }

  // hits.total is a number on older engines and {"value": n, "relation": ...} on newer ones
  private static long total(JsonNode page) {
    JsonNode total = page.path("hits").path("total");
    if (total.isNumber()) return total.asLong();
    if (total.path("value").isNumber() && "eq".equals(total.path("relation").asText("eq"))) {
      return total.path("value").asLong();
    }
    return Long.MAX_VALUE;
  }

  private JsonNode post(String path, Object body) {
    HttpResponse<String> r = send("POST", path, body);
    check(r);
    return read(r);
  }

  private void clearScroll(String scrollId) {
    try {
      HttpResponse<String> r = send("DELETE", "/_search/scroll", Map.of("scroll_id", List.of(scrollId)));
      if (r.statusCode() != 404) check(r);
    } catch (SearchClientException e) {
      log.warn("Failed to clear scroll {}; it expires after {}", scrollId, SCROLL_KEEP_ALIVE, e);
    }
  }

  private Map<String, Object> source(JsonNode hit) {
    try {
      return reader.forType(MAP).readValue(hit.path("_source"));
    } catch (IOException e) {
      throw new SearchClientException("Malformed _source in " + hit, e);
    }
  }

  private HttpResponse<String> send(String method, String path, Object body) {
    HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
    if (body != null) {
      try {
        publisher = HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body));
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Request body is not JSON-encodable", e);
      }
    }
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .method(method, publisher)
        .build();
    log.debug("{} {}", method, path);
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new SearchClientException(method + " " + path + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchClientException(method + " " + path + " interrupted", e);
    }
  }

  private static void check(HttpResponse<String> r) {
    if (r.statusCode() >= 300) {
      throw new SearchClientException(r.statusCode(), r.request().method() + " " + r.uri() + " returned "
          + r.statusCode() + ": " + r.body());
    }
  }

  private JsonNode read(HttpResponse<String> r) {
    try {
      return reader.readTree(r.body());
    } catch (JsonProcessingException e) {
      throw new SearchClientException("Malformed response from " + r.uri(), e);
    }
  }

  private static String typePath(String index, String type) {
    return "/" + encode(index) + "/" + encode(type);
  }

  private static String docPath(String index, String type, String id) {
    return typePath(index, type) + "/" + encode(id);
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
