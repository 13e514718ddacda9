package com.gentoro.tasktree.indexing.driver.qdrant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.VectorStoreException;
import com.gentoro.tasktree.indexing.driver.CollectionInfo;
import com.gentoro.tasktree.indexing.driver.PointFilter;
import com.gentoro.tasktree.indexing.driver.ScoredPoint;
import com.gentoro.tasktree.indexing.driver.VectorPoint;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import com.gentoro.tasktree.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Vector store backed by the Qdrant REST API.
 *
 * <p>HTTP 408, 429 and 5xx answers as well as I/O errors are reported as transient failures; any
 * other non-2xx answer is a client failure.
 */
public class QdrantVectorStore implements VectorStore {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(QdrantVectorStore.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final Call.Factory http;
  private final HttpUrl baseUrl;
  private final String collection;
  private final int dimension;
  private final int maxIndexingThreads;

  public QdrantVectorStore(
      Call.Factory http, String baseUrl, String collection, int dimension, int maxIndexingThreads) {
    this.http = http;
    this.baseUrl = HttpUrl.get(baseUrl);
    this.collection = collection;
    this.dimension = dimension;
    this.maxIndexingThreads = maxIndexingThreads;
  }

  @Override
  public String collectionName() {
    return collection;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public void ensureCollection() {
    if (getCollections().contains(collection)) return;
    log.info("Creating Qdrant collection {} ({} dimensions, cosine)", collection, dimension);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("vectors", Map.of("size", dimension, "distance", "Cosine"));
    body.put("hnsw_config", Map.of("max_indexing_threads", maxIndexingThreads));
    execute("PUT", url("collections", collection).build(), body);
  }

  @Override
  public void upsert(List<VectorPoint> points) {
    List<Map<String, Object>> wire = new ArrayList<>(points.size());
    for (VectorPoint p : points) {
      Map<String, Object> point = new LinkedHashMap<>();
      point.put("id", p.id());
      point.put("vector", p.vector());
      point.put("payload", p.payload());
      wire.add(point);
    }
    HttpUrl target =
        url("collections", collection, "points").addQueryParameter("wait", "true").build();
    execute("PUT", target, Map.of("points", wire));
  }

  @Override
  public List<ScoredPoint> search(float[] vector, PointFilter filter, int limit) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("vector", vector);
    body.put("limit", limit);
    body.put("with_payload", true);
    if (filter != null && !filter.isEmpty()) body.put("filter", toWire(filter));

    JsonNode result =
        execute("POST", url("collections", collection, "points", "search").build(), body);
    List<ScoredPoint> hits = new ArrayList<>();
    for (JsonNode hit : result) {
      Map<String, Object> payload = JacksonUtility.convert(hit.path("payload"), PAYLOAD_TYPE);
      hits.add(new ScoredPoint(hit.path("id").asText(), hit.path("score").asDouble(), payload));
    }
    return hits;
  }

  @Override
  public CollectionInfo getCollection(String name) {
    JsonNode result = execute("GET", url("collections", name).build(), null);
    JsonNode optimizer = result.path("optimizer_status");
    String optimizerStatus =
        optimizer.isTextual()
            ? optimizer.asText()
            : optimizer.has("error") ? optimizer.path("error").asText() : optimizer.toString();
    return new CollectionInfo(
        result.path("status").asText("unknown"),
        result.path("points_count").asLong(0),
        result.path("segments_count").asLong(0),
        result.path("indexed_vectors_count").asLong(0),
        optimizerStatus);
  }

  @Override
  public List<String> getCollections() {
    JsonNode result = execute("GET", url("collections").build(), null);
    List<String> names = new ArrayList<>();
    for (JsonNode c : result.path("collections")) names.add(c.path("name").asText());
    return names;
  }

  @Override
  public long countPoints(PointFilter filter) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("exact", true);
    if (filter != null && !filter.isEmpty()) body.put("filter", toWire(filter));
    JsonNode result =
        execute("POST", url("collections", collection, "points", "count").build(), body);
    return result.path("count").asLong(0);
  }

  @Override
  public void deleteCollection(String name) {
    log.info("Deleting Qdrant collection {}", name);
    execute("DELETE", url("collections", name).build(), null);
  }

  private static Map<String, Object> toWire(PointFilter filter) {
    List<Map<String, Object>> must = new ArrayList<>();
    filter.must().forEach((k, v) -> must.add(Map.of("key", k, "match", Map.of("value", v))));
    return Map.of("must", must);
  }

  private HttpUrl.Builder url(String... segments) {
    HttpUrl.Builder b = baseUrl.newBuilder();
    for (String s : segments) b.addPathSegment(s);
    return b;
  }

  private JsonNode execute(String method, HttpUrl target, Object body) {
    RequestBody requestBody =
        body == null ? null : RequestBody.create(JacksonUtility.toJson(body), JSON);
    Request request = new Request.Builder().url(target).method(method, requestBody).build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new VectorStoreException(
            FailureKind.fromHttpStatus(response.code()),
            "Qdrant %s %s failed with HTTP %d: %s"
                .formatted(method, target.encodedPath(), response.code(), abbreviate(text)));
      }
      return text.isBlank()
          ? JacksonUtility.getJsonMapper().nullNode()
          : JacksonUtility.readTree(text).path("result");
    } catch (IOException e) {
      throw new VectorStoreException(
          FailureKind.TRANSIENT,
          "Qdrant %s %s failed: %s".formatted(method, target.encodedPath(), e.getMessage()),
          e);
    }
  }

  private static String abbreviate(String text) {
    return text.length() > 300 ? text.substring(0, 300) + "..." : text;
  }
}
