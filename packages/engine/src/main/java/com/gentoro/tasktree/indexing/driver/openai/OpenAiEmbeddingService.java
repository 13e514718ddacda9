package com.gentoro.tasktree.indexing.driver.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tasktree.exception.EmbeddingException;
import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import com.gentoro.tasktree.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Embeddings from an OpenAI compatible {@code /embeddings} endpoint. */
public class OpenAiEmbeddingService implements EmbeddingService {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final Call.Factory http;
  private final HttpUrl endpoint;
  private final String model;
  private final int batchSize;

  public OpenAiEmbeddingService(Call.Factory http, String baseUrl, String model, int batchSize) {
    this.http = http;
    this.endpoint = HttpUrl.get(baseUrl).newBuilder().addPathSegment("embeddings").build();
    this.model = model;
    this.batchSize = Math.max(1, batchSize);
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<float[]> out = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += batchSize) {
      List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
      out.addAll(embedBatch(batch));
    }
    return out;
  }

  @Override
  public String model() {
    return model;
  }

  private List<float[]> embedBatch(List<String> batch) {
    String body = JacksonUtility.toJson(Map.of("model", model, "input", batch));
    Request request =
        new Request.Builder().url(endpoint).post(RequestBody.create(body, JSON)).build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new EmbeddingException(
            FailureKind.fromHttpStatus(response.code()),
            "Embedding request failed with HTTP %d: %s"
                .formatted(response.code(), text.length() > 300 ? text.substring(0, 300) : text));
      }
      return parse(JacksonUtility.readTree(text), batch.size());
    } catch (IOException e) {
      throw new EmbeddingException(
          FailureKind.TRANSIENT, "Embedding request failed: " + e.getMessage(), e);
    }
  }

  private static List<float[]> parse(JsonNode root, int expected) {
    float[][] ordered = new float[expected][];
    int position = 0;
    for (JsonNode item : root.path("data")) {
      int index = item.has("index") ? item.path("index").asInt() : position;
      position++;
      if (index < 0 || index >= expected) continue;
      JsonNode values = item.path("embedding");
      float[] vector = new float[values.size()];
      for (int i = 0; i < vector.length; i++) {
        JsonNode v = values.get(i);
        vector[i] = v.isNumber() ? v.floatValue() : Float.NaN;
      }
      ordered[index] = vector;
    }
    // missing entries stay null and are rejected by vector validation
    return Arrays.asList(ordered);
  }
}
