package com.gentoro.tasktree.indexing.driver.memory;

import com.gentoro.tasktree.indexing.driver.EmbeddingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline embedding: hashes lowercase word tokens into a normalized bag-of-words vector. Texts
 * sharing vocabulary land close to each other, which is enough for local runs and tests.
 */
public class HashingEmbeddingService implements EmbeddingService {
  private final int dimension;

  public HashingEmbeddingService(int dimension) {
    if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.dimension = dimension;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<float[]> out = new ArrayList<>(texts.size());
    for (String text : texts) out.add(embedOne(text));
    return out;
  }

  @Override
  public String model() {
    return "hashing-" + dimension;
  }

  private float[] embedOne(String text) {
    float[] v = new float[dimension];
    if (text != null) {
      for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
        if (token.isEmpty()) continue;
        int h = token.hashCode();
        int slot = Math.floorMod(h, dimension);
        v[slot] += (h & 0x10000) == 0 ? 1f : -1f;
      }
    }
    double norm = 0;
    for (float x : v) norm += x * x;
    if (norm == 0) {
      // all-zero vectors have no direction
      v[0] = 1f;
      return v;
    }
    float scale = (float) (1.0 / Math.sqrt(norm));
    for (int i = 0; i < v.length; i++) v[i] *= scale;
    return v;
  }
}
