package com.gentoro.tasktree.indexing.driver.memory;

import com.gentoro.tasktree.exception.FailureKind;
import com.gentoro.tasktree.exception.VectorStoreException;
import com.gentoro.tasktree.indexing.driver.CollectionInfo;
import com.gentoro.tasktree.indexing.driver.PointFilter;
import com.gentoro.tasktree.indexing.driver.ScoredPoint;
import com.gentoro.tasktree.indexing.driver.VectorPoint;
import com.gentoro.tasktree.indexing.driver.VectorStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local vector store ranking points by cosine similarity. */
public class InMemoryVectorStore implements VectorStore {
  private final String collection;
  private final int dimension;
  private final Map<String, Map<String, VectorPoint>> collections = new ConcurrentHashMap<>();

  public InMemoryVectorStore(String collection, int dimension) {
    this.collection = collection;
    this.dimension = dimension;
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
    collections.computeIfAbsent(collection, k -> new ConcurrentHashMap<>());
  }

  @Override
  public void upsert(List<VectorPoint> points) {
    Map<String, VectorPoint> target = requireCollection(collection);
    for (VectorPoint p : points) {
      if (p.vector() == null || p.vector().length != dimension) {
        throw new VectorStoreException(
            FailureKind.CLIENT,
            "Point %s has dimension %d, expected %d"
                .formatted(p.id(), p.vector() == null ? 0 : p.vector().length, dimension));
      }
    }
    for (VectorPoint p : points) target.put(p.id(), p);
  }

  @Override
  public List<ScoredPoint> search(float[] vector, PointFilter filter, int limit) {
    Map<String, VectorPoint> source = requireCollection(collection);
    List<ScoredPoint> scored = new ArrayList<>();
    for (VectorPoint p : source.values()) {
      if (filter != null && !filter.matches(p.payload())) continue;
      scored.add(new ScoredPoint(p.id(), cosine(vector, p.vector()), p.payload()));
    }
    scored.sort(
        Comparator.comparingDouble(ScoredPoint::score).reversed().thenComparing(ScoredPoint::id));
    return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
  }

  @Override
  public CollectionInfo getCollection(String name) {
    Map<String, VectorPoint> points = requireCollection(name);
    return new CollectionInfo("green", points.size(), 1, points.size(), "ok");
  }

  @Override
  public List<String> getCollections() {
    return List.copyOf(collections.keySet());
  }

  @Override
  public long countPoints(PointFilter filter) {
    return requireCollection(collection).values().stream()
        .filter(p -> filter == null || filter.matches(p.payload()))
        .count();
  }

  @Override
  public void deleteCollection(String name) {
    collections.remove(name);
  }

  private Map<String, VectorPoint> requireCollection(String name) {
    Map<String, VectorPoint> points = collections.get(name);
    if (points == null) {
      throw new VectorStoreException(FailureKind.CLIENT, "Collection not found: " + name);
    }
    return points;
  }

  static double cosine(float[] a, float[] b) {
    if (a == null || b == null || a.length != b.length) return 0;
    double dot = 0;
    double na = 0;
    double nb = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      na += a[i] * a[i];
      nb += b[i] * b[i];
    }
    return na == 0 || nb == 0 ? 0 : dot / (Math.sqrt(na) * Math.sqrt(nb));
  }
}
