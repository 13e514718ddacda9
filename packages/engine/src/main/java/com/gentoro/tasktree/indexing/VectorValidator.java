package com.gentoro.tasktree.indexing;

import java.util.Optional;

/** Checks embedding vectors before upsert. */
public class VectorValidator {
  private final int dimension;

  public VectorValidator(int dimension) {
    this.dimension = dimension;
  }

  public int dimension() {
    return dimension;
  }

  /** Describes what is wrong with {@code vector}, or returns empty when it can be stored. */
  public Optional<String> validate(float[] vector) {
    if (vector == null) return Optional.of("vector is missing");
    if (vector.length != dimension) {
      return Optional.of(
          "vector has %d dimensions, expected %d".formatted(vector.length, dimension));
    }
    for (int i = 0; i < vector.length; i++) {
      if (Float.isNaN(vector[i]) || Float.isInfinite(vector[i])) {
        return Optional.of("component " + i + " is not finite (" + vector[i] + ")");
      }
    }
    return Optional.empty();
  }
}
