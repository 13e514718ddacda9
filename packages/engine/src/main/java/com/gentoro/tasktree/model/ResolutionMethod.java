package com.gentoro.tasktree.model;

/** How a task's parent was determined, with the confidence attached to each outcome. */
public enum ResolutionMethod {
  EXPLICIT("explicit", 1.0),
  EXACT_PREFIX_UNIQUE("exact_prefix_unique", 0.85),
  EXACT_PREFIX_DISAMBIGUATED("exact_prefix_disambiguated", 0.65),
  ROOT_FALLBACK("root_fallback", 0.3);

  private final String tag;
  private final double confidence;

  ResolutionMethod(String tag, double confidence) {
    this.tag = tag;
    this.confidence = confidence;
  }

  public String tag() {
    return tag;
  }

  public double confidence() {
    return confidence;
  }

  @Override
  public String toString() {
    return tag;
  }
}
