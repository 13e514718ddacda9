package com.gentoro.tasktree.utility;

public final class StringUtility {
  private StringUtility() {}

  public static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  /** Returns the first {@code max} characters, with an ellipsis when anything was cut. */
  public static String abbreviate(String text, int max) {
    if (text == null) return "";
    if (text.length() <= max) return text;
    if (max <= 3) return text.substring(0, Math.max(0, max));
    return text.substring(0, max - 3) + "...";
  }

  /** Collapses whitespace runs into single spaces and trims. */
  public static String squash(String text) {
    if (text == null) return "";
    return text.replaceAll("\\s+", " ").trim();
  }
}
