package com.gentoro.tasktree.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes instruction and delegation text into the comparable prefix form used as lookup key by
 * {@link PrefixIndex}.
 *
 * <p>Parent declarations and child instructions must both go through {@link #canonicalize(String,
 * int)} in full; comparing a canonical string with anything derived differently breaks matching.
 * The function is pure, never throws, and is idempotent on its own output.
 */
public final class InstructionCanonicalizer {
  public static final int DEFAULT_PREFIX_LENGTH = 192;

  private static final String BOM = "\uFEFF";

  // doubly encoded input ("&amp;lt;", "\\\\n") converges within a few passes
  private static final int MAX_DECODE_PASSES = 8;

  private static final Pattern ESCAPE = Pattern.compile("\\\\([nrtNRT\\\\\"'])");
  private static final Pattern ENTITY =
      Pattern.compile("&(#[0-9]{1,7}|#[xX][0-9a-fA-F]{1,6}|[a-zA-Z]{2,6});");
  private static final Pattern NEW_TASK_BLOCK =
      Pattern.compile(
          "<new_task\\b[^>]*>(.*?)</new_task\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern MESSAGE_BLOCK =
      Pattern.compile(
          "<message\\b[^>]*>(.*?)</message\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern NEW_TASK_TAG =
      Pattern.compile("</?new_task\\b[^>]*>", Pattern.CASE_INSENSITIVE);
  private static final Pattern TAG = Pattern.compile("<[^>]*>");
  private static final Pattern ANGLE = Pattern.compile("[<>]");
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private InstructionCanonicalizer() {}

  public static String canonicalize(String raw) {
    return canonicalize(raw, DEFAULT_PREFIX_LENGTH);
  }

  /**
   * Canonical prefix of {@code raw}, at most {@code maxLength} characters long.
   *
   * <p>Steps: drop byte-order marks; undo string escaping and decode HTML entities until stable;
   * move the content of {@code <new_task>} and {@code <message>} blocks to a side list; strip the
   * remaining markup; append the side list; lowercase; collapse whitespace; truncate.
   */
  public static String canonicalize(String raw, int maxLength) {
    if (raw == null || raw.isEmpty() || maxLength <= 0) return "";

    String text = decode(raw.replace(BOM, "")).replace(BOM, "");

    List<String> fragments = new ArrayList<>();
    text = extractBlocks(text, NEW_TASK_BLOCK, fragments);
    text = extractBlocks(text, MESSAGE_BLOCK, fragments);
    text = NEW_TASK_TAG.matcher(text).replaceAll(" ");
    text = stripMarkup(text);

    StringBuilder sb = new StringBuilder(text);
    for (String fragment : fragments) {
      sb.append(' ').append(fragment);
    }

    String canonical = WHITESPACE.matcher(sb.toString().toLowerCase(Locale.ROOT)).replaceAll(" ");
    return truncate(canonical.strip(), maxLength);
  }

  /** Undoes string escaping and HTML entities until the text no longer changes. */
  public static String decode(String text) {
    if (text == null) return "";
    String current = text;
    for (int pass = 0; pass < MAX_DECODE_PASSES; pass++) {
      String next = decodeEntities(unescape(current));
      if (next.equals(current)) break;
      current = next;
    }
    return current;
  }

  private static String unescape(String text) {
    if (text.indexOf('\\') < 0) return text;
    Matcher m = ESCAPE.matcher(text);
    StringBuilder sb = new StringBuilder(text.length());
    while (m.find()) {
      char c = m.group(1).charAt(0);
      String replacement =
          switch (c) {
            case 'n', 'N' -> "\n";
            case 'r', 'R' -> "\r";
            case 't', 'T' -> "\t";
            default -> String.valueOf(c);
          };
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static String decodeEntities(String text) {
    if (text.indexOf('&') < 0) return text;
    Matcher m = ENTITY.matcher(text);
    StringBuilder sb = new StringBuilder(text.length());
    while (m.find()) {
      m.appendReplacement(sb, Matcher.quoteReplacement(decodeEntity(m.group(1), m.group())));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static String decodeEntity(String body, String original) {
    if (body.charAt(0) == '#') {
      int codePoint;
      try {
        codePoint =
            body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')
                ? Integer.parseInt(body.substring(2), 16)
                : Integer.parseInt(body.substring(1));
      } catch (NumberFormatException e) {
        return original;
      }
      if (codePoint <= 0
          || !Character.isValidCodePoint(codePoint)
          || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
        return original;
      }
      return new String(Character.toChars(codePoint));
    }
    return switch (body.toLowerCase(Locale.ROOT)) {
      case "lt" -> "<";
      case "gt" -> ">";
      case "quot" -> "\"";
      case "apos" -> "'";
      case "amp" -> "&";
      case "nbsp" -> " ";
      default -> original;
    };
  }

  private static String extractBlocks(String text, Pattern block, List<String> fragments) {
    Matcher m = block.matcher(text);
    StringBuilder sb = new StringBuilder(text.length());
    while (m.find()) {
      String inner = WHITESPACE.matcher(stripMarkup(m.group(1))).replaceAll(" ").strip();
      if (!inner.isEmpty()) fragments.add(inner);
      m.appendReplacement(sb, " ");
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static String stripMarkup(String text) {
    return ANGLE.matcher(TAG.matcher(text).replaceAll(" ")).replaceAll(" ");
  }

  private static String truncate(String text, int maxLength) {
    if (text.length() <= maxLength) return text;
    int cut = maxLength;
    if (Character.isHighSurrogate(text.charAt(cut - 1))) cut--;
    return text.substring(0, cut).stripTrailing();
  }
}
