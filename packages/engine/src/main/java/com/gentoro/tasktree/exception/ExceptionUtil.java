package com.gentoro.tasktree.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/** Helpers turning exceptions into log-friendly and result-friendly forms. */
public final class ExceptionUtil {
  private static final int DEFAULT_FRAMES = 5;

  private ExceptionUtil() {}

  public static ErrorDetails toErrorDetails(Throwable t) {
    String message = t.getMessage() == null ? "" : t.getMessage();
    if (t instanceof TaskTreeException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          message,
          ex.getCode(),
          failureKindOf(ex),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        message,
        TaskTreeErrorCode.UNKNOWN,
        failureKindOf(t),
        Map.of(),
        Instant.now());
  }

  /**
   * Failure kind used for retry decisions. Store and embedding exceptions carry their own. Invalid
   * arguments, validation and serialization failures are CLIENT; anything else, I/O included, is
   * assumed transient.
   */
  public static FailureKind failureKindOf(Throwable t) {
    if (t instanceof VectorStoreException vse) return vse.getKind();
    if (t instanceof EmbeddingException ee) return ee.getKind();
    if (t instanceof ValidationException
        || t instanceof SerializationException
        || t instanceof IllegalArgumentException
        || t instanceof NullPointerException) {
      return FailureKind.CLIENT;
    }
    return FailureKind.TRANSIENT;
  }

  /**
   * Top stack frames on one line, innermost first, e.g. {@code a.B.run (B.java:12) > a.C.main
   * (C.java:3)}.
   *
   * @param maxFrames frames to keep; not positive keeps all
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    return Arrays.stream(t.getStackTrace())
        .limit(maxFrames <= 0 ? Long.MAX_VALUE : maxFrames)
        .map(ExceptionUtil::frame)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static String frame(StackTraceElement e) {
    String source = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    if (e.getLineNumber() >= 0) source += ":" + e.getLineNumber();
    return e.getClassName() + "." + e.getMethodName() + " (" + source + ")";
  }
}
