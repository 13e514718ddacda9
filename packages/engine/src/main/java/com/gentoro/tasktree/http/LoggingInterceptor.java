package com.gentoro.tasktree.http;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Logs driver traffic: method, URL, status and latency at DEBUG, truncated bodies at TRACE.
 * Credentials never reach the log since only bodies are printed, never headers.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(LoggingInterceptor.class);

  // embedding vectors make bodies huge
  static final int MAX_LOGGED_BODY = 2_000;

  @NotNull
  @Override
  public Response intercept(@NotNull Chain chain) throws IOException {
    Request request = chain.request();
    if (log.isTraceEnabled()) {
      log.trace("-> {} {} {}", request.method(), request.url(), abbreviate(read(request.body())));
    }
    long started = System.nanoTime();
    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug(
          "{} {} failed after {} ms: {}",
          request.method(),
          request.url(),
          elapsedMillis(started),
          e.toString());
      throw e;
    }
    log.debug(
        "{} {} -> {} in {} ms",
        request.method(),
        request.url(),
        response.code(),
        elapsedMillis(started));
    if (log.isTraceEnabled()) {
      log.trace("<- {}", abbreviate(response.peekBody(MAX_LOGGED_BODY + 1L).string()));
    }
    return response;
  }

  static String abbreviate(String body) {
    if (body.length() <= MAX_LOGGED_BODY) return body;
    return body.substring(0, MAX_LOGGED_BODY) + "... (" + body.length() + " chars)";
  }

  private static String read(RequestBody body) {
    if (body == null) return "";
    try (Buffer buffer = new Buffer()) {
      body.writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "<unreadable body: " + e.getMessage() + ">";
    }
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
