package com.gentoro.tasktree.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

class LoggingInterceptorTest {
  private static final MediaType JSON = MediaType.get("application/json");

  private final Request request =
      new Request.Builder()
          .url("http://localhost:6333/collections/tasks")
          .post(RequestBody.create("{\"vector\":[0.1,0.2]}", JSON))
          .build();

  @Test
  void passesResponseThrough() throws IOException {
    Response response =
        new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(200)
            .message("OK")
            .body(ResponseBody.create("{\"result\":true}", JSON))
            .build();
    Interceptor.Chain chain = mock(Interceptor.Chain.class);
    when(chain.request()).thenReturn(request);
    when(chain.proceed(request)).thenReturn(response);

    assertSame(response, new LoggingInterceptor().intercept(chain));
    assertEquals("{\"result\":true}", response.body().string());
  }

  @Test
  void rethrowsTransportFailures() throws IOException {
    Interceptor.Chain chain = mock(Interceptor.Chain.class);
    when(chain.request()).thenReturn(request);
    when(chain.proceed(request)).thenThrow(new SocketTimeoutException("read timed out"));

    assertThrows(SocketTimeoutException.class, () -> new LoggingInterceptor().intercept(chain));
  }

  @Test
  void abbreviatesLongBodies() {
    String huge = "x".repeat(LoggingInterceptor.MAX_LOGGED_BODY + 10);

    assertEquals("short", LoggingInterceptor.abbreviate("short"));
    String logged = LoggingInterceptor.abbreviate(huge);
    assertTrue(logged.endsWith("... (" + huge.length() + " chars)"));
    assertEquals(LoggingInterceptor.MAX_LOGGED_BODY, logged.indexOf("..."));
  }
}
