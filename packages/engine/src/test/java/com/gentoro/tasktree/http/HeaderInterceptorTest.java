package com.gentoro.tasktree.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import okhttp3.Interceptor;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HeaderInterceptorTest {

  @Test
  void addsHeaderWhenAbsent() throws Exception {
    Request sent = intercept(new Request.Builder().url("http://localhost/collections").build());

    assertEquals("secret", sent.header("api-key"));
  }

  @Test
  void keepsExplicitHeader() throws Exception {
    Request sent =
        intercept(
            new Request.Builder()
                .url("http://localhost/collections")
                .header("api-key", "override")
                .build());

    assertEquals("override", sent.header("api-key"));
  }

  private static Request intercept(Request original) throws Exception {
    Interceptor.Chain chain = mock(Interceptor.Chain.class);
    when(chain.request()).thenReturn(original);
    when(chain.proceed(any()))
        .thenAnswer(
            inv ->
                new Response.Builder()
                    .request(inv.getArgument(0))
                    .protocol(Protocol.HTTP_1_1)
                    .code(200)
                    .message("OK")
                    .build());

    new HeaderInterceptor("api-key", "secret").intercept(chain);

    ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
    verify(chain).proceed(captor.capture());
    return captor.getValue();
  }
}
