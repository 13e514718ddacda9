package com.gentoro.tasktree.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds a fixed header (API key, bearer token) to every outgoing request. */
public class HeaderInterceptor implements Interceptor {
  private final String name;
  private final String value;

  public HeaderInterceptor(String name, String value) {
    this.name = name;
    this.value = value;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    if (original.header(name) != null) {
      return chain.proceed(original);
    }
    return chain.proceed(original.newBuilder().header(name, value).build());
  }
}
