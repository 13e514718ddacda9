package com.gentoro.tasktree.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(String headerName, String headerValue, long readTimeoutMs) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS);
    if (headerName != null && headerValue != null && !headerValue.isBlank()) {
      builder.addInterceptor(new HeaderInterceptor(headerName, headerValue));
    }
    return builder.addInterceptor(new LoggingInterceptor()).build();
  }
}
