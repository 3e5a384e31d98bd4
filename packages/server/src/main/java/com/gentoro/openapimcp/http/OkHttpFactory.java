package com.gentoro.openapimcp.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Client for outbound tool calls. Every call is bounded by {@code timeout} end to end and is
   * never retried.
   */
  public static OkHttpClient create(Duration timeout) {
    Duration bound = timeout == null || timeout.isZero() || timeout.isNegative()
        ? DEFAULT_TIMEOUT
        : timeout;
    return new OkHttpClient.Builder()
        .connectTimeout(bound)
        .readTimeout(bound)
        .writeTimeout(bound)
        .callTimeout(bound)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
