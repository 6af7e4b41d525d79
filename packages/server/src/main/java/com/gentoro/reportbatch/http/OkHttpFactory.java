package com.gentoro.reportbatch.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private OkHttpFactory() {}

  /**
   * Client for upstream report calls. {@code callTimeout} bounds the whole call (connect, write,
   * server processing and read) so every item gets the same independent deadline.
   */
  public static OkHttpClient create(Duration callTimeout) {
    if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    return new OkHttpClient.Builder()
        .callTimeout(callTimeout)
        .connectTimeout(callTimeout)
        .readTimeout(callTimeout)
        .writeTimeout(callTimeout)
        .followRedirects(false)
        .followSslRedirects(false)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
