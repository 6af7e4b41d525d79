package com.gentoro.reportbatch.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs upstream requests, responses and transport failures with their duration. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final long MAX_LOGGED_BODY = 4096;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "➡️ Sending request {} {}\nHeaders:\n{}\nBody:\n{}\n",
          request.method(),
          request.url(),
          request.headers(),
          bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn("Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsed(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    long durationMs = elapsed(startTime);
    log.debug(
        "⬅️ Received response for {} in {} ms\nStatus: {}\nHeaders:\n{}\n",
        response.request().url(),
        durationMs,
        response.code(),
        response.headers());
    if (log.isTraceEnabled()) {
      try {
        ResponseBody peeked = response.peekBody(MAX_LOGGED_BODY);
        log.trace("Response body:\n{}\n", peeked.string());
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
    }
    return response;
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
