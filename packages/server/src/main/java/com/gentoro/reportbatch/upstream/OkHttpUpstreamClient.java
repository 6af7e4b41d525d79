package com.gentoro.reportbatch.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.reportbatch.exception.UpstreamException;
import com.gentoro.reportbatch.exception.UpstreamException.Kind;
import com.gentoro.reportbatch.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.Iterator;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** {@link UpstreamClient} backed by OkHttp. */
public final class OkHttpUpstreamClient implements UpstreamClient {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int ERROR_SNIPPET = 512;

  private final OkHttpClient http;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public OkHttpUpstreamClient(OkHttpClient http) {
    this.http = http;
  }

  @Override
  public UpstreamResponse execute(UpstreamRequest request) {
    Request httpRequest = toHttpRequest(request);
    try (Response response = http.newCall(httpRequest).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new UpstreamException(
            Kind.HTTP_STATUS,
            response.code(),
            "Upstream returned HTTP %d: %s".formatted(response.code(), snippet(text)),
            null);
      }
      return new UpstreamResponse(response.code(), parse(text), text.length());
    } catch (InterruptedIOException e) {
      // OkHttp reports callTimeout and read timeouts as InterruptedIOException
      throw new UpstreamException(Kind.TIMEOUT, "Upstream call timed out: " + request.url(), e);
    } catch (ConnectException | UnknownHostException | NoRouteToHostException e) {
      throw new UpstreamException(
          Kind.CONNECTION, "Could not connect to upstream: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new UpstreamException(Kind.IO, "Upstream I/O error: " + e.getMessage(), e);
    }
  }

  private Request toHttpRequest(UpstreamRequest request) {
    HttpUrl url = HttpUrl.parse(request.url());
    if (url == null) {
      throw new UpstreamException(Kind.IO, "Invalid upstream URL: " + request.url(), null);
    }
    Request.Builder builder = new Request.Builder().header("Accept", "application/json");
    request.headers().forEach(builder::header);

    JsonNode payload = request.payload();
    if (request.hasBody()) {
      String json;
      try {
        json = payload == null || payload.isNull() ? "{}" : mapper.writeValueAsString(payload);
      } catch (JsonProcessingException e) {
        throw new UpstreamException(Kind.IO, "Could not serialize request payload", e);
      }
      builder.url(url).method(request.method(), RequestBody.create(json, JSON));
    } else {
      HttpUrl.Builder query = url.newBuilder();
      if (payload != null && payload.isObject()) {
        for (Iterator<Map.Entry<String, JsonNode>> it = payload.fields(); it.hasNext(); ) {
          Map.Entry<String, JsonNode> field = it.next();
          if (field.getValue().isValueNode() && !field.getValue().isNull()) {
            query.addQueryParameter(field.getKey(), field.getValue().asText());
          }
        }
      }
      builder.url(query.build()).method(request.method(), null);
    }
    return builder.build();
  }

  private JsonNode parse(String text) {
    if (text.isBlank()) return TextNode.valueOf("");
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      return TextNode.valueOf(text);
    }
  }

  private static String snippet(String text) {
    return text.length() <= ERROR_SNIPPET ? text : text.substring(0, ERROR_SNIPPET) + "...";
  }
}
