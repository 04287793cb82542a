package com.signalkit.internal.influx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.signalkit.Signalkit;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

public class InfluxConnection {
  private InfluxConnection() {}

  public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  public static final ObjectMapper DEFAULT_SERIALIZER =
      new ObjectMapper().registerModule(new Jdk8Module());

  public static class Headers {
    public static final String KEY__USER_AGENT = "User-Agent";
    public static final String KEY__AUTHORIZATION = "Authorization";
    public static final String KEY__CONTENT_TYPE = "Content-Type";

    public static final String VAL__USER_AGENT = "signalkit/" + Signalkit.VERSION;
    public static final String VAL__CONTENT_LINE_PROTOCOL = "text/plain; charset=utf-8";

    public static String basicAuthorization(String username, String password) {
      final String credentials = username + ":" + password;
      return "Basic "
          + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
  }

  public static enum Route {
    PING("/ping"),
    WRITE("/write");

    private final String pathValue;

    Route(final String pathValue) {
      this.pathValue = pathValue;
    }

    @Override
    public String toString() {
      return pathValue;
    }
  }

  public static URI getFullUri(URI baseUri, Route route) {
    return baseUri.resolve(route.toString());
  }

  public static URI getFullUri(URI baseUri, Route route, Map<String, String> query) {
    final String queryString =
        query.entrySet().stream()
            .map(
                e ->
                    URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    return baseUri.resolve(route.toString() + (queryString.isEmpty() ? "" : "?" + queryString));
  }

  /** Single attempt; failed metric writes are never retried. */
  public static HttpResponse<String> send(HttpClient httpClient, HttpRequest request)
      throws InterruptedException, IOException {
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  public static HttpClient newHttpClient(Executor executor) {
    return HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).executor(executor).build();
  }

  public static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}
