package com.signalkit.internal.influx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.signalkit.internal.PriorityThreadFactory;
import com.signalkit.metrics.BackendConfig;
import com.signalkit.metrics.BackendException;
import com.signalkit.metrics.MeasurementPoint;
import com.signalkit.metrics.MetricsBackend;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * InfluxDB 1.x over HTTP. The JDK {@link HttpClient} is safe for concurrent use, so writes are
 * never serialized by the sink.
 */
public class InfluxHttpBackend implements MetricsBackend {
  private final BackendConfig config;
  private final HttpClient httpClient;
  private final Optional<ExecutorService> ownedExecutor;
  private final Optional<String> authorization;

  public InfluxHttpBackend(BackendConfig config) {
    this(
        config,
        Executors.newCachedThreadPool(
            new PriorityThreadFactory(Thread.NORM_PRIORITY, "signalkit-http")));
  }

  private InfluxHttpBackend(BackendConfig config, ExecutorService executor) {
    this(config, InfluxConnection.newHttpClient(executor), Optional.of(executor));
  }

  // Package-private for tests, to allow mocked HTTP clients
  @VisibleForTesting
  InfluxHttpBackend(BackendConfig config, HttpClient httpClient, Optional<ExecutorService> ownedExecutor) {
    this.config = config;
    this.httpClient = httpClient;
    this.ownedExecutor = ownedExecutor;
    this.authorization =
        config
            .username()
            .map(user -> InfluxConnection.Headers.basicAuthorization(user, config.password().orElse("")));
  }

  @Override
  public void ping() throws BackendException, InterruptedException {
    final HttpRequest pingRequest =
        requestBuilder(InfluxConnection.getFullUri(config.baseUri(), InfluxConnection.Route.PING))
            .GET()
            .build();
    final HttpResponse<String> response = send(pingRequest);
    if (!InfluxConnection.isSuccess(response.statusCode())) {
      throw failure("ping", response);
    }
  }

  @Override
  public void write(String database, MeasurementPoint point)
      throws BackendException, InterruptedException {
    final String body;
    try {
      body = LineProtocol.encode(point);
    } catch (IllegalArgumentException exception) {
      throw new BackendException("couldn't encode point: " + exception.getMessage(), exception);
    }

    final URI writeUri =
        InfluxConnection.getFullUri(
            config.baseUri(),
            InfluxConnection.Route.WRITE,
            ImmutableMap.of("db", database, "precision", "ns"));
    final HttpRequest writeRequest =
        requestBuilder(writeUri)
            .header(
                InfluxConnection.Headers.KEY__CONTENT_TYPE,
                InfluxConnection.Headers.VAL__CONTENT_LINE_PROTOCOL)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    final HttpResponse<String> response = send(writeRequest);
    if (!InfluxConnection.isSuccess(response.statusCode())) {
      throw failure("write", response);
    }
  }

  @Override
  public boolean isConcurrencySafe() {
    return true;
  }

  @Override
  public void close() {
    ownedExecutor.ifPresent(ExecutorService::shutdownNow);
  }

  private HttpRequest.Builder requestBuilder(URI uri) throws BackendException {
    final HttpRequest.Builder builder;
    try {
      builder = HttpRequest.newBuilder().uri(uri);
    } catch (IllegalArgumentException exception) {
      // java.net.http only addresses server-based authorities; "influx_db" is registry-based.
      throw new BackendException(
          String.format("http client cannot address %s: %s", uri, exception.getMessage()), exception);
    }
    builder
        .timeout(InfluxConnection.REQUEST_TIMEOUT)
        .header(InfluxConnection.Headers.KEY__USER_AGENT, InfluxConnection.Headers.VAL__USER_AGENT);
    authorization.ifPresent(
        value -> builder.header(InfluxConnection.Headers.KEY__AUTHORIZATION, value));
    return builder;
  }

  private HttpResponse<String> send(HttpRequest request)
      throws BackendException, InterruptedException {
    try {
      return InfluxConnection.send(httpClient, request);
    } catch (IOException exception) {
      throw new BackendException(
          String.format("%s %s failed: %s", request.method(), request.uri().getPath(), exception),
          exception);
    }
  }

  private static BackendException failure(String operation, HttpResponse<String> response) {
    final String detail = errorDetail(Optional.ofNullable(response.body()).orElse(""));
    final String message =
        response.statusCode() == HttpURLConnection.HTTP_UNAUTHORIZED
            ? String.format("influxdb %s unauthorized: %s", operation, detail)
            : String.format("influxdb %s failed with status %d: %s", operation, response.statusCode(), detail);
    return new BackendException(message, response.statusCode());
  }

  // InfluxDB reports failures as {"error": "..."}; anything else is passed through verbatim.
  @VisibleForTesting
  static String errorDetail(String body) {
    if (body.isBlank()) {
      return "<empty body>";
    }
    try {
      final JsonNode error = InfluxConnection.DEFAULT_SERIALIZER.readTree(body).path("error");
      return error.isTextual() ? error.asText() : body.strip();
    } catch (JsonProcessingException exception) {
      return body.strip();
    }
  }
}
