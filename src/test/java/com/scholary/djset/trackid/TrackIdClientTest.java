package com.scholary.djset.trackid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrackIdClientTest {

  private static final String SEARCH_HIT =
      "{\"result\":{\"rowCount\":2,\"audiostreams\":["
          + "{\"slug\":\"carl-cox-tomorrowland-2022\",\"title\":\"Carl Cox | Tomorrowland 2022\"},"
          + "{\"slug\":\"carl-cox-space-closing\",\"title\":\"Carl Cox @ Space\"}]}}";
  private static final String SEARCH_MISS = "{\"result\":{\"rowCount\":0,\"audiostreams\":[]}}";
  private static final String DETECTIONS =
      "{\"result\":{\"title\":\"Carl Cox | Tomorrowland 2022\",\"duration\":\"01:00:00\","
          + "\"detectionProcesses\":[{\"detectionProcessMusicTracks\":["
          + "{\"artist\":\"Carl Cox\",\"title\":\"I Want You\","
          + "\"startTime\":\"00:00:00\",\"endTime\":\"00:06:00\"}]}]}}";

  private final List<String> requests = new CopyOnWriteArrayList<>();

  private HttpServer server;
  private TrackIdClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/api/public/audiostreams", this::handle);
    server.start();

    String baseUrl =
        "http://127.0.0.1:" + server.getAddress().getPort() + "/api/public/audiostreams";
    client =
        new TrackIdClient(
            new TrackIdProperties(
                baseUrl, Duration.ofSeconds(5), Duration.ofSeconds(5), "test-agent"),
            new ObjectMapper());
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void findSlug_shouldTakeFirstFinishedAudiostream() {
    assertThat(client.findSlug("carl cox")).contains("carl-cox-tomorrowland-2022");

    assertThat(requests).hasSize(1);
    assertThat(requests.get(0))
        .startsWith("/api/public/audiostreams?")
        .contains("keywords=carl+cox")
        .contains("pageSize=20")
        .contains("status=3");
  }

  @Test
  void findSlug_shouldBeEmptyWithoutMatches() {
    assertThat(client.findSlug("nobody")).isEmpty();
  }

  @Test
  void fetchDetections_shouldParseDetectedTracks() {
    TrackIdResponse response = client.fetchDetections("carl-cox-tomorrowland-2022");

    assertThat(requests).containsExactly("/api/public/audiostreams/carl-cox-tomorrowland-2022");
    assertThat(response.result().duration()).isEqualTo("01:00:00");
    assertThat(response.result().detectionProcesses().get(0).tracks())
        .extracting(TrackIdResponse.DetectedTrack::title)
        .containsExactly("I Want You");
  }

  @Test
  void fetchDetections_shouldFailOnErrorStatus() {
    assertThatThrownBy(() -> client.fetchDetections("broken"))
        .isInstanceOf(TrackIdException.class)
        .hasMessageContaining("status 500");
  }

  @Test
  void fetchDetections_shouldFailOnMalformedBody() {
    assertThatThrownBy(() -> client.fetchDetections("garbage"))
        .isInstanceOf(TrackIdException.class)
        .hasMessageContaining("detections failed");
  }

  private void handle(HttpExchange exchange) throws IOException {
    String uri = exchange.getRequestURI().toString();
    requests.add(uri);

    String path = exchange.getRequestURI().getPath();
    String query = exchange.getRequestURI().getRawQuery();
    if (path.endsWith("/broken")) {
      respond(exchange, 500, "{}");
    } else if (path.endsWith("/garbage")) {
      respond(exchange, 200, "<html>not json</html>");
    } else if (path.endsWith("/carl-cox-tomorrowland-2022")) {
      respond(exchange, 200, DETECTIONS);
    } else if (query != null && query.contains("keywords=carl")) {
      respond(exchange, 200, SEARCH_HIT);
    } else {
      respond(exchange, 200, SEARCH_MISS);
    }
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
