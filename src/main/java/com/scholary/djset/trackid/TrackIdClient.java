package com.scholary.djset.trackid;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the TrackID public API.
 *
 * <p>Searches ask for finished audiostreams only ({@code status=3}) and take the first hit.
 */
@Component
public class TrackIdClient implements TrackIdService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackIdClient.class);

  private static final int SEARCH_PAGE_SIZE = 20;
  private static final int STATUS_FINISHED = 3;

  private final HttpClient httpClient;
  private final TrackIdProperties properties;
  private final ObjectMapper objectMapper;

  public TrackIdClient(TrackIdProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();

    LOGGER.info("Initialized TrackID client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public Optional<String> findSlug(String keywords) {
    String query =
        String.format(
            "?keywords=%s&pageSize=%d&currentPage=0&status=%d",
            URLEncoder.encode(keywords, StandardCharsets.UTF_8),
            SEARCH_PAGE_SIZE,
            STATUS_FINISHED);
    TrackIdSearchResponse response =
        get(baseUrl() + query, TrackIdSearchResponse.class, "search");

    if (response.result() == null || response.result().rowCount() == 0) {
      LOGGER.info("No TrackID audiostream matches '{}'", keywords);
      return Optional.empty();
    }
    List<TrackIdSearchResponse.Audiostream> streams = response.result().audiostreams();
    if (streams == null || streams.isEmpty()) {
      return Optional.empty();
    }

    TrackIdSearchResponse.Audiostream first = streams.get(0);
    LOGGER.debug(
        "Found audiostream: keywords={}, slug={}, title={}", keywords, first.slug(), first.title());
    return Optional.ofNullable(first.slug());
  }

  @Override
  public TrackIdResponse fetchDetections(String slug) {
    String url = baseUrl() + "/" + URLEncoder.encode(slug, StandardCharsets.UTF_8);
    return get(url, TrackIdResponse.class, "detections");
  }

  private <T> T get(String url, Class<T> type, String operation) {
    HttpRequest request =
        HttpRequest.newBuilder(URI.create(url))
            .timeout(properties.requestTimeout())
            .header("Accept", "application/json")
            .header("User-Agent", properties.userAgent())
            .GET()
            .build();

    LOGGER.debug("TrackID {} request: {}", operation, url);
    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new TrackIdException(
            String.format("TrackID %s returned status %d", operation, response.statusCode()));
      }
      return objectMapper.readValue(response.body(), type);
    } catch (IOException e) {
      throw new TrackIdException("TrackID " + operation + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TrackIdException("TrackID " + operation + " interrupted", e);
    }
  }

  private String baseUrl() {
    String base = properties.baseUrl();
    return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }
}
