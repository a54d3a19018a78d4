package com.scholary.djset.download;

import com.scholary.djset.job.CancellationToken;
import com.scholary.djset.split.FileNames;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.DoubleConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads a mix over plain HTTP(S).
 *
 * <p>The body is streamed to disk in fixed-size buffers. Cancellation is checked between buffers,
 * progress is reported when the server sends a content length. The file is named from {@code
 * Content-Disposition}, falling back to the last path segment of the URL, with {@code .mp3} added
 * when the name has no extension.
 */
@Component
public class HttpDownloader implements Downloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpDownloader.class);

  private static final int BUFFER_SIZE = 64 * 1024;
  private static final String DEFAULT_EXTENSION = ".mp3";
  private static final Pattern FILENAME_PATTERN =
      Pattern.compile("filename\\*?=(?:UTF-8'')?\"?([^\";]+)\"?", Pattern.CASE_INSENSITIVE);

  private final HttpClient httpClient;
  private final DownloadProperties properties;

  public HttpDownloader(DownloadProperties properties) {
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  @Override
  public Path download(
      String url, Path outputDir, DoubleConsumer progress, CancellationToken token)
      throws IOException {
    URI uri = parse(url);
    token.throwIfCancelled();
    LOGGER.info("Downloading {}", uri);

    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(properties.requestTimeout())
            .header("User-Agent", properties.userAgent())
            .GET()
            .build();

    HttpResponse<InputStream> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Download interrupted: " + uri, e);
    }

    try (InputStream body = response.body()) {
      if (response.statusCode() != 200) {
        throw new DownloadException(
            String.format("Download of %s failed with HTTP %d", uri, response.statusCode()));
      }

      Files.createDirectories(outputDir);
      String disposition = response.headers().firstValue("Content-Disposition").orElse(null);
      Path target = outputDir.resolve(fileName(disposition, uri));
      long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);

      long written = copy(body, target, contentLength, progress, token);
      if (written == 0) {
        Files.deleteIfExists(target);
        throw new DownloadException("Downloaded file is empty: " + uri);
      }

      LOGGER.info("Downloaded {} bytes to {}", written, target);
      return target;
    }
  }

  private static long copy(
      InputStream body,
      Path target,
      long contentLength,
      DoubleConsumer progress,
      CancellationToken token)
      throws IOException {
    byte[] buffer = new byte[BUFFER_SIZE];
    long written = 0;
    try (OutputStream out = Files.newOutputStream(target)) {
      int read;
      while ((read = body.read(buffer)) != -1) {
        token.throwIfCancelled();
        out.write(buffer, 0, read);
        written += read;
        if (contentLength > 0) {
          progress.accept((double) written / contentLength);
        }
      }
    }
    return written;
  }

  private static URI parse(String url) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new DownloadException("Invalid URL: " + url, e);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new DownloadException("Unsupported URL scheme: " + url);
    }
    return uri;
  }

  static String fileName(String contentDisposition, URI uri) {
    String name = null;
    if (contentDisposition != null) {
      Matcher matcher = FILENAME_PATTERN.matcher(contentDisposition);
      if (matcher.find()) {
        name = URLDecoder.decode(matcher.group(1).trim(), StandardCharsets.UTF_8);
      }
    }
    if (name == null || name.isBlank()) {
      String path = uri.getPath() == null ? "" : uri.getPath();
      name = path.substring(path.lastIndexOf('/') + 1);
    }
    if (name.isBlank()) {
      name = "download";
    }

    name = FileNames.sanitize(name);
    return name.indexOf('.') > 0 ? name : name + DEFAULT_EXTENSION;
  }
}
