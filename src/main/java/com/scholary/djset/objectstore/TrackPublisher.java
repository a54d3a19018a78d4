package com.scholary.djset.objectstore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads split tracks to the object store and hands out presigned download links.
 *
 * <p>Objects are keyed {@code <set directory>/<file name>}, mirroring the local output layout.
 */
public class TrackPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackPublisher.class);

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "mp3", "audio/mpeg",
          "m4a", "audio/mp4",
          "wav", "audio/wav",
          "flac", "audio/flac");

  private final ObjectStoreClient client;
  private final String bucket;
  private final Duration presignTtl;

  public TrackPublisher(ObjectStoreClient client, String bucket, Duration presignTtl) {
    this.client = client;
    this.bucket = bucket;
    this.presignTtl = presignTtl;
  }

  /** Upload every non-null result path. */
  public void publish(List<String> results) throws IOException {
    int uploaded = 0;
    for (String result : results) {
      if (result == null) {
        continue;
      }
      Path file = Path.of(result);
      try (InputStream data = Files.newInputStream(file)) {
        client.putObject(bucket, objectKey(file), data, Files.size(file), contentType(file));
      }
      uploaded++;
    }
    LOGGER.info("Published {} tracks to bucket {}", uploaded, bucket);
  }

  public URL downloadUrl(Path file) {
    return client.presignGet(bucket, objectKey(file), presignTtl);
  }

  static String objectKey(Path file) {
    Path parent = file.getParent();
    String name = file.getFileName().toString();
    return parent == null || parent.getFileName() == null
        ? name
        : parent.getFileName() + "/" + name;
  }

  static String contentType(Path file) {
    String name = file.getFileName().toString();
    String extension = name.substring(name.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    return CONTENT_TYPES.getOrDefault(extension, "application/octet-stream");
  }
}
