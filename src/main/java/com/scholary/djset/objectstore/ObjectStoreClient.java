package com.scholary.djset.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Minimal object storage operations needed to publish split tracks.
 *
 * <p>Implemented for S3-compatible stores (AWS S3, MinIO).
 */
public interface ObjectStoreClient {

  /**
   * Upload an object.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Create a time-limited download URL for an object.
   *
   * @throws ObjectStoreException if the URL cannot be signed
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
