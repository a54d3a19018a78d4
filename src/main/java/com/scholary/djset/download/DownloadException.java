package com.scholary.djset.download;

/** The source could not be downloaded: bad URL, HTTP error or empty body. */
public class DownloadException extends RuntimeException {

  public DownloadException(String message) {
    super(message);
  }

  public DownloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
