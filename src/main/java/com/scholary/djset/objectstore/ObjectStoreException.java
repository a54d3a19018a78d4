package com.scholary.djset.objectstore;

/** Thrown when an upload or presign call against the object store fails. */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
