package com.scholary.montage.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Runtime exception: a missing bucket or bad credentials cannot be fixed by the caller.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
