package com.scholary.montage.scorer;

/** Exception thrown when a scorer call fails. */
public class ScorerException extends RuntimeException {

  public ScorerException(String message) {
    super(message);
  }

  public ScorerException(String message, Throwable cause) {
    super(message, cause);
  }
}
