package com.scholary.montage.scorer;

/**
 * The scoring service reported that it is overloaded.
 *
 * <p>This is the only scorer failure that is retried.
 */
public class ScorerOverloadedException extends ScorerException {

  public ScorerOverloadedException(String message) {
    super(message);
  }
}
