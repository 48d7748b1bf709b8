package com.scholary.montage.scorer;

/** The scorer answered, but not in the expected shape. */
public class MalformedScorerResponseException extends ScorerException {

  public MalformedScorerResponseException(String message) {
    super(message);
  }

  public MalformedScorerResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
