package com.scholary.montage.transcode;

/** Exception thrown when an ffmpeg or ffprobe invocation fails. */
public class TranscodeException extends RuntimeException {

  public TranscodeException(String message) {
    super(message);
  }

  public TranscodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
