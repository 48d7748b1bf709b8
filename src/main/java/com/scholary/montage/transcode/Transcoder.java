package com.scholary.montage.transcode;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Media operations needed to build clips and montages.
 *
 * <p>All methods write to the given output path and throw {@link TranscodeException} on failure,
 * leaving no partial output behind.
 */
public interface Transcoder {

  /**
   * Trim a segment and re-encode it to the canonical montage format.
   *
   * @param input source media
   * @param startSec segment start
   * @param endSec segment end, after the start
   * @param output normalized clip, in a format that can be concatenated without re-encoding
   */
  Path normalize(Path input, double startSec, double endSec, Path output);

  /** Join normalized clips, in the given order, into one MP4. */
  Path concatenate(List<Path> inputs, Path output);

  /** Grab a single JPEG frame. */
  Path thumbnail(Path input, Path output);

  /** Downscale a video for storage. */
  Path compress(Path input, Path output);

  /**
   * Read a media file's duration.
   *
   * @return the duration in seconds, or empty if it cannot be determined
   */
  Optional<Double> probeDuration(Path input);
}
