package com.scholary.montage.transcode;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/** Builds ffmpeg and ffprobe argument lists. */
class FfmpegCommands {

  private final FfmpegProperties properties;

  FfmpegCommands(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Trim and re-encode into an MPEG-TS segment.
   *
   * <p>Seeking before {@code -i} is fast and frame accurate since the segment is re-encoded.
   */
  List<String> normalize(Path input, double startSec, double endSec, Path output) {
    int w = properties.width();
    int h = properties.height();
    String filter =
        String.format(
            Locale.ROOT,
            "scale=%d:%d:force_original_aspect_ratio=decrease,pad=%d:%d:(ow-iw)/2:(oh-ih)/2,setsar=1",
            w,
            h,
            w,
            h);
    return List.of(
        properties.ffmpegPath(),
        "-y",
        "-ss",
        seconds(startSec),
        "-i",
        input.toString(),
        "-t",
        seconds(endSec - startSec),
        "-vf",
        filter,
        "-r",
        String.valueOf(properties.frameRate()),
        "-c:v",
        "libx264",
        "-preset",
        properties.preset(),
        "-crf",
        String.valueOf(properties.crf()),
        "-pix_fmt",
        "yuv420p",
        "-c:a",
        "aac",
        "-ar",
        "44100",
        "-ac",
        "2",
        "-f",
        "mpegts",
        output.toString());
  }

  List<String> concatenate(Path listFile, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-y",
        "-f",
        "concat",
        "-safe",
        "0",
        "-i",
        listFile.toString(),
        "-c",
        "copy",
        "-bsf:a",
        "aac_adtstoasc",
        "-movflags",
        "+faststart",
        output.toString());
  }

  List<String> thumbnail(Path input, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-y",
        "-i",
        input.toString(),
        "-ss",
        seconds(properties.thumbnailOffsetSeconds()),
        "-vframes",
        "1",
        "-f",
        "image2",
        output.toString());
  }

  List<String> compress(Path input, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-y",
        "-i",
        input.toString(),
        "-vf",
        "scale=-2:" + properties.compressHeight(),
        "-crf",
        String.valueOf(properties.compressCrf()),
        "-preset",
        "veryfast",
        output.toString());
  }

  List<String> probeDuration(Path input) {
    return List.of(
        properties.ffprobePath(),
        "-v",
        "error",
        "-show_entries",
        "format=duration",
        "-of",
        "default=noprint_wrappers=1:nokey=1",
        input.toString());
  }

  /** One concat demuxer line; single quotes in the path are escaped the way the demuxer expects. */
  static String concatListEntry(Path file) {
    String path = file.toAbsolutePath().toString().replace("'", "'\\''");
    return "file '" + path + "'";
  }

  private static String seconds(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
