package com.scholary.montage.api;

import com.scholary.montage.clip.Clip;
import java.time.Instant;
import java.time.LocalDate;

/** A scored clip as returned to clients. */
public record ClipResponse(
    String id,
    String mediaUrl,
    String thumbnailUrl,
    double startSec,
    double endSec,
    String description,
    double relevance,
    double quality,
    double confidence,
    double score,
    Instant capturedAt,
    LocalDate weekEnding) {

  public static ClipResponse from(Clip clip) {
    return new ClipResponse(
        clip.id(),
        clip.mediaUrl(),
        clip.thumbnailUrl(),
        clip.startSec(),
        clip.endSec(),
        clip.description(),
        clip.scores().relevance(),
        clip.scores().quality(),
        clip.scores().confidence(),
        clip.score(),
        clip.capturedAt(),
        clip.weekEnding());
  }
}
