package com.scholary.montage.objectstore;

import java.time.LocalDate;

/** Object key layout. */
public final class ObjectKeys {

  private ObjectKeys() {}

  public static String clip(String userId, LocalDate weekEnding, String unique, String filename) {
    return String.format("clips/%s/%s/%s-%s", userId, weekEnding, unique, sanitize(filename));
  }

  public static String clipThumbnail(String userId, String unique) {
    return String.format("thumbnails/%s/%s.jpg", userId, unique);
  }

  public static String montage(String userId, LocalDate weekEnding, String unique) {
    return String.format("montages/%s/%s/%s.mp4", userId, weekEnding, unique);
  }

  public static String montageThumbnail(String userId, LocalDate weekEnding, String unique) {
    return String.format("montages/thumbnails/%s/%s/%s.jpg", userId, weekEnding, unique);
  }

  /** Keep the last path segment and replace characters that are awkward in keys and URLs. */
  static String sanitize(String filename) {
    if (filename == null || filename.isBlank()) {
      return "video.mp4";
    }
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    name = name.replaceAll("[^A-Za-z0-9._-]", "_");
    return name.isEmpty() ? "video.mp4" : name;
  }
}
