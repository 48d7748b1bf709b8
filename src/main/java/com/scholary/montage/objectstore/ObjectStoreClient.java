package com.scholary.montage.objectstore;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Durable storage for uploaded clips, montages and their thumbnails.
 *
 * <p>Objects live in the configured bucket. Records elsewhere refer to them by URL, so the client
 * also maps keys to URLs and back.
 */
public interface ObjectStoreClient {

  /**
   * Download an object to a local file, replacing the file if it exists.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  void downloadToFile(String key, Path target);

  /**
   * Upload a local file.
   *
   * @return the URL of the stored object
   * @throws ObjectStoreException if the upload fails
   */
  String uploadFile(String key, Path source, String contentType);

  /**
   * Upload bytes.
   *
   * @return the URL of the stored object
   * @throws ObjectStoreException if the upload fails
   */
  String uploadBytes(String key, byte[] data, String contentType);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String key);

  /** Stable URL of an object in the bucket. */
  String objectUrl(String key);

  /**
   * Recover the object key from a URL produced by {@link #objectUrl(String)}.
   *
   * @return the key, or empty if the URL is missing or unparseable
   */
  Optional<String> keyFromUrl(String url);
}
