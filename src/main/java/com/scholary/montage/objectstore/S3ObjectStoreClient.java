package com.scholary.montage.objectstore;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * SDK retries transient failures itself; 404 and 403 fail fast.
 *
 * <p>With path-style access URLs look like {@code {endpoint}/{bucket}/{key}}, otherwise the bucket
 * is part of the host name. {@link #keyFromUrl(String)} handles both.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final String bucket;
  private final boolean pathStyleAccess;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(StaticCredentialsProvider.create(credentials))
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
            .build();
    this.bucket = properties.bucket();
    this.pathStyleAccess = properties.pathStyleAccess();

    LOGGER.info("S3 client initialized successfully");
  }

  @Override
  public void downloadToFile(String key, Path target) {
    LOGGER.debug("Downloading object: bucket={}, key={} -> {}", bucket, key, target);

    GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    try (ResponseInputStream<GetObjectResponse> stream = s3Client.getObject(request)) {
      long bytes = Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Downloaded object: bucket={}, key={}, bytes={}", bucket, key, bytes);

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public String uploadFile(String key, Path source, String contentType) {
    return put(key, contentType, RequestBody.fromFile(source));
  }

  @Override
  public String uploadBytes(String key, byte[] data, String contentType) {
    return put(key, contentType, RequestBody.fromBytes(data));
  }

  private String put(String key, String contentType, RequestBody body) {
    LOGGER.debug("Uploading object: bucket={}, key={}, contentType={}", bucket, key, contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();

      s3Client.putObject(request, body);

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);
      return objectUrl(key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void deleteObject(String key) {
    LOGGER.debug("Deleting object: bucket={}, key={}", bucket, key);

    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public String objectUrl(String key) {
    return s3Client
        .utilities()
        .getUrl(GetUrlRequest.builder().bucket(bucket).key(key).build())
        .toExternalForm();
  }

  @Override
  public Optional<String> keyFromUrl(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    String path;
    try {
      path = new URI(url).getPath();
    } catch (URISyntaxException e) {
      LOGGER.warn("Invalid object URL: {}", url);
      return Optional.empty();
    }
    if (path == null || path.length() <= 1) {
      return Optional.empty();
    }
    String key = path.substring(1);
    if (pathStyleAccess) {
      String prefix = bucket + "/";
      if (!key.startsWith(prefix)) {
        LOGGER.warn("Object URL does not point into bucket {}: {}", bucket, url);
        return Optional.empty();
      }
      key = key.substring(prefix.length());
    }
    return key.isEmpty() ? Optional.empty() : Optional.of(key);
  }

  /** Release connections when the application shuts down. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
