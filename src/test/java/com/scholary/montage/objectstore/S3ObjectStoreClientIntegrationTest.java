package com.scholary.montage.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/** Exercises the S3 client against a MinIO container. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientIntegrationTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "highlights-test";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @TempDir Path tempDir;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    try (S3Client admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
    }
    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true));
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void uploadDownloadAndDelete() throws Exception {
    String key = "clips/u1/2026-10-18/abc-beach.mp4";
    String url =
        client.uploadBytes(key, "video-bytes".getBytes(StandardCharsets.UTF_8), "video/mp4");

    assertThat(client.keyFromUrl(url)).contains(key);

    Path target = tempDir.resolve("download.mp4");
    client.downloadToFile(key, target);
    assertThat(Files.readString(target)).isEqualTo("video-bytes");

    client.deleteObject(key);
    assertThatThrownBy(() -> client.downloadToFile(key, tempDir.resolve("gone.mp4")))
        .isInstanceOf(ObjectStoreException.class);
  }

  @Test
  void uploadFile_returnsUrlOfStoredObject() throws Exception {
    Path source = Files.writeString(tempDir.resolve("thumb.jpg"), "jpeg");

    String url = client.uploadFile("thumbnails/u1/abc.jpg", source, "image/jpeg");

    assertThat(url).endsWith("/" + BUCKET + "/thumbnails/u1/abc.jpg");
  }
}
