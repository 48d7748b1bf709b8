package com.scholary.montage.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scratch directory owned by a single run.
 *
 * <p>Named {@code {userId}-{epochMillis}-{random}} under the configured root, so concurrent runs
 * never share one. {@link #close()} deletes it recursively; only the first call does any work and
 * it never throws.
 */
public final class WorkingDirectory implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkingDirectory.class);

  private final Path path;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private WorkingDirectory(Path path) {
    this.path = path;
  }

  /**
   * Create a fresh directory for one run.
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public static WorkingDirectory create(Path root, String userId, Clock clock) {
    String name =
        String.format(
            "%s-%d-%d",
            userId.replaceAll("[^A-Za-z0-9_-]", "_"),
            clock.millis(),
            ThreadLocalRandom.current().nextInt(1_000_000_000));
    Path path = root.resolve(name);
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create working directory " + path, e);
    }
    LOGGER.debug("Created working directory {}", path);
    return new WorkingDirectory(path);
  }

  public Path path() {
    return path;
  }

  public Path resolve(String fileName) {
    return path.resolve(fileName);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info("Cleaning up working directory {}", path);
    if (!Files.exists(path)) {
      return;
    }
    try {
      Files.walkFileTree(
          path,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                throws IOException {
              Files.deleteIfExists(file);
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                throws IOException {
              Files.deleteIfExists(dir);
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      LOGGER.error("Failed to clean up working directory {}", path, e);
    }
  }
}
