package com.scholary.montage.transcode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link Transcoder} backed by the ffmpeg and ffprobe binaries.
 *
 * <p>Each call runs one process with stderr merged into stdout. The process is killed when it runs
 * past the configured timeout or when the calling thread is interrupted.
 */
@Component
public class FfmpegTranscoder implements Transcoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  private static final int OUTPUT_TAIL_LINES = 20;

  private final FfmpegProperties properties;
  private final FfmpegCommands commands;

  public FfmpegTranscoder(FfmpegProperties properties) {
    this.properties = properties;
    this.commands = new FfmpegCommands(properties);
  }

  @Override
  public Path normalize(Path input, double startSec, double endSec, Path output) {
    if (endSec <= startSec) {
      throw new TranscodeException(
          String.format("Invalid segment [%s, %s) for %s", startSec, endSec, input.getFileName()));
    }
    LOGGER.info(
        "Normalizing {} [{}s, {}s] -> {}", input.getFileName(), startSec, endSec, output.getFileName());
    runProducing(commands.normalize(input, startSec, endSec, output), output);
    return output;
  }

  @Override
  public Path concatenate(List<Path> inputs, Path output) {
    if (inputs.isEmpty()) {
      throw new TranscodeException("Nothing to concatenate");
    }
    Path listFile = output.resolveSibling(output.getFileName() + ".list.txt");
    List<String> entries = new ArrayList<>(inputs.size());
    for (Path input : inputs) {
      entries.add(FfmpegCommands.concatListEntry(input));
    }
    try {
      Files.write(listFile, entries, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TranscodeException("Failed to write concat list " + listFile, e);
    }

    LOGGER.info("Concatenating {} clips -> {}", inputs.size(), output.getFileName());
    try {
      runProducing(commands.concatenate(listFile, output), output);
    } finally {
      deleteQuietly(listFile);
    }
    return output;
  }

  @Override
  public Path thumbnail(Path input, Path output) {
    LOGGER.info("Generating thumbnail for {}", input.getFileName());
    runProducing(commands.thumbnail(input, output), output);
    return output;
  }

  @Override
  public Path compress(Path input, Path output) {
    LOGGER.info("Compressing {} to {}p", input.getFileName(), properties.compressHeight());
    runProducing(commands.compress(input, output), output);
    return output;
  }

  @Override
  public Optional<Double> probeDuration(Path input) {
    try {
      List<String> lines = run(commands.probeDuration(input));
      for (String line : lines) {
        try {
          double duration = Double.parseDouble(line.trim());
          if (Double.isFinite(duration) && duration > 0) {
            return Optional.of(duration);
          }
        } catch (NumberFormatException e) {
          LOGGER.debug("Ignoring ffprobe line: {}", line);
        }
      }
      LOGGER.warn("ffprobe reported no duration for {}", input.getFileName());
    } catch (TranscodeException e) {
      LOGGER.warn("ffprobe failed for {}: {}", input.getFileName(), e.getMessage());
    }
    return Optional.empty();
  }

  /** Run a command that must leave a non-empty file at {@code output}. */
  private void runProducing(List<String> command, Path output) {
    try {
      run(command);
      if (!Files.isRegularFile(output) || Files.size(output) == 0) {
        throw new TranscodeException("ffmpeg produced no output at " + output);
      }
    } catch (IOException e) {
      deleteQuietly(output);
      throw new TranscodeException("Failed to inspect ffmpeg output " + output, e);
    } catch (TranscodeException e) {
      deleteQuietly(output);
      throw e;
    }
  }

  /**
   * Run a process to completion.
   *
   * @return the merged stdout/stderr lines
   */
  private List<String> run(List<String> command) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new TranscodeException("Failed to start " + command.get(0), e);
    }

    OutputCollector collector = new OutputCollector(process);
    Thread reader = new Thread(collector, "ffmpeg-output");
    reader.setDaemon(true);
    reader.start();

    try {
      boolean finished = process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new TranscodeException(
            String.format(
                "%s timed out after %ds", command.get(0), properties.processTimeoutSeconds()));
      }
      reader.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new TranscodeException(command.get(0) + " interrupted", e);
    }

    List<String> lines = collector.lines();
    if (process.exitValue() != 0) {
      throw new TranscodeException(
          String.format(
              "%s exited with code %d: %s",
              command.get(0), process.exitValue(), tail(lines)));
    }
    return lines;
  }

  private static String tail(List<String> lines) {
    int from = Math.max(0, lines.size() - OUTPUT_TAIL_LINES);
    return String.join("\n", lines.subList(from, lines.size()));
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", file, e.getMessage());
    }
  }

  /** Drains process output so ffmpeg never blocks on a full pipe. */
  private static final class OutputCollector implements Runnable {
    private final Process process;
    private final List<String> lines = new ArrayList<>();

    private OutputCollector(Process process) {
      this.process = process;
    }

    @Override
    public void run() {
      try (BufferedReader reader =
          new BufferedReader(
              new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          synchronized (lines) {
            lines.add(line);
          }
        }
      } catch (IOException e) {
        LOGGER.debug("Process output closed: {}", e.getMessage());
      }
    }

    private List<String> lines() {
      synchronized (lines) {
        return new ArrayList<>(lines);
      }
    }
  }
}
