package com.scholary.montage.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gemini generateContent API.
 *
 * <p>Each call is retried only when the service answers 503 (overloaded), with exponential backoff
 * and jitter between attempts. Every other failure, including a reply that does not have the
 * expected shape, ends the call at once and the operation falls back to its safe default.
 *
 * <p>A semaphore caps the number of requests in flight across all callers.
 */
@Component
public class GeminiScorerClient implements ScorerService {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiScorerClient.class);

  /** Files smaller than this cannot hold a playable video. */
  static final long MIN_VIDEO_BYTES = 1024;

  private static final String ANALYZE_INSTRUCTIONS =
      "You are assisting a video editor. Watch the attached video and answer with JSON only.\n"
          + "Find the one segment, 2 to 8 seconds long, that best matches this intent: \"%s\".\n"
          + "If someone speaks to the camera, the segment may cover their whole statement.\n"
          + "Give start_sec, end_sec, a one or two sentence description with concrete details, and\n"
          + "scores between 0 and 1 for relevance (match with the intent), quality (visual quality)\n"
          + "and confidence (certainty of your analysis).\n"
          + "Answer shape: {\"segments\": [{\"start_sec\": 1.5, \"end_sec\": 5.2, \"description\": \"...\",\n"
          + "\"scores\": {\"relevance\": 0.9, \"quality\": 0.8, \"confidence\": 0.7}}]}\n";

  private static final String REDUNDANCY_INSTRUCTIONS =
      "You are editing a highlight montage. Each clip below has an index and a description.\n"
          + "Identify clips that repeat what other clips already show, visually or thematically.\n"
          + "Leave unique clips alone.\n"
          + "Clips: %s\n"
          + "Answer with JSON only, shaped {\"remove_indices\": [12, 5, 2]}, most redundant first.\n"
          + "Answer {\"remove_indices\": []} when nothing is redundant.\n";

  private final HttpClient httpClient;
  private final ScorerProperties properties;
  private final ObjectMapper objectMapper;
  private final ScorerResponseParser parser;
  private final Semaphore permits;

  public GeminiScorerClient(ScorerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.parser = new ScorerResponseParser(objectMapper);
    this.permits = new Semaphore(properties.maxConcurrentCalls(), true);

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized scorer client: baseUrl={}, model={}, maxConcurrentCalls={}",
        properties.baseUrl(),
        properties.model(),
        properties.maxConcurrentCalls());
  }

  @Override
  public List<Integer> suggestRedundant(List<RedundancyCandidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }
    try {
      String clips = objectMapper.writeValueAsString(candidates);
      ObjectNode request = request(0.2, textPart(String.format(REDUNDANCY_INSTRUCTIONS, clips)));
      List<Integer> indices = callWithRetry("redundancy", request, parser::parseRemoveIndices);
      LOGGER.info("Scorer suggested removing {} of {} clips: {}", indices.size(), candidates.size(), indices);
      return indices;
    } catch (JsonProcessingException | ScorerException e) {
      LOGGER.warn("Redundancy ranking failed, continuing without hints: {}", e.getMessage());
      return List.of();
    }
  }

  @Override
  public SegmentAnalysis analyzeSingleClip(Path media, String intent, Double durationSec) {
    LOGGER.info("Analyzing clip: file={}, duration={}s", media.getFileName(), durationSec);
    try {
      byte[] video = readVideo(media);
      String prompt =
          String.format(ANALYZE_INSTRUCTIONS, intent == null ? properties.defaultIntent() : intent);
      ObjectNode request = request(0.1, textPart(prompt), videoPart(video));
      SegmentAnalysis analysis = callWithRetry("analysis", request, parser::parseSegment);
      LOGGER.info(
          "Clip analyzed: [{}, {}]s relevance={}",
          analysis.startSec(),
          analysis.endSec(),
          analysis.scores().relevance());
      return analysis;
    } catch (ScorerException e) {
      LOGGER.warn(
          "Analysis of {} failed, using fallback segment: {}", media.getFileName(), e.getMessage());
      return SegmentAnalysis.fallback(durationSec, properties.fallbackMaxSeconds());
    }
  }

  /**
   * Send a request, retrying while the service reports it is overloaded.
   *
   * @throws ScorerException when the call fails for good
   */
  private <T> T callWithRetry(String operation, ObjectNode request, Function<JsonNode, T> reader) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        LOGGER.debug("Scorer {} attempt {}/{}", operation, attempt, properties.maxAttempts());
        return reader.apply(parser.modelAnswer(send(request)));
      } catch (ScorerOverloadedException e) {
        if (attempt >= properties.maxAttempts()) {
          throw new ScorerException(
              String.format("Scorer still overloaded after %d attempts", attempt), e);
        }
        long backoffMs = backoffMillis(attempt);
        LOGGER.warn(
            "Scorer {} attempt {} overloaded, retrying in {}ms", operation, attempt, backoffMs);
        sleep(backoffMs);
      }
    }
  }

  long backoffMillis(int attempt) {
    return (long)
        (Math.pow(2, attempt) * properties.backoffBaseMillis()
            + Math.random() * properties.backoffJitterMillis());
  }

  private String send(ObjectNode body) {
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(
                  URI.create(
                      properties.baseUrl()
                          + "/v1beta/models/"
                          + properties.model()
                          + ":generateContent"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .header("x-goog-api-key", properties.apiKey() == null ? "" : properties.apiKey())
              .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
              .build();
    } catch (JsonProcessingException e) {
      throw new ScorerException("Failed to encode scorer request", e);
    }

    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ScorerException("Interrupted waiting for a scorer slot", e);
    }
    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() == 503) {
        throw new ScorerOverloadedException("Scorer returned 503: " + response.body());
      }
      if (response.statusCode() != 200) {
        throw new ScorerException(
            String.format(
                "Scorer returned status %d: %s", response.statusCode(), response.body()));
      }
      return response.body();
    } catch (IOException e) {
      throw new ScorerException("Scorer request failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ScorerException("Scorer request interrupted", e);
    } finally {
      permits.release();
    }
  }

  private static byte[] readVideo(Path media) {
    try {
      if (!Files.isRegularFile(media) || Files.size(media) < MIN_VIDEO_BYTES) {
        throw new ScorerException("File is missing, empty or too small to be a video: " + media);
      }
      return Files.readAllBytes(media);
    } catch (IOException e) {
      throw new ScorerException("Failed to read video " + media, e);
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ScorerException("Scorer retry interrupted", e);
    }
  }

  private ObjectNode request(double temperature, ObjectNode... parts) {
    ObjectNode body = objectMapper.createObjectNode();
    ObjectNode content = body.putArray("contents").addObject();
    content.put("role", "user");
    ArrayNode partArray = content.putArray("parts");
    for (ObjectNode part : parts) {
      partArray.add(part);
    }
    ObjectNode generationConfig = body.putObject("generationConfig");
    generationConfig.put("temperature", temperature);
    generationConfig.put("responseMimeType", "application/json");
    return body;
  }

  private ObjectNode textPart(String text) {
    ObjectNode part = objectMapper.createObjectNode();
    part.put("text", text);
    return part;
  }

  private ObjectNode videoPart(byte[] video) {
    ObjectNode part = objectMapper.createObjectNode();
    ObjectNode inlineData = part.putObject("inline_data");
    inlineData.put("mime_type", "video/mp4");
    inlineData.put("data", Base64.getEncoder().encodeToString(video));
    return part;
  }
}
