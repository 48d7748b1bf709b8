package com.scholary.montage.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.montage.clip.ClipScores;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads generateContent responses.
 *
 * <p>The model's answer is a JSON document carried as text inside the response envelope. Missing
 * optional fields get defaults; a missing envelope, unparseable text or absent required fields
 * raise {@link MalformedScorerResponseException}.
 */
class ScorerResponseParser {

  static final String DEFAULT_DESCRIPTION = "No description";
  static final double MIN_SEGMENT_SEC = 0.5;

  private final ObjectMapper objectMapper;

  ScorerResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Extract the model's answer from the response envelope and parse it. */
  JsonNode modelAnswer(String responseBody) {
    JsonNode envelope = readTree(responseBody, "response envelope");
    JsonNode text = envelope.path("candidates").path(0).path("content").path("parts").path(0).path("text");
    if (!text.isTextual()) {
      throw new MalformedScorerResponseException("Response carries no candidate text");
    }
    return readTree(text.asText(), "model answer");
  }

  SegmentAnalysis parseSegment(JsonNode answer) {
    JsonNode segments = answer.path("segments");
    if (!segments.isArray() || segments.isEmpty()) {
      throw new MalformedScorerResponseException("No segments in answer: " + answer);
    }
    JsonNode segment = segments.get(0);
    JsonNode start = segment.path("start_sec");
    JsonNode end = segment.path("end_sec");
    if (!start.isNumber() || !end.isNumber()) {
      throw new MalformedScorerResponseException("Segment bounds missing: " + segment);
    }

    double startSec = Math.max(0.0, start.asDouble());
    double endSec = Math.max(end.asDouble(), startSec + MIN_SEGMENT_SEC);

    JsonNode description = segment.path("description");
    String text =
        description.isTextual() && !description.asText().isBlank()
            ? description.asText()
            : DEFAULT_DESCRIPTION;

    JsonNode scores = segment.path("scores");
    ClipScores clipScores =
        ClipScores.clamped(
            numberOr(scores.path("relevance"), 0.0),
            numberOr(scores.path("quality"), 0.5),
            numberOr(scores.path("confidence"), 0.5));

    return new SegmentAnalysis(startSec, endSec, text, clipScores, false);
  }

  List<Integer> parseRemoveIndices(JsonNode answer) {
    JsonNode indices = answer.path("remove_indices");
    if (!indices.isArray()) {
      throw new MalformedScorerResponseException("No remove_indices array in answer: " + answer);
    }
    List<Integer> result = new ArrayList<>();
    for (JsonNode index : indices) {
      if (index.isIntegralNumber() && index.canConvertToInt()) {
        result.add(index.asInt());
      }
    }
    return result;
  }

  private JsonNode readTree(String json, String what) {
    if (json == null || json.isBlank()) {
      throw new MalformedScorerResponseException("Empty " + what);
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new MalformedScorerResponseException("Unparseable " + what, e);
    }
  }

  private static double numberOr(JsonNode node, double defaultValue) {
    return node.isNumber() ? node.asDouble() : defaultValue;
  }
}
