package com.gentoro.nuggets.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.nuggets.exception.ProviderException;
import com.gentoro.nuggets.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and validates the {@code {"golden_nuggets": [...]}} payload returned by a provider.
 *
 * <p>Shape violations are {@code STRUCTURAL} provider errors. Items with a type outside {@link
 * NuggetType} or with blank content are dropped with a warning; confidence is clamped to {@code
 * [0, 1]} and defaults to {@value #DEFAULT_CONFIDENCE} when absent.
 */
public final class NuggetResponseParser {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(NuggetResponseParser.class);

  public static final double DEFAULT_CONFIDENCE = 0.5;

  private static final Pattern FENCE =
      Pattern.compile("^```[a-zA-Z]*\\s*\\n?(.*?)\\n?```$", Pattern.DOTALL);

  private NuggetResponseParser() {}

  public static List<RawCandidate> parse(String payload, String providerId) {
    if (payload == null || payload.isBlank()) {
      throw ProviderException.structural(providerId, "Provider returned an empty response");
    }
    String body = stripFences(payload.trim());

    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(body);
    } catch (JsonProcessingException e) {
      throw ProviderException.structural(providerId, "Provider response is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw ProviderException.structural(providerId, "Provider response is not a JSON object");
    }

    JsonNode nuggets = root.get(NuggetSchema.ROOT_FIELD);
    if (nuggets == null || nuggets.isNull()) {
      throw ProviderException.structural(
          providerId, "Provider response is missing '%s'".formatted(NuggetSchema.ROOT_FIELD));
    }
    if (!nuggets.isArray()) {
      throw ProviderException.structural(
          providerId, "'%s' must be an array".formatted(NuggetSchema.ROOT_FIELD));
    }

    List<RawCandidate> out = new ArrayList<>(nuggets.size());
    for (int i = 0; i < nuggets.size(); i++) {
      JsonNode item = nuggets.get(i);
      if (!item.isObject()) {
        throw ProviderException.structural(providerId, "Nugget %d is not an object".formatted(i));
      }
      String typeLabel = requireText(item, "type", i, providerId);
      String content = requireText(item, "fullContent", i, providerId);
      double confidence = confidence(item.get("confidence"), i, providerId);

      NuggetType type = NuggetType.fromWire(typeLabel).orElse(null);
      if (type == null) {
        log.warn("Dropping nugget {} from {}: unknown type '{}'", i, providerId, typeLabel);
        continue;
      }
      if (content.isBlank()) {
        log.warn("Dropping nugget {} from {}: blank fullContent", i, providerId);
        continue;
      }
      out.add(new RawCandidate(type, content, confidence));
    }
    log.debug("Parsed {} of {} nugget(s) from {}", out.size(), nuggets.size(), providerId);
    return out;
  }

  static String stripFences(String text) {
    Matcher m = FENCE.matcher(text);
    return m.matches() ? m.group(1).trim() : text;
  }

  private static String requireText(JsonNode item, String field, int index, String providerId) {
    JsonNode node = item.get(field);
    if (node == null || !node.isTextual()) {
      throw ProviderException.structural(
          providerId, "Nugget %d is missing text field '%s'".formatted(index, field));
    }
    return node.asText();
  }

  private static double confidence(JsonNode node, int index, String providerId) {
    if (node == null || node.isNull()) {
      return DEFAULT_CONFIDENCE;
    }
    if (!node.isNumber()) {
      throw ProviderException.structural(
          providerId, "Nugget %d has a non-numeric confidence".formatted(index));
    }
    double value = node.asDouble();
    if (Double.isNaN(value)) return DEFAULT_CONFIDENCE;
    return Math.max(0.0, Math.min(1.0, value));
  }
}
