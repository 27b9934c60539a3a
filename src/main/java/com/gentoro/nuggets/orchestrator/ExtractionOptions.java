package com.gentoro.nuggets.orchestrator;

import com.gentoro.nuggets.boundary.BoundaryMatchOptions;
import com.gentoro.nuggets.exception.ConfigException;
import com.gentoro.nuggets.model.NuggetType;
import com.gentoro.nuggets.text.ContentTruncator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Settings of one extraction call.
 *
 * @param types nugget types to request; empty means all
 * @param maxAttempts hard cap on provider calls, across fallbacks
 * @param persona substituted for {@code {{ persona }}} in the caller's prompt
 * @param sourceLabel substituted for {@code {{ source }}} in the caller's prompt
 */
public record ExtractionOptions(
    double temperature,
    Set<NuggetType> types,
    BoundaryMatchOptions boundary,
    int maxAttempts,
    long baseDelayMillis,
    long rateLimitBaseDelayMillis,
    double jitterRatio,
    int maxContentLength,
    boolean useCache,
    String persona,
    String sourceLabel) {

  public ExtractionOptions {
    types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(types);
    Objects.requireNonNull(boundary, "boundary");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    if (rateLimitBaseDelayMillis <= baseDelayMillis) {
      throw new IllegalArgumentException(
          "rateLimitBaseDelayMillis (%d) must exceed baseDelayMillis (%d)"
              .formatted(rateLimitBaseDelayMillis, baseDelayMillis));
    }
    if (maxContentLength < 1) {
      throw new IllegalArgumentException("maxContentLength must be positive: " + maxContentLength);
    }
    persona = Objects.requireNonNullElse(persona, "");
    sourceLabel = Objects.requireNonNullElse(sourceLabel, "text");
  }

  public static ExtractionOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads the {@code extraction.*} keys; missing keys keep their defaults. */
  public static ExtractionOptions fromConfiguration(Configuration cfg) {
    Builder b = builder();
    b.temperature(cfg.getDouble("extraction.temperature", b.temperature));
    b.maxAttempts(cfg.getInt("extraction.retry.max-attempts", b.maxAttempts));
    b.baseDelayMillis(cfg.getLong("extraction.retry.base-delay-ms", b.baseDelayMillis));
    b.rateLimitBaseDelayMillis(
        cfg.getLong("extraction.retry.rate-limit-base-delay-ms", b.rateLimitBaseDelayMillis));
    b.jitterRatio(cfg.getDouble("extraction.retry.jitter-ratio", b.jitterRatio));
    b.maxContentLength(cfg.getInt("extraction.max-content-length", b.maxContentLength));
    b.useCache(cfg.getBoolean("cache.enabled", b.useCache));
    b.persona(cfg.getString("extraction.persona", b.persona));
    b.sourceLabel(cfg.getString("extraction.source-label", b.sourceLabel));

    BoundaryMatchOptions d = BoundaryMatchOptions.defaults();
    b.boundary(
        new BoundaryMatchOptions(
            cfg.getDouble("extraction.boundary.tolerance", d.tolerance()),
            cfg.getInt("extraction.boundary.max-start-words", d.maxStartWords()),
            cfg.getInt("extraction.boundary.max-end-words", d.maxEndWords()),
            cfg.getDouble(
                "extraction.boundary.min-confidence-threshold", d.minConfidenceThreshold())));

    List<String> typeNames = cfg.getList(String.class, "extraction.types", List.of());
    b.types(parseTypes(typeNames));
    return b.build();
  }

  /** Parses type labels (synonyms accepted); an unknown label is a configuration error. */
  public static Set<NuggetType> parseTypes(List<String> names) {
    Set<NuggetType> out = EnumSet.noneOf(NuggetType.class);
    for (String name : names) {
      if (name == null || name.isBlank()) continue;
      out.add(
          NuggetType.fromWire(name)
              .orElseThrow(() -> new ConfigException("Unknown nugget type: " + name)));
    }
    return out;
  }

  public ExtractionOptions withTypes(Set<NuggetType> newTypes) {
    return toBuilder().types(newTypes).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .temperature(temperature)
        .types(types)
        .boundary(boundary)
        .maxAttempts(maxAttempts)
        .baseDelayMillis(baseDelayMillis)
        .rateLimitBaseDelayMillis(rateLimitBaseDelayMillis)
        .jitterRatio(jitterRatio)
        .maxContentLength(maxContentLength)
        .useCache(useCache)
        .persona(persona)
        .sourceLabel(sourceLabel);
  }

  public static final class Builder {
    private double temperature = 0.7;
    private Set<NuggetType> types = Set.of();
    private BoundaryMatchOptions boundary = BoundaryMatchOptions.defaults();
    private int maxAttempts = 3;
    private long baseDelayMillis = 1000L;
    private long rateLimitBaseDelayMillis = 2000L;
    private double jitterRatio = 0.1;
    private int maxContentLength = ContentTruncator.DEFAULT_MAX_LENGTH;
    private boolean useCache = true;
    private String persona = "curious generalist";
    private String sourceLabel = "text";

    private Builder() {}

    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder types(Set<NuggetType> types) {
      this.types = types;
      return this;
    }

    public Builder boundary(BoundaryMatchOptions boundary) {
      this.boundary = boundary;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder baseDelayMillis(long baseDelayMillis) {
      this.baseDelayMillis = baseDelayMillis;
      return this;
    }

    public Builder rateLimitBaseDelayMillis(long rateLimitBaseDelayMillis) {
      this.rateLimitBaseDelayMillis = rateLimitBaseDelayMillis;
      return this;
    }

    public Builder jitterRatio(double jitterRatio) {
      this.jitterRatio = jitterRatio;
      return this;
    }

    public Builder maxContentLength(int maxContentLength) {
      this.maxContentLength = maxContentLength;
      return this;
    }

    public Builder useCache(boolean useCache) {
      this.useCache = useCache;
      return this;
    }

    public Builder persona(String persona) {
      this.persona = persona;
      return this;
    }

    public Builder sourceLabel(String sourceLabel) {
      this.sourceLabel = sourceLabel;
      return this;
    }

    public ExtractionOptions build() {
      return new ExtractionOptions(
          temperature,
          types,
          boundary,
          maxAttempts,
          baseDelayMillis,
          rateLimitBaseDelayMillis,
          jitterRatio,
          maxContentLength,
          useCache,
          persona,
          sourceLabel);
    }
  }
}
