package com.gentoro.nuggets.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Closed set of nugget categories a provider may return. */
public enum NuggetType {
  TOOL("tool"),
  MEDIA("media"),
  EXPLANATION("explanation"),
  ANALOGY("analogy"),
  MODEL("model");

  private static final Map<String, NuggetType> SYNONYMS =
      Map.ofEntries(
          Map.entry("technique", TOOL),
          Map.entry("method", TOOL),
          Map.entry("book", MEDIA),
          Map.entry("article", MEDIA),
          Map.entry("resource", MEDIA),
          Map.entry("concept", EXPLANATION),
          Map.entry("aha! moments", EXPLANATION),
          Map.entry("aha moment", EXPLANATION),
          Map.entry("metaphor", ANALOGY),
          Map.entry("comparison", ANALOGY),
          Map.entry("framework", MODEL),
          Map.entry("mental model", MODEL));

  private final String wireName;

  NuggetType(String wireName) {
    this.wireName = wireName;
  }

  /** Lower-case name used in prompts, schemas and JSON output. */
  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Maps a provider-supplied type label, including common synonyms, to a type. */
  public static Optional<NuggetType> fromWire(String value) {
    if (value == null) return Optional.empty();
    String key = value.trim().toLowerCase(Locale.ROOT);
    for (NuggetType t : values()) {
      if (t.wireName.equals(key)) return Optional.of(t);
    }
    return Optional.ofNullable(SYNONYMS.get(key));
  }
}
