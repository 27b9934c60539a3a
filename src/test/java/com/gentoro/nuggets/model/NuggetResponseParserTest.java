package com.gentoro.nuggets.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nuggets.exception.ErrorCategory;
import com.gentoro.nuggets.exception.ProviderException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NuggetResponseParserTest {

  @Test
  void parsesWellFormedPayload() {
    String payload =
        """
        {"golden_nuggets": [
          {"type": "tool", "fullContent": "Use Anki for flashcards", "confidence": 0.9},
          {"type": "analogy", "fullContent": "Memory is a muscle", "confidence": 0.4}
        ]}
        """;
    List<RawCandidate> out = NuggetResponseParser.parse(payload, "gemini");
    assertEquals(2, out.size());
    assertEquals(new RawCandidate(NuggetType.TOOL, "Use Anki for flashcards", 0.9), out.get(0));
    assertEquals(NuggetType.ANALOGY, out.get(1).type());
  }

  @Test
  void stripsMarkdownFences() {
    String payload =
        "```json\n{\"golden_nuggets\": [{\"type\": \"media\", \"fullContent\": \"x y\"}]}\n```";
    List<RawCandidate> out = NuggetResponseParser.parse(payload, "openai");
    assertEquals(1, out.size());
    assertEquals(NuggetResponseParser.DEFAULT_CONFIDENCE, out.get(0).confidence());
  }

  @Test
  @DisplayName("unknown types and blank content are dropped, synonyms are mapped")
  void dropsUnusableItems() {
    String payload =
        """
        {"golden_nuggets": [
          {"type": "recipe", "fullContent": "Bake for 20 minutes", "confidence": 0.9},
          {"type": "tool", "fullContent": "   ", "confidence": 0.9},
          {"type": "technique", "fullContent": "Interleave topics", "confidence": 0.8}
        ]}
        """;
    List<RawCandidate> out = NuggetResponseParser.parse(payload, "anthropic");
    assertEquals(List.of(new RawCandidate(NuggetType.TOOL, "Interleave topics", 0.8)), out);
  }

  @Test
  void clampsConfidence() {
    String payload =
        """
        {"golden_nuggets": [
          {"type": "model", "fullContent": "a", "confidence": 1.7},
          {"type": "model", "fullContent": "b", "confidence": -3}
        ]}
        """;
    List<RawCandidate> out = NuggetResponseParser.parse(payload, "gemini");
    assertEquals(1.0, out.get(0).confidence());
    assertEquals(0.0, out.get(1).confidence());
  }

  @Test
  void emptyArrayIsValid() {
    assertTrue(NuggetResponseParser.parse("{\"golden_nuggets\": []}", "gemini").isEmpty());
  }

  @Test
  @DisplayName("shape violations are structural errors")
  void structuralErrors() {
    List<String> bad =
        List.of(
            "",
            "not json at all",
            "[1, 2, 3]",
            "{\"nuggets\": []}",
            "{\"golden_nuggets\": {}}",
            "{\"golden_nuggets\": [\"text\"]}",
            "{\"golden_nuggets\": [{\"type\": \"tool\"}]}",
            "{\"golden_nuggets\": [{\"fullContent\": \"x\"}]}",
            "{\"golden_nuggets\": [{\"type\": \"tool\", \"fullContent\": \"x\","
                + " \"confidence\": \"high\"}]}");
    for (String payload : bad) {
      ProviderException e =
          assertThrows(
              ProviderException.class,
              () -> NuggetResponseParser.parse(payload, "gemini"),
              () -> "expected structural error for: " + payload);
      assertEquals(ErrorCategory.STRUCTURAL, e.getCategory());
      assertEquals("gemini", e.getProviderId());
    }
  }

  @Test
  void stripFencesLeavesPlainTextAlone() {
    assertEquals("{}", NuggetResponseParser.stripFences("```\n{}\n```"));
    assertEquals("{\"a\":1}", NuggetResponseParser.stripFences("{\"a\":1}"));
  }
}
