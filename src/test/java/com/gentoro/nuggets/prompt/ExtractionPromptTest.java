package com.gentoro.nuggets.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nuggets.exception.PromptException;
import com.gentoro.nuggets.model.NuggetType;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExtractionPromptTest {

  @Test
  void rendersInstructionsTypesSchemaAndContent() {
    ExtractionPrompt.Rendered rendered =
        ExtractionPrompt.defaultPrompt()
            .render(
                "  Find useful tools.  ",
                Set.of(NuggetType.MEDIA, NuggetType.TOOL),
                "Some page content.");

    assertTrue(rendered.system().startsWith("Find useful tools."));
    assertTrue(rendered.system().contains("tool, media"));
    assertTrue(rendered.system().contains("\"golden_nuggets\""));
    assertFalse(rendered.system().contains("\"analogy\""));
    assertEquals("Some page content.", rendered.user().trim());
  }

  @Test
  void allTypesWhenNoneSelected() {
    ExtractionPrompt.Rendered rendered = ExtractionPrompt.defaultPrompt().render("x", null, "y");
    assertTrue(rendered.system().contains("tool, media, explanation, analogy, model"));
  }

  @Test
  void contentIsNotInterpretedAsTemplate() {
    ExtractionPrompt.Rendered rendered =
        ExtractionPrompt.defaultPrompt().render("x", null, "literal {{ persona }} text");
    assertTrue(rendered.user().contains("{{ persona }}"));
  }

  @Test
  void placeholdersAreReplaced() {
    assertEquals(
        "You are a chef reading a website.",
        ExtractionPrompt.applyPlaceholders(
            "You are a {{ persona }} reading a {{source}}.", "chef", "website"));
  }

  @Test
  void unknownPlaceholdersAreKept() {
    assertEquals(
        "Hello {{ other }}!", ExtractionPrompt.applyPlaceholders("Hello {{ other }}!", "p", "s"));
    assertEquals("plain", ExtractionPrompt.applyPlaceholders("plain", "p", "s"));
  }

  @Test
  @DisplayName("literal braces and template markers in a caller prompt are left untouched")
  void literalBracesInCallerPrompt() {
    String prompt =
        "Persona: {{ persona }}. Return JSON such as {{\"golden_nuggets\": []}} and skip"
            + " {#hashtags and {% blocks.";

    assertEquals(
        "Persona: dev. Return JSON such as {{\"golden_nuggets\": []}} and skip"
            + " {#hashtags and {% blocks.",
        ExtractionPrompt.applyPlaceholders(prompt, "dev", "text"));
  }

  @Test
  void replacementValuesAreLiteral() {
    assertEquals(
        "Costs $1 \\ more",
        ExtractionPrompt.applyPlaceholders("Costs {{persona}} more", "$1 \\", "s"));
  }

  @Test
  void missingResourceFails() {
    assertThrows(PromptException.class, () -> ExtractionPrompt.load("prompts/none.yaml"));
  }

  @Test
  void loadsCustomPromptResource() {
    ExtractionPrompt prompt = ExtractionPrompt.load("prompts/test-extraction.yaml");
    ExtractionPrompt.Rendered rendered = prompt.render("Be brief.", Set.of(NuggetType.MODEL), "c");
    assertEquals("Be brief. [model]", rendered.system());
    assertEquals("c", rendered.user());
  }
}
