package com.gentoro.nuggets.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.nuggets.exception.ExceptionUtil;
import com.gentoro.nuggets.exception.PromptException;
import com.gentoro.nuggets.model.NuggetSchema;
import com.gentoro.nuggets.model.NuggetType;
import com.gentoro.nuggets.utility.JacksonUtility;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pebble-based extraction prompt loaded from a YAML resource with a {@code system} and a {@code
 * user} section. Templates are compiled once; rendering is thread-safe.
 */
public final class ExtractionPrompt {
  public static final String DEFAULT_RESOURCE = "prompts/extraction.yaml";

  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  // Caller prompts are free text, not templates; only these two placeholders are substituted.
  private static final Pattern PERSONA = Pattern.compile("\\{\\{\\s*persona\\s*}}");
  private static final Pattern SOURCE = Pattern.compile("\\{\\{\\s*source\\s*}}");

  private static volatile ExtractionPrompt defaultPrompt;

  private final String id;
  private final PebbleTemplate system;
  private final PebbleTemplate user;

  /** Rendered system instruction and user message. */
  public record Rendered(String system, String user) {}

  ExtractionPrompt(String id, String systemTemplate, String userTemplate) {
    this.id = Objects.requireNonNull(id, "id");
    this.system = ENGINE.getLiteralTemplate(systemTemplate);
    this.user = ENGINE.getLiteralTemplate(userTemplate);
  }

  public static ExtractionPrompt defaultPrompt() {
    ExtractionPrompt p = defaultPrompt;
    if (p == null) {
      synchronized (ExtractionPrompt.class) {
        p = defaultPrompt;
        if (p == null) {
          p = load(DEFAULT_RESOURCE);
          defaultPrompt = p;
        }
      }
    }
    return p;
  }

  /** Loads a prompt YAML resource from the classpath. */
  public static ExtractionPrompt load(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream is = loader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new PromptException("Prompt resource not found: " + resource);
      }
      JsonNode root =
          JacksonUtility.getYamlMapper()
              .readTree(new String(is.readAllBytes(), StandardCharsets.UTF_8));
      JsonNode sections = root == null ? null : root.get("sections");
      if (sections == null || !sections.isArray()) {
        throw new PromptException("Prompt YAML must contain a 'sections' array: " + resource);
      }
      Map<String, String> byId = new HashMap<>();
      for (JsonNode n : sections) {
        String sectionId = n.path("id").asText("");
        String content = n.path("content").asText("");
        if (sectionId.isBlank() || content.isBlank()) {
          throw new PromptException("Prompt section without id or content in: " + resource);
        }
        byId.put(sectionId, content);
      }
      if (!byId.containsKey("system") || !byId.containsKey("user")) {
        throw new PromptException(
            "Prompt must define 'system' and 'user' sections: " + resource);
      }
      return new ExtractionPrompt(resource, byId.get("system"), byId.get("user"));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + resource, ex));
    }
  }

  public String id() {
    return id;
  }

  /**
   * Replaces {@code {{ persona }}} and {@code {{ source }}} placeholders in a caller-supplied
   * prompt. Everything else, including other brace sequences, is left as written.
   */
  public static String applyPlaceholders(String prompt, String persona, String sourceLabel) {
    if (prompt == null || !prompt.contains("{{")) {
      return prompt;
    }
    String out =
        PERSONA
            .matcher(prompt)
            .replaceAll(Matcher.quoteReplacement(Objects.requireNonNullElse(persona, "")));
    return SOURCE
        .matcher(out)
        .replaceAll(Matcher.quoteReplacement(Objects.requireNonNullElse(sourceLabel, "")));
  }

  public Rendered render(String instructions, Collection<NuggetType> types, String content) {
    EnumSet<NuggetType> selected =
        types == null || types.isEmpty() ? EnumSet.allOf(NuggetType.class) : EnumSet.copyOf(types);
    List<String> typeNames = selected.stream().map(NuggetType::wireName).toList();

    Map<String, Object> vars = new HashMap<>();
    vars.put("instructions", Objects.requireNonNullElse(instructions, "").trim());
    vars.put("types", typeNames);
    vars.put("schema", JacksonUtility.toJson(NuggetSchema.forTypes(selected)));
    vars.put("content", Objects.requireNonNullElse(content, ""));
    try {
      return new Rendered(evaluate(system, vars).trim(), evaluate(user, vars));
    } catch (RuntimeException e) {
      throw new PromptException("Failed to render prompt " + id, e);
    }
  }

  private static String evaluate(PebbleTemplate template, Map<String, Object> vars) {
    try {
      Writer writer = new StringWriter();
      template.evaluate(writer, vars);
      return writer.toString();
    } catch (java.io.IOException e) {
      throw new PromptException("Failed to evaluate template", e);
    }
  }
}
