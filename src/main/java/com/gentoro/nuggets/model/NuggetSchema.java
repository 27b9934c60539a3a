package com.gentoro.nuggets.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.nuggets.utility.JacksonUtility;
import java.util.Collection;
import java.util.EnumSet;

/** JSON schema of the provider response payload. */
public final class NuggetSchema {
  public static final String ROOT_FIELD = "golden_nuggets";

  private NuggetSchema() {}

  /** Schema whose {@code type} enum is restricted to {@code types}; empty means all types. */
  public static ObjectNode forTypes(Collection<NuggetType> types) {
    EnumSet<NuggetType> selected =
        types == null || types.isEmpty() ? EnumSet.allOf(NuggetType.class) : EnumSet.copyOf(types);

    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    root.put("type", "object");

    ObjectNode item = root.objectNode();
    item.put("type", "object");
    ObjectNode props = item.putObject("properties");

    ObjectNode type = props.putObject("type");
    type.put("type", "string");
    ArrayNode values = type.putArray("enum");
    selected.forEach(t -> values.add(t.wireName()));

    props
        .putObject("fullContent")
        .put("type", "string")
        .put("description", "The passage copied verbatim from the content");

    props.putObject("confidence").put("type", "number").put("minimum", 0).put("maximum", 1);
    item.putArray("required").add("type").add("fullContent").add("confidence");

    ObjectNode nuggets = root.putObject("properties").putObject(ROOT_FIELD);
    nuggets.put("type", "array");
    nuggets.set("items", item);
    root.putArray("required").add(ROOT_FIELD);
    return root;
  }
}
