/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;

/**
 * Flattens an image summary record into dataset attributes.
 */
public final class MetadataNormalizer {

  /** Summary fields that are represented by coordinates or dimensions. */
  public static final Set<String> OMITTED_FIELDS = ImmutableSet.of(
    "axisnames", "incr", "hasmask", "masks", "defaultmask", "ndim",
    "refpix", "refval", "shape", "tileshape", "messages");

  /** Message labels that duplicate other attributes. */
  public static final Set<String> OMITTED_LABELS = ImmutableSet.of(
    "image_name", "image_type", "image_quantity", "pixel_mask(s)",
    "region(s)", "image_units");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private MetadataNormalizer() {
  }

  /**
   * Scalars and lists are kept under their lower-cased key.  Nested
   * records become a list of <code>[dotted.key, value]</code> pairs.
   * "label : value" lines found in <code>messages</code> are added
   * last, later lines replacing earlier ones.
   *
   * @param summary raw summary record
   * @return new attribute record
   */
  public static ObjectNode normalize(ObjectNode summary) {
    ObjectNode attrs = MAPPER.createObjectNode();
    Iterator<Map.Entry<String, JsonNode>> fields = summary.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String key = field.getKey();
      JsonNode value = field.getValue();
      if (OMITTED_FIELDS.contains(key)) {
        continue;
      }
      if (value.isObject()) {
        ArrayNode pairs = attrs.putArray(key);
        flatten("", value, pairs);
      }
      else {
        attrs.set(key.toLowerCase(), value.deepCopy());
      }
    }

    JsonNode messages = summary.path("messages");
    if (messages.isTextual()) {
      parseMessage(messages.asText(), attrs);
    }
    else {
      for (JsonNode message : messages) {
        parseMessage(message.asText(), attrs);
      }
    }
    return attrs;
  }

  /**
   * Add the "label : value" pairs of one message.  Only lines
   * containing ": " are considered.
   *
   * @param message free-text message, possibly several lines
   * @param attrs attribute record to update
   */
  public static void parseMessage(String message, ObjectNode attrs) {
    for (String line : message.split("\\r?\\n")) {
      if (!line.contains(": ")) {
        continue;
      }
      int colon = line.indexOf(':');
      String label = line.substring(0, colon).trim().toLowerCase()
        .replace(' ', '_');
      String value = line.substring(colon + 1).trim();
      if (OMITTED_LABELS.contains(label)) {
        continue;
      }
      attrs.put(label, value);
    }
  }

  private static void flatten(String prefix, JsonNode node, ArrayNode pairs) {
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String key = prefix.isEmpty() ?
        field.getKey() : prefix + "." + field.getKey();
      if (field.getValue().isObject()) {
        flatten(key, field.getValue(), pairs);
      }
      else {
        ArrayNode pair = pairs.addArray();
        pair.add(key);
        pair.add(field.getValue().deepCopy());
      }
    }
  }

}
