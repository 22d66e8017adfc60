/*-
 * -\-\-
 * Dataflow Triggers Common
 * --
 * Copyright (C) 2026 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.triggers.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient accessors for fields of JSON objects as returned by the dataflow API. Values are
 * frequently sent as text where a number is expected, so numeric readers accept both.
 */
public final class JsonFields {

  private static final Logger LOG = LoggerFactory.getLogger(JsonFields.class);

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private JsonFields() {
    throw new UnsupportedOperationException();
  }

  /**
   * Get the value of a field, absent if the node is not an object, the field is missing or the
   * field is JSON null.
   */
  public static Optional<JsonNode> field(@Nullable JsonNode node, String name) {
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    final JsonNode value = node.get(name);
    if (value == null || value.isNull() || value.isMissingNode()) {
      return Optional.empty();
    }
    return Optional.of(value);
  }

  /**
   * Get the first present field out of a list of alternative names.
   */
  public static Optional<JsonNode> firstField(@Nullable JsonNode node, String... names) {
    for (String name : names) {
      final Optional<JsonNode> value = field(node, name);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }

  /**
   * Get a scalar field as text. Numbers and booleans are rendered as text, containers are absent.
   */
  public static Optional<String> text(@Nullable JsonNode node, String name) {
    return field(node, name)
        .filter(JsonNode::isValueNode)
        .map(JsonNode::asText);
  }

  public static Optional<String> nonBlankText(@Nullable JsonNode node, String name) {
    return text(node, name).filter(value -> !value.isBlank());
  }

  /**
   * Get an integer field given either as an integral number or as numeric text.
   */
  public static Optional<Integer> integer(@Nullable JsonNode node, String name) {
    return field(node, name).flatMap(JsonFields::toInteger);
  }

  public static Optional<Integer> toInteger(JsonNode value) {
    if (value.isIntegralNumber()) {
      return value.canConvertToInt()
             ? Optional.of(value.intValue())
             : Optional.empty();
    }
    if (value.isNumber()) {
      final double number = value.doubleValue();
      return number == Math.rint(number) && value.canConvertToInt()
             ? Optional.of(value.intValue())
             : Optional.empty();
    }
    if (value.isTextual()) {
      return Optional.ofNullable(Ints.tryParse(value.asText().trim()));
    }
    return Optional.empty();
  }

  /**
   * Get a boolean field given as a JSON boolean, as "true"/"false" text or as a number.
   */
  public static boolean bool(@Nullable JsonNode node, String name, boolean defaultValue) {
    final Optional<JsonNode> field = field(node, name);
    if (field.isEmpty()) {
      return defaultValue;
    }
    final JsonNode value = field.get();
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isNumber()) {
      return value.intValue() != 0;
    }
    if (value.isTextual()) {
      switch (value.asText().trim().toLowerCase(Locale.US)) {
        case "true":
          return true;
        case "false":
          return false;
        default:
          break;
      }
    }
    LOG.debug("Ignoring non-boolean value {} of field {}", value, name);
    return defaultValue;
  }

  /**
   * Get the tokens of a list valued field. Accepts a JSON array of scalars, comma separated text
   * or a single scalar.
   */
  public static List<String> tokens(JsonNode value) {
    if (value.isArray()) {
      return StreamSupport.stream(value.spliterator(), false)
          .filter(JsonNode::isValueNode)
          .map(JsonNode::asText)
          .map(String::trim)
          .filter(token -> !token.isEmpty())
          .collect(ImmutableList.toImmutableList());
    }
    if (value.isValueNode()) {
      return LIST_SPLITTER.splitToList(value.asText());
    }
    return ImmutableList.of();
  }
}
