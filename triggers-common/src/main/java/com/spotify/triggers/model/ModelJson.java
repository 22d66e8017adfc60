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

package com.spotify.triggers.model;

import static com.spotify.triggers.util.JsonFields.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.spotify.triggers.serialization.Json;
import com.spotify.triggers.util.JsonFields;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Strict field readers for the model. Failures are reported with the JSON path of the element,
 * {@code $} being the root of the settings object.
 */
final class ModelJson {

  static final String ROOT = "$";
  static final String TYPE = "type";
  static final String HUMAN_READABLE = "humanReadable";

  private ModelJson() {
    throw new UnsupportedOperationException();
  }

  static ObjectNode newObject() {
    return Json.OBJECT_MAPPER.createObjectNode();
  }

  static String child(String path, String field) {
    return path + "." + field;
  }

  /**
   * The {@code type} of an event or condition.
   *
   * @throws MissingDiscriminantException if the element is not an object or has no textual,
   *                                      non-blank type
   */
  static String discriminant(JsonNode raw, String path) {
    if (raw == null || !raw.isObject()) {
      throw new MissingDiscriminantException(path);
    }
    final JsonNode type = raw.get(TYPE);
    if (type == null || !type.isTextual() || type.asText().isBlank()) {
      throw new MissingDiscriminantException(path);
    }
    return type.asText();
  }

  static int requiredInteger(JsonNode raw, String name, String path) {
    final Optional<JsonNode> value = field(raw, name);
    if (value.isEmpty()) {
      throw new MissingRequiredFieldException(path, name);
    }
    return JsonFields.toInteger(value.get()).orElseThrow(() ->
        new InvalidConfigurationException(child(path, name),
            "not an integer: " + value.get()));
  }

  static String requiredText(JsonNode raw, String name, String path) {
    final Optional<JsonNode> value = field(raw, name);
    if (value.isEmpty()) {
      throw new MissingRequiredFieldException(path, name);
    }
    if (!value.get().isValueNode()) {
      throw new InvalidConfigurationException(child(path, name),
          "not a text value: " + value.get());
    }
    return value.get().asText();
  }

  /**
   * Parse every element of an array field. A missing field is an empty list.
   */
  static <T> List<T> parseArray(JsonNode raw, String name, String path,
      BiFunction<JsonNode, String, T> parser) {
    final Optional<JsonNode> value = field(raw, name);
    if (value.isEmpty()) {
      return ImmutableList.of();
    }
    if (!value.get().isArray()) {
      throw new InvalidConfigurationException(child(path, name),
          "not an array: " + value.get().getNodeType());
    }
    final ImmutableList.Builder<T> elements = ImmutableList.builder();
    for (int i = 0; i < value.get().size(); i++) {
      elements.add(parser.apply(value.get().get(i), child(path, name) + "[" + i + "]"));
    }
    return elements.build();
  }
}
