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
import com.google.auto.value.AutoValue;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * A predicate gating when a trigger fires once one of its events occurred. Parameters are opaque
 * and kept as found, as are any other fields of the payload.
 */
@AutoValue
public abstract class TriggerCondition {

  static final String PARAMETERS = "parameters";

  public abstract String type();

  abstract ObjectNode parametersNode();

  abstract ObjectNode extraFieldsNode();

  public ObjectNode parameters() {
    return parametersNode().deepCopy();
  }

  /**
   * Top level fields other than {@code type} and {@code parameters}.
   */
  public ObjectNode extraFields() {
    return extraFieldsNode().deepCopy();
  }

  /**
   * Look up a parameter, first in {@code parameters} and then among the other fields.
   */
  public Optional<JsonNode> parameter(String key) {
    return field(parametersNode(), key)
        .or(() -> field(extraFieldsNode(), key))
        .map(JsonNode::deepCopy);
  }

  public static TriggerCondition of(String type, ObjectNode parameters) {
    return of(type, parameters, ModelJson.newObject());
  }

  public static TriggerCondition of(String type, ObjectNode parameters, ObjectNode extraFields) {
    return new AutoValue_TriggerCondition(type, parameters.deepCopy(), extraFields.deepCopy());
  }

  /**
   * @throws MissingDiscriminantException if the condition has no type
   */
  public static TriggerCondition fromJson(JsonNode raw) {
    return parse(raw, ModelJson.ROOT);
  }

  static TriggerCondition parse(JsonNode raw, String path) {
    final String type = ModelJson.discriminant(raw, path);
    final ObjectNode parameters = ModelJson.newObject();
    final ObjectNode extraFields = ModelJson.newObject();
    final Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> entry = fields.next();
      if (ModelJson.TYPE.equals(entry.getKey())) {
        continue;
      }
      if (PARAMETERS.equals(entry.getKey()) && entry.getValue().isObject()) {
        parameters.setAll((ObjectNode) entry.getValue().deepCopy());
      } else {
        extraFields.set(entry.getKey(), entry.getValue().deepCopy());
      }
    }
    return new AutoValue_TriggerCondition(type, parameters, extraFields);
  }

  public String humanReadableDescription() {
    return "Condition: " + type();
  }

  /**
   * {@code {type, parameters, ...}}. A {@code parameters} value that is not an object is kept
   * among the other fields and written back in its place.
   */
  public ObjectNode toJson() {
    final ObjectNode json = ModelJson.newObject();
    json.put(ModelJson.TYPE, type());
    json.set(PARAMETERS, parameters());
    json.setAll(extraFields());
    return json;
  }

  public ObjectNode exportJson() {
    final ObjectNode json = toJson();
    json.put(ModelJson.HUMAN_READABLE, humanReadableDescription());
    return json;
  }
}
