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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;

/**
 * An event of a type this model does not know. The payload is written back exactly as it was
 * read.
 */
@AutoValue
public abstract class GenericTriggerEvent extends TriggerEvent {

  public abstract String rawType();

  abstract ObjectNode payload();

  /**
   * A copy of the full payload, {@code type} included.
   */
  public ObjectNode raw() {
    return payload().deepCopy();
  }

  static GenericTriggerEvent parse(JsonNode raw, String path) {
    return new AutoValue_GenericTriggerEvent(ModelJson.discriminant(raw, path),
        ((ObjectNode) raw).deepCopy());
  }

  @Override
  public TriggerEventType eventType() {
    return TriggerEventType.UNKNOWN;
  }

  @Override
  public String type() {
    return rawType();
  }

  @Override
  public String humanReadableDescription() {
    return "Event: " + rawType();
  }

  @Override
  public ObjectNode toJson() {
    return raw();
  }

  @Override
  public ObjectNode exportJson() {
    final ObjectNode json = raw();
    json.put(ModelJson.HUMAN_READABLE, humanReadableDescription());
    return json;
  }

  @Override
  public <R> R accept(TriggerEventVisitor<R> visitor) {
    return visitor.generic(this);
  }
}
