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
import com.google.common.collect.ImmutableMap;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One condition under which a trigger fires: a schedule, an update of a dataset, or an event
 * type this model does not know, kept as is.
 */
public abstract class TriggerEvent {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerEvent.class);

  private static final ImmutableMap<String, BiFunction<JsonNode, String, TriggerEvent>> PARSERS =
      ImmutableMap.of(
          ScheduleTriggerEvent.TYPE, ScheduleTriggerEvent::parse,
          DatasetUpdatedTriggerEvent.TYPE, DatasetUpdatedTriggerEvent::parse);

  TriggerEvent() {
  }

  public abstract TriggerEventType eventType();

  /**
   * The discriminant as found in the payload.
   */
  public abstract String type();

  public abstract String humanReadableDescription();

  /**
   * The minimal form, suitable for writing back to the API.
   */
  public abstract ObjectNode toJson();

  /**
   * {@link #toJson()} plus a human readable description, with schedules exported in full.
   */
  public abstract ObjectNode exportJson();

  public abstract <R> R accept(TriggerEventVisitor<R> visitor);

  /**
   * Parse an event by its {@code type}.
   *
   * @throws MissingDiscriminantException if the event has no type
   * @throws MissingRequiredFieldException if a field required by the type is missing
   */
  public static TriggerEvent fromJson(JsonNode raw) {
    return parse(raw, ModelJson.ROOT);
  }

  static TriggerEvent parse(JsonNode raw, String path) {
    final String type = ModelJson.discriminant(raw, path);
    final BiFunction<JsonNode, String, TriggerEvent> parser = PARSERS.get(type);
    if (parser == null) {
      LOG.debug("Keeping event of unrecognized type {} at {} as is", type, path);
      return GenericTriggerEvent.parse(raw, path);
    }
    return parser.apply(raw, path);
  }
}
