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
import static com.spotify.triggers.util.JsonFields.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.spotify.triggers.schedule.ScheduleSpec;
import java.util.Optional;

/**
 * Fires on a schedule. The schedule is absent when the payload does not describe one this model
 * can resolve; the payload is then kept and written back unchanged.
 */
@AutoValue
public abstract class ScheduleTriggerEvent extends TriggerEvent {

  public static final String TYPE = "SCHEDULE";

  static final String SCHEDULE_ID = "scheduleId";
  static final String SCHEDULE = "schedule";
  static final String UNRESOLVED_SCHEDULE = "unresolvedSchedule";

  public abstract Optional<String> scheduleId();

  public abstract Optional<ScheduleSpec> schedule();

  abstract Optional<JsonNode> unresolvedScheduleNode();

  /**
   * The raw schedule payload, present only if it could not be resolved to a schedule.
   */
  public Optional<JsonNode> unresolvedSchedule() {
    return unresolvedScheduleNode().map(JsonNode::deepCopy);
  }

  public static ScheduleTriggerEvent of(Optional<String> scheduleId,
      Optional<ScheduleSpec> schedule) {
    return new AutoValue_ScheduleTriggerEvent(scheduleId, schedule, Optional.empty());
  }

  static ScheduleTriggerEvent parse(JsonNode raw, String path) {
    final Optional<String> scheduleId = text(raw, SCHEDULE_ID);
    final Optional<JsonNode> rawSchedule = field(raw, SCHEDULE);
    final Optional<ScheduleSpec> schedule = rawSchedule.flatMap(ScheduleSpec::fromJson);
    final Optional<JsonNode> unresolved = schedule.isPresent()
        ? Optional.empty()
        : rawSchedule.map(JsonNode::deepCopy);
    return new AutoValue_ScheduleTriggerEvent(scheduleId, schedule, unresolved);
  }

  @Override
  public TriggerEventType eventType() {
    return TriggerEventType.SCHEDULE;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String humanReadableDescription() {
    return "Schedule: " + schedule()
        .map(ScheduleSpec::humanReadableDescription)
        .orElse("unconfigured");
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode json = ModelJson.newObject();
    json.put(ModelJson.TYPE, TYPE);
    scheduleId().ifPresent(id -> json.put(SCHEDULE_ID, id));
    if (schedule().isPresent()) {
      json.set(SCHEDULE, schedule().get().toJson());
    } else {
      unresolvedSchedule().ifPresent(node -> json.set(SCHEDULE, node));
    }
    return json;
  }

  @Override
  public ObjectNode exportJson() {
    final ObjectNode json = ModelJson.newObject();
    json.put(ModelJson.TYPE, TYPE);
    json.put(SCHEDULE_ID, scheduleId().orElse(null));
    json.set(SCHEDULE, schedule()
        .<JsonNode>map(ScheduleSpec::exportJson)
        .orElseGet(json::nullNode));
    unresolvedSchedule().ifPresent(node -> json.set(UNRESOLVED_SCHEDULE, node));
    json.put(ModelJson.HUMAN_READABLE, humanReadableDescription());
    return json;
  }

  @Override
  public <R> R accept(TriggerEventVisitor<R> visitor) {
    return visitor.schedule(this);
  }
}
