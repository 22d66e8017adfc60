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

package com.spotify.triggers.schedule;

import static com.spotify.triggers.schedule.ScheduleParser.ADVANCED_SCHEDULE_JSON;
import static com.spotify.triggers.schedule.ScheduleParser.CRON_EXPRESSION;
import static com.spotify.triggers.schedule.ScheduleParser.FREQUENCY;
import static com.spotify.triggers.schedule.ScheduleParser.INTERVAL;
import static com.spotify.triggers.schedule.ScheduleParser.IS_ACTIVE;
import static com.spotify.triggers.schedule.ScheduleParser.SCHEDULE_EXPRESSION;
import static com.spotify.triggers.schedule.ScheduleParser.SCHEDULE_START_DATE;
import static com.spotify.triggers.schedule.ScheduleParser.TIMEZONE;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Joiner;
import com.spotify.triggers.serialization.Json;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes schedules back to JSON, either in the minimal form accepted by the API or as a
 * comprehensive export.
 */
final class ScheduleSerializer {

  static final String SCHEDULE_KIND = "scheduleKind";
  static final String HUMAN_READABLE = "humanReadable";

  private ScheduleSerializer() {
    throw new UnsupportedOperationException();
  }

  /**
   * The minimal JSON that parses back into an equal schedule.
   */
  static ObjectNode toJson(ScheduleSpec spec) {
    final ObjectNode json;
    switch (spec.scheduleKind()) {
      case CRON:
        json = Json.OBJECT_MAPPER.createObjectNode();
        json.put(CRON_EXPRESSION, spec.cronExpression().orElseThrow());
        break;
      case SIMPLE:
        json = simple(spec);
        break;
      case ADVANCED:
        json = advanced(spec);
        break;
      default:
        throw new AssertionError("unknown schedule kind " + spec.scheduleKind());
    }
    if (spec.scheduleKind() != ScheduleKind.ADVANCED || spec.advancedSourceNode().isEmpty()) {
      metadata(spec, json);
    }
    return json;
  }

  private static ObjectNode simple(ScheduleSpec spec) {
    final ObjectNode json = Json.OBJECT_MAPPER.createObjectNode();
    spec.scheduleExpression().ifPresent(expression -> json.put(SCHEDULE_EXPRESSION, expression));
    spec.hour().ifPresent(hour -> json.put(CronComponents.HOUR, String.valueOf(hour)));
    spec.minute().ifPresent(minute -> json.put(CronComponents.MINUTE, String.valueOf(minute)));
    if (!spec.dayOfWeek().isEmpty()) {
      json.put(CronComponents.DAY_OF_WEEK, Joiner.on(',').join(dayNames(spec.dayOfWeek())));
    }

    // frequency is only written when it would not be inferred the same way
    final ObjectNode candidate = json.deepCopy();
    metadata(spec, candidate);
    final Optional<ScheduleFrequency> inferred = ScheduleParser.parse(candidate)
        .map(ScheduleSpec::frequency);
    if (!inferred.equals(Optional.of(spec.frequency()))) {
      json.put(FREQUENCY, spec.frequency().name());
    }
    return json;
  }

  private static ObjectNode advanced(ScheduleSpec spec) {
    if (spec.advancedSourceNode().isPresent()) {
      return spec.advancedSourceNode().get().deepCopy();
    }
    final ObjectNode body = Json.OBJECT_MAPPER.createObjectNode();
    body.put(FREQUENCY, spec.frequency().name());
    spec.hour().ifPresent(hour -> body.put(CronComponents.HOUR, hour));
    spec.minute().ifPresent(minute -> body.put(CronComponents.MINUTE, minute));
    if (!spec.dayOfWeek().isEmpty()) {
      body.set(ScheduleParser.DAYS_OF_WEEK, intArray(spec.dayOfWeek()));
    }
    if (!spec.dayOfMonth().isEmpty()) {
      body.set(ScheduleParser.DAYS_OF_MONTH, intArray(spec.dayOfMonth()));
    }
    if (!spec.month().isEmpty()) {
      body.set(ScheduleParser.MONTHS, intArray(spec.month()));
    }
    final ObjectNode json = Json.OBJECT_MAPPER.createObjectNode();
    json.set(ADVANCED_SCHEDULE_JSON, body);
    return json;
  }

  private static void metadata(ScheduleSpec spec, ObjectNode json) {
    if (spec.interval() != 1) {
      json.put(INTERVAL, spec.interval());
    }
    spec.timezone().ifPresent(zone -> json.put(TIMEZONE, zone));
    spec.startDate().ifPresent(date ->
        json.put(SCHEDULE_START_DATE, DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(date)));
    if (!spec.active()) {
      json.put(IS_ACTIVE, false);
    }
  }

  /**
   * Every structured field, absent values as null, plus a human readable description.
   */
  static ObjectNode exportJson(ScheduleSpec spec) {
    final ObjectNode json = Json.OBJECT_MAPPER.createObjectNode();
    json.put(SCHEDULE_KIND, spec.scheduleKind().name());
    json.put(FREQUENCY, spec.frequency().name());
    json.put(INTERVAL, spec.interval());
    json.put(CronComponents.HOUR, spec.hour().orElse(null));
    json.put(CronComponents.MINUTE, spec.minute().orElse(null));
    json.set(CronComponents.DAY_OF_WEEK, intArray(spec.dayOfWeek()));
    json.set(CronComponents.DAY_OF_MONTH, intArray(spec.dayOfMonth()));
    json.set(CronComponents.MONTH, intArray(spec.month()));
    json.put(TIMEZONE, spec.timezone().orElse(null));
    json.put(CRON_EXPRESSION, spec.cronExpression().orElse(null));
    json.put(SCHEDULE_EXPRESSION, spec.scheduleExpression().orElse(null));
    json.put(SCHEDULE_START_DATE, spec.startDate()
        .map(DateTimeFormatter.ISO_LOCAL_DATE_TIME::format)
        .orElse(null));
    json.put(IS_ACTIVE, spec.active());
    json.put(HUMAN_READABLE, spec.humanReadableDescription());
    return json;
  }

  private static List<String> dayNames(List<Integer> days) {
    return days.stream()
        .map(CalendarNames::dayAbbreviation)
        .collect(Collectors.toList());
  }

  private static ArrayNode intArray(List<Integer> values) {
    final ArrayNode array = Json.OBJECT_MAPPER.createArrayNode();
    values.forEach(array::add);
    return array;
  }
}
