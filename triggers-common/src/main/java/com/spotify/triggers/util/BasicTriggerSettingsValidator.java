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

import static java.lang.String.format;

import com.spotify.triggers.model.DatasetUpdatedTriggerEvent;
import com.spotify.triggers.model.GenericTriggerEvent;
import com.spotify.triggers.model.ScheduleTriggerEvent;
import com.spotify.triggers.model.Trigger;
import com.spotify.triggers.model.TriggerEventVisitor;
import com.spotify.triggers.model.TriggerSettings;
import com.spotify.triggers.schedule.ScheduleKind;
import com.spotify.triggers.schedule.ScheduleSpec;
import com.spotify.triggers.schedule.ScheduleTimes;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports settings that parse but are unlikely to do what was intended: duplicate ids, triggers
 * that can never fire, schedules that could not be resolved and the like.
 */
public class BasicTriggerSettingsValidator implements TriggerSettingsValidator {

  public static final BasicTriggerSettingsValidator INSTANCE = new BasicTriggerSettingsValidator();

  @Override
  public List<String> validate(TriggerSettings settings) {
    final List<String> e = new ArrayList<>();

    zone(e, "zone id", settings.zoneId());

    settings.duplicateTriggerIds().stream()
        .sorted()
        .forEach(id -> e.add(format("duplicate trigger id: %d", id)));

    for (Trigger trigger : settings) {
      final int id = trigger.triggerId();
      if (trigger.title().isBlank()) {
        e.add(format("trigger %d: title is empty", id));
      }
      if (trigger.events().isEmpty()) {
        e.add(format("trigger %d: no events, trigger can never fire", id));
      }
      for (int i = 0; i < trigger.events().size(); i++) {
        final int index = i;
        trigger.events().get(i).accept(EventProblemVisitor.INSTANCE)
            .ifPresent(problem -> e.add(format("trigger %d event %d: %s", id, index, problem)));
      }
    }

    return e;
  }

  private static void zone(List<String> errors, String name, String zoneId) {
    try {
      ZoneId.of(zoneId);
    } catch (DateTimeException ex) {
      errors.add(format("invalid %s: %s", name, zoneId));
    }
  }

  /**
   * A {@link TriggerEventVisitor} for finding the problem of an event, if any.
   */
  private enum EventProblemVisitor implements TriggerEventVisitor<Optional<String>> {
    INSTANCE;

    @Override
    public Optional<String> schedule(ScheduleTriggerEvent event) {
      if (event.schedule().isEmpty()) {
        return Optional.of("schedule could not be resolved");
      }
      final ScheduleSpec schedule = event.schedule().get();
      if (schedule.scheduleKind() == ScheduleKind.CRON && !ScheduleTimes.isValid(schedule)) {
        return Optional.of("invalid cron expression: " + schedule.cronExpression().orElse(""));
      }
      final Optional<String> timezone = schedule.timezone();
      if (timezone.isPresent()) {
        final List<String> errors = new ArrayList<>();
        zone(errors, "schedule timezone", timezone.get());
        return errors.stream().findFirst();
      }
      return Optional.empty();
    }

    @Override
    public Optional<String> datasetUpdated(DatasetUpdatedTriggerEvent event) {
      return event.datasetId().isBlank()
          ? Optional.of("dataset id is empty")
          : Optional.empty();
    }

    @Override
    public Optional<String> generic(GenericTriggerEvent event) {
      return Optional.of("unrecognized event type: " + event.rawType());
    }
  }
}
