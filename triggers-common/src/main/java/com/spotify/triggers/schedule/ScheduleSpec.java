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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A resolved schedule. Built by {@link ScheduleParser} out of one of the three raw schedule
 * shapes (see {@link ScheduleKind}) and owned by the schedule trigger event that references it.
 *
 * <p>The structured fields and the frequency derived from them are only kept consistent by
 * parsing, so a changed schedule should be parsed again rather than patched through
 * {@link #toBuilder()}.
 */
@AutoValue
public abstract class ScheduleSpec {

  public abstract ScheduleKind scheduleKind();

  public abstract ScheduleFrequency frequency();

  public abstract int interval();

  public abstract Optional<Integer> hour();

  public abstract Optional<Integer> minute();

  /**
   * Days of the week, 0 = Sunday to 6 = Saturday.
   */
  public abstract ImmutableList<Integer> dayOfWeek();

  public abstract ImmutableList<Integer> dayOfMonth();

  /**
   * Months, 1 = January to 12 = December.
   */
  public abstract ImmutableList<Integer> month();

  public abstract Optional<String> timezone();

  /**
   * The cron expression, present if and only if this is a {@link ScheduleKind#CRON} schedule.
   */
  public abstract Optional<String> cronExpression();

  /**
   * A keyword expression such as {@code MANUAL}, {@code ONCE} or {@code every 2 hours}.
   */
  public abstract Optional<String> scheduleExpression();

  public abstract Optional<LocalDateTime> startDate();

  public abstract boolean active();

  abstract Optional<ObjectNode> advancedSourceNode();

  /**
   * A copy of the raw payload of an {@link ScheduleKind#ADVANCED} schedule, written back as is.
   */
  public Optional<ObjectNode> advancedSource() {
    return advancedSourceNode().map(ObjectNode::deepCopy);
  }

  public abstract Builder toBuilder();

  public String humanReadableDescription() {
    return ScheduleDescriptions.describe(this);
  }

  /**
   * The minimal form, suitable for writing back to the API.
   */
  public ObjectNode toJson() {
    return ScheduleSerializer.toJson(this);
  }

  /**
   * Every structured field plus a human readable description.
   */
  public ObjectNode exportJson() {
    return ScheduleSerializer.exportJson(this);
  }

  public static Optional<ScheduleSpec> fromJson(JsonNode raw) {
    return ScheduleParser.parse(raw);
  }

  public static Builder builder() {
    return new AutoValue_ScheduleSpec.Builder()
        .interval(1)
        .active(true)
        .dayOfWeek(ImmutableList.of())
        .dayOfMonth(ImmutableList.of())
        .month(ImmutableList.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder scheduleKind(ScheduleKind scheduleKind);

    public abstract Builder frequency(ScheduleFrequency frequency);

    public abstract Builder interval(int interval);

    public abstract Builder hour(Integer hour);

    public abstract Builder minute(Integer minute);

    public abstract Builder dayOfWeek(List<Integer> dayOfWeek);

    public abstract Builder dayOfMonth(List<Integer> dayOfMonth);

    public abstract Builder month(List<Integer> month);

    public abstract Builder timezone(String timezone);

    public abstract Builder cronExpression(String cronExpression);

    public abstract Builder scheduleExpression(String scheduleExpression);

    public abstract Builder startDate(LocalDateTime startDate);

    public abstract Builder active(boolean active);

    abstract Builder advancedSourceNode(ObjectNode advancedSourceNode);

    public Builder advancedSource(ObjectNode advancedSource) {
      return advancedSourceNode(advancedSource.deepCopy());
    }

    abstract ScheduleSpec autoBuild();

    public ScheduleSpec build() {
      final ScheduleSpec spec = autoBuild();
      checkState(spec.cronExpression().isPresent() == (spec.scheduleKind() == ScheduleKind.CRON),
          "cron expression must be set if and only if the schedule kind is CRON: %s", spec);
      checkArgument(spec.interval() >= 1, "interval must be positive: %s", spec.interval());
      return spec;
    }
  }
}
