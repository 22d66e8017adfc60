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

import static com.cronutils.model.definition.CronDefinitionBuilder.instanceDefinitionFor;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.google.common.base.Joiner;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution times of a {@link ScheduleSpec}, computed with cron-utils.
 *
 * <p>Cron schedules are evaluated as unix cron when they have five fields and as Quartz cron
 * otherwise. Simple and advanced schedules are evaluated through an equivalent unix cron
 * expression when they have one, that is when they repeat every minute, hour, day, week, month
 * or year.
 */
public final class ScheduleTimes {

  private static final Logger LOG = LoggerFactory.getLogger(ScheduleTimes.class);

  private static final CronParser UNIX = new CronParser(instanceDefinitionFor(CronType.UNIX));
  private static final CronParser QUARTZ = new CronParser(instanceDefinitionFor(CronType.QUARTZ));

  private ScheduleTimes() {
    throw new UnsupportedOperationException();
  }

  public static Optional<Cron> cron(ScheduleSpec spec) {
    if (spec.scheduleKind() == ScheduleKind.CRON) {
      final Optional<CronComponents> components =
          spec.cronExpression().flatMap(CronComponents::parseExpression);
      if (components.isEmpty()) {
        return Optional.empty();
      }
      final CronComponents cron = components.get();
      return parse(cron.quartz() ? QUARTZ : UNIX, cron.expression());
    }
    return unixExpression(spec).flatMap(expression -> parse(UNIX, expression));
  }

  public static boolean isValid(ScheduleSpec spec) {
    return cron(spec).isPresent();
  }

  /**
   * The first execution strictly after {@code from}, in the timezone of the schedule or, if it
   * has none, the zone of {@code from}. Empty if the schedule is inactive or has no cron form.
   */
  public static Optional<ZonedDateTime> nextExecution(ScheduleSpec spec, ZonedDateTime from) {
    return executionTime(spec).flatMap(time -> time.nextExecution(inZone(spec, from)));
  }

  /**
   * The last execution strictly before {@code from}.
   *
   * @see #nextExecution(ScheduleSpec, ZonedDateTime)
   */
  public static Optional<ZonedDateTime> lastExecution(ScheduleSpec spec, ZonedDateTime from) {
    return executionTime(spec).flatMap(time -> time.lastExecution(inZone(spec, from)));
  }

  private static Optional<ExecutionTime> executionTime(ScheduleSpec spec) {
    if (!spec.active()) {
      return Optional.empty();
    }
    return cron(spec).map(ExecutionTime::forCron);
  }

  private static ZonedDateTime inZone(ScheduleSpec spec, ZonedDateTime time) {
    if (spec.timezone().isEmpty()) {
      return time;
    }
    try {
      return time.withZoneSameInstant(ZoneId.of(spec.timezone().get()));
    } catch (DateTimeException e) {
      LOG.debug("Invalid schedule timezone {}, using {}", spec.timezone().get(), time.getZone());
      return time;
    }
  }

  private static Optional<Cron> parse(CronParser parser, String expression) {
    try {
      return Optional.of(parser.parse(expression).validate());
    } catch (IllegalArgumentException e) {
      LOG.debug("Invalid cron expression {}: {}", expression, e.getMessage());
      return Optional.empty();
    }
  }

  static Optional<String> unixExpression(ScheduleSpec spec) {
    if (spec.interval() != 1) {
      return Optional.empty();
    }
    final String minute = String.valueOf(spec.minute().orElse(0));
    final String hour = String.valueOf(spec.hour().orElse(0));
    switch (spec.frequency()) {
      case MINUTELY:
        return Optional.of("* * * * *");
      case HOURLY:
        return Optional.of(minute + " * * * *");
      case DAILY:
        return Optional.of(minute + " " + hour + " * * *");
      case WEEKLY:
        return Optional.of(minute + " " + hour + " * * " + list(spec.dayOfWeek(), "1"));
      case MONTHLY:
        return Optional.of(minute + " " + hour + " " + list(spec.dayOfMonth(), "1") + " * *");
      case YEARLY:
        return Optional.of(minute + " " + hour + " " + list(spec.dayOfMonth(), "1") + " "
            + list(spec.month(), "1") + " *");
      default:
        return Optional.empty();
    }
  }

  private static String list(List<Integer> values, String fallback) {
    if (values.isEmpty()) {
      return fallback;
    }
    return Joiner.on(',').join(values);
  }
}
