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

import com.google.common.base.Joiner;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * English descriptions of schedules, such as {@code Every day at 09:30 (Europe/Stockholm)}.
 */
final class ScheduleDescriptions {

  private static final DateTimeFormatter START_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.US);
  private static final Joiner COMMA = Joiner.on(", ");

  private ScheduleDescriptions() {
    throw new UnsupportedOperationException();
  }

  static String describe(ScheduleSpec spec) {
    final StringBuilder description = new StringBuilder(body(spec));
    spec.timezone().ifPresent(zone -> description.append(" (").append(zone).append(')'));
    if (!spec.active()) {
      description.append(" [INACTIVE]");
    }
    return description.toString();
  }

  private static String body(ScheduleSpec spec) {
    if (spec.scheduleKind() == ScheduleKind.CRON) {
      return "Custom schedule: " + spec.cronExpression().orElse("");
    }
    final int interval = spec.interval();
    switch (spec.frequency()) {
      case MANUAL:
        return "Manual execution";
      case ONCE:
        return spec.startDate()
            .map(date -> "Run once on " + START_DATE_FORMAT.format(date))
            .orElse("Run once");
      case MINUTELY:
        return every(interval, "minute");
      case HOURLY:
        return every(interval, "hour") + spec.minute()
            .map(minute -> String.format(Locale.US, " at %02d minutes past the hour", minute))
            .orElse("");
      case DAILY:
        return every(interval, "day") + timeOfDay(spec);
      case WEEKLY:
        return weekly(spec) + timeOfDay(spec);
      case MONTHLY:
        return every(interval, "month") + daysOfMonth(spec) + timeOfDay(spec);
      case YEARLY:
        return every(interval, "year") + months(spec) + daysOfMonth(spec) + timeOfDay(spec);
      default:
        return "Custom schedule";
    }
  }

  private static String every(int interval, String unit) {
    return interval == 1
        ? "Every " + unit
        : "Every " + interval + " " + unit + "s";
  }

  private static String weekly(ScheduleSpec spec) {
    final List<String> days = spec.dayOfWeek().stream()
        .filter(day -> day >= 0 && day <= 6)
        .map(CalendarNames::dayName)
        .collect(Collectors.toList());
    if (days.isEmpty()) {
      return every(spec.interval(), "week");
    }
    if (spec.interval() == 1) {
      return "Every " + COMMA.join(days);
    }
    return "Every " + spec.interval() + " weeks on " + COMMA.join(days);
  }

  private static String timeOfDay(ScheduleSpec spec) {
    return spec.hour()
        .map(hour -> String.format(Locale.US, " at %02d:%02d", hour, spec.minute().orElse(0)))
        .orElse("");
  }

  private static String daysOfMonth(ScheduleSpec spec) {
    if (spec.dayOfMonth().isEmpty()) {
      return "";
    }
    return " on day(s) " + COMMA.join(spec.dayOfMonth());
  }

  private static String months(ScheduleSpec spec) {
    final List<String> months = spec.month().stream()
        .filter(month -> month >= 1 && month <= 12)
        .map(CalendarNames::monthAbbreviation)
        .collect(Collectors.toList());
    return months.isEmpty() ? "" : " in " + COMMA.join(months);
  }
}
