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

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import java.time.DayOfWeek;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * English day and month names, and the numbering used for them in schedules. Days are numbered
 * 0 = Sunday to 6 = Saturday (7 is accepted as Sunday); Quartz cron numbers them 1 = Sunday to
 * 7 = Saturday.
 */
final class CalendarNames {

  private static final ImmutableMap<String, Integer> DAYS;
  private static final ImmutableMap<String, Integer> MONTHS;

  static {
    final ImmutableMap.Builder<String, Integer> days = ImmutableMap.builder();
    for (DayOfWeek day : DayOfWeek.values()) {
      putNameAndAbbreviation(days, day.name(), day.getValue() % 7);
    }
    DAYS = days.build();

    final ImmutableMap.Builder<String, Integer> months = ImmutableMap.builder();
    for (Month month : Month.values()) {
      putNameAndAbbreviation(months, month.name(), month.getValue());
    }
    MONTHS = months.build();
  }

  private CalendarNames() {
    throw new UnsupportedOperationException();
  }

  // MAY is its own abbreviation
  private static void putNameAndAbbreviation(ImmutableMap.Builder<String, Integer> names,
      String name, int value) {
    names.put(name, value);
    final String abbreviation = name.substring(0, 3);
    if (!abbreviation.equals(name)) {
      names.put(abbreviation, value);
    }
  }

  static Optional<Integer> dayOfWeek(String token, boolean quartz) {
    final String day = token.trim().toUpperCase(Locale.US);
    final Integer number = Ints.tryParse(day);
    if (number == null) {
      return Optional.ofNullable(DAYS.get(day));
    }
    if (quartz) {
      return number >= 1 && number <= 7 ? Optional.of(number - 1) : Optional.empty();
    }
    return number >= 0 && number <= 7 ? Optional.of(number % 7) : Optional.empty();
  }

  static Optional<Integer> month(String token) {
    final String month = token.trim().toUpperCase(Locale.US);
    final Integer number = Ints.tryParse(month);
    if (number == null) {
      return Optional.ofNullable(MONTHS.get(month));
    }
    return number >= 1 && number <= 12 ? Optional.of(number) : Optional.empty();
  }

  static String dayName(int day) {
    return DayOfWeek.of(day == 0 ? 7 : day).getDisplayName(TextStyle.FULL, Locale.US);
  }

  static String dayAbbreviation(int day) {
    return DayOfWeek.of(day == 0 ? 7 : day).name().substring(0, 3);
  }

  static String monthAbbreviation(int month) {
    return Month.of(month).getDisplayName(TextStyle.SHORT, Locale.US);
  }
}
