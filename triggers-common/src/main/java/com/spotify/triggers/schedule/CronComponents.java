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

import static com.spotify.triggers.util.JsonFields.field;
import static com.spotify.triggers.util.JsonFields.tokens;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The fields of a cron expression. Five field expressions are unix cron, six and seven field
 * expressions are Quartz cron with a leading second and an optional trailing year.
 */
@AutoValue
abstract class CronComponents {

  static final String SECOND = "second";
  static final String MINUTE = "minute";
  static final String HOUR = "hour";
  static final String DAY_OF_MONTH = "dayOfMonth";
  static final String MONTH = "month";
  static final String DAY_OF_WEEK = "dayOfWeek";
  static final String YEAR = "year";

  static final ImmutableList<String> KEYS =
      ImmutableList.of(SECOND, MINUTE, HOUR, DAY_OF_MONTH, MONTH, DAY_OF_WEEK, YEAR);

  private static final Splitter FIELD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Pattern WRAPPED = Pattern.compile("^cron\\((.*)\\)$",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final CharMatcher CRON_SYNTAX = CharMatcher.anyOf("/,-#LW");
  private static final Pattern DAY_OF_WEEK_SYNTAX =
      Pattern.compile(".*[/#-].*|\\d*L", Pattern.CASE_INSENSITIVE);

  abstract Optional<String> second();

  abstract String minute();

  abstract String hour();

  abstract String dayOfMonth();

  abstract String month();

  abstract String dayOfWeek();

  abstract Optional<String> year();

  static CronComponents create(Optional<String> second, String minute, String hour,
      String dayOfMonth, String month, String dayOfWeek, Optional<String> year) {
    return new AutoValue_CronComponents(second, minute, hour, dayOfMonth, month, dayOfWeek, year);
  }

  /**
   * Split a cron expression, optionally wrapped as {@code cron(...)}.
   */
  static Optional<CronComponents> parseExpression(String expression) {
    final List<String> parts = FIELD_SPLITTER.splitToList(unwrap(expression));
    switch (parts.size()) {
      case 5:
        return Optional.of(create(Optional.empty(), parts.get(0), parts.get(1), parts.get(2),
            parts.get(3), parts.get(4), Optional.empty()));
      case 6:
        return Optional.of(create(Optional.of(parts.get(0)), parts.get(1), parts.get(2),
            parts.get(3), parts.get(4), parts.get(5), Optional.empty()));
      case 7:
        return Optional.of(create(Optional.of(parts.get(0)), parts.get(1), parts.get(2),
            parts.get(3), parts.get(4), parts.get(5), Optional.of(parts.get(6))));
      default:
        return Optional.empty();
    }
  }

  static boolean looksLikeCron(String expression) {
    final int fields = FIELD_SPLITTER.splitToList(unwrap(expression)).size();
    return fields >= 5 && fields <= 7;
  }

  static String unwrap(String expression) {
    final String trimmed = expression.trim();
    final Matcher matcher = WRAPPED.matcher(trimmed);
    return matcher.matches() ? matcher.group(1).trim() : trimmed;
  }

  static boolean hasComponents(JsonNode raw) {
    return KEYS.stream().anyMatch(key -> field(raw, key).isPresent());
  }

  /**
   * Collect a component set out of individual fields. A missing second is 0, other missing
   * components are wildcards.
   */
  static CronComponents fromFields(JsonNode raw) {
    return create(
        Optional.of(component(raw, SECOND).orElse("0")),
        component(raw, MINUTE).orElse("*"),
        component(raw, HOUR).orElse("*"),
        component(raw, DAY_OF_MONTH).orElse("*"),
        component(raw, MONTH).orElse("*"),
        component(raw, DAY_OF_WEEK).orElse("*"),
        component(raw, YEAR));
  }

  private static Optional<String> component(JsonNode raw, String key) {
    return field(raw, key)
        .map(value -> Joiner.on(',').join(tokens(value)))
        .filter(value -> !value.isEmpty());
  }

  String expression() {
    final ImmutableList.Builder<String> parts = ImmutableList.builder();
    second().ifPresent(parts::add);
    parts.add(minute(), hour(), dayOfMonth(), month(), dayOfWeek());
    year().ifPresent(parts::add);
    return Joiner.on(' ').join(parts.build());
  }

  boolean quartz() {
    return second().isPresent();
  }

  /**
   * Whether these components need cron to be expressed, as opposed to a simple time of day on
   * some days of the week.
   */
  boolean nonTrivial() {
    if (hasCronSyntax(minute()) || hasCronSyntax(hour())
        || hasCronSyntax(dayOfMonth()) || hasCronSyntax(month())) {
      return true;
    }
    if (second().map(CronComponents::hasCronSyntax).orElse(false)
        || year().map(CronComponents::hasCronSyntax).orElse(false)) {
      return true;
    }
    if (hasDayOfWeekSyntax(dayOfWeek())) {
      return true;
    }
    if (!isWildcard(dayOfMonth()) || !isWildcard(month())) {
      return true;
    }
    if (year().filter(year -> !isWildcard(year)).isPresent()) {
      return true;
    }
    return second().filter(second -> !isWildcard(second) && !isZero(second)).isPresent();
  }

  static boolean isWildcard(String token) {
    return "*".equals(token) || "?".equals(token);
  }

  static boolean isNumber(String token) {
    return NUMBER.matcher(token).matches();
  }

  private static boolean isZero(String token) {
    return isNumber(token) && CharMatcher.is('0').matchesAllOf(token);
  }

  private static boolean hasCronSyntax(String token) {
    return !isWildcard(token) && CRON_SYNTAX.matchesAnyOf(token);
  }

  /**
   * Whether a day of week token uses ranges, steps, nth or last day syntax. Unknown day names and
   * out of range numbers are not cron syntax, they are dropped when the schedule is parsed.
   */
  static boolean hasDayOfWeekSyntax(String token) {
    return Splitter.on(',').trimResults().splitToList(token).stream()
        .anyMatch(day -> DAY_OF_WEEK_SYNTAX.matcher(day).matches());
  }

  /**
   * A wildcard, or a comma separated list of day numbers or names.
   */
  static boolean isPlainDayList(String token) {
    if (isWildcard(token)) {
      return true;
    }
    return Splitter.on(',').trimResults().splitToList(token).stream()
        .allMatch(day -> CalendarNames.dayOfWeek(day, false).isPresent());
  }
}
