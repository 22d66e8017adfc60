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
import static com.spotify.triggers.util.JsonFields.firstField;
import static com.spotify.triggers.util.JsonFields.integer;
import static com.spotify.triggers.util.JsonFields.nonBlankText;
import static com.spotify.triggers.util.JsonFields.tokens;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.spotify.triggers.serialization.Json;
import com.spotify.triggers.util.JsonFields;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves raw schedule payloads into {@link ScheduleSpec}s.
 *
 * <p>Schedules come in three shapes: a cron expression (or cron fields given individually), a
 * simple schedule made of a frequency keyword and a time of day, and advanced schedules whose
 * structure is only partly understood. Parsing is lenient and never throws; a payload that does
 * not describe a schedule at all resolves to nothing.
 */
public final class ScheduleParser {

  private static final Logger LOG = LoggerFactory.getLogger(ScheduleParser.class);

  static final String CRON_EXPRESSION = "cronExpression";
  static final String SCHEDULE_EXPRESSION = "scheduleExpression";
  static final String EXPRESSION = "expression";
  static final String ADVANCED_SCHEDULE_JSON = "advancedScheduleJson";
  static final String ADVANCED_SCHEDULE = "advancedSchedule";
  static final String FREQUENCY = "frequency";
  static final String INTERVAL = "interval";
  static final String TIMEZONE = "timezone";
  static final String SCHEDULE_START_DATE = "scheduleStartDate";
  static final String START_DATE = "startDate";
  static final String IS_ACTIVE = "isActive";

  static final String TIME_WINDOWS = "timeWindows";
  static final String EXCLUSIONS = "exclusions";
  static final String DAYS_OF_WEEK = "daysOfWeek";
  static final String DAYS_OF_MONTH = "daysOfMonth";
  static final String MONTHS = "months";

  private static final ImmutableList<String> ADVANCED_MARKERS = ImmutableList.of(
      ADVANCED_SCHEDULE_JSON, ADVANCED_SCHEDULE, TIME_WINDOWS, EXCLUSIONS,
      DAYS_OF_WEEK, DAYS_OF_MONTH, MONTHS);

  private static final ImmutableList<String> SCHEDULE_KEYS = ImmutableList.<String>builder()
      .addAll(CronComponents.KEYS)
      .add(CRON_EXPRESSION, SCHEDULE_EXPRESSION, EXPRESSION, FREQUENCY)
      .addAll(ADVANCED_MARKERS)
      .build();

  private static final Pattern EVERY = Pattern.compile(
      "(?:every\\s+)?(\\d+)?\\s*(minute|hour|day|week|month|year)s?");

  private static final ImmutableList<DateTimeFormatter> DATE_TIME_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.US),
      DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss", Locale.US));

  private static final ImmutableList<DateTimeFormatter> DATE_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.US));

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults();

  private static final long EPOCH_MILLIS_THRESHOLD = 10_000_000_000L;

  private ScheduleParser() {
    throw new UnsupportedOperationException();
  }

  /**
   * Resolve a raw schedule, or nothing if it is not an object or carries none of the fields that
   * define a schedule.
   */
  public static Optional<ScheduleSpec> parse(@Nullable JsonNode raw) {
    if (raw == null || !raw.isObject() || raw.size() == 0) {
      return Optional.empty();
    }
    if (SCHEDULE_KEYS.stream().noneMatch(key -> field(raw, key).isPresent())) {
      LOG.debug("Not a schedule, no schedule fields in {}", raw);
      return Optional.empty();
    }
    final ScheduleKind kind = determineScheduleKind(raw);
    switch (kind) {
      case CRON:
        return Optional.of(parseCron(raw));
      case SIMPLE:
        return Optional.of(parseSimple(raw));
      case ADVANCED:
        return Optional.of(parseAdvanced(raw));
      default:
        throw new AssertionError("unknown schedule kind " + kind);
    }
  }

  /**
   * Classify a raw schedule. Anything with a cron expression, or with cron fields that a time of
   * day on some weekdays cannot express, is {@link ScheduleKind#CRON}. Plain fields and known
   * keywords are {@link ScheduleKind#SIMPLE}. Everything else is {@link ScheduleKind#ADVANCED}.
   */
  public static ScheduleKind determineScheduleKind(@Nullable JsonNode raw) {
    if (raw == null || !raw.isObject()) {
      return ScheduleKind.SIMPLE;
    }
    if (nonBlankText(raw, CRON_EXPRESSION).isPresent()) {
      return ScheduleKind.CRON;
    }
    final Optional<String> expression = expression(raw);
    if (expression.filter(CronComponents::looksLikeCron).isPresent()) {
      return ScheduleKind.CRON;
    }
    if (CronComponents.hasComponents(raw) && CronComponents.fromFields(raw).nonTrivial()) {
      return ScheduleKind.CRON;
    }
    if (ADVANCED_MARKERS.stream().anyMatch(key -> field(raw, key).isPresent())) {
      return ScheduleKind.ADVANCED;
    }
    if (expression.isPresent() && keyword(expression.get()).isEmpty()) {
      return ScheduleKind.ADVANCED;
    }
    return ScheduleKind.SIMPLE;
  }

  private static Optional<String> expression(JsonNode raw) {
    return firstField(raw, SCHEDULE_EXPRESSION, EXPRESSION)
        .filter(JsonNode::isValueNode)
        .map(JsonNode::asText);
  }

  private static ScheduleSpec parseCron(JsonNode raw) {
    final String expression = nonBlankText(raw, CRON_EXPRESSION)
        .or(() -> expression(raw).filter(CronComponents::looksLikeCron))
        .map(String::trim)
        .orElseGet(() -> CronComponents.fromFields(raw).expression());

    final ScheduleSpec.Builder builder = common(raw)
        .scheduleKind(ScheduleKind.CRON);

    final Optional<CronComponents> parsed = CronComponents.parseExpression(expression);
    if (parsed.isEmpty()) {
      LOG.debug("Keeping unparseable cron expression {} as is", expression);
      return builder
          .cronExpression(expression)
          .frequency(ScheduleFrequency.CUSTOM_CRON)
          .build();
    }

    final CronComponents cron = parsed.get();
    builder.cronExpression(cron.expression());
    final Optional<Integer> hour = plainNumber(cron.hour(), 0, 23);
    final Optional<Integer> minute = plainNumber(cron.minute(), 0, 59);
    hour.ifPresent(builder::hour);
    minute.ifPresent(builder::minute);

    final List<Integer> days = CronComponents.isWildcard(cron.dayOfWeek())
        ? ImmutableList.of()
        : values(LIST_SPLITTER.splitToList(cron.dayOfWeek()),
            day -> CalendarNames.dayOfWeek(day, cron.quartz()));
    final List<Integer> daysOfMonth = CronComponents.isWildcard(cron.dayOfMonth())
        ? ImmutableList.of()
        : values(LIST_SPLITTER.splitToList(cron.dayOfMonth()), day -> plainNumber(day, 1, 31));
    final List<Integer> months = CronComponents.isWildcard(cron.month())
        ? ImmutableList.of()
        : values(LIST_SPLITTER.splitToList(cron.month()), CalendarNames::month);
    builder.dayOfWeek(days).dayOfMonth(daysOfMonth).month(months);

    return builder
        .frequency(cronFrequency(cron, hour.isPresent(), minute.isPresent()))
        .build();
  }

  private static ScheduleFrequency cronFrequency(CronComponents cron, boolean plainHour,
      boolean plainMinute) {
    final boolean anyYear = cron.year().map(CronComponents::isWildcard).orElse(true);
    final boolean anySecond = cron.second()
        .map(second -> CronComponents.isWildcard(second) || "0".equals(second))
        .orElse(true);
    final boolean anyDom = CronComponents.isWildcard(cron.dayOfMonth());
    final boolean anyMonth = CronComponents.isWildcard(cron.month());
    final boolean anyDow = CronComponents.isWildcard(cron.dayOfWeek());
    if (!anyYear || !anySecond || !plainMinute) {
      return ScheduleFrequency.CUSTOM_CRON;
    }
    final boolean anyHour = CronComponents.isWildcard(cron.hour());
    if (anyHour && anyDom && anyMonth && anyDow) {
      return ScheduleFrequency.HOURLY;
    }
    if (!plainHour) {
      return ScheduleFrequency.CUSTOM_CRON;
    }
    if (anyDom && anyMonth && anyDow) {
      return ScheduleFrequency.DAILY;
    }
    if (!anyDow && anyDom && anyMonth && CronComponents.isPlainDayList(cron.dayOfWeek())) {
      return ScheduleFrequency.WEEKLY;
    }
    if (anyDow && !anyDom && anyMonth && isPlainList(cron.dayOfMonth())) {
      return ScheduleFrequency.MONTHLY;
    }
    if (anyDow && !anyDom && !anyMonth
        && isPlainList(cron.dayOfMonth()) && isPlainList(cron.month())) {
      return ScheduleFrequency.YEARLY;
    }
    return ScheduleFrequency.CUSTOM_CRON;
  }

  private static boolean isPlainList(String token) {
    return LIST_SPLITTER.splitToList(token).stream()
        .allMatch(value -> CronComponents.isNumber(value) || CalendarNames.month(value).isPresent());
  }

  private static ScheduleSpec parseSimple(JsonNode raw) {
    final ScheduleSpec.Builder builder = common(raw).scheduleKind(ScheduleKind.SIMPLE);

    final Optional<Integer> hour = field(raw, CronComponents.HOUR)
        .flatMap(JsonFields::toInteger)
        .filter(value -> value >= 0 && value <= 23);
    final Optional<Integer> minute = field(raw, CronComponents.MINUTE)
        .flatMap(JsonFields::toInteger)
        .filter(value -> value >= 0 && value <= 59);
    hour.ifPresent(builder::hour);
    minute.ifPresent(builder::minute);

    final boolean quartz = field(raw, CronComponents.SECOND).isPresent()
        || field(raw, CronComponents.YEAR).isPresent();
    final List<Integer> days = field(raw, CronComponents.DAY_OF_WEEK)
        .map(value -> values(tokens(value), day -> CalendarNames.dayOfWeek(day, quartz)))
        .orElse(ImmutableList.of());
    builder.dayOfWeek(days);

    final Optional<String> expression = expression(raw);
    expression.ifPresent(builder::scheduleExpression);
    final Optional<Keyword> keyword = expression.flatMap(ScheduleParser::keyword);

    final ScheduleFrequency frequency = explicitFrequency(raw)
        .or(() -> keyword.map(Keyword::frequency))
        .orElseGet(() -> {
          if (!days.isEmpty()) {
            return ScheduleFrequency.WEEKLY;
          } else if (hour.isPresent()) {
            return ScheduleFrequency.DAILY;
          } else if (minute.isPresent()) {
            return ScheduleFrequency.HOURLY;
          } else if (CronComponents.hasComponents(raw)) {
            return ScheduleFrequency.MINUTELY;
          } else {
            return ScheduleFrequency.MANUAL;
          }
        });
    builder.frequency(frequency);

    if (interval(raw).isEmpty()) {
      keyword.map(Keyword::interval).ifPresent(builder::interval);
    }
    return builder.build();
  }

  private static ScheduleSpec parseAdvanced(JsonNode raw) {
    final JsonNode body = advancedBody(raw);
    final ScheduleSpec.Builder builder = common(raw)
        .scheduleKind(ScheduleKind.ADVANCED)
        .advancedSource((ObjectNode) raw);

    if (field(raw, TIMEZONE).isEmpty()) {
      nonBlankText(body, TIMEZONE).ifPresent(builder::timezone);
    }
    if (interval(raw).isEmpty()) {
      integer(body, INTERVAL).filter(value -> value >= 1).ifPresent(builder::interval);
    }
    final Optional<Integer> hour = integer(body, CronComponents.HOUR)
        .filter(value -> value >= 0 && value <= 23);
    final Optional<Integer> minute = integer(body, CronComponents.MINUTE)
        .filter(value -> value >= 0 && value <= 59);
    hour.ifPresent(builder::hour);
    minute.ifPresent(builder::minute);

    final List<Integer> days = firstField(body, DAYS_OF_WEEK, CronComponents.DAY_OF_WEEK)
        .map(value -> values(tokens(value), day -> CalendarNames.dayOfWeek(day, false)))
        .orElse(ImmutableList.of());
    final List<Integer> daysOfMonth = firstField(body, DAYS_OF_MONTH, CronComponents.DAY_OF_MONTH)
        .map(value -> values(tokens(value), day -> plainNumber(day, 1, 31)))
        .orElse(ImmutableList.of());
    final List<Integer> months = firstField(body, MONTHS, CronComponents.MONTH)
        .map(value -> values(tokens(value), CalendarNames::month))
        .orElse(ImmutableList.of());
    builder.dayOfWeek(days).dayOfMonth(daysOfMonth).month(months);

    final ScheduleFrequency frequency = explicitFrequency(raw)
        .or(() -> explicitFrequency(body))
        .orElseGet(() -> {
          if (!days.isEmpty()) {
            return ScheduleFrequency.WEEKLY;
          } else if (!daysOfMonth.isEmpty() && months.isEmpty()) {
            return ScheduleFrequency.MONTHLY;
          } else if (!daysOfMonth.isEmpty()) {
            return ScheduleFrequency.YEARLY;
          } else if (hour.isPresent()) {
            return ScheduleFrequency.DAILY;
          } else if (minute.isPresent()) {
            return ScheduleFrequency.HOURLY;
          } else {
            return ScheduleFrequency.CUSTOM_CRON;
          }
        });
    return builder.frequency(frequency).build();
  }

  private static JsonNode advancedBody(JsonNode raw) {
    final Optional<JsonNode> embedded = firstField(raw, ADVANCED_SCHEDULE_JSON, ADVANCED_SCHEDULE);
    if (embedded.isEmpty()) {
      return raw;
    }
    final JsonNode value = embedded.get();
    if (value.isObject()) {
      return value;
    }
    if (value.isTextual()) {
      try {
        final JsonNode parsed = Json.OBJECT_MAPPER.readTree(value.asText());
        if (parsed != null && parsed.isObject()) {
          return parsed;
        }
      } catch (JsonProcessingException e) {
        LOG.debug("Advanced schedule is not valid JSON: {}", value.asText(), e);
      }
    }
    return raw;
  }

  /**
   * Fields shared by all schedule kinds: interval, timezone, start date and active flag.
   */
  private static ScheduleSpec.Builder common(JsonNode raw) {
    final ScheduleSpec.Builder builder = ScheduleSpec.builder()
        .interval(interval(raw).orElse(1))
        .active(JsonFields.bool(raw, IS_ACTIVE, true));
    nonBlankText(raw, TIMEZONE).map(String::trim).ifPresent(builder::timezone);
    firstField(raw, SCHEDULE_START_DATE, START_DATE)
        .flatMap(ScheduleParser::startDate)
        .ifPresent(builder::startDate);
    return builder;
  }

  private static Optional<Integer> interval(JsonNode raw) {
    return integer(raw, INTERVAL).filter(value -> value >= 1);
  }

  private static Optional<ScheduleFrequency> explicitFrequency(JsonNode raw) {
    return nonBlankText(raw, FREQUENCY).flatMap(ScheduleFrequency::fromName);
  }

  static Optional<LocalDateTime> startDate(JsonNode value) {
    if (value.isNumber()) {
      final long epoch = value.longValue();
      final Instant instant = epoch > EPOCH_MILLIS_THRESHOLD
          ? Instant.ofEpochMilli(epoch)
          : Instant.ofEpochSecond(epoch);
      return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }
    if (!value.isTextual() || value.asText().isBlank()) {
      return Optional.empty();
    }
    final String text = value.asText().trim();
    final Optional<LocalDateTime> offsetDateTime = parseOffsetDateTime(text);
    if (offsetDateTime.isPresent()) {
      return offsetDateTime;
    }
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      final Optional<LocalDateTime> dateTime = parseDateTime(text, format);
      if (dateTime.isPresent()) {
        return dateTime;
      }
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      final Optional<LocalDateTime> date = parseDate(text, format);
      if (date.isPresent()) {
        return date;
      }
    }
    LOG.debug("Ignoring unparseable start date {}", text);
    return Optional.empty();
  }

  private static Optional<LocalDateTime> parseOffsetDateTime(String text) {
    try {
      return Optional.of(OffsetDateTime.parse(text)
          .withOffsetSameInstant(ZoneOffset.UTC)
          .toLocalDateTime());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<LocalDateTime> parseDateTime(String text, DateTimeFormatter format) {
    try {
      return Optional.of(LocalDateTime.parse(text, format));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<LocalDateTime> parseDate(String text, DateTimeFormatter format) {
    try {
      return Optional.of(LocalDate.parse(text, format).atStartOfDay());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<Integer> plainNumber(String token, int min, int max) {
    if (!CronComponents.isNumber(token)) {
      return Optional.empty();
    }
    return Optional.ofNullable(Ints.tryParse(token))
        .filter(value -> value >= min && value <= max);
  }

  /**
   * Resolve each token, dropping those that do not resolve, in ascending order without
   * duplicates.
   */
  private static List<Integer> values(List<String> tokens,
      Function<String, Optional<Integer>> resolver) {
    return tokens.stream()
        .map(resolver)
        .flatMap(Optional::stream)
        .distinct()
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Match a keyword expression: {@code MANUAL}, {@code ONCE}, {@code @daily},
   * {@code every 2 hours} and the like.
   */
  static Optional<Keyword> keyword(String expression) {
    final String normalized = expression.trim().toLowerCase(Locale.US);
    switch (normalized) {
      case "":
      case "manual":
      case "none":
        return Optional.of(new Keyword(ScheduleFrequency.MANUAL, 1));
      case "once":
      case "run_once":
        return Optional.of(new Keyword(ScheduleFrequency.ONCE, 1));
      case "@hourly":
        return Optional.of(new Keyword(ScheduleFrequency.HOURLY, 1));
      case "@daily":
        return Optional.of(new Keyword(ScheduleFrequency.DAILY, 1));
      case "@weekly":
        return Optional.of(new Keyword(ScheduleFrequency.WEEKLY, 1));
      case "@monthly":
        return Optional.of(new Keyword(ScheduleFrequency.MONTHLY, 1));
      case "@yearly":
      case "@annually":
      case "annually":
        return Optional.of(new Keyword(ScheduleFrequency.YEARLY, 1));
      case "minutely":
        return Optional.of(new Keyword(ScheduleFrequency.MINUTELY, 1));
      case "hourly":
        return Optional.of(new Keyword(ScheduleFrequency.HOURLY, 1));
      case "daily":
        return Optional.of(new Keyword(ScheduleFrequency.DAILY, 1));
      case "weekly":
        return Optional.of(new Keyword(ScheduleFrequency.WEEKLY, 1));
      case "monthly":
        return Optional.of(new Keyword(ScheduleFrequency.MONTHLY, 1));
      case "yearly":
        return Optional.of(new Keyword(ScheduleFrequency.YEARLY, 1));
      default:
        break;
    }
    final Matcher matcher = EVERY.matcher(normalized);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    final Integer interval = matcher.group(1) == null
        ? Integer.valueOf(1)
        : Ints.tryParse(matcher.group(1));
    if (interval == null || interval < 1) {
      return Optional.empty();
    }
    final ScheduleFrequency frequency;
    switch (matcher.group(2)) {
      case "minute":
        frequency = ScheduleFrequency.MINUTELY;
        break;
      case "hour":
        frequency = ScheduleFrequency.HOURLY;
        break;
      case "day":
        frequency = ScheduleFrequency.DAILY;
        break;
      case "week":
        frequency = ScheduleFrequency.WEEKLY;
        break;
      case "month":
        frequency = ScheduleFrequency.MONTHLY;
        break;
      default:
        frequency = ScheduleFrequency.YEARLY;
        break;
    }
    return Optional.of(new Keyword(frequency, interval));
  }

  static final class Keyword {

    private final ScheduleFrequency frequency;
    private final int interval;

    Keyword(ScheduleFrequency frequency, int interval) {
      this.frequency = frequency;
      this.interval = interval;
    }

    ScheduleFrequency frequency() {
      return frequency;
    }

    int interval() {
      return interval;
    }
  }
}
