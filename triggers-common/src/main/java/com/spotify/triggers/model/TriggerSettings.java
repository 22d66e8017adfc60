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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.spotify.triggers.util.BasicTriggerSettingsValidator;
import com.spotify.triggers.util.JsonFields;
import com.spotify.triggers.util.TriggerModelConfig;
import java.lang.ref.WeakReference;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The trigger configuration of a dataflow.
 *
 * <p>Settings without triggers mean the dataflow only runs when executed manually. A dataflow
 * that never configured triggers has no settings at all, which callers represent as a missing
 * {@code TriggerSettings}.
 *
 * <p>The entity owning the settings may be given as parent. It is only referenced weakly and
 * only used to describe where a configuration error was found.
 */
public final class TriggerSettings implements Iterable<Trigger> {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerSettings.class);

  static final String TRIGGERS = "triggers";
  static final String ZONE_ID = "zoneId";
  static final String LOCALE = "locale";
  static final String SUMMARY = "summary";
  static final String STATS = "stats";
  static final String TOTAL_TRIGGERS = "totalTriggers";
  static final String SCHEDULE_TRIGGERS = "scheduleTriggers";
  static final String DATASET_TRIGGERS = "datasetTriggers";
  static final String WARNINGS = "warnings";

  private final ImmutableList<Trigger> triggers;
  private final String zoneId;
  private final String locale;
  private final ObjectNode raw;
  private final WeakReference<Object> parent;

  private TriggerSettings(List<Trigger> triggers, String zoneId, String locale, ObjectNode raw,
      @Nullable Object parent) {
    this.triggers = ImmutableList.copyOf(triggers);
    this.zoneId = Objects.requireNonNull(zoneId);
    this.locale = Objects.requireNonNull(locale);
    this.raw = Objects.requireNonNull(raw);
    this.parent = new WeakReference<>(parent);
  }

  public static TriggerSettings of(List<Trigger> triggers, String zoneId, String locale) {
    final TriggerSettings settings =
        new TriggerSettings(triggers, zoneId, locale, ModelJson.newObject(), null);
    return new TriggerSettings(triggers, zoneId, locale, settings.toJson(), null);
  }

  public static TriggerSettings fromJson(JsonNode raw) {
    return fromJson(raw, null);
  }

  public static TriggerSettings fromJson(JsonNode raw, @Nullable Object parent) {
    return fromJson(raw, parent, TriggerModelConfig.defaults());
  }

  /**
   * Parse trigger settings. Either the whole payload parses or nothing does.
   *
   * @param raw    the {@code triggerSettings} object
   * @param parent the entity owning the settings, named in errors
   * @param config defaults for fields missing in the payload
   * @throws InvalidConfigurationException naming the path of the first malformed element
   */
  public static TriggerSettings fromJson(JsonNode raw, @Nullable Object parent,
      TriggerModelConfig config) {
    try {
      return parse(raw, parent, config);
    } catch (InvalidConfigurationException e) {
      if (parent == null) {
        throw e;
      }
      throw e.withParent(String.valueOf(parent));
    }
  }

  private static TriggerSettings parse(JsonNode raw, @Nullable Object parent,
      TriggerModelConfig config) {
    if (raw == null || !raw.isObject()) {
      throw new InvalidConfigurationException(ModelJson.ROOT,
          "trigger settings are not an object");
    }
    final List<Trigger> triggers =
        ModelJson.parseArray(raw, TRIGGERS, ModelJson.ROOT, Trigger::parse);
    final String zoneId = JsonFields.nonBlankText(raw, ZONE_ID).orElse(config.defaultZoneId());
    final String locale = JsonFields.nonBlankText(raw, LOCALE).orElse(config.defaultLocale());
    final TriggerSettings settings =
        new TriggerSettings(triggers, zoneId, locale, ((ObjectNode) raw).deepCopy(), parent);
    final Set<Integer> duplicates = settings.duplicateTriggerIds();
    if (!duplicates.isEmpty()) {
      LOG.warn("Duplicate trigger ids {} in trigger settings of {}", duplicates,
          parent == null ? "unknown parent" : parent);
    }
    return settings;
  }

  public int size() {
    return triggers.size();
  }

  public boolean isEmpty() {
    return triggers.isEmpty();
  }

  /**
   * @throws IndexOutOfBoundsException if there is no trigger at the index
   */
  public Trigger get(int index) {
    checkElementIndex(index, triggers.size());
    return triggers.get(index);
  }

  @Override
  public Iterator<Trigger> iterator() {
    return triggers.iterator();
  }

  public Stream<Trigger> stream() {
    return triggers.stream();
  }

  public ImmutableList<Trigger> triggers() {
    return triggers;
  }

  public String zoneId() {
    return zoneId;
  }

  public String locale() {
    return locale;
  }

  /**
   * The first trigger with the given id.
   */
  public Optional<Trigger> triggerById(int triggerId) {
    return triggers.stream()
        .filter(trigger -> trigger.triggerId() == triggerId)
        .findFirst();
  }

  public List<Trigger> scheduleTriggers() {
    return filter(Trigger::hasScheduleEvent);
  }

  public List<Trigger> datasetTriggers() {
    return filter(Trigger::hasDatasetEvent);
  }

  public boolean hasAnySchedules() {
    return triggers.stream().anyMatch(Trigger::hasScheduleEvent);
  }

  public boolean hasAnyDatasetTriggers() {
    return triggers.stream().anyMatch(Trigger::hasDatasetEvent);
  }

  private List<Trigger> filter(Predicate<Trigger> predicate) {
    return triggers.stream()
        .filter(predicate)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Trigger ids used by more than one trigger. These are kept as they are; lookups by id return
   * the first of them.
   */
  public Set<Integer> duplicateTriggerIds() {
    final Multiset<Integer> ids = triggers.stream()
        .map(Trigger::triggerId)
        .collect(ImmutableMultiset.toImmutableMultiset());
    return ids.entrySet().stream()
        .filter(entry -> entry.getCount() > 1)
        .map(Multiset.Entry::getElement)
        .collect(ImmutableSet.toImmutableSet());
  }

  public List<String> validationWarnings() {
    return BasicTriggerSettingsValidator.INSTANCE.validate(this);
  }

  /**
   * New settings with the given triggers, keeping zone, locale, raw payload and parent.
   */
  public TriggerSettings withTriggers(List<Trigger> triggers) {
    return new TriggerSettings(triggers, zoneId, locale, raw, parent.get());
  }

  public Optional<Object> parent() {
    return Optional.ofNullable(parent.get());
  }

  /**
   * A copy of the payload these settings were parsed from.
   */
  public ObjectNode raw() {
    return raw.deepCopy();
  }

  /**
   * {@code {triggers, zoneId, locale}}, suitable for writing back to the API.
   */
  public ObjectNode toJson() {
    final ObjectNode json = ModelJson.newObject();
    final ArrayNode array = json.putArray(TRIGGERS);
    triggers.forEach(trigger -> array.add(trigger.toJson()));
    json.put(ZONE_ID, zoneId);
    json.put(LOCALE, locale);
    return json;
  }

  public ObjectNode exportJson() {
    return exportJson(UnaryOperator.identity());
  }

  /**
   * The full export: every trigger exported in full, a summary, statistics and validation
   * warnings if there are any.
   *
   * @param override given the default export, returns the export to use instead
   */
  public ObjectNode exportJson(UnaryOperator<ObjectNode> override) {
    final ObjectNode json = ModelJson.newObject();
    final ArrayNode array = json.putArray(TRIGGERS);
    triggers.forEach(trigger -> array.add(trigger.exportJson()));
    json.put(ZONE_ID, zoneId);
    json.put(LOCALE, locale);
    json.put(SUMMARY, humanReadableSummary());
    final ObjectNode stats = json.putObject(STATS);
    stats.put(TOTAL_TRIGGERS, size());
    stats.put(SCHEDULE_TRIGGERS, scheduleTriggers().size());
    stats.put(DATASET_TRIGGERS, datasetTriggers().size());
    final List<String> warnings = validationWarnings();
    if (!warnings.isEmpty()) {
      final ArrayNode warningsArray = json.putArray(WARNINGS);
      warnings.forEach(warningsArray::add);
    }
    return Objects.requireNonNull(override.apply(json), "export override returned null");
  }

  public String humanReadableSummary() {
    if (triggers.isEmpty()) {
      return "Triggers (0): none configured (manual execution only)";
    }
    return triggers.stream()
        .map(trigger -> "  • " + trigger.humanReadableDescription())
        .collect(Collectors.joining("\n", "Triggers (" + size() + "):\n", ""));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TriggerSettings that = (TriggerSettings) o;
    return triggers.equals(that.triggers)
           && zoneId.equals(that.zoneId)
           && locale.equals(that.locale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(triggers, zoneId, locale);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("triggers", triggers)
        .add("zoneId", zoneId)
        .add("locale", locale)
        .toString();
  }
}
