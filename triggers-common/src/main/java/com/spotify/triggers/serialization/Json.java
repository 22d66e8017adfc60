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

package com.spotify.triggers.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Throwables;
import com.spotify.triggers.model.Trigger;
import com.spotify.triggers.model.TriggerCondition;
import com.spotify.triggers.model.TriggerEvent;
import com.spotify.triggers.model.TriggerSettings;
import com.spotify.triggers.schedule.ScheduleSpec;
import com.spotify.triggers.util.TypeWrapperModule;
import java.io.IOException;
import okio.ByteString;

/**
 * The shared {@link ObjectMapper}. Model types are read and written in their minimal JSON form.
 */
public final class Json {

  private Json() {
  }

  static final TypeWrapperModule MODEL_MODULE = new TypeWrapperModule()
      .setupWrapping(
          TriggerSettings.class,
          TriggerSettings::toJson,
          TriggerSettings::fromJson)
      .setupWrapping(
          Trigger.class,
          Trigger::toJson,
          Trigger::fromJson)
      .setupWrapping(
          TriggerEvent.class,
          TriggerEvent::toJson,
          TriggerEvent::fromJson)
      .setupWrapping(
          TriggerCondition.class,
          TriggerCondition::toJson,
          TriggerCondition::fromJson)
      .setupWrapping(
          ScheduleSpec.class,
          ScheduleSpec::toJson,
          raw -> ScheduleSpec.fromJson(raw).orElse(null));

  public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .registerModule(MODEL_MODULE);

  public static ByteString serialize(Object value) {
    try {
      return ByteString.of(OBJECT_MAPPER.writeValueAsBytes(value));
    } catch (JsonProcessingException e) {
      throw Throwables.propagate(e);
    }
  }

  public static <T> T deserialize(ByteString json, Class<T> valueType) {
    try {
      return OBJECT_MAPPER.readValue(json.toByteArray(), valueType);
    } catch (IOException e) {
      throw Throwables.propagate(e);
    }
  }

  public static TriggerSettings deserializeTriggerSettings(ByteString json) {
    return deserialize(json, TriggerSettings.class);
  }
}
