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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.spotify.triggers.util.JsonFields;

/**
 * Fires when a dataset is updated, or only when its data changes.
 */
@AutoValue
public abstract class DatasetUpdatedTriggerEvent extends TriggerEvent {

  public static final String TYPE = "DATASET_UPDATED";

  static final String DATASET_ID = "datasetId";
  static final String TRIGGER_ON_DATA_CHANGED = "triggerOnDataChanged";

  public abstract String datasetId();

  public abstract boolean triggerOnDataChanged();

  public static DatasetUpdatedTriggerEvent of(String datasetId, boolean triggerOnDataChanged) {
    return new AutoValue_DatasetUpdatedTriggerEvent(datasetId, triggerOnDataChanged);
  }

  static DatasetUpdatedTriggerEvent parse(JsonNode raw, String path) {
    final String datasetId = JsonFields.nonBlankText(raw, DATASET_ID)
        .orElseThrow(() -> new MissingRequiredFieldException(path, DATASET_ID));
    return of(datasetId, JsonFields.bool(raw, TRIGGER_ON_DATA_CHANGED, false));
  }

  @Override
  public TriggerEventType eventType() {
    return TriggerEventType.DATASET_UPDATED;
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String humanReadableDescription() {
    return String.format("Dataset %s updated (%s)", datasetId(),
        triggerOnDataChanged() ? "when data changes" : "on every update");
  }

  @Override
  public ObjectNode toJson() {
    final ObjectNode json = ModelJson.newObject();
    json.put(ModelJson.TYPE, TYPE);
    json.put(DATASET_ID, datasetId());
    json.put(TRIGGER_ON_DATA_CHANGED, triggerOnDataChanged());
    return json;
  }

  @Override
  public ObjectNode exportJson() {
    final ObjectNode json = toJson();
    json.put(ModelJson.HUMAN_READABLE, humanReadableDescription());
    return json;
  }

  @Override
  public <R> R accept(TriggerEventVisitor<R> visitor) {
    return visitor.datasetUpdated(this);
  }
}
