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

package com.spotify.triggers.testdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spotify.triggers.serialization.Json;
import java.io.UncheckedIOException;

public final class TestData {

  private TestData() {
  }

  public static final String DAILY_RUN =
      "{\"triggers\": [{\"triggerId\": 1, \"title\": \"Daily Run\", "
      + "\"triggerEvents\": [{\"type\": \"SCHEDULE\", "
      + "\"schedule\": {\"hour\": \"9\", \"minute\": \"0\", \"dayOfWeek\": \"*\"}}], "
      + "\"triggerConditions\": []}], \"zoneId\": \"UTC\", \"locale\": \"en_US\"}";

  public static final String NO_TRIGGERS =
      "{\"triggers\": [], \"zoneId\": \"UTC\", \"locale\": \"en_US\"}";

  public static final String DATASET_EVENT =
      "{\"type\": \"DATASET_UPDATED\", \"datasetId\": \"abc-123\", "
      + "\"triggerOnDataChanged\": true}";

  public static final String WEBHOOK_EVENT =
      "{\"type\": \"WEBHOOK\", \"url\": \"https://x\"}";

  /**
   * Three triggers: schedule only, dataset only, and both.
   */
  public static final String MIXED =
      "{\"triggers\": ["
      + "{\"triggerId\": 1, \"title\": \"Nightly\", \"triggerEvents\": ["
      + "  {\"type\": \"SCHEDULE\", \"scheduleId\": \"s-1\", "
      + "   \"schedule\": {\"cronExpression\": \"0 2 * * *\", \"timezone\": \"Europe/Stockholm\"}}"
      + "], \"triggerConditions\": []},"
      + "{\"triggerId\": 2, \"title\": \"On data\", \"triggerEvents\": ["
      + "  " + DATASET_EVENT
      + "], \"triggerConditions\": ["
      + "  {\"type\": \"TIME_WINDOW\", \"parameters\": {\"start\": \"08:00\", \"end\": \"18:00\"}}"
      + "]},"
      + "{\"triggerId\": 3, \"title\": \"Both\", \"triggerEvents\": ["
      + "  {\"type\": \"SCHEDULE\", \"schedule\": {\"hour\": 6, \"minute\": 30, "
      + "   \"dayOfWeek\": \"MON,FRI\"}},"
      + "  {\"type\": \"DATASET_UPDATED\", \"datasetId\": \"ds-9\"},"
      + "  " + WEBHOOK_EVENT
      + "]}"
      + "], \"zoneId\": \"America/New_York\", \"locale\": \"en_US\"}";

  public static JsonNode json(String json) {
    try {
      return Json.OBJECT_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static ObjectNode object(String json) {
    return (ObjectNode) json(json);
  }
}
