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

import static com.spotify.triggers.testdata.TestData.json;
import static com.spotify.triggers.testdata.TestData.object;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Optional;
import org.junit.Test;

public class TriggerConditionTest {

  private static final String TIME_WINDOW = "{\"type\": \"TIME_WINDOW\", "
      + "\"parameters\": {\"start\": \"08:00\", \"end\": \"18:00\"}, \"priority\": 2}";

  @Test
  public void shouldParseCondition() {
    final TriggerCondition condition = TriggerCondition.fromJson(json(TIME_WINDOW));

    assertThat(condition.type(), is("TIME_WINDOW"));
    assertThat(condition.parameters(), is(json("{\"start\": \"08:00\", \"end\": \"18:00\"}")));
    assertThat(condition.extraFields(), is(json("{\"priority\": 2}")));
  }

  @Test
  public void shouldLookUpParameters() {
    final TriggerCondition condition = TriggerCondition.fromJson(json(TIME_WINDOW));

    assertThat(condition.parameter("start"), is(Optional.of(TextNode.valueOf("08:00"))));
    assertThat(condition.parameter("priority"), is(Optional.of(json("2"))));
    assertThat(condition.parameter("missing"), is(Optional.empty()));
  }

  @Test
  public void shouldDefaultToEmptyParameters() {
    final TriggerCondition condition = TriggerCondition.fromJson(json("{\"type\": \"ALWAYS\"}"));

    assertThat(condition.parameters(), is(json("{}")));
    assertThat(condition.toJson(), is(json("{\"type\": \"ALWAYS\", \"parameters\": {}}")));
  }

  @Test
  public void shouldWriteConditionBack() {
    assertThat(TriggerCondition.fromJson(json(TIME_WINDOW)).toJson(), is(json(TIME_WINDOW)));
  }

  @Test
  public void shouldKeepParametersThatAreNotAnObject() {
    final String raw = "{\"type\": \"CUSTOM\", \"parameters\": [1, 2]}";
    final TriggerCondition condition = TriggerCondition.fromJson(json(raw));

    assertThat(condition.parameters(), is(json("{}")));
    assertThat(condition.toJson(), is(json(raw)));
  }

  @Test
  public void shouldExportWithDescription() {
    final TriggerCondition condition = TriggerCondition.of("ALWAYS", object("{\"a\": 1}"));

    assertThat(condition.humanReadableDescription(), is("Condition: ALWAYS"));
    assertThat(condition.exportJson(), is(json("{\"type\": \"ALWAYS\", \"parameters\": {\"a\": 1}, "
        + "\"humanReadable\": \"Condition: ALWAYS\"}")));
  }

  @Test
  public void shouldCompareByContent() {
    assertThat(TriggerCondition.fromJson(json(TIME_WINDOW)),
        is(TriggerCondition.fromJson(json(TIME_WINDOW))));
  }

  @Test
  public void shouldRequireType() {
    assertThrows(MissingDiscriminantException.class,
        () -> TriggerCondition.fromJson(json("{\"parameters\": {}}")));
  }
}
