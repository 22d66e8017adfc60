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

import static com.spotify.triggers.testdata.TestData.json;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class ScheduleSerializerTest {

  private Object[] schedules() {
    return new Object[]{
        new Object[]{"{\"cronExpression\": \"0 2 * * 6\", \"timezone\": \"Europe/Stockholm\"}"},
        new Object[]{"{\"cronExpression\": \"0 0 12 ? * MON,WED\"}"},
        new Object[]{"{\"second\": \"0\", \"minute\": \"*/5\", \"hour\": \"9-17\"}"},
        new Object[]{"{\"cronExpression\": \"not a cron\"}"},
        new Object[]{"{\"hour\": \"9\", \"minute\": \"0\", \"dayOfWeek\": \"*\"}"},
        new Object[]{"{\"hour\": 2, \"minute\": 0, \"dayOfWeek\": [\"SAT\"], \"isActive\": false}"},
        new Object[]{"{\"second\": \"0\", \"hour\": \"9\", \"dayOfWeek\": \"2\"}"},
        new Object[]{"{\"frequency\": \"DAILY\", \"minute\": \"30\"}"},
        new Object[]{"{\"frequency\": \"MONTHLY\"}"},
        new Object[]{"{\"scheduleExpression\": \"every 2 hours\", \"minute\": 10}"},
        new Object[]{"{\"scheduleExpression\": \"ONCE\", \"startDate\": \"03/01/2024 10:15:30\"}"},
        new Object[]{"{\"scheduleExpression\": \"MANUAL\", \"interval\": 3}"},
        new Object[]{"{\"advancedScheduleJson\": \"{\\\"daysOfWeek\\\": [1, 3]}\", "
            + "\"timezone\": \"UTC\"}"},
        new Object[]{"{\"timeWindows\": [{\"start\": \"09:00\", \"end\": \"17:00\"}], "
            + "\"isActive\": false}"},
    };
  }

  @Test
  @Parameters(method = "schedules")
  public void shouldRoundTrip(String raw) {
    final ScheduleSpec spec = ScheduleSpec.fromJson(json(raw)).orElseThrow();

    assertThat(ScheduleSpec.fromJson(spec.toJson()).orElseThrow(), is(spec));
  }

  @Test
  public void shouldWriteCronScheduleAsExpression() {
    final ScheduleSpec spec = parse("{\"minute\": \"0\", \"hour\": \"12\", \"dayOfMonth\": \"1\"}");

    assertThat(spec.toJson(), is(json("{\"cronExpression\": \"0 0 12 1 * *\"}")));
  }

  @Test
  public void shouldOmitInferredFrequency() {
    final ScheduleSpec spec = parse("{\"frequency\": \"DAILY\", \"hour\": 9, \"minute\": 5}");

    assertThat(spec.toJson(), is(json("{\"hour\": \"9\", \"minute\": \"5\"}")));
  }

  @Test
  public void shouldWriteFrequencyThatWouldNotBeInferred() {
    final ScheduleSpec spec = parse("{\"frequency\": \"DAILY\", \"minute\": 30}");

    assertThat(spec.toJson(), is(json("{\"minute\": \"30\", \"frequency\": \"DAILY\"}")));
  }

  @Test
  public void shouldWriteDaysAsNames() {
    final ScheduleSpec spec = parse("{\"hour\": 8, \"dayOfWeek\": [5, 1], \"interval\": 2}");

    assertThat(spec.toJson(),
        is(json("{\"hour\": \"8\", \"dayOfWeek\": \"MON,FRI\", \"interval\": 2}")));
  }

  @Test
  public void shouldWriteMetadata() {
    final ScheduleSpec spec = parse("{\"scheduleExpression\": \"ONCE\", "
        + "\"startDate\": 1709288130, \"timezone\": \"UTC\", \"isActive\": false}");

    assertThat(spec.toJson(), is(json("{\"scheduleExpression\": \"ONCE\", "
        + "\"scheduleStartDate\": \"2024-03-01T10:15:30\", \"timezone\": \"UTC\", "
        + "\"isActive\": false}")));
  }

  @Test
  public void shouldWriteAdvancedPayloadBack() {
    final String raw = "{\"timeWindows\": [{\"start\": \"09:00\"}], \"note\": \"kept\"}";

    assertThat(parse(raw).toJson(), is(json(raw)));
  }

  @Test
  public void shouldWriteAdvancedScheduleWithoutPayload() {
    final ScheduleSpec spec = ScheduleSpec.builder()
        .scheduleKind(ScheduleKind.ADVANCED)
        .frequency(ScheduleFrequency.WEEKLY)
        .dayOfWeek(List.of(1))
        .hour(6)
        .build();

    assertThat(spec.toJson(), is(json("{\"advancedScheduleJson\": "
        + "{\"frequency\": \"WEEKLY\", \"hour\": 6, \"daysOfWeek\": [1]}}")));
  }

  @Test
  public void shouldExportEveryField() {
    final ObjectNode export = parse("{\"cronExpression\": \"0 2 * * 6\"}").exportJson();

    assertThat(export, is(json("{"
        + "\"scheduleKind\": \"CRON\", \"frequency\": \"WEEKLY\", \"interval\": 1, "
        + "\"hour\": 2, \"minute\": 0, \"dayOfWeek\": [6], \"dayOfMonth\": [], \"month\": [], "
        + "\"timezone\": null, \"cronExpression\": \"0 2 * * 6\", \"scheduleExpression\": null, "
        + "\"scheduleStartDate\": null, \"isActive\": true, "
        + "\"humanReadable\": \"Custom schedule: 0 2 * * 6\"}")));
  }

  @Test
  public void shouldExportIdempotently() {
    final ScheduleSpec spec = parse("{\"hour\": 9, \"timezone\": \"UTC\"}");

    assertThat(spec.exportJson(), is(spec.exportJson()));
  }

  private static ScheduleSpec parse(String raw) {
    return ScheduleSpec.fromJson(json(raw)).orElseThrow();
  }
}
