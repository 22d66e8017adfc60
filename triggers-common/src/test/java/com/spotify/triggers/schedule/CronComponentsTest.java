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

import java.util.Optional;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class CronComponentsTest {

  @Test
  public void shouldSplitUnixExpression() {
    final CronComponents cron = CronComponents.parseExpression(" 30  9 * * 1 ").orElseThrow();

    assertThat(cron.quartz(), is(false));
    assertThat(cron.minute(), is("30"));
    assertThat(cron.dayOfWeek(), is("1"));
    assertThat(cron.expression(), is("30 9 * * 1"));
  }

  @Test
  public void shouldSplitQuartzExpressionWithYear() {
    final CronComponents cron =
        CronComponents.parseExpression("0 15 10 ? * MON-FRI 2025").orElseThrow();

    assertThat(cron.quartz(), is(true));
    assertThat(cron.second(), is(Optional.of("0")));
    assertThat(cron.dayOfWeek(), is("MON-FRI"));
    assertThat(cron.year(), is(Optional.of("2025")));
  }

  @Test
  @Parameters({
      "0 9 * *",
      "0 1 2 3 4 5 6 7",
      "daily",
  })
  public void shouldNotSplitOtherExpressions(String expression) {
    assertThat(CronComponents.parseExpression(expression), is(Optional.empty()));
    assertThat(CronComponents.looksLikeCron(expression), is(false));
  }

  @Test
  public void shouldUnwrapExpression() {
    assertThat(CronComponents.unwrap("cron(0 9 * * *)"), is("0 9 * * *"));
    assertThat(CronComponents.unwrap(" CRON( 0 9 * * * ) "), is("0 9 * * *"));
    assertThat(CronComponents.unwrap("0 9 * * *"), is("0 9 * * *"));
  }

  @Test
  public void shouldJoinListComponents() {
    final CronComponents cron =
        CronComponents.fromFields(json("{\"hour\": [6, 18], \"dayOfWeek\": \"MON, WED\"}"));

    assertThat(cron.expression(), is("0 * 6,18 * * MON,WED"));
  }

  @Test
  @Parameters({
      "0 9 * * *, false",
      "0 9 * * 1, false",
      "0 0 9 * * *, false",
      "*/5 * * * *, true",
      "0 9-17 * * *, true",
      "0 9 1 * *, true",
      "0 9 * 6 *, true",
      "0 9 * * 1-5, true",
      "0 9 * * 5L, true",
      "30 0 9 * * *, true",
      "0 0 9 * * * 2025, true",
      "0 0 9 * * * *, false",
      "0 9 * * Funday, false",
      "0 9 * * 8, false",
  })
  public void shouldDetectNonTrivialComponents(String expression, boolean nonTrivial) {
    assertThat(CronComponents.parseExpression(expression).orElseThrow().nonTrivial(),
        is(nonTrivial));
  }

  @Test
  public void shouldRecognizeDayOfWeekSyntax() {
    assertThat(CronComponents.hasDayOfWeekSyntax("MON-FRI"), is(true));
    assertThat(CronComponents.hasDayOfWeekSyntax("*/2"), is(true));
    assertThat(CronComponents.hasDayOfWeekSyntax("MON#2"), is(true));
    assertThat(CronComponents.hasDayOfWeekSyntax("5L"), is(true));
    assertThat(CronComponents.hasDayOfWeekSyntax("WED,SAT"), is(false));
    assertThat(CronComponents.hasDayOfWeekSyntax("Funday"), is(false));
    assertThat(CronComponents.hasDayOfWeekSyntax("9"), is(false));
  }

  @Test
  public void shouldRecognizePlainDayLists() {
    assertThat(CronComponents.isPlainDayList("*"), is(true));
    assertThat(CronComponents.isPlainDayList("?"), is(true));
    assertThat(CronComponents.isPlainDayList("0,6"), is(true));
    assertThat(CronComponents.isPlainDayList("mon,Friday"), is(true));
    assertThat(CronComponents.isPlainDayList("L"), is(false));
    assertThat(CronComponents.isPlainDayList("8"), is(false));
    assertThat(CronComponents.isPlainDayList("MON#2"), is(false));
  }
}
