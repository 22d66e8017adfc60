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

import com.google.common.base.Enums;
import java.util.Locale;
import java.util.Optional;

public enum ScheduleFrequency {
  MANUAL,
  ONCE,
  MINUTELY,
  HOURLY,
  DAILY,
  WEEKLY,
  MONTHLY,
  YEARLY,
  CUSTOM_CRON;

  public static Optional<ScheduleFrequency> fromName(String name) {
    return Enums.getIfPresent(ScheduleFrequency.class, name.trim().toUpperCase(Locale.US))
        .toJavaUtil();
  }
}
