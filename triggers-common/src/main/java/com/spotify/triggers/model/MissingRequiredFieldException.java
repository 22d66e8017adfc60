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

import java.util.Objects;
import javax.annotation.Nullable;

public class MissingRequiredFieldException extends InvalidConfigurationException {

  private final String field;

  public MissingRequiredFieldException(String path, String field) {
    this(path, field, null, null);
  }

  private MissingRequiredFieldException(String path, String field, @Nullable String parent,
      @Nullable Throwable cause) {
    super(path, "missing required field '" + field + "'", parent, cause);
    this.field = Objects.requireNonNull(field);
  }

  public String field() {
    return field;
  }

  @Override
  public MissingRequiredFieldException withParent(String parent) {
    return new MissingRequiredFieldException(path(), field, parent, this);
  }
}
