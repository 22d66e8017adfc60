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

import javax.annotation.Nullable;

/**
 * An event or condition without the {@code type} field that selects its variant.
 */
public class MissingDiscriminantException extends InvalidConfigurationException {

  static final String DETAIL = "missing discriminant field '" + ModelJson.TYPE + "'";

  public MissingDiscriminantException(String path) {
    super(path, DETAIL);
  }

  private MissingDiscriminantException(String path, @Nullable String parent,
      @Nullable Throwable cause) {
    super(path, DETAIL, parent, cause);
  }

  @Override
  public MissingDiscriminantException withParent(String parent) {
    return new MissingDiscriminantException(path(), parent, this);
  }
}
