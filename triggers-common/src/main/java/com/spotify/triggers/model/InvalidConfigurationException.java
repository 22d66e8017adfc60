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
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A trigger settings payload that cannot be turned into a model. Names the JSON path of the
 * offending element and, when known, a description of the entity owning the settings.
 */
public class InvalidConfigurationException extends RuntimeException {

  private final String path;
  private final String detail;
  @Nullable private final String parent;

  public InvalidConfigurationException(String path, String detail) {
    this(path, detail, null, null);
  }

  protected InvalidConfigurationException(String path, String detail, @Nullable String parent,
      @Nullable Throwable cause) {
    super(message(path, detail, parent), cause);
    this.path = Objects.requireNonNull(path);
    this.detail = Objects.requireNonNull(detail);
    this.parent = parent;
  }

  private static String message(String path, String detail, @Nullable String parent) {
    return parent == null
        ? path + ": " + detail
        : path + ": " + detail + " (in " + parent + ")";
  }

  public String path() {
    return path;
  }

  public String detail() {
    return detail;
  }

  public Optional<String> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * A copy of this exception naming the given parent, with this exception as its cause.
   */
  public InvalidConfigurationException withParent(String parent) {
    return new InvalidConfigurationException(path, detail, parent, this);
  }
}
