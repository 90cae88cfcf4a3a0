/*-
 * -\-\-
 * BugSignal Scheduler Service
 * --
 * Copyright (C) 2024 Spotify AB
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
package com.spotify.bugsignal.driver;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

@AutoValue
public abstract class FilesystemParameters {

  @JsonProperty
  public abstract ImmutableList<String> paths();

  /**
   * Glob selecting the files tracked below directory roots.
   */
  @JsonProperty
  public abstract Optional<String> mask();

  @JsonProperty
  public abstract boolean singleMessage();

  @JsonCreator
  public static FilesystemParameters create(
      @JsonProperty("paths") @JsonAlias({"path", "filepaths", "folderpaths"}) List<String> paths,
      @JsonProperty("mask") String mask,
      @JsonProperty("singleMessage") @JsonAlias("single_message") Boolean singleMessage) {
    if (paths == null || paths.isEmpty()) {
      throw new IllegalArgumentException("paths must not be empty");
    }
    if (paths.stream().anyMatch(p -> p == null || p.isBlank())) {
      throw new IllegalArgumentException("paths must not contain blank entries");
    }
    return new AutoValue_FilesystemParameters(
        ImmutableList.copyOf(paths),
        Optional.ofNullable(mask).filter(m -> !m.isBlank()),
        Boolean.TRUE.equals(singleMessage));
  }
}
