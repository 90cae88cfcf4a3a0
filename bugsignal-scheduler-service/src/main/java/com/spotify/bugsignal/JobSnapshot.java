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
package com.spotify.bugsignal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.time.Instant;

@AutoValue
public abstract class JobSnapshot {

  @JsonProperty
  public abstract String name();

  @JsonProperty
  public abstract JobKind kind();

  @JsonProperty
  public abstract Instant due();

  @JsonCreator
  public static JobSnapshot create(
      @JsonProperty("name") String name,
      @JsonProperty("kind") JobKind kind,
      @JsonProperty("due") Instant due) {
    return new AutoValue_JobSnapshot(name, kind, due);
  }

  static JobSnapshot of(Job job) {
    return create(job.name(), job.kind(), job.due());
  }
}
