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
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The pending jobs, sorted by name, and the number of live listeners.
 */
@AutoValue
public abstract class JobState {

  @JsonProperty
  public abstract ImmutableList<JobSnapshot> jobs();

  @JsonProperty
  public abstract int liveListeners();

  @JsonCreator
  public static JobState create(
      @JsonProperty("jobs") List<JobSnapshot> jobs,
      @JsonProperty("liveListeners") int liveListeners) {
    return new AutoValue_JobState(ImmutableList.copyOf(jobs), liveListeners);
  }
}
