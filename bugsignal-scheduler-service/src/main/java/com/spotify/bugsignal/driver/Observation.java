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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The outcome of one successful observation: the messages produced and the checkpoint to advance to.
 */
@AutoValue
public abstract class Observation<C> {

  public abstract ImmutableList<String> messages();

  public abstract C checkpoint();

  public static <C> Observation<C> of(List<String> messages, C checkpoint) {
    return new AutoValue_Observation<>(ImmutableList.copyOf(messages), checkpoint);
  }
}
