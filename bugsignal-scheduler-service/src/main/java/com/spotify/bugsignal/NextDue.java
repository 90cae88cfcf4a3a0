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

import com.google.auto.value.AutoValue;
import java.time.Instant;

/**
 * The answer of a {@link CronSchedule}: whether the previously pending occurrence has elapsed,
 * and when the schedule is next due.
 */
@AutoValue
public abstract class NextDue {

  public abstract boolean expired();

  public abstract Instant when();

  public static NextDue create(boolean expired, Instant when) {
    return new AutoValue_NextDue(expired, when);
  }
}
