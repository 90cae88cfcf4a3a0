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
import com.google.common.collect.ImmutableSortedMap;
import java.time.Instant;
import java.util.Map;

@AutoValue
public abstract class FilesystemCheckpoint {

  /**
   * When the items were last observed.
   */
  public abstract Instant updated();

  /**
   * Tracked items keyed by path.
   */
  public abstract ImmutableSortedMap<String, ItemState> items();

  public static FilesystemCheckpoint of(Instant updated, Map<String, ItemState> items) {
    return new AutoValue_FilesystemCheckpoint(updated, ImmutableSortedMap.copyOf(items));
  }
}
