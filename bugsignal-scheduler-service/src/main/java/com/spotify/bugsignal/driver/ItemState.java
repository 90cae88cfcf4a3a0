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
import com.google.common.collect.ImmutableSortedSet;
import java.time.Instant;
import java.util.Set;

/**
 * The observed state of one tracked filesystem item.
 */
@AutoValue
public abstract class ItemState {

  public enum Type {
    FILE,
    DIRECTORY
  }

  public abstract Type type();

  public abstract Instant modified();

  /**
   * Member file names relative to the directory. Empty for files.
   */
  public abstract ImmutableSortedSet<String> members();

  public static ItemState file(Instant modified) {
    return new AutoValue_ItemState(Type.FILE, modified, ImmutableSortedSet.of());
  }

  public static ItemState directory(Instant modified, Set<String> members) {
    return new AutoValue_ItemState(Type.DIRECTORY, modified, ImmutableSortedSet.copyOf(members));
  }
}
