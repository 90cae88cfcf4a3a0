/*-
 * -\-\-
 * BugSignal Common
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
package com.spotify.bugsignal.model;

import com.google.common.collect.ImmutableSet;
import java.util.Locale;

/**
 * The closed set of source driver kinds.
 */
public enum DriverKind {

  FILESYSTEM("filesystem", "FilesListener", "FoldersListener", "FileSystemListener"),
  SQL("sql", "SQLListener");

  private final ImmutableSet<String> names;

  DriverKind(String... names) {
    this.names = ImmutableSet.copyOf(names);
  }

  /**
   * Parses a persisted kind name. Matching is case insensitive.
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static DriverKind parse(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Driver kind missing");
    }
    final String trimmed = name.trim();
    for (DriverKind kind : values()) {
      if (kind.name().equalsIgnoreCase(trimmed)) {
        return kind;
      }
      for (String alias : kind.names) {
        if (alias.toLowerCase(Locale.ROOT).equals(trimmed.toLowerCase(Locale.ROOT))) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException("Unknown driver kind: " + name);
  }
}
