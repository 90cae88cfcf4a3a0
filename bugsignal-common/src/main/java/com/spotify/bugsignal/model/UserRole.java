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

import java.util.EnumSet;
import java.util.Set;

/**
 * Role bit flags stored in a chat's role mask.
 */
public enum UserRole {

  BLOCKED(0),
  USER(1),
  MODERATOR(2),
  MASTER(4),
  DEVELOPER(8),
  WIZARD(16),
  PALLADIN(32),
  NECROMANCER(64);

  private final int bit;

  UserRole(int bit) {
    this.bit = bit;
  }

  public int bit() {
    return bit;
  }

  /**
   * A mask with no bits set is {@link #BLOCKED}.
   */
  public boolean isSetIn(int mask) {
    if (this == BLOCKED) {
      return mask == 0;
    }
    return (mask & bit) == bit;
  }

  public static int mask(UserRole... roles) {
    int mask = 0;
    for (UserRole role : roles) {
      mask |= role.bit;
    }
    return mask;
  }

  public static Set<UserRole> fromMask(int mask) {
    final Set<UserRole> roles = EnumSet.noneOf(UserRole.class);
    for (UserRole role : values()) {
      if (role.isSetIn(mask)) {
        roles.add(role);
      }
    }
    return roles;
  }
}
