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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;

/**
 * A chat that can receive messages.
 */
@AutoValue
public abstract class Chat {

  public static final String PRIVATE = "private";

  @JsonProperty
  public abstract long id();

  @JsonProperty
  public abstract String name();

  @JsonProperty
  public abstract int role();

  @JsonProperty
  public abstract String type();

  @JsonProperty
  public abstract boolean active();

  public boolean hasRole(UserRole userRole) {
    return userRole.isSetIn(role());
  }

  public boolean isPrivate() {
    return PRIVATE.equals(type());
  }

  @JsonCreator
  public static Chat create(
      @JsonProperty("id") long id,
      @JsonProperty("name") String name,
      @JsonProperty("role") int role,
      @JsonProperty("type") String type,
      @JsonProperty("active") boolean active) {
    return new AutoValue_Chat(id, name, role, type, active);
  }
}
