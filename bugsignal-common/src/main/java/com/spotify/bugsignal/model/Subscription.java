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

@AutoValue
public abstract class Subscription {

  @JsonProperty
  public abstract long chatId();

  @JsonProperty
  public abstract int listenerId();

  @JsonProperty
  public abstract boolean active();

  @JsonCreator
  public static Subscription create(
      @JsonProperty("chatId") long chatId,
      @JsonProperty("listenerId") int listenerId,
      @JsonProperty("active") boolean active) {
    return new AutoValue_Subscription(chatId, listenerId, active);
  }
}
