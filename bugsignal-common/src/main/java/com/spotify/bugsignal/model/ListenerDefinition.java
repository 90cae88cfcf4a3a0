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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.time.Instant;
import java.util.Optional;

/**
 * A persisted listener configuration row.
 *
 * <p>The driver kind is kept as the raw persisted string and is only parsed into a
 * {@link DriverKind} when a listener is constructed from it, so that one bad row does not prevent
 * reading the others.
 */
@AutoValue
public abstract class ListenerDefinition {

  @JsonProperty
  public abstract int id();

  @JsonProperty
  public abstract String name();

  @JsonProperty
  public abstract String kind();

  /**
   * Driver parameters as a JSON object.
   */
  @JsonProperty
  public abstract String parameters();

  @JsonProperty
  public abstract Optional<String> schedule();

  @JsonProperty
  public abstract boolean active();

  @JsonProperty
  public abstract Instant created();

  @JsonProperty
  public abstract Instant updated();

  /**
   * Whether the two definitions would produce the same listener.
   */
  public boolean sameConfiguration(ListenerDefinition other) {
    return id() == other.id()
           && name().equals(other.name())
           && kind().equals(other.kind())
           && parameters().equals(other.parameters())
           && schedule().equals(other.schedule());
  }

  public String toKey() {
    return name() + "#" + id();
  }

  public abstract Builder toBuilder();

  public static Builder newBuilder() {
    return new AutoValue_ListenerDefinition.Builder()
        .parameters("{}")
        .active(true)
        .created(Instant.EPOCH)
        .updated(Instant.EPOCH);
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder id(int id);

    public abstract Builder name(String name);

    public abstract Builder kind(String kind);

    public abstract Builder parameters(String parameters);

    public abstract Builder schedule(String schedule);

    public abstract Builder schedule(Optional<String> schedule);

    public abstract Builder active(boolean active);

    public abstract Builder created(Instant created);

    public abstract Builder updated(Instant updated);

    public abstract ListenerDefinition build();
  }
}
