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

import static java.util.Objects.requireNonNull;

import com.spotify.bugsignal.driver.FilesystemDriver;
import com.spotify.bugsignal.driver.FilesystemParameters;
import com.spotify.bugsignal.driver.SourceDriver;
import com.spotify.bugsignal.driver.SqlDriver;
import com.spotify.bugsignal.driver.SqlParameters;
import com.spotify.bugsignal.model.DriverKind;
import com.spotify.bugsignal.model.ListenerDefinition;
import com.spotify.bugsignal.util.Json;
import com.spotify.bugsignal.util.Time;
import java.io.IOException;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Builds runtime {@link Listener}s from persisted definitions.
 */
public class ListenerFactory {

  private final ZoneId zone;
  private final Time time;

  public ListenerFactory(ZoneId zone, Time time) {
    this.zone = requireNonNull(zone);
    this.time = requireNonNull(time);
  }

  /**
   * Construct a listener.
   *
   * @throws IllegalArgumentException if the kind, parameters or cron expression are invalid
   * @throws IOException if the driver failed to take its initial snapshot
   */
  public Listener create(ListenerDefinition definition) throws IOException {
    final Optional<CronSchedule> schedule = definition.schedule()
        .map(expression -> new CronSchedule(expression, zone, time));
    final SourceDriver<?> driver = driver(definition);
    return new Listener(definition, driver, schedule);
  }

  SourceDriver<?> driver(ListenerDefinition definition) throws IOException {
    final DriverKind kind = DriverKind.parse(definition.kind());
    switch (kind) {
      case FILESYSTEM:
        return new FilesystemDriver(
            Json.deserialize(definition.parameters(), FilesystemParameters.class), zone, time);
      case SQL:
        return new SqlDriver(definition.name(),
            Json.deserialize(definition.parameters(), SqlParameters.class), zone, time);
      default:
        throw new IllegalArgumentException("Unsupported driver kind: " + kind);
    }
  }
}
