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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.Optional;

@AutoValue
public abstract class SqlParameters {

  /**
   * JDBC url.
   */
  @JsonProperty
  public abstract String connection();

  @JsonProperty
  public abstract Optional<String> user();

  @JsonProperty
  public abstract Optional<String> password();

  /**
   * A query returning (timestamp, text) rows. An optional {@code ?} is bound to the checkpoint.
   */
  @JsonProperty
  public abstract String query();

  /**
   * Advance to the newest row timestamp instead of the query start time.
   */
  @JsonProperty
  public abstract boolean continual();

  @JsonCreator
  public static SqlParameters create(
      @JsonProperty("connection") @JsonAlias("url") String connection,
      @JsonProperty("user") String user,
      @JsonProperty("password") String password,
      @JsonProperty("query") String query,
      @JsonProperty("continual") Boolean continual) {
    if (connection == null || connection.isBlank()) {
      throw new IllegalArgumentException("connection is required");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query is required");
    }
    return new AutoValue_SqlParameters(
        connection,
        Optional.ofNullable(user),
        Optional.ofNullable(password),
        query,
        Boolean.TRUE.equals(continual));
  }

  @Override
  public String toString() {
    return "SqlParameters{connection=" + connection() + ", user=" + user() + ", query=" + query()
           + ", continual=" + continual() + "}";
  }
}
