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

import static java.util.Objects.requireNonNull;

import com.spotify.bugsignal.model.DriverKind;
import com.spotify.bugsignal.util.Time;
import com.spotify.bugsignal.util.TimeUtil;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a SQL query returning (timestamp, text) rows.
 *
 * <p>The checkpoint is an instant bound to the query's parameter, if it has one. A continual driver
 * advances it to the newest row timestamp seen, otherwise to the time the query was started.
 */
public class SqlDriver extends AbstractSourceDriver<Instant> {

  private static final Logger LOG = LoggerFactory.getLogger(SqlDriver.class);

  private static final int EXPECTED_COLUMNS = 2;

  private final String name;
  private final SqlParameters parameters;
  private final HikariDataSource dataSource;
  private final ZoneId zone;
  private final Time time;

  public SqlDriver(String name, SqlParameters parameters, ZoneId zone, Time time) {
    super(DriverKind.SQL, time.get());
    this.name = requireNonNull(name);
    this.parameters = requireNonNull(parameters);
    this.zone = requireNonNull(zone);
    this.time = requireNonNull(time);
    this.dataSource = new HikariDataSource(hikariConfig(name, parameters));
  }

  private static HikariConfig hikariConfig(String name, SqlParameters parameters) {
    final HikariConfig config = new HikariConfig();
    config.setJdbcUrl(parameters.connection());
    parameters.user().ifPresent(config::setUsername);
    parameters.password().ifPresent(config::setPassword);
    config.setPoolName("bugsignal-sql-" + name);
    config.setMaximumPoolSize(2);
    config.setMinimumIdle(0);
    // do not fail construction when the database is unreachable, the check will report it
    config.setInitializationFailTimeout(-1);
    return config;
  }

  @Override
  protected Observation<Instant> observe(Instant checkpoint) throws IOException {
    final Instant started = time.get();
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(parameters.query())) {
      if (statement.getParameterMetaData().getParameterCount() > 0) {
        statement.setTimestamp(1, Timestamp.from(checkpoint));
      }
      try (ResultSet rs = statement.executeQuery()) {
        final int columns = rs.getMetaData().getColumnCount();
        if (columns != EXPECTED_COLUMNS) {
          throw new IOException("Query of " + name + " returned " + columns + " columns, expected "
                                + EXPECTED_COLUMNS + " (timestamp, text)");
        }
        final List<String> messages = new ArrayList<>();
        Instant newest = checkpoint;
        while (rs.next()) {
          final Timestamp timestamp = rs.getTimestamp(1);
          final String text = rs.getString(2);
          if (timestamp == null) {
            messages.add(String.valueOf(text));
            continue;
          }
          final Instant at = timestamp.toInstant();
          messages.add("[" + TimeUtil.format(at, zone) + "] " + text);
          if (at.isAfter(newest)) {
            newest = at;
          }
        }
        return Observation.of(messages, parameters.continual() ? newest : started);
      }
    } catch (SQLException e) {
      throw new IOException("Query of " + name + " failed", e);
    }
  }

  @Override
  public synchronized void close() {
    if (dataSource.isClosed()) {
      return;
    }
    try {
      dataSource.close();
    } catch (RuntimeException e) {
      LOG.warn("Failed to close connection pool of {}", name, e);
    }
  }
}
