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
package com.spotify.bugsignal.storage;

import static java.util.Objects.requireNonNull;

import com.spotify.bugsignal.model.Chat;
import com.spotify.bugsignal.model.ListenerDefinition;
import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only {@link Storage} over the {@code listener}, {@code chat} and {@code subscription}
 * tables.
 */
public class JdbcStorage implements Storage {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcStorage.class);

  private final DataSource dataSource;
  private final String prefix;
  private final Optional<Closeable> owner;

  public JdbcStorage(DataSource dataSource, Optional<String> schema) {
    this(dataSource, schema, Optional.empty());
  }

  /**
   * @param owner closed together with this storage, e.g. the connection pool behind the data source
   */
  public JdbcStorage(DataSource dataSource, Optional<String> schema, Optional<Closeable> owner) {
    this.dataSource = requireNonNull(dataSource);
    this.prefix = requireNonNull(schema).map(s -> s + ".").orElse("");
    this.owner = requireNonNull(owner);
  }

  @FunctionalInterface
  interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @Override
  public List<ListenerDefinition> listenerDefinitions(boolean activeOnly) throws IOException {
    final String sql = "SELECT listener_id, name, classname, parameters, cronstring, active, created, updated"
                       + " FROM " + prefix + "listener"
                       + (activeOnly ? " WHERE active = TRUE" : "")
                       + " ORDER BY listener_id";
    return query(sql, rs -> ListenerDefinition.newBuilder()
        .id(rs.getInt("listener_id"))
        .name(rs.getString("name"))
        .kind(rs.getString("classname"))
        .parameters(Optional.ofNullable(rs.getString("parameters")).orElse("{}"))
        .schedule(Optional.ofNullable(rs.getString("cronstring")).filter(s -> !s.isBlank()))
        .active(rs.getBoolean("active"))
        .created(instant(rs.getTimestamp("created")))
        .updated(instant(rs.getTimestamp("updated")))
        .build());
  }

  @Override
  public List<Long> subscribers(int listenerId, boolean activeOnly) throws IOException {
    final String sql = "SELECT s.chat_id FROM " + prefix + "subscription s"
                       + " JOIN " + prefix + "chat c ON c.chat_id = s.chat_id"
                       + " WHERE s.listener_id = ?"
                       + (activeOnly ? " AND s.active = TRUE AND c.active = TRUE" : "")
                       + " ORDER BY s.chat_id";
    return query(sql, rs -> rs.getLong(1), listenerId);
  }

  @Override
  public List<Chat> privateChats(boolean activeOnly) throws IOException {
    final String sql = "SELECT chat_id, name, role, type, active FROM " + prefix + "chat"
                       + " WHERE type = ?"
                       + (activeOnly ? " AND active = TRUE" : "")
                       + " ORDER BY chat_id";
    return query(sql, rs -> Chat.create(
        rs.getLong("chat_id"),
        Optional.ofNullable(rs.getString("name")).orElse(""),
        rs.getInt("role"),
        rs.getString("type"),
        rs.getBoolean("active")), Chat.PRIVATE);
  }

  private <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws IOException {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        statement.setObject(i + 1, params[i]);
      }
      try (ResultSet rs = statement.executeQuery()) {
        final List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      LOG.debug("Query failed: {}", sql, e);
      throw new IOException("Storage query failed", e);
    }
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp == null ? Instant.EPOCH : timestamp.toInstant();
  }

  @Override
  public void close() throws IOException {
    if (owner.isPresent()) {
      owner.get().close();
    }
  }
}
