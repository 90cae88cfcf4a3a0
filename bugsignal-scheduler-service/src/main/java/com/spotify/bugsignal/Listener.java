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

import com.google.common.collect.ImmutableList;
import com.spotify.bugsignal.driver.SourceDriver;
import com.spotify.bugsignal.model.DriverKind;
import com.spotify.bugsignal.model.ListenerDefinition;
import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A live instance of a {@link ListenerDefinition}: a source driver plus its schedule.
 *
 * <p>Checks are serialized. Once the checkpoint has been handed to a successor with
 * {@link #inheritFrom(Listener)}, or the listener is closed, checks are skipped.
 */
public class Listener implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(Listener.class);

  private final ListenerDefinition definition;
  private final SourceDriver<?> driver;
  private final Optional<CronSchedule> schedule;

  private final ReentrantLock lock = new ReentrantLock();
  private boolean retired;
  private boolean closed;

  Listener(ListenerDefinition definition, SourceDriver<?> driver, Optional<CronSchedule> schedule) {
    this.definition = requireNonNull(definition);
    this.driver = requireNonNull(driver);
    this.schedule = requireNonNull(schedule);
  }

  public int id() {
    return definition.id();
  }

  public String name() {
    return definition.name();
  }

  public DriverKind kind() {
    return driver.kind();
  }

  public ListenerDefinition definition() {
    return definition;
  }

  SourceDriver<?> driver() {
    return driver;
  }

  /**
   * When this listener should next be checked, advancing the schedule past elapsed occurrences.
   *
   * @return empty if the listener has no schedule
   */
  public Optional<Instant> nextDue() {
    return schedule.map(s -> s.next().when());
  }

  /**
   * When this listener should next be checked after a job due at {@code fired} ran. The result is
   * always after {@code fired}, also when the job ran ahead of the clock.
   */
  public Optional<Instant> nextDueAfter(Instant fired) {
    return schedule.map(s -> s.nextAfter(fired).when());
  }

  /**
   * Check the source for changes.
   *
   * @return the messages produced, empty if there were none or the listener is retired
   */
  public List<String> check() throws IOException {
    lock.lock();
    try {
      if (retired || closed) {
        LOG.info("Skipping check of {} listener {}", closed ? "closed" : "retired", this);
        return ImmutableList.of();
      }
      return driver.check();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Take over the checkpoint of the previous instance of this listener and retire it. Waits for
   * a check running on the previous instance to finish.
   *
   * @throws IllegalArgumentException if the previous instance has a different driver kind
   */
  void inheritFrom(Listener previous) {
    previous.lock.lock();
    try {
      driver.inherit(previous.driver);
      previous.retired = true;
    } finally {
      previous.lock.unlock();
    }
  }

  boolean isRetired() {
    lock.lock();
    try {
      return retired || closed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      driver.close();
      LOG.debug("Closed listener {}", this);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return definition.toKey();
  }
}
