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

import com.spotify.bugsignal.model.ListenerDefinition;
import com.spotify.bugsignal.storage.Storage;
import com.spotify.bugsignal.util.Time;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles the live listeners against the persisted definitions.
 *
 * <p>A definition whose live instance has the same configuration keeps that instance. A changed
 * definition gets a new instance, which inherits the checkpoint of the old one when the driver
 * kind is unchanged; otherwise the old instance gets a final check before it is closed. The
 * listener table and the listener jobs are swapped atomically.
 */
public class Actualizer {

  private static final Logger LOG = LoggerFactory.getLogger(Actualizer.class);

  private final Storage storage;
  private final ListenerRegistry registry;
  private final JobScheduler jobs;
  private final ListenerFactory factory;
  private final CronSchedule schedule;
  private final Duration retryInterval;
  private final Time time;

  private final Object passLock = new Object();

  public Actualizer(Storage storage, ListenerRegistry registry, JobScheduler jobs, ListenerFactory factory,
      CronSchedule schedule, Duration retryInterval, Time time) {
    this.storage = requireNonNull(storage);
    this.registry = requireNonNull(registry);
    this.jobs = requireNonNull(jobs);
    this.factory = requireNonNull(factory);
    this.schedule = requireNonNull(schedule);
    this.retryInterval = requireNonNull(retryInterval);
    this.time = requireNonNull(time);
  }

  /**
   * Run one reconciliation pass. Passes never overlap.
   *
   * <p>The next pass is armed whether or not the definitions could be read: on the actualizer
   * schedule after a successful read, after the retry interval after a failed one.
   *
   * @throws IOException if the definitions could not be read
   */
  public void actualize() throws IOException {
    synchronized (passLock) {
      final List<ListenerDefinition> definitions;
      try {
        definitions = storage.listenerDefinitions(true);
      } catch (IOException e) {
        final Instant retryAt = time.get().plus(retryInterval);
        LOG.warn("Failed to read listener definitions, retrying at {}", retryAt);
        jobs.schedule(Job.actualizer(retryAt));
        throw e;
      }
      jobs.scheduleIfAbsent(Job.actualizer(schedule.next().when()));
      reconcile(definitions);
    }
  }

  private void reconcile(List<ListenerDefinition> definitions) {
    final Map<Integer, Listener> current = registry.snapshot();
    final Map<Integer, Listener> next = new LinkedHashMap<>();
    final List<Listener> retired = new ArrayList<>();
    final List<Listener> flushed = new ArrayList<>();

    for (ListenerDefinition definition : definitions) {
      final Listener live = current.get(definition.id());
      if (live != null && live.definition().sameConfiguration(definition)) {
        next.put(definition.id(), live);
        continue;
      }

      final Listener fresh;
      try {
        fresh = factory.create(definition);
      } catch (Exception e) {
        LOG.error("Failed to construct listener {} ({}), skipping it", definition.name(), definition.id(), e);
        if (live != null) {
          next.put(definition.id(), live);
        }
        continue;
      }

      if (live != null) {
        if (live.kind() == fresh.kind()) {
          try {
            fresh.inheritFrom(live);
          } catch (RuntimeException e) {
            LOG.error("Listener {} could not inherit from its previous instance, keeping it", live, e);
            fresh.close();
            next.put(definition.id(), live);
            continue;
          }
          LOG.info("Listener {} inherited", fresh);
          retired.add(live);
        } else {
          LOG.info("Listener {} changed kind from {} to {}", fresh, live.kind(), fresh.kind());
          flushed.add(live);
        }
      } else {
        LOG.info("Listener {} created", fresh);
      }
      next.put(definition.id(), fresh);
    }

    current.forEach((id, listener) -> {
      if (!next.containsKey(id)) {
        LOG.info("Listener {} deactivated", listener);
        retired.add(listener);
      }
    });

    final Instant now = time.get();
    registry.replaceAll(next, table -> {
      jobs.cancel(JobKind.LISTENER);
      table.values().forEach(listener -> listener.nextDue()
          .ifPresent(due -> jobs.schedule(Job.listener(listener, due))));
      flushed.forEach(listener -> jobs.schedule(Job.finalFlush(listener, now)));
    });

    retired.forEach(Listener::close);
    LOG.info("Actualized {} listener(s)", next.size());
  }
}
