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

import com.spotify.bugsignal.monitoring.Stats;
import com.spotify.bugsignal.storage.Storage;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fired listener or checker job: checks the listener, delivers its messages to the active
 * subscribers and reschedules it.
 */
public class Dispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

  private final Storage storage;
  private final ListenerRegistry registry;
  private final JobScheduler jobs;
  private final MessageDelivery delivery;
  private final Stats stats;

  public Dispatcher(Storage storage, ListenerRegistry registry, JobScheduler jobs, MessageDelivery delivery,
      Stats stats) {
    this.storage = requireNonNull(storage);
    this.registry = requireNonNull(registry);
    this.jobs = requireNonNull(jobs);
    this.delivery = requireNonNull(delivery);
    this.stats = requireNonNull(stats);
  }

  /**
   * @throws ListenerCheckException if the check failed
   * @throws IOException if the subscribers could not be read
   */
  public void dispatch(Job job) throws ListenerCheckException, IOException {
    final Listener scheduled = job.listener()
        .orElseThrow(() -> new IllegalArgumentException(job + " has no listener"));
    final Listener listener = target(job, scheduled);
    try {
      final List<String> messages;
      try {
        messages = listener.check();
      } catch (Exception e) {
        stats.recordCheck("failure");
        throw new ListenerCheckException(listener.id(), listener.name(), job.callerChat(), e);
      }
      if (messages.isEmpty()) {
        stats.recordCheck("no_updates");
        LOG.info("{}: no updates", listener);
        return;
      }
      stats.recordCheck("updates");
      final List<Long> chats = storage.subscribers(listener.id(), true);
      LOG.info("{}: {} message(s) for {} chat(s)", listener, messages.size(), chats.size());
      delivery.deliver(chats, messages);
    } finally {
      if (job.kind() == JobKind.LISTENER) {
        reschedule(listener, job.due());
      }
      if (job.finalFlush()) {
        listener.close();
      }
    }
  }

  /**
   * A force-check runs against the live instance, which may have replaced the one it was queued for.
   */
  private Listener target(Job job, Listener scheduled) {
    if (job.kind() != JobKind.CHECKER || job.finalFlush()) {
      return scheduled;
    }
    return registry.get(scheduled.id()).orElse(scheduled);
  }

  private void reschedule(Listener listener, Instant fired) {
    final boolean current = registry.ifCurrent(listener, () -> listener.nextDueAfter(fired)
        .ifPresent(due -> jobs.scheduleIfAbsent(Job.listener(listener, due))));
    if (!current) {
      LOG.debug("{} is no longer live, not rescheduling", listener);
    }
  }
}
