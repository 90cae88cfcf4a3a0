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
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.collect.ImmutableList;
import com.spotify.bugsignal.monitoring.Stats;
import com.spotify.bugsignal.util.Time;
import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the pending one-shot {@link Job}s. Due times are owned by a timer executor; a job that
 * fires is handed to a worker executor so that slow jobs do not delay other due times.
 */
public class JobScheduler implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

  @FunctionalInterface
  public interface JobHandler {
    void run(Job job) throws Exception;
  }

  private static final class Entry {

    private final Job job;
    private final ScheduledFuture<?> timer;

    private Entry(Job job, ScheduledFuture<?> timer) {
      this.job = job;
      this.timer = timer;
    }
  }

  private final ScheduledExecutorService timer;
  private final Executor workers;
  private final Time time;
  private final Stats stats;
  private final JobHandler handler;
  private final Consumer<Throwable> errorHandler;

  private final Map<String, Entry> pending = new HashMap<>();
  private final Set<Job> running = new HashSet<>();
  private boolean closed;

  public JobScheduler(ScheduledExecutorService timer, Executor workers, Time time, Stats stats,
      JobHandler handler, Consumer<Throwable> errorHandler) {
    this.timer = requireNonNull(timer);
    this.workers = requireNonNull(workers);
    this.time = requireNonNull(time);
    this.stats = requireNonNull(stats);
    this.handler = requireNonNull(handler);
    this.errorHandler = requireNonNull(errorHandler);
  }

  /**
   * Schedule a job, replacing a pending job with the same key.
   */
  public synchronized void schedule(Job job) {
    if (closed) {
      LOG.debug("Dropping {}, scheduler is closed", job);
      job.done().complete(null);
      return;
    }
    final Entry previous = pending.remove(job.key());
    if (previous != null) {
      drop(previous);
    }
    final ScheduledFuture<?> future = timer.schedule(() -> fire(job), delayNanos(job.due()), NANOSECONDS);
    pending.put(job.key(), new Entry(job, future));
    LOG.debug("Scheduled {}", job);
  }

  /**
   * Schedule a job unless one with the same key is already pending.
   *
   * @return true if the job was scheduled
   */
  public synchronized boolean scheduleIfAbsent(Job job) {
    if (pending.containsKey(job.key())) {
      return false;
    }
    schedule(job);
    return true;
  }

  /**
   * Cancel every pending job of a kind.
   */
  public synchronized void cancel(JobKind kind) {
    final Iterator<Entry> it = pending.values().iterator();
    while (it.hasNext()) {
      final Entry entry = it.next();
      if (entry.job.kind() == kind) {
        it.remove();
        drop(entry);
      }
    }
  }

  public synchronized boolean hasPending(String key) {
    return pending.containsKey(key);
  }

  public synchronized boolean hasPending(JobKind kind) {
    return pending.values().stream().anyMatch(entry -> entry.job.kind() == kind);
  }

  /**
   * Whether a job is still waiting for its due time or running.
   */
  public synchronized boolean isActive(Job job) {
    final Entry entry = pending.get(job.key());
    return (entry != null && entry.job == job) || running.contains(job);
  }

  public synchronized List<Job> pending() {
    return pending.values().stream()
        .map(entry -> entry.job)
        .collect(ImmutableList.toImmutableList());
  }

  public synchronized int size() {
    return pending.size();
  }

  private long delayNanos(Instant due) {
    final Duration delay = Duration.between(time.get(), due);
    if (delay.isNegative()) {
      return 0;
    }
    try {
      return delay.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private void drop(Entry entry) {
    entry.timer.cancel(false);
    entry.job.done().complete(null);
  }

  private void fire(Job job) {
    synchronized (this) {
      final Entry entry = pending.get(job.key());
      if (entry == null || entry.job != job) {
        return;
      }
      pending.remove(job.key());
      running.add(job);
    }
    try {
      workers.execute(() -> run(job));
    } catch (RejectedExecutionException e) {
      LOG.warn("Dropping {}, workers are shut down", job);
      finish(job);
    }
  }

  private void run(Job job) {
    final long t0 = System.nanoTime();
    try {
      handler.run(job);
    } catch (Throwable e) {
      escalate(job, e);
    } finally {
      stats.recordTickDuration(job.kind().name().toLowerCase(Locale.ROOT),
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
      finish(job);
    }
  }

  private void escalate(Job job, Throwable e) {
    try {
      errorHandler.accept(e);
    } catch (RuntimeException escalationFailure) {
      LOG.error("Failed to escalate failure of {}", job, escalationFailure);
      LOG.error("Original failure of {}", job, e);
    }
  }

  private void finish(Job job) {
    synchronized (this) {
      running.remove(job);
    }
    job.done().complete(null);
  }

  /**
   * Drop all pending jobs. Running jobs complete on their own.
   */
  @Override
  public synchronized void close() {
    closed = true;
    pending.values().forEach(this::drop);
    pending.clear();
  }
}
