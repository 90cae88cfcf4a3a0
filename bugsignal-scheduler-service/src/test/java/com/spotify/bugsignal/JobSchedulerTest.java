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

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.util.concurrent.MoreExecutors;
import com.spotify.bugsignal.model.DriverKind;
import com.spotify.bugsignal.model.ListenerDefinition;
import com.spotify.bugsignal.monitoring.Stats;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import org.jmock.lib.concurrent.DeterministicScheduler;
import org.junit.Before;
import org.junit.Test;

public class JobSchedulerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private final DeterministicScheduler timer = new DeterministicScheduler();
  private final List<Job> ran = new CopyOnWriteArrayList<>();
  private final List<Throwable> escalated = new CopyOnWriteArrayList<>();

  private Listener listener;
  private JobScheduler sut;

  @Before
  public void setUp() {
    listener = new Listener(ListenerDefinition.newBuilder().id(3).name("errors").kind("sql").build(),
        new FakeDriver(DriverKind.SQL), Optional.empty());
    sut = new JobScheduler(timer, MoreExecutors.directExecutor(), () -> NOW, Stats.NOOP, ran::add,
        escalated::add);
  }

  @Test
  public void shouldRunJobWhenDue() {
    final Job job = Job.listener(listener, NOW.plusSeconds(10));
    sut.schedule(job);

    timer.tick(9, SECONDS);
    assertThat(ran, is(empty()));
    assertThat(sut.isActive(job), is(true));

    timer.tick(1, SECONDS);
    assertThat(ran, contains(job));
    assertThat(sut.isActive(job), is(false));
    assertThat(job.done().isDone(), is(true));
    assertThat(sut.size(), is(0));
  }

  @Test
  public void shouldNotRunJobBeforeSubMillisecondDueTime() {
    final Job job = Job.listener(listener, NOW.plusNanos(1_500_000));
    sut.schedule(job);

    timer.tick(1, MILLISECONDS);
    assertThat(ran, is(empty()));

    timer.tick(1, MILLISECONDS);
    assertThat(ran, contains(job));
  }

  @Test
  public void shouldReplacePendingJobWithSameKey() {
    final Job first = Job.listener(listener, NOW.plusSeconds(10));
    final Job second = Job.listener(listener, NOW.plusSeconds(20));
    sut.schedule(first);
    sut.schedule(second);

    assertThat(sut.size(), is(1));
    assertThat(first.done().isDone(), is(true));

    timer.tick(30, SECONDS);
    assertThat(ran, contains(second));
  }

  @Test
  public void shouldKeepPendingJobWhenScheduledIfAbsent() {
    final Job first = Job.listener(listener, NOW.plusSeconds(10));
    final Job second = Job.listener(listener, NOW.plusSeconds(5));

    assertThat(sut.scheduleIfAbsent(first), is(true));
    assertThat(sut.scheduleIfAbsent(second), is(false));
    assertThat(sut.pending(), contains(first));

    timer.tick(30, SECONDS);
    assertThat(ran, contains(first));
  }

  @Test
  public void shouldGiveEveryCheckerItsOwnKey() {
    sut.schedule(Job.checker(listener, NOW, Optional.empty()));
    sut.schedule(Job.checker(listener, NOW, Optional.of(5L)));
    sut.schedule(Job.listener(listener, NOW.plusSeconds(60)));

    assertThat(sut.size(), is(3));
  }

  @Test
  public void shouldCancelJobsOfKind() {
    final Job listenerJob = Job.listener(listener, NOW.plusSeconds(10));
    final Job actualizerJob = Job.actualizer(NOW.plusSeconds(10));
    sut.schedule(listenerJob);
    sut.schedule(actualizerJob);

    sut.cancel(JobKind.LISTENER);

    assertThat(sut.hasPending(JobKind.LISTENER), is(false));
    assertThat(sut.hasPending(Job.ACTUALIZER_NAME), is(true));
    assertThat(listenerJob.done().isDone(), is(true));
    timer.tick(30, SECONDS);
    assertThat(ran, contains(actualizerJob));
  }

  @Test
  public void shouldRunOverdueJobImmediately() {
    final Job job = Job.actualizer(NOW.minusSeconds(60));
    sut.schedule(job);

    timer.runUntilIdle();

    assertThat(ran, contains(job));
  }

  @Test
  public void shouldEscalateHandlerFailure() {
    final IllegalStateException failure = new IllegalStateException("boom");
    final JobScheduler failing = new JobScheduler(timer, MoreExecutors.directExecutor(), () -> NOW, Stats.NOOP,
        job -> {
          throw failure;
        }, escalated::add);
    final Job job = Job.actualizer(NOW);
    failing.schedule(job);

    timer.runUntilIdle();

    assertThat(escalated.size(), is(1));
    assertThat(escalated.get(0), is(sameInstance(failure)));
    assertThat(job.done().isDone(), is(true));
  }

  @Test
  public void shouldFinishJobRejectedByWorkers() {
    final JobScheduler rejecting = new JobScheduler(timer, command -> {
      throw new RejectedExecutionException("shut down");
    }, () -> NOW, Stats.NOOP, ran::add, escalated::add);
    final Job job = Job.actualizer(NOW);
    rejecting.schedule(job);

    timer.runUntilIdle();

    assertThat(ran, is(empty()));
    assertThat(rejecting.isActive(job), is(false));
    assertThat(job.done().isDone(), is(true));
  }

  @Test
  public void shouldDropEverythingWhenClosed() {
    final Job pending = Job.actualizer(NOW.plusSeconds(10));
    sut.schedule(pending);

    sut.close();
    final Job late = Job.shutdown(NOW);
    sut.schedule(late);
    timer.tick(30, SECONDS);

    assertThat(ran, is(empty()));
    assertThat(pending.done().isDone(), is(true));
    assertThat(late.done().isDone(), is(true));
    assertThat(sut.size(), is(0));
  }
}
