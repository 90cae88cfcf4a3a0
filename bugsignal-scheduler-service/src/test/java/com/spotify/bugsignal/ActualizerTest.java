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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

import com.google.common.util.concurrent.MoreExecutors;
import com.spotify.bugsignal.model.Chat;
import com.spotify.bugsignal.model.ListenerDefinition;
import com.spotify.bugsignal.monitoring.Stats;
import com.spotify.bugsignal.storage.InMemStorage;
import com.spotify.bugsignal.storage.Storage;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.jmock.lib.concurrent.DeterministicScheduler;
import org.junit.Before;
import org.junit.Test;

public class ActualizerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final Instant MIDNIGHT = Instant.parse("2024-03-02T00:00:00Z");
  private static final Duration RETRY_INTERVAL = Duration.ofSeconds(15);

  private static final ListenerDefinition ERRORS = ListenerDefinition.newBuilder()
      .id(1)
      .name("errors")
      .kind("sql")
      .parameters("{\"query\": \"SELECT 1\"}")
      .schedule("*/5 * * * *")
      .build();

  private static final ListenerDefinition UPLOADS = ListenerDefinition.newBuilder()
      .id(2)
      .name("uploads")
      .kind("filesystem")
      .parameters("{\"paths\": [\"/srv/uploads\"]}")
      .schedule("0 * * * *")
      .build();

  private final AtomicBoolean storageDown = new AtomicBoolean();
  private final InMemStorage definitions = new InMemStorage();
  private final Storage storage = new Storage() {
    @Override
    public List<ListenerDefinition> listenerDefinitions(boolean activeOnly) throws IOException {
      if (storageDown.get()) {
        throw new IOException("storage down");
      }
      return definitions.listenerDefinitions(activeOnly);
    }

    @Override
    public List<Long> subscribers(int listenerId, boolean activeOnly) {
      return definitions.subscribers(listenerId, activeOnly);
    }

    @Override
    public List<Chat> privateChats(boolean activeOnly) {
      return definitions.privateChats(activeOnly);
    }

    @Override
    public void close() {
      // nothing to release
    }
  };

  private final DeterministicScheduler timer = new DeterministicScheduler();
  private final ListenerRegistry registry = new ListenerRegistry();
  private final List<Throwable> escalated = new CopyOnWriteArrayList<>();
  private final FakeListenerFactory factory = new FakeListenerFactory(() -> NOW);

  private JobScheduler jobs;
  private Actualizer sut;

  @Before
  public void setUp() {
    jobs = new JobScheduler(timer, MoreExecutors.directExecutor(), () -> NOW, Stats.NOOP, job -> {
      if (job.kind() == JobKind.ACTUALIZER) {
        sut.actualize();
      }
    }, escalated::add);
    sut = new Actualizer(storage, registry, jobs, factory, new CronSchedule("0 0 * * *", ZoneOffset.UTC, () -> NOW),
        RETRY_INTERVAL, () -> NOW);
  }

  @Test
  public void shouldCreateListenersAndScheduleThem() throws IOException {
    definitions.storeListenerDefinition(ERRORS);
    definitions.storeListenerDefinition(UPLOADS);
    definitions.storeListenerDefinition(ListenerDefinition.newBuilder().id(3).name("manual").kind("sql").build());

    sut.actualize();

    assertThat(registry.size(), is(3));
    assertThat(listenerJobs().size(), is(2));
    assertThat(pendingJob(Job.listenerKey(1)).due(), is(Instant.parse("2024-03-01T10:05:00Z")));
    assertThat(pendingJob(Job.listenerKey(2)).due(), is(Instant.parse("2024-03-01T11:00:00Z")));
    assertThat(pendingJob(Job.ACTUALIZER_NAME).due(), is(MIDNIGHT));
  }

  @Test
  public void shouldKeepLiveInstanceWhenUnchanged() throws IOException {
    definitions.storeListenerDefinition(ERRORS);
    sut.actualize();
    final Listener live = registry.get(1).orElseThrow();

    definitions.storeListenerDefinition(ERRORS.toBuilder().updated(NOW).build());
    sut.actualize();
    sut.actualize();

    assertThat(registry.get(1).orElseThrow(), is(sameInstance(live)));
    assertThat(factory.createdCount(), is(1));
    assertThat(listenerJobs().size(), is(1));
    assertThat(jobs.size(), is(2));
  }

  @Test
  public void shouldInheritCheckpointWhenKindIsUnchanged() throws IOException {
    definitions.storeListenerDefinition(ERRORS);
    sut.actualize();
    final Listener previous = registry.get(1).orElseThrow();
    final FakeDriver previousDriver = factory.driver(1);
    previous.check();
    previous.check();

    definitions.storeListenerDefinition(ERRORS.toBuilder().schedule("*/10 * * * *").build());
    sut.actualize();

    final Listener fresh = registry.get(1).orElseThrow();
    assertThat(fresh, is(not(sameInstance(previous))));
    assertThat(factory.driver(1).checkpoint(), is(2));
    assertThat(previousDriver.closeCount(), is(1));
    assertThat(previous.isRetired(), is(true));
    assertThat(pendingJob(Job.listenerKey(1)).listener().orElseThrow(), is(sameInstance(fresh)));
    assertThat(pendingJob(Job.listenerKey(1)).due(), is(Instant.parse("2024-03-01T10:10:00Z")));
  }

  @Test
  public void shouldFlushPreviousInstanceWhenKindChanges() throws IOException {
    definitions.storeListenerDefinition(ERRORS);
    sut.actualize();
    final Listener previous = registry.get(1).orElseThrow();
    final FakeDriver previousDriver = factory.driver(1);

    definitions.storeListenerDefinition(ERRORS.toBuilder()
        .kind("filesystem")
        .parameters("{\"paths\": [\"/var/log/app\"]}")
        .build());
    sut.actualize();

    final List<Job> checkers = pending(JobKind.CHECKER);
    assertThat(checkers.size(), is(1));
    assertThat(checkers.get(0).finalFlush(), is(true));
    assertThat(checkers.get(0).due(), is(NOW));
    assertThat(checkers.get(0).listener().orElseThrow(), is(sameInstance(previous)));
    assertThat(previousDriver.closeCount(), is(0));
    assertThat(registry.get(1).orElseThrow().definition().kind(), is("filesystem"));
  }

  @Test
  public void shouldKeepLiveInstanceWhenConstructionFails() throws IOException {
    definitions.storeListenerDefinition(ERRORS);
    sut.actualize();
    final Listener live = registry.get(1).orElseThrow();

    definitions.storeListenerDefinition(ERRORS.toBuilder().parameters("{\"query\": \"broken\"}").build());
    sut.actualize();

    assertThat(registry.get(1).orElseThrow(), is(sameInstance(live)));
    assertThat(factory.driver(1).closeCount(), is(0));
    assertThat(jobs.hasPending(Job.listenerKey(1)), is(true));
  }

  @Test
  public void shouldSkipDefinitionThatNeverConstructed() throws IOException {
    definitions.storeListenerDefinition(ERRORS.toBuilder().parameters("{\"query\": \"broken\"}").build());
    definitions.storeListenerDefinition(UPLOADS);

    sut.actualize();

    assertThat(registry.snapshot().keySet().stream().collect(Collectors.toList()), is(List.of(2)));
  }

  @Test
  public void shouldRetireDeactivatedAndDeletedListeners() throws IOException {
    definitions.storeListenerDefinition(ERRORS);
    definitions.storeListenerDefinition(UPLOADS);
    sut.actualize();
    final FakeDriver errorsDriver = factory.driver(1);
    final FakeDriver uploadsDriver = factory.driver(2);

    definitions.storeListenerDefinition(ERRORS.toBuilder().active(false).build());
    definitions.deleteListenerDefinition(2);
    sut.actualize();

    assertThat(registry.size(), is(0));
    assertThat(errorsDriver.closeCount(), is(1));
    assertThat(uploadsDriver.closeCount(), is(1));
    assertThat(listenerJobs(), is(empty()));
  }

  @Test
  public void shouldRetryAfterStorageFailure() {
    definitions.storeListenerDefinition(ERRORS);
    storageDown.set(true);

    assertThrows(IOException.class, sut::actualize);
    assertThat(pendingJob(Job.ACTUALIZER_NAME).due(), is(NOW.plus(RETRY_INTERVAL)));
    assertThat(registry.size(), is(0));

    storageDown.set(false);
    timer.tick(RETRY_INTERVAL.getSeconds(), SECONDS);

    assertThat(escalated, is(empty()));
    assertThat(registry.size(), is(1));
    assertThat(pendingJob(Job.ACTUALIZER_NAME).due(), is(MIDNIGHT));
  }

  @Test
  public void shouldEscalateRepeatedStorageFailure() {
    storageDown.set(true);
    assertThrows(IOException.class, sut::actualize);

    timer.tick(RETRY_INTERVAL.getSeconds(), SECONDS);

    assertThat(escalated.size(), is(1));
    assertThat(escalated.get(0) instanceof IOException, is(true));
    assertThat(pendingJob(Job.ACTUALIZER_NAME).due(), is(NOW.plus(RETRY_INTERVAL)));
  }

  private Job pendingJob(String key) {
    return jobs.pending().stream()
        .filter(job -> job.key().equals(key))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no pending job " + key));
  }

  private List<Job> pending(JobKind kind) {
    return jobs.pending().stream()
        .filter(job -> job.kind() == kind)
        .collect(Collectors.toList());
  }

  private List<Job> listenerJobs() {
    return pending(JobKind.LISTENER);
  }
}
