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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.spotify.bugsignal.model.DriverKind;
import com.spotify.bugsignal.model.ListenerDefinition;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.Test;

public class ListenerTest {

  private static final ListenerDefinition DEFINITION = ListenerDefinition.newBuilder()
      .id(7)
      .name("errors")
      .kind("sql")
      .build();

  private Instant now = Instant.parse("2024-03-01T09:11:22Z");

  @Test
  public void shouldAdvanceCheckpointOnlyOnSuccess() throws IOException {
    final FakeDriver driver = new FakeDriver(DriverKind.SQL).enqueue("row");
    final Listener listener = new Listener(DEFINITION, driver, Optional.empty());

    assertThat(listener.check(), contains("row"));
    assertThat(driver.checkpoint(), is(1));

    driver.failWith(new IOException("connection refused"));
    assertThrows(IOException.class, listener::check);
    assertThat(driver.checkpoint(), is(1));
  }

  @Test
  public void shouldHandOverCheckpointAndRetirePrevious() throws IOException {
    final FakeDriver oldDriver = new FakeDriver(DriverKind.SQL).enqueue("a").enqueue("b");
    final Listener previous = new Listener(DEFINITION, oldDriver, Optional.empty());
    previous.check();
    previous.check();

    final FakeDriver newDriver = new FakeDriver(DriverKind.SQL);
    final Listener fresh = new Listener(DEFINITION, newDriver, Optional.empty());
    fresh.inheritFrom(previous);

    assertThat(newDriver.checkpoint(), is(2));
    assertThat(previous.isRetired(), is(true));
    oldDriver.enqueue("late");
    assertThat(previous.check(), is(empty()));
  }

  @Test
  public void shouldRefuseToInheritFromOtherKind() {
    final Listener previous = new Listener(DEFINITION, new FakeDriver(DriverKind.FILESYSTEM), Optional.empty());
    final Listener fresh = new Listener(DEFINITION, new FakeDriver(DriverKind.SQL), Optional.empty());

    assertThrows(IllegalArgumentException.class, () -> fresh.inheritFrom(previous));
    assertThat(previous.isRetired(), is(false));
  }

  @Test
  public void shouldCloseDriverOnce() throws IOException {
    final FakeDriver driver = new FakeDriver(DriverKind.SQL).enqueue("row");
    final Listener listener = new Listener(DEFINITION, driver, Optional.empty());

    listener.close();
    listener.close();

    assertThat(driver.closeCount(), is(1));
    assertThat(listener.check(), is(empty()));
  }

  @Test
  public void shouldFollowSchedule() {
    final Listener scheduled = new Listener(DEFINITION, new FakeDriver(DriverKind.SQL),
        Optional.of(new CronSchedule("0 * * * *", ZoneOffset.UTC, () -> now)));
    final Listener unscheduled = new Listener(DEFINITION, new FakeDriver(DriverKind.SQL), Optional.empty());

    assertThat(scheduled.nextDue(), is(Optional.of(Instant.parse("2024-03-01T10:00:00Z"))));
    assertThat(unscheduled.nextDue(), is(Optional.empty()));
  }

  @Test
  public void shouldDescribeItselfByKey() {
    final Listener listener = new Listener(DEFINITION, new FakeDriver(DriverKind.SQL), Optional.empty());

    assertThat(listener.toString(), is("errors#7"));
    assertThat(listener.kind(), is(DriverKind.SQL));
  }
}
