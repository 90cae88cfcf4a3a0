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
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class CronScheduleTest {

  private Instant now = Instant.parse("2024-03-01T09:11:22Z");

  private final CronSchedule schedule = new CronSchedule("*/5 * * * *", ZoneOffset.UTC, () -> now);

  @Test
  public void shouldBePendingUntilOccurrence() {
    assertThat(schedule.next(), is(NextDue.create(false, Instant.parse("2024-03-01T09:15:00Z"))));
    now = Instant.parse("2024-03-01T09:14:59Z");
    assertThat(schedule.next(), is(NextDue.create(false, Instant.parse("2024-03-01T09:15:00Z"))));
  }

  @Test
  public void shouldAdvanceWhenOccurrenceElapsed() {
    now = Instant.parse("2024-03-01T09:15:00Z");
    assertThat(schedule.next(), is(NextDue.create(true, Instant.parse("2024-03-01T09:20:00Z"))));

    now = Instant.parse("2024-03-01T09:17:00Z");
    assertThat(schedule.next(), is(NextDue.create(false, Instant.parse("2024-03-01T09:20:00Z"))));
  }

  @Test
  public void shouldTreatFiredOccurrenceAsElapsedAheadOfClock() {
    now = Instant.parse("2024-03-01T09:14:59.999Z");

    assertThat(schedule.nextAfter(Instant.parse("2024-03-01T09:15:00Z")),
        is(NextDue.create(true, Instant.parse("2024-03-01T09:20:00Z"))));
  }

  @Test
  public void shouldSkipMissedOccurrences() {
    now = Instant.parse("2024-03-01T10:02:00Z");
    assertThat(schedule.next(), is(NextDue.create(true, Instant.parse("2024-03-01T10:05:00Z"))));
  }

  @Test
  public void shouldEvaluateInZone() {
    final CronSchedule daily = new CronSchedule("30 8 * * *", ZoneId.of("Europe/Stockholm"), () -> now);

    assertThat(daily.next().when(), is(Instant.parse("2024-03-02T07:30:00Z")));
  }

  @Test
  @Parameters({
      "every minute",
      "61 * * * *",
      "* * * *"
  })
  public void shouldRejectInvalidExpression(String expression) {
    assertThrows(IllegalArgumentException.class, () -> new CronSchedule(expression, ZoneOffset.UTC, () -> now));
  }
}
