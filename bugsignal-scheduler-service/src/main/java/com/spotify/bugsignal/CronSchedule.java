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

import com.cronutils.model.Cron;
import com.spotify.bugsignal.util.Time;
import com.spotify.bugsignal.util.TimeUtil;
import java.time.Instant;
import java.time.ZoneId;

/**
 * A five field UNIX cron evaluated in a timezone, remembering its pending occurrence.
 */
public class CronSchedule {

  private final String expression;
  private final Cron cron;
  private final ZoneId zone;
  private final Time time;

  private Instant pending;

  /**
   * @throws IllegalArgumentException if the expression is not a valid cron
   */
  public CronSchedule(String expression, ZoneId zone, Time time) {
    this.expression = requireNonNull(expression);
    this.cron = TimeUtil.cron(expression);
    this.zone = requireNonNull(zone);
    this.time = requireNonNull(time);
    this.pending = occurrenceAfter(time.get());
  }

  /**
   * If the pending occurrence is not after now it has expired, and the schedule advances to the
   * first occurrence strictly after now. The returned instant is never before now.
   */
  public synchronized NextDue next() {
    return advance(time.get());
  }

  /**
   * Like {@link #next()}, but every occurrence up to {@code fired} counts as elapsed even if the
   * clock has not reached it yet.
   */
  public synchronized NextDue nextAfter(Instant fired) {
    final Instant now = time.get();
    return advance(now.isAfter(fired) ? now : fired);
  }

  private NextDue advance(Instant now) {
    if (pending.isAfter(now)) {
      return NextDue.create(false, pending);
    }
    pending = occurrenceAfter(now);
    return NextDue.create(true, pending);
  }

  public String expression() {
    return expression;
  }

  private Instant occurrenceAfter(Instant instant) {
    return TimeUtil.nextInstant(instant, cron, zone)
        .orElseThrow(() -> new IllegalArgumentException("Cron '" + expression + "' never occurs after " + instant));
  }

  @Override
  public String toString() {
    return "CronSchedule{" + expression + " " + zone + "}";
  }
}
