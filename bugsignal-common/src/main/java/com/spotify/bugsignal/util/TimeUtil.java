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
package com.spotify.bugsignal.util;

import static com.cronutils.model.definition.CronDefinitionBuilder.instanceDefinitionFor;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility functions for cron expressions, time zones and message timestamps.
 */
public class TimeUtil {

  private static final Logger LOG = LoggerFactory.getLogger(TimeUtil.class);

  private static final CronParser CRON_PARSER = new CronParser(instanceDefinitionFor(CronType.UNIX));

  public static final DateTimeFormatter MESSAGE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private TimeUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Parses a five field UNIX cron expression.
   *
   * @throws IllegalArgumentException if the expression is not valid
   */
  public static Cron cron(String expression) {
    return CRON_PARSER.parse(expression.trim());
  }

  /**
   * Gets the first occurrence of a cron strictly after the given instant, evaluated in a zone.
   *
   * @return empty if the cron never occurs again
   */
  public static Optional<Instant> nextInstant(Instant instant, Cron cron, ZoneId zone) {
    final ExecutionTime executionTime = ExecutionTime.forCron(cron);
    final ZonedDateTime dateTime = instant.atZone(zone);
    return executionTime.nextExecution(dateTime)
        .map(ZonedDateTime::toInstant)
        .filter(next -> next.isAfter(instant));
  }

  /**
   * Resolves a zone id, falling back to UTC with a warning when the name is not known.
   */
  public static ZoneId zoneId(String name) {
    try {
      return ZoneId.of(name);
    } catch (DateTimeException | NullPointerException e) {
      LOG.warn("Unknown timezone '{}', falling back to UTC", name);
      return ZoneOffset.UTC;
    }
  }

  /**
   * Formats an instant as {@code yyyy-MM-dd HH:mm:ss} in a zone.
   */
  public static String format(Instant instant, ZoneId zone) {
    return MESSAGE_FORMAT.format(instant.atZone(zone));
  }
}
