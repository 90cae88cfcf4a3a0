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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.io.Closer;
import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers executors with a {@link Closer} so that they are drained on shutdown.
 */
public class CloserUtil {

  private static final Logger LOG = LoggerFactory.getLogger(CloserUtil.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private CloserUtil() {
    throw new UnsupportedOperationException();
  }

  public static <T extends ExecutorService> T register(Closer closer, T executorService, String name) {
    return register(closer, executorService, name, DEFAULT_TIMEOUT);
  }

  public static <T extends ExecutorService> T register(Closer closer, T executorService, String name,
      Duration timeout) {
    closer.register(closeable(executorService, name, timeout));
    return executorService;
  }

  public static Closeable closeable(ExecutorService executor, String name, Duration timeout) {
    return () -> shutdown(executor, name, timeout);
  }

  /**
   * Shuts an executor down, waiting up to the timeout for running work before interrupting it.
   *
   * @return the number of queued tasks that never ran
   */
  public static int shutdown(ExecutorService executor, String name, Duration timeout) {
    LOG.debug("Shutting down executor: {}", name);
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeout.toNanos(), NANOSECONDS)) {
        LOG.warn("Executor {} did not terminate within {}", name, timeout);
      }
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while shutting down {}", name);
      Thread.currentThread().interrupt();
    }
    final List<Runnable> dropped = executor.shutdownNow();
    if (!dropped.isEmpty()) {
      LOG.warn("{} task(s) in {} did not execute", dropped.size(), name);
    }
    return dropped.size();
  }
}
