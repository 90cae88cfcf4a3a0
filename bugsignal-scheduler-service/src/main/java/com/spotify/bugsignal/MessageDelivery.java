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
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.spotify.bugsignal.monitoring.Stats;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans messages out to chats. Recipients are served concurrently; each recipient receives the
 * segments in order, every segment retried at a fixed interval until its lifetime is spent.
 */
public class MessageDelivery {

  private static final Logger LOG = LoggerFactory.getLogger(MessageDelivery.class);

  private final MessageSender sender;
  private final ExecutorService executor;
  private final Stats stats;
  private final int maxLength;
  private final Duration retryInterval;
  private final Duration lifetime;
  private final Duration timeout;

  public MessageDelivery(MessageSender sender, ExecutorService executor, Stats stats, int maxLength,
      Duration retryInterval, Duration lifetime, Duration timeout) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    this.sender = requireNonNull(sender);
    this.executor = requireNonNull(executor);
    this.stats = requireNonNull(stats);
    this.maxLength = maxLength;
    this.retryInterval = requireNonNull(retryInterval);
    this.lifetime = requireNonNull(lifetime);
    this.timeout = requireNonNull(timeout);
  }

  /**
   * Deliver messages to chats, waiting up to the common timeout. Failures and the timeout are
   * logged, not raised.
   */
  public void deliver(List<Long> chats, List<String> messages) {
    final List<String> segments = messages.stream()
        .flatMap(message -> split(message, maxLength).stream())
        .collect(ImmutableList.toImmutableList());
    if (chats.isEmpty() || segments.isEmpty()) {
      return;
    }

    final CompletableFuture<?>[] deliveries = chats.stream()
        .map(chat -> CompletableFuture.runAsync(() -> deliverTo(chat, segments), executor))
        .toArray(CompletableFuture[]::new);
    try {
      CompletableFuture.allOf(deliveries).get(timeout.toMillis(), MILLISECONDS);
    } catch (TimeoutException e) {
      LOG.warn("Delivery to {} chat(s) did not complete within {}", chats.size(), timeout);
    } catch (ExecutionException e) {
      LOG.error("Delivery failed", e.getCause());
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for delivery to {} chat(s)", chats.size());
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Deliver segments to one chat in order.
   *
   * @return the number of segments delivered
   */
  @VisibleForTesting
  int deliverTo(long chat, List<String> segments) {
    int delivered = 0;
    for (String segment : segments) {
      final Retryer<Void> retryer = RetryerBuilder.<Void>newBuilder()
          .retryIfException()
          .withWaitStrategy(WaitStrategies.fixedWait(retryInterval.toMillis(), MILLISECONDS))
          .withStopStrategy(StopStrategies.stopAfterDelay(lifetime.toMillis(), MILLISECONDS))
          .withRetryListener(MessageDelivery::onAttempt)
          .build();
      try {
        retryer.call(() -> {
          sender.send(chat, segment);
          return null;
        });
        delivered++;
        stats.recordDelivery("success");
      } catch (RetryException e) {
        stats.recordDelivery("failure");
        LOG.error("Gave up delivering to chat {} after {} attempt(s)", chat, e.getNumberOfFailedAttempts(),
            e.getLastFailedAttempt().getExceptionCause());
      } catch (ExecutionException e) {
        stats.recordDelivery("failure");
        LOG.error("Failed to deliver to chat {}", chat, e.getCause());
      }
    }
    return delivered;
  }

  private static <T> void onAttempt(Attempt<T> attempt) {
    if (attempt.hasException()) {
      LOG.warn("Delivery attempt {} failed: {}", attempt.getAttemptNumber(), attempt.getExceptionCause().toString());
    }
  }

  /**
   * Split a message into consecutive segments of at most {@code maxLength} characters.
   */
  static List<String> split(String message, int maxLength) {
    if (message.length() <= maxLength) {
      return ImmutableList.of(message);
    }
    final ImmutableList.Builder<String> segments = ImmutableList.builder();
    for (int start = 0; start < message.length(); start += maxLength) {
      segments.add(message.substring(start, Math.min(message.length(), start + maxLength)));
    }
    return segments.build();
  }
}
