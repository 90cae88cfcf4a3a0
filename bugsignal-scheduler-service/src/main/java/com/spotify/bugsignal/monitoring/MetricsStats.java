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
package com.spotify.bugsignal.monitoring;

import static com.codahale.metrics.MetricRegistry.name;
import static java.util.Objects.requireNonNull;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SlidingTimeWindowArrayReservoir;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * {@link Stats} backed by a Dropwizard {@link MetricRegistry}.
 */
public final class MetricsStats implements Stats {

  private static final String PREFIX = "bugsignal";

  static final String LIVE_LISTENERS = name(PREFIX, "listeners", "live");
  static final String PENDING_JOBS = name(PREFIX, "jobs", "pending");
  static final String TICK_DURATION = name(PREFIX, "tick", "duration");
  static final String CHECK_RATE = name(PREFIX, "check", "rate");
  static final String DELIVERY_RATE = name(PREFIX, "delivery", "rate");
  static final String ESCALATION_RATE = name(PREFIX, "escalation", "rate");

  private final MetricRegistry registry;

  private final ConcurrentMap<String, Histogram> tickHistograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Meter> checkMeters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Meter> deliveryMeters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Meter> escalationMeters = new ConcurrentHashMap<>();

  public MetricsStats(MetricRegistry registry) {
    this.registry = requireNonNull(registry);
  }

  @Override
  public void registerLiveListenersMetric(Gauge<Integer> liveListeners) {
    registry.register(LIVE_LISTENERS, liveListeners);
  }

  @Override
  public void registerPendingJobsMetric(Gauge<Integer> pendingJobs) {
    registry.register(PENDING_JOBS, pendingJobs);
  }

  @Override
  public void recordTickDuration(String type, long durationMillis) {
    tickHistograms.computeIfAbsent(type, t -> registry.histogram(name(TICK_DURATION, t),
        () -> new Histogram(new SlidingTimeWindowArrayReservoir(30, TimeUnit.SECONDS))))
        .update(durationMillis);
  }

  @Override
  public void recordCheck(String outcome) {
    checkMeters.computeIfAbsent(outcome, o -> registry.meter(name(CHECK_RATE, o))).mark();
  }

  @Override
  public void recordDelivery(String outcome) {
    deliveryMeters.computeIfAbsent(outcome, o -> registry.meter(name(DELIVERY_RATE, o))).mark();
  }

  @Override
  public void recordEscalation(String type) {
    escalationMeters.computeIfAbsent(type, t -> registry.meter(name(ESCALATION_RATE, t))).mark();
  }
}
