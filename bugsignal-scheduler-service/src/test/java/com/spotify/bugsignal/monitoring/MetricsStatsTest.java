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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.codahale.metrics.MetricRegistry;
import org.junit.Test;

public class MetricsStatsTest {

  private final MetricRegistry registry = new MetricRegistry();
  private final MetricsStats sut = new MetricsStats(registry);

  @Test
  public void shouldMeterOutcomes() {
    sut.recordCheck("updates");
    sut.recordCheck("updates");
    sut.recordCheck("failure");
    sut.recordDelivery("success");
    sut.recordEscalation("storage");

    assertThat(registry.meter(MetricsStats.CHECK_RATE + ".updates").getCount(), is(2L));
    assertThat(registry.meter(MetricsStats.CHECK_RATE + ".failure").getCount(), is(1L));
    assertThat(registry.meter(MetricsStats.DELIVERY_RATE + ".success").getCount(), is(1L));
    assertThat(registry.meter(MetricsStats.ESCALATION_RATE + ".storage").getCount(), is(1L));
  }

  @Test
  public void shouldRecordTickDurationPerJobKind() {
    sut.recordTickDuration("listener", 12);
    sut.recordTickDuration("listener", 30);

    assertThat(registry.getHistograms().get(MetricsStats.TICK_DURATION + ".listener").getCount(), is(2L));
  }

  @Test
  public void shouldExposeGauges() {
    sut.registerLiveListenersMetric(() -> 3);
    sut.registerPendingJobsMetric(() -> 5);

    assertThat((Integer) registry.getGauges().get(MetricsStats.LIVE_LISTENERS).getValue(), is(3));
    assertThat((Integer) registry.getGauges().get(MetricsStats.PENDING_JOBS).getValue(), is(5));
  }
}
