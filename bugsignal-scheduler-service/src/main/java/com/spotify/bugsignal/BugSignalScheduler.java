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

import static com.spotify.bugsignal.util.CloserUtil.closeable;
import static com.spotify.bugsignal.util.ConfigUtil.getDuration;
import static com.spotify.bugsignal.util.ConfigUtil.getPositiveInt;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import com.google.common.base.Predicates;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spotify.bugsignal.monitoring.Stats;
import com.spotify.bugsignal.storage.Storage;
import com.spotify.bugsignal.util.ConfigUtil;
import com.spotify.bugsignal.util.Time;
import com.spotify.bugsignal.util.TimeUtil;
import com.typesafe.config.Config;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine together and exposes the administrative commands.
 */
public class BugSignalScheduler implements AdminCommands, Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(BugSignalScheduler.class);

  static final String TIMEZONE = "bugsignal.timezone";
  static final String TIMEOUT_COMMON = "bugsignal.timeout.common";
  static final String TIMEOUT_START = "bugsignal.timeout.start";
  static final String TIMEOUT_CLOSE = "bugsignal.timeout.close";
  static final String TIMEOUT_RETRY_INTERVAL = "bugsignal.timeout.retry-interval";
  static final String TIMEOUT_LIFETIME = "bugsignal.timeout.lifetime";
  static final String TIMEOUT_FORCE_CHECK_POLL = "bugsignal.timeout.force-check-poll";
  static final String ACTUALIZER_SCHEDULE = "bugsignal.actualizer.schedule";
  static final String DELIVERY_MAX_MESSAGE_LENGTH = "bugsignal.delivery.max-message-length";
  static final String DELIVERY_CONCURRENCY = "bugsignal.delivery.concurrency";
  static final String WORKERS = "bugsignal.workers";
  static final String ESCALATION_AUDIENCE_TTL = "bugsignal.escalation.audience-ttl";

  static final Duration DEFAULT_TIMEOUT_COMMON = Duration.ofSeconds(300);
  static final Duration DEFAULT_TIMEOUT_START = Duration.ofMillis(2500);
  static final Duration DEFAULT_TIMEOUT_CLOSE = Duration.ofSeconds(5);
  static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(15);
  static final Duration DEFAULT_LIFETIME = Duration.ofSeconds(30);
  static final Duration DEFAULT_FORCE_CHECK_POLL = Duration.ofMillis(100);
  static final String DEFAULT_ACTUALIZER_SCHEDULE = "0 0 * * *";
  static final int DEFAULT_MAX_MESSAGE_LENGTH = 4096;
  static final int DEFAULT_DELIVERY_CONCURRENCY = 32;
  static final int DEFAULT_WORKERS = 8;
  static final Duration DEFAULT_AUDIENCE_TTL = Duration.ofSeconds(60);

  private static final Duration EXECUTOR_CLOSE_TIMEOUT = Duration.ofSeconds(1);

  @FunctionalInterface
  interface ExecutorFactory {
    ScheduledExecutorService create(int threads, ThreadFactory threadFactory);
  }

  @FunctionalInterface
  interface WorkerExecutorFactory {
    ExecutorService create(int threads, ThreadFactory threadFactory);
  }

  public static class Builder {

    private Time time = Time.SYSTEM;
    private Storage storage;
    private MessageSender messageSender = new LoggingMessageSender();
    private Stats stats = Stats.NOOP;
    private ExecutorFactory executorFactory = Executors::newScheduledThreadPool;
    private WorkerExecutorFactory workerExecutorFactory = Executors::newFixedThreadPool;
    private Runnable shutdownListener = () -> { };

    public Builder setTime(Time time) {
      this.time = time;
      return this;
    }

    public Builder setStorage(Storage storage) {
      this.storage = storage;
      return this;
    }

    public Builder setMessageSender(MessageSender messageSender) {
      this.messageSender = messageSender;
      return this;
    }

    public Builder setStats(Stats stats) {
      this.stats = stats;
      return this;
    }

    Builder setExecutorFactory(ExecutorFactory executorFactory) {
      this.executorFactory = executorFactory;
      return this;
    }

    Builder setWorkerExecutorFactory(WorkerExecutorFactory workerExecutorFactory) {
      this.workerExecutorFactory = workerExecutorFactory;
      return this;
    }

    /**
     * Called by the shutdown job once the close delay has passed.
     */
    public Builder setShutdownListener(Runnable shutdownListener) {
      this.shutdownListener = shutdownListener;
      return this;
    }

    public BugSignalScheduler build() {
      return new BugSignalScheduler(this);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private final Time time;
  private final Storage storage;
  private final MessageSender messageSender;
  private final Stats stats;
  private final ExecutorFactory executorFactory;
  private final WorkerExecutorFactory workerExecutorFactory;
  private final Runnable shutdownListener;

  private final Closer closer = Closer.create();
  private final ListenerRegistry registry = new ListenerRegistry();

  private JobScheduler jobs;
  private Actualizer actualizer;
  private Dispatcher dispatcher;
  private ErrorEscalation escalation;
  private Duration commonTimeout;
  private Duration closeDelay;
  private Duration forceCheckPoll;

  private BugSignalScheduler(Builder builder) {
    this.time = requireNonNull(builder.time);
    this.storage = requireNonNull(builder.storage, "storage");
    this.messageSender = requireNonNull(builder.messageSender);
    this.stats = requireNonNull(builder.stats);
    this.executorFactory = requireNonNull(builder.executorFactory);
    this.workerExecutorFactory = requireNonNull(builder.workerExecutorFactory);
    this.shutdownListener = requireNonNull(builder.shutdownListener);
  }

  /**
   * Wire the engine from configuration and arm the first reconciliation pass after the start delay.
   */
  public synchronized void start(Config config) {
    if (jobs != null) {
      throw new IllegalStateException("Already started");
    }

    final ZoneId zone = TimeUtil.zoneId(ConfigUtil.get(config, TIMEZONE, "UTC"));
    commonTimeout = getDuration(config, TIMEOUT_COMMON, DEFAULT_TIMEOUT_COMMON);
    closeDelay = getDuration(config, TIMEOUT_CLOSE, DEFAULT_TIMEOUT_CLOSE);
    forceCheckPoll = getDuration(config, TIMEOUT_FORCE_CHECK_POLL, DEFAULT_FORCE_CHECK_POLL);
    final Duration startDelay = getDuration(config, TIMEOUT_START, DEFAULT_TIMEOUT_START);
    final Duration retryInterval = getDuration(config, TIMEOUT_RETRY_INTERVAL, DEFAULT_RETRY_INTERVAL);
    final Duration lifetime = getDuration(config, TIMEOUT_LIFETIME, DEFAULT_LIFETIME);
    final String actualizerSchedule = ConfigUtil.get(config, ACTUALIZER_SCHEDULE, DEFAULT_ACTUALIZER_SCHEDULE);
    final int maxMessageLength = getPositiveInt(config, DELIVERY_MAX_MESSAGE_LENGTH, DEFAULT_MAX_MESSAGE_LENGTH);
    final int deliveryConcurrency = getPositiveInt(config, DELIVERY_CONCURRENCY, DEFAULT_DELIVERY_CONCURRENCY);
    final int workers = getPositiveInt(config, WORKERS, DEFAULT_WORKERS);
    final Duration audienceTtl = getDuration(config, ESCALATION_AUDIENCE_TTL, DEFAULT_AUDIENCE_TTL);

    final Thread.UncaughtExceptionHandler uncaughtExceptionHandler =
        (thread, throwable) -> LOG.error("Thread {} threw {}", thread, throwable);

    // Closer is a stack (LIFO): storage is registered first so that it is closed last
    closer.register(storage);
    closer.register((Closeable) this::closeListeners);

    final ExecutorService deliveryExecutor = workerExecutorFactory.create(deliveryConcurrency,
        threadFactory("bugsignal-delivery-%d", uncaughtExceptionHandler));
    closer.register(closeable(deliveryExecutor, "delivery", EXECUTOR_CLOSE_TIMEOUT));
    final ExecutorService workerExecutor = workerExecutorFactory.create(workers,
        threadFactory("bugsignal-worker-%d", uncaughtExceptionHandler));
    closer.register(closeable(workerExecutor, "worker", EXECUTOR_CLOSE_TIMEOUT));
    final ScheduledExecutorService timer = executorFactory.create(1,
        threadFactory("bugsignal-timer-%d", uncaughtExceptionHandler));
    closer.register(closeable(timer, "timer", EXECUTOR_CLOSE_TIMEOUT));

    final MessageDelivery delivery = new MessageDelivery(messageSender, deliveryExecutor, stats,
        maxMessageLength, retryInterval, lifetime, commonTimeout);
    escalation = new ErrorEscalation(storage, delivery, time, audienceTtl, stats);
    jobs = closer.register(new JobScheduler(timer, workerExecutor, time, stats, this::runJob, escalation::handle));
    dispatcher = new Dispatcher(storage, registry, jobs, delivery, stats);
    actualizer = new Actualizer(storage, registry, jobs, new ListenerFactory(zone, time),
        new CronSchedule(actualizerSchedule, zone, time), retryInterval, time);

    stats.registerLiveListenersMetric(registry::size);
    stats.registerPendingJobsMetric(jobs::size);

    jobs.schedule(Job.actualizer(time.get().plus(startDelay)));
    LOG.info("Started, timezone {}, first actualization in {}", zone, startDelay);
  }

  private static ThreadFactory threadFactory(String nameFormat,
      Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
    return new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat(nameFormat)
        .setUncaughtExceptionHandler(uncaughtExceptionHandler)
        .build();
  }

  private void runJob(Job job) throws Exception {
    switch (job.kind()) {
      case ACTUALIZER:
        actualizer.actualize();
        break;
      case LISTENER:
      case CHECKER:
        dispatcher.dispatch(job);
        break;
      case SHUTDOWN:
        LOG.info("Shutting down");
        shutdownListener.run();
        break;
      default:
        throw new IllegalArgumentException("Unknown job kind: " + job.kind());
    }
  }

  @Override
  public void forceCheck(Set<Integer> listenerIds, Optional<Long> callerChat) throws ForceCheckTimeoutException {
    final JobScheduler scheduler = started();
    final Map<Integer, Listener> live = registry.snapshot();
    final List<Listener> targets;
    if (listenerIds.isEmpty()) {
      targets = ImmutableList.copyOf(live.values());
    } else {
      listenerIds.stream()
          .filter(id -> !live.containsKey(id))
          .forEach(id -> LOG.warn("Cannot force check of listener {}: not live", id));
      targets = listenerIds.stream()
          .filter(live::containsKey)
          .map(live::get)
          .collect(ImmutableList.toImmutableList());
    }

    final Instant now = time.get();
    final List<Job> checks = targets.stream()
        .map(listener -> Job.checker(listener, now, callerChat))
        .collect(ImmutableList.toImmutableList());
    checks.forEach(scheduler::schedule);
    LOG.info("Forced check of {} listener(s)", checks.size());

    final Retryer<Boolean> retryer = RetryerBuilder.<Boolean>newBuilder()
        .retryIfResult(Predicates.equalTo(Boolean.TRUE))
        .withWaitStrategy(WaitStrategies.fixedWait(forceCheckPoll.toMillis(), MILLISECONDS))
        .withStopStrategy(StopStrategies.stopAfterDelay(commonTimeout.toMillis(), MILLISECONDS))
        .build();
    try {
      retryer.call(() -> checks.stream().anyMatch(scheduler::isActive));
    } catch (RetryException e) {
      final int remaining = (int) checks.stream().filter(scheduler::isActive).count();
      throw new ForceCheckTimeoutException(remaining, commonTimeout, e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    }
  }

  @Override
  public void actualize() throws IOException {
    started();
    try {
      actualizer.actualize();
    } catch (IOException e) {
      escalation.handle(e);
      throw e;
    }
  }

  @Override
  public JobState jobState() {
    final List<JobSnapshot> pending = started().pending().stream()
        .map(JobSnapshot::of)
        .sorted(Comparator.comparing(JobSnapshot::name).thenComparing(JobSnapshot::due))
        .collect(ImmutableList.toImmutableList());
    return JobState.create(pending, registry.size());
  }

  @Override
  public void shutdown() {
    final Instant at = time.get().plus(closeDelay);
    started().schedule(Job.shutdown(at));
    LOG.info("Shutdown requested, stopping at {}", at);
  }

  private synchronized JobScheduler started() {
    if (jobs == null) {
      throw new IllegalStateException("Not started");
    }
    return jobs;
  }

  private void closeListeners() {
    registry.snapshot().values().forEach(Listener::close);
  }

  @Override
  public void close() throws IOException {
    closer.close();
  }
}
