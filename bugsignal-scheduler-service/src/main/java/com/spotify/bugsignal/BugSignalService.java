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

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.spotify.bugsignal.monitoring.MetricsStats;
import com.spotify.bugsignal.storage.InMemStorage;
import com.spotify.bugsignal.storage.JdbcStorage;
import com.spotify.bugsignal.storage.Storage;
import com.spotify.bugsignal.util.ConfigUtil;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Runs the engine until a shutdown is requested or the JVM is stopped.
 */
public final class BugSignalService {

  private static final Logger LOG = LoggerFactory.getLogger(BugSignalService.class);

  static final String SERVICE_NAME = "bugsignal";

  static final String STORAGE_JDBC_URL = "bugsignal.storage.jdbc-url";
  static final String STORAGE_USER = "bugsignal.storage.user";
  static final String STORAGE_PASSWORD = "bugsignal.storage.password";
  static final String STORAGE_SCHEMA = "bugsignal.storage.schema";
  static final String METRICS_REPORT_INTERVAL = "bugsignal.metrics.report-interval";

  private BugSignalService() {
    throw new UnsupportedOperationException();
  }

  public static void main(String[] args) throws Exception {
    final Config config = ConfigFactory.load(SERVICE_NAME);
    final CountDownLatch stopped = new CountDownLatch(1);

    final MetricRegistry metricRegistry = new MetricRegistry();
    final Slf4jReporter reporter = Slf4jReporter.forRegistry(metricRegistry)
        .outputTo(LoggerFactory.getLogger("com.spotify.bugsignal.metrics"))
        .build();
    final long reportSeconds = ConfigUtil.get(config, config::getDuration, METRICS_REPORT_INTERVAL)
        .map(d -> d.getSeconds())
        .orElse(0L);
    if (reportSeconds > 0) {
      reporter.start(reportSeconds, TimeUnit.SECONDS);
    }

    final BugSignalScheduler scheduler = BugSignalScheduler.newBuilder()
        .setStorage(storage(config))
        .setStats(new MetricsStats(metricRegistry))
        .setShutdownListener(stopped::countDown)
        .build();

    Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "bugsignal-shutdown"));

    scheduler.start(config);
    stopped.await();
    LOG.info("Stopping");
    reporter.stop();
    scheduler.close();
  }

  static Storage storage(Config config) {
    final Optional<String> jdbcUrl = ConfigUtil.getString(config, STORAGE_JDBC_URL);
    if (jdbcUrl.isEmpty()) {
      LOG.warn("{} is not configured, running with empty in-memory storage", STORAGE_JDBC_URL);
      return new InMemStorage();
    }
    final HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(jdbcUrl.get());
    ConfigUtil.getString(config, STORAGE_USER).ifPresent(hikariConfig::setUsername);
    ConfigUtil.getString(config, STORAGE_PASSWORD).ifPresent(hikariConfig::setPassword);
    hikariConfig.setPoolName("bugsignal-storage");
    hikariConfig.setReadOnly(true);
    hikariConfig.setInitializationFailTimeout(-1);
    final HikariDataSource dataSource = new HikariDataSource(hikariConfig);
    return new JdbcStorage(dataSource, ConfigUtil.getString(config, STORAGE_SCHEMA), Optional.of(dataSource));
  }
}
