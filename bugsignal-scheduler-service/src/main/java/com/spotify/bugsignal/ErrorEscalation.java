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

import static com.spotify.bugsignal.util.ExceptionUtil.describe;
import static com.spotify.bugsignal.util.ExceptionUtil.findCause;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.spotify.bugsignal.model.Chat;
import com.spotify.bugsignal.model.UserRole;
import com.spotify.bugsignal.monitoring.Stats;
import com.spotify.bugsignal.storage.Storage;
import com.spotify.bugsignal.util.CachedSupplier;
import com.spotify.bugsignal.util.Time;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies failures and notifies the developer audience about them.
 *
 * <p>The audience is every active private chat with the {@link UserRole#DEVELOPER} role. It is
 * cached, so that a storage outage is still reported to the developers known before it.
 */
public class ErrorEscalation {

  private static final Logger LOG = LoggerFactory.getLogger(ErrorEscalation.class);

  static final String SERVICE_DEGRADED =
      "Something went wrong: the service cannot reach its storage. See the service log for details.";

  private final CachedSupplier<List<Long>> developers;
  private final MessageDelivery delivery;
  private final Stats stats;

  public ErrorEscalation(Storage storage, MessageDelivery delivery, Time time, Duration audienceTtl, Stats stats) {
    requireNonNull(storage);
    this.developers = new CachedSupplier<>(() -> developers(storage), time, audienceTtl);
    this.delivery = requireNonNull(delivery);
    this.stats = requireNonNull(stats);
  }

  private static List<Long> developers(Storage storage) throws IOException {
    return storage.privateChats(true).stream()
        .filter(chat -> chat.hasRole(UserRole.DEVELOPER))
        .map(Chat::id)
        .collect(ImmutableList.toImmutableList());
  }

  public void handle(Throwable failure) {
    final Optional<ListenerCheckException> checkFailure = findCause(failure, ListenerCheckException.class);
    if (checkFailure.isPresent()) {
      final ListenerCheckException e = checkFailure.get();
      LOG.error("Listener check failed: {}", describe(e), e);
      stats.recordEscalation("listener");
      final Set<Long> audience = new LinkedHashSet<>(developers().orElse(ImmutableList.of()));
      e.callerChat().ifPresent(audience::add);
      send(audience, "Listener " + e.listenerName() + " (" + e.listenerId() + ") check failed: "
                       + describe(e.getCause() == null ? e : e.getCause()));
    } else if (findCause(failure, IOException.class).isPresent()) {
      LOG.error("Storage failure", failure);
      stats.recordEscalation("storage");
      developers().ifPresent(audience -> send(audience, SERVICE_DEGRADED));
    } else {
      LOG.error("Unhandled failure", failure);
      stats.recordEscalation("other");
    }
  }

  private Optional<List<Long>> developers() {
    try {
      return Optional.of(developers.get());
    } catch (RuntimeException e) {
      LOG.warn("Developer audience is unknown, notification dropped", e);
      return Optional.empty();
    }
  }

  private void send(Set<Long> audience, String text) {
    send(ImmutableList.copyOf(audience), text);
  }

  private void send(List<Long> audience, String text) {
    if (audience.isEmpty()) {
      LOG.warn("Nobody to notify: {}", text);
      return;
    }
    delivery.deliver(audience, ImmutableList.of(text));
  }
}
