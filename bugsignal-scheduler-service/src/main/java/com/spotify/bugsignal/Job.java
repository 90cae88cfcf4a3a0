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

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A one-shot work item of the {@link JobScheduler}.
 *
 * <p>Jobs with the same key replace each other: there is one key per listener for
 * {@link JobKind#LISTENER} jobs, one for the actualizer and one for shutdown, while every
 * {@link JobKind#CHECKER} job has a key of its own.
 */
public final class Job {

  private static final AtomicLong CHECKER_SEQUENCE = new AtomicLong();

  static final String ACTUALIZER_NAME = "actualizer";
  static final String SHUTDOWN_NAME = "shutdown";

  private final String key;
  private final String name;
  private final JobKind kind;
  private final Instant due;
  private final Optional<Listener> listener;
  private final Optional<Long> callerChat;
  private final boolean finalFlush;
  private final CompletableFuture<Void> done = new CompletableFuture<>();

  private Job(String key, String name, JobKind kind, Instant due, Optional<Listener> listener,
      Optional<Long> callerChat, boolean finalFlush) {
    this.key = requireNonNull(key);
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.due = requireNonNull(due);
    this.listener = requireNonNull(listener);
    this.callerChat = requireNonNull(callerChat);
    this.finalFlush = finalFlush;
  }

  public static Job actualizer(Instant due) {
    return new Job(ACTUALIZER_NAME, ACTUALIZER_NAME, JobKind.ACTUALIZER, due, Optional.empty(), Optional.empty(),
        false);
  }

  public static Job shutdown(Instant due) {
    return new Job(SHUTDOWN_NAME, SHUTDOWN_NAME, JobKind.SHUTDOWN, due, Optional.empty(), Optional.empty(), false);
  }

  public static Job listener(Listener listener, Instant due) {
    return new Job(listenerKey(listener.id()), listener.name(), JobKind.LISTENER, due, Optional.of(listener),
        Optional.empty(), false);
  }

  public static Job checker(Listener listener, Instant due, Optional<Long> callerChat) {
    return new Job("checker#" + CHECKER_SEQUENCE.incrementAndGet(), listener.name(), JobKind.CHECKER, due,
        Optional.of(listener), callerChat, false);
  }

  /**
   * A last check of a listener that is being replaced by one of another kind, closing it afterwards.
   */
  public static Job finalFlush(Listener listener, Instant due) {
    return new Job("checker#" + CHECKER_SEQUENCE.incrementAndGet(), listener.name(), JobKind.CHECKER, due,
        Optional.of(listener), Optional.empty(), true);
  }

  static String listenerKey(int listenerId) {
    return "listener#" + listenerId;
  }

  public String key() {
    return key;
  }

  public String name() {
    return name;
  }

  public JobKind kind() {
    return kind;
  }

  public Instant due() {
    return due;
  }

  public Optional<Listener> listener() {
    return listener;
  }

  public Optional<Long> callerChat() {
    return callerChat;
  }

  public boolean finalFlush() {
    return finalFlush;
  }

  /**
   * Completes when the job has run or was dropped.
   */
  public CompletableFuture<Void> done() {
    return done;
  }

  @Override
  public String toString() {
    return kind + "{" + name + " at " + due + "}";
  }
}
