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
package com.spotify.bugsignal.driver;

import static java.util.Objects.requireNonNull;

import com.spotify.bugsignal.model.DriverKind;
import java.io.IOException;
import java.util.List;

/**
 * Base class that owns the checkpoint of a driver. Subclasses compute an {@link Observation} from
 * the current checkpoint; the checkpoint is only replaced once the observation has succeeded.
 */
public abstract class AbstractSourceDriver<C> implements SourceDriver<C> {

  private final DriverKind kind;
  private C checkpoint;

  protected AbstractSourceDriver(DriverKind kind, C initialCheckpoint) {
    this.kind = requireNonNull(kind);
    this.checkpoint = requireNonNull(initialCheckpoint);
  }

  @Override
  public final DriverKind kind() {
    return kind;
  }

  @Override
  public final synchronized List<String> check() throws IOException {
    final Observation<C> observation = observe(checkpoint);
    checkpoint = observation.checkpoint();
    return observation.messages();
  }

  @Override
  public final synchronized C checkpoint() {
    return checkpoint;
  }

  @Override
  public final void inherit(SourceDriver<?> previous) {
    if (previous.kind() != kind || previous.getClass() != getClass()) {
      throw new IllegalArgumentException(
          "Cannot inherit " + kind + " checkpoint from " + previous.kind() + " driver");
    }
    @SuppressWarnings("unchecked") final C inherited = (C) previous.checkpoint();
    synchronized (this) {
      checkpoint = requireNonNull(merge(checkpoint, inherited));
    }
  }

  /**
   * Observe the source relative to a checkpoint.
   */
  protected abstract Observation<C> observe(C checkpoint) throws IOException;

  /**
   * Combine the checkpoint of a freshly constructed driver with one inherited from its
   * predecessor. Defaults to taking the inherited one.
   */
  protected C merge(C fresh, C inherited) {
    return inherited;
  }
}
