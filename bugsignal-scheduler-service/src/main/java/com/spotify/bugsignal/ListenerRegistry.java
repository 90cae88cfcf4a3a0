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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The table of live listeners. Replaced as a whole by the actualizer; read by dispatchers.
 *
 * <p>The registry lock is always taken before the {@link JobScheduler} lock.
 */
public class ListenerRegistry {

  private final Object lock = new Object();
  private volatile ImmutableMap<Integer, Listener> listeners = ImmutableMap.of();

  public Map<Integer, Listener> snapshot() {
    return listeners;
  }

  public Optional<Listener> get(int id) {
    return Optional.ofNullable(listeners.get(id));
  }

  public int size() {
    return listeners.size();
  }

  /**
   * Swap in a new table and run an action against it before any other reader can act on it.
   */
  public void replaceAll(Map<Integer, Listener> next, Consumer<Map<Integer, Listener>> whileLocked) {
    synchronized (lock) {
      listeners = ImmutableMap.copyOf(next);
      whileLocked.accept(listeners);
    }
  }

  /**
   * Run an action if the listener is still the live instance for its id.
   *
   * @return true if the action ran
   */
  public boolean ifCurrent(Listener listener, Runnable action) {
    synchronized (lock) {
      if (listeners.get(listener.id()) != listener) {
        return false;
      }
      action.run();
      return true;
    }
  }
}
