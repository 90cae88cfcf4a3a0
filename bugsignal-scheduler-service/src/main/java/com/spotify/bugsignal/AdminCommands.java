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

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Commands of the administrative surface.
 */
public interface AdminCommands {

  /**
   * Check listeners now and wait until the checks and their deliveries are done.
   *
   * @param listenerIds the listeners to check, all live listeners if empty
   * @param callerChat  the chat that asked, notified if a check fails
   * @throws ForceCheckTimeoutException if the checks did not complete within the common timeout
   */
  void forceCheck(Set<Integer> listenerIds, Optional<Long> callerChat) throws ForceCheckTimeoutException;

  /**
   * Run a reconciliation pass now.
   *
   * @throws IOException if the definitions could not be read
   */
  void actualize() throws IOException;

  JobState jobState();

  /**
   * Stop the engine after the close delay.
   */
  void shutdown();
}
