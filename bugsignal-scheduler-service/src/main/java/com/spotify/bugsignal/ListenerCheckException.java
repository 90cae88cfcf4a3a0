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

import java.util.Optional;

/**
 * A listener check failed.
 */
public class ListenerCheckException extends Exception {

  private final int listenerId;
  private final String listenerName;
  private final Optional<Long> callerChat;

  public ListenerCheckException(int listenerId, String listenerName, Optional<Long> callerChat, Throwable cause) {
    super("Check of listener " + listenerName + " (" + listenerId + ") failed", cause);
    this.listenerId = listenerId;
    this.listenerName = listenerName;
    this.callerChat = callerChat;
  }

  public int listenerId() {
    return listenerId;
  }

  public String listenerName() {
    return listenerName;
  }

  /**
   * The chat that requested a forced check, if any.
   */
  public Optional<Long> callerChat() {
    return callerChat;
  }
}
