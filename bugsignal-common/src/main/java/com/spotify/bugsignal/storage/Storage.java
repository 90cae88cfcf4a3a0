/*-
 * -\-\-
 * BugSignal Common
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
package com.spotify.bugsignal.storage;

import com.spotify.bugsignal.model.Chat;
import com.spotify.bugsignal.model.ListenerDefinition;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * The read side of the persisted configuration used by the engine.
 *
 * <p>Writes (subscribing, enabling listeners) happen through the administrative surface and are
 * not part of this interface.
 */
public interface Storage extends Closeable {

  /**
   * Get listener definitions ordered by id.
   *
   * @param activeOnly only return definitions with the active flag set
   */
  List<ListenerDefinition> listenerDefinitions(boolean activeOnly) throws IOException;

  /**
   * Get the chat ids subscribed to a listener.
   *
   * @param listenerId the listener
   * @param activeOnly only return chats where both the subscription and the chat are active
   */
  List<Long> subscribers(int listenerId, boolean activeOnly) throws IOException;

  /**
   * Get all private chats.
   */
  List<Chat> privateChats(boolean activeOnly) throws IOException;
}
