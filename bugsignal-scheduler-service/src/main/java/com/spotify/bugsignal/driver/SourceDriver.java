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

import com.spotify.bugsignal.model.DriverKind;
import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Observes one kind of source for changes since its checkpoint.
 *
 * @param <C> the immutable checkpoint type
 */
public interface SourceDriver<C> extends Closeable {

  DriverKind kind();

  /**
   * Observe changes since the checkpoint and advance the checkpoint.
   *
   * <p>The checkpoint is left untouched when this throws.
   *
   * @return zero or more messages describing the changes
   */
  List<String> check() throws IOException;

  C checkpoint();

  /**
   * Take over the checkpoint of a previous driver of the same kind.
   *
   * @throws IllegalArgumentException if the previous driver is of a different kind
   */
  void inherit(SourceDriver<?> previous);

  /**
   * Release held resources. Idempotent; failures are logged.
   */
  @Override
  void close();
}
