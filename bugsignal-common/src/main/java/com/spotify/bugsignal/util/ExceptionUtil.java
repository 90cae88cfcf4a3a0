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
package com.spotify.bugsignal.util;

import com.google.common.base.Throwables;
import java.util.Optional;

public final class ExceptionUtil {

  private ExceptionUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Find the first throwable of a type in a causal chain.
   */
  public static <T extends Throwable> Optional<T> findCause(Throwable throwable, Class<T> type) {
    for (Throwable cause : Throwables.getCausalChain(throwable)) {
      if (type.isInstance(cause)) {
        return Optional.of(type.cast(cause));
      }
    }
    return Optional.empty();
  }

  /**
   * A one line description of a causal chain, e.g. {@code IOException: read failed <- SQLException: gone}.
   */
  public static String describe(Throwable throwable) {
    final StringBuilder sb = new StringBuilder();
    for (Throwable cause : Throwables.getCausalChain(throwable)) {
      if (sb.length() > 0) {
        sb.append(" <- ");
      }
      sb.append(cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        sb.append(": ").append(cause.getMessage());
      }
    }
    return sb.toString();
  }
}
