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
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Supplier} that caches the value of an expensive or failure-prone delegate for a time to
 * live. When refreshing fails after a value has been read once, the last known value is returned.
 */
public class CachedSupplier<T> implements Supplier<T> {

  private static final Logger LOG = LoggerFactory.getLogger(CachedSupplier.class);

  private final ThrowingSupplier<T, Exception> delegate;
  private final Time time;
  private final Duration ttl;

  private final Object lock = new Object();
  private volatile T cachedValue;
  private volatile Instant cacheTime = Instant.MIN;

  public CachedSupplier(ThrowingSupplier<T, Exception> delegate, Time time, Duration ttl) {
    this.delegate = Objects.requireNonNull(delegate);
    this.time = Objects.requireNonNull(time);
    this.ttl = Objects.requireNonNull(ttl);
  }

  /**
   * Get the value, refreshing it if it is older than the time to live.
   *
   * @throws RuntimeException wrapping the delegate failure if no value was ever read
   */
  @Override
  public T get() {
    final T value = cachedValue;
    if (value != null && !expired()) {
      return value;
    }
    return getSynchronized();
  }

  /**
   * The last value read, without refreshing.
   */
  public Optional<T> lastKnown() {
    return Optional.ofNullable(cachedValue);
  }

  private T getSynchronized() {
    synchronized (lock) {
      final T value = cachedValue;
      if (value != null && !expired()) {
        return value;
      }
      try {
        final T newValue = Objects.requireNonNull(delegate.get());
        cachedValue = newValue;
        cacheTime = time.get();
        return newValue;
      } catch (Exception e) {
        if (value == null) {
          Throwables.throwIfUnchecked(e);
          throw new RuntimeException(e);
        }
        LOG.warn("Failed to refresh cached value, using last known value", e);
        return value;
      }
    }
  }

  private boolean expired() {
    return cacheTime.plus(ttl).isBefore(time.get());
  }

  @FunctionalInterface
  public interface ThrowingSupplier<T, E extends Exception> {
    T get() throws E;
  }
}
