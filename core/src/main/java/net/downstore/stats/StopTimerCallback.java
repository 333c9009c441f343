// This file is part of Downstore.
// Copyright (C) 2026  The Downstore Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.downstore.stats;

import static com.google.common.base.Preconditions.checkNotNull;

import com.codahale.metrics.Timer;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

/**
 * A {@link Callback} for use with {@link Deferred}s that stops the provided
 * timer on success or failure and passes the result through unchanged.
 */
public class StopTimerCallback<T> implements Callback<T, T> {
  private final Timer.Context timer_context;

  /**
   * Create a new instance that will stop the provided timer when called.
   *
   * @param timer_context The timer to call stop on
   */
  public StopTimerCallback(final Timer.Context timer_context) {
    this.timer_context = checkNotNull(timer_context);
  }

  /**
   * Add a callback on the provided {@link Deferred} that will stop the
   * provided {@link com.codahale.metrics.Timer.Context} once called.
   *
   * @param timer_context The timer to stop
   * @param deferred The deferred to wait on
   * @param <T> The type of result of the deferred
   * @return The deferred with the callback attached.
   */
  public static <T> Deferred<T> stopOn(final Timer.Context timer_context,
                                       final Deferred<T> deferred) {
    return deferred.addBoth(new StopTimerCallback<T>(timer_context));
  }

  @Override
  public T call(final T result) {
    timer_context.stop();
    return result;
  }

  @Override
  public String toString() {
    return "StopTimerCallback";
  }
}
