/*-
 * =================================LICENSE_START==================================
 * dispatch-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
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
 * ==================================LICENSE_END===================================
 */
package io.aleph0.dispatch.core.dispatch;

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.dispatch.core.ActivityNotifier;

/**
 * Repeats an activity signal for one correlation id, immediately and then every interval, until
 * cancelled. The scheduler only keeps time and the signals are sent on the given executor, at most
 * one at a time. Failures are logged and the indicator keeps going.
 */
class ActivityIndicator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ActivityIndicator.class);

  private final ActivityNotifier notifier;
  private final String correlationId;
  private final String action;
  private final Duration interval;
  private final AtomicBoolean sending = new AtomicBoolean(false);
  private Executor executor;
  private ScheduledFuture<?> future;
  private boolean cancelled;

  public ActivityIndicator(ActivityNotifier notifier, String correlationId, String action,
      Duration interval) {
    this.notifier = requireNonNull(notifier, "notifier");
    this.correlationId = requireNonNull(correlationId, "correlationId");
    this.action = requireNonNull(action, "action");
    this.interval = requireNonNull(interval, "interval");
  }

  public synchronized void start(ScheduledExecutorService scheduler, Executor executor) {
    if (future != null)
      throw new IllegalStateException("already started");
    if (cancelled)
      return;
    this.executor = requireNonNull(executor, "executor");
    future = scheduler.scheduleWithFixedDelay(this::tick, 0L, interval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  public synchronized void cancel() {
    cancelled = true;
    if (future != null)
      future.cancel(false);
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  private void tick() {
    final Executor executor;
    synchronized (this) {
      if (cancelled)
        return;
      executor = this.executor;
    }

    if (!sending.compareAndSet(false, true))
      return;

    try {
      executor.execute(() -> {
        try {
          signal();
        } finally {
          sending.set(false);
        }
      });
    } catch (RejectedExecutionException e) {
      sending.set(false);
    }
  }

  void signal() {
    try {
      notifier.sendActivity(correlationId, action);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      LOGGER.atWarn().addKeyValue("correlationId", correlationId).addKeyValue("action", action)
          .setCause(e).log("Failed to send activity. Continuing...");
    }
  }
}
