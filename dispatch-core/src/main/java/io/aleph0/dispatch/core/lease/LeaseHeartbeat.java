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
package io.aleph0.dispatch.core.lease;

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.dispatch.core.broker.Broker;

/**
 * Keeps one received message invisible to other receivers while it is being worked on by extending
 * its lease every {@code interval}, by {@code extension} each time, until cancelled.
 *
 * <p>
 * The heartbeat moves through the following states:
 * 
 * <pre>
 *     READY ─► RUNNING ─► CANCELLED
 *       │                    ▲
 *       └────────────────────┘
 * </pre>
 * 
 * <p>
 * The scheduler only keeps time. Each tick hands the extension call to an executor, so that a broker
 * call that hangs for one message cannot hold up the heartbeats of other messages. A tick that finds
 * the previous extension still in progress is skipped.
 *
 * <p>
 * A failed extension is logged and the heartbeat keeps going; a single missed extension is not
 * fatal as long as the next one lands before the lease runs out. If extensions keep failing, the
 * broker may deliver the message to another receiver, which handlers must tolerate.
 */
public class LeaseHeartbeat {
  private static final Logger LOGGER = LoggerFactory.getLogger(LeaseHeartbeat.class);

  /**
   * Receives the outcome of every extension attempt.
   */
  public static interface Listener {
    default void onLeaseExtended(LeaseHeartbeat heartbeat) {}

    default void onLeaseExtensionFailed(LeaseHeartbeat heartbeat, Exception cause) {}

    default void onHeartbeatCancelled(LeaseHeartbeat heartbeat) {}
  }

  public static enum State {
    READY {
      @Override
      public State to(State target) {
        if (target == RUNNING || target == CANCELLED)
          return target;
        throw new IllegalStateException("Invalid transition from READY to " + target);
      }
    },
    RUNNING {
      @Override
      public State to(State target) {
        if (target == CANCELLED)
          return target;
        throw new IllegalStateException("Invalid transition from RUNNING to " + target);
      }
    },
    CANCELLED {
      @Override
      public State to(State target) {
        throw new IllegalStateException("Invalid transition from CANCELLED to " + target);
      }
    };

    /**
     * Validate that the transition to the target state is valid.
     * 
     * @param target the target state
     * @return the target state
     * @throws IllegalStateException if the transition is invalid
     */
    public abstract State to(State target);
  }

  private static final Listener NOP_LISTENER = new Listener() {};

  private final AtomicReference<State> state = new AtomicReference<>(State.READY);
  private final AtomicLong extensions = new AtomicLong(0);
  private final AtomicLong failures = new AtomicLong(0);
  private final AtomicLong skipped = new AtomicLong(0);
  private final AtomicBoolean extending = new AtomicBoolean(false);
  private final Broker broker;
  private final String address;
  private final String messageId;
  private final String leaseToken;
  private final Duration interval;
  private final Duration extension;
  private final Listener listener;
  private volatile Executor executor;
  private volatile ScheduledFuture<?> future;

  public LeaseHeartbeat(Broker broker, String address, String messageId, String leaseToken,
      Duration interval, Duration extension) {
    this(broker, address, messageId, leaseToken, interval, extension, NOP_LISTENER);
  }

  public LeaseHeartbeat(Broker broker, String address, String messageId, String leaseToken,
      Duration interval, Duration extension, Listener listener) {
    this.broker = requireNonNull(broker, "broker");
    this.address = requireNonNull(address, "address");
    this.messageId = requireNonNull(messageId, "messageId");
    this.leaseToken = requireNonNull(leaseToken, "leaseToken");
    this.interval = requireNonNull(interval, "interval");
    this.extension = requireNonNull(extension, "extension");
    this.listener = requireNonNull(listener, "listener");
    if (interval.isNegative() || interval.isZero())
      throw new IllegalArgumentException("interval must be positive");
    if (extension.isNegative() || extension.isZero())
      throw new IllegalArgumentException("extension must be positive");
  }

  /**
   * Schedules the first extension one interval from now, and every interval after that, running the
   * extensions on the scheduler's own threads.
   *
   * @param scheduler the scheduler to time and run extensions on
   * @throws IllegalStateException if the heartbeat was already started or cancelled
   */
  public void start(ScheduledExecutorService scheduler) {
    start(scheduler, Runnable::run);
  }

  /**
   * Schedules the first extension one interval from now, and every interval after that.
   *
   * @param scheduler the scheduler that times the extensions
   * @param executor the executor that makes the extension calls
   * @throws IllegalStateException if the heartbeat was already started or cancelled
   */
  public void start(ScheduledExecutorService scheduler, Executor executor) {
    requireNonNull(scheduler, "scheduler");
    requireNonNull(executor, "executor");
    synchronized (this) {
      state.set(state.get().to(State.RUNNING));
      this.executor = executor;
      future = scheduler.scheduleWithFixedDelay(this::tick, interval.toMillis(),
          interval.toMillis(), TimeUnit.MILLISECONDS);
    }
    LOGGER.atDebug().addKeyValue("messageId", messageId).addKeyValue("interval", interval)
        .log("Heartbeat started");
  }

  /**
   * Stops extending the lease. An extension that is already in progress is allowed to finish.
   * Idempotent.
   */
  public void cancel() {
    synchronized (this) {
      if (state.get() == State.CANCELLED)
        return;
      state.set(state.get().to(State.CANCELLED));
      if (future != null)
        future.cancel(false);
    }
    LOGGER.atDebug().addKeyValue("messageId", messageId).addKeyValue("extensions", extensions.get())
        .log("Heartbeat cancelled");
    try {
      listener.onHeartbeatCancelled(this);
    } catch (Exception e) {
      LOGGER.atError().setCause(e).log("Error notifying heartbeat listener");
    }
  }

  void tick() {
    if (state.get() != State.RUNNING)
      return;

    if (!extending.compareAndSet(false, true)) {
      skipped.incrementAndGet();
      LOGGER.atDebug().addKeyValue("messageId", messageId)
          .log("Previous extension still in progress. Skipping beat...");
      return;
    }

    try {
      executor.execute(() -> {
        try {
          beat();
        } finally {
          extending.set(false);
        }
      });
    } catch (RejectedExecutionException e) {
      extending.set(false);
      LOGGER.atDebug().addKeyValue("messageId", messageId)
          .log("Extension executor shut down. Skipping beat...");
    }
  }

  void beat() {
    if (state.get() != State.RUNNING)
      return;

    try {
      broker.extendLease(address, leaseToken, extension);
      extensions.incrementAndGet();
      LOGGER.atDebug().addKeyValue("messageId", messageId).addKeyValue("extension", extension)
          .log("Extended lease");
      listener.onLeaseExtended(this);
    } catch (Exception e) {
      // Never propagate, or the scheduler silently stops running this heartbeat
      failures.incrementAndGet();
      LOGGER.atWarn().addKeyValue("messageId", messageId).addKeyValue("address", address)
          .setCause(e).log("Failed to extend lease. Continuing...");
      try {
        listener.onLeaseExtensionFailed(this, e);
      } catch (Exception x) {
        LOGGER.atError().setCause(x).log("Error notifying heartbeat listener");
      }
    }
  }

  public State getState() {
    return state.get();
  }

  public String getAddress() {
    return address;
  }

  public String getMessageId() {
    return messageId;
  }

  /**
   * @return the number of successful extensions so far
   */
  public long getExtensions() {
    return extensions.get();
  }

  /**
   * @return the number of failed extensions so far
   */
  public long getFailures() {
    return failures.get();
  }

  /**
   * @return the number of beats skipped because the previous extension had not finished
   */
  public long getSkipped() {
    return skipped.get();
  }
}
