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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.dispatch.core.Measureable;
import io.aleph0.dispatch.core.broker.Broker;

/**
 * Starts {@link LeaseHeartbeat heartbeats} on a shared scheduler and keeps track of the ones still
 * running, so that they can all be cancelled at shutdown. The scheduler only times the beats; the
 * extension calls run on the given executor.
 */
public class LeaseKeeper implements Measureable<HeartbeatMetrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(LeaseKeeper.class);

  private final Set<LeaseHeartbeat> active = Collections.newSetFromMap(new ConcurrentHashMap<>());
  private final AtomicLong startedMetric = new AtomicLong(0);
  private final AtomicLong extensionsMetric = new AtomicLong(0);
  private final AtomicLong failuresMetric = new AtomicLong(0);
  private final LeaseHeartbeat.Listener listener = new LeaseHeartbeat.Listener() {
    @Override
    public void onLeaseExtended(LeaseHeartbeat heartbeat) {
      extensionsMetric.incrementAndGet();
    }

    @Override
    public void onLeaseExtensionFailed(LeaseHeartbeat heartbeat, Exception cause) {
      failuresMetric.incrementAndGet();
    }

    @Override
    public void onHeartbeatCancelled(LeaseHeartbeat heartbeat) {
      active.remove(heartbeat);
    }
  };

  private final Broker broker;
  private final ScheduledExecutorService scheduler;
  private final Executor executor;
  private final Duration interval;
  private final Duration extension;

  public LeaseKeeper(Broker broker, ScheduledExecutorService scheduler, Duration interval,
      Duration extension) {
    this(broker, scheduler, scheduler, interval, extension);
  }

  public LeaseKeeper(Broker broker, ScheduledExecutorService scheduler, Executor executor,
      Duration interval, Duration extension) {
    this.broker = requireNonNull(broker, "broker");
    this.scheduler = requireNonNull(scheduler, "scheduler");
    this.executor = requireNonNull(executor, "executor");
    this.interval = requireNonNull(interval, "interval");
    this.extension = requireNonNull(extension, "extension");
  }

  /**
   * Starts a heartbeat for the given message.
   *
   * @param address the queue address
   * @param messageId the message id, for logging
   * @param leaseToken the lease token of the delivery
   * @return the running heartbeat
   */
  public LeaseHeartbeat start(String address, String messageId, String leaseToken) {
    final LeaseHeartbeat heartbeat = new LeaseHeartbeat(broker, address, messageId, leaseToken,
        interval, extension, listener);
    active.add(heartbeat);
    try {
      heartbeat.start(scheduler, executor);
    } catch (RuntimeException e) {
      active.remove(heartbeat);
      throw e;
    }
    startedMetric.incrementAndGet();
    return heartbeat;
  }

  /**
   * Cancels every heartbeat that is still running.
   *
   * @return the number of heartbeats cancelled
   */
  public int cancelAll() {
    final List<LeaseHeartbeat> remaining = new ArrayList<>(active);
    for (LeaseHeartbeat heartbeat : remaining)
      heartbeat.cancel();
    if (!remaining.isEmpty())
      LOGGER.atInfo().addKeyValue("count", remaining.size()).log("Cancelled orphaned heartbeats");
    return remaining.size();
  }

  @Override
  public HeartbeatMetrics checkMetrics() {
    final int active = this.active.size();
    final long started = startedMetric.get();
    final long extensions = extensionsMetric.get();
    final long failures = failuresMetric.get();
    return new HeartbeatMetrics(active, started, extensions, failures);
  }

  @Override
  public HeartbeatMetrics flushMetrics() {
    final HeartbeatMetrics metrics = checkMetrics();
    startedMetric.set(0);
    extensionsMetric.set(0);
    failuresMetric.set(0);
    return metrics;
  }
}
