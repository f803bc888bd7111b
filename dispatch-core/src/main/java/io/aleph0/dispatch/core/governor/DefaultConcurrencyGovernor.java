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
package io.aleph0.dispatch.core.governor;

import static java.util.Objects.requireNonNull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConcurrencyGovernor} backed by one global {@link Semaphore} and one lazily-created
 * {@link Semaphore} per queue address.
 */
public class DefaultConcurrencyGovernor implements ConcurrencyGovernor {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultConcurrencyGovernor.class);

  public static final int DEFAULT_MAX_INFLIGHT_TOTAL = 50;

  public static final int DEFAULT_MAX_PREFETCH_PER_QUEUE = 2;

  private final AtomicLong reservationsMetric = new AtomicLong(0);
  private final AtomicLong rejectionsMetric = new AtomicLong(0);
  private final Map<String, Semaphore> queues = new ConcurrentHashMap<>();
  private final Semaphore global;
  private final int maxInflightTotal;
  private final int maxPrefetchPerQueue;

  public DefaultConcurrencyGovernor() {
    this(DEFAULT_MAX_INFLIGHT_TOTAL, DEFAULT_MAX_PREFETCH_PER_QUEUE);
  }

  public DefaultConcurrencyGovernor(int maxInflightTotal, int maxPrefetchPerQueue) {
    if (maxInflightTotal < 1)
      throw new IllegalArgumentException("maxInflightTotal must be at least 1");
    if (maxPrefetchPerQueue < 1)
      throw new IllegalArgumentException("maxPrefetchPerQueue must be at least 1");
    this.maxInflightTotal = maxInflightTotal;
    this.maxPrefetchPerQueue = maxPrefetchPerQueue;
    this.global = new Semaphore(maxInflightTotal);
  }

  @Override
  public Reservation tryReserve(String address) {
    requireNonNull(address, "address");

    final Semaphore queue = queueSemaphore(address);

    // A full queue rejects without touching the global pool
    if (queue.availablePermits() == 0) {
      rejectionsMetric.incrementAndGet();
      LOGGER.atTrace().addKeyValue("address", address).log("Queue capacity exhausted");
      return null;
    }

    if (!global.tryAcquire()) {
      rejectionsMetric.incrementAndGet();
      LOGGER.atTrace().addKeyValue("address", address).log("Global capacity exhausted");
      return null;
    }

    if (!queue.tryAcquire()) {
      global.release();
      rejectionsMetric.incrementAndGet();
      LOGGER.atTrace().addKeyValue("address", address).log("Queue capacity exhausted");
      return null;
    }

    reservationsMetric.incrementAndGet();

    return new Reservation(address, global, true, queue, true);
  }

  @Override
  public Reservation reserve(String address) throws InterruptedException {
    requireNonNull(address, "address");

    final Semaphore queue = queueSemaphore(address);

    global.acquire();
    try {
      queue.acquire();
    } catch (InterruptedException e) {
      global.release();
      throw e;
    }

    reservationsMetric.incrementAndGet();

    return new Reservation(address, global, true, queue, true);
  }

  private Semaphore queueSemaphore(String address) {
    return queues.computeIfAbsent(address, k -> new Semaphore(maxPrefetchPerQueue));
  }

  @Override
  public GovernorMetrics checkMetrics() {
    final int inflight = maxInflightTotal - global.availablePermits();
    final Map<String, Integer> reserved = new LinkedHashMap<>();
    for (Map.Entry<String, Semaphore> e : queues.entrySet()) {
      final int held = maxPrefetchPerQueue - e.getValue().availablePermits();
      if (held > 0)
        reserved.put(e.getKey(), held);
    }
    final long reservations = reservationsMetric.get();
    final long rejections = rejectionsMetric.get();
    return new GovernorMetrics(Math.max(inflight, 0), maxInflightTotal, maxPrefetchPerQueue,
        reserved, reservations, rejections);
  }

  @Override
  public GovernorMetrics flushMetrics() {
    final GovernorMetrics metrics = checkMetrics();
    reservationsMetric.set(0);
    rejectionsMetric.set(0);
    return metrics;
  }
}
