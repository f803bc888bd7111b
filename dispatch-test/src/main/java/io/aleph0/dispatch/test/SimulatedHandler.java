/*-
 * =================================LICENSE_START==================================
 * dispatch-test
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
package io.aleph0.dispatch.test;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.dispatch.core.Handler;
import io.aleph0.dispatch.core.HandlerContext;
import io.aleph0.dispatch.core.Payload;

/**
 * A {@link Handler} that simulates slow processing by sleeping for a delay given by a
 * {@link Scheduler}, then delegates to another handler for the result. It records every call and
 * the highest concurrency seen, overall and per owner, so tests can check ordering and
 * concurrency bounds.
 */
public class SimulatedHandler implements Handler {
  private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedHandler.class);

  /**
   * One call to the handler.
   */
  public static record Invocation(String owner, String body, String messageId,
      int deliveryAttempt) {
  }

  private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
  private final AtomicInteger active = new AtomicInteger(0);
  private final AtomicInteger maxActive = new AtomicInteger(0);
  private final Map<String, AtomicInteger> activeByOwner = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> maxActiveByOwner = new ConcurrentHashMap<>();
  private final Scheduler scheduler;
  private final Handler delegate;

  public SimulatedHandler() {
    this(Scheduler.defaultScheduler());
  }

  public SimulatedHandler(Scheduler scheduler) {
    this(scheduler, (payload, context) -> "processed " + payload.body());
  }

  public SimulatedHandler(Scheduler scheduler, Handler delegate) {
    this.scheduler = requireNonNull(scheduler, "scheduler");
    this.delegate = requireNonNull(delegate, "delegate");
  }

  @Override
  public String process(Payload payload, HandlerContext context) throws Exception {
    invocations.add(new Invocation(payload.owner(), payload.body(), context.messageId(),
        context.deliveryAttempt()));

    final AtomicInteger ownerActive =
        activeByOwner.computeIfAbsent(payload.owner(), k -> new AtomicInteger(0));
    final AtomicInteger ownerMax =
        maxActiveByOwner.computeIfAbsent(payload.owner(), k -> new AtomicInteger(0));
    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
    ownerMax.accumulateAndGet(ownerActive.incrementAndGet(), Math::max);
    try {
      final Duration delay = scheduler.schedule();
      if (delay.isNegative())
        throw new IllegalArgumentException("scheduler returned negative delay");

      LOGGER.atDebug().addKeyValue("owner", payload.owner()).addKeyValue("delay", delay)
          .log("Simulating work");

      Thread.sleep(delay.toMillis());

      return delegate.process(payload, context);
    } finally {
      ownerActive.decrementAndGet();
      active.decrementAndGet();
    }
  }

  public List<Invocation> getInvocations() {
    return unmodifiableList(new ArrayList<>(invocations));
  }

  /**
   * @return the bodies of the messages handled for the given owner, in call order
   */
  public List<String> getBodies(String owner) {
    final List<String> result = new ArrayList<>();
    for (Invocation invocation : invocations)
      if (invocation.owner().equals(owner))
        result.add(invocation.body());
    return result;
  }

  public int getInvocationCount() {
    return invocations.size();
  }

  public int getActiveCount() {
    return active.get();
  }

  /**
   * @return the highest number of concurrent calls seen across all owners
   */
  public int getMaxConcurrency() {
    return maxActive.get();
  }

  /**
   * @return the highest number of concurrent calls seen for the given owner
   */
  public int getMaxConcurrency(String owner) {
    final AtomicInteger result = maxActiveByOwner.get(owner);
    return result == null ? 0 : result.get();
  }
}
