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

import io.aleph0.dispatch.core.Measureable;

/**
 * Two-level admission control for in-flight messages. A global pool bounds the number of messages
 * in flight across all queues, and a pool per queue bounds the number of messages reserved from
 * any one queue. Every in-flight message holds one token from each pool, represented by a
 * {@link Reservation}, from the moment it is received until it reaches a terminal state.
 *
 * <p>
 * The per-queue pool keeps one owner from flooding the system. The global pool keeps many owners
 * together from doing so, independent of how many queues exist.
 */
public interface ConcurrencyGovernor extends Measureable<GovernorMetrics> {
  /**
   * Reserves one global token and one token for the given queue, if both are available right now.
   * Never blocks. If either pool is exhausted, nothing is held when this method returns.
   *
   * @param address the queue address
   * @return the reservation, or {@code null} if either pool is exhausted
   */
  public Reservation tryReserve(String address);

  /**
   * Reserves one global token and then one token for the given queue, waiting for each as needed.
   * The global token is always acquired first. If interrupted after the global token was acquired,
   * the global token is returned before the interrupt is propagated.
   *
   * @param address the queue address
   * @return the reservation
   * @throws InterruptedException if interrupted while waiting
   */
  public Reservation reserve(String address) throws InterruptedException;
}
