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
package io.aleph0.dispatch.core.broker;

import java.io.IOException;
import java.time.Duration;

/**
 * The operations the dispatcher needs from an at-least-once queue service. A received message stays
 * invisible to other receivers for the duration of its lease. If it is neither deleted nor has its
 * lease extended before the lease runs out, the broker delivers it again.
 *
 * <p>
 * Implementations must be thread-safe. All operations may block on network I/O, so the dispatcher
 * never calls them from its poll loop.
 */
public interface Broker {
  /**
   * Creates a durable queue with the given attributes, or returns the address of the queue with the
   * same name if it already exists.
   *
   * @param attributes the queue attributes
   * @return the address of the queue
   * @throws IOException if the queue could not be created
   */
  public String createQueue(QueueAttributes attributes) throws IOException;

  /**
   * Receives at most one message from the given queue, waiting up to {@code wait} for one to arrive.
   * A zero wait returns immediately.
   *
   * @param address the queue address
   * @param wait how long to wait for a message
   * @return the message, or {@code null} if none was available
   * @throws IOException if the receive failed
   * @throws InterruptedException if interrupted while waiting
   */
  public BrokerMessage receive(String address, Duration wait)
      throws IOException, InterruptedException;

  /**
   * Extends the lease of a received message so that it stays invisible for {@code duration} from
   * now.
   *
   * @param address the queue address
   * @param leaseToken the lease token of the received message
   * @param duration the new lease duration, counted from now
   * @throws IOException if the lease could not be extended, e.g., because it already expired
   */
  public void extendLease(String address, String leaseToken, Duration duration)
      throws IOException;

  /**
   * Deletes a received message, acknowledging it.
   *
   * @param address the queue address
   * @param leaseToken the lease token of the received message
   * @throws IOException if the message could not be deleted
   */
  public void delete(String address, String leaseToken) throws IOException;

  /**
   * Deletes a queue and all of its messages. Idempotent.
   *
   * @param address the queue address
   * @return {@code true} if the queue existed, {@code false} otherwise
   * @throws IOException if the queue could not be deleted
   */
  public boolean deleteQueue(String address) throws IOException;
}
