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
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The capacity tokens held by one in-flight message. Releasing a reservation returns exactly the
 * tokens it holds, once.
 */
public final class Reservation implements AutoCloseable {
  private final String address;
  private final Semaphore global;
  private final Semaphore queue;
  private final AtomicBoolean globalHeld;
  private final AtomicBoolean queueHeld;

  Reservation(String address, Semaphore global, boolean globalHeld, Semaphore queue,
      boolean queueHeld) {
    this.address = requireNonNull(address, "address");
    this.global = requireNonNull(global, "global");
    this.queue = requireNonNull(queue, "queue");
    this.globalHeld = new AtomicBoolean(globalHeld);
    this.queueHeld = new AtomicBoolean(queueHeld);
  }

  public String getAddress() {
    return address;
  }

  /**
   * @return {@code true} if this reservation still holds any token
   */
  public boolean isHeld() {
    return globalHeld.get() || queueHeld.get();
  }

  /**
   * Returns the held tokens to their pools. Idempotent.
   */
  public void release() {
    // Queue before global, the reverse of acquisition order
    if (queueHeld.compareAndSet(true, false))
      queue.release();
    if (globalHeld.compareAndSet(true, false))
      global.release();
  }

  @Override
  public void close() {
    release();
  }

  @Override
  public String toString() {
    return "Reservation[address=" + address + ", globalHeld=" + globalHeld.get() + ", queueHeld="
        + queueHeld.get() + "]";
  }
}
