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

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A fair mutex that grants turns strictly in ticket order. A caller first takes a ticket with
 * {@link #nextTicket()}, possibly on a different thread than the one that later waits, and then
 * waits for its turn with {@link #await(long)}. Every ticket must eventually be given back with
 * {@link #release(long)}, whether or not its turn ever came; tickets given back before their turn
 * are skipped.
 *
 * <p>
 * The dispatcher takes a ticket on the thread that received a message, so the order of turns is
 * the order of receipt, no matter how the worker threads are scheduled.
 */
public class OrderLock {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition turnChanged = lock.newCondition();

  /**
   * Tickets given back before their turn came.
   */
  private final Set<Long> skipped = new HashSet<>();

  private long next = 0;
  private long serving = 0;

  /**
   * @return a new ticket, one greater than the previous one
   */
  public long nextTicket() {
    lock.lock();
    try {
      return next++;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until it is the given ticket's turn. If interrupted while waiting, the ticket is given
   * back, so later tickets are not blocked by it.
   *
   * @param ticket the ticket
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalArgumentException if the ticket was never issued
   * @throws IllegalStateException if the ticket was already given back
   */
  public void await(long ticket) throws InterruptedException {
    lock.lock();
    try {
      checkIssued(ticket);
      if (ticket < serving || skipped.contains(ticket))
        throw new IllegalStateException("ticket " + ticket + " already released");
      while (serving != ticket) {
        try {
          turnChanged.await();
        } catch (InterruptedException e) {
          giveBack(ticket);
          throw e;
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gives back the given ticket. If it is the ticket's turn, the turn passes to the next ticket
   * still outstanding. Otherwise the ticket is skipped when its turn comes. Idempotent.
   *
   * @param ticket the ticket
   * @throws IllegalArgumentException if the ticket was never issued
   */
  public void release(long ticket) {
    lock.lock();
    try {
      checkIssued(ticket);
      giveBack(ticket);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Whether a ticket issued before the given one is still outstanding, i.e., holds the turn or is
   * waiting for it.
   *
   * @param ticket the ticket
   * @return {@code true} if the given ticket would have to wait for its turn
   */
  public boolean isBusy(long ticket) {
    lock.lock();
    try {
      checkIssued(ticket);
      return serving < ticket;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return the number of tickets issued but not yet given back
   */
  public int outstanding() {
    lock.lock();
    try {
      return (int) (next - serving) - skipped.size();
    } finally {
      lock.unlock();
    }
  }

  private void giveBack(long ticket) {
    if (ticket < serving)
      return;
    if (ticket > serving) {
      skipped.add(ticket);
      return;
    }
    serving = serving + 1;
    while (skipped.remove(serving))
      serving = serving + 1;
    turnChanged.signalAll();
  }

  private void checkIssued(long ticket) {
    if (ticket < 0 || ticket >= next)
      throw new IllegalArgumentException("ticket " + ticket + " was never issued");
  }
}
