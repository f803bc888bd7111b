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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

public class DefaultConcurrencyGovernorTest {
  @Test
  void givenQueueCapacityTwo_whenReserveThree_thenThirdRejected() {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(10, 2);

    final Reservation r1 = governor.tryReserve("q1");
    final Reservation r2 = governor.tryReserve("q1");
    final Reservation r3 = governor.tryReserve("q1");

    assertThat(r1).isNotNull();
    assertThat(r2).isNotNull();
    assertThat(r3).isNull();

    final GovernorMetrics metrics = governor.checkMetrics();
    assertThat(metrics.inflight()).isEqualTo(2);
    assertThat(metrics.reserved()).containsEntry("q1", 2);
    assertThat(metrics.rejections()).isEqualTo(1);
  }

  @Test
  void givenQueueExhausted_whenTryReserve_thenNoGlobalTokenLeaks() {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(3, 1);
    governor.tryReserve("q1");

    for (int i = 0; i < 10; i++)
      assertThat(governor.tryReserve("q1")).isNull();

    assertThat(governor.checkMetrics().inflight()).isEqualTo(1);
    assertThat(governor.tryReserve("q2")).isNotNull();
    assertThat(governor.tryReserve("q3")).isNotNull();
  }

  @Test
  void givenGlobalCapacityTwo_whenReserveAcrossQueues_thenThirdRejected() {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(2, 2);

    assertThat(governor.tryReserve("q1")).isNotNull();
    assertThat(governor.tryReserve("q2")).isNotNull();
    assertThat(governor.tryReserve("q3")).isNull();
  }

  @Test
  void givenReservation_whenReleasedTwice_thenTokensReturnedOnce() {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(2, 2);
    final Reservation reservation = governor.tryReserve("q1");

    reservation.release();
    reservation.release();

    assertThat(reservation.isHeld()).isFalse();
    final GovernorMetrics metrics = governor.checkMetrics();
    assertThat(metrics.inflight()).isZero();
    assertThat(metrics.reserved()).isEmpty();
    assertThat(governor.tryReserve("q1")).isNotNull();
    assertThat(governor.tryReserve("q1")).isNotNull();
    assertThat(governor.tryReserve("q1")).isNull();
  }

  @Test
  @Timeout(5)
  void givenGlobalExhausted_whenReserve_thenBlocksUntilRelease() throws Exception {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(1, 1);
    final Reservation first = governor.reserve("q1");
    final AtomicReference<Reservation> second = new AtomicReference<>();
    final CountDownLatch done = new CountDownLatch(1);

    final Thread thread = new Thread(() -> {
      try {
        second.set(governor.reserve("q2"));
        done.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    thread.start();

    thread.join(50);
    assertThat(thread.isAlive()).isTrue();

    first.close();
    done.await();

    assertThat(second.get().getAddress()).isEqualTo("q2");
  }

  @Test
  @Timeout(5)
  void givenQueueExhausted_whenReserveInterrupted_thenGlobalTokenReturned() throws Exception {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(5, 1);
    governor.reserve("q1");
    final AtomicReference<Throwable> failure = new AtomicReference<>();
    final AtomicBoolean stillInterrupted = new AtomicBoolean(true);

    final Thread thread = new Thread(() -> {
      try {
        governor.reserve("q1");
      } catch (InterruptedException e) {
        failure.set(e);
        stillInterrupted.set(Thread.currentThread().isInterrupted());
      }
    });
    thread.start();
    await().atMost(Duration.ofSeconds(2))
        .until(() -> governor.checkMetrics().inflight() == 2);

    thread.interrupt();
    thread.join();

    assertThat(failure.get()).isInstanceOf(InterruptedException.class);
    assertThat(stillInterrupted.get()).isFalse();
    assertThat(governor.checkMetrics().inflight()).isEqualTo(1);
  }

  @Test
  @Timeout(10)
  void givenFullQueue_whenTryReservedConcurrently_thenOtherQueuesNeverSeeGlobalExhausted()
      throws Exception {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(2, 1);
    governor.tryReserve("q1");
    final AtomicBoolean running = new AtomicBoolean(true);

    final Thread hammer = new Thread(() -> {
      while (running.get())
        governor.tryReserve("q1");
    });
    hammer.start();

    int rejected = 0;
    try {
      for (int i = 0; i < 20000; i++) {
        final Reservation reservation = governor.tryReserve("q2");
        if (reservation == null)
          rejected = rejected + 1;
        else
          reservation.release();
      }
    } finally {
      running.set(false);
      hammer.join();
    }

    assertThat(rejected).isZero();
    assertThat(governor.checkMetrics().inflight()).isEqualTo(1);
  }

  @Test
  void givenMetrics_whenFlushed_thenCountersReset() {
    final DefaultConcurrencyGovernor governor = new DefaultConcurrencyGovernor(1, 1);
    governor.tryReserve("q1");
    governor.tryReserve("q1");

    final GovernorMetrics flushed = governor.flushMetrics();
    final GovernorMetrics after = governor.checkMetrics();

    assertThat(flushed.reservations()).isEqualTo(1);
    assertThat(flushed.rejections()).isEqualTo(1);
    assertThat(after.reservations()).isZero();
    assertThat(after.rejections()).isZero();
    assertThat(after.inflight()).isEqualTo(1);
  }

  @Test
  void givenNonPositiveCapacity_whenConstructed_thenIllegalArgumentException() {
    assertThatThrownBy(() -> new DefaultConcurrencyGovernor(0, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DefaultConcurrencyGovernor(1, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
