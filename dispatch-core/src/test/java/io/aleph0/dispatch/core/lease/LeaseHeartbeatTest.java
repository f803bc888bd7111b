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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import io.aleph0.dispatch.core.broker.Broker;

public class LeaseHeartbeatTest {
  private static final Duration INTERVAL = Duration.ofMillis(20);
  private static final Duration EXTENSION = Duration.ofSeconds(1);

  private Broker broker;
  private ScheduledExecutorService scheduler;

  @BeforeEach
  void setupLeaseHeartbeatTest() {
    broker = mock(Broker.class);
    scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterEach
  void cleanupLeaseHeartbeatTest() {
    scheduler.shutdownNow();
  }

  @Test
  @Timeout(5)
  void givenStartedHeartbeat_whenIntervalsPass_thenLeaseExtendedRepeatedly() throws Exception {
    final LeaseHeartbeat heartbeat =
        new LeaseHeartbeat(broker, "q1", "m1", "token", INTERVAL, EXTENSION);

    heartbeat.start(scheduler);

    await().atMost(Duration.ofSeconds(2)).until(() -> heartbeat.getExtensions() >= 3);
    heartbeat.cancel();
    verify(broker, atLeast(3)).extendLease("q1", "token", EXTENSION);
    assertThat(heartbeat.getState()).isEqualTo(LeaseHeartbeat.State.CANCELLED);
  }

  @Test
  @Timeout(5)
  void givenFailingBroker_whenBeat_thenFailureCountedAndHeartbeatContinues() throws Exception {
    doThrow(new IOException("simulated")).when(broker).extendLease(any(), any(), any());
    final LeaseHeartbeat heartbeat =
        new LeaseHeartbeat(broker, "q1", "m1", "token", INTERVAL, EXTENSION);

    heartbeat.start(scheduler);

    await().atMost(Duration.ofSeconds(2)).until(() -> heartbeat.getFailures() >= 2);
    heartbeat.cancel();
    assertThat(heartbeat.getExtensions()).isZero();
  }

  @Test
  void givenCancelledHeartbeat_whenBeat_thenNoExtension() throws Exception {
    final LeaseHeartbeat heartbeat =
        new LeaseHeartbeat(broker, "q1", "m1", "token", Duration.ofMinutes(1), EXTENSION);
    heartbeat.start(scheduler);

    heartbeat.cancel();
    heartbeat.cancel();
    heartbeat.beat();

    verify(broker, never()).extendLease(eq("q1"), eq("token"), any());
  }

  @Test
  void givenCancelledHeartbeat_whenStarted_thenIllegalStateException() {
    final LeaseHeartbeat heartbeat =
        new LeaseHeartbeat(broker, "q1", "m1", "token", INTERVAL, EXTENSION);
    heartbeat.cancel();

    assertThatThrownBy(() -> heartbeat.start(scheduler))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void givenListener_whenCancelled_thenNotifiedOnce() {
    final LeaseHeartbeat.Listener listener = mock(LeaseHeartbeat.Listener.class);
    final LeaseHeartbeat heartbeat =
        new LeaseHeartbeat(broker, "q1", "m1", "token", INTERVAL, EXTENSION, listener);
    heartbeat.start(scheduler);

    heartbeat.cancel();
    heartbeat.cancel();

    verify(listener).onHeartbeatCancelled(heartbeat);
  }

  @Test
  @Timeout(5)
  void givenHangingExtension_whenIntervalsPass_thenSchedulerStaysFreeAndBeatsAreSkipped()
      throws Exception {
    final CountDownLatch hang = new CountDownLatch(1);
    final ExecutorService executor = Executors.newCachedThreadPool();
    doAnswer(invocation -> {
      hang.await();
      return null;
    }).when(broker).extendLease(eq("q1"), any(), any());
    final LeaseHeartbeat stuck =
        new LeaseHeartbeat(broker, "q1", "m1", "token1", INTERVAL, EXTENSION);
    final LeaseHeartbeat healthy =
        new LeaseHeartbeat(broker, "q2", "m2", "token2", INTERVAL, EXTENSION);

    try {
      stuck.start(scheduler, executor);
      healthy.start(scheduler, executor);

      await().atMost(Duration.ofSeconds(2)).until(() -> healthy.getExtensions() >= 3);
      await().atMost(Duration.ofSeconds(2)).until(() -> stuck.getSkipped() >= 2);
      verify(broker, times(1)).extendLease(eq("q1"), any(), any());
    } finally {
      stuck.cancel();
      healthy.cancel();
      hang.countDown();
      executor.shutdownNow();
    }
  }
}
