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
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import io.aleph0.dispatch.core.broker.Broker;

public class LeaseKeeperTest {
  private ScheduledExecutorService scheduler;
  private LeaseKeeper keeper;

  @BeforeEach
  void setupLeaseKeeperTest() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    keeper = new LeaseKeeper(mock(Broker.class), scheduler, Duration.ofMillis(20),
        Duration.ofSeconds(1));
  }

  @AfterEach
  void cleanupLeaseKeeperTest() {
    scheduler.shutdownNow();
  }

  @Test
  void givenStartedHeartbeats_whenOneCancelled_thenNoLongerActive() {
    final LeaseHeartbeat h1 = keeper.start("q1", "m1", "t1");
    keeper.start("q1", "m2", "t2");

    h1.cancel();

    final HeartbeatMetrics metrics = keeper.checkMetrics();
    assertThat(metrics.active()).isEqualTo(1);
    assertThat(metrics.started()).isEqualTo(2);
  }

  @Test
  void givenStartedHeartbeats_whenCancelAll_thenAllCancelled() {
    final LeaseHeartbeat h1 = keeper.start("q1", "m1", "t1");
    final LeaseHeartbeat h2 = keeper.start("q2", "m2", "t2");

    final int cancelled = keeper.cancelAll();

    assertThat(cancelled).isEqualTo(2);
    assertThat(h1.getState()).isEqualTo(LeaseHeartbeat.State.CANCELLED);
    assertThat(h2.getState()).isEqualTo(LeaseHeartbeat.State.CANCELLED);
    assertThat(keeper.checkMetrics().active()).isZero();
    assertThat(keeper.cancelAll()).isZero();
  }

  @Test
  @Timeout(5)
  void givenRunningHeartbeat_whenFlushMetrics_thenExtensionsCountedAndReset() {
    final LeaseHeartbeat heartbeat = keeper.start("q1", "m1", "t1");
    await().atMost(Duration.ofSeconds(2)).until(() -> keeper.checkMetrics().extensions() >= 1);
    heartbeat.cancel();

    final HeartbeatMetrics flushed = keeper.flushMetrics();

    assertThat(flushed.extensions()).isGreaterThanOrEqualTo(1);
    assertThat(keeper.checkMetrics().extensions()).isZero();
    assertThat(keeper.checkMetrics().started()).isZero();
  }
}
