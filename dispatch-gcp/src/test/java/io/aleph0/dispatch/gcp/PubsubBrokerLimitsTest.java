/*-
 * =================================LICENSE_START==================================
 * dispatch-gcp
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
package io.aleph0.dispatch.gcp;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Duration;
import org.junit.jupiter.api.Test;

public class PubsubBrokerLimitsTest {
  @Test
  void givenLongLease_whenConvertedToAckDeadline_thenCapped() {
    assertThat(PubsubBroker.ackDeadlineSeconds(Duration.ofMinutes(15)))
        .isEqualTo(PubsubBroker.MAX_ACK_DEADLINE_SECONDS);
  }

  @Test
  void givenShortLease_whenConvertedToAckDeadline_thenRaisedToMinimum() {
    assertThat(PubsubBroker.ackDeadlineSeconds(Duration.ofSeconds(2)))
        .isEqualTo(PubsubBroker.MIN_ACK_DEADLINE_SECONDS);
  }

  @Test
  void givenFractionalLease_whenConvertedToAckDeadline_thenRoundedUp() {
    assertThat(PubsubBroker.ackDeadlineSeconds(Duration.ofMillis(30500))).isEqualTo(31);
  }

  @Test
  void givenRetentionOutsideRange_whenClamped_thenWithinPubsubLimits() {
    assertThat(PubsubBroker.retention(Duration.ofMinutes(1))).isEqualTo(PubsubBroker.MIN_RETENTION);
    assertThat(PubsubBroker.retention(Duration.ofDays(30))).isEqualTo(PubsubBroker.MAX_RETENTION);
    assertThat(PubsubBroker.retention(Duration.ofDays(1))).isEqualTo(Duration.ofDays(1));
  }
}
