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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

public class MessageStateTest {
  @Test
  void givenLeased_whenFinished_thenEveryTerminalStateAllowed() {
    assertThat(MessageState.RECEIVED.to(MessageState.LEASED)).isEqualTo(MessageState.LEASED);
    assertThat(MessageState.LEASED.to(MessageState.ACKNOWLEDGED).isTerminal()).isTrue();
    assertThat(MessageState.LEASED.to(MessageState.ABANDONED).isTerminal()).isTrue();
    assertThat(MessageState.LEASED.to(MessageState.REJECTED).isTerminal()).isTrue();
  }

  @Test
  void givenInvalidTransitions_whenTo_thenIllegalStateException() {
    assertThatThrownBy(() -> MessageState.RECEIVED.to(MessageState.ACKNOWLEDGED))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> MessageState.ACKNOWLEDGED.to(MessageState.ABANDONED))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> DispatcherState.STOPPED.to(DispatcherState.RUNNING))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> DispatcherState.RUNNING.to(DispatcherState.READY))
        .isInstanceOf(IllegalStateException.class);
  }
}
