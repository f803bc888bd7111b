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

import static java.util.Objects.requireNonNull;
import io.aleph0.dispatch.core.governor.GovernorMetrics;
import io.aleph0.dispatch.core.lease.HeartbeatMetrics;

public record DispatcherMetrics(
    /**
     * The current state of the dispatcher
     */
    DispatcherState state,

    /**
     * The number of queues the dispatcher knows about
     */
    int queues,

    /**
     * The number of messages currently being worked on
     */
    int inflight,

    /**
     * The number of messages received
     */
    long received,

    /**
     * The number of messages handled successfully and deleted
     */
    long acknowledged,

    /**
     * The number of messages left on their queue for redelivery
     */
    long abandoned,

    /**
     * The number of messages deleted without success, either because they could not be parsed or
     * because the handler failed permanently
     */
    long rejected,

    /**
     * The number of busy notices sent
     */
    long busyNotices,

    /**
     * The number of failed receive calls
     */
    long receiveFailures,

    /**
     * The admission metrics
     */
    GovernorMetrics governor,

    /**
     * The lease heartbeat metrics
     */
    HeartbeatMetrics heartbeats) {
  public DispatcherMetrics {
    requireNonNull(state, "state");
    requireNonNull(governor, "governor");
    requireNonNull(heartbeats, "heartbeats");
    if (queues < 0)
      throw new IllegalArgumentException("queues must be at least 0");
    if (inflight < 0)
      throw new IllegalArgumentException("inflight must be at least 0");
    if (received < 0)
      throw new IllegalArgumentException("received must be at least 0");
    if (acknowledged < 0)
      throw new IllegalArgumentException("acknowledged must be at least 0");
    if (abandoned < 0)
      throw new IllegalArgumentException("abandoned must be at least 0");
    if (rejected < 0)
      throw new IllegalArgumentException("rejected must be at least 0");
    if (busyNotices < 0)
      throw new IllegalArgumentException("busyNotices must be at least 0");
    if (receiveFailures < 0)
      throw new IllegalArgumentException("receiveFailures must be at least 0");
  }
}
