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

import static java.util.Objects.requireNonNull;
import java.time.Duration;

/**
 * The attributes a queue is created with.
 */
public record QueueAttributes(
    /**
     * The queue name. Brokers derive the address from it.
     */
    String name,

    /**
     * How long a received message stays invisible to other receivers.
     */
    Duration leaseDuration,

    /**
     * How long an unacknowledged message survives before the broker discards it.
     */
    Duration retentionPeriod,

    /**
     * Where to send messages that keep failing, or {@code null} for no dead-lettering.
     */
    DeadLetterPolicy deadLetterPolicy) {
  public QueueAttributes {
    requireNonNull(name, "name");
    requireNonNull(leaseDuration, "leaseDuration");
    requireNonNull(retentionPeriod, "retentionPeriod");
    if (name.isBlank())
      throw new IllegalArgumentException("name must not be blank");
    if (leaseDuration.isNegative() || leaseDuration.isZero())
      throw new IllegalArgumentException("leaseDuration must be positive");
    if (retentionPeriod.isNegative() || retentionPeriod.isZero())
      throw new IllegalArgumentException("retentionPeriod must be positive");
  }
}
