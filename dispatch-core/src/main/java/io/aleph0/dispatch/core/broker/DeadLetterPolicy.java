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

/**
 * Broker-side dead-lettering for messages whose handling keeps failing. The dispatcher never counts
 * deliveries itself; it only passes this policy to the broker when a queue is created.
 */
public record DeadLetterPolicy(String deadLetterAddress, int maxDeliveryAttempts) {
  public DeadLetterPolicy {
    requireNonNull(deadLetterAddress, "deadLetterAddress");
    if (maxDeliveryAttempts < 1)
      throw new IllegalArgumentException("maxDeliveryAttempts must be at least 1");
  }
}
