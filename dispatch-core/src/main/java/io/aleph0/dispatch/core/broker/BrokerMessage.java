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

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message as received from a {@link Broker}.
 */
public record BrokerMessage(
    /**
     * The broker-assigned message id. Redelivery of the same message yields the same id.
     */
    String id,

    /**
     * The token required to delete this delivery or extend its lease. Each delivery gets its own.
     */
    String leaseToken,

    /**
     * The raw message body.
     */
    String body,

    /**
     * Broker-level message attributes, possibly empty.
     */
    Map<String, String> attributes,

    /**
     * The delivery attempt reported by the broker, starting at 1, or 0 if not reported.
     */
    int deliveryAttempt) {
  public BrokerMessage {
    requireNonNull(id, "id");
    requireNonNull(leaseToken, "leaseToken");
    requireNonNull(body, "body");
    attributes = attributes == null ? Map.of() : unmodifiableMap(new LinkedHashMap<>(attributes));
    if (deliveryAttempt < 0)
      throw new IllegalArgumentException("deliveryAttempt must be greater than or equal to 0");
  }

  public BrokerMessage(String id, String leaseToken, String body) {
    this(id, leaseToken, body, Map.of(), 0);
  }
}
