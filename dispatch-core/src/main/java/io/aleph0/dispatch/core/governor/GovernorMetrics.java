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

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.util.LinkedHashMap;
import java.util.Map;

public record GovernorMetrics(
    /**
     * The number of global tokens currently held.
     */
    int inflight,

    /**
     * The size of the global pool.
     */
    int maxInflightTotal,

    /**
     * The size of each per-queue pool.
     */
    int maxPrefetchPerQueue,

    /**
     * The number of tokens currently held per queue address. Queues with none held are omitted.
     */
    Map<String, Integer> reserved,

    /**
     * The number of reservations granted.
     */
    long reservations,

    /**
     * The number of non-blocking reservation attempts refused because a pool was exhausted.
     */
    long rejections) {
  public GovernorMetrics {
    requireNonNull(reserved);
    reserved = unmodifiableMap(new LinkedHashMap<>(reserved));
    if (inflight < 0)
      throw new IllegalArgumentException("inflight must be greater than or equal to 0");
    if (maxInflightTotal < 1)
      throw new IllegalArgumentException("maxInflightTotal must be at least 1");
    if (maxPrefetchPerQueue < 1)
      throw new IllegalArgumentException("maxPrefetchPerQueue must be at least 1");
    if (reservations < 0)
      throw new IllegalArgumentException("reservations must be greater than or equal to 0");
    if (rejections < 0)
      throw new IllegalArgumentException("rejections must be greater than or equal to 0");
  }
}
