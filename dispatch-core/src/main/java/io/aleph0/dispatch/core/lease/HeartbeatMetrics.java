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

public record HeartbeatMetrics(
    /**
     * The number of heartbeats currently running.
     */
    int active,

    /**
     * The number of heartbeats started.
     */
    long started,

    /**
     * The number of successful lease extensions.
     */
    long extensions,

    /**
     * The number of failed lease extensions.
     */
    long failures) {
  public HeartbeatMetrics {
    if (active < 0)
      throw new IllegalArgumentException("active must be greater than or equal to 0");
    if (started < 0)
      throw new IllegalArgumentException("started must be greater than or equal to 0");
    if (extensions < 0)
      throw new IllegalArgumentException("extensions must be greater than or equal to 0");
    if (failures < 0)
      throw new IllegalArgumentException("failures must be greater than or equal to 0");
  }
}
