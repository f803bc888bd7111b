/*-
 * =================================LICENSE_START==================================
 * dispatch-test
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
package io.aleph0.dispatch.test;

import java.time.Duration;
import java.util.Random;

/**
 * A source of delays, used to simulate how long a handler takes to process a message.
 */
@FunctionalInterface
public interface Scheduler {
  /**
   * Returns a scheduler whose delays are uniformly distributed between 80ms and 120ms.
   */
  public static Scheduler defaultScheduler() {
    return randomScheduler(new Random(), 80, 40);
  }

  /**
   * Returns a scheduler that always returns the given delay.
   *
   * @param delay the delay, must not be negative
   * @return the scheduler
   */
  public static Scheduler fixedScheduler(Duration delay) {
    if (delay == null)
      throw new NullPointerException("delay");
    if (delay.isNegative())
      throw new IllegalArgumentException("delay must be non-negative");
    return () -> delay;
  }

  /**
   * Returns a scheduler whose delays fall between {@code base} and {@code base + jitter}
   * milliseconds, drawn from the given random number generator.
   */
  public static Scheduler randomScheduler(Random rand, long base, long jitter) {
    if (rand == null)
      throw new NullPointerException("rand");
    if (base < 0)
      throw new IllegalArgumentException("base must be non-negative");
    if (jitter < 0)
      throw new IllegalArgumentException("jitter must be non-negative");

    if (jitter == 0)
      return () -> Duration.ofMillis(base);

    return () -> Duration.ofMillis(base + rand.nextLong(jitter));
  }

  /**
   * @return the next delay, never negative
   */
  public Duration schedule();
}
