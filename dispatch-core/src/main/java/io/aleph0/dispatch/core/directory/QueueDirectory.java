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
package io.aleph0.dispatch.core.directory;

import java.io.IOException;
import java.util.Set;

/**
 * Maps owner keys to the addresses of their durable queues. Each owner has exactly one queue, which
 * is created the first time it is asked for. The dispatcher polls every address the directory
 * knows about.
 */
public interface QueueDirectory {
  /**
   * Returns the address of the owner's queue, creating the queue if this is the first request for
   * the owner. Idempotent. Failures are not retried.
   *
   * @param owner the owner key
   * @return the queue address
   * @throws IOException if the queue had to be created and creation failed
   */
  public String getOrCreate(String owner) throws IOException;

  /**
   * Returns the address of the owner's queue without creating it.
   *
   * @param owner the owner key
   * @return the queue address, or {@code null} if the owner is not known
   */
  public String lookup(String owner);

  /**
   * @return a snapshot of all known queue addresses, in no particular order
   */
  public Set<String> addresses();

  /**
   * Stops tracking the owner's queue without deleting it. The queue and its messages are kept by
   * the broker, and are picked up again on the next {@link #getOrCreate(String)} for the owner.
   *
   * @param owner the owner key
   * @return {@code true} if the owner was tracked, {@code false} otherwise
   */
  public boolean forget(String owner);

  /**
   * Deletes the owner's durable queue and stops tracking it. Idempotent.
   *
   * @param owner the owner key
   * @return {@code true} if a queue existed, {@code false} otherwise
   * @throws IOException if the broker failed to delete the queue, in which case the owner stays
   *         tracked
   */
  public boolean delete(String owner) throws IOException;

  /**
   * @return the number of owners with tracked queues
   */
  public int size();
}
