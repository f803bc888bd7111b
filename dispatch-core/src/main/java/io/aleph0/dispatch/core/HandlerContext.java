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
package io.aleph0.dispatch.core;

/**
 * Per-call information and side channels handed to a {@link Handler}. A context is only valid for
 * the duration of the call it was created for.
 */
public interface HandlerContext {
  /**
   * @return the broker-assigned id of the message being handled
   */
  public String messageId();

  /**
   * @return the address of the queue the message was received from
   */
  public String address();

  /**
   * @return the broker-reported delivery attempt, starting at 1, or 0 if the broker does not report
   *         delivery attempts
   */
  public int deliveryAttempt();

  /**
   * Sends an interim message, e.g., a progress update, to the correlation id of the message being
   * handled. Does nothing if the dispatcher has no {@link Notifier}. Failures are logged, not
   * thrown.
   *
   * @param text the text to send
   * @return {@code true} if the notification was delivered, {@code false} otherwise
   */
  public boolean notify(String text);
}
