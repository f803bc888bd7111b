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

/**
 * Receives message lifecycle events from an {@link OrderedDispatcher}. Methods are called on
 * dispatcher threads and should return quickly. Exceptions thrown by listeners are logged and
 * ignored.
 */
public interface DispatchListener {
  default void onMessageReceived(String address, String messageId) {}

  default void onMessageRejected(String address, String messageId, Exception cause) {}

  default void onMessageAcknowledged(String address, String messageId) {}

  default void onMessageAbandoned(String address, String messageId, Throwable cause) {}

  default void onBusyNotice(String address, String messageId, String correlationId) {}
}
