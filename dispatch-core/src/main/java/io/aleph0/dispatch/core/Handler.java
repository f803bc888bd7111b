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
 * Processes the payload of one message. Supplied by the user of the dispatcher.
 *
 * <p>
 * The dispatcher calls the handler for the messages of a single queue strictly one at a time and in
 * the order they were received. Calls for different queues run in parallel. The dispatcher imposes
 * no timeout, so a handler may run for minutes; the message lease is kept alive in the background
 * while it does.
 *
 * <p>
 * Because the underlying queues deliver at least once, the same message may be handled more than
 * once, for example after a failed lease extension. Handlers must be idempotent.
 */
@FunctionalInterface
public interface Handler {
  /**
   * Process one message.
   *
   * <p>
   * Returning normally acknowledges the message, and the returned text is forwarded to the
   * {@link Notifier}, if any. Throwing {@link PermanentHandlerException} deletes the message without
   * retry. Throwing anything else leaves the message on its queue, and the broker redelivers it
   * after its lease expires. Implementations should respond to interruption, which is how the
   * dispatcher cancels them at shutdown.
   *
   * @param payload the parsed message payload
   * @param context per-call details and side channels for this message
   * @return the result text, may be {@code null} or empty
   * @throws Exception if processing failed
   */
  public String process(Payload payload, HandlerContext context) throws Exception;
}
