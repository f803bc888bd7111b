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

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parsed content of a queue message. The dispatcher only reads {@link #owner()} and
 * {@link #correlationId()} for routing. The {@link #attachments()} and {@link #context()} are
 * passed through to the {@link Handler} untouched.
 */
public record Payload(
    /**
     * The owner of the queue this message was sent to.
     */
    String owner,

    /**
     * Routing target for notifications about this message, e.g., a chat id.
     */
    String correlationId,

    /**
     * The message body.
     */
    String body,

    /**
     * When the message was produced, or {@code null} if the producer did not say.
     */
    Instant timestamp,

    /**
     * Attachment descriptors, possibly empty. Never {@code null}.
     */
    List<Map<String, Object>> attachments,

    /**
     * Opaque context supplied by the producer, possibly empty. Never {@code null}.
     */
    Map<String, Object> context) {
  public Payload {
    requireNonNull(owner, "owner");
    requireNonNull(correlationId, "correlationId");
    requireNonNull(body, "body");
    if (owner.isBlank())
      throw new IllegalArgumentException("owner must not be blank");
    attachments = attachments == null ? List.of() : unmodifiableList(new ArrayList<>(attachments));
    context = context == null ? Map.of() : unmodifiableMap(new LinkedHashMap<>(context));
  }

  public Payload(String owner, String correlationId, String body) {
    this(owner, correlationId, body, null, List.of(), Map.of());
  }

  public boolean hasAttachments() {
    return !attachments.isEmpty();
  }
}
