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
package io.aleph0.dispatch.core.payload;

import io.aleph0.dispatch.core.MalformedPayloadException;
import io.aleph0.dispatch.core.Payload;

/**
 * Converts between raw message bodies and {@link Payload payloads}.
 */
public interface PayloadCodec {
  /**
   * Parses a raw message body.
   *
   * @param body the raw message body
   * @return the payload
   * @throws MalformedPayloadException if the body is not a valid payload. Messages that fail to
   *         parse are never retried.
   */
  public Payload decode(String body) throws MalformedPayloadException;

  /**
   * Formats a payload as a raw message body that {@link #decode(String)} accepts.
   *
   * @param payload the payload
   * @return the raw message body
   */
  public String encode(Payload payload);
}
