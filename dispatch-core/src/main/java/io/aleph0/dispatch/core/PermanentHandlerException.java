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
 * Thrown by a {@link Handler} when processing failed in a way that redelivery cannot fix, e.g., a
 * deterministic validation error. The dispatcher deletes the message instead of leaving it for
 * redelivery, so that it does not block its queue forever.
 */
public class PermanentHandlerException extends Exception {
  private static final long serialVersionUID = 4129740382205843067L;

  public PermanentHandlerException(String message) {
    super(message);
  }

  public PermanentHandlerException(String message, Throwable cause) {
    super(message, cause);
  }
}
