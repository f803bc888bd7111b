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
 * Signals ongoing activity, e.g., a "typing" indicator, to the party identified by a correlation
 * id. Such signals typically expire after a few seconds, so the dispatcher repeats them while a
 * message is being worked on.
 */
@FunctionalInterface
public interface ActivityNotifier {
  public static final String TYPING = "typing";

  public void sendActivity(String correlationId, String action) throws Exception;
}
