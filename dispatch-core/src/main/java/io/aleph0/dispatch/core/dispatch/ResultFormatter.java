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

import static java.util.Objects.requireNonNull;

/**
 * Turns a handler result into the text sent to the notifier. Blank results are replaced with a
 * fallback text so the sender always gets an answer. Results may be tagged with the first
 * {@value #TAG_LENGTH} characters of the message id, e.g., {@code [job 1a2b3c4d] done}, so that
 * answers to different messages can be told apart.
 */
public class ResultFormatter {
  public static final int TAG_LENGTH = 8;

  private final boolean tagResults;
  private final String emptyResultText;

  public ResultFormatter(boolean tagResults, String emptyResultText) {
    this.tagResults = tagResults;
    this.emptyResultText = requireNonNull(emptyResultText, "emptyResultText");
  }

  public String format(String messageId, String result) {
    requireNonNull(messageId, "messageId");
    final String text = result == null || result.isBlank() ? emptyResultText : result;
    if (!tagResults)
      return text;
    final String tag =
        messageId.length() <= TAG_LENGTH ? messageId : messageId.substring(0, TAG_LENGTH);
    return "[job " + tag + "] " + text;
  }

  public boolean isEmpty(String result) {
    return result == null || result.isBlank();
  }
}
