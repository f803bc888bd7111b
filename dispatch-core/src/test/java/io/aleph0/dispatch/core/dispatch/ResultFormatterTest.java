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

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

public class ResultFormatterTest {
  @Test
  void givenTagging_whenFormat_thenPrefixedWithFirstEightCharsOfId() {
    final ResultFormatter formatter = new ResultFormatter(true, "fallback");

    assertThat(formatter.format("1a2b3c4d-5e6f", "done")).isEqualTo("[job 1a2b3c4d] done");
    assertThat(formatter.format("abc", "done")).isEqualTo("[job abc] done");
  }

  @Test
  void givenBlankResult_whenFormat_thenFallbackText() {
    final ResultFormatter formatter = new ResultFormatter(false, "fallback");

    assertThat(formatter.format("id", null)).isEqualTo("fallback");
    assertThat(formatter.format("id", "  ")).isEqualTo("fallback");
    assertThat(formatter.format("id", "ok")).isEqualTo("ok");
  }
}
