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
 * The lifecycle of one received message inside the dispatcher.
 *
 * <pre>
 *     RECEIVED ─► LEASED ─► ACKNOWLEDGED
 *                   │  │
 *                   │  └──► ABANDONED
 *                   │
 *                   └─────► REJECTED
 * </pre>
 *
 * <p>
 * An {@code ACKNOWLEDGED} or {@code REJECTED} message has been deleted from its queue. An
 * {@code ABANDONED} message was left on its queue, and the broker delivers it again once its lease
 * runs out.
 */
public enum MessageState {
  RECEIVED {
    @Override
    public MessageState to(MessageState target) {
      if (target == LEASED)
        return target;
      throw new IllegalStateException("Invalid transition from RECEIVED to " + target);
    }
  },
  LEASED {
    @Override
    public MessageState to(MessageState target) {
      if (target == ACKNOWLEDGED || target == ABANDONED || target == REJECTED)
        return target;
      throw new IllegalStateException("Invalid transition from LEASED to " + target);
    }
  },
  ACKNOWLEDGED {
    @Override
    public MessageState to(MessageState target) {
      throw new IllegalStateException("Invalid transition from ACKNOWLEDGED to " + target);
    }
  },
  ABANDONED {
    @Override
    public MessageState to(MessageState target) {
      throw new IllegalStateException("Invalid transition from ABANDONED to " + target);
    }
  },
  REJECTED {
    @Override
    public MessageState to(MessageState target) {
      throw new IllegalStateException("Invalid transition from REJECTED to " + target);
    }
  };

  public abstract MessageState to(MessageState target);

  public boolean isTerminal() {
    return this == ACKNOWLEDGED || this == ABANDONED || this == REJECTED;
  }
}
