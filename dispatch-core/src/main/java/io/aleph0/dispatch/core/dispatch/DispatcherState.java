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
 * The lifecycle of an {@link OrderedDispatcher}.
 *
 * <pre>
 *     READY ─► RUNNING ─► STOPPING ─► STOPPED
 *       │                               ▲
 *       └───────────────────────────────┘
 * </pre>
 */
public enum DispatcherState {
  READY {
    @Override
    public DispatcherState to(DispatcherState target) {
      if (target == RUNNING || target == STOPPED)
        return target;
      throw new IllegalStateException("Invalid transition from READY to " + target);
    }
  },
  RUNNING {
    @Override
    public DispatcherState to(DispatcherState target) {
      if (target == STOPPING)
        return target;
      throw new IllegalStateException("Invalid transition from RUNNING to " + target);
    }
  },
  STOPPING {
    @Override
    public DispatcherState to(DispatcherState target) {
      if (target == STOPPED)
        return target;
      throw new IllegalStateException("Invalid transition from STOPPING to " + target);
    }
  },
  STOPPED {
    @Override
    public DispatcherState to(DispatcherState target) {
      throw new IllegalStateException("Invalid transition from STOPPED to " + target);
    }
  };

  /**
   * Validate that the transition to the target state is valid.
   * 
   * @param target the target state
   * @return the target state
   * @throws IllegalStateException if the transition is invalid
   */
  public abstract DispatcherState to(DispatcherState target);
}
