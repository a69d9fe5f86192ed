// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.supervisor.impl;

import static com.rabbitmq.supervisor.Resource.State.CLOSED;
import static com.rabbitmq.supervisor.Resource.State.DISCONNECTED;

import com.rabbitmq.supervisor.Resource;
import com.rabbitmq.supervisor.SupervisorException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Base class for resources with a state and {@link StateListener}s. */
abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>(DISCONNECTED);
  private final List<StateListener> listeners;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
  }

  protected void checkNotClosed() {
    if (this.state.get() == CLOSED) {
      throw new SupervisorException.SupervisorClosedException(this + " is closed");
    }
  }

  public State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.state(state, null);
  }

  /**
   * Change the state and notify the listeners if the state is different from the previous one.
   *
   * <p>{@link State#CLOSED} is final, any change after it is ignored.
   */
  protected void state(State state, Throwable failureCause) {
    State previous = this.state.getAndUpdate(current -> current == CLOSED ? CLOSED : state);
    if (previous != CLOSED && previous != state) {
      this.notifyListeners(new StateChange(this, failureCause, previous, state));
    }
  }

  private void notifyListeners(Context context) {
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(context);
      } catch (Exception e) {
        LOGGER.warn("Error in state listener of {} ({})", this, context, e);
      }
    }
  }

  private static final class StateChange implements Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private StateChange(
        Resource resource, Throwable failureCause, State previousState, State currentState) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }

    @Override
    public String toString() {
      return previousState + " -> " + currentState;
    }
  }
}
