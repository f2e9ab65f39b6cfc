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
package io.resilientmq.client.impl;

import static io.resilientmq.client.Resource.State.CLOSED;
import static io.resilientmq.client.Resource.State.CLOSING;
import static io.resilientmq.client.Resource.State.FAILED;
import static io.resilientmq.client.Resource.State.OPENING;

import io.resilientmq.client.MqException;
import io.resilientmq.client.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

abstract class ResourceBase implements Resource {

  private final AtomicReference<State> state = new AtomicReference<>();
  private final StateEventSupport stateEventSupport;
  private volatile Throwable closeReason;

  ResourceBase(List<StateListener> listeners) {
    this.stateEventSupport = new StateEventSupport(listeners);
    this.state(OPENING);
  }

  protected void checkNotClosed() {
    State state = this.state.get();
    if (state == FAILED && this.closeReason instanceof MqException) {
      throw (MqException) this.closeReason;
    } else if (state == CLOSING || state == CLOSED || state == FAILED) {
      throw new MqException.MqResourceClosedException(
          "Resource is closed, current state is %s", state.name());
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(Resource.State state) {
    this.state(state, null);
  }

  protected void state(Resource.State state, Throwable failureCause) {
    Resource.State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      if ((state == CLOSING || state == CLOSED || state == FAILED) && this.closeReason == null) {
        this.closeReason = failureCause;
      }
      this.stateEventSupport.dispatch(this, failureCause, previousState, state);
    }
  }
}
