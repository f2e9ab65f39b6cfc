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
package io.resilientmq.client;

/**
 * Marker interface for {@link Resource}-like classes.
 *
 * <p>Instances of these classes go through different states during their lifecycle: opening,
 * open, degraded, recovering, closed, etc. Applications can react to some of them (e.g. raise an
 * alert when the {@link Client} gets {@link State#FAILED}).
 *
 * @see Client
 * @see Consumer
 */
public interface Resource {

  /**
   * Application listener for a {@link Resource}.
   *
   * <p>They are usually registered at creation time.
   *
   * @see ClientBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(Context context);
  }

  /** Context of a resource state change. */
  interface Context {

    /**
     * The resource instance.
     *
     * @return resource instance
     */
    Resource resource();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause, null if no cause for failure
     */
    Throwable failureCause();

    /**
     * The previous state of the resource.
     *
     * @return previous state
     */
    State previousState();

    /**
     * The current (new) state of the resource.
     *
     * @return current state
     */
    State currentState();
  }

  /** Resource state. */
  enum State {
    /** The resource is connecting (client) or has been created but not started (consumer). */
    OPENING,
    /** The resource is connected (client) or streaming deliveries (consumer). */
    OPEN,
    /** A failure has been observed, recovery has not started yet. */
    DEGRADED,
    /** The resource is reconnecting. */
    RECOVERING,
    /** The resource is closing (consumers drain in-flight deliveries). */
    CLOSING,
    /** The resource is closed. */
    CLOSED,
    /** The resource gave up recovering, it cannot be used anymore. */
    FAILED
  }
}
