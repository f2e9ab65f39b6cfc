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
package io.resilientmq.client.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when the broker connection is opened or re-opened. */
  void openConnection();

  /** Called when the broker connection is closed or lost. */
  void closeConnection();

  /** Called before each reconnection attempt. */
  void reconnectionAttempt();

  /** Called when a {@link io.resilientmq.client.Consumer} starts. */
  void openConsumer();

  /** Called when a {@link io.resilientmq.client.Consumer} is closed. */
  void closeConsumer();

  /** Called when a message is published. */
  void publish();

  /** Called when a delivery is handed to a worker. */
  void consume();

  /**
   * Called when a delivery reaches its terminal action.
   *
   * @param disposition the outcome
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Terminal outcome of a delivery. */
  enum ConsumeDisposition {
    /** Processed, acknowledged. */
    ACKED,
    /** Rejected and requeued by the broker. */
    REQUEUED,
    /** Re-published with a decremented retry count, original acknowledged. */
    REPUBLISHED,
    /** Retry budget spent, acknowledged without further processing. */
    DROPPED
  }
}
