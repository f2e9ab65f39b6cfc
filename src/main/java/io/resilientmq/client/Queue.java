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

import java.util.List;

/**
 * A named queue of the broker.
 *
 * <p>Messages are published to the queue through the default exchange, with the queue name as
 * the routing key. Instances do not own the connection, they must not be used after the {@link
 * Client} is closed.
 *
 * @see Client#queue(String)
 */
public interface Queue {

  /**
   * The queue name.
   *
   * @return name
   */
  String name();

  /**
   * Declare a durable, non-exclusive, non-auto-delete queue. Idempotent.
   *
   * @throws MqException if the declaration fails
   */
  void declare();

  /**
   * Declare the queue with the given settings.
   *
   * @param options declaration settings
   * @throws MqException if the declaration fails
   */
  void declare(DeclareOptions options);

  /**
   * Publish a persistent message without retry budget.
   *
   * @param body message body
   * @throws MqException.MqPublishException if the broker call fails
   */
  void publish(byte[] body);

  /**
   * Publish a message with the given settings.
   *
   * <p>The <code>x-remaining-retries</code> header is set only if {@link
   * PublishConfig#maxRetries()} is present.
   *
   * @param body message body
   * @param config message settings
   * @throws MqException.MqPublishException if the broker call fails
   */
  void publish(byte[] body, PublishConfig config);

  /**
   * Publish messages in chunks of <code>batchSize</code>.
   *
   * <p>With publisher confirms enabled, the call waits for confirms once per chunk. It stops at
   * the first failing chunk, previous chunks are not rolled back.
   *
   * @param bodies message bodies, in publishing order
   * @param batchSize maximum number of messages per chunk
   * @param config settings applied to every message
   * @throws MqException.MqPublishException if a broker call fails
   */
  void publishBatch(List<byte[]> bodies, int batchSize, PublishConfig config);

  /**
   * Check the underlying connection.
   *
   * @throws MqException.MqConnectException if the connection is closed
   */
  void healthCheck();
}
