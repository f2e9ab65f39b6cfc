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
 * API to consume messages from a queue with a pool of workers and a per-message retry policy.
 *
 * <p>Instances are created with {@link Client#consumer(String, ConsumerOptions, MessageHandler)}
 * and started with {@link Client#startConsumers(Consumer...)}. A consumer keeps its identity
 * across reconnections, only its delivery stream is re-created.
 *
 * <p>When the handler fails and {@link ConsumerOptions#retryOnError()} is set, the delivery is
 * either re-published with a decremented <code>x-remaining-retries</code> header, dropped if the
 * budget is spent, or rejected and requeued if there is no budget at all.
 *
 * @see ConsumerOptions
 */
public interface Consumer extends ConnectionClient, AutoCloseable, Resource {

  /**
   * Open the delivery stream and launch the workers.
   *
   * @throws MqException.MqConnectException if the delivery stream cannot be opened
   */
  void start();

  /**
   * Replace the delivery stream with a new one from the current connection and launch new
   * workers. Workers of the previous stream stop after their in-flight delivery.
   *
   * @throws MqException.MqConnectException if the delivery stream cannot be opened
   */
  @Override
  void reconnect();

  /**
   * Check the underlying connection.
   *
   * @throws MqException.MqConnectException if the connection is closed
   */
  void healthCheck();

  /**
   * The consumed queue.
   *
   * @return queue name
   */
  String queue();

  /** Stop pulling deliveries and release the delivery stream. */
  @Override
  void close();

  /** Contract to process a message. */
  @FunctionalInterface
  interface MessageHandler {

    /**
     * Process a message.
     *
     * <p>Throwing an exception signals a processing failure and triggers the retry policy.
     *
     * @param message the message body
     * @throws Exception if the message could not be processed
     */
    void handle(byte[] message) throws Exception;
  }
}
