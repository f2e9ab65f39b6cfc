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

import java.util.concurrent.CompletableFuture;

/**
 * Entry point to a broker: owns the connection, supervises it, and restores registered consumers
 * after a reconnection.
 *
 * <p>Applications are expected to build one instance, start their consumers, then run {@link
 * #listenConnection()} (or {@link #listenConnectionAsync()}) until shutdown. Closing the client is
 * the cancellation signal for the listening loop and all the consumers.
 *
 * <p>Implementations are thread-safe.
 *
 * @see io.resilientmq.client.impl.MqClientBuilder
 */
public interface Client extends AutoCloseable, Resource {

  /**
   * Queue handle. Does not declare the queue.
   *
   * @param name queue name
   * @return queue
   */
  Queue queue(String name);

  /**
   * Exchange handle. Does not declare the exchange.
   *
   * @param name exchange name
   * @return exchange
   */
  Exchange exchange(String name);

  /**
   * Create a consumer. The consumer is not started.
   *
   * @param queue queue to consume from
   * @param options consumer settings
   * @param handler message handler
   * @return the consumer
   */
  Consumer consumer(String queue, ConsumerOptions options, Consumer.MessageHandler handler);

  /**
   * Start the consumers and register them for reconnection, in order.
   *
   * @param consumers consumers to start
   * @throws MqException at the first consumer that cannot start
   */
  void startConsumers(Consumer... consumers);

  /**
   * Register a component to restore after each reconnection.
   *
   * @param connectionClient the component
   */
  void addConnectionClient(ConnectionClient connectionClient);

  /**
   * Supervise the connection until the client is closed.
   *
   * <p>Blocks the calling thread. A connection or channel failure triggers a reconnection with
   * back-off, followed by the reconnection of the registered components.
   *
   * @throws MqException.MqReconnectExhaustedException if the broker cannot be reached within the
   *     attempt budget
   */
  void listenConnection();

  /**
   * Supervise the connection in a background thread.
   *
   * @return a future that completes when the client is closed, or fails if the reconnection
   *     budget is exhausted
   */
  CompletableFuture<Void> listenConnectionAsync();

  /**
   * Check the connection.
   *
   * @throws MqException.MqConnectException if the connection is closed
   */
  void healthCheck();

  /** Close the consumers and the connection. Idempotent. */
  @Override
  void close();
}
