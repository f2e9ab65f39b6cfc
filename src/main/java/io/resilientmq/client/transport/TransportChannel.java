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
package io.resilientmq.client.transport;

import io.resilientmq.client.DeliveryMode;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/** A channel of a {@link TransportConnection}. */
public interface TransportChannel {

  void qos(int prefetchCount, boolean global) throws IOException;

  void confirmSelect() throws IOException;

  /**
   * Wait for the broker to confirm the messages published since the last call.
   *
   * @param timeout maximum time to wait
   * @return true if all the messages have been acknowledged, false if at least one was nacked
   */
  boolean waitForConfirms(Duration timeout)
      throws IOException, InterruptedException, TimeoutException;

  void declareQueue(
      String queue,
      boolean durable,
      boolean exclusive,
      boolean autoDelete,
      Map<String, Object> arguments)
      throws IOException;

  void declareExchange(String exchange, String type, boolean durable, boolean autoDelete)
      throws IOException;

  void bindQueue(String queue, String exchange, String routingKey) throws IOException;

  void publish(
      String exchange,
      String routingKey,
      Map<String, Object> headers,
      byte[] body,
      DeliveryMode deliveryMode)
      throws IOException;

  /**
   * Subscribe to a queue with manual acknowledgment.
   *
   * @param queue the queue
   * @param listener callback for deliveries
   * @return the consumer tag
   */
  String consume(String queue, DeliveryListener listener) throws IOException;

  void cancel(String consumerTag) throws IOException;

  void ack(long deliveryTag) throws IOException;

  void reject(long deliveryTag, boolean requeue) throws IOException;

  boolean isOpen();

  void close() throws IOException, TimeoutException;

  /**
   * Register a listener called once when the channel closes.
   *
   * <p>The cause is null when the application closed the channel. The listener is called
   * immediately if the channel is already closed.
   *
   * @param listener close listener
   */
  void addCloseListener(Consumer<Throwable> listener);

  /** Callback for deliveries of a subscription. */
  interface DeliveryListener {

    /**
     * Called for each delivery, on a transport thread. Must not block.
     *
     * @param delivery the delivery
     */
    void handle(TransportDelivery delivery);

    /** Called when the broker cancels the subscription (e.g. the queue has been deleted). */
    default void cancelled() {}
  }
}
