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

import io.resilientmq.client.transport.TransportChannel;
import io.resilientmq.client.transport.TransportDelivery;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deliveries of one subscription, buffered for the workers of a consumer.
 *
 * <p>A consumer opens a new stream on each (re)connection. The stream is bound to its channel:
 * it becomes inactive when the channel closes, when the broker cancels the subscription or when
 * the consumer deactivates it.
 */
final class DeliveryStream implements TransportChannel.DeliveryListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryStream.class);

  private final String queue;
  private final TransportChannel channel;
  private final BlockingQueue<TransportDelivery> deliveries = new LinkedBlockingQueue<>();
  private final AtomicBoolean active = new AtomicBoolean(true);
  private volatile String consumerTag;

  private DeliveryStream(TransportChannel channel, String queue) {
    this.channel = channel;
    this.queue = queue;
  }

  /**
   * Subscribe to a queue on a dedicated channel.
   *
   * @param channel the channel, closed if the subscription fails
   * @param queue the queue
   * @param prefetch maximum number of unacknowledged deliveries on the channel
   * @return the open stream
   */
  static DeliveryStream open(TransportChannel channel, String queue, int prefetch) {
    DeliveryStream stream = new DeliveryStream(channel, queue);
    try {
      channel.qos(prefetch, false);
      stream.consumerTag = channel.consume(queue, stream);
    } catch (IOException | RuntimeException e) {
      Utils.closeQuietly(LOGGER, "consumer channel", channel::close);
      throw ExceptionUtils.convertConnect(e, "Error while subscribing to queue '%s'", queue);
    }
    LOGGER.debug("Subscribed to queue '{}' (consumer tag {})", queue, stream.consumerTag);
    return stream;
  }

  @Override
  public void handle(TransportDelivery delivery) {
    if (this.active.get()) {
      this.deliveries.offer(delivery);
    } else {
      // the broker requeues it when the channel closes
      LOGGER.debug("Delivery {} received on inactive stream of '{}'", delivery, this.queue);
    }
  }

  @Override
  public void cancelled() {
    LOGGER.warn("Subscription to queue '{}' cancelled by the broker", this.queue);
    this.active.set(false);
  }

  /**
   * Wait for the next delivery.
   *
   * @return the delivery, or null if none arrived in time
   */
  TransportDelivery poll(Duration timeout) throws InterruptedException {
    return this.deliveries.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  boolean isActive() {
    return this.active.get() && this.channel.isOpen();
  }

  void deactivate() {
    this.active.set(false);
  }

  /**
   * Cancel the subscription and close the channel. Unacknowledged deliveries go back to the queue.
   */
  void close() {
    this.deactivate();
    if (this.channel.isOpen()) {
      String tag = this.consumerTag;
      if (tag != null) {
        Utils.closeQuietly(LOGGER, "subscription " + tag, () -> this.channel.cancel(tag));
      }
      Utils.closeQuietly(LOGGER, "consumer channel", this.channel::close);
    }
    this.deliveries.clear();
  }
}
