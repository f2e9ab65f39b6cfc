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

import io.resilientmq.client.Consumer;
import io.resilientmq.client.ConsumerOptions;
import io.resilientmq.client.PublishConfig;
import io.resilientmq.client.metrics.MetricsCollector;
import io.resilientmq.client.transport.TransportDelivery;
import java.io.IOException;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run the handler on a delivery and settle the delivery according to the retry policy.
 *
 * <p>Every delivery with a body is settled exactly once: acknowledged, or rejected with requeue.
 */
final class DeliveryProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryProcessor.class);

  private final String queue;
  private final Consumer.MessageHandler handler;
  private final ConsumerOptions options;
  private final BiConsumer<byte[], PublishConfig> republisher;
  private final RetryUtils.Waiter waiter;
  private final MetricsCollector metricsCollector;

  DeliveryProcessor(
      String queue,
      Consumer.MessageHandler handler,
      ConsumerOptions options,
      BiConsumer<byte[], PublishConfig> republisher,
      RetryUtils.Waiter waiter,
      MetricsCollector metricsCollector) {
    this.queue = queue;
    this.handler = handler;
    this.options = options;
    this.republisher = republisher;
    this.waiter = waiter;
    this.metricsCollector = metricsCollector;
  }

  Outcome process(TransportDelivery delivery) {
    byte[] body = delivery.body();
    if (body == null) {
      LOGGER.debug("Ignoring delivery without body from queue '{}'", this.queue);
      return Outcome.SKIPPED;
    }
    this.metricsCollector.consume();
    int remainingRetries =
        remainingRetries(delivery.headers()).orElse(this.options.maxRetries());

    Outcome outcome;
    Exception failure = this.invokeHandler(body);
    if (failure == null) {
      outcome = ack(delivery, Outcome.ACKED);
    } else {
      LOGGER.error("Error while processing message from queue '{}'", this.queue, failure);
      if (!this.options.retryOnError()) {
        outcome = ack(delivery, Outcome.ACKED);
      } else if (!this.waitRetryDelay()) {
        outcome = requeue(delivery);
      } else if (remainingRetries > 0) {
        outcome = this.republish(delivery, remainingRetries - 1);
      } else if (remainingRetries == 0) {
        // no dead-letter destination, the message is dropped
        LOGGER.error(
            "Retry budget of message from queue '{}' exhausted, dropping it", this.queue);
        outcome = ack(delivery, Outcome.DROPPED);
      } else {
        outcome = requeue(delivery);
      }
    }
    this.metricsCollector.consumeDisposition(outcome.disposition);
    return outcome;
  }

  private Exception invokeHandler(byte[] body) {
    try {
      this.handler.handle(body);
      return null;
    } catch (Exception e) {
      return e;
    }
  }

  private boolean waitRetryDelay() {
    if (this.options.retryDelay().isZero()) {
      return true;
    }
    try {
      return this.waiter.await(this.options.retryDelay());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private Outcome republish(TransportDelivery delivery, int retries) {
    PublishConfig config =
        PublishConfig.withMaxRetries(retries).deliveryMode(delivery.deliveryMode());
    try {
      this.republisher.accept(delivery.body(), config);
    } catch (RuntimeException e) {
      LOGGER.error(
          "Could not republish message to queue '{}', requeuing it: {}",
          this.queue,
          ExceptionUtils.exceptionMessage(e));
      return requeue(delivery);
    }
    LOGGER.debug("Message republished to queue '{}' with {} retries left", this.queue, retries);
    return ack(delivery, Outcome.REPUBLISHED);
  }

  private Outcome ack(TransportDelivery delivery, Outcome outcome) {
    try {
      delivery.ack();
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Could not acknowledge delivery from queue '{}': {}",
          this.queue,
          ExceptionUtils.exceptionMessage(e));
    }
    return outcome;
  }

  private Outcome requeue(TransportDelivery delivery) {
    try {
      delivery.reject(true);
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Could not reject delivery from queue '{}': {}",
          this.queue,
          ExceptionUtils.exceptionMessage(e));
    }
    return Outcome.REQUEUED;
  }

  /**
   * Read the retry budget of a message.
   *
   * @return the budget, or empty if the header is missing or not an integer
   */
  static OptionalInt remainingRetries(Map<String, Object> headers) {
    Object value = headers == null ? null : headers.get(PublishConfig.REMAINING_RETRIES_HEADER);
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return OptionalInt.of(((Number) value).intValue());
    } else if (value instanceof Long
        && (Long) value >= Integer.MIN_VALUE
        && (Long) value <= Integer.MAX_VALUE) {
      return OptionalInt.of(((Long) value).intValue());
    } else {
      if (value != null) {
        LOGGER.debug(
            "Ignoring header {} of type {}",
            PublishConfig.REMAINING_RETRIES_HEADER,
            value.getClass().getSimpleName());
      }
      return OptionalInt.empty();
    }
  }

  enum Outcome {
    SKIPPED(null),
    ACKED(MetricsCollector.ConsumeDisposition.ACKED),
    REQUEUED(MetricsCollector.ConsumeDisposition.REQUEUED),
    REPUBLISHED(MetricsCollector.ConsumeDisposition.REPUBLISHED),
    DROPPED(MetricsCollector.ConsumeDisposition.DROPPED);

    private final MetricsCollector.ConsumeDisposition disposition;

    Outcome(MetricsCollector.ConsumeDisposition disposition) {
      this.disposition = disposition;
    }
  }
}
