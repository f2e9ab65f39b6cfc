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
import static io.resilientmq.client.Resource.State.DEGRADED;
import static io.resilientmq.client.Resource.State.OPEN;
import static io.resilientmq.client.Resource.State.RECOVERING;

import io.resilientmq.client.Consumer;
import io.resilientmq.client.ConsumerOptions;
import io.resilientmq.client.MqException;
import io.resilientmq.client.transport.TransportChannel;
import io.resilientmq.client.transport.TransportDelivery;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RetryingConsumer extends ResourceBase implements Consumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingConsumer.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);
  private static final Duration CLOSE_GRACE_PERIOD = Duration.ofSeconds(10);

  private final long id;
  private final MqClient client;
  private final MqQueue queue;
  private final ConsumerOptions options;
  private final DeliveryProcessor processor;
  private final ExecutorService workers;
  // serializes start, reconnect and close
  private final Lock lifecycleLock = new ReentrantLock();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile DeliveryStream stream;

  RetryingConsumer(
      MqClient client,
      MqQueue queue,
      ConsumerOptions options,
      MessageHandler handler,
      List<StateListener> listeners) {
    super(listeners);
    this.id = ID_SEQUENCE.getAndIncrement();
    this.client = client;
    this.queue = queue;
    this.options = options;
    this.processor =
        new DeliveryProcessor(
            queue.name(),
            handler,
            options,
            queue::publish,
            RetryUtils.SLEEP,
            client.metricsCollector());
    this.workers =
        Executors.newCachedThreadPool(
            Utils.threadFactory(
                String.format("resilientmq-consumer-%s-%d-", queue.name(), this.id)));
  }

  @Override
  public void start() {
    this.lifecycleLock.lock();
    try {
      this.checkNotClosed();
      if (!this.started.compareAndSet(false, true)) {
        throw new IllegalStateException("Consumer " + this + " already started");
      }
      this.client.metricsCollector().openConsumer();
      try {
        this.openStream();
      } catch (MqException e) {
        // not started, start() can be called again
        this.started.set(false);
        this.client.metricsCollector().closeConsumer();
        this.state(DEGRADED, e);
        throw e;
      }
      this.state(OPEN);
    } finally {
      this.lifecycleLock.unlock();
    }
  }

  @Override
  public void reconnect() {
    this.lifecycleLock.lock();
    try {
      if (this.closed.get()) {
        LOGGER.debug("Not reconnecting {}, it is closed", this);
        return;
      }
      this.state(RECOVERING);
      DeliveryStream previous = this.stream;
      this.stream = null;
      if (previous != null) {
        // previous workers exit after their in-flight delivery
        previous.close();
      }
      this.openStream();
      this.state(OPEN);
    } catch (MqException e) {
      this.state(DEGRADED, e);
      throw e;
    } finally {
      this.lifecycleLock.unlock();
    }
  }

  private void openStream() {
    BrokerConnection connection = this.client.connection();
    int prefetch =
        connection.prefetchLimit() > 0 ? connection.prefetchLimit() : this.options.workers();
    TransportChannel channel = connection.openChannel();
    DeliveryStream newStream = DeliveryStream.open(channel, this.queue.name(), prefetch);
    channel.addCloseListener(
        cause -> {
          if (!this.closed.get() && this.stream == newStream) {
            this.state(DEGRADED, cause);
          }
        });
    this.stream = newStream;
    for (int i = 0; i < this.options.workers(); i++) {
      int index = i;
      this.workers.submit(() -> this.consume(newStream, index));
    }
    LOGGER.info(
        "Consuming queue '{}' with {} worker(s) (prefetch {})",
        this.queue.name(),
        this.options.workers(),
        prefetch);
  }

  private void consume(DeliveryStream deliveryStream, int index) {
    LOGGER.debug("Worker {} of {} started", index, this);
    try {
      while (deliveryStream.isActive() && !Thread.currentThread().isInterrupted()) {
        TransportDelivery delivery = deliveryStream.poll(POLL_TIMEOUT);
        if (delivery != null) {
          try {
            this.processor.process(delivery);
          } catch (RuntimeException e) {
            LOGGER.warn("Unexpected error while processing delivery of {}", this, e);
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOGGER.debug("Worker {} of {} stopped", index, this);
  }

  @Override
  public void healthCheck() {
    this.client.healthCheck();
  }

  @Override
  public String queue() {
    return this.queue.name();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.lifecycleLock.lock();
      try {
        this.state(CLOSING);
        DeliveryStream current = this.stream;
        if (current != null) {
          current.deactivate();
        }
        this.workers.shutdown();
        try {
          if (!this.workers.awaitTermination(
              CLOSE_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
            LOGGER.info("Workers of {} did not stop in time, interrupting them", this);
            this.workers.shutdownNow();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          this.workers.shutdownNow();
        }
        if (current != null) {
          current.close();
        }
        this.stream = null;
        if (this.started.get()) {
          this.client.metricsCollector().closeConsumer();
        }
        this.client.removeConsumer(this);
        this.state(CLOSED);
      } finally {
        this.lifecycleLock.unlock();
      }
    }
  }

  @Override
  public String toString() {
    // also called while the base constructor publishes the initial state
    return "Consumer{id=" + id + ", queue='" + (queue == null ? null : queue.name()) + "'}";
  }
}
