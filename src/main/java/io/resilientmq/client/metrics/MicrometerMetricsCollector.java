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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong connections;
  private final AtomicLong consumers;
  private final Counter reconnectionAttempts;
  private final Counter publish;
  private final Counter consume, consumeAcked, consumeRequeued, consumeRepublished, consumeDropped;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "resilientmq");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.connections = registry.gauge(prefix + ".connections", tags, new AtomicLong(0));
    this.consumers = registry.gauge(prefix + ".consumers", tags, new AtomicLong(0));
    this.reconnectionAttempts = registry.counter(prefix + ".reconnection_attempts", tags);
    this.publish = registry.counter(prefix + ".published", tags);
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.consumeAcked = registry.counter(prefix + ".consumed_acked", tags);
    this.consumeRequeued = registry.counter(prefix + ".consumed_requeued", tags);
    this.consumeRepublished = registry.counter(prefix + ".consumed_republished", tags);
    this.consumeDropped = registry.counter(prefix + ".consumed_dropped", tags);
  }

  @Override
  public void openConnection() {
    this.connections.incrementAndGet();
  }

  @Override
  public void closeConnection() {
    this.connections.decrementAndGet();
  }

  @Override
  public void reconnectionAttempt() {
    this.reconnectionAttempts.increment();
  }

  @Override
  public void openConsumer() {
    this.consumers.incrementAndGet();
  }

  @Override
  public void closeConsumer() {
    this.consumers.decrementAndGet();
  }

  @Override
  public void publish() {
    this.publish.increment();
  }

  @Override
  public void consume() {
    this.consume.increment();
  }

  @Override
  public void consumeDisposition(ConsumeDisposition disposition) {
    switch (disposition) {
      case ACKED:
        this.consumeAcked.increment();
        break;
      case REQUEUED:
        this.consumeRequeued.increment();
        break;
      case REPUBLISHED:
        this.consumeRepublished.increment();
        break;
      case DROPPED:
        this.consumeDropped.increment();
        break;
      default:
        break;
    }
  }
}
