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

import io.resilientmq.client.Exchange;
import io.resilientmq.client.PublishConfig;
import io.resilientmq.client.Queue;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class MqExchange implements Exchange {

  private static final Logger LOGGER = LoggerFactory.getLogger(MqExchange.class);

  private final MqClient client;
  private final String name;

  MqExchange(MqClient client, String name) {
    this.client = client;
    this.name = name;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public void declare(ExchangeType type) {
    this.client.checkNotClosed();
    this.client.connection().declareExchange(this.name, type.type());
    LOGGER.debug("Exchange '{}' declared with type {}", this.name, type.type());
  }

  @Override
  public void bind(List<? extends Queue> queues) {
    this.bind(queues, "");
  }

  @Override
  public void bind(List<? extends Queue> queues, String routingKey) {
    this.client.checkNotClosed();
    for (Queue queue : queues) {
      this.client.connection().bindQueue(queue.name(), this.name, routingKey);
      LOGGER.debug(
          "Queue '{}' bound to exchange '{}' with key '{}'", queue.name(), this.name, routingKey);
    }
  }

  @Override
  public void publish(byte[] message) {
    this.publish(message, "");
  }

  @Override
  public void publish(byte[] message, String routingKey) {
    this.publish(message, routingKey, PublishConfig.defaults());
  }

  @Override
  public void publish(byte[] message, String routingKey, PublishConfig config) {
    this.client.checkNotClosed();
    this.client.connection().publish(this.name, routingKey, message, config);
  }

  @Override
  public String toString() {
    return "Exchange{name='" + name + "'}";
  }
}
