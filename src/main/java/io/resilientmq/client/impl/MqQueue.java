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

import io.resilientmq.client.DeclareOptions;
import io.resilientmq.client.PublishConfig;
import io.resilientmq.client.Queue;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class MqQueue implements Queue {

  private static final Logger LOGGER = LoggerFactory.getLogger(MqQueue.class);

  private static final String DEFAULT_EXCHANGE = "";

  private final MqClient client;
  private final String name;

  MqQueue(MqClient client, String name) {
    this.client = client;
    this.name = name;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public void declare() {
    this.declare(DeclareOptions.durable());
  }

  @Override
  public void declare(DeclareOptions options) {
    this.client.checkNotClosed();
    this.client.connection().declareQueue(this.name, options);
    LOGGER.debug("Queue '{}' declared ({})", this.name, options);
  }

  @Override
  public void publish(byte[] message) {
    this.publish(message, PublishConfig.defaults());
  }

  @Override
  public void publish(byte[] message, PublishConfig config) {
    this.client.checkNotClosed();
    this.client.connection().publish(DEFAULT_EXCHANGE, this.name, message, config);
  }

  @Override
  public void publishBatch(List<byte[]> messages, int batchSize, PublishConfig config) {
    this.client.checkNotClosed();
    for (List<byte[]> batch : Utils.partition(messages, batchSize)) {
      this.client.connection().publishAll(DEFAULT_EXCHANGE, this.name, batch, config);
    }
  }

  @Override
  public void healthCheck() {
    this.client.healthCheck();
  }

  @Override
  public String toString() {
    return "Queue{name='" + name + "'}";
  }
}
