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

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Settings of an outbound message.
 *
 * <p>Instances are immutable. The default is a persistent message without retry budget.
 */
public final class PublishConfig {

  /**
   * Message header carrying the remaining retry budget of a message, as a 32-bit integer.
   *
   * <p>Consumers decrement it each time they republish a message after a processing failure.
   */
  public static final String REMAINING_RETRIES_HEADER = "x-remaining-retries";

  private static final PublishConfig DEFAULT =
      new PublishConfig(OptionalInt.empty(), DeliveryMode.PERSISTENT);

  private final OptionalInt maxRetries;
  private final DeliveryMode deliveryMode;

  private PublishConfig(OptionalInt maxRetries, DeliveryMode deliveryMode) {
    this.maxRetries = maxRetries;
    this.deliveryMode = deliveryMode;
  }

  /**
   * Persistent message, no retry header.
   *
   * @return the default configuration
   */
  public static PublishConfig defaults() {
    return DEFAULT;
  }

  /**
   * Persistent message carrying a retry budget.
   *
   * @param maxRetries number of retries consumers may perform after processing failures,
   *     overrides the consumer setting
   * @return the configuration
   */
  public static PublishConfig withMaxRetries(int maxRetries) {
    return DEFAULT.maxRetries(maxRetries);
  }

  /**
   * Copy of this configuration with a retry budget.
   *
   * @param maxRetries the retry budget
   * @return a new configuration
   */
  public PublishConfig maxRetries(int maxRetries) {
    return new PublishConfig(OptionalInt.of(maxRetries), this.deliveryMode);
  }

  /**
   * Copy of this configuration with another delivery mode.
   *
   * @param deliveryMode the delivery mode
   * @return a new configuration
   */
  public PublishConfig deliveryMode(DeliveryMode deliveryMode) {
    return new PublishConfig(
        this.maxRetries, Objects.requireNonNull(deliveryMode, "deliveryMode"));
  }

  /**
   * The retry budget, empty if the message must not carry a retry header.
   *
   * @return retry budget
   */
  public OptionalInt maxRetries() {
    return this.maxRetries;
  }

  public DeliveryMode deliveryMode() {
    return this.deliveryMode;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PublishConfig that = (PublishConfig) o;
    return maxRetries.equals(that.maxRetries) && deliveryMode == that.deliveryMode;
  }

  @Override
  public int hashCode() {
    return Objects.hash(maxRetries, deliveryMode);
  }

  @Override
  public String toString() {
    return "PublishConfig{" + "maxRetries=" + maxRetries + ", deliveryMode=" + deliveryMode + '}';
  }
}
