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

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a {@link Consumer}.
 *
 * @see #defaults(int)
 * @see #builder()
 */
public final class ConsumerOptions {

  private final int workers;
  private final boolean retryOnError;
  private final Duration retryDelay;
  private final int maxRetries;

  private ConsumerOptions(Builder builder) {
    this.workers = builder.workers;
    this.retryOnError = builder.retryOnError;
    this.retryDelay = builder.retryDelay;
    this.maxRetries = builder.maxRetries;
  }

  /**
   * Default options: retry on error after 1 second, infinite broker-native redelivery.
   *
   * @param workers number of workers
   * @return options
   */
  public static ConsumerOptions defaults(int workers) {
    return builder().workers(workers).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Number of concurrent workers pulling deliveries.
   *
   * @return worker count
   */
  public int workers() {
    return this.workers;
  }

  /**
   * Whether a failed delivery is retried. If false, failures are logged and acknowledged.
   *
   * @return retry flag
   */
  public boolean retryOnError() {
    return this.retryOnError;
  }

  /**
   * Delay a worker waits for after a processing failure, before retrying.
   *
   * @return retry delay
   */
  public Duration retryDelay() {
    return this.retryDelay;
  }

  /**
   * Retry budget of messages that do not carry one.
   *
   * <p>A negative value means infinite broker-native redelivery (reject and requeue).
   *
   * @return retry budget
   */
  public int maxRetries() {
    return this.maxRetries;
  }

  public Builder toBuilder() {
    return builder()
        .workers(this.workers)
        .retryOnError(this.retryOnError)
        .retryDelay(this.retryDelay)
        .maxRetries(this.maxRetries);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ConsumerOptions that = (ConsumerOptions) o;
    return workers == that.workers
        && retryOnError == that.retryOnError
        && maxRetries == that.maxRetries
        && retryDelay.equals(that.retryDelay);
  }

  @Override
  public int hashCode() {
    return Objects.hash(workers, retryOnError, retryDelay, maxRetries);
  }

  @Override
  public String toString() {
    return "ConsumerOptions{"
        + "workers="
        + workers
        + ", retryOnError="
        + retryOnError
        + ", retryDelay="
        + retryDelay
        + ", maxRetries="
        + maxRetries
        + '}';
  }

  public static final class Builder {

    private int workers = 1;
    private boolean retryOnError = true;
    private Duration retryDelay = Duration.ofSeconds(1);
    private int maxRetries = -1;

    private Builder() {}

    public Builder workers(int workers) {
      if (workers <= 0) {
        throw new IllegalArgumentException("The number of workers must be strictly positive");
      }
      this.workers = workers;
      return this;
    }

    public Builder retryOnError(boolean retryOnError) {
      this.retryOnError = retryOnError;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      if (retryDelay == null || retryDelay.isNegative()) {
        throw new IllegalArgumentException("The retry delay must be positive or zero");
      }
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public ConsumerOptions build() {
      return new ConsumerOptions(this);
    }
  }
}
