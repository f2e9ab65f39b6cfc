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

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is typically the re-creation of the broker connection.
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use before a given attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task must not be attempted
   * anymore.
   *
   * @param attempt number of the attempt, starting at 0
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int attempt);

  /**
   * Policy with a fixed delay and no attempt limit.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(delay, delay);
  }

  /**
   * Policy with a fixed delay and a maximum number of attempts.
   *
   * @param delay the fixed delay
   * @param maxAttempts number of attempts before giving up
   * @return fixed-delay policy with an attempt limit
   */
  static BackOffDelayPolicy fixed(Duration delay, int maxAttempts) {
    return new LimitedAttemptsBackOffPolicy(fixed(delay), maxAttempts);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @return fixed-delay policy with initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(initialDelay, delay);
  }

  /**
   * Decorate a policy to give up after a number of attempts.
   *
   * @param policy the policy to decorate
   * @param maxAttempts number of attempts before giving up
   * @return the limited policy
   */
  static BackOffDelayPolicy limited(BackOffDelayPolicy policy, int maxAttempts) {
    return new LimitedAttemptsBackOffPolicy(policy, maxAttempts);
  }

  final class FixedWithInitialDelayBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayBackOffPolicy(Duration initialDelay, Duration delay) {
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int attempt) {
      return attempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }

  final class LimitedAttemptsBackOffPolicy implements BackOffDelayPolicy {

    private final BackOffDelayPolicy delegate;
    private final int maxAttempts;

    private LimitedAttemptsBackOffPolicy(BackOffDelayPolicy delegate, int maxAttempts) {
      if (maxAttempts <= 0) {
        throw new IllegalArgumentException("The number of attempts must be strictly positive");
      }
      this.delegate = delegate;
      this.maxAttempts = maxAttempts;
    }

    @Override
    public Duration delay(int attempt) {
      if (attempt >= maxAttempts) {
        return TIMEOUT;
      } else {
        return delegate.delay(attempt);
      }
    }

    @Override
    public String toString() {
      return "LimitedAttemptsBackOffPolicy{"
          + "maxAttempts="
          + maxAttempts
          + ", delegate="
          + delegate
          + '}';
    }
  }
}
