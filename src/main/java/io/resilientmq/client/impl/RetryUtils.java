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

import static java.lang.String.format;

import io.resilientmq.client.BackOffDelayPolicy;
import io.resilientmq.client.MqException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class RetryUtils {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryUtils.class);

  static final Waiter SLEEP =
      delay -> {
        Thread.sleep(delay.toMillis());
        return true;
      };

  private RetryUtils() {}

  /**
   * Call an operation until it succeeds, waiting before each attempt.
   *
   * <p>The delay policy gives the wait before attempt <code>n</code> (0-based), {@link
   * BackOffDelayPolicy#TIMEOUT} ends the retries.
   *
   * @throws RetryExhaustedException if no attempt succeeded
   * @throws CancellationException if the waiter reports cancellation
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  static <T> T callWithBackOff(
      Attempt<T> operation,
      Predicate<Exception> retryCondition,
      BackOffDelayPolicy delayPolicy,
      Waiter waiter,
      String format,
      Object... args)
      throws InterruptedException {
    String description = format(format, args);
    int attempt = 0;
    Exception lastException = null;
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    while (true) {
      Duration delay = delayPolicy.delay(attempt);
      if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
        break;
      }
      if (!delay.isZero()) {
        LOGGER.debug(
            "Waiting {} ms before attempt #{} of '{}'", delay.toMillis(), attempt + 1, description);
        if (!waiter.await(delay)) {
          throw new CancellationException(format("Operation '%s' cancelled", description));
        }
      }
      Utils.throwIfInterrupted();
      attempt++;
      try {
        LOGGER.debug("Starting attempt #{} for operation '{}'", attempt, description);
        T result = operation.call(attempt);
        LOGGER.debug(
            "Operation '{}' completed in {} ms after {} attempt(s)",
            description,
            stopWatch.stop().toMillis(),
            attempt);
        return result;
      } catch (Exception e) {
        lastException = e;
        if (retryCondition.test(e)) {
          LOGGER.debug(
              "Attempt #{} of operation '{}' failed: {}",
              attempt,
              description,
              ExceptionUtils.exceptionMessage(e));
        } else {
          LOGGER.debug("Operation '{}' failed with non-retryable error", description);
          throw ExceptionUtils.convert(e);
        }
      }
    }
    String message =
        format(
            "Could not complete task '%s' after %d attempt(s) (reason: %s)",
            description, attempt, ExceptionUtils.exceptionMessage(lastException));
    LOGGER.debug(message);
    throw new RetryExhaustedException(message, attempt, lastException);
  }

  @FunctionalInterface
  interface Attempt<T> {

    T call(int attempt) throws Exception;
  }

  /** Wait between attempts, returns false if the wait has been cancelled. */
  @FunctionalInterface
  interface Waiter {

    boolean await(Duration delay) throws InterruptedException;
  }

  static final class RetryExhaustedException extends MqException {

    private final int attempts;

    private RetryExhaustedException(String message, int attempts, Throwable cause) {
      super(message, cause);
      this.attempts = attempts;
    }

    int attempts() {
      return this.attempts;
    }
  }
}
