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

import static org.assertj.core.api.Assertions.fail;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public final class TestUtils {

  static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_WAIT_TIME = Duration.ofMillis(50);

  private TestUtils() {}

  @FunctionalInterface
  public interface CallableBooleanSupplier {
    boolean getAsBoolean() throws Exception;
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, null);
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition, Supplier<String> message) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, condition, message);
  }

  public static Duration waitAtMost(
      Duration timeout, CallableBooleanSupplier condition, Supplier<String> message) {
    long start = System.nanoTime();
    try {
      if (condition.getAsBoolean()) {
        return Duration.ZERO;
      }
      Duration waitedTime = Duration.ofNanos(System.nanoTime() - start);
      Exception exception = null;
      while (waitedTime.compareTo(timeout) <= 0) {
        Thread.sleep(DEFAULT_WAIT_TIME.toMillis());
        try {
          if (condition.getAsBoolean()) {
            return Duration.ofNanos(System.nanoTime() - start);
          }
          exception = null;
        } catch (Exception e) {
          exception = e;
        }
        waitedTime = Duration.ofNanos(System.nanoTime() - start);
      }
      String msg;
      if (message == null) {
        msg = "Waited " + timeout.getSeconds() + " second(s), condition never got true";
      } else {
        msg = "Waited " + timeout.getSeconds() + " second(s), " + message.get();
      }
      if (exception == null) {
        fail(msg);
      } else {
        fail(msg, exception);
      }
      return waitedTime;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  static Sync sync(int count) {
    return new Sync(count);
  }

  static final class Sync {

    private final CountDownLatch latch;

    private Sync(int count) {
      this.latch = new CountDownLatch(count);
    }

    void down() {
      this.latch.countDown();
    }

    boolean await(Duration timeout) {
      try {
        return this.latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RuntimeException(e);
      }
    }

    boolean hasCompleted() {
      return this.latch.getCount() == 0;
    }
  }
}
