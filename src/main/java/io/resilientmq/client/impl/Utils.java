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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

final class Utils {

  private Utils() {}

  /**
   * Split a list into consecutive chunks of at most <code>size</code> elements.
   *
   * <p>The last chunk holds the remainder. An empty list or a non-positive size gives no chunk.
   * Chunks are views of the input list.
   */
  static <T> List<List<T>> partition(List<T> elements, int size) {
    if (elements == null || elements.isEmpty() || size <= 0) {
      return Collections.emptyList();
    }
    List<List<T>> chunks = new ArrayList<>((elements.size() + size - 1) / size);
    for (int start = 0; start < elements.size(); start += size) {
      chunks.add(elements.subList(start, Math.min(start + size, elements.size())));
    }
    return chunks;
  }

  static ThreadFactory threadFactory(String prefix) {
    if (prefix == null) {
      return Executors.defaultThreadFactory();
    } else {
      return new NamedThreadFactory(prefix);
    }
  }

  static void throwIfInterrupted() throws InterruptedException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException();
    }
  }

  /** Run a closing action, log and drop any error. */
  static void closeQuietly(Logger logger, String label, RunnableWithException action) {
    try {
      action.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.info("Interrupted while closing {}", label);
    } catch (Exception e) {
      logger.info("Error while closing {}: {}", label, ExceptionUtils.exceptionMessage(e));
    }
  }

  @FunctionalInterface
  interface RunnableWithException {

    void run() throws Exception;
  }

  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadFactory backingThreadFactory;

    private final String prefix;

    private final AtomicLong count = new AtomicLong(0);

    private NamedThreadFactory(String prefix) {
      this.backingThreadFactory = Executors.defaultThreadFactory();
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = this.backingThreadFactory.newThread(r);
      thread.setName(prefix + count.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }

  static class StopWatch {

    private final long start = System.nanoTime();

    Duration stop() {
      return Duration.ofNanos(System.nanoTime() - start);
    }
  }
}
