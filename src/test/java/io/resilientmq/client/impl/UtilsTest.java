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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

public class UtilsTest {

  @ParameterizedTest
  @CsvSource({"10,3,4,1", "9,3,3,3", "2,5,1,2", "1,1,1,1"})
  void partitionShouldSplitInChunks(int size, int chunkSize, int expectedChunks, int lastSize) {
    List<Integer> elements = IntStream.range(0, size).boxed().collect(Collectors.toList());
    List<List<Integer>> chunks = Utils.partition(elements, chunkSize);
    assertThat(chunks).hasSize(expectedChunks);
    assertThat(chunks.get(chunks.size() - 1)).hasSize(lastSize);
    assertThat(chunks.stream().flatMap(List::stream).collect(Collectors.toList()))
        .isEqualTo(elements);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1})
  void partitionShouldReturnNothingOnNonPositiveSize(int chunkSize) {
    assertThat(Utils.partition(List.of(1, 2, 3), chunkSize)).isEmpty();
  }

  @Test
  void partitionShouldReturnNothingOnEmptyList() {
    assertThat(Utils.partition(Collections.emptyList(), 10)).isEmpty();
  }

  @Test
  void threadFactoryShouldNameThreadsWithPrefix() {
    Thread t1 = Utils.threadFactory("resilientmq-test-").newThread(() -> {});
    assertThat(t1.getName()).isEqualTo("resilientmq-test-0");
    assertThat(t1.isDaemon()).isTrue();
  }

  @Test
  void closeQuietlyShouldSwallowErrors() {
    Utils.closeQuietly(
        LoggerFactory.getLogger(UtilsTest.class),
        "resource",
        () -> {
          throw new IllegalStateException("already closed");
        });
  }
}
