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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

public class ConsumerOptionsTest {

  @Test
  void defaultsShouldUseBrokerRedeliveryAfterOneSecond() {
    ConsumerOptions options = ConsumerOptions.defaults(4);
    assertThat(options.workers()).isEqualTo(4);
    assertThat(options.retryOnError()).isTrue();
    assertThat(options.retryDelay()).isEqualTo(Duration.ofSeconds(1));
    assertThat(options.maxRetries()).isEqualTo(-1);
  }

  @Test
  void toBuilderShouldCopySettings() {
    ConsumerOptions options =
        ConsumerOptions.builder().workers(2).retryDelay(Duration.ZERO).maxRetries(3).build();
    assertThat(options.toBuilder().build()).isEqualTo(options);
    assertThat(options.toBuilder().maxRetries(0).build().maxRetries()).isZero();
  }

  @Test
  void invalidSettingsShouldBeRejected() {
    assertThatThrownBy(() -> ConsumerOptions.builder().workers(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ConsumerOptions.builder().retryDelay(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void publishConfigShouldBeImmutable() {
    PublishConfig config = PublishConfig.defaults();
    PublishConfig withRetries = config.maxRetries(2);
    assertThat(config.maxRetries()).isEmpty();
    assertThat(withRetries.maxRetries()).hasValue(2);
    assertThat(withRetries.deliveryMode()).isEqualTo(DeliveryMode.PERSISTENT);
  }
}
