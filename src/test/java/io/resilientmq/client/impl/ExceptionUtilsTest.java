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

import com.rabbitmq.client.ShutdownSignalException;
import io.resilientmq.client.MqException;
import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

public class ExceptionUtilsTest {

  @Test
  void convertShouldReturnConnectExceptionOnNetworkErrors() {
    assertThat(ExceptionUtils.convert(new ConnectException("Connection refused")))
        .isInstanceOf(MqException.MqConnectException.class);
    assertThat(ExceptionUtils.convert(new TimeoutException()))
        .isInstanceOf(MqException.MqConnectException.class);
    assertThat(
            ExceptionUtils.convert(
                new IOException(new ShutdownSignalException(true, false, null, null))))
        .isInstanceOf(MqException.MqConnectException.class);
  }

  @Test
  void convertShouldReturnGenericExceptionOnOtherErrors() {
    MqException e =
        ExceptionUtils.convert(new IOException("PRECONDITION_FAILED"), "declare %s", "q");
    assertThat(e).isNotInstanceOf(MqException.MqConnectException.class).hasMessage("declare q");
  }

  @Test
  void convertShouldKeepClientExceptions() {
    MqException e = new MqException.MqPublishException("nacked");
    assertThat(ExceptionUtils.convert(e)).isSameAs(e);
    assertThat(ExceptionUtils.convertPublish(e, "publish")).isSameAs(e);
  }

  @Test
  void convertPublishShouldWrap() {
    assertThat(ExceptionUtils.convertPublish(new IOException("boom"), "publish to %s", "q"))
        .isInstanceOf(MqException.MqPublishException.class)
        .hasMessage("publish to q")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void exceptionMessageShouldIncludeType() {
    assertThat(ExceptionUtils.exceptionMessage(new IOException("boom")))
        .isEqualTo("boom [IOException]");
    assertThat(ExceptionUtils.exceptionMessage(new IOException())).isEqualTo("IOException");
    assertThat(ExceptionUtils.exceptionMessage(null)).isEqualTo("unknown");
  }
}
