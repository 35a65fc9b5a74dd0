/*
 * Copyright The renterd-client-java Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.renterd.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.DeserializationFeature;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import org.junit.jupiter.api.Test;

@SuppressFBWarnings(
    value = "NP_NONNULL_PARAM_VIOLATION",
    justification = "We mean to pass nulls to checks")
public class RenterdClientTest {

  @Test
  void testConstructorRejectsNulls() {
    assertThrows(NullPointerException.class, () -> new RenterdClient((RequestExecutor) null));
    assertThrows(
        NullPointerException.class, () -> new RenterdClient((ApiClientConfiguration) null));
  }

  @Test
  void testCreatesSdkExecutorFromConfiguration() throws IOException {
    ApiClientConfiguration configuration =
        ApiClientConfiguration.builder()
            .apiEndpointUrl("http://localhost:9980/api")
            .apiPassword("secret")
            .build();
    try (RenterdClient client = new RenterdClient(configuration)) {
      assertInstanceOf(SdkHttpRequestExecutor.class, client.getRequestExecutor());
      assertNotNull(client.getWorker().getObjects());
    }
  }

  @Test
  void testCloseClosesExecutor() throws IOException {
    RequestExecutor executor = mock(RequestExecutor.class);
    RenterdClient client = new RenterdClient(executor);

    assertSame(executor, client.getRequestExecutor());
    client.close();

    verify(executor).close();
  }

  @Test
  void testObjectMapperIgnoresUnknownProperties() {
    assertFalse(
        RenterdClient.createObjectMapper()
            .isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
  }
}
