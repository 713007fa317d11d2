/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.logship.lib.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransportConfigTest {

  @Test
  void testDefaultHeadersAreEmpty() {
    assertTrue(TransportConfig.defaults().getHeaders().isEmpty());
  }

  @Test
  void testHeadersAreCopiedOnBuild() {
    Map<String, String> source = new HashMap<>();
    source.put("Authorization", "Bearer a");
    TransportConfig config = TransportConfig.builder().headers(source).build();

    source.put("Authorization", "Bearer b");
    source.put("X-Extra", "1");

    assertEquals(Map.of("Authorization", "Bearer a"), config.getHeaders());
  }

  @Test
  void testHeadersAreUnmodifiable() {
    TransportConfig config =
        TransportConfig.builder().header("X-Team", "core").header("X-Env", "prod").build();

    assertThrows(UnsupportedOperationException.class, () -> config.getHeaders().put("X", "y"));
    assertEquals(Map.of("X-Team", "core", "X-Env", "prod"), config.getHeaders());
  }

  @Test
  void testToBuilderKeepsHeaders() {
    TransportConfig config = TransportConfig.builder().header("X-Team", "core").build();

    TransportConfig copy = config.toBuilder().channel("other").build();

    assertEquals(config.getHeaders(), copy.getHeaders());
    assertEquals("other", copy.getChannel());
  }
}
