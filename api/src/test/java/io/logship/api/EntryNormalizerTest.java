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
package io.logship.api;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class EntryNormalizerTest {

  private static final long NOW = 1_700_000_000_000L;

  private final AtomicInteger ids = new AtomicInteger();
  private final EntryNormalizer normalizer =
      new EntryNormalizer(
          Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC),
          () -> "id-" + ids.incrementAndGet());

  @Test
  void testNormalizeWithNameAndExtra() {
    LogEntry entry =
        EntryNormalizer.normalize("warn", "disk low", "sys", Map.of("used_pct", 91));

    assertEquals(LogLevel.WARN, entry.getLevel());
    assertEquals(40, entry.toPayload().get("level"));
    assertEquals("disk low", entry.getMsg());
    assertEquals("sys", entry.getName());
    assertEquals(91, entry.getExtra().get("used_pct"));
    assertNotNull(entry.getId());
    assertTrue(entry.getTime() > 0);
  }

  @Test
  void testNumericLevelUsesStandardScale() {
    LogEntry entry = EntryNormalizer.normalize(40, "boom", null, null);
    assertEquals(LogLevel.ERROR, entry.getLevel());
  }

  @Test
  void testNumericLevelWithExplicitScale() {
    assertEquals(
        LogLevel.WARN,
        EntryNormalizer.normalize(900, NumericLevelScale.JUL, "m", null, null).getLevel());
    assertEquals(
        LogLevel.WARN,
        EntryNormalizer.normalize(40, NumericLevelScale.CANONICAL, "m", null, null).getLevel());
  }

  @Test
  void testUnknownLevelsDefaultToInfo() {
    assertEquals(LogLevel.INFO, EntryNormalizer.normalize("loud", "m", null, null).getLevel());
    assertEquals(LogLevel.INFO, EntryNormalizer.normalize(12345, "m", null, null).getLevel());
    assertEquals(
        LogLevel.INFO, EntryNormalizer.normalize((LogLevel) null, "m", null, null).getLevel());
  }

  @Test
  void testStampsIdAndTime() {
    LogEntry first = normalizer.create(LogLevel.INFO, "a", null, null);
    LogEntry second = normalizer.create(LogLevel.INFO, "b", null, null);

    assertEquals("id-1", first.getId());
    assertEquals("id-2", second.getId());
    assertEquals(NOW, first.getTime());
  }

  @Test
  void testDefaultIdsAreUnique() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      assertTrue(seen.add(EntryNormalizer.normalize("info", "m", null, null).getId()));
    }
  }

  @Test
  void testTimeCanBeOverridden() {
    LogEntry entry = normalizer.create(LogLevel.INFO, "m", null, null).withTime(42L);
    assertEquals(42L, entry.getTime());
    assertEquals(42L, entry.toPayload().get("time"));
  }

  @Test
  void testAbsentNameIsOmitted() {
    assertFalse(normalizer.create(LogLevel.INFO, "m", null, null).toPayload().containsKey("name"));
    assertFalse(normalizer.create(LogLevel.INFO, "m", "  ", null).toPayload().containsKey("name"));
  }

  @Test
  void testNullMessageBecomesEmpty() {
    assertEquals("", normalizer.create(LogLevel.INFO, null, null, null).getMsg());
  }

  @Test
  void testExtraOverridesReservedKeysInPayload() {
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("msg", "from extra");
    extra.put("user_id", 7);

    LogEntry entry = normalizer.create(LogLevel.INFO, "original", null, extra);
    Map<String, Object> payload = entry.toPayload();

    assertEquals("from extra", payload.get("msg"));
    assertEquals(7, payload.get("user_id"));
    assertEquals("original", entry.getMsg());
  }

  @Test
  void testExtraIsCopied() {
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("k", "v");
    LogEntry entry = normalizer.create(LogLevel.INFO, "m", null, extra);

    extra.put("k", "changed");

    assertEquals("v", entry.getExtra().get("k"));
    assertThrows(UnsupportedOperationException.class, () -> entry.getExtra().put("x", 1));
  }
}
