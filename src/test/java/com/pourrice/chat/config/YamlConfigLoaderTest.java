package com.pourrice.chat.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadReadsChatSection() throws IOException {
    Path yaml = tempDir.resolve("chat.yaml");
    Files.writeString(yaml, """
        chat:
          metricsExporter: none
          socketUrl: wss://chat.pourrice.test/chat
          userId: diner-1
          historyTimeoutMillis: 5000
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("wss://chat.pourrice.test/chat", map.get("socketUrl"));
    assertEquals("diner-1", map.get("userId"));
    assertEquals("5000", map.get("historyTimeoutMillis"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        Chat:
          reconnect:
            initialDelayMillis: 500
            maxAttempts: 3
          typing:
            idleMillis: 1500
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("500", map.get("reconnect.initialDelayMillis"));
    assertEquals("3", map.get("reconnect.maxAttempts"));
    assertEquals("1500", map.get("typing.idleMillis"));
  }

  @Test
  void topLevelKeysNeedNoChatSection() throws IOException {
    Path yaml = tempDir.resolve("flat.yaml");
    Files.writeString(yaml, """
        restaurantId: r42
        typing.expiryMillis: 4000
        verbose: true
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals(Map.of("restaurantId", "r42", "typing.expiryMillis", "4000", "verbose", "true"), map);
  }

  @Test
  void misspeltSettingIsRejected() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, """
        chat:
          restaurantId: r42
          reconnect:
            maxAttempt: 3
        """);

    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));

    assertTrue(error.getMessage().contains("reconnect.maxAttempt"));
  }

  @Test
  void otherCommandSectionsAreNotSettings() throws IOException {
    Path yaml = tempDir.resolve("sections.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        chat:
          restaurantId: r42
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"));

    assertTrue(result.isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml).orElseThrow());
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        chat:
          restaurantId:
            - r1
            - r2
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }

  @Test
  void invalidYamlIsReportedAsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "chat: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }
}
