package com.pourrice.chat.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML settings
   * @param cli CLI overrides; may be empty
   * @param defaults embedded defaults
   * @param warn receives a note whenever a CLI key overrides a YAML key
   * @return immutable merged map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    if (!trim(effective.get("authToken")).isEmpty() && trim(effective.get("userId")).isEmpty()) {
      throw new IllegalArgumentException("authToken requires userId");
    }
    if (!trim(effective.get("apiPasscode")).isEmpty() && trim(effective.get("apiBaseUrl")).isEmpty()) {
      throw new IllegalArgumentException("apiPasscode requires apiBaseUrl");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
