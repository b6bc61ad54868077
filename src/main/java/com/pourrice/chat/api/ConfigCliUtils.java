package com.pourrice.chat.api;

import java.util.Map;

/**
 * Helpers for mixing CLI arguments with YAML configuration.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} (or {@code --config}) argument.
   *
   * @param args mutable CLI map
   * @return config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
