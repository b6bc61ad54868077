package com.pourrice.chat.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a chat configuration file into the dotted keys understood by {@link ChatConfig}.
 *
 * <p>The document holds the chat keys either at the top level or under a single {@code chat:} mapping. Groups
 * such as {@code reconnect} or {@code typing} may be written nested:</p>
 * <pre>
 * chat:
 *   socketUrl: wss://chat.example.com/ws
 *   restaurantId: r42
 *   reconnect:
 *     maxAttempts: 5
 * </pre>
 * Keys that {@link ChatDefaults} does not know are rejected so a misspelt setting never falls back silently.
 */
public final class YamlConfigLoader {
  static final String CHAT_SECTION = "chat";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path}.
   *
   * @param path YAML file
   * @return dotted keys mapped to scalar text, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, holds a list, or names an unknown key
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, String> settings = new LinkedHashMap<>();
    collect(unwrapChatSection(document), "", settings);
    rejectUnknownKeys(settings.keySet(), path);
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<?, ?> unwrapChatSection(Object document) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Chat configuration must be a mapping of settings");
    }
    if (root.size() == 1) {
      Map.Entry<?, ?> only = root.entrySet().iterator().next();
      if (only.getKey() instanceof String key && CHAT_SECTION.equals(key.trim().toLowerCase(Locale.ROOT))) {
        if (only.getValue() == null) {
          return Map.of();
        }
        if (!(only.getValue() instanceof Map<?, ?> section)) {
          throw new IllegalArgumentException("chat section must be a mapping of settings");
        }
        return section;
      }
    }
    return root;
  }

  private static void collect(Map<?, ?> node, String group, Map<String, String> settings) {
    for (Map.Entry<?, ?> entry : node.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("Setting names must be non-blank text" + inGroup(group));
      }
      String key = group.isEmpty() ? name.trim() : group + '.' + name.trim();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(nested, key, settings);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Setting " + key + " takes a single value, not a list");
      } else {
        settings.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static void rejectUnknownKeys(Set<String> keys, Path path) {
    Set<String> unknown = new TreeSet<>(keys);
    unknown.removeAll(ChatDefaults.asFlatMap().keySet());
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("Unknown chat setting(s) " + unknown + " in " + path);
    }
  }

  private static String inGroup(String group) {
    return group.isEmpty() ? "" : " (under " + group + ")";
  }
}
