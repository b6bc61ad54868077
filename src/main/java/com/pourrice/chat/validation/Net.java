package com.pourrice.chat.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Endpoint validation for the chat socket and image API base URLs.
 */
public final class Net {
  private static final Set<String> SOCKET_SCHEMES = Set.of("ws", "wss", "http", "https");
  private static final Set<String> HTTP_SCHEMES = Set.of("http", "https");
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a WebSocket endpoint. {@code http(s)} is accepted and left as is; OkHttp upgrades it.
   *
   * @param name parameter name for diagnostics
   * @param value candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException if the URL is malformed or uses another scheme
   */
  public static URI requireSocketUri(String name, String value) {
    return requireUri(name, value, SOCKET_SCHEMES);
  }

  /**
   * Validates an HTTP base URL.
   *
   * @param name parameter name for diagnostics
   * @param value candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException if the URL is malformed or not http(s)
   */
  public static URI requireHttpUri(String name, String value) {
    return requireUri(name, value, HTTP_SCHEMES);
  }

  private static URI requireUri(String name, String value, Set<String> schemes) {
    String sanitized = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + ex.getMessage(), ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!schemes.contains(scheme)) {
      throw new IllegalArgumentException(name + " must use one of " + schemes + " (was " + sanitized + ")");
    }
    String host = uri.getHost();
    if (host == null || host.isEmpty()) {
      throw new IllegalArgumentException(name + " must include a host (was " + sanitized + ")");
    }
    if (!host.startsWith("[")) {
      validateHost(name, host);
    }
    if (uri.getPort() != -1) {
      Numbers.requireRange(name + " port", uri.getPort(), 1, 65535);
    }
    return uri;
  }

  private static void validateHost(String name, String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      for (String part : host.split("\\.")) {
        Numbers.requireRange(name + " IPv4 octet", Integer.parseInt(part), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(name + " hostname is longer than " + MAX_HOSTNAME_LENGTH);
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException(name + " has an invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException(name + " hostname labels must start and end with alphanumeric");
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!(isAsciiAlnum(c) || c == '-')) {
          throw new IllegalArgumentException(name + " hostname has illegal character '" + c + '\'');
        }
      }
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
