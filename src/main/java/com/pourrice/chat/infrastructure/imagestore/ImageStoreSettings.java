package com.pourrice.chat.infrastructure.imagestore;

import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Endpoint settings of the image store.
 *
 * @param baseUrl API base URL, e.g. {@code https://api.example.com}
 * @param uploadPath upload path relative to the base, e.g. {@code API/Images/upload}
 * @param deletePath delete path relative to the base, e.g. {@code API/Images/delete}
 * @param folder storage folder passed as the {@code folder} query parameter
 * @param passcode value of the {@code x-api-passcode} header; empty to omit the header
 * @since 0.1.0
 */
public record ImageStoreSettings(HttpUrl baseUrl, String uploadPath, String deletePath, String folder, String passcode) {

  public ImageStoreSettings {
    Objects.requireNonNull(baseUrl, "baseUrl");
    uploadPath = relative(uploadPath, "uploadPath");
    deletePath = relative(deletePath, "deletePath");
    folder = Objects.requireNonNullElse(folder, "").trim();
    passcode = Objects.requireNonNullElse(passcode, "");
  }

  /**
   * Parses the base URL and applies the settings.
   *
   * @param baseUrl absolute http(s) URL
   * @param uploadPath upload path
   * @param deletePath delete path
   * @param folder storage folder
   * @param passcode optional passcode
   * @return settings
   * @throws IllegalArgumentException when {@code baseUrl} is not an http(s) URL
   */
  public static ImageStoreSettings of(
      String baseUrl, String uploadPath, String deletePath, String folder, String passcode) {
    return new ImageStoreSettings(HttpUrl.get(baseUrl), uploadPath, deletePath, folder, passcode);
  }

  private static String relative(String path, String name) {
    Objects.requireNonNull(path, name);
    String trimmed = path.trim();
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }
}
