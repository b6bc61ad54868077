package com.pourrice.chat.domain.chat;

import java.util.Objects;

/**
 * Reference to an image held by the image store.
 *
 * @param url public URL embedded in chat messages
 * @param path storage path used to delete the object
 * @since 0.1.0
 */
public record UploadedImage(String url, String path) {

  public UploadedImage {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(path, "path");
  }
}
