package com.pourrice.chat.domain.chat;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Local image selected by the user for upload.
 * <p><strong>Thread-safety:</strong> Immutable; content is copied on construction.</p>
 *
 * @param fileName original file name
 * @param contentType MIME type such as {@code image/png}; may be empty when unknown
 * @param content raw bytes
 * @since 0.1.0
 */
public record ImageFile(String fileName, String contentType, byte[] content) {
  private static final Map<String, String> TYPES_BY_EXTENSION = Map.of(
      "png", "image/png",
      "jpg", "image/jpeg",
      "jpeg", "image/jpeg",
      "gif", "image/gif",
      "webp", "image/webp",
      "bmp", "image/bmp",
      "heic", "image/heic");

  public ImageFile {
    Objects.requireNonNull(fileName, "fileName");
    contentType = Objects.requireNonNullElse(contentType, "").trim().toLowerCase(Locale.ROOT);
    content = content != null ? content.clone() : new byte[0];
  }

  /**
   * Reads an image from disk, guessing the content type from the platform or the file extension.
   *
   * @param path file to read
   * @return loaded image file
   * @throws IOException when the file cannot be read
   */
  public static ImageFile fromPath(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    byte[] bytes = Files.readAllBytes(path);
    String name = path.getFileName() != null ? path.getFileName().toString() : "image";
    String type = Files.probeContentType(path);
    if (type == null || type.isBlank()) {
      type = guessContentType(name);
    }
    return new ImageFile(name, type, bytes);
  }

  static String guessContentType(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    return TYPES_BY_EXTENSION.getOrDefault(extension, "");
  }

  /**
   * Returns the file content without copying.
   *
   * @return internal content array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Content is copied on construction; upload bodies read it without another copy.")
  public byte[] content() {
    return content;
  }

  /**
   * Returns the size in bytes.
   *
   * @return content length
   */
  public long size() {
    return content.length;
  }

  /**
   * Indicates whether the declared content type is an image type.
   *
   * @return {@code true} for {@code image/*}
   */
  public boolean isImage() {
    return contentType.startsWith("image/");
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ImageFile that)) {
      return false;
    }
    return fileName.equals(that.fileName)
        && contentType.equals(that.contentType)
        && Arrays.equals(content, that.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, contentType, Arrays.hashCode(content));
  }

  @Override
  public String toString() {
    return "ImageFile[fileName=" + fileName + ", contentType=" + contentType + ", size=" + content.length + "]";
  }
}
