package com.pourrice.chat.domain.chat;

import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the image staged for the next message.
 *
 * <p>The staged image is uploaded as soon as it is selected. It is either consumed by a send, which
 * transfers ownership of the remote object to the message, or discarded, which deletes the remote object.</p>
 *
 * @param fileName local file name
 * @param previewDataUrl {@code data:} URL for local preview rendering
 * @param uploaded remote reference once the upload completed; {@code null} while uploading
 * @param uploadProgress upload progress in percent (0-100)
 * @since 0.1.0
 */
public record PendingAttachment(
    String fileName, String previewDataUrl, UploadedImage uploaded, int uploadProgress) {

  public PendingAttachment {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(previewDataUrl, "previewDataUrl");
    uploadProgress = Math.max(0, Math.min(100, uploadProgress));
  }

  /**
   * Returns the remote reference once available.
   *
   * @return uploaded image, empty while the upload is in flight
   */
  public Optional<UploadedImage> uploadedImage() {
    return Optional.ofNullable(uploaded);
  }

  /**
   * Indicates whether the upload is still running.
   *
   * @return {@code true} while no remote reference exists
   */
  public boolean uploading() {
    return uploaded == null;
  }
}
