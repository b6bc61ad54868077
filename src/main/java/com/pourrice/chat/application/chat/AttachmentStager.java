package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.ImageStorePort;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.port.SchedulerPort;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.PendingAttachment;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.DeleteFailedException;
import com.pourrice.chat.domain.error.UploadFailedException;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Holds the single image staged for the next message.
 * <p><strong>Lifecycle:</strong> Selecting an image validates it and starts the upload right away. The staged image
 * then ends in one of two ways: {@link #consumeForSend()} hands the remote object to a message, or
 * {@link #clearImage()} deletes it. A discard while the upload is still running deletes the object as soon as the
 * upload completes. A handed-over image whose message was not sent comes back through
 * {@link #returnUnsent(UploadedImage)}. Every uploaded but unsent object is deleted exactly once.</p>
 * <p><strong>Failures:</strong> Upload and delete failures are reported through
 * {@link ChatEventListener#onError}; neither is retried.</p>
 * <p><strong>Thread-safety:</strong> Confined to the event loop; upload callbacks are re-dispatched onto it.</p>
 * <p><strong>Observability:</strong> Emits {@code chat.attachment.upload.ok}, {@code chat.attachment.upload.failed},
 * {@code chat.attachment.delete.ok}, {@code chat.attachment.delete.failed} and observes
 * {@code chat.attachment.upload.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class AttachmentStager {
  private static final Logger log = LoggerFactory.getLogger(AttachmentStager.class);

  private final ImageStorePort imageStore;
  private final SchedulerPort scheduler;
  private final ChatEventListener listener;
  private final MetricsPort metrics;
  private final long maxBytes;
  private final Map<UploadedImage, Staged> handedOver = new HashMap<>();
  private volatile Staged current;
  private boolean closed;

  AttachmentStager(
      ImageStorePort imageStore,
      SchedulerPort scheduler,
      ChatEventListener listener,
      MetricsPort metrics,
      long maxBytes) {
    this.imageStore = Objects.requireNonNull(imageStore, "imageStore");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.maxBytes = maxBytes;
  }

  /**
   * Checks that a file may be staged.
   *
   * @param file candidate image
   * @throws IllegalArgumentException with a user-facing message when the file is not an image or too large
   */
  void validate(ImageFile file) {
    Objects.requireNonNull(file, "file");
    if (!file.isImage()) {
      throw new IllegalArgumentException("Only image files can be attached.");
    }
    if (file.size() == 0) {
      throw new IllegalArgumentException("The selected image is empty.");
    }
    if (file.size() > maxBytes) {
      throw new IllegalArgumentException(
          "Images must be at most " + (maxBytes / (1024 * 1024)) + " MB.");
    }
  }

  /**
   * Stages an image and starts uploading it. A previously staged image is discarded first.
   *
   * @param file image to stage
   * @return future completed with the remote reference once uploaded, or exceptionally with
   *     {@link UploadFailedException}
   * @throws IllegalArgumentException when validation fails
   */
  CompletableFuture<UploadedImage> selectImage(ImageFile file) {
    validate(file);
    closed = false;
    if (current != null) {
      discard(current);
    }
    Staged staged = new Staged(file.fileName(), previewDataUrl(file));
    current = staged;
    publish();
    metrics.observe("chat.attachment.upload.bytes", file.size());
    log.info("Uploading {} ({} bytes)", file.fileName(), file.size());
    CompletableFuture<UploadedImage> upload;
    try {
      upload = imageStore.upload(file, percent -> scheduler.execute(() -> onProgress(staged, percent)));
    } catch (RuntimeException ex) {
      upload = CompletableFuture.failedFuture(ex);
    }
    CompletableFuture<UploadedImage> result = new CompletableFuture<>();
    upload.whenCompleteAsync((image, error) -> onUploaded(staged, image, error, result), scheduler);
    return result;
  }

  /**
   * Discards the staged image, deleting its remote object.
   *
   * @return future completed once the delete finished, or immediately when nothing needs deleting now
   */
  CompletableFuture<Void> clearImage() {
    Staged staged = current;
    if (staged == null) {
      return CompletableFuture.completedFuture(null);
    }
    current = null;
    publish();
    return discard(staged);
  }

  /**
   * Discards the staged image when the session closes.
   *
   * @return see {@link #clearImage()}
   */
  CompletableFuture<Void> discardOnClose() {
    closed = true;
    return clearImage();
  }

  /**
   * Hands the uploaded image to an outgoing message without deleting it.
   *
   * @return uploaded reference, or empty when nothing has finished uploading
   */
  Optional<UploadedImage> consumeForSend() {
    Staged staged = current;
    if (staged == null || staged.uploaded == null) {
      return Optional.empty();
    }
    current = null;
    handedOver.put(staged.uploaded, staged);
    publish();
    log.debug("Attached {} to outgoing message", staged.uploaded.path());
    return Optional.of(staged.uploaded);
  }

  /**
   * Confirms that the message carrying a handed-over image was sent; the remote object now belongs to it.
   *
   * @param image reference returned by {@link #consumeForSend()}
   */
  void confirmSent(UploadedImage image) {
    handedOver.remove(image);
  }

  /**
   * Takes back a handed-over image whose message could not be sent. It is staged again when the slot is free and the
   * session is open; otherwise its remote object is deleted.
   *
   * @param image reference returned by {@link #consumeForSend()}
   * @return future completed once the image is staged again or deleted
   */
  CompletableFuture<Void> returnUnsent(UploadedImage image) {
    Staged staged = handedOver.remove(image);
    if (staged == null) {
      return CompletableFuture.completedFuture(null);
    }
    if (closed || current != null) {
      log.debug("Message with {} not sent; deleting it", image.path());
      staged.discarded = true;
      return deleteRemote(image.path());
    }
    log.debug("Message with {} not sent; image staged again", image.path());
    current = staged;
    publish();
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Indicates whether an uploaded image is ready to be sent.
   *
   * @return {@code true} when {@link #consumeForSend()} would return a value
   */
  boolean hasUploadedImage() {
    Staged staged = current;
    return staged != null && staged.uploaded != null;
  }

  /**
   * Returns the staged attachment.
   *
   * @return staging snapshot, or empty when nothing is staged
   */
  public Optional<PendingAttachment> current() {
    Staged staged = current;
    return staged == null ? Optional.empty() : Optional.of(staged.snapshot());
  }

  static String previewDataUrl(ImageFile file) {
    return "data:" + file.contentType() + ";base64," + Base64.getEncoder().encodeToString(file.content());
  }

  private void onProgress(Staged staged, int percent) {
    if (current != staged || staged.uploaded != null) {
      return;
    }
    int bounded = Math.max(0, Math.min(100, percent));
    if (bounded != staged.progress) {
      staged.progress = bounded;
      publish();
    }
  }

  private void onUploaded(
      Staged staged, UploadedImage image, Throwable error, CompletableFuture<UploadedImage> result) {
    if (error != null) {
      UploadFailedException failure = asUploadFailure(error);
      metrics.increment("chat.attachment.upload.failed");
      log.warn("Upload of {} failed: {}", staged.fileName, failure.getMessage());
      if (!staged.discarded && current == staged) {
        current = null;
        publish();
        listener.onError(failure);
      }
      result.completeExceptionally(failure);
      return;
    }
    metrics.increment("chat.attachment.upload.ok");
    staged.uploaded = image;
    staged.progress = 100;
    if (staged.discarded) {
      log.debug("Upload of {} finished after discard; deleting {}", staged.fileName, image.path());
      deleteRemote(image.path());
    } else if (current == staged) {
      publish();
    }
    result.complete(image);
  }

  private CompletableFuture<Void> discard(Staged staged) {
    if (staged.discarded) {
      return CompletableFuture.completedFuture(null);
    }
    staged.discarded = true;
    if (staged.uploaded == null) {
      log.debug("Discarded {} while uploading; delete deferred", staged.fileName);
      return CompletableFuture.completedFuture(null);
    }
    return deleteRemote(staged.uploaded.path());
  }

  private CompletableFuture<Void> deleteRemote(String path) {
    CompletableFuture<Void> delete;
    try {
      delete = imageStore.delete(path);
    } catch (RuntimeException ex) {
      delete = CompletableFuture.failedFuture(ex);
    }
    CompletableFuture<Void> result = new CompletableFuture<>();
    delete.whenCompleteAsync((ignored, error) -> {
      if (error != null) {
        DeleteFailedException failure = asDeleteFailure(path, error);
        metrics.increment("chat.attachment.delete.failed");
        log.warn("Could not delete discarded image {}: {}", path, failure.getMessage());
        listener.onError(failure);
      } else {
        metrics.increment("chat.attachment.delete.ok");
        log.debug("Deleted discarded image {}", path);
      }
      result.complete(null);
    }, scheduler);
    return result;
  }

  private void publish() {
    listener.onAttachmentChanged(current());
  }

  private static UploadFailedException asUploadFailure(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    if (cause instanceof UploadFailedException failure) {
      return failure;
    }
    return new UploadFailedException("Upload failed: " + cause.getMessage(), cause);
  }

  private static DeleteFailedException asDeleteFailure(String path, Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    if (cause instanceof DeleteFailedException failure) {
      return failure;
    }
    return new DeleteFailedException("Delete of " + path + " failed: " + cause.getMessage(), cause);
  }

  private static final class Staged {
    private final String fileName;
    private final String preview;
    private volatile UploadedImage uploaded;
    private int progress;
    private boolean discarded;

    Staged(String fileName, String preview) {
      this.fileName = fileName;
      this.preview = preview;
    }

    PendingAttachment snapshot() {
      return new PendingAttachment(fileName, preview, uploaded, progress);
    }
  }
}
