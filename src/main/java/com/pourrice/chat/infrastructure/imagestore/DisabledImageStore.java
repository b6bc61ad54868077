package com.pourrice.chat.infrastructure.imagestore;

import com.pourrice.chat.application.port.ImageStorePort;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.DeleteFailedException;
import com.pourrice.chat.domain.error.UploadFailedException;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntConsumer;

/**
 * Image store used when no {@code apiBaseUrl} is configured. Every call fails.
 *
 * @since 0.1.0
 */
public final class DisabledImageStore implements ImageStorePort {

  @Override
  public CompletableFuture<UploadedImage> upload(ImageFile file, IntConsumer progress) {
    return CompletableFuture.failedFuture(new UploadFailedException("Image uploads are not configured"));
  }

  @Override
  public CompletableFuture<Void> delete(String path) {
    return CompletableFuture.failedFuture(new DeleteFailedException("Image uploads are not configured"));
  }
}
