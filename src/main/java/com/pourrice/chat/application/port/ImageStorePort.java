package com.pourrice.chat.application.port;

import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.UploadedImage;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntConsumer;

/**
 * <strong>What:</strong> Port for the HTTP image store that holds chat attachments.
 * <p><strong>Thread-safety:</strong> Futures may complete on HTTP client threads.</p>
 *
 * @since 0.1.0
 */
public interface ImageStorePort {

  /**
   * Uploads an image.
   *
   * @param file image to upload
   * @param progress receives upload progress in percent (0-100); may be called from any thread
   * @return future completed with the stored reference, or exceptionally with {@code UploadFailedException}
   */
  CompletableFuture<UploadedImage> upload(ImageFile file, IntConsumer progress);

  /**
   * Deletes a previously uploaded image.
   *
   * @param path storage path returned by {@link #upload(ImageFile, IntConsumer)}
   * @return future completed on success, or exceptionally with {@code DeleteFailedException}
   */
  CompletableFuture<Void> delete(String path);
}
