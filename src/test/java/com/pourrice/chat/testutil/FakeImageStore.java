package com.pourrice.chat.testutil;

import com.pourrice.chat.application.port.ImageStorePort;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.DeleteFailedException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntConsumer;

/** Image store whose uploads stay pending until the test completes them. */
public final class FakeImageStore implements ImageStorePort {
  private final List<PendingUpload> uploads = new ArrayList<>();
  private final List<String> deletes = new ArrayList<>();
  private boolean failDeletes;

  @Override
  public CompletableFuture<UploadedImage> upload(ImageFile file, IntConsumer progress) {
    PendingUpload upload = new PendingUpload(file, progress, new CompletableFuture<>());
    uploads.add(upload);
    return upload.result();
  }

  @Override
  public CompletableFuture<Void> delete(String path) {
    deletes.add(path);
    if (failDeletes) {
      return CompletableFuture.failedFuture(new DeleteFailedException("delete rejected for " + path));
    }
    return CompletableFuture.completedFuture(null);
  }

  public void failDeletes() {
    failDeletes = true;
  }

  public PendingUpload lastUpload() {
    return uploads.get(uploads.size() - 1);
  }

  public int uploadCount() {
    return uploads.size();
  }

  public List<String> deletes() {
    return List.copyOf(deletes);
  }

  public record PendingUpload(ImageFile file, IntConsumer progress, CompletableFuture<UploadedImage> result) {
    public void succeed(String url, String path) {
      result.complete(new UploadedImage(url, path));
    }
  }
}
