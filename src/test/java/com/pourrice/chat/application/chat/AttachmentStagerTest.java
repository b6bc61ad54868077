package com.pourrice.chat.application.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.PendingAttachment;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.DeleteFailedException;
import com.pourrice.chat.domain.error.UploadFailedException;
import com.pourrice.chat.domain.protocol.SendMessageRequest;
import com.pourrice.chat.testutil.FakeImageStore;
import com.pourrice.chat.testutil.ManualScheduler;
import com.pourrice.chat.testutil.RecordingChatListener;
import com.pourrice.chat.testutil.RecordingMetrics;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttachmentStagerTest {
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

  private FakeImageStore store;
  private RecordingChatListener listener;
  private RecordingMetrics metrics;
  private AttachmentStager stager;

  @BeforeEach
  void setUp() {
    store = new FakeImageStore();
    listener = new RecordingChatListener();
    metrics = new RecordingMetrics();
    stager = new AttachmentStager(store, new ManualScheduler(), listener, metrics, 16);
  }

  @Test
  void rejectsNonImagesEmptyFilesAndOversizedFiles() {
    IllegalArgumentException notImage = assertThrows(IllegalArgumentException.class,
        () -> stager.validate(new ImageFile("menu.pdf", "application/pdf", PNG)));
    assertEquals("Only image files can be attached.", notImage.getMessage());
    assertThrows(IllegalArgumentException.class, () -> stager.validate(new ImageFile("a.png", "image/png", null)));
    assertThrows(IllegalArgumentException.class,
        () -> stager.validate(new ImageFile("big.png", "image/png", new byte[17])));
    assertEquals(0, store.uploadCount());
  }

  @Test
  void uploadPublishesPreviewProgressAndResult() {
    CompletableFuture<UploadedImage> result = stager.selectImage(png("dish.png"));

    PendingAttachment staged = stager.current().orElseThrow();
    assertTrue(staged.uploading());
    assertTrue(staged.previewDataUrl().startsWith("data:image/png;base64,"));

    store.lastUpload().progress().accept(40);
    assertEquals(40, stager.current().orElseThrow().uploadProgress());

    store.lastUpload().succeed("https://cdn.test/Chat/dish.png", "Chat/dish.png");

    assertEquals(new UploadedImage("https://cdn.test/Chat/dish.png", "Chat/dish.png"), result.getNow(null));
    PendingAttachment done = stager.current().orElseThrow();
    assertFalse(done.uploading());
    assertEquals(100, done.uploadProgress());
    assertEquals(List.of(4L), metrics.observations("chat.attachment.upload.bytes"));
    assertEquals(1, metrics.count("chat.attachment.upload.ok"));
  }

  @Test
  void consumeForSendHandsOverUploadedImageOnce() {
    stager.selectImage(png("dish.png"));
    assertTrue(stager.consumeForSend().isEmpty());
    store.lastUpload().succeed("https://cdn.test/dish.png", "Chat/dish.png");

    Optional<UploadedImage> attached = stager.consumeForSend();

    assertEquals("https://cdn.test/dish.png", attached.orElseThrow().url());
    assertTrue(stager.current().isEmpty());
    assertTrue(stager.consumeForSend().isEmpty());
    assertTrue(store.deletes().isEmpty());
  }

  @Test
  void clearingUploadedImageDeletesIt() {
    stager.selectImage(png("dish.png"));
    store.lastUpload().succeed("https://cdn.test/dish.png", "Chat/dish.png");

    stager.clearImage();

    assertEquals(List.of("Chat/dish.png"), store.deletes());
    assertTrue(stager.current().isEmpty());
    assertEquals(1, metrics.count("chat.attachment.delete.ok"));
  }

  @Test
  void discardDuringUploadDeletesOnceUploadFinishes() {
    stager.selectImage(png("first.png"));
    FakeImageStore.PendingUpload first = store.lastUpload();
    stager.selectImage(png("second.png"));

    assertTrue(store.deletes().isEmpty());
    assertEquals("second.png", stager.current().orElseThrow().fileName());

    first.progress().accept(90);
    first.succeed("https://cdn.test/first.png", "Chat/first.png");

    assertEquals(List.of("Chat/first.png"), store.deletes());
    assertEquals("second.png", stager.current().orElseThrow().fileName());
    assertTrue(stager.current().orElseThrow().uploading());
    assertEquals(0, stager.current().orElseThrow().uploadProgress());
  }

  @Test
  void failedUploadClearsAttachmentAndReportsError() {
    CompletableFuture<UploadedImage> result = stager.selectImage(png("dish.png"));

    store.lastUpload().result().completeExceptionally(new IOException("connection reset"));

    assertTrue(result.isCompletedExceptionally());
    assertTrue(stager.current().isEmpty());
    assertEquals(1, listener.errors.size());
    assertInstanceOf(UploadFailedException.class, listener.errors.get(0));
    assertEquals(1, metrics.count("chat.attachment.upload.failed"));
  }

  @Test
  void failedDeleteIsReportedNotThrown() {
    store.failDeletes();
    stager.selectImage(png("dish.png"));
    store.lastUpload().succeed("https://cdn.test/dish.png", "Chat/dish.png");

    CompletableFuture<Void> cleared = stager.clearImage();

    assertTrue(cleared.isDone());
    assertFalse(cleared.isCompletedExceptionally());
    assertInstanceOf(DeleteFailedException.class, listener.errors.get(0));
    assertEquals(1, metrics.count("chat.attachment.delete.failed"));
  }

  @Test
  void imageOnlyMessageCarriesUploadedUrl() throws Exception {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.session.selectImage(png("dish.png"));
    fixture.imageStore.lastUpload().succeed("https://cdn.test/dish.png", "Chat/dish.png");

    fixture.session.send(SessionFixture.ROOM, "").get();

    SendMessageRequest request = fixture.transport.sent(SendMessageRequest.class).get(0);
    assertEquals("https://cdn.test/dish.png", request.imageUrl());
    assertEquals("", request.message());
    assertTrue(fixture.session.attachment().isEmpty());
  }

  @Test
  void shutdownDiscardsStagedImage() throws Exception {
    SessionFixture fixture = new SessionFixture().ready();
    fixture.session.selectImage(png("dish.png"));
    fixture.imageStore.lastUpload().succeed("https://cdn.test/dish.png", "Chat/dish.png");

    fixture.session.shutdown().get();

    assertEquals(List.of("Chat/dish.png"), fixture.imageStore.deletes());
  }

  private static ImageFile png(String name) {
    return new ImageFile(name, "image/png", PNG);
  }
}
