package com.pourrice.chat.infrastructure.imagestore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.DeleteFailedException;
import com.pourrice.chat.domain.error.UploadFailedException;
import com.pourrice.chat.infrastructure.auth.StaticTokenProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OkHttpImageStoreClientTest {
  private static final ImageStoreSettings SETTINGS =
      ImageStoreSettings.of("https://api.test/", "/API/Images/upload", "API/Images/delete", "Chat", "pass-1");
  private static final ImageFile DISH = new ImageFile("dish.png", "image/png", new byte[] {1, 2, 3, 4});

  private final List<OkHttpClient> clients = new ArrayList<>();

  @AfterEach
  void tearDown() {
    clients.forEach(client -> client.dispatcher().executorService().shutdown());
  }

  @Test
  void uploadPostsMultipartWithAuthHeaders() throws Exception {
    CannedServer server = new CannedServer(200, "{\"success\":true,\"imageUrl\":\"https://cdn.test/Chat/x.png\","
        + "\"fileName\":\"Chat/x.png\"}");
    List<Integer> progress = new CopyOnWriteArrayList<>();

    UploadedImage image = client(server, "tok-1").upload(DISH, progress::add).get(5, TimeUnit.SECONDS);

    assertEquals(new UploadedImage("https://cdn.test/Chat/x.png", "Chat/x.png"), image);
    CapturedRequest request = server.requests.get(0);
    assertEquals("POST", request.method());
    assertEquals("https://api.test/API/Images/upload?folder=Chat", request.url());
    assertEquals("Bearer tok-1", request.authorization());
    assertEquals("pass-1", request.passcode());
    assertTrue(request.body().contains("name=\"image\"; filename=\"dish.png\""));
    assertEquals(Integer.valueOf(100), progress.get(progress.size() - 1));
  }

  @Test
  void uploadWithoutFileNameUsesUrlAsPath() throws Exception {
    CannedServer server = new CannedServer(200, "{\"success\":true,\"imageUrl\":\"https://cdn.test/x.png\"}");

    UploadedImage image = client(server, "tok-1").upload(DISH, null).get(5, TimeUnit.SECONDS);

    assertEquals("https://cdn.test/x.png", image.path());
  }

  @Test
  void uploadFailuresSurfaceAsUploadFailed() {
    CannedServer rejected = new CannedServer(500, "oops");
    CannedServer unsuccessful = new CannedServer(200, "{\"success\":false}");
    CannedServer notJson = new CannedServer(200, "<html>");

    for (CannedServer server : List.of(rejected, unsuccessful, notJson)) {
      ExecutionException error = assertThrows(ExecutionException.class,
          () -> client(server, "tok-1").upload(DISH, null).get(5, TimeUnit.SECONDS));
      assertInstanceOf(UploadFailedException.class, error.getCause());
    }
  }

  @Test
  void missingTokenFailsBeforeAnyRequest() {
    CannedServer server = new CannedServer(200, "{}");

    ExecutionException error = assertThrows(ExecutionException.class,
        () -> client(server, "").upload(DISH, null).get(5, TimeUnit.SECONDS));

    assertInstanceOf(UploadFailedException.class, error.getCause());
    assertTrue(server.requests.isEmpty());
  }

  @Test
  void deleteSendsFilePathBody() throws Exception {
    CannedServer server = new CannedServer(204, "");

    assertNull(client(server, "tok-2").delete("Chat/x.png").get(5, TimeUnit.SECONDS));

    CapturedRequest request = server.requests.get(0);
    assertEquals("DELETE", request.method());
    assertEquals("https://api.test/API/Images/delete", request.url());
    assertEquals("Bearer tok-2", request.authorization());
    assertEquals("{\"filePath\":\"Chat/x.png\"}", request.body());
  }

  @Test
  void deleteNon2xxSurfacesAsDeleteFailed() {
    CannedServer server = new CannedServer(404, "missing");

    ExecutionException error = assertThrows(ExecutionException.class,
        () -> client(server, "tok-2").delete("Chat/x.png").get(5, TimeUnit.SECONDS));

    assertInstanceOf(DeleteFailedException.class, error.getCause());
  }

  private OkHttpImageStoreClient client(CannedServer server, String token) {
    OkHttpClient client = new OkHttpClient.Builder().addInterceptor(server).build();
    clients.add(client);
    return new OkHttpImageStoreClient(client, new ObjectMapper(), new StaticTokenProvider(token), SETTINGS);
  }

  private record CapturedRequest(String method, String url, String authorization, String passcode, String body) {}

  /** Answers every call with a fixed response without touching the network. */
  private static final class CannedServer implements Interceptor {
    private final int code;
    private final String body;
    private final List<CapturedRequest> requests = new CopyOnWriteArrayList<>();

    CannedServer(int code, String body) {
      this.code = code;
      this.body = body;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
      Request request = chain.request();
      Buffer buffer = new Buffer();
      if (request.body() != null) {
        request.body().writeTo(buffer);
      }
      requests.add(new CapturedRequest(
          request.method(),
          request.url().toString(),
          request.header("Authorization"),
          request.header("x-api-passcode"),
          buffer.readString(StandardCharsets.UTF_8)));
      return new Response.Builder()
          .request(request)
          .protocol(Protocol.HTTP_1_1)
          .code(code)
          .message("canned")
          .body(ResponseBody.create(body, MediaType.get("application/json")))
          .build();
    }
  }
}
