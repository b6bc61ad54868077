package com.pourrice.chat.infrastructure.imagestore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pourrice.chat.application.port.ImageStorePort;
import com.pourrice.chat.application.port.TokenProvider;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.DeleteFailedException;
import com.pourrice.chat.domain.error.UploadFailedException;
import com.pourrice.chat.logging.Logs;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.IntConsumer;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ImageStorePort} calling the PourRice image API over HTTP.
 * <p><strong>Contract:</strong> Uploads are {@code POST {base}/{uploadPath}?folder={folder}} with the multipart
 * field {@code image}; the response is {@code {success, imageUrl, fileName}}. Deletes are
 * {@code DELETE {base}/{deletePath}} with body {@code {filePath}}; any 2xx is success. Both send
 * {@code Authorization: Bearer <token>} with a freshly fetched token and, when configured, {@code x-api-passcode}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; futures complete on OkHttp dispatcher threads.</p>
 *
 * @since 0.1.0
 */
public final class OkHttpImageStoreClient implements ImageStorePort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpImageStoreClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
  private static final String PASSCODE_HEADER = "x-api-passcode";
  private static final int LOG_BODY_BYTES = 256;

  private final OkHttpClient client;
  private final ObjectMapper mapper;
  private final TokenProvider tokens;
  private final ImageStoreSettings settings;

  /**
   * Creates a client.
   *
   * @param client shared OkHttp client
   * @param mapper JSON mapper
   * @param tokens bearer token source, called per request
   * @param settings endpoint settings
   */
  public OkHttpImageStoreClient(
      OkHttpClient client, ObjectMapper mapper, TokenProvider tokens, ImageStoreSettings settings) {
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public CompletableFuture<UploadedImage> upload(ImageFile file, IntConsumer progress) {
    Objects.requireNonNull(file, "file");
    IntConsumer sink = progress == null ? percent -> {} : progress;
    HttpUrl.Builder urlBuilder = settings.baseUrl().newBuilder().addPathSegments(settings.uploadPath());
    if (!settings.folder().isEmpty()) {
      urlBuilder.addQueryParameter("folder", settings.folder());
    }
    HttpUrl url = urlBuilder.build();
    MediaType type = MediaType.parse(file.contentType());
    RequestBody content = RequestBody.create(file.content(), type != null ? type : OCTET_STREAM);
    RequestBody multipart = new MultipartBody.Builder()
        .setType(MultipartBody.FORM)
        .addFormDataPart("image", file.fileName(), content)
        .build();
    RequestBody body = new ProgressRequestBody(multipart, sink);
    return withToken(token -> call(authorized(url, token).post(body).build()))
        .handle((response, error) -> {
          if (error != null) {
            throw new CompletionException(asUploadFailure(error));
          }
          return parseUpload(response);
        });
  }

  @Override
  public CompletableFuture<Void> delete(String path) {
    Objects.requireNonNull(path, "path");
    HttpUrl url = settings.baseUrl().newBuilder().addPathSegments(settings.deletePath()).build();
    ObjectNode payload = mapper.createObjectNode().put("filePath", path);
    RequestBody body;
    try {
      body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
    } catch (JsonProcessingException ex) {
      return CompletableFuture.failedFuture(new DeleteFailedException("Could not encode delete request", ex));
    }
    return withToken(token -> call(authorized(url, token).delete(body).build()))
        .handle((response, error) -> {
          if (error != null) {
            Throwable cause = unwrap(error);
            throw new CompletionException(cause instanceof DeleteFailedException
                ? cause
                : new DeleteFailedException("Delete of " + path + " failed: " + cause.getMessage(), cause));
          }
          if (response.code() / 100 != 2) {
            throw new CompletionException(
                new DeleteFailedException("Delete of " + path + " returned HTTP " + response.code()));
          }
          log.debug("Deleted {} from image store", path);
          return null;
        });
  }

  private UploadedImage parseUpload(HttpResult response) {
    if (response.code() / 100 != 2) {
      log.warn("Image upload returned HTTP {}: {}", response.code(), Logs.truncate(response.body(), LOG_BODY_BYTES));
      throw new CompletionException(new UploadFailedException("Upload returned HTTP " + response.code()));
    }
    JsonNode json;
    try {
      json = mapper.readTree(response.body());
    } catch (JsonProcessingException ex) {
      throw new CompletionException(new UploadFailedException("Upload response is not JSON", ex));
    }
    if (json == null || !json.path("success").asBoolean(false)) {
      throw new CompletionException(new UploadFailedException("Image store reported failure"));
    }
    String imageUrl = json.path("imageUrl").asText("");
    if (imageUrl.isBlank()) {
      throw new CompletionException(new UploadFailedException("Upload response has no imageUrl"));
    }
    String fileName = json.path("fileName").asText("");
    return new UploadedImage(imageUrl, fileName.isBlank() ? imageUrl : fileName);
  }

  private Request.Builder authorized(HttpUrl url, String token) {
    Request.Builder builder = new Request.Builder()
        .url(url)
        .header("Authorization", "Bearer " + token);
    if (!settings.passcode().isBlank()) {
      builder.header(PASSCODE_HEADER, settings.passcode());
    }
    return builder;
  }

  private <T> CompletableFuture<T> withToken(Function<String, CompletableFuture<T>> action) {
    CompletableFuture<String> token;
    try {
      token = tokens.fetchToken();
    } catch (RuntimeException ex) {
      token = CompletableFuture.failedFuture(ex);
    }
    return token.thenCompose(value -> {
      if (value == null || value.isBlank()) {
        throw new CompletionException(new IOException("Auth token unavailable"));
      }
      return action.apply(value);
    });
  }

  private CompletableFuture<HttpResult> call(Request request) {
    CompletableFuture<HttpResult> result = new CompletableFuture<>();
    client.newCall(request).enqueue(new Callback() {
      @Override
      public void onFailure(Call call, IOException e) {
        result.completeExceptionally(e);
      }

      @Override
      public void onResponse(Call call, Response response) {
        try (response) {
          ResponseBody body = response.body();
          result.complete(new HttpResult(response.code(), body == null ? "" : body.string()));
        } catch (IOException ex) {
          result.completeExceptionally(ex);
        }
      }
    });
    return result;
  }

  private static UploadFailedException asUploadFailure(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof UploadFailedException failure) {
      return failure;
    }
    return new UploadFailedException("Upload failed: " + cause.getMessage(), cause);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private record HttpResult(int code, String body) {}
}
