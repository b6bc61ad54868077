package com.pourrice.chat.infrastructure.imagestore;

import java.io.IOException;
import java.util.Objects;
import java.util.function.IntConsumer;
import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.Buffer;
import okio.BufferedSink;
import okio.ForwardingSink;
import okio.Okio;
import okio.Sink;

/**
 * Request body wrapper reporting write progress in whole percent.
 *
 * <p>Each percentage is reported at most once per write of the body; retries restart from zero.</p>
 *
 * @since 0.1.0
 */
final class ProgressRequestBody extends RequestBody {
  private final RequestBody delegate;
  private final IntConsumer progress;

  ProgressRequestBody(RequestBody delegate, IntConsumer progress) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  @Override
  public MediaType contentType() {
    return delegate.contentType();
  }

  @Override
  public long contentLength() throws IOException {
    return delegate.contentLength();
  }

  @Override
  public void writeTo(BufferedSink sink) throws IOException {
    long total = contentLength();
    CountingSink counting = new CountingSink(sink, total);
    BufferedSink buffered = Okio.buffer(counting);
    delegate.writeTo(buffered);
    buffered.flush();
  }

  private final class CountingSink extends ForwardingSink {
    private final long total;
    private long written;
    private int lastPercent = -1;

    CountingSink(Sink delegate, long total) {
      super(delegate);
      this.total = total;
    }

    @Override
    public void write(Buffer source, long byteCount) throws IOException {
      super.write(source, byteCount);
      written += byteCount;
      if (total <= 0) {
        return;
      }
      int percent = (int) Math.min(100, written * 100 / total);
      if (percent != lastPercent) {
        lastPercent = percent;
        progress.accept(percent);
      }
    }
  }
}
