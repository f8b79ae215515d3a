/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import static io.crums.logseg.LogsegConstants.sysLogger;

import java.io.IOException;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import io.crums.logseg.SegmentException.Kind;

/**
 * A single parse invocation and its state: the decoder, the partial-line
 * buffer, the open entry, and the counters. Instances run exactly once.
 *
 * <h2>Threading</h2>
 * <p>
 * The parse itself is sequential. It may be run on another thread
 * ({@linkplain #runAsync(Executor)}), in which case listener callbacks are
 * invoked on that thread, in the order they're produced. The only method
 * designed to be invoked from another thread is {@linkplain #stop()}.
 * </p>
 *
 * @see LogSegmenter#newSegmentation(ByteSource, LogSegmenter.Listener)
 */
public class Segmentation {

  private final SegmenterSettings settings;
  private final LogSegmenter.Listener listener;

  private ByteSource source;
  private boolean started;
  private volatile boolean stop;


  Segmentation(
      SegmenterSettings settings, ByteSource source, LogSegmenter.Listener listener) {
    this.settings = Objects.requireNonNull(settings, "null settings");
    this.listener = Objects.requireNonNull(listener, "null listener");
    this.source = source;
  }


  /**
   * Signals the parse to stop. Stopping is cooperative: it takes effect
   * between chunks, and the parse then fails with {@linkplain Kind#STOPPED}.
   */
  public void stop() {
    stop = true;
  }


  /** Returns {@code true} if {@linkplain #stop()} was invoked. */
  public boolean isStopped() {
    return stop;
  }


  /**
   * Runs the parse on the given executor.
   *
   * @return a future completed with the result, or completed exceptionally
   *         with a {@linkplain SegmentException} (or an unchecked exception
   *         thrown by the listener)
   */
  public CompletableFuture<SegmentResult> runAsync(Executor executor) {
    var future = new CompletableFuture<SegmentResult>();
    executor.execute(() -> {
      try {
        future.complete(run());
      } catch (SegmentException | RuntimeException x) {
        future.completeExceptionally(x);
      }
    });
    return future;
  }


  /**
   * Runs the parse on the invoking thread. The terminal outcome is both
   * reported to the listener and returned (or thrown).
   *
   * @throws IllegalStateException if already run
   */
  public synchronized SegmentResult run() throws SegmentException {
    if (started)
      throw new IllegalStateException("already run");
    started = true;

    try {
      SegmentResult result;
      if (source == null || source.size() == 0) {
        sysLogger().log(Level.DEBUG, "empty source");
        result = SegmentResult.EMPTY;
      } else
        result = parse(source);

      listener.completed(result);
      return result;

    } catch (SegmentException sx) {
      sysLogger().log(Level.WARNING, "parse aborted (" + sx.kind() + "): " + sx.getMessage());
      listener.failed(sx);
      throw sx;

    } finally {
      source = null;
    }
  }



  private SegmentResult parse(ByteSource source) throws SegmentException {

    final long startNanos = System.nanoTime();
    final long totalBytes = source.size();
    final int chunkSize = settings.chunkSize();

    sysLogger().log(Level.DEBUG,
        "parsing %d bytes in %d-byte chunks (%s)".formatted(
            totalBytes, chunkSize, settings.charset()));

    List<LogEntry> entries = new ArrayList<>();
    var grouper = new EntryGrouper(
        settings.retainEntries() ?
            (e) -> { entries.add(e); listener.entry(e); } :
              listener::entry);
    var splitter = new LineSplitter();
    var decoder = new ChunkDecoder(settings.charset(), settings.strict());

    // room for a partial multi-byte char carried over
    ByteBuffer buffer = ByteBuffer.allocate(chunkSize + 16);

    long bytesProcessed = 0;
    long lastProgressAt = 0;

    while (bytesProcessed < totalBytes) {

      if (stop)
        throw new SegmentException(
            Kind.STOPPED, "stopped at byte offset " + bytesProcessed);

      int len = (int) Math.min(chunkSize, totalBytes - bytesProcessed);
      int read = readChunk(source, buffer, len, bytesProcessed, totalBytes);

      buffer.flip();
      String text;
      try {
        text = decoder.decode(buffer);
      } catch (CharacterCodingException ccx) {
        throw decodingError(ccx, bytesProcessed + buffer.position());
      }
      buffer.compact();

      splitter.split(text, grouper::accept);
      bytesProcessed += read;

      if (bytesProcessed - lastProgressAt >= settings.progressInterval() ||
          bytesProcessed >= totalBytes) {
        lastProgressAt = bytesProcessed;
        var progress = new Progress(
            bytesProcessed, totalBytes, grouper.lineNo(), grouper.entryCount());
        sysLogger().log(Level.TRACE, progress::toString);
        listener.progress(progress);
      }
    }

    buffer.flip();
    try {
      splitter.split(decoder.finish(buffer), grouper::accept);
    } catch (CharacterCodingException ccx) {
      throw decodingError(ccx, bytesProcessed - buffer.remaining());
    }
    splitter.finish(grouper::accept);
    grouper.finish();

    long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
    var stats = new ParsingStats(
        bytesProcessed, totalBytes, grouper.lineNo(), grouper.entryCount(), durationMs);

    sysLogger().log(Level.DEBUG, () -> "parse completed: " + stats);

    return new SegmentResult(entries, stats);
  }


  /**
   * Reads exactly {@code len} bytes into the buffer (after any bytes
   * carried over).
   *
   * @return {@code len}
   */
  private int readChunk(
      ByteSource source, ByteBuffer buffer, int len, long offset, long totalBytes)
          throws SegmentException {

    buffer.limit(buffer.position() + len);
    int total = 0;
    try {
      while (buffer.hasRemaining()) {
        int n = source.read(buffer);
        if (n == -1)
          throw new SegmentException(
              Kind.SOURCE_READ,
              "source ended at byte offset %d; expected %d bytes".formatted(
                  offset + total, totalBytes));
        total += n;
      }
    } catch (SegmentException sx) {
      throw sx;
    } catch (IOException iox) {
      throw new SegmentException(
          Kind.SOURCE_READ,
          "read failed at byte offset %d: %s".formatted(offset + total, iox.getMessage()),
          iox);
    }
    return total;
  }


  private SegmentException decodingError(CharacterCodingException ccx, long offset) {
    return new SegmentException(
        Kind.DECODING,
        "cannot decode %s text near byte offset %d: %s".formatted(
            settings.charset(), offset, ccx.toString()),
        ccx);
  }

}
