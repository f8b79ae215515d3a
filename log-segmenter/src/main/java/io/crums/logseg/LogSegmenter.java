/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Streaming log segmenter. Reads a {@linkplain ByteSource} in bounded
 * chunks, reconstructs logical {@linkplain LogEntry entries} (which may span
 * multiple lines, e.g. stack traces), and classifies each by severity and
 * timestamp. The whole source is never held in memory at once (though the
 * entries are, unless {@linkplain SegmenterSettings#retainEntries()
 * retention} is turned off).
 *
 * <h2>Notification</h2>
 * <p>
 * Progress, entries, and the terminal outcome are reported thru a
 * {@linkplain Listener}, in the order they are produced. Exactly one of
 * {@linkplain Listener#completed(SegmentResult) completed} or
 * {@linkplain Listener#failed(SegmentException) failed} is invoked per parse.
 * </p>
 * <h2>Empty Sources</h2>
 * <p>
 * A {@code null} source, or one with zero size, is not an error: it
 * parses to {@linkplain SegmentResult#EMPTY}.
 * </p>
 * <p>
 * Instances are stateless (beyond their settings) and may be shared across
 * threads. Parse state lives in a per-invocation {@linkplain Segmentation}.
 * </p>
 */
public class LogSegmenter {

  /**
   * Parse callbacks. All methods default to noops.
   */
  public interface Listener {

    /**
     * Invoked after a chunk, if at least the {@linkplain
     * SegmenterSettings#progressInterval() progress interval} bytes were
     * processed since the last report, or if it was the last chunk.
     */
    default void progress(Progress progress) {  }

    /** Invoked for every finalized entry, in line order. */
    default void entry(LogEntry entry) {  }

    /** Invoked on successful completion. Last call of the run. */
    default void completed(SegmentResult result) {  }

    /** Invoked on failure. Last call of the run. */
    default void failed(SegmentException error) {  }
  }


  /** Listener that ignores everything. */
  public final static Listener NOOP = new Listener() {  };



  private final SegmenterSettings settings;


  /** Creates an instance with {@linkplain SegmenterSettings#DEFAULT default} settings. */
  public LogSegmenter() {
    this(SegmenterSettings.DEFAULT);
  }


  public LogSegmenter(SegmenterSettings settings) {
    this.settings = Objects.requireNonNull(settings, "null settings");
  }


  public SegmenterSettings settings() {
    return settings;
  }


  /**
   * Parses the given source on the invoking thread. The source is not closed.
   *
   * @param source    may be {@code null} (parses as empty)
   */
  public SegmentResult parse(ByteSource source) throws SegmentException {
    return parse(source, NOOP);
  }


  /**
   * Parses the given source on the invoking thread, reporting to the given
   * listener. The source is not closed.
   *
   * @param source    may be {@code null} (parses as empty)
   * @param listener  not {@code null}
   */
  public SegmentResult parse(ByteSource source, Listener listener)
      throws SegmentException {
    return newSegmentation(source, listener).run();
  }


  /**
   * Parses the given source on the given executor. The source is not closed.
   *
   * @see Segmentation#runAsync(Executor)
   */
  public CompletableFuture<SegmentResult> parseAsync(
      ByteSource source, Listener listener, Executor executor) {
    return newSegmentation(source, listener).runAsync(executor);
  }


  /**
   * Returns a new, not-yet-run parse of the given source. Use this to
   * be able to {@linkplain Segmentation#stop() stop} the parse.
   *
   * @param source    may be {@code null} (parses as empty)
   * @param listener  not {@code null}
   */
  public Segmentation newSegmentation(ByteSource source, Listener listener) {
    return new Segmentation(settings, source, listener);
  }

}
