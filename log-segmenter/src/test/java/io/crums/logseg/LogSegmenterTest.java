/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 *
 */
public class LogSegmenterTest {

  final static String JAVA_APP = "java-app.log";
  final static int JAVA_APP_LINE_COUNT = 21;
  final static int JAVA_APP_ENTRY_COUNT = 6;


  final static String MIXED =
      "2026-01-03T06:29:46.882Z TRACE héllo €\r\n" +
      "  at com.foo.Bar.baz(Bar.java:10)\r\n" +
      "日本語 continuation 😀\n" +
      "2026-01-03 06:29:47 ERROR über-boom\n" +
      "{\"level\":\"warn\",\"msg\":\"ça\"}\r\n" +
      "\n" +
      "Traceback (most recent call last):\n" +
      "  File \"x.py\", line 1\n" +
      "INFO 😀😀 done";


  /** Records every callback, in order. */
  static class RecordingListener implements LogSegmenter.Listener {

    final List<Object> events = new ArrayList<>();
    final List<Progress> progress = new ArrayList<>();
    final List<LogEntry> entries = new ArrayList<>();

    @Override
    public void progress(Progress p) {
      events.add(p);
      progress.add(p);
    }
    @Override
    public void entry(LogEntry entry) {
      events.add(entry);
      entries.add(entry);
    }
    @Override
    public void completed(SegmentResult result) {
      events.add(result);
    }
    @Override
    public void failed(SegmentException error) {
      events.add(error);
    }
  }


  static ByteSource source(String text) {
    return ByteSource.of(text.getBytes(StandardCharsets.UTF_8));
  }


  static SegmentResult parse(String text) throws SegmentException {
    return new LogSegmenter().parse(source(text));
  }


  static byte[] loadResource(String resource) throws IOException {
    try (InputStream in = LogSegmenterTest.class.getResourceAsStream(resource)) {
      assertNotNull(in, resource);
      return in.readAllBytes();
    }
  }


  /** Asserts every line is covered exactly once, in order. */
  static void assertCoverage(SegmentResult result) {
    long expectedStart = 1;
    for (var entry : result.entries()) {
      assertEquals(expectedStart, entry.lineStart(), entry.toString());
      assertTrue(entry.lineStart() <= entry.lineEnd());
      assertEquals(entry.lineCount(), entry.text().split("\n", -1).length);
      expectedStart = entry.lineEnd() + 1;
    }
    assertEquals(result.stats().lines(), expectedStart - 1);
    assertEquals(result.stats().entries(), result.entries().size());
    assertTrue(result.stats().isComplete());
  }



  @Test
  public void testScenario() throws Exception {
    var result = parse(
        "2026-01-03T06:29:46.882Z TRACE hello\nworld\n2026-01-03T06:29:47.000Z ERROR boom\n");

    assertCoverage(result);
    assertEquals(3, result.stats().lines());
    assertEquals(2, result.entries().size());

    var first = result.entries().get(0);
    assertEquals(1, first.lineStart());
    assertEquals(2, first.lineEnd());
    assertEquals("2026-01-03T06:29:46.882Z TRACE hello\nworld", first.text());
    assertEquals(Optional.of(Severity.TRACE), first.severity());
    assertEquals(Optional.of("2026-01-03T06:29:46.882"), first.timestamp());

    var second = result.entries().get(1);
    assertEquals(3, second.lineStart());
    assertEquals(3, second.lineEnd());
    assertEquals(Optional.of(Severity.ERROR), second.severity());
  }


  @Test
  public void testEmpty() throws Exception {
    var result = parse("");
    assertTrue(result.entries().isEmpty());
    assertEquals(0, result.stats().lines());
    assertEquals(0, result.stats().entries());
    assertEquals(0, result.stats().totalBytes());
  }


  @Test
  public void testNullSource() throws Exception {
    var listener = new RecordingListener();
    var result = new LogSegmenter().parse(null, listener);
    assertEquals(SegmentResult.EMPTY, result);
    assertEquals(List.of(result), listener.events);
  }


  @Test
  public void testNoTrailingNewline() throws Exception {
    var result = parse("INFO a\nINFO b");
    assertCoverage(result);
    assertEquals(2, result.entries().size());
    assertEquals("INFO b", result.entries().get(1).text());
  }


  @Test
  public void testResource() throws Exception {
    byte[] bytes = loadResource(JAVA_APP);
    var result = new LogSegmenter().parse(ByteSource.of(bytes));
    assertCoverage(result);
    assertEquals(JAVA_APP_LINE_COUNT, result.stats().lines());
    assertEquals(JAVA_APP_ENTRY_COUNT, result.entries().size());
    assertEquals(bytes.length, result.stats().bytesProcessed());

    var entries = result.entries();
    // the stack trace, incl. "Caused by" and the blank line
    assertEquals(3, entries.get(2).lineStart());
    assertEquals(10, entries.get(2).lineEnd());
    assertEquals(Optional.of(Severity.ERROR), entries.get(2).severity());
    assertEquals(Optional.of("2026-01-03 06:29:47.512"), entries.get(2).timestamp());
    // indented WARN line merged
    assertEquals(11, entries.get(3).lineStart());
    assertEquals(12, entries.get(3).lineEnd());
    // single line JSON record
    assertEquals(13, entries.get(4).lineStart());
    assertEquals(13, entries.get(4).lineEnd());
    assertEquals(Optional.of("2026-01-03T06:29:49.100"), entries.get(4).timestamp());
    // pretty-printed JSON swallows the traceback after it
    assertEquals(14, entries.get(5).lineStart());
    assertEquals(21, entries.get(5).lineEnd());
    assertTrue(entries.get(5).severity().isEmpty());
  }


  @Test
  public void testChunkBoundaries() throws Exception {
    byte[] bytes = MIXED.getBytes(StandardCharsets.UTF_8);
    var expected = new LogSegmenter().parse(ByteSource.of(bytes));
    assertCoverage(expected);
    assertEquals(4, expected.entries().size());
    assertFalse(expected.entries().stream().anyMatch(e -> e.text().contains("\uFFFD")));
    assertFalse(expected.entries().stream().anyMatch(e -> e.text().contains("\r")));

    // every split position gets hit by some chunk size
    for (int chunkSize = LogsegConstants.MIN_CHUNK_SIZE; chunkSize < 64; ++chunkSize) {
      var settings = SegmenterSettings.DEFAULT.chunkSize(chunkSize).strict(true);
      var result = new LogSegmenter(settings).parse(ByteSource.of(bytes));
      assertEquals(expected.entries(), result.entries(), "chunkSize " + chunkSize);
      assertEquals(expected.stats().lines(), result.stats().lines());
    }
  }


  @Test
  public void testCrLfAtChunkBoundary() throws Exception {
    // 15 chars + "\r" puts the '\r' last in the 16-byte chunk
    String text = "INFO 0123456789\r\nINFO next\r\n";
    var settings = SegmenterSettings.DEFAULT.chunkSize(16);
    var result = new LogSegmenter(settings).parse(source(text));
    assertCoverage(result);
    assertEquals(2, result.entries().size());
    assertEquals("INFO 0123456789", result.entries().get(0).text());
    assertEquals("INFO next", result.entries().get(1).text());
  }


  @Test
  public void testIdempotent() throws Exception {
    byte[] bytes = loadResource(JAVA_APP);
    var a = new LogSegmenter().parse(ByteSource.of(bytes));
    var b = new LogSegmenter().parse(ByteSource.of(bytes));
    assertEquals(a.entries(), b.entries());
    assertEquals(a.stats().lines(), b.stats().lines());
    assertEquals(a.stats().entries(), b.stats().entries());
  }


  @Test
  public void testProgress() throws Exception {
    String text = "abcdefghi\n".repeat(10);
    var settings = SegmenterSettings.DEFAULT.chunkSize(16).progressInterval(32);
    var listener = new RecordingListener();
    var result = new LogSegmenter(settings).parse(source(text), listener);

    List<Long> reported = new ArrayList<>();
    for (var p : listener.progress) {
      reported.add(p.bytesProcessed());
      assertEquals(100, p.totalBytes());
      assertEquals(0, p.entries());   // the one entry is still open
    }
    assertEquals(List.of(32L, 64L, 96L, 100L), reported);
    assertEquals(3, listener.progress.get(0).lines());
    assertEquals(10, listener.progress.get(3).lines());
    assertEquals(1.0, listener.progress.get(3).fraction());
    assertEquals(100, listener.progress.get(3).percent());

    assertEquals(1, result.entries().size());
    assertEquals(10, result.stats().lines());
  }


  @Test
  public void testEventOrder() throws Exception {
    var listener = new RecordingListener();
    var settings = SegmenterSettings.DEFAULT.chunkSize(16).progressInterval(1);
    String text = "INFO one\nINFO two\nINFO three\n";
    var result = new LogSegmenter(settings).parse(source(text), listener);

    assertEquals(result, listener.events.get(listener.events.size() - 1));
    assertEquals(result.entries(), listener.entries);

    long lastBytes = 0;
    long lastEntries = 0;
    for (var e : listener.events) {
      if (e instanceof Progress p) {
        assertTrue(p.bytesProcessed() > lastBytes);
        assertTrue(p.entries() >= lastEntries);
        lastBytes = p.bytesProcessed();
        lastEntries = p.entries();
      }
    }
    assertEquals(text.length(), lastBytes);
  }


  @Test
  public void testNoRetainedEntries() throws Exception {
    byte[] bytes = loadResource(JAVA_APP);
    var listener = new RecordingListener();
    var settings = SegmenterSettings.DEFAULT.retainEntries(false);
    var result = new LogSegmenter(settings).parse(ByteSource.of(bytes), listener);
    assertTrue(result.entries().isEmpty());
    assertEquals(JAVA_APP_ENTRY_COUNT, result.stats().entries());
    assertEquals(JAVA_APP_ENTRY_COUNT, listener.entries.size());
  }


  @Test
  public void testBom() throws Exception {
    byte[] text = "INFO a\n".getBytes(StandardCharsets.UTF_8);
    byte[] bytes = new byte[text.length + 3];
    bytes[0] = (byte) 0xef;
    bytes[1] = (byte) 0xbb;
    bytes[2] = (byte) 0xbf;
    System.arraycopy(text, 0, bytes, 3, text.length);
    var result = new LogSegmenter().parse(ByteSource.of(bytes));
    assertEquals("INFO a", result.entries().get(0).text());
    assertEquals(bytes.length, result.stats().bytesProcessed());
  }


  @Test
  public void testMalformedLenient() throws Exception {
    byte[] bytes = { 'I', 'N', 'F', 'O', ' ', (byte) 0xff, '\n' };
    var result = new LogSegmenter().parse(ByteSource.of(bytes));
    assertEquals("INFO \uFFFD", result.entries().get(0).text());
  }


  @Test
  public void testMalformedStrict() {
    byte[] bytes = { 'I', 'N', 'F', 'O', ' ', (byte) 0xff, '\n' };
    var listener = new RecordingListener();
    var segmenter = new LogSegmenter(SegmenterSettings.DEFAULT.strict(true));
    var sx = assertThrows(
        SegmentException.class,
        () -> segmenter.parse(ByteSource.of(bytes), listener));
    assertEquals(SegmentException.Kind.DECODING, sx.kind());
    assertNotNull(sx.getMessage());
    assertEquals(List.of(sx), listener.events);
  }


  @Test
  public void testTruncatedCharStrict() {
    byte[] euro = "€".getBytes(StandardCharsets.UTF_8);
    byte[] bytes = { 'I', 'N', 'F', 'O', '\n', euro[0], euro[1] };
    var segmenter = new LogSegmenter(SegmenterSettings.DEFAULT.strict(true));
    var sx = assertThrows(
        SegmentException.class,
        () -> segmenter.parse(ByteSource.of(bytes)));
    assertEquals(SegmentException.Kind.DECODING, sx.kind());
  }


  @Test
  public void testSourceEndsEarly() {
    byte[] bytes = "INFO a\nINFO b\n".getBytes(StandardCharsets.UTF_8);
    ReadableByteChannel ch = Channels.newChannel(new java.io.ByteArrayInputStream(bytes));
    var listener = new RecordingListener();
    var sx = assertThrows(
        SegmentException.class,
        () -> new LogSegmenter().parse(ByteSource.of(ch, bytes.length + 10), listener));
    assertEquals(SegmentException.Kind.SOURCE_READ, sx.kind());
    // no partial results
    assertEquals(1, listener.events.size());
    assertEquals(sx, listener.events.get(0));
  }


  @Test
  public void testSourceFails() {
    var failing = new ByteSource() {
      int reads;
      @Override
      public long size() {
        return 1024;
      }
      @Override
      public int read(ByteBuffer dst) throws IOException {
        if (reads++ > 0)
          throw new IOException("device unplugged");
        dst.put((byte) 'x');
        return 1;
      }
      @Override
      public void close() {  }
    };
    var sx = assertThrows(
        SegmentException.class,
        () -> new LogSegmenter().parse(failing));
    assertEquals(SegmentException.Kind.SOURCE_READ, sx.kind());
    assertTrue(sx.getCause() instanceof IOException);
    assertTrue(sx.getMessage().contains("device unplugged"));
  }


  @Test
  public void testStop() {
    var settings = SegmenterSettings.DEFAULT.chunkSize(16).progressInterval(1);
    Segmentation[] segmentation = new Segmentation[1];
    var stopper = new RecordingListener() {
      @Override
      public void progress(Progress progress) {
        super.progress(progress);
        segmentation[0].stop();
      }
    };
    segmentation[0] = new LogSegmenter(settings).newSegmentation(
        source("INFO x\n".repeat(20)), stopper);
    assertFalse(segmentation[0].isStopped());

    var sx = assertThrows(SegmentException.class, segmentation[0]::run);
    assertEquals(SegmentException.Kind.STOPPED, sx.kind());
    assertTrue(segmentation[0].isStopped());
    assertEquals(1, stopper.progress.size());
    assertEquals(sx, stopper.events.get(stopper.events.size() - 1));
  }


  @Test
  public void testRunOnce() throws Exception {
    var segmentation = new LogSegmenter().newSegmentation(source("INFO a"), LogSegmenter.NOOP);
    segmentation.run();
    assertThrows(IllegalStateException.class, segmentation::run);
  }


  @Test
  public void testAsync() throws Exception {
    byte[] bytes = loadResource(JAVA_APP);
    var expected = new LogSegmenter().parse(ByteSource.of(bytes));

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      var listener = new RecordingListener();
      var settings = SegmenterSettings.DEFAULT.chunkSize(64).progressInterval(128);
      var future = new LogSegmenter(settings).parseAsync(
          ByteSource.of(bytes), listener, executor);
      var result = future.get(10, TimeUnit.SECONDS);
      assertEquals(expected.entries(), result.entries());
      assertEquals(result, listener.events.get(listener.events.size() - 1));
      assertFalse(listener.progress.isEmpty());
    } finally {
      executor.shutdownNow();
    }
  }


  @Test
  public void testAsyncFailure() throws Exception {
    byte[] bytes = { (byte) 0xff, '\n' };
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      var future = new LogSegmenter(SegmenterSettings.DEFAULT.strict(true))
          .parseAsync(ByteSource.of(bytes), LogSegmenter.NOOP, executor);
      var ex = assertThrows(
          java.util.concurrent.ExecutionException.class,
          () -> future.get(10, TimeUnit.SECONDS));
      assertTrue(ex.getCause() instanceof SegmentException);
    } finally {
      executor.shutdownNow();
    }
  }


  @Test
  public void testFileSource(@TempDir Path dir) throws Exception {
    Path log = dir.resolve(JAVA_APP);
    Files.write(log, loadResource(JAVA_APP));
    SegmentResult result;
    try (var source = ByteSource.of(log)) {
      assertEquals(Files.size(log), source.size());
      result = new LogSegmenter(SegmenterSettings.DEFAULT.chunkSize(100)).parse(source);
    }
    assertCoverage(result);
    assertEquals(JAVA_APP_ENTRY_COUNT, result.entries().size());
  }

}
