/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.json.simple.JSONObject;

import io.crums.logseg.json.JsonEntityWriter;

/**
 * A logical log record, spanning one or more physical lines. Instances
 * are immutable.
 *
 * @see #WRITER
 */
public final class LogEntry {

  /** JSON writer. */
  public final static JsonEntityWriter<LogEntry> WRITER = new Writer();


  private final long lineStart;
  private final long lineEnd;
  private final String text;
  private final Severity severity;
  private final String timestamp;


  /**
   * Full constructor.
   *
   * @param lineStart   1-based, inclusive
   * @param lineEnd     1-based, inclusive; &ge; {@code lineStart}
   * @param text        the lines joined by {@code '\n'}; must contain exactly
   *                    {@code lineEnd - lineStart} newline chars
   *
   * @throws IllegalArgumentException if the line range is out of bounds, or
   *         does not match the number of lines in {@code text}
   * @param severity    optional (may be {@code null})
   * @param timestamp   optional (may be {@code null})
   */
  public LogEntry(
      long lineStart, long lineEnd, String text,
      Severity severity, String timestamp) {

    this.lineStart = lineStart;
    this.lineEnd = lineEnd;
    this.text = Objects.requireNonNull(text, "null text");
    this.severity = severity;
    this.timestamp = timestamp;

    if (lineStart < 1)
      throw new IllegalArgumentException("lineStart " + lineStart);
    if (lineEnd < lineStart)
      throw new IllegalArgumentException(
          "lineEnd (%d) < lineStart (%d)".formatted(lineEnd, lineStart));
    long newlines = text.chars().filter(c -> c == '\n').count();
    if (newlines != lineEnd - lineStart)
      throw new IllegalArgumentException(
          "text has %d newline(s); expected %d for lines [%d, %d]".formatted(
              newlines, lineEnd - lineStart, lineStart, lineEnd));
  }


  /**
   * Creates an entry from its constituent lines. Severity and timestamp
   * are detected from the <em>first</em> line only.
   *
   * @param lineStart   the first line's 1-based number
   * @param lines       not empty; no element contains {@code '\n'}
   */
  public static LogEntry fromLines(long lineStart, List<String> lines) {
    if (lines.isEmpty())
      throw new IllegalArgumentException("empty lines");
    String first = lines.get(0);
    return new LogEntry(
        lineStart,
        lineStart + lines.size() - 1,
        String.join("\n", lines),
        Classifier.detectSeverity(first).orElse(null),
        Classifier.detectTimestamp(first).orElse(null));
  }


  /** Returns the 1-based first line no. */
  public long lineStart() {
    return lineStart;
  }

  /** Returns the 1-based last line no. (inclusive). */
  public long lineEnd() {
    return lineEnd;
  }

  /** Returns the number of physical lines. */
  public long lineCount() {
    return lineEnd - lineStart + 1;
  }

  public boolean isMultiLine() {
    return lineEnd > lineStart;
  }

  /** Returns the text (lines joined by {@code '\n'}). */
  public String text() {
    return text;
  }

  /** Returns the severity token found in the first line, if any. */
  public Optional<Severity> severity() {
    return Optional.ofNullable(severity);
  }

  /** Returns the timestamp substring found in the first line, if any. */
  public Optional<String> timestamp() {
    return Optional.ofNullable(timestamp);
  }

  /** Returns the first line. */
  public String firstLine() {
    int nl = text.indexOf('\n');
    return nl == -1 ? text : text.substring(0, nl);
  }


  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof LogEntry e &&
        e.lineStart == lineStart &&
        e.lineEnd == lineEnd &&
        e.severity == severity &&
        e.text.equals(text) &&
        Objects.equals(e.timestamp, timestamp);
  }


  @Override
  public int hashCode() {
    return Long.hashCode(lineStart) * 31 + text.hashCode();
  }


  @Override
  public String toString() {
    return "LogEntry[%d-%d %s %s: %s]".formatted(
        lineStart, lineEnd,
        severity == null ? "-" : severity,
        timestamp == null ? "-" : timestamp,
        firstLine());
  }



  /**
   * JSON writer. Optional fields are omitted when absent.
   */
  public static class Writer implements JsonEntityWriter<LogEntry> {

    public final static String LINE_START = "lineStart";
    public final static String LINE_END = "lineEnd";
    public final static String TEXT = "text";
    public final static String SEVERITY = "severity";
    public final static String TIMESTAMP = "timestamp";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(LogEntry entry, JSONObject jObj) {
      jObj.put(LINE_START, entry.lineStart());
      jObj.put(LINE_END, entry.lineEnd());
      jObj.put(TEXT, entry.text());
      JsonEntityWriter.addIfPresent(
          jObj, SEVERITY, entry.severity().map(Severity::name).orElse(null));
      JsonEntityWriter.addIfPresent(
          jObj, TIMESTAMP, entry.timestamp().orElse(null));
      return jObj;
    }
  }

}
