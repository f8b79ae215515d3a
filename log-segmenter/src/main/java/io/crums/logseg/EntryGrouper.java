/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Groups physical lines into logical {@linkplain LogEntry entries}.
 * 
 * <h2>State Machine</h2>
 * <p>
 * There are 2 states: <em>no current entry</em> and <em>in entry</em>
 * (a start line no. and the lines accumulated so far). For each line
 * {@linkplain #accept(String) accept}ed, the line no. is first incremented;
 * then,
 * </p>
 * <ul>
 * <li>if there is no current entry, a new one begins at this line (whatever
 * the line looks like);</li>
 * <li>otherwise, if the line {@linkplain Classifier#isEntryStart(String)
 * looks like an entry start} and is <em>not</em> a {@linkplain
 * Classifier#isContinuation(String) continuation} line, the current entry
 * is finalized and a new one begins at this line;</li>
 * <li>otherwise, the line is appended to the current entry.</li>
 * </ul>
 * <p>
 * So ambiguous lines are merged rather than split. {@linkplain #finish()}
 * finalizes the open entry, if any.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public class EntryGrouper {
  
  private final Consumer<LogEntry> sink;
  
  private final List<String> lines = new ArrayList<>();
  private long startLine;
  
  private long lineNo;
  private long entryCount;
  
  
  /**
   * @param sink    receives each finalized entry, in order
   */
  public EntryGrouper(Consumer<LogEntry> sink) {
    this.sink = Objects.requireNonNull(sink, "null sink");
  }
  
  
  /**
   * Feeds the next physical line.
   * 
   * @param line    without line terminator
   */
  public void accept(String line) {
    ++lineNo;
    
    if (!inEntry()) {
      begin(line);
      return;
    }
    
    if (Classifier.isEntryStart(line) && !Classifier.isContinuation(line)) {
      finalizeEntry();
      begin(line);
    } else
      lines.add(line);
  }
  
  
  /** Finalizes the open entry, if any. */
  public void finish() {
    if (inEntry())
      finalizeEntry();
  }
  
  
  /** Returns {@code true} iff an entry is open (not yet finalized). */
  public boolean inEntry() {
    return !lines.isEmpty();
  }
  
  
  /** Returns the number of lines accepted so far. */
  public long lineNo() {
    return lineNo;
  }
  
  
  /** Returns the number of entries finalized so far. */
  public long entryCount() {
    return entryCount;
  }
  
  
  private void begin(String line) {
    startLine = lineNo;
    lines.add(line);
  }
  
  
  private void finalizeEntry() {
    var entry = LogEntry.fromLines(startLine, lines);
    lines.clear();
    ++entryCount;
    sink.accept(entry);
  }

}
