/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import org.json.simple.JSONObject;

import io.crums.logseg.json.JsonEntityWriter;

/**
 * Aggregate statistics of a completed parse.
 * 
 * @param bytesProcessed  bytes read (equal to {@code totalBytes} on success)
 * @param totalBytes      the source's declared size
 * @param lines           number of physical lines
 * @param entries         number of {@linkplain LogEntry entries}
 * @param durationMs      wall-clock duration in milliseconds
 * 
 * @see #WRITER
 */
public record ParsingStats(
    long bytesProcessed, long totalBytes, long lines, long entries, long durationMs) {
  
  /** JSON writer. */
  public final static JsonEntityWriter<ParsingStats> WRITER = new Writer();
  
  /** Stats for empty input. */
  public final static ParsingStats EMPTY = new ParsingStats(0, 0, 0, 0, 0);
  
  
  public ParsingStats {
    if (bytesProcessed < 0 || totalBytes < 0 || lines < 0 || entries < 0 || durationMs < 0)
      throw new IllegalArgumentException(
          "negative argument(s): bytesProcessed %d, totalBytes %d, lines %d, entries %d, durationMs %d"
          .formatted(bytesProcessed, totalBytes, lines, entries, durationMs));
    if (entries > lines)
      throw new IllegalArgumentException(
          "entries (%d) > lines (%d)".formatted(entries, lines));
  }
  
  
  /** Returns {@code true} iff all declared bytes were processed. */
  public boolean isComplete() {
    return bytesProcessed == totalBytes;
  }
  
  
  
  public static class Writer implements JsonEntityWriter<ParsingStats> {
    
    public final static String BYTES_PROCESSED = "bytesProcessed";
    public final static String TOTAL_BYTES = "totalBytes";
    public final static String LINES = "lines";
    public final static String ENTRIES = "entries";
    public final static String DURATION_MS = "durationMs";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(ParsingStats stats, JSONObject jObj) {
      jObj.put(BYTES_PROCESSED, stats.bytesProcessed());
      jObj.put(TOTAL_BYTES, stats.totalBytes());
      jObj.put(LINES, stats.lines());
      jObj.put(ENTRIES, stats.entries());
      jObj.put(DURATION_MS, stats.durationMs());
      return jObj;
    }
  }

}
