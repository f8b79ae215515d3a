/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.List;
import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.logseg.json.JsonEntityWriter;

/**
 * The success payload of a parse: the ordered entries and final statistics.
 * If entries were not {@linkplain SegmenterSettings#retainEntries() retained},
 * then the list is empty (but {@code stats().entries()} still counts them).
 * 
 * @param entries   read-only, in line order
 * @param stats     final statistics
 * 
 * @see #WRITER
 */
public record SegmentResult(List<LogEntry> entries, ParsingStats stats) {
  
  /** JSON writer. */
  public final static JsonEntityWriter<SegmentResult> WRITER = new Writer();
  
  /** The result of parsing an empty (or absent) source. */
  public final static SegmentResult EMPTY = new SegmentResult(List.of(), ParsingStats.EMPTY);
  
  
  public SegmentResult {
    entries = List.copyOf(entries);
    Objects.requireNonNull(stats, "null stats");
    if (entries.size() > stats.entries())
      throw new IllegalArgumentException(
          "entry count (%d) > stats.entries (%d)".formatted(entries.size(), stats.entries()));
  }
  
  
  /**
   * Returns a copy of this instance with the given entries (typically a
   * filtered subset) but with the same statistics.
   */
  public SegmentResult withEntries(List<LogEntry> subset) {
    return new SegmentResult(subset, stats);
  }
  
  
  public static class Writer implements JsonEntityWriter<SegmentResult> {
    
    public final static String ENTRIES = "entries";
    public final static String STATS = "stats";

    @SuppressWarnings("unchecked")
    @Override
    public JSONObject injectEntity(SegmentResult result, JSONObject jObj) {
      jObj.put(ENTRIES, LogEntry.WRITER.toJsonArray(result.entries()));
      jObj.put(STATS, ParsingStats.WRITER.toJsonObject(result.stats()));
      return jObj;
    }
  }

}
