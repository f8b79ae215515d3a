/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;

/**
 * A progress report emitted while parsing.
 * 
 * @param bytesProcessed  cumulative bytes read
 * @param totalBytes      the source's declared size
 * @param lines           cumulative physical lines seen
 * @param entries         cumulative <em>finalized</em> entries (the entry
 *                        still open is not counted)
 */
public record Progress(long bytesProcessed, long totalBytes, long lines, long entries) {
  
  public Progress {
    if (bytesProcessed < 0 || totalBytes < 0 || lines < 0 || entries < 0)
      throw new IllegalArgumentException(
          "negative argument(s): bytesProcessed %d, totalBytes %d, lines %d, entries %d"
          .formatted(bytesProcessed, totalBytes, lines, entries));
  }
  
  
  /**
   * Returns the completed fraction, clamped to [0, 1]. Empty sources
   * count as complete.
   */
  public double fraction() {
    return totalBytes == 0 ? 1.0 : Math.min(1.0, (double) bytesProcessed / totalBytes);
  }
  
  
  /** Returns the completed percentage, rounded down. */
  public int percent() {
    return (int) (fraction() * 100);
  }
  
}
