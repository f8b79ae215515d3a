/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg.cli;


import java.util.Locale;

/**
 * Text formatting helpers for console output.
 */
class Texts {
  
  // never
  private Texts() {  }
  
  
  private final static String[] UNITS = { "B", "KB", "MB", "GB", "TB" };
  
  /**
   * Returns a human-readable byte size, e.g. "1.5 MB". Units are powers
   * of 1024.
   */
  static String formatBytes(long bytes) {
    if (bytes < 1024)
      return bytes + " B";
    double value = bytes;
    int unit = 0;
    while (value >= 1024 && unit < UNITS.length - 1) {
      value /= 1024;
      ++unit;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
  }
  
  
  /** Returns e.g. "1 line", "2 lines". */
  static String nOf(long count, String singular) {
    return nOf(count, singular, singular + "s");
  }
  
  
  /** Returns e.g. "1 entry", "2 entries". */
  static String nOf(long count, String singular, String plural) {
    return count + " " + (count == 1 ? singular : plural);
  }

}
