/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.lang.System.Logger;

/**
 * Engine-wide constants and defaults.
 */
public class LogsegConstants {

  // never
  private LogsegConstants() {  }


  /** System logger name. */
  public final static String LOG_NAME = "io.crums.logseg";


  public static Logger sysLogger() {
    return System.getLogger(LOG_NAME);
  }


  /** Default number of bytes read per chunk: 256 kB. */
  public final static int DEFAULT_CHUNK_SIZE = 256 * 1024;

  /** Smallest chunk size allowed. (Must fit any single encoded char.) */
  public final static int MIN_CHUNK_SIZE = 16;

  /** Default minimum number of bytes between progress reports: 1 MB. */
  public final static long DEFAULT_PROGRESS_INTERVAL = 1024 * 1024;


  /** Properties key for {@linkplain SegmenterSettings#chunkSize()}. */
  public final static String CHUNK_SIZE_PROPERTY = "logseg.chunk.size";
  /** Properties key for {@linkplain SegmenterSettings#progressInterval()}. */
  public final static String PROGRESS_INTERVAL_PROPERTY = "logseg.progress.interval";
  /** Properties key for {@linkplain SegmenterSettings#charset()}. */
  public final static String CHARSET_PROPERTY = "logseg.charset";
  /** Properties key for {@linkplain SegmenterSettings#strict()}. */
  public final static String STRICT_PROPERTY = "logseg.strict";
  /** Properties key for {@linkplain SegmenterSettings#retainEntries()}. */
  public final static String RETAIN_ENTRIES_PROPERTY = "logseg.retain.entries";

}
