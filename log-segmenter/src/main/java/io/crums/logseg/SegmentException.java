/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.io.IOException;
import java.util.Objects;

/**
 * The terminal error of a failed parse. No partial results accompany
 * an instance: the work done before the failure is discarded.
 */
@SuppressWarnings("serial")
public class SegmentException extends IOException {

  /** Failure categories. */
  public enum Kind {
    /** The bytes cannot be interpreted as text in the configured charset. */
    DECODING,
    /** The byte source failed, or ended before its declared size. */
    SOURCE_READ,
    /** Parsing was {@linkplain Segmentation#stop() stopped} between chunks. */
    STOPPED;
  }


  private final Kind kind;


  public SegmentException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "null kind");
  }

  public SegmentException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "null kind");
  }


  /** Returns the failure category. */
  public Kind kind() {
    return kind;
  }

}
