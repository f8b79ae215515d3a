/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;

import static io.crums.logseg.LogsegConstants.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Parse settings. Instances are immutable: <em>mutator methods return new
 * instances.</em>
 *
 * <h2>Properties</h2>
 * <p>
 * Settings may be loaded from a properties file. Recognized keys (all
 * optional) are
 * </p>
 * <ul>
 * <li>{@value LogsegConstants#CHUNK_SIZE_PROPERTY}</li>
 * <li>{@value LogsegConstants#PROGRESS_INTERVAL_PROPERTY}</li>
 * <li>{@value LogsegConstants#CHARSET_PROPERTY}</li>
 * <li>{@value LogsegConstants#STRICT_PROPERTY}</li>
 * <li>{@value LogsegConstants#RETAIN_ENTRIES_PROPERTY}</li>
 * </ul>
 *
 * @see #load(Properties)
 */
public final class SegmenterSettings {

  /** 256 kB chunks, 1 MB progress interval, lenient UTF-8, entries retained. */
  public final static SegmenterSettings DEFAULT = new SegmenterSettings();


  private final int chunkSize;
  private final long progressInterval;
  private final Charset charset;
  private final boolean strict;
  private final boolean retainEntries;


  private SegmenterSettings() {
    this(DEFAULT_CHUNK_SIZE, DEFAULT_PROGRESS_INTERVAL, StandardCharsets.UTF_8, false, true);
  }


  /**
   * Full constructor.
   *
   * @param chunkSize         bytes read per chunk (&ge; {@value LogsegConstants#MIN_CHUNK_SIZE})
   * @param progressInterval  minimum bytes between progress reports (&ge; 1)
   * @param charset           not {@code null}
   * @param strict            if {@code true}, malformed input fails the parse;
   *                          o.w. it's replaced with U+FFFD
   * @param retainEntries     if {@code false}, entries are only streamed to the
   *                          listener and the result's entry list is empty
   */
  public SegmenterSettings(
      int chunkSize, long progressInterval, Charset charset,
      boolean strict, boolean retainEntries) {

    this.chunkSize = chunkSize;
    this.progressInterval = progressInterval;
    this.charset = Objects.requireNonNull(charset, "null charset");
    this.strict = strict;
    this.retainEntries = retainEntries;

    if (chunkSize < MIN_CHUNK_SIZE)
      throw new IllegalArgumentException(
          "chunkSize %d < %d".formatted(chunkSize, MIN_CHUNK_SIZE));
    if (progressInterval < 1)
      throw new IllegalArgumentException("progressInterval " + progressInterval);
  }


  /**
   * Loads an instance from the given properties. Missing properties take on
   * {@linkplain #DEFAULT} values.
   *
   * @throws IllegalArgumentException if a property value is malformed
   */
  public static SegmenterSettings load(Properties props) {
    var defaults = DEFAULT;
    return new SegmenterSettings(
        (int) longProperty(props, CHUNK_SIZE_PROPERTY, defaults.chunkSize),
        longProperty(props, PROGRESS_INTERVAL_PROPERTY, defaults.progressInterval),
        charsetProperty(props, defaults.charset),
        booleanProperty(props, STRICT_PROPERTY, defaults.strict),
        booleanProperty(props, RETAIN_ENTRIES_PROPERTY, defaults.retainEntries));
  }


  /**
   * Loads an instance from the given properties file.
   *
   * @see #load(Properties)
   */
  public static SegmenterSettings load(Path file) throws IOException {
    var props = new Properties();
    try (InputStream in = Files.newInputStream(file)) {
      props.load(in);
    }
    return load(props);
  }


  private static long longProperty(Properties props, String name, long defaultValue) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return defaultValue;
    try {
      long n = Long.parseLong(value.strip());
      if (n > Integer.MAX_VALUE && name.equals(CHUNK_SIZE_PROPERTY))
        throw new IllegalArgumentException(name + " too large: " + value);
      return n;
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(
          "expected numeric value for %s: %s".formatted(name, value), nfx);
    }
  }


  private static boolean booleanProperty(Properties props, String name, boolean defaultValue) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return defaultValue;
    switch (value.strip().toLowerCase()) {
    case "true":
    case "yes":   return true;
    case "false":
    case "no":    return false;
    default:
      throw new IllegalArgumentException(
          "expected boolean value for %s: %s".formatted(name, value));
    }
  }


  private static Charset charsetProperty(Properties props, Charset defaultValue) {
    String value = props.getProperty(CHARSET_PROPERTY);
    if (value == null || value.isBlank())
      return defaultValue;
    try {
      return Charset.forName(value.strip());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException x) {
      throw new IllegalArgumentException(
          "unsupported %s: %s".formatted(CHARSET_PROPERTY, value), x);
    }
  }



  /** Returns the number of bytes read per chunk. */
  public int chunkSize() {
    return chunkSize;
  }

  /** Returns an instance with the given chunk size. */
  public SegmenterSettings chunkSize(int size) {
    return size == chunkSize ? this :
      new SegmenterSettings(size, progressInterval, charset, strict, retainEntries);
  }


  /** Returns the minimum number of bytes processed between progress reports. */
  public long progressInterval() {
    return progressInterval;
  }

  /** Returns an instance with the given progress interval. */
  public SegmenterSettings progressInterval(long bytes) {
    return bytes == progressInterval ? this :
      new SegmenterSettings(chunkSize, bytes, charset, strict, retainEntries);
  }


  public Charset charset() {
    return charset;
  }

  public SegmenterSettings charset(Charset cs) {
    return cs.equals(charset) ? this :
      new SegmenterSettings(chunkSize, progressInterval, cs, strict, retainEntries);
  }


  /** If {@code true}, malformed input fails the parse. */
  public boolean strict() {
    return strict;
  }

  public SegmenterSettings strict(boolean on) {
    return on == strict ? this :
      new SegmenterSettings(chunkSize, progressInterval, charset, on, retainEntries);
  }


  /** If {@code false}, the result's entry list is left empty. */
  public boolean retainEntries() {
    return retainEntries;
  }

  public SegmenterSettings retainEntries(boolean on) {
    return on == retainEntries ? this :
      new SegmenterSettings(chunkSize, progressInterval, charset, strict, on);
  }


  @Override
  public String toString() {
    return
        "SegmenterSettings[chunkSize=%d, progressInterval=%d, charset=%s, strict=%b, retainEntries=%b]"
        .formatted(chunkSize, progressInterval, charset, strict, retainEntries);
  }

}
