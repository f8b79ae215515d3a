/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line classification rules. Stateless; all methods are thread-safe.
 *
 * <h2>Entry Starts</h2>
 * <p>
 * A line <em>looks like</em> the start of a new log record if it contains
 * a {@linkplain #detectTimestamp(String) timestamp}, a {@linkplain
 * #detectSeverity(String) severity} token, or if it opens a JSON object.
 * </p>
 * <h2>Continuation Lines</h2>
 * <p>
 * A line looks like part of a preceding multi-line block (stack frame,
 * wrapped exception, Python traceback, indented content) if it is blank,
 * indented, or its stripped contents begin with one of {@code at },
 * {@code Caused by}, {@code Traceback}, {@code File "}.
 * </p>
 * <p>
 * The two tests are independent. The {@linkplain EntryGrouper grouper}
 * gives the continuation test precedence.
 * </p>
 */
public final class Classifier {

  // never
  private Classifier() {  }


  /**
   * Whitespace chars recognized in patterns: ASCII whitespace (less the
   * information separators), the Unicode space separators (incl. no-break
   * spaces), line and paragraph separators, and U+FEFF.
   *
   * @see #isWhitespace(char)
   */
  private final static String WS = "[\\t\\n\\x0B\\f\\r\\p{Zs}\\u2028\\u2029\\uFEFF]";

  private final static Pattern TIMESTAMP =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}(?:T|" + WS + ")\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?");

  /** Whole-word match; word chars are ASCII only. */
  private final static Pattern SEVERITY =
      Pattern.compile(
          "(?<![A-Za-z0-9_])(ERROR|WARN|WARNING|INFO|DEBUG|TRACE|FATAL)(?![A-Za-z0-9_])",
          Pattern.CASE_INSENSITIVE);

  private final static Pattern STACK_FRAME = Pattern.compile("^at" + WS);

  private final static Pattern PY_FRAME = Pattern.compile("^File" + WS + "+\"");



  /**
   * Returns the first date-time substring in the given line, if any. The
   * recognized form is {@code YYYY-MM-DD} followed by {@code 'T'} or
   * whitespace, then {@code HH:MM:SS} with an optional fractional seconds
   * suffix. Time zone designators are not captured.
   */
  public static Optional<String> detectTimestamp(String line) {
    Matcher m = TIMESTAMP.matcher(line);
    return m.find() ? Optional.of(m.group()) : Optional.empty();
  }


  /**
   * Returns the first whole-word severity token in the given line, if any
   * (case-insensitive).
   */
  public static Optional<Severity> detectSeverity(String line) {
    Matcher m = SEVERITY.matcher(line);
    return m.find() ? Severity.forToken(m.group(1)) : Optional.empty();
  }


  /** Returns {@code true} iff the first non-whitespace char is <code>'{'</code>. */
  public static boolean isJsonStart(String line) {
    final int len = line.length();
    for (int index = 0; index < len; ++index) {
      char c = line.charAt(index);
      if (!isWhitespace(c))
        return c == '{';
    }
    return false;
  }


  /**
   * Returns {@code true} if the line independently looks like the start of
   * a new record.
   */
  public static boolean isEntryStart(String line) {
    return
        TIMESTAMP.matcher(line).find() ||
        SEVERITY.matcher(line).find() ||
        isJsonStart(line);
  }


  /**
   * Returns {@code true} if the line looks like it belongs to a preceding
   * multi-line block.
   */
  public static boolean isContinuation(String line) {
    String stripped = strip(line);
    if (stripped.isEmpty())
      return true;
    return
        isWhitespace(line.charAt(0)) ||
        STACK_FRAME.matcher(stripped).find() ||
        stripped.startsWith("Caused by") ||
        stripped.startsWith("Traceback") ||
        PY_FRAME.matcher(stripped).find();
  }


  /**
   * Returns {@code true} if the given char is whitespace. Unlike
   * {@linkplain Character#isWhitespace(char)}, this includes no-break
   * spaces and U+FEFF, but not the information separators U+001C..U+001F.
   */
  public static boolean isWhitespace(char c) {
    switch (c) {
    case '\t':
    case '\n':
    case '\u000B':
    case '\f':
    case '\r':
    case '\u2028':
    case '\u2029':
    case '\uFEFF':
      return true;
    default:
      return Character.getType(c) == Character.SPACE_SEPARATOR;
    }
  }


  /**
   * Returns the given line with leading and trailing {@linkplain
   * #isWhitespace(char) whitespace} removed.
   */
  static String strip(String line) {
    int end = line.length();
    while (end > 0 && isWhitespace(line.charAt(end - 1)))
      --end;
    int start = 0;
    while (start < end && isWhitespace(line.charAt(start)))
      ++start;
    return line.substring(start, end);
  }

}
