/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.util.function.Consumer;

/**
 * Splits decoded text into lines, carrying the trailing incomplete line
 * over to the next chunk. Lines are terminated by {@code "\n"} or
 * {@code "\r\n"}; terminators are not included in the emitted lines.
 * A lone {@code '\r'} is not a terminator.
 */
final class LineSplitter {
  
  private final StringBuilder carry = new StringBuilder();
  
  
  /**
   * Appends the given text to any carried-over fragment and emits every
   * complete line in order. The new trailing fragment (possibly empty) is
   * retained.
   * 
   * @param text    the decoded text of the next chunk
   * @param sink    line consumer
   */
  void split(CharSequence text, Consumer<String> sink) {
    // the carry never contains '\n'
    int index = carry.length();
    carry.append(text);
    final int len = carry.length();
    int start = 0;
    for (; index < len; ++index) {
      if (carry.charAt(index) != '\n')
        continue;
      int end = index;
      if (end > start && carry.charAt(end - 1) == '\r')
        --end;
      sink.accept(carry.substring(start, end));
      start = index + 1;
    }
    carry.delete(0, start);
  }
  
  
  /**
   * Emits the carried-over fragment, if not empty, as the final line.
   */
  void finish(Consumer<String> sink) {
    if (carry.length() > 0) {
      sink.accept(carry.toString());
      carry.setLength(0);
    }
  }
  
  
  /** Returns the length of the carried-over fragment. */
  int fragmentLength() {
    return carry.length();
  }

}
