/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.Objects;

/**
 * {@linkplain ByteSource} backed by a {@linkplain ReadableByteChannel}.
 */
final class ChannelSource implements ByteSource {
  
  private final ReadableByteChannel ch;
  private final long size;
  
  
  ChannelSource(ReadableByteChannel ch, long size) {
    this.ch = Objects.requireNonNull(ch, "null channel");
    this.size = size;
    if (size < 0)
      throw new IllegalArgumentException("size " + size);
    if (!ch.isOpen())
      throw new IllegalArgumentException("channel closed: " + ch);
  }
  

  @Override
  public long size() {
    return size;
  }

  @Override
  public int read(ByteBuffer dst) throws IOException {
    return ch.read(dst);
  }

  @Override
  public void close() throws IOException {
    ch.close();
  }
  
  
  @Override
  public String toString() {
    return "ChannelSource[" + ch + ", size " + size + "]";
  }

}
