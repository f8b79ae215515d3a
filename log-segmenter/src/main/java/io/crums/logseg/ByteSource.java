/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A sequentially readable byte source of known size. Only forward reads
 * are required: no seeking.
 * 
 * @see #of(Path)
 * @see #of(byte[])
 * @see #of(ReadableByteChannel, long)
 */
public interface ByteSource extends Closeable {
  
  /**
   * Returns the total number of bytes this source is expected to yield.
   * 
   * @return &ge; 0
   */
  long size();
  
  /**
   * Reads the next bytes into the given buffer (as {@linkplain
   * ReadableByteChannel#read(ByteBuffer)} does).
   * 
   * @return the number of bytes read, or -1 on end-of-stream
   */
  int read(ByteBuffer dst) throws IOException;
  
  
  /**
   * Returns a source reading the given file from the beginning. The file's
   * size is taken when this method is invoked.
   */
  static ByteSource of(Path file) throws IOException {
    FileChannel ch = FileChannel.open(file, StandardOpenOption.READ);
    try {
      return new ChannelSource(ch, ch.size());
    } catch (RuntimeException | IOException x) {
      ch.close();
      throw x;
    }
  }
  
  
  /** Returns a source reading the given bytes. */
  static ByteSource of(byte[] bytes) {
    return new ChannelSource(
        Channels.newChannel(new ByteArrayInputStream(bytes)), bytes.length);
  }
  
  
  /**
   * Returns a source reading the given channel from its current position.
   * 
   * @param ch      open channel
   * @param size    the number of bytes expected (&ge; 0)
   */
  static ByteSource of(ReadableByteChannel ch, long size) {
    return new ChannelSource(ch, size);
  }

}
