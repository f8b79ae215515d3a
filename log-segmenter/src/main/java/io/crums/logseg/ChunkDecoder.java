/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.logseg;


import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;

/**
 * Stateful, incremental decoder. A multi-byte character split across
 * chunks is left unconsumed in the input buffer; the caller is expected to
 * {@linkplain ByteBuffer#compact() compact} the buffer and append the next
 * chunk's bytes after it. A leading byte-order mark is dropped.
 *
 * <h2>Malformed Input</h2>
 * <p>
 * In lenient mode, malformed (and truncated) sequences are decoded to
 * U+FFFD. In strict mode, they raise {@linkplain CharacterCodingException}.
 * </p>
 */
final class ChunkDecoder {

  private final static char BOM = '\uFEFF';

  private final CharsetDecoder decoder;
  private CharBuffer out = CharBuffer.allocate(0);
  private boolean started;


  ChunkDecoder(Charset charset, boolean strict) {
    CodingErrorAction action =
        strict ? CodingErrorAction.REPORT : CodingErrorAction.REPLACE;
    this.decoder = charset.newDecoder()
        .onMalformedInput(action)
        .onUnmappableCharacter(action);
  }


  /**
   * Decodes as much of the remaining bytes in the given buffer as possible.
   * On return, any remaining bytes in {@code in} constitute a partial
   * character sequence.
   */
  String decode(ByteBuffer in) throws CharacterCodingException {
    prepareOut(in.remaining());
    decodeInto(in, false);
    return drain();
  }


  /**
   * Decodes the remaining bytes in the given buffer as the final input and
   * flushes the decoder. No further invocations are expected.
   */
  String finish(ByteBuffer in) throws CharacterCodingException {
    prepareOut(in.remaining() + 1);
    decodeInto(in, true);
    CoderResult result;
    while ((result = decoder.flush(out)).isOverflow())
      grow();
    if (result.isError())
      result.throwException();
    return drain();
  }


  private void decodeInto(ByteBuffer in, boolean endOfInput)
      throws CharacterCodingException {
    while (true) {
      CoderResult result = decoder.decode(in, out, endOfInput);
      if (result.isOverflow())
        grow();
      else if (result.isError())
        result.throwException();
      else
        break;
    }
  }


  private void prepareOut(int bytes) {
    int cap = (int) Math.ceil(bytes * (double) decoder.maxCharsPerByte()) + 1;
    if (out.capacity() < cap)
      out = CharBuffer.allocate(cap);
    out.clear();
  }


  private void grow() {
    CharBuffer expand = CharBuffer.allocate(out.capacity() * 2 + 16);
    out.flip();
    expand.put(out);
    out = expand;
  }


  private String drain() {
    out.flip();
    if (!started && out.hasRemaining()) {
      started = true;
      if (out.get(out.position()) == BOM)
        out.position(out.position() + 1);
    }
    String text = out.toString();
    out.clear();
    return text;
  }

}
