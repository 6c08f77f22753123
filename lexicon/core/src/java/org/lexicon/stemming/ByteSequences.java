/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lexicon.stemming;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.util.Arrays;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;

/** Static helpers for byte sequences shared by the encoders and the lookup. */
final class ByteSequences {
  /** Instruction byte value meaning "remove everything", before adding the 'A' bias. */
  static final int REMOVE_EVERYTHING = 255;

  private ByteSequences() {}

  /** Converts a trimming count into an instruction byte. */
  static byte toInstruction(int count) {
    return (byte) ((count + 'A') & 0xFF);
  }

  /** Converts an instruction byte back into a trimming count. */
  static int fromInstruction(byte b) {
    return (b - 'A') & 0xFF;
  }

  /**
   * Returns the number of equal bytes at the start of <code>a</code> (from <code>aStart</code>) and
   * <code>b</code> (from <code>bStart</code>). Starts are relative to each reference's offset.
   */
  static int sharedPrefixLength(BytesRef a, int aStart, BytesRef b, int bStart) {
    final int aFrom = a.offset + aStart;
    final int aTo = a.offset + a.length;
    final int bFrom = b.offset + bStart;
    final int bTo = b.offset + b.length;
    if (aFrom >= aTo || bFrom >= bTo) {
      return 0;
    }
    final int mismatch = Arrays.mismatch(a.bytes, aFrom, aTo, b.bytes, bFrom, bTo);
    return mismatch < 0 ? aTo - aFrom : mismatch;
  }

  /** Returns the number of equal bytes at the start of both sequences. */
  static int sharedPrefixLength(BytesRef a, BytesRef b) {
    return sharedPrefixLength(a, 0, b, 0);
  }

  /**
   * Encodes characters into bytes with an encoder that reports unmappable input.
   *
   * @throws UnmappableInputException if any character cannot be represented.
   */
  static BytesRef charsToBytes(CharsetEncoder encoder, CharSequence chars, BytesRefBuilder bytes)
      throws UnmappableInputException {
    final int maxBytes = (int) Math.ceil(encoder.maxBytesPerChar() * chars.length());
    bytes.clear();
    bytes.grow(maxBytes);

    final ByteBuffer out = ByteBuffer.wrap(bytes.bytes());
    encoder.reset();
    try {
      CoderResult result = encoder.encode(CharBuffer.wrap(chars), out, true);
      if (!result.isUnderflow()) {
        result.throwException();
      }
      result = encoder.flush(out);
      if (!result.isUnderflow()) {
        result.throwException();
      }
    } catch (CharacterCodingException e) {
      throw new UnmappableInputException(
          "Input cannot be mapped to bytes using encoding "
              + encoder.charset().name()
              + ": "
              + chars,
          e);
    }

    bytes.setLength(out.position());
    return bytes.get();
  }
}
