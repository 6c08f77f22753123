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
package org.lexicon.util.fsa;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Common header of all automaton encodings: a four byte magic marker (<code>\fsa</code>) followed by
 * a single version byte that selects the encoding.
 *
 * @lucene.experimental
 */
public final class FSAHeader {
  /** Magic marker, as an integer. */
  static final int FSA_MAGIC = ('\\' << 24) | ('f' << 16) | ('s' << 8) | 'a';

  /** Maximum length of the header block. */
  public static final int MAX_HEADER_LENGTH = 4 + 8;

  /** The version byte following the magic marker. */
  final byte version;

  FSAHeader(byte version) {
    this.version = version;
  }

  /** Returns the encoding version byte. */
  public byte getVersion() {
    return version;
  }

  /**
   * Reads an automaton header from a stream, leaving the stream positioned right after the version
   * byte.
   *
   * @throws CorruptFSAException if the magic marker does not match.
   * @throws java.io.EOFException if the stream ends before the header is complete.
   */
  public static FSAHeader read(InputStream in) throws IOException {
    final DataInputStream data = new DataInputStream(in);
    final int magic = data.readInt();
    if (magic != FSA_MAGIC) {
      throw new CorruptFSAException(
          "Invalid automaton header, expected magic 0x"
              + Integer.toHexString(FSA_MAGIC)
              + ", got: 0x"
              + Integer.toHexString(magic));
    }
    return new FSAHeader(data.readByte());
  }

  /** Writes an automaton header with the given version to a stream. */
  public static void write(OutputStream os, byte version) throws IOException {
    os.write(FSA_MAGIC >> 24);
    os.write(FSA_MAGIC >> 16);
    os.write(FSA_MAGIC >> 8);
    os.write(FSA_MAGIC);
    os.write(version);
  }
}
