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
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Automaton with fixed-width goto fields (version 5 of the binary format).
 *
 * <p>Header (after the common {@link FSAHeader}): filler byte, annotation byte and a single byte
 * whose high nibble is the length of per-node right-language counts and whose low nibble is the
 * length of goto fields.
 *
 * <p>Each arc is a label byte followed by a goto field of <code>gotoLength</code> bytes, little
 * endian. The three lowest bits of the goto field are flags ({@link #BIT_FINAL_ARC}, {@link
 * #BIT_LAST_ARC}, {@link #BIT_TARGET_NEXT}), the remaining bits hold the target address. If {@link
 * #BIT_TARGET_NEXT} is set only the flags byte is stored and the target state follows this arc
 * immediately.
 *
 * @lucene.experimental
 */
public final class FixedFSA extends FSA {
  /** Version byte of this encoding. */
  public static final byte VERSION = 5;

  /** The arc ends a stored sequence. */
  static final int BIT_FINAL_ARC = 1 << 0;

  /** The arc is the last one of its state. */
  static final int BIT_LAST_ARC = 1 << 1;

  /** The target state is stored right after this arc. */
  static final int BIT_TARGET_NEXT = 1 << 2;

  /** Offset of the goto field (and flags) relative to the arc's label byte. */
  static final int ADDRESS_OFFSET = 1;

  /** Filler character, kept for compatibility. */
  public final byte filler;

  /** Annotation character, kept for compatibility. */
  public final byte annotation;

  /** Number of bytes of right-language counts stored in front of each state's arcs. */
  public final int nodeDataLength;

  /** Number of bytes of a goto field. */
  public final int gotoLength;

  private final Set<FSAFlags> flags;

  FixedFSA(InputStream stream) throws IOException {
    this(new DataInputStream(stream));
  }

  private FixedFSA(DataInputStream in) throws IOException {
    this(in.readByte(), in.readByte(), in.readByte(), in);
  }

  private FixedFSA(byte filler, byte annotation, byte hgtl, DataInputStream in)
      throws IOException {
    super(in.readAllBytes());
    this.filler = filler;
    this.annotation = annotation;
    this.nodeDataLength = (hgtl >>> 4) & 0x0f;
    this.gotoLength = hgtl & 0x0f;

    final EnumSet<FSAFlags> flags =
        EnumSet.of(FSAFlags.FLEXIBLE, FSAFlags.STOPBIT, FSAFlags.NEXTBIT);
    if (nodeDataLength != 0) {
      flags.add(FSAFlags.NUMBERS);
    }
    this.flags = Collections.unmodifiableSet(flags);
  }

  @Override
  public int getRootNode() {
    // State 0 is a dummy; the epsilon state follows it and its only arc leads to the root.
    final int epsilonNode = skipArc(getFirstArc(0));
    return getDestinationNodeOffset(getFirstArc(epsilonNode));
  }

  @Override
  public int getFirstArc(int node) {
    return nodeDataLength + node;
  }

  @Override
  public int getNextArc(int arc) {
    if (isArcLast(arc)) {
      return 0;
    }
    return skipArc(arc);
  }

  @Override
  public int getEndNode(int arc) {
    final int nodeOffset = getDestinationNodeOffset(arc);
    assert nodeOffset != 0 : "Terminal arcs have no target state.";
    return nodeOffset;
  }

  @Override
  public byte getArcLabel(int arc) {
    return arcs[arc];
  }

  @Override
  public boolean isArcFinal(int arc) {
    return (arcs[arc + ADDRESS_OFFSET] & BIT_FINAL_ARC) != 0;
  }

  @Override
  public boolean isArcTerminal(int arc) {
    return 0 == getDestinationNodeOffset(arc);
  }

  @Override
  public int getRightLanguageCount(int node) {
    assert getFlags().contains(FSAFlags.NUMBERS) : "This automaton was compiled without NUMBERS.";
    return decodeFromBytes(arcs, node, nodeDataLength);
  }

  @Override
  public Set<FSAFlags> getFlags() {
    return flags;
  }

  /** Returns <code>true</code> if this arc is the last one of its state. */
  public boolean isArcLast(int arc) {
    return (arcs[arc + ADDRESS_OFFSET] & BIT_LAST_ARC) != 0;
  }

  /** Returns <code>true</code> if the target state is stored right after this arc. */
  public boolean isNextSet(int arc) {
    return (arcs[arc + ADDRESS_OFFSET] & BIT_TARGET_NEXT) != 0;
  }

  /** Returns an n-byte little endian integer stored at <code>start</code>. */
  static int decodeFromBytes(byte[] arcs, int start, int n) {
    int r = 0;
    for (int i = n; --i >= 0; ) {
      r = r << 8 | (arcs[start + i] & 0xff);
    }
    return r;
  }

  /** Returns the address of the target state of an arc, 0 for terminal arcs. */
  int getDestinationNodeOffset(int arc) {
    if (isNextSet(arc)) {
      return skipArc(arc);
    } else {
      return decodeFromBytes(arcs, arc + ADDRESS_OFFSET, gotoLength) >>> 3;
    }
  }

  /** Returns the offset of the byte right after this arc. */
  private int skipArc(int offset) {
    return offset + (isNextSet(offset) ? 1 + 1 : 1 + gotoLength);
  }
}
