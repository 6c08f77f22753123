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
import org.apache.lucene.util.RamUsageEstimator;

/**
 * Automaton with compressed labels and fixed-width goto fields (version 0xC5 of the binary
 * format).
 *
 * <p>The header matches {@link FixedFSA} and is followed by a 32-byte table of frequent labels.
 * Flags live in the three lowest bits of an arc's first byte. Arcs whose target follows them
 * ({@link #BIT_TARGET_NEXT}) store a label table index in the five highest bits, or 0 followed by
 * an explicit label byte. Other arcs store a label byte and a little endian goto field of
 * <code>gotoLength</code> bytes that starts in the first byte and skips over the label.
 *
 * @lucene.experimental
 */
public final class CompactFSA extends FSA {
  /** Version byte of this encoding. */
  public static final byte VERSION = (byte) 0xC5;

  static final int BIT_FINAL_ARC = 1 << 0;
  static final int BIT_LAST_ARC = 1 << 1;
  static final int BIT_TARGET_NEXT = 1 << 2;

  /** Size of the label table. */
  static final int LABEL_MAPPING_SIZE = 32;

  /** Filler character, kept for compatibility. */
  public final byte filler;

  /** Annotation character, kept for compatibility. */
  public final byte annotation;

  /** Number of bytes of right-language counts stored in front of each state's arcs. */
  public final int nodeDataLength;

  /** Number of bytes of a goto field (including the flags byte, excluding the label). */
  public final int gotoLength;

  /** Labels of compressed arcs, indexed by the five highest bits of the flags byte. */
  final byte[] labelMapping;

  private final Set<FSAFlags> flags;

  CompactFSA(InputStream stream) throws IOException {
    this(new DataInputStream(stream));
  }

  private CompactFSA(DataInputStream in) throws IOException {
    this(in.readByte(), in.readByte(), in.readByte(), readLabelMapping(in), in);
  }

  private CompactFSA(
      byte filler, byte annotation, byte hgtl, byte[] labelMapping, DataInputStream in)
      throws IOException {
    super(in.readAllBytes());
    this.filler = filler;
    this.annotation = annotation;
    this.labelMapping = labelMapping;

    final EnumSet<FSAFlags> flags =
        EnumSet.of(FSAFlags.FLEXIBLE, FSAFlags.STOPBIT, FSAFlags.NEXTBIT);
    if ((hgtl & 0xf0) != 0) {
      this.nodeDataLength = (hgtl >>> 4) & 0x0f;
      flags.add(FSAFlags.NUMBERS);
    } else {
      this.nodeDataLength = 0;
    }
    this.gotoLength = hgtl & 0x0f;
    this.flags = Collections.unmodifiableSet(flags);
  }

  private static byte[] readLabelMapping(DataInputStream in) throws IOException {
    final byte[] labelMapping = new byte[LABEL_MAPPING_SIZE];
    in.readFully(labelMapping);
    return labelMapping;
  }

  @Override
  public int getRootNode() {
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
    if (0 == nodeOffset) {
      throw new IllegalArgumentException("This is a terminal arc [" + arc + "]");
    }
    return nodeOffset;
  }

  @Override
  public byte getArcLabel(int arc) {
    if (isNextSet(arc) && isLabelCompressed(arc)) {
      return labelMapping[(arcs[arc] >>> 3) & 0x1f];
    }
    return arcs[arc + 1];
  }

  @Override
  public int getRightLanguageCount(int node) {
    assert getFlags().contains(FSAFlags.NUMBERS) : "This automaton was compiled without NUMBERS.";
    return FixedFSA.decodeFromBytes(arcs, node, nodeDataLength);
  }

  @Override
  public boolean isArcFinal(int arc) {
    return (arcs[arc] & BIT_FINAL_ARC) != 0;
  }

  @Override
  public boolean isArcTerminal(int arc) {
    return 0 == getDestinationNodeOffset(arc);
  }

  /** Returns <code>true</code> if this arc is the last one of its state. */
  public boolean isArcLast(int arc) {
    return (arcs[arc] & BIT_LAST_ARC) != 0;
  }

  /** Returns <code>true</code> if the target state is stored right after this arc. */
  public boolean isNextSet(int arc) {
    return (arcs[arc] & BIT_TARGET_NEXT) != 0;
  }

  /** Returns <code>true</code> if the label of a {@link #BIT_TARGET_NEXT} arc is in the table. */
  public boolean isLabelCompressed(int arc) {
    assert isNextSet(arc) : "Only arcs with the next bit set may have compressed labels.";
    return (arcs[arc] & (-1 << 3)) != 0;
  }

  @Override
  public Set<FSAFlags> getFlags() {
    return flags;
  }

  /** Returns the address of the target state of an arc, 0 for terminal arcs. */
  int getDestinationNodeOffset(int arc) {
    if (isNextSet(arc)) {
      return skipArc(arc);
    }

    // High bytes follow the label, the lowest byte shares space with the flags.
    int r = 0;
    for (int i = gotoLength; --i >= 1; ) {
      r = r << 8 | (arcs[arc + 1 + i] & 0xff);
    }
    r = r << 8 | (arcs[arc] & 0xff);
    return r >>> 3;
  }

  /** Returns the offset of the byte right after this arc. */
  private int skipArc(int offset) {
    if (isNextSet(offset)) {
      return offset + (isLabelCompressed(offset) ? 1 : 2);
    }
    return offset + 1 + gotoLength;
  }

  @Override
  public long ramBytesUsed() {
    return super.ramBytesUsed() + RamUsageEstimator.sizeOf(labelMapping);
  }
}
