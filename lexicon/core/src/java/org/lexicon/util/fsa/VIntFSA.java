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
 * Automaton with compressed labels and variable-length goto fields (version 0xC6 of the binary
 * format).
 *
 * <p>Header (after the common {@link FSAHeader}): a big endian short with {@link FSAFlags} bits, a
 * byte with the size of the label table and the label table itself.
 *
 * <p>Each arc starts with a flags byte: {@link #BIT_TARGET_NEXT}, {@link #BIT_LAST_ARC}, {@link
 * #BIT_FINAL_ARC} and a five bit label table index. An index of 0 means an explicit label byte
 * follows. Unless {@link #BIT_TARGET_NEXT} is set, the arc ends with a v-coded target address (7
 * bits per byte, least significant group first). A {@link #BIT_TARGET_NEXT} arc points at the state
 * stored right after the last arc of its own state. States carry a v-coded right-language count if
 * the automaton has {@link FSAFlags#NUMBERS}.
 *
 * @lucene.experimental
 */
public final class VIntFSA extends FSA {
  /** Version byte of this encoding. */
  public static final byte VERSION = (byte) 0xC6;

  /** The target state is stored right after the last arc of this arc's state. */
  public static final int BIT_TARGET_NEXT = 1 << 7;

  /** The arc is the last one of its state. */
  public static final int BIT_LAST_ARC = 1 << 6;

  /** The arc ends a stored sequence. */
  public static final int BIT_FINAL_ARC = 1 << 5;

  /** Maximum number of labels in the label table (index 0 is reserved for explicit labels). */
  static final int LABEL_INDEX_SIZE = (1 << 5) - 1;

  /** Mask of the label index bits in the flags byte. */
  static final int LABEL_INDEX_MASK = LABEL_INDEX_SIZE;

  /** Labels of compressed arcs, indexed by the label bits of the flags byte. */
  final byte[] labelMapping;

  private final boolean hasNumbers;

  private final Set<FSAFlags> flags;

  VIntFSA(InputStream stream) throws IOException {
    this(new DataInputStream(stream));
  }

  private VIntFSA(DataInputStream in) throws IOException {
    this(readFlags(in), readLabelMapping(in), in);
  }

  private VIntFSA(Set<FSAFlags> flags, byte[] labelMapping, DataInputStream in)
      throws IOException {
    super(in.readAllBytes());
    this.flags = Collections.unmodifiableSet(flags);
    this.hasNumbers = flags.contains(FSAFlags.NUMBERS);
    this.labelMapping = labelMapping;
  }

  private static Set<FSAFlags> readFlags(DataInputStream in) throws IOException {
    final int flagBits = in.readShort() & 0xffff;
    final EnumSet<FSAFlags> flags = EnumSet.noneOf(FSAFlags.class);
    for (FSAFlags f : FSAFlags.values()) {
      if (f.isSet(flagBits)) {
        flags.add(f);
      }
    }
    // Bits that map to no known flag.
    if ((FSAFlags.asShort(flags) & 0xffff) != flagBits) {
      throw new CorruptFSAException("Unrecognized flags: 0x" + Integer.toHexString(flagBits));
    }
    return flags;
  }

  private static byte[] readLabelMapping(DataInputStream in) throws IOException {
    final byte[] labelMapping = new byte[in.readByte() & 0xff];
    in.readFully(labelMapping);
    return labelMapping;
  }

  @Override
  public int getRootNode() {
    // The epsilon state at offset 0 has a single arc leading to the root.
    return getDestinationNodeOffset(getFirstArc(0));
  }

  @Override
  public int getFirstArc(int node) {
    if (hasNumbers) {
      return skipVInt(node);
    } else {
      return node;
    }
  }

  @Override
  public int getNextArc(int arc) {
    if (isArcLast(arc)) {
      return 0;
    } else {
      return skipArc(arc);
    }
  }

  @Override
  public int getEndNode(int arc) {
    final int nodeOffset = getDestinationNodeOffset(arc);
    assert nodeOffset != 0 : "Can't follow a terminal arc: " + arc;
    assert nodeOffset < arcs.length : "Node out of bounds.";
    return nodeOffset;
  }

  @Override
  public byte getArcLabel(int arc) {
    final int index = arcs[arc] & LABEL_INDEX_MASK;
    if (index > 0) {
      return labelMapping[index];
    } else {
      return arcs[arc + 1];
    }
  }

  @Override
  public int getRightLanguageCount(int node) {
    assert hasNumbers : "This automaton was compiled without NUMBERS.";
    return readVInt(arcs, node);
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

  /** Returns <code>true</code> if the target state follows the last arc of this arc's state. */
  public boolean isNextSet(int arc) {
    return (arcs[arc] & BIT_TARGET_NEXT) != 0;
  }

  @Override
  public Set<FSAFlags> getFlags() {
    return flags;
  }

  /** Returns the address of the target state of an arc, 0 for terminal arcs. */
  int getDestinationNodeOffset(int arc) {
    if (isNextSet(arc)) {
      // The target is the state right after the last arc of this state.
      while (!isArcLast(arc)) {
        arc = getNextArc(arc);
      }
      return skipArc(arc);
    } else {
      // Skip the flags byte and the explicit label, if any.
      return readVInt(arcs, arc + ((arcs[arc] & LABEL_INDEX_MASK) == 0 ? 2 : 1));
    }
  }

  /** Returns the offset of the byte right after this arc. */
  private int skipArc(int offset) {
    final int flag = arcs[offset++];

    // Explicit label.
    if ((flag & LABEL_INDEX_MASK) == 0) {
      offset++;
    }

    // Explicit goto address.
    if ((flag & BIT_TARGET_NEXT) == 0) {
      offset = skipVInt(offset);
    }

    assert offset <= this.arcs.length;
    return offset;
  }

  /** Reads a v-coded integer starting at <code>offset</code>. */
  static int readVInt(byte[] array, int offset) {
    byte b = array[offset];
    int value = b & 0x7F;

    for (int shift = 7; b < 0; shift += 7) {
      b = array[++offset];
      value |= (b & 0x7F) << shift;
    }

    return value;
  }

  /** Returns the offset right after the v-coded integer starting at <code>offset</code>. */
  private int skipVInt(int offset) {
    while (arcs[offset++] < 0) {
      // Continuation bit set.
    }
    return offset;
  }

  @Override
  public long ramBytesUsed() {
    return super.ramBytesUsed() + RamUsageEstimator.sizeOf(labelMapping);
  }
}
