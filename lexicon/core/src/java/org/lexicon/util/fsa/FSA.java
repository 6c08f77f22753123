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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.FixedBitSet;
import org.apache.lucene.util.RamUsageEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents a finite state automaton over byte sequences, stored in a single immutable byte[].
 * States (nodes) and arcs are addressed by integer offsets into that array; offset <code>0</code>
 * stands for "no arc" or "no node" and is never a valid state.
 *
 * <p>The three binary encodings ({@link FixedFSA}, {@link CompactFSA} and {@link VIntFSA}) are the
 * only implementations. Use {@link #read(InputStream)} to load any of them; the version byte in the
 * header selects the decoder.
 *
 * <p>An automaton is immutable once loaded and may be shared by any number of threads. Iterators,
 * matchers and lookups built on top of it are not thread safe.
 *
 * @lucene.experimental
 */
public abstract class FSA implements Iterable<BytesRef>, Accountable {
  private static final Logger log = LoggerFactory.getLogger(FSA.class);

  /** Encoded states and arcs. */
  final byte[] arcs;

  FSA(byte[] arcs) {
    this.arcs = arcs;
  }

  /** @return Returns the identifier of the root node of this automaton. */
  public abstract int getRootNode();

  /** @return Returns the identifier of the first arc leaving <code>node</code> or 0 if none. */
  public abstract int getFirstArc(int node);

  /** @return Returns the identifier of the next arc after <code>arc</code> or 0 if it is the last. */
  public abstract int getNextArc(int arc);

  /**
   * @return Returns the identifier of an arc leaving <code>node</code> and labeled with <code>
   *     label</code>, or 0 if no such arc exists.
   */
  public int getArc(int node, byte label) {
    for (int arc = getFirstArc(node); arc != 0; arc = getNextArc(arc)) {
      if (getArcLabel(arc) == label) {
        return arc;
      }
    }
    return 0;
  }

  /** @return Returns the label associated with a given <code>arc</code>. */
  public abstract byte getArcLabel(int arc);

  /** @return Returns <code>true</code> if the arc ends a sequence stored in the automaton. */
  public abstract boolean isArcFinal(int arc);

  /**
   * @return Returns <code>true</code> if the arc has no target node. Terminal arcs are always
   *     final.
   */
  public abstract boolean isArcTerminal(int arc);

  /** @return Returns the target node of <code>arc</code>. The arc must not be terminal. */
  public abstract int getEndNode(int arc);

  /** @return Returns the set of flags this automaton was stored with. */
  public abstract Set<FSAFlags> getFlags();

  /** @return Returns the number of arcs leaving <code>node</code>. */
  public int getArcCount(int node) {
    int count = 0;
    for (int arc = getFirstArc(node); arc != 0; arc = getNextArc(arc)) {
      count++;
    }
    return count;
  }

  /**
   * @return Returns the number of sequences reachable from the given state. Only available if the
   *     automaton was stored with {@link FSAFlags#NUMBERS}.
   */
  public int getRightLanguageCount(int node) {
    throw new UnsupportedOperationException("Automaton does not have right-language counts.");
  }

  /**
   * Returns an iterable over all sequences reachable from a given node. The returned {@link
   * BytesRef} is reused between calls to {@link Iterator#next()}.
   */
  public Iterable<BytesRef> getSequences(final int node) {
    if (node == 0) {
      return Collections.emptyList();
    }
    return () -> new ByteSequenceIterator(FSA.this, node);
  }

  /** Returns an iterable over all sequences stored in this automaton. */
  public final Iterable<BytesRef> getSequences() {
    return getSequences(getRootNode());
  }

  /** Returns an iterator over all sequences stored in this automaton. */
  @Override
  public final Iterator<BytesRef> iterator() {
    return getSequences().iterator();
  }

  /** Visits all states reachable from the root, in no particular order. */
  public <T extends StateVisitor> T visitAllStates(T v) {
    return visitInPostOrder(v);
  }

  /** Visits all states reachable from the root in post-order. */
  public <T extends StateVisitor> T visitInPostOrder(T v) {
    return visitInPostOrder(v, getRootNode());
  }

  /**
   * Visits all states reachable from <code>node</code> in post-order: a state is visited after all
   * of its descendants. Visiting stops as soon as the visitor returns <code>false</code>.
   */
  public <T extends StateVisitor> T visitInPostOrder(T v, int node) {
    final FixedBitSet visited = new FixedBitSet(arcs.length);
    int[] nodes = new int[16];
    int[] pending = new int[16];
    visited.set(node);
    nodes[0] = node;
    pending[0] = getFirstArc(node);
    int depth = 1;
    while (depth > 0) {
      final int top = depth - 1;
      final int arc = pending[top];
      if (arc == 0) {
        depth--;
        if (!v.accept(nodes[top])) {
          break;
        }
        continue;
      }

      pending[top] = getNextArc(arc);
      if (!isArcTerminal(arc)) {
        final int target = getEndNode(arc);
        if (!visited.getAndSet(target)) {
          if (depth == nodes.length) {
            nodes = ArrayUtil.grow(nodes, depth + 1);
            pending = ArrayUtil.grow(pending, depth + 1);
          }
          nodes[depth] = target;
          pending[depth] = getFirstArc(target);
          depth++;
        }
      }
    }
    return v;
  }

  /** Visits all states reachable from the root in pre-order. */
  public <T extends StateVisitor> T visitInPreOrder(T v) {
    return visitInPreOrder(v, getRootNode());
  }

  /**
   * Visits all states reachable from <code>node</code> in pre-order: a state is visited before its
   * descendants. If the visitor returns <code>false</code> the subtree of that state is skipped.
   */
  public <T extends StateVisitor> T visitInPreOrder(T v, int node) {
    final FixedBitSet visited = new FixedBitSet(arcs.length);
    int[] pending = new int[16];
    int depth = 0;

    visited.set(node);
    if (v.accept(node)) {
      pending[depth++] = getFirstArc(node);
    }
    while (depth > 0) {
      final int top = depth - 1;
      final int arc = pending[top];
      if (arc == 0) {
        depth--;
        continue;
      }

      pending[top] = getNextArc(arc);
      if (!isArcTerminal(arc)) {
        final int target = getEndNode(arc);
        if (!visited.getAndSet(target) && v.accept(target)) {
          pending = ArrayUtil.grow(pending, depth + 1);
          pending[depth++] = getFirstArc(target);
        }
      }
    }
    return v;
  }

  @Override
  public long ramBytesUsed() {
    return RamUsageEstimator.shallowSizeOf(this) + RamUsageEstimator.sizeOf(arcs);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(flags=" + getFlags() + ", bytes=" + arcs.length + ")";
  }

  /**
   * Reads an automaton from a stream. The stream is read to the end but is not closed.
   *
   * @throws CorruptFSAException if the header is invalid or the version is not supported.
   */
  public static FSA read(InputStream stream) throws IOException {
    final FSAHeader header = FSAHeader.read(stream);
    final FSA fsa;
    switch (header.version) {
      case FixedFSA.VERSION:
        fsa = new FixedFSA(stream);
        break;
      case CompactFSA.VERSION:
        fsa = new CompactFSA(stream);
        break;
      case VIntFSA.VERSION:
        fsa = new VIntFSA(stream);
        break;
      default:
        throw new CorruptFSAException(
            "Unsupported automaton version: 0x"
                + Integer.toHexString(header.version & 0xFF));
    }
    if (log.isDebugEnabled()) {
      log.debug("Loaded {}", fsa);
    }
    return fsa;
  }

  /**
   * Reads an automaton and checks that it is of the expected class.
   *
   * @throws IOException if the automaton cannot be read or is of a different class.
   */
  public static <T extends FSA> T read(InputStream stream, Class<? extends T> clazz)
      throws IOException {
    final FSA fsa = read(stream);
    if (!clazz.isInstance(fsa)) {
      throw new IOException(
          "Expected automaton of class "
              + clazz.getSimpleName()
              + " but got: "
              + fsa.getClass().getSimpleName());
    }
    return clazz.cast(fsa);
  }

  /** Reads an automaton from a file. */
  public static FSA read(Path path) throws IOException {
    try (InputStream is = new BufferedInputStream(Files.newInputStream(path))) {
      return read(is);
    }
  }
}
