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

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.apache.lucene.util.BytesRef;

/**
 * Iterates over all byte sequences reachable from a given state, depth first, in the order of arcs.
 *
 * <p>The returned {@link BytesRef} is shared and overwritten by subsequent calls to {@link
 * #next()}; callers must copy it if they need it longer. The iterator can be restarted from
 * another state with {@link #restartFrom(int)} without reallocating its buffers.
 */
public final class ByteSequenceIterator implements Iterator<BytesRef> {
  /** Default (and growth increment of) the expected depth of the automaton. */
  private static final int EXPECTED_MAX_STATES = 15;

  private final FSA fsa;

  /** The next sequence to return, or <code>null</code> if it has not been computed yet. */
  private BytesRef nextElement;

  /** Labels on the current path. */
  private byte[] buffer = new byte[EXPECTED_MAX_STATES];

  /** Reusable view over {@link #buffer}. */
  private final BytesRef bufferWrapper = new BytesRef(buffer, 0, 0);

  /** Pending arcs on the current path, one per depth. */
  private int[] arcs = new int[EXPECTED_MAX_STATES];

  /** Current depth of the path. */
  private int position;

  /** Iterates over all sequences in the automaton. */
  public ByteSequenceIterator(FSA fsa) {
    this(fsa, fsa.getRootNode());
  }

  /** Iterates over all sequences reachable from <code>node</code>. */
  public ByteSequenceIterator(FSA fsa, int node) {
    this.fsa = fsa;
    if (fsa.getFirstArc(node) != 0) {
      restartFrom(node);
    }
  }

  /** Restarts iteration from a new state. The previous iteration state is discarded. */
  public ByteSequenceIterator restartFrom(int node) {
    position = 0;
    bufferWrapper.length = 0;
    nextElement = null;

    pushNode(node);
    return this;
  }

  @Override
  public boolean hasNext() {
    if (nextElement == null) {
      nextElement = advance();
    }
    return nextElement != null;
  }

  @Override
  public BytesRef next() {
    if (nextElement != null) {
      final BytesRef cache = nextElement;
      nextElement = null;
      return cache;
    } else {
      final BytesRef cache = advance();
      if (cache == null) {
        throw new NoSuchElementException();
      }
      return cache;
    }
  }

  /** Advances to the next final arc and returns the path leading to it, or null at the end. */
  private BytesRef advance() {
    if (position == 0) {
      return null;
    }

    while (position > 0) {
      final int lastIndex = position - 1;
      final int arc = arcs[lastIndex];

      if (arc == 0) {
        // All arcs of this state have been visited.
        position--;
        continue;
      }

      // Remember the next arc of this state, then descend.
      arcs[lastIndex] = fsa.getNextArc(arc);

      if (lastIndex >= buffer.length) {
        buffer = Arrays.copyOf(buffer, buffer.length + EXPECTED_MAX_STATES);
        bufferWrapper.bytes = buffer;
      }
      buffer[lastIndex] = fsa.getArcLabel(arc);

      if (!fsa.isArcTerminal(arc)) {
        pushNode(fsa.getEndNode(arc));
      }

      if (fsa.isArcFinal(arc)) {
        bufferWrapper.offset = 0;
        bufferWrapper.length = lastIndex + 1;
        return bufferWrapper;
      }
    }

    return null;
  }

  /** Descends to a given state, adding its first arc to the path. */
  private void pushNode(int node) {
    if (position == arcs.length) {
      arcs = Arrays.copyOf(arcs, arcs.length + EXPECTED_MAX_STATES);
    }
    arcs[position++] = fsa.getFirstArc(node);
  }
}
