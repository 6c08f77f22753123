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

import static org.lexicon.util.fsa.MatchResult.AUTOMATON_HAS_PREFIX;
import static org.lexicon.util.fsa.MatchResult.EXACT_MATCH;
import static org.lexicon.util.fsa.MatchResult.NO_MATCH;
import static org.lexicon.util.fsa.MatchResult.SEQUENCE_IS_A_PREFIX;

/**
 * Matches byte sequences against an automaton and computes perfect hashes of stored sequences.
 *
 * <p>A matcher holds no state besides the automaton and may be shared; {@link MatchResult}
 * instances passed to {@link #match(MatchResult, byte[], int, int, int)} are reused.
 */
public final class FSAMatcher {
  private final FSA fsa;

  public FSAMatcher(FSA fsa) {
    this.fsa = fsa;
  }

  /**
   * Computes the perfect hash of a sequence: its rank among the sequences reachable from <code>node
   * </code>, in the order of arcs (which is byte-lexicographic for all supported encodings). The
   * automaton must have {@link FSAFlags#NUMBERS}.
   *
   * @return A non-negative rank if the sequence is stored in the automaton, {@link
   *     MatchResult#AUTOMATON_HAS_PREFIX} or {@link MatchResult#SEQUENCE_IS_A_PREFIX} if only a
   *     prefix relation holds, {@link MatchResult#NO_MATCH} otherwise. An empty sequence is a
   *     prefix of every stored sequence and yields {@link MatchResult#SEQUENCE_IS_A_PREFIX}, as
   *     {@link #match(byte[])} does.
   */
  public int perfectHash(byte[] sequence, int start, int length, int node) {
    assert fsa.getFlags().contains(FSAFlags.NUMBERS) : "Automaton has no right-language counts.";
    if (length == 0) {
      return SEQUENCE_IS_A_PREFIX;
    }

    int hash = 0;
    final int end = start + length - 1;

    int seqIndex = start;
    byte label = sequence[seqIndex];

    for (int arc = fsa.getFirstArc(node); arc != 0; ) {
      if (fsa.getArcLabel(arc) == label) {
        if (fsa.isArcFinal(arc)) {
          if (seqIndex == end) {
            return hash;
          }
          hash++;
        }

        if (fsa.isArcTerminal(arc)) {
          return AUTOMATON_HAS_PREFIX;
        }

        if (seqIndex == end) {
          return SEQUENCE_IS_A_PREFIX;
        }

        arc = fsa.getFirstArc(fsa.getEndNode(arc));
        label = sequence[++seqIndex];
        continue;
      } else {
        if (fsa.isArcFinal(arc)) {
          hash++;
        }
        if (!fsa.isArcTerminal(arc)) {
          hash += fsa.getRightLanguageCount(fsa.getEndNode(arc));
        }
      }

      arc = fsa.getNextArc(arc);
    }

    if (seqIndex > start) {
      return AUTOMATON_HAS_PREFIX;
    } else {
      return NO_MATCH;
    }
  }

  /** Computes the perfect hash of a whole sequence, starting from the root. */
  public int perfectHash(byte[] sequence) {
    return perfectHash(sequence, 0, sequence.length, fsa.getRootNode());
  }

  /**
   * Matches <code>length</code> bytes of <code>sequence</code> starting at <code>start</code>,
   * beginning at state <code>node</code>.
   *
   * @param reuse The result to fill in and return.
   */
  public MatchResult match(MatchResult reuse, byte[] sequence, int start, int length, int node) {
    if (node == 0) {
      reuse.reset(NO_MATCH, start, node);
      return reuse;
    }

    final FSA fsa = this.fsa;
    final int end = start + length;
    for (int i = start; i < end; i++) {
      final int arc = fsa.getArc(node, sequence[i]);
      if (arc != 0) {
        if (i + 1 == end && fsa.isArcFinal(arc)) {
          reuse.reset(EXACT_MATCH, i, node);
          return reuse;
        }

        if (fsa.isArcTerminal(arc)) {
          reuse.reset(AUTOMATON_HAS_PREFIX, i + 1, node);
          return reuse;
        }

        node = fsa.getEndNode(arc);
      } else {
        if (i > start) {
          reuse.reset(AUTOMATON_HAS_PREFIX, i, node);
        } else {
          reuse.reset(NO_MATCH, i, node);
        }
        return reuse;
      }
    }

    // The whole input was consumed without reaching a final arc.
    reuse.reset(SEQUENCE_IS_A_PREFIX, 0, node);
    return reuse;
  }

  /** Same as {@link #match(MatchResult, byte[], int, int, int)} with a new result. */
  public MatchResult match(byte[] sequence, int start, int length, int node) {
    return match(new MatchResult(), sequence, start, length, node);
  }

  /** Matches a whole sequence starting at <code>node</code>. */
  public MatchResult match(byte[] sequence, int node) {
    return match(sequence, 0, sequence.length, node);
  }

  /** Matches a whole sequence starting at the root. */
  public MatchResult match(byte[] sequence) {
    return match(sequence, fsa.getRootNode());
  }
}
