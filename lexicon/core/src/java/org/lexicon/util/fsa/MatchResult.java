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

/**
 * Result of matching a byte sequence against an automaton with {@link FSAMatcher}. Instances are
 * mutable and may be reused between matches.
 */
public final class MatchResult {
  /** The sequence was found in the automaton. {@link #index} is the position of its last byte. */
  public static final int EXACT_MATCH = 0;

  /** The sequence was not found and no byte of it was consumed. */
  public static final int NO_MATCH = -1;

  /**
   * The automaton contains a prefix of the input sequence. {@link #index} is the first position
   * that could not be matched.
   */
  public static final int AUTOMATON_HAS_PREFIX = -3;

  /**
   * The whole input sequence was consumed and is a prefix of at least one sequence in the
   * automaton. {@link #node} is the state reached after the last byte.
   */
  public static final int SEQUENCE_IS_A_PREFIX = -4;

  /** One of the match kind constants above. */
  public int kind;

  /** Input position associated with {@link #kind}. */
  public int index;

  /** Automaton state associated with {@link #kind}. */
  public int node;

  /** Creates an empty result, ready for reuse. */
  public MatchResult() {
    reset(NO_MATCH, 0, 0);
  }

  final void reset(int kind, int index, int node) {
    this.kind = kind;
    this.index = index;
    this.node = node;
  }

  @Override
  public String toString() {
    return "MatchResult(kind=" + kind + ", index=" + index + ", node=" + node + ")";
  }
}
