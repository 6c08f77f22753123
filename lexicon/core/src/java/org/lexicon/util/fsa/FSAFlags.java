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

import java.util.Set;

/**
 * Flags stored in automaton headers. Not every encoding supports every flag.
 *
 * @lucene.experimental
 */
public enum FSAFlags {
  /** Daciuk: flexible FSA encoding. */
  FLEXIBLE(1 << 0),

  /** Daciuk: stop bit in use. */
  STOPBIT(1 << 1),

  /** Daciuk: next bit in use. */
  NEXTBIT(1 << 2),

  /** Daciuk: tails compression. */
  TAILS(1 << 3),

  /** The automaton contains right-language counts on states. */
  NUMBERS(1 << 8),

  /**
   * The automaton encodes a dictionary with separator bytes between the inflected form, the
   * stem and the tag.
   */
  SEPARATORS(1 << 9);

  /** Bit mask for this flag in a binary header. */
  public final int bits;

  FSAFlags(int bits) {
    this.bits = bits;
  }

  /** Returns <code>true</code> if this flag is set in the given bit mask. */
  public boolean isSet(int flags) {
    return (flags & bits) != 0;
  }

  /** Packs a set of flags into a single short, as stored in binary headers. */
  public static short asShort(Set<FSAFlags> flags) {
    int value = 0;
    for (FSAFlags f : flags) {
      value |= f.bits;
    }
    return (short) value;
  }
}
