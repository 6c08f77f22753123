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

import static org.lexicon.stemming.ByteSequences.REMOVE_EVERYTHING;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;

/**
 * Encodes the target as the number of bytes to remove from the start and from the end of the
 * source, followed by the bytes to append.
 *
 * <p>The two leading bytes are <code>'A' + p</code> and <code>'A' + s</code>. The encoder picks
 * the position in the source where the longest prefix of the target starts. If either count
 * exceeds a byte both are set to {@link ByteSequences#REMOVE_EVERYTHING} and the whole target is
 * stored.
 *
 * <p>Example: <code>source=nieduży, target=duży</code> is encoded as <code>DA</code>.
 */
public class TrimPrefixAndSuffixEncoder implements SequenceEncoder {
  @Override
  public BytesRef encode(BytesRefBuilder reuse, BytesRef source, BytesRef target) {
    // Search for the maximum matching subsequence that can be encoded.
    int maxSubsequenceLength = 0;
    int maxSubsequenceIndex = 0;
    for (int i = 0; i < source.length; i++) {
      // prefix at i => shared subsequence (infix)
      final int sharedPrefix = ByteSequences.sharedPrefixLength(source, i, target, 0);
      // Only update maxSubsequenceLength if we will be able to encode it.
      if (sharedPrefix > maxSubsequenceLength
          && i < REMOVE_EVERYTHING
          && (source.length - (i + sharedPrefix)) < REMOVE_EVERYTHING) {
        maxSubsequenceLength = sharedPrefix;
        maxSubsequenceIndex = i;
      }
    }

    // Determine how much to remove (and where) from source to get a prefix of target.
    int truncatePrefixBytes = maxSubsequenceIndex;
    int truncateSuffixBytes = source.length - (maxSubsequenceIndex + maxSubsequenceLength);
    if (truncatePrefixBytes >= REMOVE_EVERYTHING || truncateSuffixBytes >= REMOVE_EVERYTHING) {
      maxSubsequenceIndex = maxSubsequenceLength = 0;
      truncatePrefixBytes = truncateSuffixBytes = REMOVE_EVERYTHING;
    }

    final int len = target.length - maxSubsequenceLength;
    reuse.clear();
    reuse.grow(2 + len);
    reuse.append(ByteSequences.toInstruction(truncatePrefixBytes));
    reuse.append(ByteSequences.toInstruction(truncateSuffixBytes));
    reuse.append(target.bytes, target.offset + maxSubsequenceLength, len);
    return reuse.get();
  }

  @Override
  public BytesRef decode(BytesRefBuilder reuse, BytesRef source, BytesRef encoded) {
    assert encoded.length >= 2 : "Encoded sequence is missing its instruction bytes.";

    int truncatePrefixBytes = ByteSequences.fromInstruction(encoded.bytes[encoded.offset]);
    int truncateSuffixBytes = ByteSequences.fromInstruction(encoded.bytes[encoded.offset + 1]);

    if (truncatePrefixBytes == REMOVE_EVERYTHING || truncateSuffixBytes == REMOVE_EVERYTHING) {
      truncatePrefixBytes = source.length;
      truncateSuffixBytes = 0;
    }

    final int len1 = source.length - (truncateSuffixBytes + truncatePrefixBytes);
    assert len1 >= 0 : "Cannot remove more bytes than the source has.";
    final int len2 = encoded.length - 2;

    reuse.clear();
    reuse.grow(len1 + len2);
    reuse.append(source.bytes, source.offset + truncatePrefixBytes, len1);
    reuse.append(encoded.bytes, encoded.offset + 2, len2);
    return reuse.get();
  }

  @Override
  public int prefixBytes() {
    return 2;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
