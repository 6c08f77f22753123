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
 * Encodes the target as an infix to remove from the source, a number of bytes to remove from the
 * end of the source and the bytes to append.
 *
 * <p>The three leading bytes are <code>'A' + infixIndex</code>, <code>'A' + infixLength</code> and
 * <code>'A' + suffixLength</code>. The removed infix starts either at the beginning of the source
 * or right after the longest prefix shared with the target. A removal that only cuts the end of
 * the source is stored as a suffix removal. If any count exceeds a byte, the infix length and
 * suffix counts are set to {@link ByteSequences#REMOVE_EVERYTHING} and the whole target is stored.
 *
 * <p>Example: <code>source=ayz, target=abc</code> is encoded as <code>AACbc</code> and <code>
 * source=aillent, target=aller</code> as <code>BBCr</code>.
 */
public class TrimInfixAndSuffixEncoder implements SequenceEncoder {
  @Override
  public BytesRef encode(BytesRefBuilder reuse, BytesRef source, BytesRef target) {
    // Search for the infix that can be encoded and removed from source to get the maximum-length
    // prefix of target.
    int maxInfixIndex = 0;
    int maxSubsequenceLength = ByteSequences.sharedPrefixLength(source, target);
    int maxInfixLength = 0;
    for (int i : new int[] {0, maxSubsequenceLength}) {
      for (int j = 1; j <= source.length - i; j++) {
        // source[0, i) is shared with the target for both candidate positions, so the prefix of
        // source with [i, i + j) removed continues at i + j.
        final int sharedPrefix = i + ByteSequences.sharedPrefixLength(source, i + j, target, i);

        // Only update maxSubsequenceLength if we will be able to encode it.
        if (sharedPrefix > 0
            && sharedPrefix > maxSubsequenceLength
            && i < REMOVE_EVERYTHING
            && j < REMOVE_EVERYTHING) {
          maxSubsequenceLength = sharedPrefix;
          maxInfixIndex = i;
          maxInfixLength = j;
        }
      }
    }

    int truncateSuffixBytes = source.length - (maxInfixLength + maxSubsequenceLength);

    // Special case: if we're removing the suffix in the infix code, move it to the suffix code.
    if (truncateSuffixBytes == 0 && maxInfixIndex + maxInfixLength == source.length) {
      truncateSuffixBytes = maxInfixLength;
      maxInfixIndex = maxInfixLength = 0;
    }

    if (maxInfixIndex >= REMOVE_EVERYTHING
        || maxInfixLength >= REMOVE_EVERYTHING
        || truncateSuffixBytes >= REMOVE_EVERYTHING) {
      maxInfixIndex = maxSubsequenceLength = 0;
      maxInfixLength = truncateSuffixBytes = REMOVE_EVERYTHING;
    }

    final int len = target.length - maxSubsequenceLength;
    reuse.clear();
    reuse.grow(3 + len);
    reuse.append(ByteSequences.toInstruction(maxInfixIndex));
    reuse.append(ByteSequences.toInstruction(maxInfixLength));
    reuse.append(ByteSequences.toInstruction(truncateSuffixBytes));
    reuse.append(target.bytes, target.offset + maxSubsequenceLength, len);
    return reuse.get();
  }

  @Override
  public BytesRef decode(BytesRefBuilder reuse, BytesRef source, BytesRef encoded) {
    assert encoded.length >= 3 : "Encoded sequence is missing its instruction bytes.";

    int infixIndex = ByteSequences.fromInstruction(encoded.bytes[encoded.offset]);
    int infixLength = ByteSequences.fromInstruction(encoded.bytes[encoded.offset + 1]);
    int truncateSuffixBytes = ByteSequences.fromInstruction(encoded.bytes[encoded.offset + 2]);

    if (infixLength == REMOVE_EVERYTHING || truncateSuffixBytes == REMOVE_EVERYTHING) {
      infixIndex = 0;
      infixLength = source.length;
      truncateSuffixBytes = 0;
    }

    final int len1 = source.length - (infixIndex + infixLength + truncateSuffixBytes);
    assert len1 >= 0 : "Cannot remove more bytes than the source has.";
    final int len2 = encoded.length - 3;

    reuse.clear();
    reuse.grow(infixIndex + len1 + len2);
    reuse.append(source.bytes, source.offset, infixIndex);
    reuse.append(source.bytes, source.offset + infixIndex + infixLength, len1);
    reuse.append(encoded.bytes, encoded.offset + 3, len2);
    return reuse.get();
  }

  @Override
  public int prefixBytes() {
    return 3;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
