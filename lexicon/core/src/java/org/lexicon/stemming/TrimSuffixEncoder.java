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
 * Encodes the target as the number of bytes to remove from the end of the source, followed by the
 * bytes to append.
 *
 * <p>The first byte is <code>'A' + k</code> where <code>k</code> is the number of trailing bytes of
 * the source to drop. A count of {@link ByteSequences#REMOVE_EVERYTHING} drops the whole source; it
 * is used whenever the source shares no prefix with the target or the count would not fit in a
 * byte.
 *
 * <p>Example: <code>source=foo, target=foobar</code> is encoded as <code>Abar</code>.
 */
public class TrimSuffixEncoder implements SequenceEncoder {
  @Override
  public BytesRef encode(BytesRefBuilder reuse, BytesRef source, BytesRef target) {
    int sharedPrefix = ByteSequences.sharedPrefixLength(source, target);
    int truncateBytes = source.length - sharedPrefix;
    if (truncateBytes >= REMOVE_EVERYTHING || (sharedPrefix == 0 && truncateBytes > 0)) {
      truncateBytes = REMOVE_EVERYTHING;
      sharedPrefix = 0;
    }

    reuse.clear();
    reuse.grow(1 + target.length - sharedPrefix);
    reuse.append(ByteSequences.toInstruction(truncateBytes));
    reuse.append(target.bytes, target.offset + sharedPrefix, target.length - sharedPrefix);
    return reuse.get();
  }

  @Override
  public BytesRef decode(BytesRefBuilder reuse, BytesRef source, BytesRef encoded) {
    assert encoded.length >= 1 : "Encoded sequence is missing its instruction byte.";

    int truncateBytes = ByteSequences.fromInstruction(encoded.bytes[encoded.offset]);
    if (truncateBytes == REMOVE_EVERYTHING) {
      truncateBytes = source.length;
    }
    assert truncateBytes <= source.length : "Cannot remove more bytes than the source has.";

    final int keep = source.length - truncateBytes;
    final int suffix = encoded.length - 1;
    reuse.clear();
    reuse.grow(keep + suffix);
    reuse.append(source.bytes, source.offset, keep);
    reuse.append(encoded.bytes, encoded.offset + 1, suffix);
    return reuse.get();
  }

  @Override
  public int prefixBytes() {
    return 1;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
