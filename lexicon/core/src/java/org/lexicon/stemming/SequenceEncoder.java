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

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;

/**
 * Encodes a target byte sequence (typically a stem) as a delta against a source sequence (the
 * inflected form) and decodes it back. The encoded form starts with {@link #prefixBytes()} bytes of
 * editing instructions followed by the bytes that are appended literally.
 *
 * <p>Implementations keep no state; the returned {@link BytesRef} is a view over <code>reuse
 * </code> and is valid until the builder is modified.
 *
 * @lucene.experimental
 */
public interface SequenceEncoder {
  /**
   * Encodes <code>target</code> relative to <code>source</code>.
   *
   * @param reuse Builder receiving the encoded bytes; its previous content is discarded.
   * @return A view over the encoded bytes.
   */
  BytesRef encode(BytesRefBuilder reuse, BytesRef source, BytesRef target);

  /**
   * Decodes <code>encoded</code> (as produced by {@link #encode}) relative to <code>source</code>.
   *
   * @param reuse Builder receiving the decoded bytes; its previous content is discarded.
   * @return A view over the decoded bytes.
   */
  BytesRef decode(BytesRefBuilder reuse, BytesRef source, BytesRef encoded);

  /** @return The number of leading instruction bytes in every encoded sequence. */
  int prefixBytes();
}
