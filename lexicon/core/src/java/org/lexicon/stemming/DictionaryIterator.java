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

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.lexicon.util.fsa.ByteSequenceIterator;

/**
 * Iterates over all entries of a {@link Dictionary}, yielding one {@link WordData} row per stored
 * sequence. The row is reused between calls to {@link #next()}.
 */
public final class DictionaryIterator implements Iterator<WordData> {
  private final ByteSequenceIterator entriesIter;
  private final WordData entry;
  private final byte separator;
  private final DictionaryMetadata metadata;
  private final boolean decodeStems;
  private final SequenceEncoder sequenceEncoder;

  private final BytesRefBuilder inflected = new BytesRefBuilder();
  private final BytesRef encodedScratch = new BytesRef();

  /**
   * @param decodeStems If <code>false</code>, stems are returned in their encoded form (including
   *     the encoder's instruction bytes).
   */
  public DictionaryIterator(Dictionary dictionary, boolean decodeStems) {
    this.metadata = dictionary.getMetadata();
    this.entriesIter = new ByteSequenceIterator(dictionary.getFSA());
    this.separator = metadata.getSeparator();
    this.decodeStems = decodeStems;
    this.sequenceEncoder = metadata.getSequenceEncoderType().get();
    this.entry = new WordData(metadata.getCharset());
  }

  @Override
  public boolean hasNext() {
    return entriesIter.hasNext();
  }

  /**
   * @throws IllegalStateException if a stored sequence does not contain a separator.
   */
  @Override
  public WordData next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }

    final BytesRef entryBuffer = entriesIter.next();
    final byte[] ba = entryBuffer.bytes;
    final int start = entryBuffer.offset;
    final int end = start + entryBuffer.length;

    // Inflected form, up to the first separator.
    int sep = start;
    while (sep < end && ba[sep] != separator) {
      sep++;
    }
    if (sep == end) {
      throw new IllegalStateException("Invalid dictionary entry format (missing separator).");
    }

    inflected.copyBytes(ba, start, sep - start);
    final BytesRef inflectedBytes = inflected.get();
    entry.update(inflectedBytes, new String(ba, start, sep - start, metadata.getCharset()));

    // Encoded stem, up to the second separator (instruction bytes may contain any value).
    final int stemStart = sep + 1;
    int stemEnd = Math.min(end, stemStart + sequenceEncoder.prefixBytes());
    while (stemEnd < end && ba[stemEnd] != separator) {
      stemEnd++;
    }

    encodedScratch.bytes = ba;
    encodedScratch.offset = stemStart;
    encodedScratch.length = stemEnd - stemStart;
    if (decodeStems) {
      sequenceEncoder.decode(entry.stem, inflectedBytes, encodedScratch);
    } else {
      entry.stem.copyBytes(encodedScratch);
    }

    // Tag, the remainder after the second separator.
    final int tagStart = stemEnd + 1;
    if (tagStart < end) {
      entry.tag.copyBytes(ba, tagStart, end - tagStart);
    }

    return entry;
  }
}
