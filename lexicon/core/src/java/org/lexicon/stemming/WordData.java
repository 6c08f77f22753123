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

import java.nio.charset.Charset;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;

/**
 * A single row of a dictionary lookup: the looked-up word, its stem and its tag.
 *
 * <p>Instances are owned and reused by a {@link DictionaryLookup}; their content is only valid
 * until the next lookup on the same instance. Use {@link #clone()} to keep a detached copy. Because
 * the content changes, {@link #equals(Object)} and {@link #hashCode()} are not supported.
 */
public final class WordData implements Cloneable {
  private static final String COLLECTIONS_ERROR_MESSAGE =
      "Not suitable for use in collections (content is reused between lookups).";

  private final Charset charset;

  /** Inflected word, after output conversion. */
  private CharSequence word;

  /** Raw bytes of the inflected word, as matched against the automaton. */
  private BytesRef wordBytes;

  /** Decoded stem bytes. */
  final BytesRefBuilder stem = new BytesRefBuilder();

  /** Tag bytes. */
  final BytesRefBuilder tag = new BytesRefBuilder();

  WordData(Charset charset) {
    this.charset = charset;
  }

  /** Creates a detached row. Used for tests and copies. */
  WordData(String word, String stem, String tag, Charset charset) {
    this(charset);
    this.word = word;
    if (word != null) {
      this.wordBytes = new BytesRef(word.getBytes(charset));
    }
    if (stem != null) {
      this.stem.copyBytes(new BytesRef(stem.getBytes(charset)));
    }
    if (tag != null) {
      this.tag.copyBytes(new BytesRef(tag.getBytes(charset)));
    }
  }

  /**
   * Copies the stem bytes into <code>target</code>.
   *
   * @return A view over <code>target</code>'s bytes.
   */
  public BytesRef getStemBytes(BytesRefBuilder target) {
    target.copyBytes(stem.get());
    return target.get();
  }

  /**
   * Copies the tag bytes into <code>target</code>.
   *
   * @return A view over <code>target</code>'s bytes.
   */
  public BytesRef getTagBytes(BytesRefBuilder target) {
    target.copyBytes(tag.get());
    return target.get();
  }

  /**
   * Copies the inflected word's bytes into <code>target</code>.
   *
   * @return A view over <code>target</code>'s bytes.
   */
  public BytesRef getWordBytes(BytesRefBuilder target) {
    target.clear();
    if (wordBytes != null) {
      target.copyBytes(wordBytes);
    }
    return target.get();
  }

  /** @return The tag, or <code>null</code> if the entry has no tag. */
  public CharSequence getTag() {
    return decode(tag);
  }

  /** @return The stem, or <code>null</code> if the entry has no stem. */
  public CharSequence getStem() {
    return decode(stem);
  }

  /** @return The inflected word this row was found for. */
  public CharSequence getWord() {
    return word;
  }

  private CharSequence decode(BytesRefBuilder bytes) {
    if (bytes.length() == 0) {
      return null;
    }
    return new String(bytes.bytes(), 0, bytes.length(), charset);
  }

  /** Resets this row for a new match of <code>word</code>. */
  void update(BytesRef wordBytes, CharSequence word) {
    this.stem.clear();
    this.tag.clear();
    this.wordBytes = wordBytes;
    this.word = word;
  }

  @Override
  public boolean equals(Object obj) {
    throw new UnsupportedOperationException(COLLECTIONS_ERROR_MESSAGE);
  }

  @Override
  public int hashCode() {
    throw new UnsupportedOperationException(COLLECTIONS_ERROR_MESSAGE);
  }

  @Override
  public String toString() {
    return "WordData[" + getWord() + "," + getStem() + "," + getTag() + "]";
  }

  /** Returns a deep copy of this row, independent of the lookup that produced it. */
  @Override
  public WordData clone() {
    final WordData clone = new WordData(charset);
    clone.word = word == null ? null : word.toString();
    clone.wordBytes = wordBytes == null ? null : BytesRef.deepCopyOf(wordBytes);
    clone.stem.copyBytes(stem.get());
    clone.tag.copyBytes(tag.get());
    return clone;
  }
}
