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

import java.nio.charset.CharsetEncoder;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.lexicon.util.fsa.ByteSequenceIterator;
import org.lexicon.util.fsa.FSA;
import org.lexicon.util.fsa.FSAMatcher;
import org.lexicon.util.fsa.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up inflected words in a {@link Dictionary} and returns their stems and tags.
 *
 * <p>Entries are stored in the automaton as <code>inflected SEP encoded-stem SEP tag</code>. A
 * lookup matches the inflected form followed by the separator and then enumerates everything
 * reachable from there, decoding each stem relative to the inflected form.
 *
 * <p>Instances are not thread safe: the returned list and its {@link WordData} rows are reused by
 * the next lookup. Create one instance per thread; the underlying {@link Dictionary} may be
 * shared.
 */
public final class DictionaryLookup implements Stemmer, Iterable<WordData> {
  private static final Logger log = LoggerFactory.getLogger(DictionaryLookup.class);

  /** Initial size of the row pool. */
  private static final int INITIAL_FORMS = 2;

  /** The dictionary this lookup works on. */
  private final Dictionary dictionary;

  /** The automaton of {@link #dictionary}. */
  private final FSA fsa;

  /** Matches words against {@link #fsa}. */
  private final FSAMatcher matcher;

  /** Enumerates entries following a matched inflected form. */
  private final ByteSequenceIterator finalStatesIterator;

  /** The root node of {@link #fsa}. */
  private final int rootNode;

  /** Scratch match result. */
  private final MatchResult matchResult = new MatchResult();

  /** Pool of rows, reused between lookups. */
  private WordData[] forms;

  /** Read-only view over the rows of the last lookup. */
  private final ArrayViewList<WordData> formsList;

  /** Encoder for the dictionary's charset, reporting unmappable input. */
  private final CharsetEncoder encoder;

  /** Bytes of the word being looked up. */
  private final BytesRefBuilder wordBuffer = new BytesRefBuilder();

  /** View over the encoded part of an entry, used to decode stems. */
  private final BytesRef encodedScratch = new BytesRef();

  /** The separator as a character, rejected in input words. */
  private final char separatorChar;

  /** Decodes stems relative to the inflected form. */
  private final SequenceEncoder sequenceEncoder;

  /**
   * Creates a lookup over the given dictionary.
   *
   * @throws IllegalArgumentException if the dictionary's encoder or separator is not usable.
   */
  public DictionaryLookup(Dictionary dictionary) {
    this.dictionary = dictionary;
    this.fsa = dictionary.getFSA();
    this.matcher = new FSAMatcher(fsa);
    this.rootNode = fsa.getRootNode();
    this.finalStatesIterator = new ByteSequenceIterator(fsa, rootNode);

    final DictionaryMetadata metadata = dictionary.getMetadata();
    this.separatorChar = metadata.getSeparatorAsChar();
    this.encoder = metadata.getEncoder();
    this.sequenceEncoder = metadata.getSequenceEncoderType().get();

    this.forms = new WordData[INITIAL_FORMS];
    for (int i = 0; i < forms.length; i++) {
      forms[i] = new WordData(metadata.getCharset());
    }
    this.formsList = new ArrayViewList<>(forms, 0, 0);
  }

  /**
   * Searches the automaton for a symbol sequence equal to <code>word</code>, followed by a
   * separator. The result is a stem (decoded with the dictionary's stem encoder)
   * and an optional tag.
   *
   * <p>The returned list and its rows are reused by the next call to this method.
   */
  @Override
  public List<WordData> lookup(CharSequence word) {
    final DictionaryMetadata metadata = dictionary.getMetadata();
    final byte separator = metadata.getSeparator();
    final int prefixBytes = sequenceEncoder.prefixBytes();

    formsList.wrap(forms, 0, 0);

    // Reject words containing the separator; they cannot be distinguished from stored fields.
    if (containsSeparator(word)) {
      return formsList;
    }

    final Map<String, String> inputConversion = metadata.getInputConversionPairs();
    if (!inputConversion.isEmpty()) {
      word = applyReplacements(word, inputConversion);
      if (containsSeparator(word)) {
        return formsList;
      }
    }

    final BytesRef wordBytes;
    try {
      wordBytes = ByteSequences.charsToBytes(encoder, word, wordBuffer);
    } catch (UnmappableInputException e) {
      // Words that cannot be encoded cannot be in the dictionary.
      return formsList;
    }

    final MatchResult match =
        matcher.match(matchResult, wordBytes.bytes, wordBytes.offset, wordBytes.length, rootNode);
    if (match.kind == MatchResult.SEQUENCE_IS_A_PREFIX) {
      // The word is a prefix of at least one entry; look for the separator right after it.
      final int arc = fsa.getArc(match.node, separator);

      // The separator must be followed by encoded stems (a final separator arc has nothing after).
      if (arc != 0 && !fsa.isArcFinal(arc)) {
        int formsCount = 0;
        finalStatesIterator.restartFrom(fsa.getEndNode(arc));
        while (finalStatesIterator.hasNext()) {
          final BytesRef bb = finalStatesIterator.next();
          final byte[] ba = bb.bytes;
          final int bbSize = bb.length;

          if (formsCount >= forms.length) {
            final int oldLength = forms.length;
            forms = ArrayUtil.grow(forms, formsCount + 1);
            for (int k = oldLength; k < forms.length; k++) {
              forms[k] = new WordData(metadata.getCharset());
            }
          }

          final WordData wordData = forms[formsCount++];
          final Map<String, String> outputConversion = metadata.getOutputConversionPairs();
          if (outputConversion.isEmpty()) {
            wordData.update(wordBytes, word);
          } else {
            wordData.update(wordBytes, applyReplacements(word, outputConversion));
          }

          // Find the separator after the stem, skipping the encoder's instruction bytes.
          assert prefixBytes <= bbSize : sequenceEncoder.getClass() + " >? " + bbSize;
          int sepPos;
          for (sepPos = prefixBytes; sepPos < bbSize; sepPos++) {
            if (ba[bb.offset + sepPos] == separator) {
              break;
            }
          }

          // Decode the stem into the stem buffer.
          encodedScratch.bytes = ba;
          encodedScratch.offset = bb.offset;
          encodedScratch.length = sepPos;
          sequenceEncoder.decode(wordData.stem, wordBytes, encodedScratch);

          // Skip the separator; the rest (if any) is the tag.
          sepPos++;
          final int tagSize = bbSize - sepPos;
          if (tagSize > 0) {
            wordData.tag.copyBytes(ba, bb.offset + sepPos, tagSize);
          }
        }

        formsList.wrap(forms, 0, formsCount);
      }
    } else if (match.kind == MatchResult.EXACT_MATCH && log.isDebugEnabled()) {
      // The word is stored without a separator. This is not a valid dictionary entry.
      log.debug("Entry without separator matched for: {}", word);
    }

    return formsList;
  }

  private boolean containsSeparator(CharSequence word) {
    for (int i = 0; i < word.length(); i++) {
      if (word.charAt(i) == separatorChar) {
        return true;
      }
    }
    return false;
  }

  /**
   * Applies conversion pairs to a word, in the map's iteration order. All non-overlapping
   * occurrences of each key are replaced, left to right; replaced text is not scanned again for the
   * same key.
   */
  public static String applyReplacements(CharSequence word, Map<String, String> replacements) {
    final StringBuilder sb = new StringBuilder(word);
    for (final Map.Entry<String, String> e : replacements.entrySet()) {
      final String key = e.getKey();
      final String value = e.getValue();
      int index = sb.indexOf(key);
      while (index != -1) {
        sb.replace(index, index + key.length(), value);
        index = sb.indexOf(key, index + value.length());
      }
    }
    return sb.toString();
  }

  /**
   * Returns an iterator over all entries of the dictionary, with decoded stems. Rows are reused
   * between calls to {@link Iterator#next()}.
   */
  @Override
  public Iterator<WordData> iterator() {
    return new DictionaryIterator(dictionary, true);
  }

  /** Returns the dictionary this lookup works on. */
  public Dictionary getDictionary() {
    return dictionary;
  }

  /** Returns the separator character of the dictionary. */
  public char getSeparatorChar() {
    return separatorChar;
  }

  /** Returns the current capacity of the row pool. */
  int formsCapacity() {
    return forms.length;
  }

  @Override
  public String toString() {
    return "DictionaryLookup(" + dictionary + ")";
  }
}
