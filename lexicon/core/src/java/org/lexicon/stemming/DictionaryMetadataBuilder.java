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
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Helper class to build {@link DictionaryMetadata} instances. */
public final class DictionaryMetadataBuilder {
  private final EnumMap<DictionaryAttribute, String> attrs =
      new EnumMap<>(DictionaryAttribute.class);

  public DictionaryMetadataBuilder separator(char c) {
    this.attrs.put(DictionaryAttribute.SEPARATOR, Character.toString(c));
    return this;
  }

  public DictionaryMetadataBuilder encoding(Charset charset) {
    return encoding(charset.name());
  }

  public DictionaryMetadataBuilder encoding(String charsetName) {
    this.attrs.put(DictionaryAttribute.ENCODING, charsetName);
    return this;
  }

  public DictionaryMetadataBuilder frequencyIncluded() {
    return frequencyIncluded(true);
  }

  public DictionaryMetadataBuilder frequencyIncluded(boolean v) {
    this.attrs.put(DictionaryAttribute.FREQUENCY_INCLUDED, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder ignorePunctuation() {
    return ignorePunctuation(true);
  }

  public DictionaryMetadataBuilder ignorePunctuation(boolean v) {
    this.attrs.put(DictionaryAttribute.IGNORE_PUNCTUATION, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder ignoreNumbers() {
    return ignoreNumbers(true);
  }

  public DictionaryMetadataBuilder ignoreNumbers(boolean v) {
    this.attrs.put(DictionaryAttribute.IGNORE_NUMBERS, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder ignoreCamelCase() {
    return ignoreCamelCase(true);
  }

  public DictionaryMetadataBuilder ignoreCamelCase(boolean v) {
    this.attrs.put(DictionaryAttribute.IGNORE_CAMEL_CASE, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder ignoreAllUppercase() {
    return ignoreAllUppercase(true);
  }

  public DictionaryMetadataBuilder ignoreAllUppercase(boolean v) {
    this.attrs.put(DictionaryAttribute.IGNORE_ALL_UPPERCASE, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder ignoreDiacritics() {
    return ignoreDiacritics(true);
  }

  public DictionaryMetadataBuilder ignoreDiacritics(boolean v) {
    this.attrs.put(DictionaryAttribute.IGNORE_DIACRITICS, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder convertCase() {
    return convertCase(true);
  }

  public DictionaryMetadataBuilder convertCase(boolean v) {
    this.attrs.put(DictionaryAttribute.CONVERT_CASE, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder supportRunOnWords() {
    return supportRunOnWords(true);
  }

  public DictionaryMetadataBuilder supportRunOnWords(boolean v) {
    this.attrs.put(DictionaryAttribute.RUN_ON_WORDS, Boolean.toString(v));
    return this;
  }

  public DictionaryMetadataBuilder encoder(EncoderType type) {
    this.attrs.put(DictionaryAttribute.ENCODER, type.name());
    return this;
  }

  public DictionaryMetadataBuilder locale(Locale locale) {
    return locale(locale.toString());
  }

  public DictionaryMetadataBuilder locale(String localeName) {
    this.attrs.put(DictionaryAttribute.LOCALE, localeName);
    return this;
  }

  public DictionaryMetadataBuilder withReplacementPairs(
      Map<String, List<String>> replacementPairs) {
    final StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, List<String>> e : replacementPairs.entrySet()) {
      for (String value : e.getValue()) {
        appendPair(builder, e.getKey(), value);
      }
    }
    this.attrs.put(DictionaryAttribute.REPLACEMENT_PAIRS, builder.toString());
    return this;
  }

  public DictionaryMetadataBuilder withEquivalentChars(
      Map<Character, List<Character>> equivalentChars) {
    final StringBuilder builder = new StringBuilder();
    for (Map.Entry<Character, List<Character>> e : equivalentChars.entrySet()) {
      for (Character value : e.getValue()) {
        appendPair(builder, e.getKey().toString(), value.toString());
      }
    }
    this.attrs.put(DictionaryAttribute.EQUIVALENT_CHARS, builder.toString());
    return this;
  }

  public DictionaryMetadataBuilder withInputConversionPairs(Map<String, String> conversionPairs) {
    this.attrs.put(DictionaryAttribute.INPUT_CONVERSION, toPairs(conversionPairs));
    return this;
  }

  public DictionaryMetadataBuilder withOutputConversionPairs(Map<String, String> conversionPairs) {
    this.attrs.put(DictionaryAttribute.OUTPUT_CONVERSION, toPairs(conversionPairs));
    return this;
  }

  public DictionaryMetadataBuilder author(String author) {
    this.attrs.put(DictionaryAttribute.AUTHOR, author);
    return this;
  }

  public DictionaryMetadataBuilder creationDate(String creationDate) {
    this.attrs.put(DictionaryAttribute.CREATION_DATE, creationDate);
    return this;
  }

  public DictionaryMetadataBuilder license(String license) {
    this.attrs.put(DictionaryAttribute.LICENSE, license);
    return this;
  }

  /**
   * Creates the metadata.
   *
   * @throws IllegalArgumentException if a required attribute is missing or a value is invalid.
   */
  public DictionaryMetadata build() {
    return new DictionaryMetadata(attrs);
  }

  /** Returns a copy of the attributes collected so far. */
  public EnumMap<DictionaryAttribute, String> toMap() {
    return new EnumMap<>(attrs);
  }

  private static String toPairs(Map<String, String> conversionPairs) {
    final StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, String> e : conversionPairs.entrySet()) {
      appendPair(builder, e.getKey(), e.getValue());
    }
    return builder.toString();
  }

  private static void appendPair(StringBuilder builder, String key, String value) {
    if (builder.length() > 0) {
      builder.append(", ");
    }
    builder.append(key).append(' ').append(value);
  }
}
