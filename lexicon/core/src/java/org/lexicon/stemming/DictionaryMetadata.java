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

import static org.lexicon.stemming.DictionaryAttribute.CONVERT_CASE;
import static org.lexicon.stemming.DictionaryAttribute.ENCODER;
import static org.lexicon.stemming.DictionaryAttribute.ENCODING;
import static org.lexicon.stemming.DictionaryAttribute.EQUIVALENT_CHARS;
import static org.lexicon.stemming.DictionaryAttribute.FREQUENCY_INCLUDED;
import static org.lexicon.stemming.DictionaryAttribute.IGNORE_ALL_UPPERCASE;
import static org.lexicon.stemming.DictionaryAttribute.IGNORE_CAMEL_CASE;
import static org.lexicon.stemming.DictionaryAttribute.IGNORE_DIACRITICS;
import static org.lexicon.stemming.DictionaryAttribute.IGNORE_NUMBERS;
import static org.lexicon.stemming.DictionaryAttribute.IGNORE_PUNCTUATION;
import static org.lexicon.stemming.DictionaryAttribute.INPUT_CONVERSION;
import static org.lexicon.stemming.DictionaryAttribute.LOCALE;
import static org.lexicon.stemming.DictionaryAttribute.OUTPUT_CONVERSION;
import static org.lexicon.stemming.DictionaryAttribute.REPLACEMENT_PAIRS;
import static org.lexicon.stemming.DictionaryAttribute.RUN_ON_WORDS;
import static org.lexicon.stemming.DictionaryAttribute.SEPARATOR;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Description of attributes, their types and default values, read from a dictionary's metadata
 * (<code>.info</code>) file.
 *
 * @see DictionaryMetadataBuilder
 */
public final class DictionaryMetadata {
  /** Extension of metadata files. */
  public static final String METADATA_FILE_EXTENSION = "info";

  /** Default attribute values. */
  private static final Map<DictionaryAttribute, String> DEFAULT_ATTRIBUTES;

  /** Required attributes. */
  private static final EnumSet<DictionaryAttribute> REQUIRED_ATTRIBUTES =
      EnumSet.of(SEPARATOR, ENCODER, ENCODING);

  static {
    final Map<DictionaryAttribute, String> defaults = new EnumMap<>(DictionaryAttribute.class);
    defaults.put(FREQUENCY_INCLUDED, "false");
    defaults.put(IGNORE_PUNCTUATION, "true");
    defaults.put(IGNORE_NUMBERS, "true");
    defaults.put(IGNORE_CAMEL_CASE, "true");
    defaults.put(IGNORE_ALL_UPPERCASE, "true");
    defaults.put(IGNORE_DIACRITICS, "true");
    defaults.put(CONVERT_CASE, "true");
    defaults.put(RUN_ON_WORDS, "true");
    DEFAULT_ATTRIBUTES = Collections.unmodifiableMap(defaults);
  }

  /** Legacy keys replaced by {@link DictionaryAttribute#ENCODER}. */
  private static final String USES_SUFFIXES = "fsa.dict.uses-suffixes";

  private static final String USES_PREFIXES = "fsa.dict.uses-prefixes";
  private static final String USES_INFIXES = "fsa.dict.uses-infixes";

  /** All attributes, as strings. */
  private final Map<DictionaryAttribute, String> attributes;

  /** Boolean attributes, parsed. */
  private final Map<DictionaryAttribute, Boolean> boolAttributes;

  private final char separatorChar;
  private final byte separator;
  private final Charset charset;
  private final Locale locale;
  private final EncoderType encoderType;
  private final Map<String, String> inputConversion;
  private final Map<String, String> outputConversion;
  private final Map<String, List<String>> replacementPairs;
  private final Map<Character, List<Character>> equivalentChars;

  /**
   * Creates metadata from a map of string attribute values. Missing optional attributes take their
   * default values.
   *
   * @throws IllegalArgumentException if a required attribute is missing or a value is invalid.
   */
  public DictionaryMetadata(Map<DictionaryAttribute, String> userAttributes) {
    final EnumMap<DictionaryAttribute, String> attrs = new EnumMap<>(DictionaryAttribute.class);
    attrs.putAll(DEFAULT_ATTRIBUTES);
    attrs.putAll(userAttributes);

    final EnumSet<DictionaryAttribute> requiredAttributes = EnumSet.copyOf(REQUIRED_ATTRIBUTES);
    requiredAttributes.removeAll(attrs.keySet());
    if (!requiredAttributes.isEmpty()) {
      throw new IllegalArgumentException(
          "At least one of the required attributes was not provided: " + requiredAttributes);
    }

    final EnumMap<DictionaryAttribute, Object> values = new EnumMap<>(DictionaryAttribute.class);
    final EnumMap<DictionaryAttribute, Boolean> bools = new EnumMap<>(DictionaryAttribute.class);
    for (Map.Entry<DictionaryAttribute, String> e : attrs.entrySet()) {
      final DictionaryAttribute key = e.getKey();
      final Object value = key.fromString(e.getValue());
      values.put(key, value);
      if (value instanceof Boolean) {
        bools.put(key, (Boolean) value);
      }
    }

    this.attributes = Collections.unmodifiableMap(attrs);
    this.boolAttributes = Collections.unmodifiableMap(bools);
    this.charset = (Charset) values.get(ENCODING);
    this.encoderType = (EncoderType) values.get(ENCODER);
    this.separatorChar = (Character) values.get(SEPARATOR);
    this.separator = encodeSeparator(separatorChar, newEncoder(charset));
    this.locale = values.containsKey(LOCALE) ? (Locale) values.get(LOCALE) : Locale.ROOT;
    this.inputConversion = typedOrEmpty(values, INPUT_CONVERSION);
    this.outputConversion = typedOrEmpty(values, OUTPUT_CONVERSION);
    this.replacementPairs = typedOrEmpty(values, REPLACEMENT_PAIRS);
    this.equivalentChars = typedOrEmpty(values, EQUIVALENT_CHARS);
  }

  @SuppressWarnings("unchecked")
  private static <K, V> Map<K, V> typedOrEmpty(
      Map<DictionaryAttribute, Object> values, DictionaryAttribute attr) {
    final Object value = values.get(attr);
    if (value == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap((Map<K, V>) value);
  }

  private static byte encodeSeparator(char separatorChar, CharsetEncoder encoder) {
    final ByteBuffer encoded;
    try {
      encoded = encoder.encode(CharBuffer.wrap(new char[] {separatorChar}));
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException(
          "Separator character cannot be encoded in "
              + encoder.charset().name()
              + ": "
              + separatorChar,
          e);
    }
    if (encoded.remaining() != 1) {
      throw new IllegalArgumentException(
          "Separator character must be a single byte in "
              + encoder.charset().name()
              + ", got "
              + encoded.remaining()
              + " bytes for: "
              + separatorChar);
    }
    return encoded.get(0);
  }

  private static CharsetEncoder newEncoder(Charset charset) {
    return charset
        .newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
  }

  /** Returns all attributes (including defaults) as strings. */
  public Map<DictionaryAttribute, String> getAttributes() {
    return attributes;
  }

  public String getEncoding() {
    return attributes.get(ENCODING);
  }

  /** Returns the separator byte, in the dictionary's encoding. */
  public byte getSeparator() {
    return separator;
  }

  /** Returns the separator as a character. */
  public char getSeparatorAsChar() {
    return separatorChar;
  }

  public Locale getLocale() {
    return locale;
  }

  public Map<String, String> getInputConversionPairs() {
    return inputConversion;
  }

  public Map<String, String> getOutputConversionPairs() {
    return outputConversion;
  }

  public Map<String, List<String>> getReplacementPairs() {
    return replacementPairs;
  }

  public Map<Character, List<Character>> getEquivalentChars() {
    return equivalentChars;
  }

  public boolean isFrequencyIncluded() {
    return boolAttributes.get(FREQUENCY_INCLUDED);
  }

  public boolean isIgnoringPunctuation() {
    return boolAttributes.get(IGNORE_PUNCTUATION);
  }

  public boolean isIgnoringNumbers() {
    return boolAttributes.get(IGNORE_NUMBERS);
  }

  public boolean isIgnoringCamelCase() {
    return boolAttributes.get(IGNORE_CAMEL_CASE);
  }

  public boolean isIgnoringAllUppercase() {
    return boolAttributes.get(IGNORE_ALL_UPPERCASE);
  }

  public boolean isIgnoringDiacritics() {
    return boolAttributes.get(IGNORE_DIACRITICS);
  }

  public boolean isConvertingCase() {
    return boolAttributes.get(CONVERT_CASE);
  }

  public boolean isSupportingRunOnWords() {
    return boolAttributes.get(RUN_ON_WORDS);
  }

  /** Returns the dictionary's charset. */
  public Charset getCharset() {
    return charset;
  }

  /** Returns a new encoder for the dictionary's charset that reports unmappable input. */
  public CharsetEncoder getEncoder() {
    return newEncoder(charset);
  }

  /** Returns a new decoder for the dictionary's charset that reports malformed input. */
  public CharsetDecoder getDecoder() {
    return charset
        .newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
  }

  /** Returns the type of stem encoder used by the dictionary. */
  public EncoderType getSequenceEncoderType() {
    return encoderType;
  }

  /** Returns a new builder for metadata. */
  public static DictionaryMetadataBuilder builder() {
    return new DictionaryMetadataBuilder();
  }

  /**
   * Returns the expected name of the metadata file, given the name of the dictionary file. The
   * dictionary file's extension (if any) is replaced with {@link #METADATA_FILE_EXTENSION}.
   */
  public static String getExpectedMetadataFileName(String dictionaryFile) {
    final int dotIndex = dictionaryFile.lastIndexOf('.');
    final String featuresName;
    if (dotIndex >= 0) {
      featuresName = dictionaryFile.substring(0, dotIndex) + "." + METADATA_FILE_EXTENSION;
    } else {
      featuresName = dictionaryFile + "." + METADATA_FILE_EXTENSION;
    }
    return featuresName;
  }

  /** Returns the expected location of a metadata file, next to the dictionary file. */
  public static Path getExpectedMetadataLocation(Path dictionary) {
    return dictionary.resolveSibling(
        getExpectedMetadataFileName(dictionary.getFileName().toString()));
  }

  /**
   * Reads metadata from a properties stream (UTF-8). The stream is not closed.
   *
   * @throws IOException if the stream cannot be read or uses the legacy encoder keys.
   * @throws IllegalArgumentException if an attribute is unknown, missing or invalid.
   */
  public static DictionaryMetadata read(InputStream metadataStream) throws IOException {
    final Properties properties = new Properties();
    properties.load(new InputStreamReader(metadataStream, StandardCharsets.UTF_8));

    if (!properties.containsKey(ENCODER.propertyName)) {
      final boolean hasDeprecated =
          properties.containsKey(USES_SUFFIXES)
              || properties.containsKey(USES_INFIXES)
              || properties.containsKey(USES_PREFIXES);

      if (hasDeprecated) {
        throw new IOException(
            "Deprecated encoder keys in metadata. Use "
                + ENCODER.propertyName
                + "="
                + guessEncoderType(properties));
      } else {
        throw new IOException(
            "Use an explicit "
                + ENCODER.propertyName
                + "=... metadata key, one of: "
                + Arrays.toString(EncoderType.values()));
      }
    }

    final Map<DictionaryAttribute, String> map = new EnumMap<>(DictionaryAttribute.class);
    for (String key : properties.stringPropertyNames()) {
      map.put(DictionaryAttribute.fromPropertyName(key), properties.getProperty(key));
    }
    return new DictionaryMetadata(map);
  }

  private static EncoderType guessEncoderType(Properties properties) {
    if (Boolean.parseBoolean(properties.getProperty(USES_INFIXES, "false"))) {
      return EncoderType.INFIX;
    } else if (Boolean.parseBoolean(properties.getProperty(USES_PREFIXES, "false"))) {
      return EncoderType.PREFIX;
    } else if (Boolean.parseBoolean(properties.getProperty(USES_SUFFIXES, "true"))) {
      return EncoderType.SUFFIX;
    } else {
      return EncoderType.NONE;
    }
  }

  /** Writes all attributes as a properties file. The writer is flushed but not closed. */
  public void write(Writer writer) throws IOException {
    final Properties properties = new Properties();
    for (Map.Entry<DictionaryAttribute, String> e : getAttributes().entrySet()) {
      properties.setProperty(e.getKey().propertyName, e.getValue());
    }
    properties.store(writer, "Dictionary metadata");
  }
}
