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
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Attributes of a dictionary, stored in its metadata (<code>.info</code>) file. Each attribute has
 * a property name and parses and validates its own values.
 */
public enum DictionaryAttribute {
  /** Logical fields separator inside the automaton. */
  SEPARATOR("fsa.dict.separator") {
    @Override
    public Character fromString(String separator) {
      if (separator == null || separator.length() != 1) {
        throw new IllegalArgumentException(
            "Attribute " + propertyName + " must be a single character: " + separator);
      }

      final char charValue = separator.charAt(0);
      if (Character.isHighSurrogate(charValue) || Character.isLowSurrogate(charValue)) {
        throw new IllegalArgumentException(
            "Field separator character cannot be part of a surrogate pair: " + separator);
      }

      return charValue;
    }
  },

  /** Character encoding used for strings inside the automaton. */
  ENCODING("fsa.dict.encoding") {
    @Override
    public Charset fromString(String charsetName) {
      try {
        return Charset.forName(charsetName);
      } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
        throw new IllegalArgumentException(
            "Attribute " + propertyName + " has an unsupported charset: " + charsetName, e);
      }
    }
  },

  /** If the automaton stores frequencies of entries. */
  FREQUENCY_INCLUDED("fsa.dict.frequency-included") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to ignore words containing digits. */
  IGNORE_NUMBERS("fsa.dict.speller.ignore-numbers") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to ignore punctuation. */
  IGNORE_PUNCTUATION("fsa.dict.speller.ignore-punctuation") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to ignore CamelCase words. */
  IGNORE_CAMEL_CASE("fsa.dict.speller.ignore-camel-case") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to ignore ALL UPPERCASE words. */
  IGNORE_ALL_UPPERCASE("fsa.dict.speller.ignore-all-uppercase") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to ignore diacritics. */
  IGNORE_DIACRITICS("fsa.dict.speller.ignore-diacritics") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to treat upper and lower case as equal. */
  CONVERT_CASE("fsa.dict.speller.convert-case") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** If the spelling dictionary is supposed to split run-on words. */
  RUN_ON_WORDS("fsa.dict.speller.runon-words") {
    @Override
    public Boolean fromString(String value) {
      return booleanValue(value);
    }
  },

  /** Locale associated with the dictionary. */
  LOCALE("fsa.dict.speller.locale") {
    @Override
    public Locale fromString(String value) {
      final String[] parts = value.trim().split("[_-]", 3);
      switch (parts.length) {
        case 1:
          return new Locale(parts[0]);
        case 2:
          return new Locale(parts[0], parts[1]);
        default:
          return new Locale(parts[0], parts[1], parts[2]);
      }
    }
  },

  /** Replacement pairs for non-obvious candidate search in a speller dictionary. */
  REPLACEMENT_PAIRS("fsa.dict.speller.replacement-pairs") {
    @Override
    public Map<String, List<String>> fromString(String value) {
      final Map<String, List<String>> replacementPairs = new LinkedHashMap<>();
      for (String stringPair : splitPairs(value)) {
        final String[] twoStrings = splitPair(this, stringPair);
        replacementPairs.computeIfAbsent(twoStrings[0], k -> new ArrayList<>()).add(twoStrings[1]);
      }
      return replacementPairs;
    }
  },

  /** Equivalent characters (treated similarly as equivalent chars with and without diacritics). */
  EQUIVALENT_CHARS("fsa.dict.speller.equivalent-chars") {
    @Override
    public Map<Character, List<Character>> fromString(String value) {
      final Map<Character, List<Character>> equivalentCharacters = new LinkedHashMap<>();
      for (String stringPair : splitPairs(value)) {
        final String[] twoChars = splitPair(this, stringPair);
        if (twoChars[0].length() != 1 || twoChars[1].length() != 1) {
          throw new IllegalArgumentException(
              "Attribute " + propertyName + " must contain pairs of single characters: "
                  + stringPair);
        }
        equivalentCharacters
            .computeIfAbsent(twoChars[0].charAt(0), k -> new ArrayList<>())
            .add(twoChars[1].charAt(0));
      }
      return equivalentCharacters;
    }
  },

  /** Dictionary license attribute. */
  LICENSE("fsa.dict.license"),

  /** Dictionary author. */
  AUTHOR("fsa.dict.author"),

  /** Dictionary creation date. */
  CREATION_DATE("fsa.dict.created"),

  /** Stem encoder used to compress stems in the automaton. */
  ENCODER("fsa.dict.encoder") {
    @Override
    public EncoderType fromString(String value) {
      try {
        return EncoderType.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "Attribute " + propertyName + " must be one of "
                + Arrays.toString(EncoderType.values())
                + ": "
                + value,
            e);
      }
    }
  },

  /** Input conversion pairs, applied to words before they are looked up. */
  INPUT_CONVERSION("fsa.dict.input-conversion") {
    @Override
    public Map<String, String> fromString(String value) {
      return conversionPairs(this, value);
    }
  },

  /** Output conversion pairs, applied to words returned by a lookup. */
  OUTPUT_CONVERSION("fsa.dict.output-conversion") {
    @Override
    public Map<String, String> fromString(String value) {
      return conversionPairs(this, value);
    }
  };

  /** Property name of this attribute in the metadata file. */
  public final String propertyName;

  private static final Map<String, DictionaryAttribute> attrsByPropertyName;

  static {
    final Map<String, DictionaryAttribute> byName = new HashMap<>();
    for (DictionaryAttribute attr : DictionaryAttribute.values()) {
      if (byName.put(attr.propertyName, attr) != null) {
        throw new RuntimeException("Duplicate property key for: " + attr);
      }
    }
    attrsByPropertyName = Collections.unmodifiableMap(byName);
  }

  DictionaryAttribute(String propertyName) {
    this.propertyName = propertyName;
  }

  /**
   * Converts a string value of this attribute to its typed representation.
   *
   * @throws IllegalArgumentException if the value is not valid for this attribute.
   */
  public Object fromString(String value) {
    return value;
  }

  /**
   * Returns the attribute for a given property name.
   *
   * @throws IllegalArgumentException if no attribute has this property name.
   */
  public static DictionaryAttribute fromPropertyName(String propertyName) {
    final DictionaryAttribute value = attrsByPropertyName.get(propertyName);
    if (value == null) {
      throw new IllegalArgumentException("No attribute for property: " + propertyName);
    }
    return value;
  }

  private static Boolean booleanValue(String value) {
    final String v = value.trim().toLowerCase(Locale.ROOT);
    switch (v) {
      case "true":
      case "yes":
      case "on":
        return Boolean.TRUE;
      case "false":
      case "no":
      case "off":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException("Not a boolean value: " + value);
    }
  }

  private static String[] splitPairs(String value) {
    final String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return new String[0];
    }
    return trimmed.split(",\\s*");
  }

  private static String[] splitPair(DictionaryAttribute attr, String stringPair) {
    final String[] twoStrings = stringPair.trim().split(" ");
    if (twoStrings.length != 2) {
      throw new IllegalArgumentException(
          "Attribute " + attr.propertyName + " is not in the format: 'a b, c d': " + stringPair);
    }
    return twoStrings;
  }

  private static Map<String, String> conversionPairs(DictionaryAttribute attr, String value) {
    final Map<String, String> conversionPairs = new LinkedHashMap<>();
    for (String stringPair : splitPairs(value)) {
      final String[] twoStrings = splitPair(attr, stringPair);
      if (conversionPairs.containsKey(twoStrings[0])) {
        throw new IllegalArgumentException(
            "Attribute " + attr.propertyName + " contains a duplicate key: " + twoStrings[0]);
      }
      conversionPairs.put(twoStrings[0], twoStrings[1]);
    }
    return conversionPairs;
  }
}
