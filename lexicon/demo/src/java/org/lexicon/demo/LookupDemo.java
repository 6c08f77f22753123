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
package org.lexicon.demo;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.lexicon.stemming.Dictionary;
import org.lexicon.stemming.DictionaryLookup;
import org.lexicon.stemming.WordData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up words in a dictionary and prints one line per result: <code>word TAB stem TAB tag
 * </code>, or <code>word TAB -</code> for unknown words.
 *
 * <p>Usage: <code>LookupDemo dictionary.dict [word ...]</code>. Words are read from standard input,
 * one per line, when none are given.
 */
public class LookupDemo {
  private static final Logger log = LoggerFactory.getLogger(LookupDemo.class);

  private LookupDemo() {}

  public static void main(String[] args) throws IOException {
    if (args.length == 0) {
      System.err.println("Usage: LookupDemo <dictionary.dict> [word ...]");
      System.exit(1);
    }

    final Path dictPath = Paths.get(args[0]);
    final Dictionary dictionary = Dictionary.read(dictPath);
    log.info("Loaded dictionary from {}: {}", dictPath, dictionary);

    final List<String> words;
    if (args.length > 1) {
      words = Arrays.asList(args).subList(1, args.length);
    } else {
      words = readLines(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    final int unknown = run(new DictionaryLookup(dictionary), words, System.out);
    log.info("Looked up {} words, {} unknown.", words.size(), unknown);
  }

  /**
   * Looks up each word and prints the results.
   *
   * @return The number of words not found in the dictionary.
   */
  public static int run(DictionaryLookup lookup, Iterable<String> words, PrintStream out) {
    int unknown = 0;
    for (String word : words) {
      final List<WordData> rows = lookup.lookup(word);
      if (rows.isEmpty()) {
        out.println(word + "\t-");
        unknown++;
        continue;
      }
      for (WordData row : rows) {
        out.println(row.getWord() + "\t" + orEmpty(row.getStem()) + "\t" + orEmpty(row.getTag()));
      }
    }
    out.flush();
    return unknown;
  }

  private static CharSequence orEmpty(CharSequence value) {
    return value == null ? "" : value;
  }

  private static List<String> readLines(BufferedReader reader) throws IOException {
    final List<String> lines = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      line = line.trim();
      if (!line.isEmpty()) {
        lines.add(line);
      }
    }
    return lines;
  }
}
