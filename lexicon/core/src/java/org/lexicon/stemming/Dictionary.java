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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import org.lexicon.util.fsa.FSA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A dictionary combines an {@link FSA} with the {@link DictionaryMetadata} describing how its
 * entries are encoded.
 */
public final class Dictionary {
  private static final Logger log = LoggerFactory.getLogger(Dictionary.class);

  private final FSA fsa;

  private final DictionaryMetadata metadata;

  public Dictionary(FSA fsa, DictionaryMetadata metadata) {
    this.fsa = fsa;
    this.metadata = metadata;
  }

  /** Returns the automaton with all dictionary entries. */
  public FSA getFSA() {
    return fsa;
  }

  /** Returns the metadata describing the automaton's entries. */
  public DictionaryMetadata getMetadata() {
    return metadata;
  }

  /**
   * Reads a dictionary from a file. The metadata is expected next to it, as returned by {@link
   * DictionaryMetadata#getExpectedMetadataLocation(Path)}.
   */
  public static Dictionary read(Path location) throws IOException {
    final Path metadata = DictionaryMetadata.getExpectedMetadataLocation(location);

    try (InputStream fsaStream = new BufferedInputStream(Files.newInputStream(location));
        InputStream metadataStream = new BufferedInputStream(Files.newInputStream(metadata))) {
      final Dictionary dictionary = read(fsaStream, metadataStream);
      log.debug("Loaded dictionary {} with metadata {}", location, metadata);
      return dictionary;
    }
  }

  /** Reads a dictionary from a URL. The metadata URL is derived the same way as for files. */
  public static Dictionary read(URL dictURL) throws IOException {
    final String dictionary = dictURL.toExternalForm();
    final URL expectedMetadataURL;
    try {
      final String metadataName =
          DictionaryMetadata.getExpectedMetadataFileName(lastPathSegment(dictionary));
      expectedMetadataURL = new URL(dictURL, metadataName);
    } catch (MalformedURLException e) {
      throw new IOException("Couldn't construct relative metadata URL for: " + dictURL, e);
    }

    try (InputStream fsaStream = new BufferedInputStream(dictURL.openStream());
        InputStream metadataStream = new BufferedInputStream(expectedMetadataURL.openStream())) {
      final Dictionary result = read(fsaStream, metadataStream);
      log.debug("Loaded dictionary {} with metadata {}", dictURL, expectedMetadataURL);
      return result;
    }
  }

  /**
   * Reads a dictionary from a pair of streams. Neither stream is closed.
   *
   * @throws IOException if either stream cannot be read or is invalid.
   */
  public static Dictionary read(InputStream fsaStream, InputStream metadataStream)
      throws IOException {
    return new Dictionary(FSA.read(fsaStream), DictionaryMetadata.read(metadataStream));
  }

  private static String lastPathSegment(String url) {
    final int slash = url.lastIndexOf('/');
    return slash >= 0 ? url.substring(slash + 1) : url;
  }

  @Override
  public String toString() {
    return "Dictionary(" + fsa + ", encoder=" + metadata.getSequenceEncoderType() + ")";
  }
}
