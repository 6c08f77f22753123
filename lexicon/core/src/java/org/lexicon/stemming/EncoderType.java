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

/** Known {@link SequenceEncoder}s, as named by the <code>fsa.dict.encoder</code> attribute. */
public enum EncoderType {
  /** Stems are stored verbatim. */
  NONE {
    @Override
    public SequenceEncoder get() {
      return new NoEncoder();
    }
  },

  /** Stems are stored as a suffix removal plus appended bytes. */
  SUFFIX {
    @Override
    public SequenceEncoder get() {
      return new TrimSuffixEncoder();
    }
  },

  /** Stems are stored as a prefix and suffix removal plus appended bytes. */
  PREFIX {
    @Override
    public SequenceEncoder get() {
      return new TrimPrefixAndSuffixEncoder();
    }
  },

  /** Stems are stored as an infix and suffix removal plus appended bytes. */
  INFIX {
    @Override
    public SequenceEncoder get() {
      return new TrimInfixAndSuffixEncoder();
    }
  };

  /** Returns a new encoder of this type. */
  public abstract SequenceEncoder get();
}
