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

/** No relative encoding at all: the encoded form is the target itself. */
public class NoEncoder implements SequenceEncoder {
  @Override
  public BytesRef encode(BytesRefBuilder reuse, BytesRef source, BytesRef target) {
    reuse.copyBytes(target);
    return reuse.get();
  }

  @Override
  public BytesRef decode(BytesRefBuilder reuse, BytesRef source, BytesRef encoded) {
    reuse.copyBytes(encoded);
    return reuse.get();
  }

  @Override
  public int prefixBytes() {
    return 0;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
