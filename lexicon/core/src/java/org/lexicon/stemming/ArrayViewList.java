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

import java.util.AbstractList;
import java.util.RandomAccess;

/** A read-only {@link java.util.List} view over a slice of an array. The slice may be rewrapped. */
final class ArrayViewList<E> extends AbstractList<E> implements RandomAccess {
  private E[] array;
  private int start;
  private int length;

  ArrayViewList(E[] array, int start, int length) {
    wrap(array, start, length);
  }

  void wrap(E[] array, int start, int length) {
    assert start >= 0 && length >= 0 && start + length <= array.length;
    this.array = array;
    this.start = start;
    this.length = length;
  }

  @Override
  public int size() {
    return length;
  }

  @Override
  public E get(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException("Index: " + index + ", size: " + length);
    }
    return array[start + index];
  }
}
