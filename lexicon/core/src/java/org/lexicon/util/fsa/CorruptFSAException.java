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
package org.lexicon.util.fsa;

import java.io.IOException;

/**
 * This exception is thrown when an automaton stream has an invalid header or cannot be decoded by
 * any of the supported encodings.
 */
public class CorruptFSAException extends IOException {

  /** Create exception with a message only */
  public CorruptFSAException(String message) {
    super(message);
  }

  /** Create exception with message and root cause. */
  public CorruptFSAException(String message, Throwable cause) {
    super(message, cause);
  }
}
