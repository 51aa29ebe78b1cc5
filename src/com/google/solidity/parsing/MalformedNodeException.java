/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.solidity.parsing;

import com.google.solidity.parsing.AstParseException.ErrorKind;

/**
 * A low-level failure raised while extracting a single node. It never escapes the parsers: the
 * nearest dispatch boundary converts it to an {@link AstParseException} that names the node.
 */
final class MalformedNodeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind errorKind;

  MalformedNodeException(ErrorKind errorKind, String message) {
    super(message);
    this.errorKind = errorKind;
  }

  MalformedNodeException(String message) {
    this(ErrorKind.MALFORMED_NODE, message);
  }

  static MalformedNodeException ambiguousChildList(String kind, String expected, int actual) {
    return new MalformedNodeException(
        ErrorKind.AMBIGUOUS_CHILD_LIST,
        String.format("%s expects %s children but has %d", kind, expected, actual));
  }

  ErrorKind getErrorKind() {
    return errorKind;
  }
}
