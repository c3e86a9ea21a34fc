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

package com.google.template.syntax;

/** Lexical items captured by the parser that are not part of the tree structure. */
public enum TriviaKind {
  WHITESPACE,
  NEW_LINE,
  SEMICOLON,
  COMMA,
  END, // the literal closing keyword of a block construct
  COMMENT, // # to end of line
  COMMENT_MULTI, // ## ... ##
  PUNCTUATION;

  /** Whether an item of this kind separates two statements on its own. */
  public boolean isStatementSeparator() {
    return this == NEW_LINE || this == SEMICOLON;
  }
}
