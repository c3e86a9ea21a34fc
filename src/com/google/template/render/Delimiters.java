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

package com.google.template.render;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;

/** The text of the delimiters that open and close code regions. */
final class Delimiters {
  static final String STRIP = "~";

  private Delimiters() {}

  /** Returns {@code "{"}, {@code escapeLevel} percent signs, then {@code "{"}. */
  static String open(int escapeLevel) {
    checkArgument(escapeLevel >= 0, "Negative escape level %s", escapeLevel);
    return "{" + Strings.repeat("%", escapeLevel) + "{";
  }

  /** Returns {@code "}"}, {@code escapeLevel} percent signs, then {@code "}"}. */
  static String close(int escapeLevel) {
    checkArgument(escapeLevel >= 0, "Negative escape level %s", escapeLevel);
    return "}" + Strings.repeat("%", escapeLevel) + "}";
  }
}
