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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.errorprone.annotations.Immutable;

/** A single captured lexical item and the exact text it was parsed from. */
@AutoValue
@Immutable
public abstract class Trivia {

  /** Receives the text of a trivia item. */
  public interface TriviaSink {
    void write(String text);
  }

  public static Trivia create(TriviaKind kind, String text) {
    checkArgument(!text.isEmpty(), "Empty %s trivia", kind);
    return new AutoValue_Trivia(kind, text);
  }

  public static Trivia whitespace(String text) {
    checkArgument(CharMatcher.whitespace().matchesAllOf(text), "Not whitespace: '%s'", text);
    return create(TriviaKind.WHITESPACE, text);
  }

  public static Trivia space() {
    return whitespace(" ");
  }

  public static Trivia newLine() {
    return create(TriviaKind.NEW_LINE, "\n");
  }

  public static Trivia semicolon() {
    return create(TriviaKind.SEMICOLON, ";");
  }

  public static Trivia comma() {
    return create(TriviaKind.COMMA, ",");
  }

  public static Trivia end() {
    return create(TriviaKind.END, "end");
  }

  public static Trivia comment(String text) {
    return create(TriviaKind.COMMENT, text);
  }

  public abstract TriviaKind getKind();

  public abstract String getText();

  public void writeTo(TriviaSink sink) {
    sink.write(getText());
  }
}
