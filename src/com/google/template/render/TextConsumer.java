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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Abstracted consumer of the {@link TemplateRenderer} output.
 *
 * <p>Output is not transactional: when rendering fails, whatever was appended so far stays in the
 * consumer and must be discarded by the caller.
 *
 * @see TemplateRenderer
 * @see TemplatePrinter
 */
public abstract class TextConsumer {

  /** Appends literal text. */
  public abstract void append(String str);

  /** Retrieve the last character of the last non-empty string sent to append. */
  public abstract char getLastChar();

  /** Whether the last character written is whitespace. False if nothing was written yet. */
  public boolean lastCharIsWhitespace() {
    char c = getLastChar();
    return c != '\0' && Character.isWhitespace(c);
  }

  /** Returns a consumer writing through to {@code out}. */
  public static TextConsumer forAppendable(Appendable out) {
    return new AppendableTextConsumer(out);
  }

  private static final class AppendableTextConsumer extends TextConsumer {
    private final Appendable out;
    private char lastChar = '\0';

    AppendableTextConsumer(Appendable out) {
      this.out = checkNotNull(out);
    }

    @Override
    public void append(String str) {
      if (str.isEmpty()) {
        return;
      }
      try {
        out.append(str);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      lastChar = str.charAt(str.length() - 1);
    }

    @Override
    public char getLastChar() {
      return lastChar;
    }
  }
}
