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
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.template.syntax.Node;
import com.google.template.syntax.Trivia;
import com.google.template.syntax.TriviaBundle;
import com.google.template.syntax.TriviaKind;
import org.jspecify.annotations.Nullable;

/**
 * Writes a template syntax tree back to text.
 *
 * <p>Trivia captured by the parser is replayed verbatim, so a fully captured tree reproduces its
 * source exactly. Whatever the trivia does not provide is synthesized: the delimiters around code,
 * the spaces between words, the {@code "; "} between statements and the {@code end} keyword of
 * block constructs.
 *
 * <p>One instance renders one tree and is not thread-safe. If rendering fails the output already
 * written to the {@link TextConsumer} is incomplete and should be discarded.
 */
public final class TemplateRenderer {
  private final TextConsumer output;
  private final ContentWriter contentWriter;
  private final RenderOptions options;
  private final LoopContext loops = new LoopContext();

  private boolean isInCode;
  private boolean expectSpace;
  private boolean expectEnd;
  private boolean expectEndOfStatement;
  private boolean hasEndOfStatement;
  private boolean nextLeftStrip;
  private boolean nextRightStrip;
  private @Nullable Node previousRawStatement;
  // Number of write(Node) calls in progress.
  private int depth;

  public TemplateRenderer(TextConsumer output, ContentWriter contentWriter, RenderOptions options) {
    this.output = checkNotNull(output);
    this.contentWriter = checkNotNull(contentWriter);
    this.options = checkNotNull(options);
  }

  public RenderOptions getOptions() {
    return options;
  }

  /** Whether the last character written is whitespace. */
  public boolean previousHasSpace() {
    return output.lastCharIsWhitespace();
  }

  /** Returns the last character written, or {@code '\0'} if nothing was written yet. */
  public char getLastChar() {
    return output.getLastChar();
  }

  /** Whether the nearest loop enclosing the node being written is a {@code while} loop. */
  public boolean isInWhileLoop() {
    return loops.isInWhileLoop();
  }

  public boolean isInCode() {
    return isInCode;
  }

  int getLoopDepth() {
    return loops.depth();
  }

  /** Renders {@code node} and its subtree. Does nothing if {@code node} is null. */
  @CanIgnoreReturnValue
  public TemplateRenderer write(@Nullable Node node) {
    if (node == null) {
      return this;
    }
    depth++;
    try (LoopContext.Scope scope = loops.enter(node)) {
      writeBegin(node);
      contentWriter.writeContent(node, this);
      writeEnd(node);
    } finally {
      depth--;
      if (!node.isContainer()) {
        if (node.isRawText()) {
          previousRawStatement = node;
        } else if (isInCode) {
          previousRawStatement = null;
        }
      }
    }
    return this;
  }

  /** Writes {@code node} between parentheses, placing a pending space before the opening one. */
  @CanIgnoreReturnValue
  public TemplateRenderer writeParenthesized(Node node) {
    if (expectSpace && !previousHasSpace()) {
      write(" ");
    }
    expectSpace = false;
    write("(");
    write(node);
    return write(")");
  }

  /** Writes literal text. */
  @CanIgnoreReturnValue
  public TemplateRenderer write(String text) {
    output.append(text);
    return this;
  }

  /**
   * Requests a statement terminator before the next statement, unless one has been written
   * already.
   */
  @CanIgnoreReturnValue
  public TemplateRenderer expectEos() {
    if (!hasEndOfStatement) {
      expectEndOfStatement = true;
    }
    return this;
  }

  /** Requests a space before the next node, unless trivia provides one. */
  @CanIgnoreReturnValue
  public TemplateRenderer expectSpace() {
    expectSpace = true;
    return this;
  }

  /** Requests the {@code end} keyword once the content of the current block construct is done. */
  @CanIgnoreReturnValue
  public TemplateRenderer expectEnd() {
    expectEnd = true;
    expectEos();
    return this;
  }

  /**
   * Writes {@code first} and its following siblings, with a comma between two items unless the
   * earlier one already carries a comma trivia.
   */
  @CanIgnoreReturnValue
  public TemplateRenderer writeListWithCommas(@Nullable Node first) {
    for (Node n = first; n != null; n = n.getNext()) {
      write(n);
      if (n.getNext() != null && !n.hasTrivia(TriviaKind.COMMA, false)) {
        write(",");
      }
    }
    return this;
  }

  @CanIgnoreReturnValue
  public TemplateRenderer writeEnterCode(int escapeLevel) {
    write(Delimiters.open(escapeLevel));
    if (nextLeftStrip) {
      write(Delimiters.STRIP);
      nextLeftStrip = false;
    }
    resetExpectations();
    isInCode = true;
    return this;
  }

  @CanIgnoreReturnValue
  public TemplateRenderer writeExitCode(int escapeLevel) {
    if (nextRightStrip) {
      write(Delimiters.STRIP);
      nextRightStrip = false;
    }
    write(Delimiters.close(escapeLevel));
    resetExpectations();
    isInCode = false;
    return this;
  }

  private void resetExpectations() {
    expectEndOfStatement = false;
    expectEnd = false;
    expectSpace = false;
    hasEndOfStatement = false;
  }

  /** Opens a code region, stripping the whitespace after the last raw text if it captured any. */
  private void enterCodeAfterRawText() {
    nextLeftStrip =
        previousRawStatement != null
            && previousRawStatement.hasTrivia(TriviaKind.WHITESPACE, false);
    writeEnterCode(0);
  }

  private void writeBegin(Node node) {
    if (!node.isContainer()) {
      if (isInCode) {
        if (node.isRawText()) {
          nextRightStrip = node.hasTrivia(TriviaKind.WHITESPACE, true);
          writeExitCode(0);
        }
      } else if (!node.isRawText()) {
        enterCodeAfterRawText();
      }
    }

    writeTrivia(node, true);

    handleEndOfStatement(node);

    // Add a space if this is required and no trivia are providing it
    if (node.canHaveLeadingTrivia()) {
      if (expectSpace && !previousHasSpace()) {
        write(" ");
      }
      expectSpace = false;
    }
  }

  private void writeEnd(Node node) {
    if (expectEnd) {
      checkState(
          node.getToken().isBlockConstruct(), "%s cannot be closed by an end keyword", node);
      handleEndOfStatement(node);

      if (!isInCode) {
        enterCodeAfterRawText();
      }

      TriviaBundle trivia = node.getTrivia();
      Trivia endKeyword = trivia != null ? trivia.getEndKeyword() : null;
      if (endKeyword == null) {
        write("end");
      }
      writeTrivia(node, false);

      expectEnd = false;
      expectEndOfStatement = true;
    } else {
      writeTrivia(node, false);
    }

    // The outermost node closes a code region left open by its content.
    if (depth == 1 && isInCode) {
      writeExitCode(0);
    }
  }

  /** Writes a statement terminator in front of a statement if the previous one needs it. */
  private void handleEndOfStatement(Node node) {
    if (node.isStatement() && !node.isContainer() && isInCode) {
      if (expectEndOfStatement && !hasEndOfStatement) {
        write("; ");
      }
      expectEndOfStatement = false;
      hasEndOfStatement = false;
    }
  }

  private void writeTrivia(Node node, boolean before) {
    TriviaBundle trivia = node.getTrivia();
    if (trivia == null) {
      return;
    }
    for (Trivia t : trivia.get(before)) {
      t.writeTo(this::write);
      TriviaKind kind = t.getKind();
      if (kind == TriviaKind.END) {
        hasEndOfStatement = false;
      } else if (kind.isStatementSeparator()) {
        hasEndOfStatement = true;
        // A line break or semicolon already separates the tokens.
        expectSpace = false;
      }
    }
  }
}
