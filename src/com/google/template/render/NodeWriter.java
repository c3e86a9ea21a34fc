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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.template.syntax.Node;
import com.google.template.syntax.Token;
import com.google.template.syntax.TriviaKind;

/**
 * NodeWriter writes the tokens of each kind of template node, sending children back through the
 * {@link TemplateRenderer}.
 */
public class NodeWriter implements ContentWriter {
  private static final Escaper DOUBLE_QUOTED =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  private static final Escaper SINGLE_QUOTED =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('\'', "\\'")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  private static final int PRIMARY = Token.NAME.precedence();

  private final boolean preferSingleQuotes;

  public NodeWriter(RenderOptions options) {
    this.preferSingleQuotes = options.getPreferSingleQuotes();
  }

  @Override
  public void writeContent(Node n, TemplateRenderer r) {
    Token type = n.getToken();
    Node first = n.getFirstChild();
    Node last = n.getLastChild();
    int childCount = n.getChildCount();

    String opstr = Token.opToStr(type);
    if (opstr != null) {
      checkState(
          childCount == 2,
          "Bad binary operator \"%s\": expected 2 arguments but got %s",
          opstr,
          childCount);
      // Binary operators are left associative.
      int p = type.precedence();
      addExpr(r, first, p);
      r.write(opstr);
      addExpr(r, last, p + 1);
      return;
    }

    switch (type) {
      case ROOT:
      case BLOCK:
        for (Node c = first; c != null; c = c.getNext()) {
          r.write(c);
        }
        break;

      case RAW:
        r.write(n.getString());
        break;

      case ESCAPE:
        // The escaped text stays literal, so no code region is entered.
        r.write(Delimiters.open(n.getEscapeLevel()));
        r.write(n.getString());
        r.write(Delimiters.close(n.getEscapeLevel()));
        break;

      case EXPR_RESULT:
        checkState(childCount == 1, n);
        r.write(first);
        r.expectEos();
        break;

      case FOR:
        checkState(childCount == 3, n);
        r.write("for").expectSpace();
        r.write(first);
        addKeyword(r, "in");
        r.expectSpace();
        r.write(first.getNext());
        r.expectEos();
        r.write(last);
        r.expectEnd();
        break;

      case WHILE:
        checkState(childCount == 2, n);
        r.write("while").expectSpace();
        r.write(first);
        r.expectEos();
        r.write(last);
        r.expectEnd();
        break;

      case IF:
        checkState(childCount == 2 || childCount == 3, n);
        r.write("if").expectSpace();
        r.write(first);
        r.expectEos();
        r.write(first.getNext());
        if (childCount == 3) {
          r.write(last);
        }
        // An "else if" is closed by the end of the outermost if.
        if (!n.isElseIf()) {
          r.expectEnd();
        }
        break;

      case ELSE:
        checkState(childCount == 1, n);
        r.write("else");
        if (first.isIf()) {
          r.expectSpace();
        } else {
          r.expectEos();
        }
        r.write(first);
        break;

      case CAPTURE:
        checkState(childCount == 2, n);
        r.write("capture").expectSpace();
        r.write(first);
        r.expectEos();
        r.write(last);
        r.expectEnd();
        break;

      case BREAK:
        r.write("break").expectEos();
        break;

      case CONTINUE:
        r.write("continue").expectEos();
        break;

      case RETURN:
        r.write("ret");
        if (first != null) {
          r.expectSpace();
          r.write(first);
        }
        r.expectEos();
        break;

      case ASSIGN:
        checkState(childCount == 2, n);
        r.write(first);
        r.write("=");
        addExpr(r, last, Token.PIPE.precedence());
        break;

      case NAME:
        r.write(n.getString());
        break;

      case LOOP_VAR:
        r.write(r.isInWhileLoop() ? "while." : "for.");
        r.write(n.getString());
        break;

      case STRINGLIT:
        addStringLiteral(r, n);
        break;

      case NUMBER:
        addNumber(r, n.getDouble());
        break;

      case TRUE:
        r.write("true");
        break;

      case FALSE:
        r.write("false");
        break;

      case NULL:
        r.write("null");
        break;

      case ARRAYLIT:
        r.write("[");
        r.writeListWithCommas(first);
        r.write("]");
        break;

      case CALL:
        checkState(childCount >= 1, n);
        addExpr(r, first, PRIMARY);
        for (Node arg = first.getNext(); arg != null; arg = arg.getNext()) {
          r.expectSpace();
          addExpr(r, arg, PRIMARY);
        }
        break;

      case PIPE:
        checkState(childCount == 2, n);
        addExpr(r, first, Token.PIPE.precedence());
        r.write("|");
        addExpr(r, last, Token.CALL.precedence());
        break;

      case NOT:
        checkState(childCount == 1, n);
        r.write("!");
        addExpr(r, first, Token.NOT.precedence());
        break;

      default:
        throw new IllegalStateException("Unknown token " + type + "\n" + n.toStringTree());
    }
  }

  /**
   * Writes {@code n}, in parentheses if it binds more loosely than {@code minPrecedence} and the
   * parentheses were not captured as trivia.
   */
  private static void addExpr(TemplateRenderer r, Node n, int minPrecedence) {
    if (precedence(n) < minPrecedence && !n.hasTrivia(TriviaKind.PUNCTUATION, true)) {
      r.writeParenthesized(n);
    } else {
      r.write(n);
    }
  }

  private static int precedence(Node n) {
    switch (n.getToken()) {
      case CALL:
        return n.getChildCount() > 1 ? Token.CALL.precedence() : PRIMARY;
      case NUMBER:
        // A negative literal reads as a unary minus.
        return isNegative(n.getDouble()) ? Token.NOT.precedence() : PRIMARY;
      default:
        return n.getToken().precedence();
    }
  }

  /** Writes a keyword that follows another word, separated from it unless trivia already is. */
  private static void addKeyword(TemplateRenderer r, String keyword) {
    if (!r.previousHasSpace()) {
      r.write(" ");
    }
    r.write(keyword);
  }

  private void addStringLiteral(TemplateRenderer r, Node n) {
    char quote;
    if (n.hasProp(Node.Prop.QUOTE_CHAR)) {
      quote = (char) n.getIntProp(Node.Prop.QUOTE_CHAR);
    } else {
      quote = preferSingleQuotes ? '\'' : '"';
    }
    Escaper escaper = quote == '\'' ? SINGLE_QUOTED : DOUBLE_QUOTED;
    r.write(quote + escaper.escape(n.getString()) + quote);
  }

  static void addNumber(TemplateRenderer r, double x) {
    checkState(!Double.isNaN(x) && !Double.isInfinite(x), "Cannot write number %s", x);
    // Keeps x- -4 from being read as x--4.
    if (isNegative(x) && r.getLastChar() == '-') {
      r.write(" ");
    }
    if ((long) x == x && !isNegativeZero(x)) {
      r.write(Long.toString((long) x));
    } else {
      r.write(String.valueOf(x));
    }
  }

  private static boolean isNegative(double x) {
    return x < 0 || isNegativeZero(x);
  }

  private static boolean isNegativeZero(double x) {
    return x == 0.0 && Math.copySign(1, x) == -1.0;
  }
}
