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

import com.google.common.collect.Sets;
import com.google.template.syntax.Node;
import com.google.template.syntax.Token;
import com.google.template.syntax.Trivia;
import com.google.template.syntax.TriviaBundle;
import com.google.template.syntax.TriviaKind;
import java.util.Set;
import java.util.logging.Logger;

/**
 * This class walks a template tree and validates that the structure is one the renderer can
 * print.
 */
public final class TreeValidator {
  private static final Logger logger = Logger.getLogger(TreeValidator.class.getName());

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;
  private final Set<TriviaBundle> seenTrivia = Sets.newIdentityHashSet();

  public TreeValidator(ViolationHandler handler) {
    this.violationHandler = checkNotNull(handler);
  }

  public TreeValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(
                message
                    + ". Reference node:\n"
                    + n.toStringTree()
                    + "\n Parent node:\n"
                    + ((n.getParent() != null) ? n.getParent().toStringTree() : " no parent "));
          }
        });
  }

  /** Returns a handler that logs violations as warnings instead of failing. */
  public static ViolationHandler loggingHandler() {
    return (message, n) -> logger.warning(message + ": " + n);
  }

  public void validateRoot(Node n) {
    seenTrivia.clear();
    validateNodeType(Token.ROOT, n);
    validateTrivia(n);
    validateStatements(n);
  }

  private void validateStatements(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateStatement(c);
    }
  }

  private void validateStatement(Node n) {
    validateTrivia(n);
    switch (n.getToken()) {
      case BLOCK:
        validateStatements(n);
        return;
      case RAW:
        validateChildless(n);
        return;
      case ESCAPE:
        validateChildless(n);
        if (n.getEscapeLevel() < 0) {
          violation("Negative escape level " + n.getEscapeLevel(), n);
        }
        return;
      case EXPR_RESULT:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case FOR:
        validateChildCount(n, 3);
        validateName(n.getFirstChild());
        validateExpression(n.getSecondChild());
        validateBlock(n.getLastChild());
        return;
      case WHILE:
        validateChildCount(n, 2);
        validateExpression(n.getFirstChild());
        validateBlock(n.getLastChild());
        return;
      case IF:
        validateIf(n);
        return;
      case CAPTURE:
        validateChildCount(n, 2);
        validateName(n.getFirstChild());
        validateBlock(n.getLastChild());
        return;
      case BREAK:
      case CONTINUE:
        validateChildless(n);
        return;
      case RETURN:
        validateChildCountIn(n, 0, 1);
        if (n.hasChildren()) {
          validateExpression(n.getFirstChild());
        }
        return;
      default:
        violation("Expected statement but was " + n.getToken() + ".", n);
    }
  }

  private void validateIf(Node n) {
    validateNodeType(Token.IF, n);
    validateChildCountIn(n, 2, 3);
    validateExpression(n.getFirstChild());
    validateBlock(n.getSecondChild());
    if (n.getChildCount() == 3) {
      Node elseNode = n.getLastChild();
      validateNodeType(Token.ELSE, elseNode);
      validateTrivia(elseNode);
      validateChildCount(elseNode, 1);
      Node body = elseNode.getFirstChild();
      if (body != null && body.isIf()) {
        validateTrivia(body);
        validateIf(body);
        if (body.hasTrivia(TriviaKind.END, false)) {
          violation("An else if shares the end keyword of its if", body);
        }
      } else {
        validateBlock(body);
      }
    }
  }

  private void validateBlock(Node n) {
    if (n == null) {
      return;
    }
    validateNodeType(Token.BLOCK, n);
    validateTrivia(n);
    validateStatements(n);
  }

  private void validateName(Node n) {
    if (n == null) {
      return;
    }
    validateNodeType(Token.NAME, n);
    validateTrivia(n);
    validateChildless(n);
  }

  private void validateExpression(Node n) {
    if (n == null) {
      return;
    }
    validateTrivia(n);
    Token type = n.getToken();
    if (type.isBinaryOperator()) {
      validateChildCount(n, 2);
      validateChildExpressions(n);
      return;
    }
    switch (type) {
      case ASSIGN:
        validateChildCount(n, 2);
        validateName(n.getFirstChild());
        validateExpression(n.getLastChild());
        return;
      case NAME:
      case LOOP_VAR:
      case STRINGLIT:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
        validateChildless(n);
        return;
      case ARRAYLIT:
        validateChildExpressions(n);
        return;
      case CALL:
        validateMinimumChildCount(n, 1);
        validateChildExpressions(n);
        return;
      case PIPE:
        validateChildCount(n, 2);
        validateChildExpressions(n);
        return;
      case NOT:
        validateChildCount(n, 1);
        validateChildExpressions(n);
        return;
      default:
        violation("Expected expression but was " + type + ".", n);
    }
  }

  private void validateChildExpressions(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateExpression(c);
    }
  }

  /**
   * Checks that a trivia bundle is owned by a single node and that an end keyword only follows a
   * block construct.
   */
  private void validateTrivia(Node n) {
    TriviaBundle trivia = n.getTrivia();
    if (trivia == null || trivia.isEmpty()) {
      return;
    }
    if (!seenTrivia.add(trivia)) {
      violation("Trivia is shared with another node", n);
    }
    for (Trivia t : trivia.getBefore()) {
      if (t.getKind() == TriviaKind.END) {
        violation("End keyword in leading trivia", n);
      }
    }
    if (trivia.getEndKeyword() != null && !n.getToken().isBlockConstruct()) {
      violation(n.getToken() + " cannot be closed by an end keyword", n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  private void validateNodeType(Token type, Node n) {
    if (n == null) {
      return;
    }
    if (n.getToken() != type) {
      violation("Expected " + type + " but was " + n.getToken(), n);
    }
  }

  private void validateChildless(Node n) {
    validateChildCount(n, 0);
  }

  private void validateChildCount(Node n, int expected) {
    int count = n.getChildCount();
    if (expected != count) {
      violation("Expected " + expected + " children, but was " + count, n);
    }
  }

  private void validateChildCountIn(Node n, int min, int max) {
    int count = n.getChildCount();
    if (count < min || count > max) {
      violation("Expected child count in [" + min + ", " + max + "], but was " + count, n);
    }
  }

  private void validateMinimumChildCount(Node n, int i) {
    if (n.getChildCount() < i) {
      violation("Expected at least " + i + " children, but was " + n.getChildCount(), n);
    }
  }
}
