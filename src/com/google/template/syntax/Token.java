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

import org.jspecify.annotations.Nullable;

/**
 * The kinds of nodes in a template syntax tree.
 *
 * <p>Statements appear directly under {@link #ROOT} or {@link #BLOCK}; everything else is an
 * expression nested inside a statement.
 */
public enum Token {
  ROOT, // the whole document
  BLOCK, // the body of a block construct

  // Literal text leaves
  RAW,
  ESCAPE, // {%{ verbatim }%}

  // Statements
  EXPR_RESULT,
  FOR,
  WHILE,
  IF,
  ELSE,
  CAPTURE,
  BREAK,
  CONTINUE,
  RETURN,

  // Expressions
  ASSIGN,
  NAME,
  LOOP_VAR, // for.index, while.first, ...
  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,
  ARRAYLIT,
  CALL,
  PIPE,
  NOT,

  // Binary operators
  ADD,
  SUB,
  MUL,
  DIV,
  EQ,
  NE,
  LT,
  GT,
  AND,
  OR;

  /** Whether nodes of this kind hold literal template text instead of code. */
  public boolean isRawText() {
    return this == RAW || this == ESCAPE;
  }

  /** Whether nodes of this kind only group statements and have no delimiter semantics. */
  public boolean isContainer() {
    return this == ROOT || this == BLOCK;
  }

  public boolean isLoop() {
    return this == FOR || this == WHILE;
  }

  public boolean isStatement() {
    switch (this) {
      case ROOT:
      case BLOCK:
      case RAW:
      case ESCAPE:
      case EXPR_RESULT:
      case FOR:
      case WHILE:
      case IF:
      case ELSE:
      case CAPTURE:
      case BREAK:
      case CONTINUE:
      case RETURN:
        return true;
      default:
        return false;
    }
  }

  /** Whether the construct is closed by an {@code end} keyword. */
  public boolean isBlockConstruct() {
    switch (this) {
      case FOR:
      case WHILE:
      case IF:
      case CAPTURE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns how tightly an expression of this kind binds; higher binds tighter. {@code CALL} is
   * ranked as a call with arguments, whose arguments extend as far to the right as possible.
   */
  public int precedence() {
    switch (this) {
      case ASSIGN:
        return 0;
      case PIPE:
        return 1;
      case CALL:
        return 2;
      case OR:
        return 3;
      case AND:
        return 4;
      case EQ:
      case NE:
        return 5;
      case LT:
      case GT:
        return 6;
      case ADD:
      case SUB:
        return 7;
      case MUL:
      case DIV:
        return 8;
      case NOT:
        return 9;
      default:
        return 10;
    }
  }

  public boolean isBinaryOperator() {
    return opToStr(this) != null;
  }

  /**
   * Returns the operator text of a binary operator, or null if the token is not a binary
   * operator.
   */
  public static @Nullable String opToStr(Token token) {
    switch (token) {
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case EQ:
        return "==";
      case NE:
        return "!=";
      case LT:
        return "<";
      case GT:
        return ">";
      case AND:
        return "&&";
      case OR:
        return "||";
      default:
        return null;
    }
  }
}
