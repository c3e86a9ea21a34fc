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
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** A template syntax tree construction helper class */
public class IR {

  private IR() {}

  public static Node root(Node... stmts) {
    Node root = new Node(Token.ROOT);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Root node cannot contain %s", stmt.getToken());
      root.addChildToBack(stmt);
    }
    return root;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node raw(String text) {
    return Node.newString(Token.RAW, text);
  }

  public static Node escape(String text, int escapeLevel) {
    checkArgument(escapeLevel >= 0, "Negative escape level %s", escapeLevel);
    Node escape = Node.newString(Token.ESCAPE, text);
    escape.putIntProp(Node.Prop.ESCAPE_LEVEL, escapeLevel);
    return escape;
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node forIn(Node variable, Node iterable, Node body) {
    checkState(variable.isName(), variable);
    checkState(mayBeExpression(iterable), iterable);
    checkState(body.isBlock(), body);
    return new Node(Token.FOR, variable, iterable, body);
  }

  public static Node whileLoop(Node condition, Node body) {
    checkState(mayBeExpression(condition), condition);
    checkState(body.isBlock(), body);
    return new Node(Token.WHILE, condition, body);
  }

  public static Node ifNode(Node condition, Node then) {
    checkState(mayBeExpression(condition), condition);
    checkState(then.isBlock(), then);
    return new Node(Token.IF, condition, then);
  }

  public static Node ifNode(Node condition, Node then, Node elseNode) {
    checkState(mayBeExpression(condition), condition);
    checkState(then.isBlock(), then);
    checkState(elseNode.isElse(), elseNode);
    return new Node(Token.IF, condition, then, elseNode);
  }

  /** Creates an {@code else} branch whose body is a BLOCK, or an IF for {@code else if}. */
  public static Node elseNode(Node body) {
    checkState(body.isBlock() || body.isIf(), body);
    return new Node(Token.ELSE, body);
  }

  public static Node capture(Node variable, Node body) {
    checkState(variable.isName(), variable);
    checkState(body.isBlock(), body);
    return new Node(Token.CAPTURE, variable, body);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName(), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node name(String name) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.NAME, name);
  }

  /** A loop variable such as {@code index}, printed relative to the enclosing loop kind. */
  public static Node loopVar(String name) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.LOOP_VAR, name);
  }

  public static Node string(String str) {
    return Node.newString(Token.STRINGLIT, str);
  }

  public static Node string(String str, char quote) {
    checkArgument(quote == '"' || quote == '\'', "Bad quote character %s", quote);
    Node string = string(str);
    string.putIntProp(Node.Prop.QUOTE_CHAR, quote);
    return string;
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node arraylit(Node... exprs) {
    Node array = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      array.addChildToBack(expr);
    }
    return array;
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target), target);
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node pipe(Node left, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(Token.PIPE, left, right);
  }

  public static Node not(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.NOT, expr);
  }

  public static Node binaryOp(Token token, Node left, Node right) {
    checkArgument(token.isBinaryOperator(), "Not a binary operator: %s", token);
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(token, left, right);
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Token.ADD, left, right);
  }

  public static Node lt(Node left, Node right) {
    return binaryOp(Token.LT, left, right);
  }

  public static Node eq(Node left, Node right) {
    return binaryOp(Token.EQ, left, right);
  }

  static boolean mayBeStatement(Node n) {
    return n.isStatement() && !n.isRoot() && !n.isElse();
  }

  static boolean mayBeExpression(Node n) {
    return !n.isStatement();
  }
}
