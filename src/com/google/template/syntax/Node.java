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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node in a template syntax tree.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points to the last
 * child so that appending is constant time, and {@code last.next} is null.
 */
public class Node {

  /** Optional integer properties. */
  public enum Prop {
    // Number of '%' characters in the delimiters of an ESCAPE node.
    ESCAPE_LEVEL,
    // The quote character a STRINGLIT was written with.
    QUOTE_CHAR,
  }

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    public String getString() {
      return str;
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      return node instanceof StringNode && str.equals(((StringNode) node).str);
    }

    @Override
    Node cloneNode() {
      return new StringNode(getToken(), str);
    }
  }

  private static final class NumberNode extends Node {
    private final double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    public double getDouble() {
      return number;
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      return node instanceof NumberNode && Double.compare(number, ((NumberNode) node).number) == 0;
    }

    @Override
    Node cloneNode() {
      return new NumberNode(number);
    }
  }

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;
  private @Nullable TriviaBundle trivia;
  private @Nullable Map<Prop, Integer> props;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public final Token getToken() {
    return token;
  }

  public String getString() {
    throw new UnsupportedOperationException(token + " does not have a string value");
  }

  public double getDouble() {
    throw new UnsupportedOperationException(token + " is not a number node");
  }

  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = checkNotNull(n).next;
      i--;
    }
    return checkNotNull(n);
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  // Trivia

  public final @Nullable TriviaBundle getTrivia() {
    return trivia;
  }

  @CanIgnoreReturnValue
  public final Node setTrivia(@Nullable TriviaBundle trivia) {
    this.trivia = trivia;
    return this;
  }

  public final boolean hasTrivia(TriviaKind kind, boolean before) {
    return trivia != null && trivia.has(kind, before);
  }

  // Properties

  public final int getIntProp(Prop prop) {
    if (props == null) {
      return 0;
    }
    Integer value = props.get(prop);
    return value == null ? 0 : value;
  }

  public final boolean hasProp(Prop prop) {
    return props != null && props.containsKey(prop);
  }

  public final void putIntProp(Prop prop, int value) {
    if (props == null) {
      props = new EnumMap<>(Prop.class);
    }
    props.put(prop, value);
  }

  public final int getEscapeLevel() {
    return getIntProp(Prop.ESCAPE_LEVEL);
  }

  // Classification

  public final boolean isRawText() {
    return token.isRawText();
  }

  public final boolean isContainer() {
    return token.isContainer();
  }

  public final boolean isLoopStatement() {
    return token.isLoop();
  }

  public final boolean isWhileLoop() {
    return token == Token.WHILE;
  }

  public final boolean isStatement() {
    return token.isStatement();
  }

  /** Whether a synthesized separator may be placed in front of this node. */
  public final boolean canHaveLeadingTrivia() {
    return !isContainer() && !isRawText();
  }

  public final boolean isRoot() {
    return token == Token.ROOT;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isElse() {
    return token == Token.ELSE;
  }

  /** Whether this IF is the {@code if} of an {@code else if} and shares its parent's end. */
  public final boolean isElseIf() {
    return isIf() && parent != null && parent.isElse();
  }

  // Equivalence and cloning

  /**
   * Returns true if this subtree has the same node kinds and literal values as {@code node}.
   * Trivia is not compared.
   */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token
        || getChildCount() != node.getChildCount()
        || !isValueEquivalentTo(node)
        || !Objects.equals(props, node.props)) {
      return false;
    }
    for (Node a = first, b = node.first; a != null; a = a.next, b = b.next) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
    }
    return true;
  }

  boolean isValueEquivalentTo(Node node) {
    return node.getClass() == Node.class;
  }

  Node cloneNode() {
    return new Node(token);
  }

  /** Returns a detached deep copy of this subtree, with or without the captured trivia. */
  public final Node cloneTree(boolean keepTrivia) {
    Node result = cloneNode();
    if (props != null) {
      result.props = new EnumMap<>(props);
    }
    if (keepTrivia) {
      result.trivia = trivia;
    }
    for (Node n = first; n != null; n = n.next) {
      result.addChildToBack(n.cloneTree(keepTrivia));
    }
    return result;
  }

  // Debugging

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(" \"").append(getString()).append('"');
    } else if (this instanceof NumberNode) {
      sb.append(' ').append(getDouble());
    }
    if (props != null) {
      sb.append(' ').append(props);
    }
    if (trivia != null && !trivia.isEmpty()) {
      sb.append(" [trivia]");
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
