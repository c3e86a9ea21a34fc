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

import com.google.errorprone.annotations.MustBeClosed;
import com.google.template.syntax.Node;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks the kinds of the loops enclosing the node being rendered.
 *
 * <p>The depth of the stack always equals the number of loop statements currently being visited.
 */
final class LoopContext {

  /** Undoes the push, if any, made by {@link #enter}. */
  interface Scope extends AutoCloseable {
    @Override
    void close();
  }

  private static final Scope NO_LOOP = () -> {};

  private final Deque<Boolean> isWhileLoop = new ArrayDeque<>(4);

  /**
   * Pushes the kind of {@code node} if it is a loop statement. The returned scope must be closed
   * when the node has been rendered, whether or not rendering succeeded.
   */
  @MustBeClosed
  Scope enter(Node node) {
    if (!node.isLoopStatement()) {
      return NO_LOOP;
    }
    isWhileLoop.push(node.isWhileLoop());
    int depth = isWhileLoop.size();
    return () -> {
      checkState(isWhileLoop.size() == depth, "Unbalanced loop context for %s", node);
      isWhileLoop.pop();
    };
  }

  /** Whether the nearest enclosing loop is a {@code while} loop. */
  boolean isInWhileLoop() {
    return !isWhileLoop.isEmpty() && isWhileLoop.peek();
  }

  int depth() {
    return isWhileLoop.size();
  }
}
