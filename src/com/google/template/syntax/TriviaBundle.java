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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * The trivia captured around a single node: the items preceding its first token and the items
 * following its last token, each in source order.
 *
 * <p>A bundle belongs to exactly one node. {@code TreeValidator} reports a bundle that is shared
 * between nodes.
 */
@Immutable
public final class TriviaBundle {
  private static final TriviaBundle EMPTY =
      new TriviaBundle(ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<Trivia> before;
  private final ImmutableList<Trivia> after;
  private final @Nullable Trivia endKeyword;

  private TriviaBundle(ImmutableList<Trivia> before, ImmutableList<Trivia> after) {
    this.before = before;
    this.after = after;
    this.endKeyword = findFirst(after, TriviaKind.END);
  }

  public static TriviaBundle empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<Trivia> getBefore() {
    return before;
  }

  public ImmutableList<Trivia> getAfter() {
    return after;
  }

  public ImmutableList<Trivia> get(boolean isBefore) {
    return isBefore ? before : after;
  }

  public boolean isEmpty() {
    return before.isEmpty() && after.isEmpty();
  }

  /**
   * Returns the literal closing keyword captured after the node, or null if the closing keyword
   * must be synthesized.
   */
  public @Nullable Trivia getEndKeyword() {
    return endKeyword;
  }

  public boolean has(TriviaKind kind, boolean isBefore) {
    return findFirst(get(isBefore), kind) != null;
  }

  private static @Nullable Trivia findFirst(ImmutableList<Trivia> trivia, TriviaKind kind) {
    for (Trivia t : trivia) {
      if (t.getKind() == kind) {
        return t;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("before", before).add("after", after).toString();
  }

  /** Accumulates trivia in source order. */
  public static final class Builder {
    private final ImmutableList.Builder<Trivia> before = ImmutableList.builder();
    private final ImmutableList.Builder<Trivia> after = ImmutableList.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addBefore(Trivia... trivia) {
      before.add(trivia);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAfter(Trivia... trivia) {
      after.add(trivia);
      return this;
    }

    public TriviaBundle build() {
      return new TriviaBundle(before.build(), after.build());
    }
  }
}
