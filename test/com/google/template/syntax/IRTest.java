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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testStatementsOnly() {
    assertThrows(IllegalStateException.class, () -> IR.root(IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.block(IR.root()));
    assertThrows(IllegalStateException.class, () -> IR.block(IR.elseNode(IR.block())));
  }

  @Test
  public void testExpressionsOnly() {
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.breakNode()));
    assertThrows(IllegalStateException.class, () -> IR.not(IR.raw("x")));
  }

  @Test
  public void testShapes() {
    assertThrows(
        IllegalStateException.class, () -> IR.forIn(IR.string("x"), IR.name("xs"), IR.block()));
    assertThrows(
        IllegalStateException.class, () -> IR.ifNode(IR.name("a"), IR.block(), IR.block()));
    assertThrows(IllegalStateException.class, () -> IR.elseNode(IR.exprResult(IR.name("x"))));
    assertThrows(IllegalStateException.class, () -> IR.assign(IR.number(1), IR.number(2)));
  }

  @Test
  public void testBadArguments() {
    assertThrows(IllegalArgumentException.class, () -> IR.escape("x", -1));
    assertThrows(IllegalArgumentException.class, () -> IR.name(""));
    assertThrows(IllegalArgumentException.class, () -> IR.string("x", '`'));
    assertThrows(
        IllegalArgumentException.class, () -> IR.binaryOp(Token.PIPE, IR.name("a"), IR.name("b")));
  }

  @Test
  public void testBinaryOp() {
    Node n = IR.binaryOp(Token.AND, IR.name("a"), IR.name("b"));

    assertThat(n.getToken()).isEqualTo(Token.AND);
    assertThat(Token.opToStr(n.getToken())).isEqualTo("&&");
    assertThat(Token.opToStr(Token.NAME)).isNull();
  }
}
