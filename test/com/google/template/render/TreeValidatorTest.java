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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.template.syntax.IR;
import com.google.template.syntax.Node;
import com.google.template.syntax.Token;
import com.google.template.syntax.Trivia;
import com.google.template.syntax.TriviaBundle;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TreeValidatorTest {
  private List<String> violations;
  private TreeValidator validator;

  @Before
  public void setUp() {
    violations = new ArrayList<>();
    validator = new TreeValidator((message, n) -> violations.add(message));
  }

  private static Node withEnd(Node n) {
    return n.setTrivia(TriviaBundle.builder().addAfter(Trivia.space(), Trivia.end()).build());
  }

  @Test
  public void testValidTree() {
    Node root =
        IR.root(
            IR.raw("a"),
            withEnd(
                IR.ifNode(
                    IR.lt(IR.name("x"), IR.number(3)),
                    IR.block(IR.exprResult(IR.assign(IR.name("y"), IR.string("s")))),
                    IR.elseNode(IR.ifNode(IR.name("z"), IR.block(IR.breakNode()))))),
            IR.whileLoop(IR.trueNode(), IR.block(IR.continueNode())),
            IR.capture(IR.name("c"), IR.block(IR.escape("{{", 1))),
            IR.returnNode());

    validator.validateRoot(root);

    assertThat(violations).isEmpty();
  }

  @Test
  public void testRootExpected() {
    validator.validateRoot(IR.block());

    assertThat(violations).containsExactly("Expected ROOT but was BLOCK");
  }

  @Test
  public void testSharedTrivia() {
    TriviaBundle shared = TriviaBundle.builder().addBefore(Trivia.space()).build();
    Node root =
        IR.root(IR.exprResult(IR.name("x")).setTrivia(shared), IR.raw("a").setTrivia(shared));

    validator.validateRoot(root);

    assertThat(violations).containsExactly("Trivia is shared with another node");
  }

  @Test
  public void testValidationCanBeRepeated() {
    TriviaBundle trivia = TriviaBundle.builder().addAfter(Trivia.newLine()).build();
    Node root = IR.root(IR.exprResult(IR.name("x")).setTrivia(trivia));

    validator.validateRoot(root);
    validator.validateRoot(root);

    assertThat(violations).isEmpty();
  }

  @Test
  public void testEndInLeadingTrivia() {
    Node loop = IR.whileLoop(IR.name("c"), IR.block());
    loop.setTrivia(TriviaBundle.builder().addBefore(Trivia.end()).build());

    validator.validateRoot(IR.root(loop));

    assertThat(violations).containsExactly("End keyword in leading trivia");
  }

  @Test
  public void testEndAfterNonBlockConstruct() {
    validator.validateRoot(IR.root(withEnd(IR.exprResult(IR.name("x")))));

    assertThat(violations).containsExactly("EXPR_RESULT cannot be closed by an end keyword");
  }

  @Test
  public void testElseIfWithOwnEnd() {
    Node root =
        IR.root(
            IR.ifNode(
                IR.name("a"),
                IR.block(),
                IR.elseNode(withEnd(IR.ifNode(IR.name("b"), IR.block())))));

    validator.validateRoot(root);

    assertThat(violations).containsExactly("An else if shares the end keyword of its if");
  }

  @Test
  public void testBadChildCounts() {
    Node root =
        IR.root(
            new Node(Token.FOR, IR.name("x"), IR.block()),
            new Node(Token.EXPR_RESULT, new Node(Token.ADD, IR.name("a"))),
            new Node(Token.EXPR_RESULT, new Node(Token.CALL)));

    validator.validateRoot(root);

    assertThat(violations)
        .containsExactly(
            "Expected 3 children, but was 2",
            "Expected expression but was BLOCK.",
            "Expected 2 children, but was 1",
            "Expected at least 1 children, but was 0")
        .inOrder();
  }

  @Test
  public void testExpressionInStatementPosition() {
    Node block = new Node(Token.BLOCK, IR.name("x"));

    validator.validateRoot(new Node(Token.ROOT, block));

    assertThat(violations).containsExactly("Expected statement but was NAME.");
  }

  @Test
  public void testStatementInExpressionPosition() {
    validator.validateRoot(IR.root(new Node(Token.EXPR_RESULT, IR.breakNode())));

    assertThat(violations).containsExactly("Expected expression but was BREAK.");
  }

  @Test
  public void testDefaultHandlerThrows() {
    Node root = IR.root(withEnd(IR.exprResult(IR.name("x"))));

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> new TreeValidator().validateRoot(root));
    assertThat(e).hasMessageThat().contains("cannot be closed by an end keyword");
    assertThat(e).hasMessageThat().contains("Parent node:\nROOT");
  }

  @Test
  public void testLoggingHandlerDoesNotThrow() {
    new TreeValidator(TreeValidator.loggingHandler())
        .validateRoot(IR.root(withEnd(IR.exprResult(IR.name("x")))));
  }
}
