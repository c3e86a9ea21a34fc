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
import com.google.template.syntax.Trivia;
import com.google.template.syntax.TriviaBundle;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TemplatePrinterTest {

  @Test
  public void testBuild() {
    Node root = IR.root(IR.raw("Hello "), IR.exprResult(IR.name("name")));

    assertThat(new TemplatePrinter.Builder(root).build()).isEqualTo("Hello {{name}}");
  }

  @Test
  public void testBuildLoopNode() {
    Node loop = IR.forIn(IR.name("item"), IR.name("items"), IR.block(IR.raw("Hi")));
    String text = new TemplatePrinter.Builder(loop).build();

    assertThat(text).isEqualTo("{{for item in items}}Hi{{end}}");
  }

  @Test
  public void testPrintToAppendable() {
    StringBuilder sb = new StringBuilder("> ");

    new TemplatePrinter.Builder(IR.root(IR.exprResult(IR.name("x")))).printTo(sb);

    assertThat(sb.toString()).isEqualTo("> {{x}}");
  }

  @Test
  public void testMissingRoot() {
    TemplatePrinter.Builder builder = new TemplatePrinter.Builder(null);

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  public void testStringQuoting() {
    Node root = IR.root(IR.exprResult(IR.call(IR.name("f"), IR.string("say \"hi\"\n"))));

    assertThat(new TemplatePrinter.Builder(root).build()).isEqualTo("{{f \"say \\\"hi\\\"\\n\"}}");
  }

  @Test
  public void testPreferSingleQuotes() {
    RenderOptions options = new RenderOptions();
    options.setPreferSingleQuotes(true);
    Node root = IR.root(IR.exprResult(IR.string("it's")));

    String text = new TemplatePrinter.Builder(root).setRenderOptions(options).build();

    assertThat(text).isEqualTo("{{'it\\'s'}}");
  }

  @Test
  public void testRecordedQuoteWins() {
    RenderOptions options = new RenderOptions();
    options.setPreferSingleQuotes(true);
    Node root = IR.root(IR.exprResult(IR.string("x", '"')));

    String text = new TemplatePrinter.Builder(root).setRenderOptions(options).build();

    assertThat(text).isEqualTo("{{\"x\"}}");
  }

  @Test
  public void testNumbers() {
    Node root =
        IR.root(
            IR.exprResult(
                IR.arraylit(IR.number(3), IR.number(0.25), IR.number(-0.0), IR.number(-7))));

    assertThat(new TemplatePrinter.Builder(root).build()).isEqualTo("{{[3,0.25,-0.0,-7]}}");
  }

  @Test
  public void testValidationRejectsSharedTrivia() {
    TriviaBundle shared = TriviaBundle.builder().addAfter(Trivia.space()).build();
    Node root =
        IR.root(
            IR.exprResult(IR.name("x").setTrivia(shared)),
            IR.exprResult(IR.name("y").setTrivia(shared)));
    RenderOptions options = new RenderOptions();
    options.setValidateTree(true);
    TemplatePrinter.Builder builder = new TemplatePrinter.Builder(root).setRenderOptions(options);

    IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
    assertThat(e).hasMessageThat().contains("Trivia is shared with another node");
  }

  @Test
  public void testValidationAcceptsWellFormedTree() {
    Node root =
        IR.root(
            IR.raw("a"),
            IR.forIn(IR.name("x"), IR.name("xs"), IR.block(IR.exprResult(IR.name("x")))));
    RenderOptions options = new RenderOptions();
    options.setValidateTree(true);

    String text = new TemplatePrinter.Builder(root).setRenderOptions(options).build();

    assertThat(text).isEqualTo("a{{for x in xs; x; end}}");
  }

  @Test
  public void testCustomContentWriter() {
    Node root = IR.root(IR.exprResult(IR.add(IR.name("a"), IR.name("b"))));

    String text =
        new TemplatePrinter.Builder(root)
            .setContentWriterFactory(
                options ->
                    new NodeWriter(options) {
                      @Override
                      public void writeContent(Node n, TemplateRenderer r) {
                        if (n.isName()) {
                          r.write(n.getString().toUpperCase());
                        } else {
                          super.writeContent(n, r);
                        }
                      }
                    })
            .build();

    assertThat(text).isEqualTo("{{A+B}}");
  }

  @Test
  public void testOptionsAreHandedToFactory() {
    RenderOptions options = new RenderOptions();
    RenderOptions[] seen = new RenderOptions[1];

    new TemplatePrinter.Builder(IR.root())
        .setRenderOptions(options)
        .setContentWriterFactory(
            o -> {
              seen[0] = o;
              return new NodeWriter(o);
            })
        .build();

    assertThat(seen[0]).isSameInstanceAs(options);
  }
}
