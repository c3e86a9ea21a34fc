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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.template.syntax.Node;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TemplatePrinter prints out a template tree, either exactly as it was parsed or, where trivia is
 * missing, in the most compact form that parses back to the same tree.
 *
 * @see TemplateRenderer
 */
public final class TemplatePrinter {
  private static final Logger logger = Logger.getLogger(TemplatePrinter.class.getName());

  private TemplatePrinter() {}

  public static final class Builder {
    private final Node root;
    private RenderOptions options = new RenderOptions();
    private ContentWriterFactory contentWriterFactory = NodeWriter::new;

    /**
     * Sets the root node from which to generate the template text.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = node;
    }

    @CanIgnoreReturnValue
    public Builder setRenderOptions(RenderOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /** Set a custom content writer factory to enable custom rendering of nodes. */
    @CanIgnoreReturnValue
    public Builder setContentWriterFactory(ContentWriterFactory factory) {
      this.contentWriterFactory = checkNotNull(factory);
      return this;
    }

    public interface ContentWriterFactory {
      ContentWriter getContentWriter(RenderOptions options);
    }

    /** Generates the template text and returns it. */
    public String build() {
      StringBuilder sb = new StringBuilder(1024);
      printTo(sb);
      return sb.toString();
    }

    /**
     * Writes the template text to {@code out}. If rendering fails, the text written so far is
     * incomplete and should be discarded.
     */
    public void printTo(Appendable out) {
      if (root == null) {
        throw new IllegalStateException("Cannot build without root node being specified");
      }
      if (options.getValidateTree()) {
        new TreeValidator().validateRoot(root);
      }

      TextConsumer consumer = TextConsumer.forAppendable(out);
      TemplateRenderer renderer =
          new TemplateRenderer(consumer, contentWriterFactory.getContentWriter(options), options);
      renderer.write(root);

      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Rendered " + root.getToken() + " with " + options);
      }
    }
  }
}
