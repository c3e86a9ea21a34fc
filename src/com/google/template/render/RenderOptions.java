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

import com.google.common.base.MoreObjects;
import java.io.Serializable;

/**
 * Options for rendering a template tree. The renderer core only stores them; they are read by the
 * content writers and by {@link TemplatePrinter}.
 */
public class RenderOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  boolean preferSingleQuotes;

  /**
   * String literals that were not parsed from source are written with double quotes. Set this to
   * true to use single quotes instead.
   */
  public void setPreferSingleQuotes(boolean enabled) {
    this.preferSingleQuotes = enabled;
  }

  public boolean getPreferSingleQuotes() {
    return preferSingleQuotes;
  }

  boolean validateTree;

  /** Whether to run the {@link TreeValidator} over the tree before it is rendered. */
  public void setValidateTree(boolean enabled) {
    this.validateTree = enabled;
  }

  public boolean getValidateTree() {
    return validateTree;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("preferSingleQuotes", preferSingleQuotes)
        .add("validateTree", validateTree)
        .toString();
  }
}
