/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.opgen.pybackend.tree;

import org.apache.commons.lang3.StringUtils;

import exm.opgen.common.util.LineWrapper;

/**
 * The PyTree class hierarchy represents the Python constructs
 * necessary for op wrapper generation
 *
 * PyTree is the most abstract Python construct
 * */
public abstract class PyTree
{
  int indentation = 0;
  static int indentWidth = 2;
  static int rightMargin = LineWrapper.DEFAULT_RIGHT_MARGIN;

  public abstract void appendTo(StringBuilder sb);

  /**
   * Set layout parameters for all generated code
   * @param indent spaces per nesting level
   * @param margin maximum width of wrapped lines
   */
  public static void configure(int indent, int margin) {
    indentWidth = indent;
    rightMargin = margin;
  }

  public static int indentWidth() {
    return indentWidth;
  }

  public static int rightMargin() {
    return rightMargin;
  }

  /**
   * Append the body to the StringBuilder, one level deeper
   * than this tree.
   * @param sb
   * @param body
   */
  public void appendBlock(StringBuilder sb, PyTree body) {
    body.setIndentation(indentation + indentWidth);
    body.appendTo(sb);
  }

  public void indent(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void setIndentation(int i)
  {
    indentation = i;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb);
    return sb.toString();
  }
}
