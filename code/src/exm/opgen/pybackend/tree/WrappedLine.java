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
 * A statement that may be word-wrapped to the right margin.
 * Continuation lines line up with the end of the prefix, and breaks
 * fall only inside brackets.
 */
public class WrappedLine extends PyTree
{
  private final String prefix;
  private final String body;
  private final boolean enclosed;

  /**
   * @param prefix start of statement, not wrapped
   * @param body remainder of statement, wrapped at spaces outside strings
   */
  public WrappedLine(String prefix, String body)
  {
    this(prefix, body, false);
  }

  /**
   * @param enclosed true if this line continues a bracket opened on an
   *                 earlier line, so breaks are allowed at its top level
   */
  public WrappedLine(String prefix, String body, boolean enclosed)
  {
    this.prefix = prefix;
    this.body = body;
    this.enclosed = enclosed;
  }

  /**
   * Continuation of a call whose opening bracket ends the previous line
   */
  public static WrappedLine continued(String prefix, String body)
  {
    return new WrappedLine(prefix, body, true);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    String start = StringUtils.repeat(' ', indentation) + prefix;
    sb.append(LineWrapper.wrap(start, body, rightMargin, enclosed));
    sb.append('\n');
  }
}
