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
package exm.opgen.common.util;

import org.apache.commons.lang3.StringUtils;

/**
 * Word wrapping for generated code and documentation.
 *
 * The first line starts with the prefix; continuation lines are
 * indented by as many spaces as the prefix is wide.  Lines are broken
 * only at spaces; a word longer than the width is kept whole.  Code is
 * only broken inside brackets, where Python joins lines implicitly.
 */
public class LineWrapper {

  public static final int DEFAULT_RIGHT_MARGIN = 78;

  /**
   * Wrap code: spaces inside string literals or outside brackets are
   * never break points.  Brackets left open by the prefix count.
   * @param prefix text of first line before body
   * @param body text to wrap
   * @param width maximum line length, including prefix
   */
  public static String wrap(String prefix, String body, int width) {
    return wrap(prefix, body, width, false);
  }

  /**
   * Wrap code that continues a bracket opened on an earlier line.
   * @param enclosed true if the statement is already inside brackets
   */
  public static String wrap(String prefix, String body, int width,
                            boolean enclosed) {
    int depth = bracketDepth(prefix, enclosed ? 1 : 0);
    return wrap(prefix, body, width, codeBreakPoints(body, depth));
  }

  /**
   * Wrap prose: quotes and brackets have no special meaning.
   */
  public static String wrapText(String prefix, String body, int width) {
    boolean breakable[] = new boolean[body.length()];
    for (int i = 0; i < body.length(); i++) {
      breakable[i] = body.charAt(i) == ' ';
    }
    return wrap(prefix, body, width, breakable);
  }

  private static String wrap(String prefix, String body, int width,
                             boolean breakable[]) {
    String spaces = StringUtils.repeat(' ', prefix.length());
    StringBuilder result = new StringBuilder(prefix);
    int lineStart = 0;
    int pos = 0;
    final int len = body.length();
    while (pos < len) {
      int lineLen = result.length() - lineStart;
      if (lineLen + (len - pos) <= width) {
        // Remaining text fits on this line
        result.append(body, pos, len);
        break;
      }

      // Break at the last space that keeps this line within width, or
      // failing that, the first space after it
      int limit = pos + (width - lineLen);
      int brk = -1;
      for (int i = Math.min(limit, len - 1); i > pos; i--) {
        if (breakable[i]) {
          brk = i;
          break;
        }
      }
      if (brk < 0) {
        for (int i = Math.max(limit + 1, pos + 1); i < len; i++) {
          if (breakable[i]) {
            brk = i;
            break;
          }
        }
      }
      if (brk < 0) {
        result.append(body, pos, len);
        break;
      }

      result.append(StringUtils.stripEnd(body.substring(pos, brk), " "));
      pos = brk + 1;
      while (pos < len && body.charAt(pos) == ' ') {
        pos++;
      }
      if (pos < len) {
        result.append('\n');
        lineStart = result.length();
        result.append(spaces);
      }
    }
    return result.toString();
  }

  /**
   * @return bracket nesting at the end of text, starting from depth
   */
  private static int bracketDepth(String text, int depth) {
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else {
        depth = nest(c, depth);
      }
    }
    return depth;
  }

  private static int nest(char c, int depth) {
    switch (c) {
      case '(':
      case '[':
      case '{':
        return depth + 1;
      case ')':
      case ']':
      case '}':
        return Math.max(0, depth - 1);
      default:
        return depth;
    }
  }

  /**
   * @param depth bracket nesting before the first character of body
   * @return array where true marks a space we may break at
   */
  private static boolean[] codeBreakPoints(String body, int depth) {
    boolean result[] = new boolean[body.length()];
    char quote = 0;
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          // Skip escaped character
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == ' ') {
        result[i] = depth > 0;
      } else {
        depth = nest(c, depth);
      }
    }
    return result;
  }
}
