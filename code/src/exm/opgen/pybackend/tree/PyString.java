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

/**
 * Python string literal in double quotes.
 */
public class PyString extends Expression
{
  private final String value;
  /** Prefix such as b for bytes literals */
  private final String prefix;

  public PyString(String value, String prefix)
  {
    this.value = value;
    this.prefix = prefix;
  }

  public PyString(String value)
  {
    this(value, "");
  }

  public static PyString bytes(String value)
  {
    return new PyString(value, "b");
  }

  public String value()
  {
    return value;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(prefix);
    sb.append('"');
    pyEscapeString(value, sb);
    sb.append('"');
  }

  private static void pyEscapeString(String unescaped, StringBuilder escaped) {
    for (int i = 0; i < unescaped.length(); i++) {
      char c = unescaped.charAt(i);
      switch (c) {
      case '\n':
        escaped.append("\\n");
        break;
      case '\r':
        escaped.append("\\r");
        break;
      case '\t':
        escaped.append("\\t");
        break;
      case '\\':
        escaped.append("\\\\");
        break;
      case '"':
        escaped.append("\\\"");
        break;
      default:
        if (Character.isISOControl(c)) {
          escaped.append(String.format("\\x%02x", (int)c));
        } else {
          escaped.append(c);
        }
      }
    }
  }
}
