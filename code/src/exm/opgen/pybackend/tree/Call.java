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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Function call expression, e.g. f(a, b, key=c)
 * */
public class Call extends Expression
{
  private final String function;
  private final List<Expression> args = new ArrayList<Expression>();
  private final List<String> keywords = new ArrayList<String>();
  private final List<Expression> keywordValues = new ArrayList<Expression>();

  public Call(String function, Expression... args)
  {
    this.function = function;
    this.args.addAll(Arrays.asList(args));
  }

  public Call arg(Expression arg)
  {
    args.add(arg);
    return this;
  }

  public Call arg(String code)
  {
    return arg(new Token(code));
  }

  public Call kwarg(String keyword, Expression value)
  {
    keywords.add(keyword);
    keywordValues.add(value);
    return this;
  }

  public Call kwarg(String keyword, String code)
  {
    return kwarg(keyword, new Token(code));
  }

  public static Call fnCall(String fnName, String... args)
  {
    Call call = new Call(fnName);
    for (String arg : args)
      call.arg(arg);
    return call;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(function);
    sb.append('(');
    appendArgs(sb);
    sb.append(')');
  }

  /**
   * Append only the argument list, without parentheses
   */
  public void appendArgs(StringBuilder sb)
  {
    boolean first = true;
    Iterator<Expression> it = args.iterator();
    while (it.hasNext())
    {
      if (!first)
        sb.append(", ");
      first = false;
      it.next().appendTo(sb);
    }
    for (int i = 0; i < keywords.size(); i++)
    {
      if (!first)
        sb.append(", ");
      first = false;
      sb.append(keywords.get(i));
      sb.append('=');
      keywordValues.get(i).appendTo(sb);
    }
  }

  public String argsString()
  {
    StringBuilder sb = new StringBuilder();
    appendArgs(sb);
    return sb.toString();
  }
}
