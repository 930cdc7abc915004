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
 * Python list or tuple display, e.g. [a, b] or (a,)
 * */
public class PyList extends Expression
{
  private final List<Expression> items;
  private final boolean tuple;

  public PyList(List<? extends Expression> items, boolean tuple)
  {
    this.items = new ArrayList<Expression>(items);
    this.tuple = tuple;
  }

  public PyList(Expression... items)
  {
    this(Arrays.asList(items), false);
  }

  public static PyList tuple(List<? extends Expression> items)
  {
    return new PyList(items, true);
  }

  public static PyList tupleOfNames(List<String> names)
  {
    return new PyList(tokens(names), true);
  }

  public static PyList listOfNames(List<String> names)
  {
    return new PyList(tokens(names), false);
  }

  private static List<Token> tokens(List<String> names)
  {
    List<Token> result = new ArrayList<Token>(names.size());
    for (String name : names)
      result.add(new Token(name));
    return result;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(tuple ? '(' : '[');
    Iterator<Expression> it = items.iterator();
    while (it.hasNext())
    {
      it.next().appendTo(sb);
      if (it.hasNext())
        sb.append(", ");
    }
    // One-element tuple needs trailing comma
    if (tuple && items.size() == 1)
      sb.append(',');
    sb.append(tuple ? ')' : ']');
  }
}
