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
import java.util.List;

/**
 * Python try construct
 *
 * try:
 *   body
 * except clause:
 *   handler
 * */
public class Try extends PyTree
{
  private final Sequence body;
  private final List<String> clauses = new ArrayList<String>();
  private final List<Sequence> handlers = new ArrayList<Sequence>();

  public Try(Sequence body)
  {
    this.body = body;
  }

  public Try()
  {
    this(new Sequence());
  }

  public Sequence body() {
    return body;
  }

  /**
   * @param clause what follows "except", e.g. "(TypeError, ValueError)"
   * @return the handler block to fill in
   */
  public Sequence addExcept(String clause)
  {
    Sequence handler = new Sequence();
    addExcept(clause, handler);
    return handler;
  }

  public void addExcept(String clause, Sequence handler)
  {
    clauses.add(clause);
    handlers.add(handler);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    assert(!clauses.isEmpty()) : "try without except";
    indent(sb);
    sb.append("try:\n");
    appendBlock(sb, body);
    for (int i = 0; i < clauses.size(); i++) {
      indent(sb);
      sb.append("except ");
      sb.append(clauses.get(i));
      sb.append(":\n");
      appendBlock(sb, handlers.get(i));
    }
  }
}
