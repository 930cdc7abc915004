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
 * Statements at the same nesting level
 */
public class Sequence extends PyTree
{
  private final List<PyTree> members = new ArrayList<PyTree>();

  public Sequence(PyTree... trees)
  {
    for (PyTree tree : trees)
      add(tree);
  }

  public void add(PyTree tree)
  {
    members.add(tree);
  }

  /**
   * Convenience: add a single unwrapped statement
   */
  public void add(String line)
  {
    members.add(new Line(line));
  }

  public void addAll(List<String> lines)
  {
    for (String line : lines)
      add(line);
  }

  /**
   * Append at end of current sequence
   * @param seq
   */
  public void append(Sequence seq)
  {
    members.addAll(seq.members);
  }

  public boolean isEmpty()
  {
    return members.isEmpty();
  }

  public int size()
  {
    return members.size();
  }

  public PyTree get(int i)
  {
    return members.get(i);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (PyTree member : members)
    {
      member.setIndentation(indentation);
      member.appendTo(sb);
    }
  }
}
