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
import java.util.Set;

import exm.opgen.common.exceptions.OpGenRuntimeError;

/**
 * Python function definition, with decorators
 */
public class Def extends PyTree
{
  private final String name;
  private final String params;
  private final String returnType;
  private final List<String> decorators = new ArrayList<String>();
  private final Sequence body;

  /**
   * @param name
   * @param usedFunctionNames used to ensure we're not generating
   *                  duplicate functions, or null to skip the check
   * @param params parameter list without parentheses
   * @param returnType return annotation, or null
   */
  public Def(String name, Set<String> usedFunctionNames, String params,
             String returnType)
  {
    checkPythonFunctionName(name);
    if (usedFunctionNames != null) {
      if (!usedFunctionNames.add(name)) {
        throw new OpGenRuntimeError("Duplicate function: " + name);
      }
    }
    this.name = name;
    this.params = params;
    this.returnType = returnType;
    this.body = new Sequence();
  }

  public Def(String name, String params)
  {
    this(name, null, params, null);
  }

  public String name() {
    return name;
  }

  public Sequence body() {
    return body;
  }

  /**
   * @param decorator without the leading @
   */
  public void addDecorator(String decorator) {
    decorators.add(decorator);
  }

  /**
   * Check that there are no invalid characters
   */
  private static void checkPythonFunctionName(String name) {
    if (name.length() == 0 || Character.isDigit(name.charAt(0))) {
      throw new OpGenRuntimeError("Bad python function name '" + name + "'");
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') {
        throw new OpGenRuntimeError("Bad character '" + c +
                                  "' in python function name " + name);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (String decorator : decorators) {
      indent(sb);
      sb.append('@');
      sb.append(decorator);
      sb.append('\n');
    }
    String end = returnType == null ? "):" : ") -> " + returnType + ":";
    WrappedLine defLine = new WrappedLine("def " + name + "(", params + end);
    defLine.setIndentation(indentation);
    defLine.appendTo(sb);
    if (body.isEmpty()) {
      body.add("pass");
    }
    appendBlock(sb, body);
  }
}
