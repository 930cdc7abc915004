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
package exm.opgen.pybackend;

import java.util.ArrayList;
import java.util.List;

import exm.opgen.common.lang.ArgDef;

/**
 * Convert between per-argument values and the flat tensor lists that
 * the runtime works with.
 */
public class ArgFlattener {

  /** Marker for a scalar argument in a sizes list */
  public static final String SCALAR = "";

  private enum State {
    STARTING, WAS_LIST, WAS_SOLO
  }

  /**
   * Build an expression for the flat list of all tensors in args.
   * Consecutive scalar arguments are grouped into one list literal,
   * list arguments are spliced in with list(...).
   * @param args arguments to flatten
   * @param names python variable holding each argument
   * @param sizes if not null, receives for each argument either
   *        {@link #SCALAR} or an expression for its length
   */
  public static String flatten(List<ArgDef> args, List<String> names,
                               List<String> sizes) {
    assert(args.size() == names.size());
    StringBuilder sb = new StringBuilder();
    State state = State.STARTING;
    for (int i = 0; i < args.size(); i++) {
      ArgDef arg = args.get(i);
      String name = names.get(i);
      if (arg.isList()) {
        if (state == State.WAS_SOLO) {
          sb.append("] + ");
        } else if (state == State.WAS_LIST) {
          sb.append(" + ");
        }
        sb.append("list(").append(name).append(")");
        state = State.WAS_LIST;
        if (sizes != null) {
          if (arg.numberAttr() != null) {
            sizes.add(PyNamer.attrVarName(arg.numberAttr()));
          } else {
            sizes.add("len(" + name + ")");
          }
        }
      } else {
        if (state == State.WAS_SOLO) {
          sb.append(", ");
        } else if (state == State.WAS_LIST) {
          sb.append(" + [");
        } else {
          sb.append("[");
        }
        sb.append(name);
        state = State.WAS_SOLO;
        if (sizes != null) {
          sizes.add(SCALAR);
        }
      }
    }
    switch (state) {
      case STARTING:
        return "[]";
      case WAS_SOLO:
        sb.append("]");
        return sb.toString();
      case WAS_LIST:
        return sb.toString();
      default:
        throw new IllegalStateException("Unknown state " + state);
    }
  }

  /**
   * Statements that regroup a flat list held in var so that each list
   * position becomes a single nested list.
   * @param sizes one entry per position: {@link #SCALAR} or a length
   *              expression
   */
  public static List<String> unflatten(List<String> sizes, String var) {
    List<String> result = new ArrayList<String>();
    for (int i = 0; i < sizes.size(); i++) {
      String size = sizes.get(i);
      if (size.isEmpty()) {
        continue;
      }
      StringBuilder sb = new StringBuilder();
      sb.append(var).append(" = ");
      if (i > 0) {
        sb.append(var).append("[:").append(i).append("] + ");
      }
      if (i + 1 < sizes.size()) {
        if (i == 0) {
          // Avoid "0 +" in the generated code
          sb.append("[").append(var).append("[:").append(size).append("]] + ");
          sb.append(var).append("[").append(size).append(":]");
        } else {
          sb.append("[").append(var).append("[").append(i).append(":")
            .append(i).append(" + ").append(size).append("]] + ");
          sb.append(var).append("[").append(i).append(" + ").append(size)
            .append(":]");
        }
      } else {
        sb.append("[").append(var).append("[").append(i).append(":]]");
      }
      result.add(sb.toString());
    }
    return result;
  }
}
