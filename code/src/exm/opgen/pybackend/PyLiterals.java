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

import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.AttrValue.Shape;
import exm.opgen.pybackend.tree.PyList;
import exm.opgen.pybackend.tree.PyString;
import exm.opgen.pybackend.tree.Token;

/**
 * Render attribute values as Python source literals
 */
public class PyLiterals {

  private static final String TRIPLE_QUOTE = "\"\"\"";

  /**
   * Python expression for an attribute default.
   * Tensor defaults are rebuilt at call time from their text form.
   * @param opName used in error messages
   * @param paramName name passed to the tensor constructor
   */
  public static String defaultExpression(String opName, String paramName,
        AttrValue value) throws GenerationException {
    if (value.type().is(AttrKind.TENSOR)) {
      return PyRuntime.MAKE_TENSOR + "(" + tensorText(value) + ", \"" +
             paramName + "\")";
    } else if (value.type().isListOf(AttrKind.TENSOR)) {
      List<Token> texts = new ArrayList<Token>();
      for (AttrValue elem: value.getList()) {
        texts.add(new Token(tensorText(elem)));
      }
      return "[" + PyRuntime.MAKE_TENSOR + "(_pb, \"" + paramName +
             "\") for _pb in " + PyList.tuple(texts) + "]";
    }
    return toPython(opName, value);
  }

  /**
   * Python literal for a non-tensor value
   */
  public static String toPython(String opName, AttrValue value)
        throws GenerationException {
    if (value.type().isList()) {
      StringBuilder sb = new StringBuilder("[");
      boolean first = true;
      for (AttrValue elem: value.getList()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(scalarToPython(opName, elem));
      }
      sb.append("]");
      return sb.toString();
    }
    return scalarToPython(opName, value);
  }

  private static String scalarToPython(String opName, AttrValue value)
        throws GenerationException {
    AttrKind kind = value.type().kind();
    switch (kind) {
      case STRING:
        return new PyString(value.getString()).toString();
      case INT:
        return Long.toString(value.getInt());
      case FLOAT:
        return floatToPython(value.getFloat());
      case BOOL:
        return value.getBool() ? "True" : "False";
      case TYPE:
        return value.getDataType().pythonName();
      case SHAPE:
        return shapeToPython(value.getShape());
      case TENSOR:
        return tensorText(value);
      case FUNC:
        throw new GenerationException(opName,
              "can't render a default for attr of type 'func'");
      default:
        throw new IllegalStateException("Unknown attr kind " + kind);
    }
  }

  public static String floatToPython(double f) {
    if (Double.isNaN(f)) {
      return "float('nan')";
    } else if (Double.isInfinite(f)) {
      return f > 0 ? "float('inf')" : "float('-inf')";
    } else if (f == Math.rint(f) && Math.abs(f) < 1e15) {
      return Long.toString((long)f);
    }
    return Double.toString(f).toLowerCase();
  }

  private static String shapeToPython(Shape shape) {
    if (shape.unknownRank()) {
      return "None";
    }
    StringBuilder sb = new StringBuilder("[");
    List<Long> dims = shape.dims();
    for (int i = 0; i < dims.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(dims.get(i));
    }
    sb.append("]");
    return sb.toString();
  }

  private static String tensorText(AttrValue value) {
    return TRIPLE_QUOTE + value.getTensorText() + TRIPLE_QUOTE;
  }
}
