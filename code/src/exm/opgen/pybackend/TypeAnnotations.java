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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.DataType;
import exm.opgen.common.lang.OpDef;
import exm.opgen.pybackend.tree.Line;
import exm.opgen.pybackend.tree.Sequence;

/**
 * Python type hints for the ops that opt in.
 * Each type attribute gets a TypeVar; single tensors are annotated as
 * _ops.Tensor[...].  Lists of tensors are left unannotated.
 */
public class TypeAnnotations {

  /**
   * @return schema name of attr or input -> annotation
   */
  public static Map<String, String> annotationsFor(OpDef op) {
    Map<String, String> result = new HashMap<String, String>();
    for (AttrDef attr: op.attrs()) {
      if (attr.type().isList()) {
        continue;
      }
      switch (attr.type().kind()) {
        case TYPE:
          result.put(attr.name(), PyNamer.typeVarName(op.name(), attr.name()));
          break;
        case INT:
          result.put(attr.name(), "int");
          break;
        case FLOAT:
          result.put(attr.name(), "float");
          break;
        case BOOL:
          result.put(attr.name(), "bool");
          break;
        case STRING:
          result.put(attr.name(), "str");
          break;
        case SHAPE:
        case TENSOR:
        case FUNC:
          break;
        default:
          throw new IllegalStateException("Unknown attr kind " +
                                          attr.type().kind());
      }
    }
    for (ArgDef in: op.inputs()) {
      if (!in.isList()) {
        result.put(in.name(), tensorAnnotation(op, in));
      }
    }
    return result;
  }

  /**
   * @return annotation for the result of an op with a single
   *          non-list output, otherwise null
   */
  public static String returnAnnotation(OpDef op) {
    if (op.outputs().size() != 1) {
      return null;
    }
    ArgDef out = op.outputs().get(0);
    if (out.isList()) {
      return null;
    }
    return tensorAnnotation(op, out);
  }

  private static String tensorAnnotation(OpDef op, ArgDef arg) {
    if (arg.typeAttr() != null) {
      return "_ops.Tensor[" + PyNamer.typeVarName(op.name(), arg.typeAttr()) +
             "]";
    }
    return "_ops.Tensor[" + arg.type().annotationName() + "]";
  }

  /**
   * TypeVar declarations, one per type attribute, followed by a blank
   * line.  Empty if the op has no type attributes.
   */
  public static Sequence typeVars(OpDef op) {
    Sequence result = new Sequence();
    for (AttrDef attr: op.attrs()) {
      if (!attr.type().is(AttrKind.TYPE)) {
        continue;
      }
      List<String> classes = new ArrayList<String>();
      for (DataType t: attr.allowedTypes()) {
        classes.add(t.annotationName());
      }
      if (classes.isEmpty()) {
        classes.addAll(DataType.allAnnotationNames());
      }
      Collections.sort(classes);
      String name = PyNamer.typeVarName(op.name(), attr.name());
      result.add(name + " = TypeVar(\"" + name + "\", " +
                 StringUtils.join(classes, ", ") + ")");
    }
    if (!result.isEmpty()) {
      result.add(Line.BLANK);
    }
    return result;
  }
}
