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

import org.apache.commons.lang3.StringUtils;

import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrType;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;
import exm.opgen.common.util.LineWrapper;
import exm.opgen.pybackend.ParamPlan.Param;
import exm.opgen.pybackend.tree.Line;
import exm.opgen.pybackend.tree.PyTree;
import exm.opgen.pybackend.tree.Sequence;

/**
 * Docstring of the generated wrapper, built from the override's summary
 * and description and the argument documentation.
 */
public class DocStrings {

  private static final String QUOTES = "\"\"\"";
  private static final String NO_DOC = "TODO: add doc.";
  private static final String ITEM_INDENT = "  ";
  private static final String DTYPES_PREFIX = "_dtypes.";

  /**
   * @param bodyIndent column at which the docstring starts, for wrapping
   */
  public static Sequence emit(OpContext ctx, int bodyIndent)
        throws GenerationException {
    List<String> lines = new ArrayList<String>();
    String summary = ctx.api().summary();
    String description = ctx.api().description();
    if (summary.isEmpty() && description.isEmpty()) {
      summary = NO_DOC;
    }
    lines.add("r" + QUOTES + escape(summary));
    if (!description.isEmpty()) {
      lines.add("");
      for (String l: escape(description).split("\n", -1)) {
        lines.add(l);
      }
    }
    lines.add("");

    int width = PyTree.rightMargin() - bodyIndent;
    lines.add("Args:");
    for (Param p: ctx.plan().inputs()) {
      ArgDef arg = ctx.op().findInput(p.name());
      item(lines, p.renameTo(), inputDoc(ctx, arg), width);
    }
    for (Param p: ctx.plan().attrParams()) {
      AttrDef attr = ctx.op().findAttr(p.name());
      item(lines, p.renameTo(), attrDoc(ctx, attr), width);
    }
    item(lines, ParamPlan.NAME_PARAM,
         "A name for the operation (optional).", width);
    lines.add("");

    lines.add("Returns:");
    outputs(ctx, lines, width);
    lines.add(QUOTES);

    Sequence result = new Sequence();
    for (String l: lines) {
      result.add(l.isEmpty() ? Line.BLANK : new Line(l));
    }
    return result;
  }

  private static void outputs(OpContext ctx, List<String> lines, int width) {
    List<ArgDef> outs = ctx.op().outputs();
    if (outs.isEmpty()) {
      lines.add(ITEM_INDENT + "The created Operation.");
    } else if (outs.size() == 1) {
      ArgDef out = outs.get(0);
      wrapped(lines, ITEM_INDENT, withDescription(outputType(ctx, out),
                                                  out.description()), width);
    } else {
      List<String> names = new ArrayList<String>();
      for (ArgDef out: outs) {
        names.add(outputName(ctx, out));
      }
      wrapped(lines, ITEM_INDENT, "A tuple of `Tensor` objects (" +
              StringUtils.join(names, ", ") + ").", width);
      lines.add("");
      for (ArgDef out: outs) {
        item(lines, outputName(ctx, out),
             withDescription(outputType(ctx, out), out.description()), width);
      }
    }
  }

  private static String outputName(OpContext ctx, ArgDef out) {
    return PyNamer.avoidKeyword(ctx.api().outArgName(out.name()));
  }

  private static void item(List<String> lines, String name, String text,
                           int width) {
    wrapped(lines, ITEM_INDENT + name + ": ", text, width);
  }

  private static void wrapped(List<String> lines, String prefix, String text,
                              int width) {
    String w = LineWrapper.wrapText(prefix, escape(text), width);
    for (String l: w.split("\n")) {
      lines.add(l);
    }
  }

  private static String withDescription(String typeText, String description) {
    if (description.isEmpty()) {
      return typeText;
    }
    return typeText + " " + description.replace('\n', ' ');
  }

  /**
   * Describe the tensor type of an input, relative to the first input
   * of the same type where there is one.
   */
  private static String inputDoc(OpContext ctx, ArgDef arg) {
    String desc;
    String mutable = arg.isRef() ? "mutable " : "";
    if (arg.typeListAttr() != null) {
      desc = "A list of " + mutable + "`Tensor` objects.";
    } else if (arg.typeAttr() != null) {
      String first = ctx.inference().firstArgName(arg.typeAttr());
      String self = ctx.inputParamName(arg.name());
      String sameType;
      if (first != null && !first.equals(self)) {
        sameType = "Must have the same type as `" + first + "`.";
      } else {
        sameType = allowedTypes(ctx.op().findAttr(arg.typeAttr()));
      }
      if (arg.numberAttr() != null) {
        desc = "A list of " + mutable + "`Tensor` objects with the same type.";
      } else {
        desc = "A " + mutable + "`Tensor`.";
      }
      if (!sameType.isEmpty()) {
        desc += " " + sameType;
      }
    } else if (arg.numberAttr() != null) {
      desc = "A list of " + mutable + "`Tensor` objects with type `" +
             arg.type().schemaName() + "`.";
    } else {
      desc = "A " + mutable + "`Tensor` of type `" +
             arg.type().schemaName() + "`.";
    }
    return withDescription(desc, arg.description());
  }

  private static String allowedTypes(AttrDef attr) {
    if (attr == null || attr.allowedTypes().isEmpty()) {
      return "";
    }
    List<String> names = new ArrayList<String>();
    for (DataType t: attr.allowedTypes()) {
      names.add("`" + t.schemaName() + "`");
    }
    return "Must be one of the following types: " +
           StringUtils.join(names, ", ") + ".";
  }

  private static String outputType(OpContext ctx, ArgDef out) {
    String mutable = out.isRef() ? "mutable " : "";
    if (out.typeListAttr() != null) {
      return "A list of " + mutable + "`Tensor` objects of type `" +
             ctx.api().attrName(out.typeListAttr()) + "`.";
    }
    String typeText;
    if (out.typeAttr() != null) {
      String first = ctx.inference().firstArgName(out.typeAttr());
      if (first != null) {
        typeText = "Has the same type as `" + first + "`.";
      } else {
        typeText = "of type `" + ctx.api().attrName(out.typeAttr()) + "`.";
      }
    } else {
      typeText = "of type `" + out.type().schemaName() + "`.";
    }
    if (out.numberAttr() != null) {
      String count = ctx.inference().isInferred(out.numberAttr()) ?
            "" : "`" + ctx.api().attrName(out.numberAttr()) + "` ";
      return "A list of " + count + mutable + "`Tensor` objects " +
             (typeText.startsWith("Has") ? "with the same type as `" +
               ctx.inference().firstArgName(out.typeAttr()) + "`." :
               "with type " + typeText.substring("of type ".length()));
    }
    if (typeText.startsWith("Has")) {
      return "A " + mutable + "`Tensor`. " + typeText;
    }
    return "A " + mutable + "`Tensor` " + typeText;
  }

  private static String attrDoc(OpContext ctx, AttrDef attr)
        throws GenerationException {
    AttrType type = attr.type();
    String typeName = attrTypeName(type);
    String result;
    if (ctx.plan().hasDefault(attr.name())) {
      AttrValue dflt = ParamPlan.effectiveDefault(ctx.api(), attr);
      result = "An optional " + typeName + ".";
      if (!type.is(AttrKind.TENSOR) && !type.isListOf(AttrKind.TENSOR)) {
        // dtypes are documented under their public module
        String text = PyLiterals.toPython(ctx.op().name(), dflt)
                                .replace(DTYPES_PREFIX, "tf.");
        result += " Defaults to `" + text + "`.";
      }
    } else {
      result = (startsWithVowel(typeName) ? "An " : "A ") + typeName + ".";
    }
    if (type.is(AttrKind.TYPE) && !attr.allowedTypes().isEmpty()) {
      List<String> names = new ArrayList<String>();
      for (DataType t: attr.allowedTypes()) {
        names.add("`" + t.schemaName() + "`");
      }
      result += " From: " + StringUtils.join(names, ", ") + ".";
    }
    return withDescription(result, attr.description());
  }

  private static String attrTypeName(AttrType type) {
    String scalar;
    switch (type.kind()) {
      case STRING:
        scalar = type.isList() ? "strings" : "string";
        break;
      case INT:
        scalar = type.isList() ? "ints" : "int";
        break;
      case FLOAT:
        scalar = type.isList() ? "floats" : "float";
        break;
      case BOOL:
        scalar = type.isList() ? "bools" : "bool";
        break;
      case TYPE:
        scalar = type.isList() ? "tf.DTypes" : "tf.DType";
        break;
      case SHAPE:
        scalar = type.isList() ? "tf.TensorShape objects" : "tf.TensorShape";
        break;
      case TENSOR:
        scalar = type.isList() ? "tf.TensorProto objects" : "tf.TensorProto";
        break;
      case FUNC:
        scalar = type.isList() ? "functions" : "function";
        break;
      default:
        throw new IllegalStateException("Unknown attr kind " + type.kind());
    }
    return type.isList() ? "list of `" + scalar + "`" : "`" + scalar + "`";
  }

  private static boolean startsWithVowel(String typeName) {
    String s = StringUtils.stripStart(typeName, "`");
    return !s.isEmpty() && "aeiou".indexOf(s.charAt(0)) >= 0;
  }

  /**
   * The docstring is a raw string: only a run of three quotes would end
   * it early.
   */
  private static String escape(String text) {
    return text.replace(QUOTES, "\\\"\\\"\\\"");
  }
}
