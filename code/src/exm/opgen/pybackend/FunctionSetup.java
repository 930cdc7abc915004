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

import java.util.List;

import exm.opgen.common.exceptions.OpGenRuntimeError;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrType;
import exm.opgen.pybackend.ParamPlan.Param;
import exm.opgen.pybackend.tree.Call;
import exm.opgen.pybackend.tree.If;
import exm.opgen.pybackend.tree.PyString;
import exm.opgen.pybackend.tree.Sequence;
import exm.opgen.pybackend.tree.Token;

/**
 * Statements at the top of both the graph path and the fallback
 * function: validate list inputs, compute inferred lengths, fill in
 * defaults and coerce attribute values.
 */
public class FunctionSetup {

  public static Sequence emit(OpContext ctx) {
    Sequence result = new Sequence();
    inferLengths(ctx, result);
    for (Param p: ctx.plan().attrParams()) {
      AttrDef attr = ctx.op().findAttr(p.name());
      coerceAttr(ctx, attr, p, result);
    }
    return result;
  }

  /**
   * int attributes inferred from list lengths.  The first list sets the
   * attribute, all later ones must have the same length.
   */
  private static void inferLengths(OpContext ctx, Sequence result) {
    List<String> inputNames = ctx.canonicalInputNames();
    for (AttrDef attr: ctx.op().attrs()) {
      if (!attr.type().is(AttrKind.INT) ||
          !ctx.inference().isInferred(attr.name())) {
        continue;
      }
      String var = PyNamer.attrVarName(attr.name());
      String first = ctx.inference().firstArgName(attr.name());
      boolean isFirst = true;
      for (int index: ctx.inference().argIndices(attr.name())) {
        String arg = inputNames.get(index);
        expectList(ctx, arg, result);
        if (isFirst) {
          result.add(var + " = len(" + arg + ")");
          isFirst = false;
        } else {
          If check = new If("len(" + arg + ") != " + var, false);
          Sequence body = check.thenBlock();
          body.add("raise ValueError(");
          body.add("    \"List argument '" + arg + "' to '" + ctx.opName() +
                   "' Op with length %d \"");
          body.add("    \"must match length %d of argument '" + first +
                   "'.\" %");
          body.add("    (len(" + arg + "), " + var + "))");
          result.add(check);
        }
      }
    }
  }

  /**
   * Raise TypeError unless var holds a list or tuple
   */
  static void expectList(OpContext ctx, String var, Sequence result) {
    If check = new If("not isinstance(" + var + ", (list, tuple))", false);
    Sequence body = check.thenBlock();
    body.add("raise TypeError(");
    body.add("    \"Expected list for '" + var + "' argument to \"");
    body.add("    \"'" + ctx.opName() + "' Op, not %r.\" % " + var + ")");
    result.add(check);
  }

  private static void coerceAttr(OpContext ctx, AttrDef attr, Param p,
                                 Sequence result) {
    String var = p.renameTo();
    if (ctx.plan().hasDefault(attr.name())) {
      If dflt = new If(var + " is None", false);
      dflt.thenBlock().add(var + " = " + ctx.plan().defaultExpr(attr.name()));
      result.add(dflt);
    }
    AttrType type = attr.type();
    String fn = PyRuntime.makeFn(type.kind());
    if (fn == null) {
      throw new OpGenRuntimeError("attr " + attr.name() + " of op " +
            ctx.op().name() + " has type " + type + " which can't be coerced");
    }
    if (type.isList()) {
      expectList(ctx, var, result);
      String elem = PyRuntime.elementVar(type.kind());
      Call make = new Call(fn, new Token(elem), new PyString(var));
      result.add(var + " = [" + make + " for " + elem + " in " + var + "]");
    } else {
      result.add(var + " = " + new Call(fn, new Token(var), new PyString(var)));
    }
  }
}
