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

import exm.opgen.pybackend.ParamPlan.Param;
import exm.opgen.pybackend.tree.Def;
import exm.opgen.pybackend.tree.If;
import exm.opgen.pybackend.tree.Line;
import exm.opgen.pybackend.tree.Sequence;
import exm.opgen.pybackend.tree.Try;
import exm.opgen.pybackend.tree.WrappedLine;

/**
 * Hooks that let user code override public ops: decorators, a
 * type-based pre-check and a dispatch attempt after a failed graph
 * construction.  Nothing is added for hidden ops.
 */
public class DispatchInjector {

  public static void addDecorators(OpContext ctx, Def def) {
    if (!ctx.isVisible()) {
      return;
    }
    def.addDecorator(PyRuntime.FALLBACK_DISPATCH_DECORATOR);
    def.addDecorator(PyRuntime.TYPE_DISPATCH_DECORATOR);
  }

  /**
   * Offer the call to the type-based dispatcher, returning its result
   * unless it declines.
   */
  public static Sequence typeBasedDispatch(OpContext ctx) {
    Sequence result = new Sequence();
    if (!ctx.isVisible()) {
      return result;
    }
    StringBuilder args = new StringBuilder("(");
    for (Param p: ctx.plan().all()) {
      args.append(p.renameTo()).append(", ");
    }
    args.append(ParamPlan.NAME_PARAM).append(",), None)");
    result.add("_result = " + PyNamer.dispatcherAlias(ctx.functionName()) +
               "(");
    result.add(WrappedLine.continued("    ", args.toString()));
    If check = new If("_result is not NotImplemented", false);
    check.thenBlock().add("return _result");
    result.add(check);
    return result;
  }

  /**
   * Add an except clause to t that retries the call through the
   * dispatch list, re-raising if no dispatcher handles it.
   */
  public static void addFallbackDispatch(OpContext ctx, Try t) {
    if (!ctx.isVisible()) {
      return;
    }
    Sequence handler = t.addExcept("(TypeError, ValueError)");
    handler.add(PyRuntime.DISPATCH_CALL_PREFIX);
    handler.add(new WrappedLine("      " + ctx.functionName() + ", (), dict(",
                                keywordArgs(ctx)));
    handler.add("    )");
    If check = new If("_result is not " + PyRuntime.NOT_SUPPORTED, false);
    check.thenBlock().add("return _result");
    handler.add(check);
    handler.add("raise");
  }

  /**
   * Keyword arguments naming every parameter, closed with ")"
   */
  static String keywordArgs(OpContext ctx) {
    StringBuilder sb = new StringBuilder();
    for (Param p: ctx.plan().all()) {
      sb.append(PyNamer.avoidKeyword(p.name())).append("=")
        .append(p.renameTo()).append(", ");
    }
    sb.append(ParamPlan.NAME_PARAM).append("=").append(ParamPlan.NAME_PARAM)
      .append(")");
    return sb.toString();
  }

  /**
   * Module level alias for the dispatcher, so a parameter with the same
   * name as the function can't shadow it.
   * @return null for hidden ops
   */
  public static Line dispatcherAlias(OpContext ctx) {
    if (!ctx.isVisible()) {
      return null;
    }
    String fn = ctx.functionName();
    return new Line(PyNamer.dispatcherAlias(fn) + " = " + fn + "." +
                    PyRuntime.TYPE_BASED_DISPATCHER);
  }
}
