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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.opgen.common.Logging;
import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.lang.ApiDef.Endpoint;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;
import exm.opgen.pybackend.tree.Call;
import exm.opgen.pybackend.tree.Comment;
import exm.opgen.pybackend.tree.Def;
import exm.opgen.pybackend.tree.If;
import exm.opgen.pybackend.tree.Line;
import exm.opgen.pybackend.tree.PyList;
import exm.opgen.pybackend.tree.PyString;
import exm.opgen.pybackend.tree.PyTree;
import exm.opgen.pybackend.tree.Sequence;
import exm.opgen.pybackend.tree.Try;
import exm.opgen.pybackend.tree.WrappedLine;

/**
 * Generates the code block for one op: the public function, which
 * tries immediate execution and otherwise stages the op into a graph,
 * and the fallback function used when the runtime's fast path declines.
 */
public class OpEmitter {

  private static final Logger logger = Logging.getLogger();

  private static final String EAGER_COMMENT =
      "Add nodes to the TensorFlow graph.";

  private final OpContext ctx;

  private OpEmitter(OpContext ctx) {
    this.ctx = ctx;
  }

  /**
   * @param usedFunctionNames names of python functions generated so
   *        far, updated with the new ones.  May be null.
   */
  public static Sequence emit(OpContext ctx, Set<String> usedFunctionNames)
        throws GenerationException {
    return new OpEmitter(ctx).emit(usedFunctionNames);
  }

  private Sequence emit(Set<String> usedFunctionNames)
        throws GenerationException {
    Map<EmitPath, Sequence> bodies =
          new EnumMap<EmitPath, Sequence>(EmitPath.class);
    for (EmitPath path = EmitPath.FAST_PATH; path != EmitPath.EMITTED;
         path = path.next()) {
      logger.trace(ctx.functionName() + ": emitting " + path);
      bodies.put(path, emitPath(path));
    }
    Sequence docString = DocStrings.emit(ctx, PyTree.indentWidth());
    return assemble(bodies, docString, usedFunctionNames);
  }

  private Sequence emitPath(EmitPath path) {
    switch (path) {
      case FAST_PATH:
        return fastPath();
      case FALLBACK:
        return fallback();
      case DEFERRED:
        return deferred();
      case EMITTED:
        throw new IllegalStateException("Nothing to emit for " + path);
      default:
        throw new IllegalStateException("Unknown path " + path);
    }
  }

  private Sequence assemble(Map<EmitPath, Sequence> bodies,
        Sequence docString, Set<String> usedFunctionNames) {
    Sequence block = new Sequence();
    if (ctx.outputCount() > 1) {
      block.append(outputTuple());
    }
    if (ctx.annotate()) {
      block.append(TypeAnnotations.typeVars(ctx.op()));
    }

    String fn = ctx.functionName();
    Map<String, String> annotations = ctx.typeAnnotations();
    Def main = new Def(fn, usedFunctionNames,
          ctx.plan().signature(true, annotations), ctx.returnAnnotation());
    DispatchInjector.addDecorators(ctx, main);
    for (String decorator: exportDecorators()) {
      main.addDecorator(decorator);
    }
    Sequence body = main.body();
    body.append(docString);
    body.add(PyRuntime.GET_CONTEXT);
    body.add(PyRuntime.THREAD_LOCAL);
    If eager = new If(PyRuntime.IS_EAGER, true);
    eager.thenBlock().append(bodies.get(EmitPath.FAST_PATH));
    eager.elseBlock().append(DispatchInjector.typeBasedDispatch(ctx));
    body.add(eager);
    body.append(bodies.get(EmitPath.DEFERRED));
    block.add(main);
    block.add(Line.BLANK);

    block.add(rawOpExport());
    Line alias = DispatchInjector.dispatcherAlias(ctx);
    if (alias != null) {
      block.add(alias);
    }
    block.add(Line.BLANK);
    block.add(Line.BLANK);

    Def fallback = new Def(PyNamer.fallbackFunctionName(fn),
          usedFunctionNames, ctx.plan().signature(false, annotations) +
          ", ctx", ctx.returnAnnotation());
    fallback.body().append(bodies.get(EmitPath.FALLBACK));
    block.add(fallback);
    block.add(Line.BLANK);
    return block;
  }

  /**
   * Named tuple type for ops with several outputs
   */
  private Sequence outputTuple() {
    List<PyString> names = new ArrayList<PyString>();
    for (ArgDef out: ctx.op().outputs()) {
      names.add(new PyString(
            PyNamer.avoidKeyword(ctx.api().outArgName(out.name()))));
    }
    Sequence result = new Sequence();
    result.add(PyNamer.outputTupleName(ctx.op().name()) +
               " = collections.namedtuple(");
    result.add("    " + new PyString(ctx.op().name()) + ",");
    result.add(WrappedLine.continued("    ",
                                     new PyList(names, false) + ")"));
    result.add(Line.BLANK);
    result.add(Line.BLANK);
    return result;
  }

  /**
   * tf_export lists endpoints that are current; if some are deprecated
   * the full list is given as v1.
   */
  private List<String> exportDecorators() {
    List<String> result = new ArrayList<String>();
    List<Endpoint> endpoints = ctx.api().endpoints();
    if (!ctx.isVisible() || endpoints.isEmpty()) {
      return result;
    }
    List<String> names = new ArrayList<String>();
    List<String> namesV1 = new ArrayList<String>();
    List<String> deprecated = new ArrayList<String>();
    for (Endpoint e: endpoints) {
      String quoted = "'" + PyNamer.lowerCaseOpName(e.name()) + "'";
      namesV1.add(quoted);
      if (e.deprecated()) {
        deprecated.add(quoted);
      } else {
        names.add(quoted);
      }
    }
    String args = StringUtils.join(names, ", ");
    if (!names.equals(namesV1)) {
      args += (args.isEmpty() ? "" : ", ") + "v1=[" +
              StringUtils.join(namesV1, ", ") + "]";
    }
    result.add(PyRuntime.TF_EXPORT + "(" + args + ")");
    if (!deprecated.isEmpty()) {
      result.add(PyRuntime.DEPRECATED_ENDPOINTS + "(" +
                 StringUtils.join(deprecated, ", ") + ")");
    }
    return result;
  }

  private Line rawOpExport() {
    String raw = PyNamer.avoidReserved(ctx.op().name());
    return new Line(raw + " = " + PyRuntime.TF_EXPORT + "(\"" +
          PyRuntime.RAW_OPS_PREFIX + raw + "\")(" + PyRuntime.TO_RAW_OP +
          "(" + ctx.functionName() + "))");
  }

  /**
   * Body of the eager branch of the public function
   */
  private Sequence fastPath() {
    Sequence result = new Sequence();
    if (!ctx.eagerAllowed()) {
      result.add(ctx.eagerNotAllowedError());
      return result;
    }
    StringBuilder execParams = new StringBuilder();
    execParams.append("_ctx, \"").append(ctx.op().name()).append("\", ");
    execParams.append(ParamPlan.NAME_PARAM);
    for (String input: ctx.schemaInputNames()) {
      execParams.append(", ").append(input);
    }
    List<String> fallbackParams = new ArrayList<String>(
          ctx.canonicalInputNames());
    for (AttrDef attr: ctx.op().attrs()) {
      if (ctx.inference().isInferred(attr.name())) {
        continue;
      }
      String param = ctx.attrExpression(attr.name());
      execParams.append(", \"").append(attr.name()).append("\", ")
                .append(param);
      fallbackParams.add(param + "=" + param);
    }
    execParams.append(")");
    fallbackParams.add("name=name");
    fallbackParams.add("ctx=_ctx");

    Try fast = new Try();
    fast.body().add("_result = " + PyRuntime.FAST_PATH_EXECUTE + "(");
    fast.body().add(WrappedLine.continued("  ", execParams.toString()));
    if (ctx.outputCount() > 1) {
      fast.body().add("_result = " +
          PyNamer.outputTupleName(ctx.op().name()) + "._make(_result)");
    }
    fast.body().add("return _result");
    fast.addExcept(PyRuntime.NOT_OK_STATUS).add(PyRuntime.RAISE_NOT_OK);
    fast.addExcept(PyRuntime.FALLBACK_EXCEPTION).add("pass");
    result.add(fast);

    Try fallback = new Try();
    fallback.body().append(DispatchInjector.typeBasedDispatch(ctx));
    fallback.body().add("return " +
          PyNamer.fallbackFunctionName(ctx.functionName()) + "(");
    fallback.body().add(WrappedLine.continued("    ",
          StringUtils.join(fallbackParams, ", ") + ")"));
    fallback.addExcept(PyRuntime.SYMBOLIC_EXCEPTION)
            .add("pass  # " + EAGER_COMMENT);
    DispatchInjector.addFallbackDispatch(ctx, fallback);
    result.add(fallback);
    return result;
  }

  /**
   * Body of the fallback function
   */
  private Sequence fallback() {
    Sequence result = new Sequence();
    if (!ctx.eagerAllowed()) {
      result.add(ctx.eagerNotAllowedError());
      return result;
    }
    result.append(FunctionSetup.emit(ctx));
    inferredAttrs(result);
    inputCasts(result);
    result.add("_inputs_flat = " + ArgFlattener.flatten(
          ctx.op().inputs(), ctx.schemaInputNames(), null));

    if (ctx.op().attrs().isEmpty()) {
      result.add("_attrs = None");
    } else {
      List<String> values = new ArrayList<String>();
      for (AttrDef attr: ctx.op().attrs()) {
        values.add("\"" + attr.name() + "\", " +
                   ctx.attrExpression(attr.name()));
      }
      result.add(new WrappedLine("_attrs = (",
                                 StringUtils.join(values, ", ") + ")"));
    }
    Call execute = new Call(PyRuntime.EXECUTE, PyString.bytes(ctx.op().name()))
          .arg(ctx.outputSizes().countExpr())
          .kwarg("inputs", "_inputs_flat").kwarg("attrs", "_attrs")
          .kwarg("ctx", "ctx")
          .kwarg(ParamPlan.NAME_PARAM, ParamPlan.NAME_PARAM);
    result.add(new WrappedLine("_result = " + PyRuntime.EXECUTE + "(",
                               execute.argsString() + ")"));

    if (ctx.outputCount() > 0) {
      If record = new If(PyRuntime.MUST_RECORD_GRADIENT, false);
      addRecordGradient(record.thenBlock());
      result.add(record);
      shapeResult(result);
    } else {
      result.add("_result = None");
    }
    result.add("return _result");
    return result;
  }

  /**
   * Convert inputs whose types are given by attributes, and compute
   * those attributes from them
   */
  private void inferredAttrs(Sequence result) {
    List<ArgDef> inputs = ctx.canonicalInputs();
    List<String> names = ctx.canonicalInputNames();
    for (AttrDef attr: ctx.op().attrs()) {
      if (!ctx.inference().isInferred(attr.name())) {
        continue;
      }
      List<Integer> indices = ctx.inference().argIndices(attr.name());
      List<ArgDef> args = new ArrayList<ArgDef>();
      List<String> argNames = new ArrayList<String>();
      for (int i: indices) {
        args.add(inputs.get(i));
        argNames.add(names.get(i));
      }
      String var = PyNamer.attrVarName(attr.name());
      if (attr.type().is(AttrKind.TYPE)) {
        matchingType(attr, var, args, argNames, result);
      } else if (attr.type().isListOf(AttrKind.TYPE)) {
        // Defaults for list(type) attrs are not used
        if (argNames.size() > 1) {
          String tuple = PyList.tupleOfNames(argNames).toString();
          result.add(new WrappedLine(var + ", " + tuple + " = ",
                PyRuntime.ARGS_TO_MIXED + "(" + tuple + ", ctx)"));
        } else {
          String arg = argNames.get(0);
          result.add(new WrappedLine(var + ", " + arg + " = ",
                PyRuntime.CONVERT_MIXED + "(" + arg + ", ctx)"));
        }
      }
    }
  }

  private void matchingType(AttrDef attr, String var, List<ArgDef> args,
                            List<String> argNames, Sequence result) {
    List<String> sizes = new ArrayList<String>();
    String flat = ArgFlattener.flatten(args, argNames, sizes);
    List<String> allowed = new ArrayList<String>();
    for (DataType t: attr.allowedTypes()) {
      allowed.add(t.pythonName());
    }
    StringBuilder conv = new StringBuilder(PyRuntime.ARGS_TO_MATCHING);
    conv.append("(").append(flat).append(", ctx, [");
    conv.append(StringUtils.join(allowed, ", ")).append("]");
    AttrValue dflt = ParamPlan.effectiveDefault(ctx.api(), attr);
    if (dflt != null) {
      conv.append(", ").append(dflt.getDataType().pythonName());
    }
    conv.append(")");

    if (sizes.size() == 1) {
      String arg = argNames.get(0);
      String target = sizes.get(0).isEmpty() ? "(" + arg + ",)" : arg;
      result.add(new WrappedLine(var + ", " + target + " = ",
                                 conv.toString()));
    } else {
      String inputsVar = "_inputs_" + attr.name();
      result.add(new WrappedLine(var + ", " + inputsVar + " = ",
                                 conv.toString()));
      result.addAll(ArgFlattener.unflatten(sizes, inputsVar));
      result.add(PyList.tupleOfNames(argNames) + " = " + inputsVar);
    }
  }

  /**
   * Inputs of fixed type are converted directly
   */
  private void inputCasts(Sequence result) {
    for (ArgDef in: ctx.op().inputs()) {
      if (in.typeAttr() != null || in.typeListAttr() != null) {
        continue;
      }
      String param = ctx.inputParamName(in.name());
      String fn = in.numberAttr() == null ?
            PyRuntime.CONVERT_TO_TENSOR : PyRuntime.CONVERT_N_TO_TENSOR;
      result.add(param + " = " +
                 Call.fnCall(fn, param, in.type().pythonName()));
    }
  }

  private void addRecordGradient(Sequence seq) {
    seq.add(PyRuntime.RECORD_GRADIENT + "(");
    seq.add("    \"" + ctx.op().name() +
            "\", _inputs_flat, _attrs, _result)");
  }

  /**
   * Turn the flat result list into what the function returns
   */
  private void shapeResult(Sequence seq) {
    OutputSizes sizes = ctx.outputSizes();
    if (ctx.outputCount() == 1 && sizes.isList(0)) {
      // Single list result
    } else if (ctx.outputCount() == 1) {
      seq.add("_result, = _result");
    } else {
      seq.addAll(ArgFlattener.unflatten(sizes.sizes(), "_result"));
      seq.add("_result = " + PyNamer.outputTupleName(ctx.op().name()) +
              "._make(_result)");
    }
  }

  /**
   * Graph construction, after the eager branch of the public function
   */
  private Sequence deferred() {
    Sequence result = new Sequence();
    result.add(new Comment(EAGER_COMMENT));
    result.append(FunctionSetup.emit(ctx));

    Sequence apply = new Sequence();
    apply.add("_, _, _op, _outputs = " + PyRuntime.APPLY_OP_HELPER + "(");
    apply.add(WrappedLine.continued("    ", "\"" + ctx.op().name() + "\", " +
                                    DispatchInjector.keywordArgs(ctx)));
    if (ctx.isVisible()) {
      Try t = new Try(apply);
      DispatchInjector.addFallbackDispatch(ctx, t);
      result.add(t);
    } else {
      result.append(apply);
    }

    if (ctx.outputCount() == 0) {
      result.add("return _op");
      return result;
    }
    result.add("_result = _outputs[:]");
    if (ctx.outputCount() == 1 && ctx.op().isStateful() &&
        ctx.op().outputs().get(0).isList()) {
      If empty = new If("not _result", false);
      empty.thenBlock().add("return _op");
      result.add(empty);
    }

    If record = new If(PyRuntime.MUST_RECORD_GRADIENT, false);
    Sequence recordBody = record.thenBlock();
    if (ctx.op().attrs().isEmpty()) {
      recordBody.add("_attrs = ()");
    } else {
      List<String> values = new ArrayList<String>();
      for (AttrDef attr: ctx.op().attrs()) {
        String getter = PyRuntime.graphAttrGetter(attr.type().kind(),
                                                  attr.type().isList());
        values.add("\"" + attr.name() + "\", " + getter + "(\"" +
                   attr.name() + "\")");
      }
      recordBody.add(new WrappedLine("_attrs = (",
                                     StringUtils.join(values, ", ") + ")"));
    }
    recordBody.add("_inputs_flat = _op.inputs");
    addRecordGradient(recordBody);
    result.add(record);

    shapeResult(result);
    result.add("return _result");
    return result;
  }
}
