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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.OpDef;
import exm.opgen.common.lang.Visibility;
import exm.opgen.pybackend.ParamPlan.Param;

/**
 * Everything derived from one op and its override that the emitters
 * need.  Built once per op and discarded afterwards.
 */
public class OpContext {
  private final OpDef op;
  private final ApiDef api;
  private final String functionName;
  private final String opName;
  private final boolean annotate;

  /** Inputs in signature order */
  private final List<ArgDef> canonicalInputs;
  private final AttrInference inference;
  private final ParamPlan plan;

  /** schema attr name -> python expression for its value */
  private final Map<String, String> attrExpressions;
  private final Map<String, String> typeAnnotations;
  private final OutputSizes outputSizes;

  /** Python statement refusing immediate execution, or null */
  private final String eagerNotAllowedError;

  private OpContext(OpDef op, ApiDef api, String functionName,
        boolean annotate, List<ArgDef> canonicalInputs,
        AttrInference inference, ParamPlan plan,
        Map<String, String> attrExpressions, OutputSizes outputSizes) {
    this.op = op;
    this.api = api;
    this.functionName = functionName;
    this.opName = functionName.startsWith("_") ?
                        functionName.substring(1) : functionName;
    this.annotate = annotate;
    this.canonicalInputs = Collections.unmodifiableList(canonicalInputs);
    this.inference = inference;
    this.plan = plan;
    this.attrExpressions = Collections.unmodifiableMap(attrExpressions);
    this.outputSizes = outputSizes;
    this.typeAnnotations = annotate ?
          TypeAnnotations.annotationsFor(op) :
          Collections.<String, String>emptyMap();
    this.eagerNotAllowedError = eagerNotAllowedError(op, api, opName);
  }

  /**
   * @param functionName final python name of the generated function
   * @param annotate whether to add type annotations
   * @throws GenerationException if the op or override is inconsistent
   *          or uses unsupported features
   */
  public static OpContext build(OpDef op, ApiDef api, String functionName,
        boolean annotate) throws GenerationException {
    List<ArgDef> canonical = canonicalInputs(op, api);
    List<Param> inputParams = new ArrayList<Param>(canonical.size());
    List<String> inputNames = new ArrayList<String>(canonical.size());
    for (ArgDef in: canonical) {
      String renamed = PyNamer.avoidKeyword(api.inArgName(in.name()));
      inputParams.add(new Param(in.name(), renamed));
      inputNames.add(renamed);
    }
    AttrInference inference = AttrInference.resolve(canonical, inputNames);
    for (String attr: inference.inferredAttrs()) {
      if (op.findAttr(attr) == null) {
        throw new GenerationException(op.name(),
              "input refers to unknown attr " + attr);
      }
    }
    checkNames(op, api, inputNames);

    ParamPlan plan = ParamPlan.build(op, api, inputParams, inference);

    Map<String, String> attrExpressions = new HashMap<String, String>();
    for (Param p: plan.attrParams()) {
      attrExpressions.put(p.name(), p.renameTo());
    }
    for (String attr: inference.inferredAttrs()) {
      attrExpressions.put(attr, PyNamer.attrVarName(attr));
    }
    OutputSizes sizes = OutputSizes.compute(op, attrExpressions, inference);

    return new OpContext(op, api, functionName, annotate, canonical,
                         inference, plan, attrExpressions, sizes);
  }

  private static List<ArgDef> canonicalInputs(OpDef op, ApiDef api)
        throws GenerationException {
    List<String> order = api.argOrder();
    if (order.isEmpty()) {
      return new ArrayList<ArgDef>(op.inputs());
    }
    if (order.size() != op.inputs().size()) {
      throw new GenerationException(op.name(), "arg_order has " +
          order.size() + " entries but op has " + op.inputs().size() +
          " inputs");
    }
    List<ArgDef> result = new ArrayList<ArgDef>(order.size());
    Set<String> seen = new HashSet<String>();
    for (String name: order) {
      ArgDef arg = op.findInput(name);
      if (arg == null) {
        throw new GenerationException(op.name(),
              "arg_order refers to unknown input " + name);
      }
      if (!seen.add(name)) {
        throw new GenerationException(op.name(),
              "arg_order names input " + name + " twice");
      }
      result.add(arg);
    }
    return result;
  }

  /**
   * Parameter names must be distinct after renaming
   */
  private static void checkNames(OpDef op, ApiDef api,
        List<String> inputNames) throws GenerationException {
    Set<String> names = new HashSet<String>();
    names.add(ParamPlan.NAME_PARAM);
    List<String> all = new ArrayList<String>(inputNames);
    for (AttrDef attr: op.attrs()) {
      all.add(PyNamer.avoidKeyword(api.attrName(attr.name())));
    }
    for (String name: all) {
      if (!names.add(name)) {
        throw new GenerationException(op.name(), "parameter name " + name +
                                      " is used twice");
      }
    }
  }

  private static String eagerNotAllowedError(OpDef op, ApiDef api,
                                             String opName) {
    String refArg = null;
    for (ArgDef in: op.inputs()) {
      if (in.isRef()) {
        refArg = api.inArgName(in.name());
      }
    }
    for (ArgDef out: op.outputs()) {
      if (out.isRef()) {
        refArg = api.outArgName(out.name());
      }
    }
    if (refArg == null) {
      return null;
    }
    return "raise RuntimeError(\"" + opName + " op does not support eager " +
           "execution. Arg '" + refArg + "' is a ref.\")";
  }

  public OpDef op() {
    return op;
  }

  public ApiDef api() {
    return api;
  }

  public boolean isVisible() {
    return api.visibility() == Visibility.VISIBLE;
  }

  /** Python name of the generated function */
  public String functionName() {
    return functionName;
  }

  /** Function name without a leading underscore, used in messages */
  public String opName() {
    return opName;
  }

  public boolean annotate() {
    return annotate;
  }

  public List<ArgDef> canonicalInputs() {
    return canonicalInputs;
  }

  /** Parameter name for each input in signature order */
  public List<String> canonicalInputNames() {
    List<String> result = new ArrayList<String>();
    for (Param p: plan.inputs()) {
      result.add(p.renameTo());
    }
    return result;
  }

  /** Parameter name for an input, by schema name */
  public String inputParamName(String schemaName) {
    for (Param p: plan.inputs()) {
      if (p.name().equals(schemaName)) {
        return p.renameTo();
      }
    }
    throw new IllegalArgumentException("No input " + schemaName + " in " +
                                       op.name());
  }

  /** Parameter names for inputs in schema order */
  public List<String> schemaInputNames() {
    List<String> result = new ArrayList<String>();
    for (ArgDef in: op.inputs()) {
      result.add(inputParamName(in.name()));
    }
    return result;
  }

  public AttrInference inference() {
    return inference;
  }

  public ParamPlan plan() {
    return plan;
  }

  /**
   * @return python expression holding attr value inside the generated
   *          function
   */
  public String attrExpression(String attrName) {
    String expr = attrExpressions.get(attrName);
    assert(expr != null) : attrName;
    return expr;
  }

  /** schema name -> annotation; empty if not annotating */
  public Map<String, String> typeAnnotations() {
    return typeAnnotations;
  }

  public OutputSizes outputSizes() {
    return outputSizes;
  }

  public int outputCount() {
    return op.outputs().size();
  }

  public boolean eagerAllowed() {
    return eagerNotAllowedError == null;
  }

  public String eagerNotAllowedError() {
    return eagerNotAllowedError;
  }

  /** Return annotation of the generated function, or null */
  public String returnAnnotation() {
    if (!annotate) {
      return null;
    }
    return TypeAnnotations.returnAnnotation(op);
  }

  @Override
  public String toString() {
    return functionName + ": " + plan;
  }
}
