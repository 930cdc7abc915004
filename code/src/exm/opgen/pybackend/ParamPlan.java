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

import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.exceptions.UnsupportedAttrTypeException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.OpDef;

/**
 * Parameters of a generated wrapper: every input in canonical order,
 * then attributes without defaults, then attributes with defaults.
 * A trailing name parameter always comes last.
 */
public class ParamPlan {

  public static final String NAME_PARAM = "name";

  /**
   * A parameter: the schema name and the name in the generated code
   */
  public static class Param {
    private final String name;
    private final String renameTo;

    public Param(String name, String renameTo) {
      this.name = name;
      this.renameTo = renameTo;
    }

    public String name() {
      return name;
    }

    public String renameTo() {
      return renameTo;
    }

    @Override
    public String toString() {
      return name.equals(renameTo) ? name : name + "->" + renameTo;
    }
  }

  private final List<Param> inputs;
  private final List<Param> requiredAttrs;
  private final List<Param> defaultedAttrs;
  /** schema attr name -> python default expression */
  private final Map<String, String> defaults;

  private ParamPlan(List<Param> inputs, List<Param> requiredAttrs,
                    List<Param> defaultedAttrs, Map<String, String> defaults) {
    this.inputs = Collections.unmodifiableList(inputs);
    this.requiredAttrs = Collections.unmodifiableList(requiredAttrs);
    this.defaultedAttrs = Collections.unmodifiableList(defaultedAttrs);
    this.defaults = Collections.unmodifiableMap(defaults);
  }

  /**
   * @param inputParams inputs in canonical order
   * @throws GenerationException if an attribute can't be passed from
   *          python
   */
  public static ParamPlan build(OpDef op, ApiDef api, List<Param> inputParams,
        AttrInference inference) throws GenerationException {
    List<Param> required = new ArrayList<Param>();
    List<Param> defaulted = new ArrayList<Param>();
    Map<String, String> defaults = new HashMap<String, String>();

    for (AttrDef attr: op.attrs()) {
      if (attr.type().kind() == AttrKind.FUNC) {
        throw new UnsupportedAttrTypeException(op.name(), attr.name(),
                                               attr.type());
      }
      if (inference.isInferred(attr.name())) {
        continue;
      }
      Param p = new Param(attr.name(),
                          PyNamer.avoidKeyword(api.attrName(attr.name())));
      AttrValue dflt = effectiveDefault(api, attr);
      if (dflt == null) {
        required.add(p);
      } else {
        if (!dflt.type().equals(attr.type())) {
          throw new GenerationException(op.name(), "default for attr " +
              attr.name() + " has type " + dflt.type() + ", expected " +
              attr.type());
        }
        defaulted.add(p);
        defaults.put(attr.name(), PyLiterals.defaultExpression(op.name(),
                                                        p.renameTo(), dflt));
      }
    }
    return new ParamPlan(new ArrayList<Param>(inputParams), required,
                         defaulted, defaults);
  }

  /**
   * Override default if any, then schema default
   * @return null if no default
   */
  public static AttrValue effectiveDefault(ApiDef api, AttrDef attr) {
    AttrValue override = api.attrDefault(attr.name());
    if (override != null) {
      return override;
    }
    return attr.defaultValue();
  }

  public List<Param> inputs() {
    return inputs;
  }

  /** Attributes that must be passed, in schema order */
  public List<Param> requiredAttrs() {
    return requiredAttrs;
  }

  /** Attributes with defaults, in schema order */
  public List<Param> defaultedAttrs() {
    return defaultedAttrs;
  }

  /** Inputs then attributes without defaults */
  public List<Param> required() {
    List<Param> result = new ArrayList<Param>(inputs);
    result.addAll(requiredAttrs);
    return result;
  }

  /** Attribute parameters in signature order */
  public List<Param> attrParams() {
    List<Param> result = new ArrayList<Param>(requiredAttrs);
    result.addAll(defaultedAttrs);
    return result;
  }

  /** All parameters in signature order, excluding name */
  public List<Param> all() {
    List<Param> result = required();
    result.addAll(defaultedAttrs);
    return result;
  }

  public boolean hasDefault(String attrName) {
    return defaults.containsKey(attrName);
  }

  /**
   * @return python expression for default, or null
   */
  public String defaultExpr(String attrName) {
    return defaults.get(attrName);
  }

  /**
   * Render the parameter list of a def.
   * @param withDefaults if true, defaulted params get "=default" and the
   *        name parameter "=None"
   * @param annotations schema name -> annotation, may be empty
   */
  public String signature(boolean withDefaults,
                          Map<String, String> annotations) {
    StringBuilder sb = new StringBuilder();
    for (Param p: required()) {
      appendSep(sb);
      sb.append(p.renameTo());
      String ann = annotations.get(p.name());
      if (ann != null) {
        sb.append(": ").append(ann);
      }
    }
    for (Param p: defaultedAttrs) {
      appendSep(sb);
      sb.append(p.renameTo());
      String ann = annotations.get(p.name());
      if (withDefaults) {
        if (ann != null) {
          sb.append(":").append(ann);
        }
        sb.append("=").append(defaults.get(p.name()));
      } else if (ann != null) {
        sb.append(": ").append(ann);
      }
    }
    appendSep(sb);
    sb.append(withDefaults ? NAME_PARAM + "=None" : NAME_PARAM);
    return sb.toString();
  }

  private static void appendSep(StringBuilder sb) {
    if (sb.length() > 0) {
      sb.append(", ");
    }
  }

  @Override
  public String toString() {
    return "required: " + required() + " defaulted: " + defaultedAttrs;
  }
}
