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

import org.apache.commons.lang3.StringUtils;

import exm.opgen.common.lang.AttrKind;

/**
 * Names of the runtime primitives that generated wrappers call.
 * The primitives themselves live in the Python runtime.
 *
 * This class is package-private: only the emitters use it
 * */
class PyRuntime {

  static final String EAGER_FALLBACK_SUFFIX = "_eager_fallback";

  /* Context and mode */
  static final String GET_CONTEXT =
      "_ctx = _context._context or _context.context()";
  static final String THREAD_LOCAL = "tld = _ctx._thread_local_data";
  static final String IS_EAGER = "tld.is_eager";

  /* Immediate execution */
  static final String FAST_PATH_EXECUTE =
      "pywrap_tfe.TFE_Py_FastPathExecute";
  static final String EXECUTE = "_execute.execute";
  static final String NOT_OK_STATUS =
      "_core._NotOkStatusException as e";
  static final String RAISE_NOT_OK = "_ops.raise_from_not_ok_status(e, name)";
  static final String FALLBACK_EXCEPTION = "_core._FallbackException";
  static final String SYMBOLIC_EXCEPTION = "_core._SymbolicException";

  /* Input conversion */
  static final String ARGS_TO_MATCHING = "_execute.args_to_matching_eager";
  static final String CONVERT_MIXED =
      "_execute.convert_to_mixed_eager_tensors";
  static final String ARGS_TO_MIXED = "_execute.args_to_mixed_eager_tensors";
  static final String CONVERT_TO_TENSOR = "_ops.convert_to_tensor";
  static final String CONVERT_N_TO_TENSOR = "_ops.convert_n_to_tensor";
  static final String MAKE_TENSOR = "_execute.make_tensor";

  /* Graph construction */
  static final String APPLY_OP_HELPER = "_op_def_library._apply_op_helper";
  static final String MUST_RECORD_GRADIENT =
      "_execute.must_record_gradient()";
  static final String RECORD_GRADIENT = "_execute.record_gradient";

  /* Dispatch */
  static final String FALLBACK_DISPATCH_DECORATOR =
      "_dispatch.add_fallback_dispatch_list";
  static final String TYPE_DISPATCH_DECORATOR =
      "_dispatch.add_type_based_api_dispatcher";
  static final String DISPATCH_CALL_PREFIX =
      "_result = _dispatch.dispatch(";
  static final String NOT_SUPPORTED = "_dispatch.OpDispatcher.NOT_SUPPORTED";
  static final String TYPE_BASED_DISPATCHER =
      "_tf_type_based_dispatcher.Dispatch";

  /* Export */
  static final String TF_EXPORT = "tf_export";
  static final String DEPRECATED_ENDPOINTS = "deprecated_endpoints";
  static final String TO_RAW_OP = "_ops.to_raw_op";
  static final String RAW_OPS_PREFIX = "raw_ops.";

  /** Module preamble of every generated file */
  static final List<String> IMPORTS = java.util.Arrays.asList(
      "import collections",
      "",
      "from tensorflow.python import pywrap_tfe as pywrap_tfe",
      "from tensorflow.python.eager import context as _context",
      "from tensorflow.python.eager import core as _core",
      "from tensorflow.python.eager import execute as _execute",
      "from tensorflow.python.framework import dtypes as _dtypes",
      "",
      "from tensorflow.python.framework import op_def_registry as _op_def_registry",
      "from tensorflow.python.framework import ops as _ops",
      "from tensorflow.python.framework import op_def_library as _op_def_library",
      "from tensorflow.python.util.deprecation import deprecated_endpoints",
      "from tensorflow.python.util import dispatch as _dispatch",
      "from tensorflow.python.util.tf_export import tf_export",
      "",
      "from typing import TypeVar");

  /**
   * Coercion helper for a scalar attribute of the given kind.
   * @return null for kinds that can't be coerced
   */
  static String makeFn(AttrKind kind) {
    switch (kind) {
      case STRING:
        return "_execute.make_str";
      case INT:
        return "_execute.make_int";
      case FLOAT:
        return "_execute.make_float";
      case BOOL:
        return "_execute.make_bool";
      case TYPE:
        return "_execute.make_type";
      case SHAPE:
        return "_execute.make_shape";
      case TENSOR:
        return MAKE_TENSOR;
      case FUNC:
        return null;
      default:
        throw new IllegalStateException("Unknown attr kind " + kind);
    }
  }

  /**
   * Loop variable used when coercing each element of a list attribute
   */
  static String elementVar(AttrKind kind) {
    switch (kind) {
      case STRING:
      case SHAPE:
        return "_s";
      case INT:
        return "_i";
      case FLOAT:
        return "_f";
      case BOOL:
        return "_b";
      case TYPE:
      case TENSOR:
        return "_t";
      case FUNC:
        return null;
      default:
        throw new IllegalStateException("Unknown attr kind " + kind);
    }
  }

  /**
   * Accessor on the graph op object used to read back an attribute
   * when recording gradients.
   */
  static String graphAttrGetter(AttrKind kind, boolean list) {
    if (list) {
      return "_op.get_attr";
    }
    switch (kind) {
      case TYPE:
        return "_op._get_attr_type";
      case BOOL:
        return "_op._get_attr_bool";
      case INT:
        return "_op._get_attr_int";
      case STRING:
      case FLOAT:
      case SHAPE:
      case TENSOR:
      case FUNC:
        return "_op.get_attr";
      default:
        throw new IllegalStateException("Unknown attr kind " + kind);
    }
  }

  static String header(List<String> sourceFiles) {
    StringBuilder sb = new StringBuilder();
    sb.append("\"\"\"Python wrappers around TensorFlow ops.\n\n");
    sb.append("This file is MACHINE GENERATED! Do not edit.\n");
    if (!sourceFiles.isEmpty()) {
      sb.append("Original C++ source file: ");
      sb.append(StringUtils.join(sourceFiles, ", "));
      sb.append("\n");
    }
    sb.append("\"\"\"\n\n");
    for (String imp: IMPORTS) {
      sb.append(imp);
      sb.append("\n");
    }
    return sb.toString();
  }
}
