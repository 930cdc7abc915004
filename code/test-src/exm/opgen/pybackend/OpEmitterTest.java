package exm.opgen.pybackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.opgen.common.Logging;
import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.OpDef;
import exm.opgen.common.lang.Visibility;
import exm.opgen.common.util.LineWrapper;
import exm.opgen.pybackend.tree.PyTree;

public class OpEmitterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  /**
   * Most tests check whole lines, so don't wrap them
   */
  @Before
  public void wideMargin() {
    PyTree.configure(2, 1000);
  }

  @After
  public void resetMargin() {
    PyTree.configure(2, LineWrapper.DEFAULT_RIGHT_MARGIN);
  }

  static String generate(OpDef op) throws GenerationException {
    return generate(op, ApiDef.defaultFor(op), false);
  }

  static String generate(OpDef op, ApiDef api, boolean annotate)
      throws GenerationException {
    String fn = PyOpsGenerator.functionName(op, api,
                                       Collections.<String>emptySet());
    OpContext ctx = OpContext.build(op, api, fn, annotate);
    return OpEmitter.emit(ctx, new HashSet<String>()).toString();
  }

  static void assertContains(String code, String expected) {
    assertTrue("Expected:\n" + expected + "\nin:\n" + code,
               code.contains(expected));
  }

  static void assertNotContains(String code, String unexpected) {
    assertFalse("Did not expect:\n" + unexpected + "\nin:\n" + code,
                code.contains(unexpected));
  }

  @Test
  public void testAddSignature() throws Exception {
    String code = generate(OpFixtures.add());
    assertContains(code, "\ndef add(x, y, name=None):\n");
    assertContains(code, "\ndef add_eager_fallback(x, y, name, ctx):\n");
    assertContains(code,
        "@_dispatch.add_fallback_dispatch_list\n" +
        "@_dispatch.add_type_based_api_dispatcher\n" +
        "@tf_export('add')\n" +
        "def add(");
  }

  @Test
  public void testAddFastPath() throws Exception {
    String code = generate(OpFixtures.add());
    assertContains(code,
        "  _ctx = _context._context or _context.context()\n" +
        "  tld = _ctx._thread_local_data\n" +
        "  if tld.is_eager:\n" +
        "    try:\n" +
        "      _result = pywrap_tfe.TFE_Py_FastPathExecute(\n" +
        "        _ctx, \"Add\", name, x, y)\n" +
        "      return _result\n" +
        "    except _core._NotOkStatusException as e:\n" +
        "      _ops.raise_from_not_ok_status(e, name)\n" +
        "    except _core._FallbackException:\n" +
        "      pass\n" +
        "    try:\n" +
        "      _result = _dispatcher_for_add(\n" +
        "          (x, y, name,), None)\n" +
        "      if _result is not NotImplemented:\n" +
        "        return _result\n" +
        "      return add_eager_fallback(\n" +
        "          x, y, name=name, ctx=_ctx)\n" +
        "    except _core._SymbolicException:\n" +
        "      pass  # Add nodes to the TensorFlow graph.\n" +
        "    except (TypeError, ValueError):\n" +
        "      _result = _dispatch.dispatch(\n" +
        "            add, (), dict(x=x, y=y, name=name)\n" +
        "          )\n" +
        "      if _result is not _dispatch.OpDispatcher.NOT_SUPPORTED:\n" +
        "        return _result\n" +
        "      raise\n" +
        "  else:\n" +
        "    _result = _dispatcher_for_add(\n" +
        "        (x, y, name,), None)\n" +
        "    if _result is not NotImplemented:\n" +
        "      return _result\n" +
        "  # Add nodes to the TensorFlow graph.\n");
  }

  @Test
  public void testAddDeferredPath() throws Exception {
    String code = generate(OpFixtures.add());
    assertContains(code,
        "  try:\n" +
        "    _, _, _op, _outputs = _op_def_library._apply_op_helper(\n" +
        "        \"Add\", x=x, y=y, name=name)\n" +
        "  except (TypeError, ValueError):\n");
    assertContains(code,
        "  _result = _outputs[:]\n" +
        "  if _execute.must_record_gradient():\n" +
        "    _attrs = (\"T\", _op._get_attr_type(\"T\"))\n" +
        "    _inputs_flat = _op.inputs\n" +
        "    _execute.record_gradient(\n" +
        "        \"Add\", _inputs_flat, _attrs, _result)\n" +
        "  _result, = _result\n" +
        "  return _result\n");
    assertContains(code,
        "\nAdd = tf_export(\"raw_ops.Add\")(_ops.to_raw_op(add))\n" +
        "_dispatcher_for_add = add._tf_type_based_dispatcher.Dispatch\n" +
        "\n\ndef add_eager_fallback(");
  }

  @Test
  public void testAddFallbackInfersSharedType() throws Exception {
    String code = generate(OpFixtures.add());
    assertContains(code,
        "def add_eager_fallback(x, y, name, ctx):\n" +
        "  _attr_T, _inputs_T = _execute.args_to_matching_eager(" +
        "[x, y], ctx, [_dtypes.float32, _dtypes.int32])\n" +
        "  (x, y) = _inputs_T\n" +
        "  _inputs_flat = [x, y]\n" +
        "  _attrs = (\"T\", _attr_T)\n" +
        "  _result = _execute.execute(b\"Add\", 1, inputs=_inputs_flat, " +
        "attrs=_attrs, ctx=ctx, name=name)\n" +
        "  if _execute.must_record_gradient():\n" +
        "    _execute.record_gradient(\n" +
        "        \"Add\", _inputs_flat, _attrs, _result)\n" +
        "  _result, = _result\n" +
        "  return _result\n");
    // Single output is unwrapped on both paths
    assertEquals(2, StringUtils.countMatches(code, "_result, = _result\n"));
    assertNotContains(code, "namedtuple");
  }

  @Test
  public void testSplitListOutput() throws Exception {
    String code = generate(OpFixtures.split());
    assertContains(code, "def split(axis, value, num_split, name=None):\n");
    assertContains(code,
        "        _ctx, \"Split\", name, axis, value, \"num_split\", " +
        "num_split)\n");
    assertContains(code,
        "  num_split = _execute.make_int(num_split, \"num_split\")\n" +
        "  _attr_T, (value,) = _execute.args_to_matching_eager(" +
        "[value], ctx, [])\n" +
        "  axis = _ops.convert_to_tensor(axis, _dtypes.int32)\n" +
        "  _inputs_flat = [axis, value]\n" +
        "  _attrs = (\"num_split\", num_split, \"T\", _attr_T)\n" +
        "  _result = _execute.execute(b\"Split\", num_split, ");
    assertContains(code,
        "    _attrs = (\"num_split\", _op._get_attr_int(\"num_split\"), " +
        "\"T\", _op._get_attr_type(\"T\"))\n");
    // The list is returned as is
    assertNotContains(code, "_result, = _result");
    assertNotContains(code, "_result = _result[");
  }

  @Test
  public void testListThenScalarOutputUnflatten() throws Exception {
    String code = generate(OpFixtures.splitWithCount());
    assertContains(code,
        "_SplitWithCountOutput = collections.namedtuple(\n" +
        "    \"SplitWithCount\",\n" +
        "    [\"output\", \"count\"])\n" +
        "\n\n");
    assertContains(code, "b\"SplitWithCount\", num_split + 1, ");
    assertContains(code,
        "  _result = [_result[:num_split]] + _result[num_split:]\n" +
        "  _result = _SplitWithCountOutput._make(_result)\n");
    assertNotContains(code, "0 +");
  }

  @Test
  public void testMultipleOutputsNamedTuple() throws Exception {
    String code = generate(OpFixtures.unique());
    assertContains(code, "def unique(x, out_idx=_dtypes.int32, name=None):\n");
    assertContains(code, "def unique_eager_fallback(x, out_idx, name, ctx):\n");
    assertContains(code,
        "        _ctx, \"Unique\", name, x, \"out_idx\", out_idx)\n" +
        "      _result = _UniqueOutput._make(_result)\n" +
        "      return _result\n");
    assertContains(code,
        "  if out_idx is None:\n" +
        "    out_idx = _dtypes.int32\n" +
        "  out_idx = _execute.make_type(out_idx, \"out_idx\")\n");
    assertContains(code, "b\"Unique\", 2, ");
    assertContains(code, "    [\"y\", \"idx\"])\n");
    assertEquals(2, StringUtils.countMatches(code,
        "  _result = _UniqueOutput._make(_result)\n  return _result\n"));
  }

  @Test
  public void testNoOutputs() throws Exception {
    String code = generate(OpFixtures.noOp());
    assertContains(code, "def no_op(name=None):\n");
    assertContains(code, "def no_op_eager_fallback(name, ctx):\n");
    assertContains(code,
        "        \"NoOp\", name=name)\n");
    assertContains(code,
        "  _inputs_flat = []\n" +
        "  _attrs = None\n" +
        "  _result = _execute.execute(b\"NoOp\", 0, inputs=_inputs_flat, " +
        "attrs=_attrs, ctx=ctx, name=name)\n" +
        "  _result = None\n" +
        "  return _result\n");
    assertContains(code, "    raise\n  return _op\n");
    assertNotContains(code, "_outputs[:]");
    assertNotContains(code, "record_gradient");
  }

  @Test
  public void testRefOpRefusesEager() throws Exception {
    String code = generate(OpFixtures.assignAdd());
    String refusal = "raise RuntimeError(\"assign_add op does not support " +
        "eager execution. Arg 'output_ref' is a ref.\")\n";
    assertContains(code, "  if tld.is_eager:\n    " + refusal);
    assertContains(code,
        "def assign_add_eager_fallback(ref, value, use_locking, name, ctx):\n" +
        "  " + refusal);
    assertNotContains(code, "TFE_Py_FastPathExecute");
    assertNotContains(code, "_execute.execute(");
    assertContains(code, "_op_def_library._apply_op_helper(\n" +
        "        \"AssignAdd\", ref=ref, value=value, use_locking=use_locking, " +
        "name=name)\n");
  }

  @Test
  public void testSiblingListLengthsChecked() throws Exception {
    String code = generate(OpFixtures.pairwise());
    assertContains(code, "def pairwise(a, b, name=None):\n");
    assertContains(code,
        "  if not isinstance(a, (list, tuple)):\n" +
        "    raise TypeError(\n" +
        "        \"Expected list for 'a' argument to \"\n" +
        "        \"'pairwise' Op, not %r.\" % a)\n" +
        "  _attr_N = len(a)\n" +
        "  if not isinstance(b, (list, tuple)):\n" +
        "    raise TypeError(\n" +
        "        \"Expected list for 'b' argument to \"\n" +
        "        \"'pairwise' Op, not %r.\" % b)\n" +
        "  if len(b) != _attr_N:\n" +
        "    raise ValueError(\n" +
        "        \"List argument 'b' to 'pairwise' Op with length %d \"\n" +
        "        \"must match length %d of argument 'a'.\" %\n" +
        "        (len(b), _attr_N))\n");
    assertContains(code,
        "  _attr_T, _inputs_T = _execute.args_to_matching_eager(" +
        "list(a) + list(b), ctx, [])\n" +
        "  _inputs_T = [_inputs_T[:_attr_N]] + _inputs_T[_attr_N:]\n" +
        "  _inputs_T = _inputs_T[:1] + [_inputs_T[1:]]\n" +
        "  (a, b) = _inputs_T\n" +
        "  _inputs_flat = list(a) + list(b)\n" +
        "  _attrs = (\"N\", _attr_N, \"T\", _attr_T)\n");
  }

  @Test
  public void testMixedTypeList() throws Exception {
    String code = generate(OpFixtures.identityN());
    assertContains(code, "def identity_n(input, name=None):\n");
    assertContains(code,
        "  _attr_T, input = _execute.convert_to_mixed_eager_tensors(" +
        "input, ctx)\n" +
        "  _inputs_flat = list(input)\n");
    assertContains(code, "b\"IdentityN\", len(input), ");
    assertContains(code, "    _attrs = (\"T\", _op.get_attr(\"T\"))\n");
    assertNotContains(code, "_result, = _result");
  }

  @Test
  public void testAttrDefaultsAndCoercion() throws Exception {
    String code = generate(OpFixtures.attrs());
    assertContains(code,
        "def attr_op(x, padding, strides, alpha=0.2, shape=None, " +
        "value=_execute.make_tensor(\"\"\"dtype: DT_FLOAT tensor_shape { }" +
        "\"\"\", \"value\"), data_format=\"NHWC\", name=None):\n");
    assertContains(code, "def attr_op_eager_fallback(x, padding, strides, " +
        "alpha, shape, value, data_format, name, ctx):\n");
    assertContains(code,
        "  padding = _execute.make_str(padding, \"padding\")\n" +
        "  if not isinstance(strides, (list, tuple)):\n" +
        "    raise TypeError(\n" +
        "        \"Expected list for 'strides' argument to \"\n" +
        "        \"'attr_op' Op, not %r.\" % strides)\n" +
        "  strides = [_execute.make_int(_i, \"strides\") for _i in strides]\n" +
        "  if alpha is None:\n" +
        "    alpha = 0.2\n" +
        "  alpha = _execute.make_float(alpha, \"alpha\")\n" +
        "  if shape is None:\n" +
        "    shape = None\n" +
        "  shape = _execute.make_shape(shape, \"shape\")\n");
    assertContains(code,
        "  data_format = _execute.make_str(data_format, \"data_format\")\n");
    assertContains(code, "  x = _ops.convert_to_tensor(x, _dtypes.float32)\n");
    assertContains(code, "\"strides\", _op.get_attr(\"strides\"), " +
                         "\"alpha\", _op.get_attr(\"alpha\")");
    assertContains(code, "return attr_op_eager_fallback(\n" +
        "          x, padding=padding, strides=strides, alpha=alpha, " +
        "shape=shape, value=value, data_format=data_format, name=name, " +
        "ctx=_ctx)\n");
  }

  @Test
  public void testRenamesAndArgOrder() throws Exception {
    OpDef split = OpFixtures.split();
    ApiDef api = ApiDef.builder("Split")
        .argOrder(Arrays.asList("value", "axis"))
        .renameAttr("num_split", "num")
        .endpoint("Split", false)
        .build();
    String code = generate(split, api, false);
    assertContains(code, "def split(value, axis, num, name=None):\n");
    // Runtime calls take inputs in schema order
    assertContains(code,
        "        _ctx, \"Split\", name, axis, value, \"num_split\", num)\n");
    assertContains(code, "          value, axis, num=num, name=name, " +
                         "ctx=_ctx)\n");
    assertContains(code, "        \"Split\", value=value, axis=axis, " +
                         "num_split=num, name=name)\n");
    assertContains(code, "  _inputs_flat = [axis, value]\n");
    assertContains(code, "b\"Split\", num, ");
  }

  @Test
  public void testKeywordInputRenamed() throws Exception {
    OpDef op = OpFixtures.withoutAttrs("Neg");
    ApiDef api = ApiDef.builder("Neg").renameInArg("x", "lambda").build();
    String code = generate(op, api, false);
    assertContains(code, "def neg(lambda_, name=None):\n");
    assertContains(code, "\"Neg\", x=lambda_, name=name)\n");
  }

  @Test
  public void testHiddenOpHasNoDispatch() throws Exception {
    OpDef op = OpFixtures.add();
    ApiDef api = ApiDef.builder("Add").visibility(Visibility.HIDDEN)
                       .endpoint("Add", false).build();
    String code = generate(op, api, false);
    assertTrue(code, code.startsWith("def add(x, y, name=None):\n"));
    assertNotContains(code, "_dispatch");
    assertNotContains(code, "tf_export('add')");
    assertNotContains(code, "  else:\n");
    assertContains(code, "  # Add nodes to the TensorFlow graph.\n" +
        "  _, _, _op, _outputs = _op_def_library._apply_op_helper(\n" +
        "      \"Add\", x=x, y=y, name=name)\n" +
        "  _result = _outputs[:]\n");
    assertContains(code, "Add = tf_export(\"raw_ops.Add\")");
  }

  @Test
  public void testDeprecatedEndpoints() throws Exception {
    OpDef op = OpFixtures.add();
    ApiDef api = ApiDef.builder("Add")
        .endpoint("math.add", false)
        .endpoint("add", true)
        .build();
    String code = generate(op, api, false);
    assertContains(code,
        "@tf_export('math.add', v1=['math.add', 'add'])\n" +
        "@deprecated_endpoints('add')\n" +
        "def add(");
  }

  @Test
  public void testTypeAnnotations() throws Exception {
    OpDef op = OpFixtures.add();
    String code = generate(op, ApiDef.defaultFor(op), true);
    assertTrue(code, code.startsWith(
        "TV_Add_T = TypeVar(\"TV_Add_T\", _dtypes.Float32, _dtypes.Int32)\n" +
        "\n"));
    assertContains(code, "def add(x: _ops.Tensor[TV_Add_T], " +
        "y: _ops.Tensor[TV_Add_T], name=None) -> _ops.Tensor[TV_Add_T]:\n");
    assertContains(code, "def add_eager_fallback(x: _ops.Tensor[TV_Add_T], " +
        "y: _ops.Tensor[TV_Add_T], name, ctx) -> _ops.Tensor[TV_Add_T]:\n");
  }

  @Test
  public void testTypeAnnotationsForAttrs() throws Exception {
    OpDef op = OpFixtures.attrs();
    String code = generate(op, ApiDef.defaultFor(op), true);
    assertContains(code, "def attr_op(x: _ops.Tensor[_dtypes.Float32], " +
        "padding: str, strides, alpha:float=0.2, shape=None,");
    assertContains(code, "data_format:str=\"NHWC\", name=None) -> " +
        "_ops.Tensor[_dtypes.Float32]:\n");
    assertContains(code, "x: _ops.Tensor[_dtypes.Float32], padding: str, " +
        "strides, alpha: float, shape, value, data_format: str, name, ctx)");
  }

  @Test
  public void testLinesWrapped() throws Exception {
    PyTree.configure(2, LineWrapper.DEFAULT_RIGHT_MARGIN);
    String code = generate(OpFixtures.add());
    for (String line: code.split("\n")) {
      assertTrue("Line too long: " + line,
                 line.length() <= LineWrapper.DEFAULT_RIGHT_MARGIN);
    }
    assertContains(code, "  _attr_T, _inputs_T = " +
        "_execute.args_to_matching_eager([x, y], ctx,\n");
  }

  @Test
  public void testTopLevelOperatorsNotWrapped() throws Exception {
    PyTree.configure(2, LineWrapper.DEFAULT_RIGHT_MARGIN);
    String code = generate(OpFixtures.quantizedConcat());
    for (String line: code.split("\n")) {
      String stripped = StringUtils.stripEnd(line, " ");
      assertFalse("Dangling operator: " + line, stripped.endsWith("+"));
      assertFalse("Dangling assignment: " + line, stripped.endsWith("="));
    }
    assertContains(code, "  _inputs_flat = [concat_dim] + list(values) + " +
        "list(input_mins) + list(input_maxes)\n");
  }

  @Test
  public void testFuncAttrRejected() throws Exception {
    OpDef op = OpFixtures.mapFn();
    try {
      OpContext.build(op, ApiDef.defaultFor(op), "map_fn", false);
    } catch (GenerationException e) {
      assertContains(e.getMessage(), "func");
      return;
    }
    throw new AssertionError("Expected GenerationException");
  }

  @Test
  public void testBadArgOrderRejected() throws Exception {
    OpDef op = OpFixtures.add();
    ApiDef api = ApiDef.builder("Add").argOrder(Arrays.asList("x", "q"))
                       .build();
    try {
      OpContext.build(op, api, "add", false);
    } catch (GenerationException e) {
      assertEquals("Add", e.opName());
      assertContains(e.getMessage(), "unknown input q");
      return;
    }
    throw new AssertionError("Expected GenerationException");
  }
}
