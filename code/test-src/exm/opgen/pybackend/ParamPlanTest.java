package exm.opgen.pybackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.exceptions.UnsupportedAttrTypeException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;
import exm.opgen.common.lang.OpDef;
import exm.opgen.pybackend.ParamPlan.Param;

public class ParamPlanTest {

  private static final Map<String, String> NO_ANNOTATIONS =
      Collections.<String, String>emptyMap();

  private static ParamPlan plan(OpDef op, ApiDef api)
        throws GenerationException {
    List<Param> inputs = new ArrayList<Param>();
    List<String> names = new ArrayList<String>();
    for (ArgDef in: op.inputs()) {
      String n = PyNamer.avoidKeyword(api.inArgName(in.name()));
      inputs.add(new Param(in.name(), n));
      names.add(n);
    }
    return ParamPlan.build(op, api, inputs,
                           AttrInference.resolve(op.inputs(), names));
  }

  private static ParamPlan plan(OpDef op) throws GenerationException {
    return plan(op, ApiDef.defaultFor(op));
  }

  @Test
  public void testInferredAttrsNotParams() throws Exception {
    ParamPlan p = plan(OpFixtures.add());
    assertTrue(p.attrParams().isEmpty());
    assertEquals("x, y, name=None", p.signature(true, NO_ANNOTATIONS));
    assertEquals("x, y, name", p.signature(false, NO_ANNOTATIONS));
  }

  @Test
  public void testRequiredBeforeDefaulted() throws Exception {
    ParamPlan p = plan(OpFixtures.attrs());
    assertEquals("[padding, strides]", p.requiredAttrs().toString());
    assertEquals("[alpha, shape, value, data_format]",
                 p.defaultedAttrs().toString());
    assertEquals(7, p.all().size());
    assertTrue(p.hasDefault("alpha"));
    assertFalse(p.hasDefault("padding"));
    assertEquals("0.2", p.defaultExpr("alpha"));
    assertEquals("\"NHWC\"", p.defaultExpr("data_format"));
    assertEquals("None", p.defaultExpr("shape"));
  }

  @Test
  public void testOverrideDefault() throws Exception {
    OpDef op = OpFixtures.split();
    ApiDef api = ApiDef.builder("Split")
        .attrDefault("num_split", AttrValue.ofInt(2))
        .build();
    ParamPlan p = plan(op, api);
    assertEquals("axis, value, num_split=2, name=None",
                 p.signature(true, NO_ANNOTATIONS));
  }

  @Test
  public void testRenamedAttr() throws Exception {
    OpDef op = OpFixtures.split();
    ApiDef api = ApiDef.builder("Split").renameAttr("num_split", "in")
                       .build();
    ParamPlan p = plan(op, api);
    assertEquals("in_", p.requiredAttrs().get(0).renameTo());
    assertEquals("num_split", p.requiredAttrs().get(0).name());
  }

  @Test
  public void testAnnotations() throws Exception {
    ParamPlan p = plan(OpFixtures.attrs());
    Map<String, String> ann = new HashMap<String, String>();
    ann.put("x", "_ops.Tensor[_dtypes.Float32]");
    ann.put("alpha", "float");
    String sig = p.signature(true, ann);
    assertTrue(sig, sig.startsWith("x: _ops.Tensor[_dtypes.Float32], "));
    assertTrue(sig, sig.contains(" alpha:float=0.2,"));
    String noDefaults = p.signature(false, ann);
    assertTrue(noDefaults, noDefaults.contains(" alpha: float,"));
  }

  @Test
  public void testMismatchedDefault() throws Exception {
    OpDef op = OpFixtures.split();
    ApiDef api = ApiDef.builder("Split")
        .attrDefault("num_split", AttrValue.ofString("two"))
        .build();
    try {
      plan(op, api);
      fail("Expected GenerationException");
    } catch (GenerationException e) {
      assertEquals("Split", e.opName());
    }
  }

  @Test
  public void testFuncAttr() throws Exception {
    try {
      plan(OpFixtures.mapFn());
      fail("Expected UnsupportedAttrTypeException");
    } catch (UnsupportedAttrTypeException e) {
      assertEquals(AttrKind.FUNC, e.attrType().kind());
    }
  }

  @Test
  public void testEffectiveDefault() {
    OpDef op = OpFixtures.unique();
    ApiDef api = ApiDef.builder("Unique")
        .attrDefault("out_idx", AttrValue.ofType(DataType.INT64))
        .build();
    assertEquals(DataType.INT64, ParamPlan.effectiveDefault(api,
                 op.findAttr("out_idx")).getDataType());
    assertEquals(DataType.INT32, ParamPlan.effectiveDefault(
        ApiDef.defaultFor(op), op.findAttr("out_idx")).getDataType());
  }
}
