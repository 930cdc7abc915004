package exm.opgen.pybackend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;

public class PyLiteralsTest {

  private static String py(AttrValue v) throws Exception {
    return PyLiterals.toPython("Op", v);
  }

  @Test
  public void testScalars() throws Exception {
    assertEquals("\"VALID\"", py(AttrValue.ofString("VALID")));
    assertEquals("\"a\\\"b\"", py(AttrValue.ofString("a\"b")));
    assertEquals("-3", py(AttrValue.ofInt(-3)));
    assertEquals("True", py(AttrValue.ofBool(true)));
    assertEquals("_dtypes.int64", py(AttrValue.ofType(DataType.INT64)));
  }

  @Test
  public void testFloats() {
    assertEquals("0.5", PyLiterals.floatToPython(0.5));
    assertEquals("1", PyLiterals.floatToPython(1.0));
    assertEquals("-2", PyLiterals.floatToPython(-2.0));
    assertEquals("1.0e-5", PyLiterals.floatToPython(1e-5));
    assertEquals("float('nan')", PyLiterals.floatToPython(Double.NaN));
    assertEquals("float('inf')",
                 PyLiterals.floatToPython(Double.POSITIVE_INFINITY));
    assertEquals("float('-inf')",
                 PyLiterals.floatToPython(Double.NEGATIVE_INFINITY));
  }

  @Test
  public void testShapes() throws Exception {
    assertEquals("None", py(AttrValue.unknownShape()));
    assertEquals("[]", py(AttrValue.ofShape()));
    assertEquals("[2, -1]", py(AttrValue.ofShape(2, -1)));
  }

  @Test
  public void testLists() throws Exception {
    assertEquals("[1, 2, 3]", py(AttrValue.listOf(AttrKind.INT,
        AttrValue.ofInt(1), AttrValue.ofInt(2), AttrValue.ofInt(3))));
    assertEquals("[]", py(AttrValue.listOf(AttrKind.STRING)));
    assertEquals("[_dtypes.float32, _dtypes.int32]",
        py(AttrValue.listOf(AttrKind.TYPE, AttrValue.ofType(DataType.FLOAT32),
                            AttrValue.ofType(DataType.INT32))));
    assertEquals("[[1], None]", py(AttrValue.listOf(AttrKind.SHAPE,
        AttrValue.ofShape(1), AttrValue.unknownShape())));
  }

  @Test
  public void testTensorDefaults() throws Exception {
    assertEquals("_execute.make_tensor(\"\"\"dtype: DT_INT32\"\"\", \"v\")",
        PyLiterals.defaultExpression("Op", "v",
                                     AttrValue.ofTensor("dtype: DT_INT32")));
    assertEquals("[_execute.make_tensor(_pb, \"vs\") for _pb in " +
                 "(\"\"\"a\"\"\",)]",
        PyLiterals.defaultExpression("Op", "vs", AttrValue.listOf(
            AttrKind.TENSOR, AttrValue.ofTensor("a"))));
    assertEquals("7", PyLiterals.defaultExpression("Op", "n",
                                                   AttrValue.ofInt(7)));
  }
}
