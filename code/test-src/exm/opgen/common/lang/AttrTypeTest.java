package exm.opgen.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AttrTypeTest {

  @Test
  public void testParse() {
    AttrType t = AttrType.parse("int");
    assertTrue(t.is(AttrKind.INT));
    assertFalse(t.isList());
    assertEquals("int", t.toString());

    AttrType l = AttrType.parse(" list(type) ");
    assertTrue(l.isListOf(AttrKind.TYPE));
    assertFalse(l.is(AttrKind.TYPE));
    assertEquals("list(type)", l.toString());
    assertEquals(AttrType.listOf(AttrKind.TYPE), l);
    assertEquals(AttrType.listOf(AttrKind.TYPE).hashCode(), l.hashCode());

    assertEquals(AttrKind.FUNC, AttrType.parse("func").kind());
  }

  @Test
  public void testParseInvalid() {
    assertNull(AttrType.parse("matrix"));
    assertNull(AttrType.parse("list(matrix)"));
    assertNull(AttrType.parse("list(int"));
  }

  @Test
  public void testDataTypeNames() {
    assertEquals(DataType.FLOAT32, DataType.fromName("float32"));
    assertEquals(DataType.FLOAT32, DataType.fromName("DT_FLOAT"));
    assertEquals(DataType.INT64, DataType.fromName("DT_INT64"));
    assertNull(DataType.fromName("float99"));
    assertEquals("_dtypes.float32", DataType.FLOAT32.pythonName());
    assertEquals("_dtypes.Float32", DataType.FLOAT32.annotationName());
    assertEquals(DataType.values().length,
                 DataType.allAnnotationNames().size());
  }

  @Test
  public void testValueTypes() {
    AttrValue v = AttrValue.listOf(AttrKind.INT, AttrValue.ofInt(1));
    assertEquals(AttrType.listOf(AttrKind.INT), v.type());
    assertEquals(1L, v.getList().get(0).getInt());
    assertEquals(AttrType.scalar(AttrKind.SHAPE),
                 AttrValue.unknownShape().type());
  }
}
