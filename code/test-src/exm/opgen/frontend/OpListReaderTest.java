package exm.opgen.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.opgen.common.Logging;
import exm.opgen.common.exceptions.SchemaException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrType;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;
import exm.opgen.common.lang.OpDef;
import exm.opgen.common.lang.Visibility;

public class OpListReaderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static OpList fixture;

  @BeforeClass
  public static void readFixture() throws Exception {
    Logging.setupLogging(null, false);
    InputStream in = OpListReaderTest.class.getResourceAsStream("ops.json");
    try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      fixture = OpListReader.read(r);
    }
  }

  @Test
  public void testOpsInFileOrder() {
    assertEquals(3, fixture.ops().size());
    assertEquals("Add", fixture.ops().get(0).name());
    assertEquals("Conv", fixture.ops().get(1).name());
    assertEquals("Assign", fixture.ops().get(2).name());
  }

  @Test
  public void testArgs() {
    OpDef add = fixture.ops().get(0);
    ArgDef x = add.inputs().get(0);
    assertEquals("T", x.typeAttr());
    assertEquals("First operand.", x.description());
    AttrDef t = add.findAttr("T");
    assertEquals(Arrays.asList(DataType.FLOAT32, DataType.INT32),
                 t.allowedTypes());

    OpDef assign = fixture.ops().get(2);
    assertTrue(assign.inputs().get(0).isRef());
    assertFalse(assign.inputs().get(1).isRef());
    assertTrue(assign.isStateful());
    assertFalse(add.isStateful());
  }

  @Test
  public void testAttrDefaults() {
    OpDef conv = fixture.ops().get(1);
    assertEquals(AttrType.listOf(AttrKind.INT),
                 conv.findAttr("strides").type());
    assertNull(conv.findAttr("strides").defaultValue());
    assertEquals("SAME", conv.findAttr("padding").defaultValue().getString());
    assertTrue(Double.isNaN(
        conv.findAttr("epsilon").defaultValue().getFloat()));
    assertTrue(conv.findAttr("shape").defaultValue().getShape()
                   .unknownRank());
    AttrValue dims = conv.findAttr("dims").defaultValue();
    assertEquals(2, dims.getList().size());
    assertEquals(Arrays.asList(2L, 3L),
                 dims.getList().get(0).getShape().dims());
    assertTrue(dims.getList().get(1).getShape().unknownRank());
    assertTrue(conv.findAttr("use_cudnn").defaultValue().getBool());
    // func defaults are not read
    assertNull(conv.findAttr("f").defaultValue());
  }

  @Test
  public void testApiDefs() {
    ApiDef add = fixture.apiDefs().get("Add");
    assertEquals(Visibility.VISIBLE, add.visibility());
    assertEquals("a", add.inArgName("x"));
    assertEquals("y", add.inArgName("y"));
    assertEquals(Arrays.asList("y", "x"), add.argOrder());
    assertEquals(2, add.endpoints().size());
    assertEquals("math.add", add.endpoints().get(0).name());
    assertFalse(add.endpoints().get(0).deprecated());
    assertTrue(add.endpoints().get(1).deprecated());
    assertEquals("Returns x + y element-wise.", add.summary());
    assertEquals("", add.description());

    ApiDef conv = fixture.apiDefs().get("Conv");
    assertEquals(Visibility.HIDDEN, conv.visibility());
    assertEquals("pad", conv.attrName("padding"));
    assertEquals("VALID", conv.attrDefault("padding").getString());
    // Endpoint defaults to the op name
    assertEquals("Conv", conv.endpoints().get(0).name());

    assertNull(fixture.apiDefs().get("Assign"));
  }

  @Test
  public void testEmptyDocument() throws Exception {
    OpList l = OpListReader.read("{}");
    assertTrue(l.ops().isEmpty());
    assertTrue(l.apiDefs().isEmpty());
  }

  @Test
  public void testInvalidJson() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("Invalid JSON");
    OpListReader.read("{\"ops\": [");
  }

  @Test
  public void testUnknownDataType() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("op Foo: unknown data type float99");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\", \"input_arg\": " +
        "[{\"name\": \"x\", \"type\": \"float99\"}]}]}");
  }

  @Test
  public void testUnknownAttrType() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("attr a has unknown type matrix");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\", \"attr\": " +
        "[{\"name\": \"a\", \"type\": \"matrix\"}]}]}");
  }

  @Test
  public void testBadDefault() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("bad value for attr n");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\", \"attr\": " +
        "[{\"name\": \"n\", \"type\": \"int\", \"default_value\": \"x\"}]}]}");
  }

  @Test
  public void testDuplicateOp() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("defined more than once");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\"}, {\"name\": \"Foo\"}]}");
  }

  @Test
  public void testApiDefForUnknownOp() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("op Bar: api_def for unknown op");
    OpListReader.read("{\"ops\": [], \"api_defs\": " +
                      "[{\"graph_op_name\": \"Bar\"}]}");
  }

  @Test
  public void testUnknownVisibility() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("unknown visibility sometimes");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\"}], \"api_defs\": " +
        "[{\"graph_op_name\": \"Foo\", \"visibility\": \"sometimes\"}]}");
  }

  @Test
  public void testObjectForFlag() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("op Foo: \"is_ref\" must be a single value");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\", \"input_arg\": " +
        "[{\"name\": \"x\", \"type\": \"float\", \"is_ref\": {}}]}]}");
  }

  @Test
  public void testStringForFlag() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("op Foo: \"is_stateful\" must be true or false");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\", " +
                      "\"is_stateful\": \"yes\"}]}");
  }

  @Test
  public void testListForOpName() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("\"name\" must be a single value");
    OpListReader.read("{\"ops\": [{\"name\": [\"Foo\", \"Bar\"]}]}");
  }

  @Test
  public void testObjectInApiDef() throws Exception {
    exception.expect(SchemaException.class);
    exception.expectMessage("op Foo: \"summary\" must be a single value");
    OpListReader.read("{\"ops\": [{\"name\": \"Foo\"}], \"api_defs\": " +
        "[{\"graph_op_name\": \"Foo\", \"summary\": {\"text\": 1}}]}");
  }
}
