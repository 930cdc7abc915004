package exm.opgen.pybackend;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.DataType;

public class ArgFlattenerTest {

  private static ArgDef scalar(String name) {
    return ArgDef.builder(name).type(DataType.FLOAT32).build();
  }

  private static ArgDef counted(String name, String numberAttr) {
    return ArgDef.builder(name).typeAttr("T").numberAttr(numberAttr).build();
  }

  private static ArgDef typeList(String name) {
    return ArgDef.builder(name).typeListAttr("Tlist").build();
  }

  private static List<String> names(List<ArgDef> args) {
    List<String> result = new ArrayList<String>();
    for (ArgDef a: args) {
      result.add(a.name());
    }
    return result;
  }

  private static String flatten(List<String> sizes, ArgDef... args) {
    List<ArgDef> l = Arrays.asList(args);
    return ArgFlattener.flatten(l, names(l), sizes);
  }

  @Test
  public void testEmpty() {
    assertEquals("[]", ArgFlattener.flatten(Collections.<ArgDef>emptyList(),
                                 Collections.<String>emptyList(), null));
  }

  @Test
  public void testScalarsGrouped() {
    List<String> sizes = new ArrayList<String>();
    assertEquals("[a, b, c]",
                 flatten(sizes, scalar("a"), scalar("b"), scalar("c")));
    assertEquals(Arrays.asList("", "", ""), sizes);
  }

  @Test
  public void testListsSpliced() {
    List<String> sizes = new ArrayList<String>();
    assertEquals("list(a) + list(b)",
                 flatten(sizes, counted("a", "N"), typeList("b")));
    assertEquals(Arrays.asList("_attr_N", "len(b)"), sizes);
  }

  @Test
  public void testMixed() {
    assertEquals("[a] + list(b) + [c, d] + list(e)",
          flatten(null, scalar("a"), counted("b", "N"), scalar("c"),
                  scalar("d"), typeList("e")));
    assertEquals("list(a) + [b]",
                 flatten(null, counted("a", "N"), scalar("b")));
  }

  @Test
  public void testUnflattenAllScalar() {
    assertEquals(Collections.<String>emptyList(),
          ArgFlattener.unflatten(Arrays.asList("", ""), "_result"));
  }

  @Test
  public void testUnflattenFirst() {
    assertEquals(Arrays.asList(
        "_result = [_result[:n]] + _result[n:]"),
        ArgFlattener.unflatten(Arrays.asList("n", ""), "_result"));
  }

  @Test
  public void testUnflattenMiddle() {
    assertEquals(Arrays.asList(
        "_result = _result[:1] + [_result[1:1 + _attr_N]] + " +
        "_result[1 + _attr_N:]"),
        ArgFlattener.unflatten(Arrays.asList("", "_attr_N", ""), "_result"));
  }

  @Test
  public void testUnflattenLast() {
    assertEquals(Arrays.asList("_result = _result[:2] + [_result[2:]]"),
        ArgFlattener.unflatten(Arrays.asList("", "", "len(x)"), "_result"));
  }

  @Test
  public void testUnflattenSingle() {
    assertEquals(Arrays.asList("_result = [_result[0:]]"),
        ArgFlattener.unflatten(Arrays.asList("n"), "_result"));
  }

  /**
   * Positions after a regrouped list shift to one slot each
   */
  @Test
  public void testUnflattenSeveralLists() {
    assertEquals(Arrays.asList(
        "_inputs_T = [_inputs_T[:_attr_N]] + _inputs_T[_attr_N:]",
        "_inputs_T = _inputs_T[:1] + [_inputs_T[1:1 + len(b)]] + " +
        "_inputs_T[1 + len(b):]",
        "_inputs_T = _inputs_T[:3] + [_inputs_T[3:]]"),
        ArgFlattener.unflatten(
            Arrays.asList("_attr_N", "len(b)", "", "_attr_M"), "_inputs_T"));
  }
}
