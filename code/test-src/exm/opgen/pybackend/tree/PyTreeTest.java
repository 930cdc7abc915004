package exm.opgen.pybackend.tree;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.opgen.common.exceptions.OpGenRuntimeError;
import exm.opgen.common.util.LineWrapper;

public class PyTreeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetLayout() {
    PyTree.configure(2, LineWrapper.DEFAULT_RIGHT_MARGIN);
  }

  @Test
  public void testDefWithDecorators() {
    Def def = new Def("f", "a, b=1");
    def.addDecorator("decorate");
    def.body().add("return a");
    assertEquals("@decorate\ndef f(a, b=1):\n  return a\n", def.toString());
  }

  @Test
  public void testEmptyDefGetsPass() {
    Def def = new Def("g", null, "", "int");
    assertEquals("def g() -> int:\n  pass\n", def.toString());
  }

  @Test
  public void testDuplicateDef() {
    Set<String> used = new HashSet<String>();
    new Def("f", used, "", null);
    exception.expect(OpGenRuntimeError.class);
    new Def("f", used, "", null);
  }

  @Test
  public void testBadDefName() {
    exception.expect(OpGenRuntimeError.class);
    new Def("a.b", "");
  }

  @Test
  public void testNesting() {
    Def def = new Def("f", "x");
    If check = new If("x", true);
    Try t = new Try();
    t.body().add("y = g(x)");
    t.addExcept("ValueError").add("raise");
    check.thenBlock().add(t);
    check.elseBlock().add(new Comment("nothing\n\nat all"));
    def.body().add(check);
    def.body().add(Line.BLANK);
    def.body().add("return y");
    assertEquals(
        "def f(x):\n" +
        "  if x:\n" +
        "    try:\n" +
        "      y = g(x)\n" +
        "    except ValueError:\n" +
        "      raise\n" +
        "  else:\n" +
        "    # nothing\n" +
        "    #\n" +
        "    # at all\n" +
        "\n" +
        "  return y\n", def.toString());
  }

  @Test
  public void testEmptyElseOmitted() {
    If check = new If("x", true);
    check.thenBlock().add("pass");
    assertEquals("if x:\n  pass\n", check.toString());
  }

  @Test
  public void testIndentWidth() {
    PyTree.configure(4, 78);
    If check = new If("x", new Sequence(new Line("a"), new Line("b")));
    assertEquals("if x:\n    a\n    b\n", check.toString());
  }

  @Test
  public void testWrappedLine() {
    PyTree.configure(2, 20);
    Sequence seq = new Sequence();
    seq.add(new WrappedLine("f(", "aaaa, bbbb, cccc, dddd)"));
    If check = new If("x", seq);
    assertEquals("if x:\n" +
                 "  f(aaaa, bbbb,\n" +
                 "    cccc, dddd)\n", check.toString());
  }

  @Test
  public void testSequence() {
    Sequence a = new Sequence();
    a.add("x = 1");
    Sequence b = new Sequence();
    b.addAll(Arrays.asList("y = 2", "z = 3"));
    a.append(b);
    assertEquals(3, a.size());
    assertEquals("y = 2", ((Line)a.get(1)).text());
    assertEquals("x = 1\ny = 2\nz = 3\n", a.toString());
  }

  @Test
  public void testExpressions() {
    assertEquals("(a,)", PyList.tupleOfNames(Arrays.asList("a")).toString());
    assertEquals("(a, b)",
                 PyList.tupleOfNames(Arrays.asList("a", "b")).toString());
    assertEquals("[a, b]",
                 PyList.listOfNames(Arrays.asList("a", "b")).toString());
    assertEquals("[]", PyList.listOfNames(
                          Collections.<String>emptyList()).toString());
    assertEquals("[\"x\", 1]",
                 new PyList(new PyString("x"), new Token("1")).toString());
    assertEquals("\"a\\\"b\\n\"", new PyString("a\"b\n").toString());
    assertEquals("b\"Add\"", PyString.bytes("Add").toString());
    assertEquals("Add", PyString.bytes("Add").value());
    assertEquals("f(a, \"s\", k=v)", Call.fnCall("f", "a")
                 .arg(new PyString("s")).kwarg("k", "v").toString());
    assertEquals("k=v", new Call("f").kwarg("k", "v").argsString());
  }
}
