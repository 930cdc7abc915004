package exm.opgen.pybackend;

import java.util.Arrays;

import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrType;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;
import exm.opgen.common.lang.OpDef;

/**
 * Op definitions shared by the backend tests
 */
public class OpFixtures {

  public static AttrDef typeAttr(String name, DataType... allowed) {
    return new AttrDef(name, AttrType.scalar(AttrKind.TYPE), null,
                       Arrays.asList(allowed), "");
  }

  public static AttrDef intAttr(String name) {
    return new AttrDef(name, AttrType.scalar(AttrKind.INT));
  }

  /** z = x + y, with x and y sharing type T */
  public static OpDef add() {
    return OpDef.builder("Add")
        .input(ArgDef.builder("x").typeAttr("T").build())
        .input(ArgDef.builder("y").typeAttr("T").build())
        .output(ArgDef.builder("z").typeAttr("T").build())
        .attr(typeAttr("T", DataType.FLOAT32, DataType.INT32))
        .build();
  }

  /** Split value into num_split tensors along axis */
  public static OpDef split() {
    return OpDef.builder("Split")
        .input(ArgDef.builder("axis").type(DataType.INT32).build())
        .input(ArgDef.builder("value").typeAttr("T").build())
        .output(ArgDef.builder("output").typeAttr("T")
                      .numberAttr("num_split").build())
        .attr(intAttr("num_split"))
        .attr(typeAttr("T"))
        .build();
  }

  /** Two scalar outputs */
  public static OpDef unique() {
    return OpDef.builder("Unique")
        .input(ArgDef.builder("x").typeAttr("T").build())
        .output(ArgDef.builder("y").typeAttr("T").build())
        .output(ArgDef.builder("idx").typeAttr("out_idx").build())
        .attr(typeAttr("T"))
        .attr(new AttrDef("out_idx", AttrType.scalar(AttrKind.TYPE),
              AttrValue.ofType(DataType.INT32),
              Arrays.asList(DataType.INT32, DataType.INT64), ""))
        .build();
  }

  /** A list output followed by a scalar output */
  public static OpDef splitWithCount() {
    return OpDef.builder("SplitWithCount")
        .input(ArgDef.builder("value").typeAttr("T").build())
        .output(ArgDef.builder("output").typeAttr("T")
                      .numberAttr("num_split").build())
        .output(ArgDef.builder("count").type(DataType.INT64).build())
        .attr(intAttr("num_split"))
        .attr(typeAttr("T"))
        .build();
  }

  /** No inputs, outputs or attrs */
  public static OpDef noOp() {
    return OpDef.builder("NoOp").stateful(true).build();
  }

  /** Mutates its ref input */
  public static OpDef assignAdd() {
    return OpDef.builder("AssignAdd")
        .input(ArgDef.builder("ref").typeAttr("T").ref().build())
        .input(ArgDef.builder("value").typeAttr("T").build())
        .output(ArgDef.builder("output_ref").typeAttr("T").ref().build())
        .attr(typeAttr("T"))
        .attr(new AttrDef("use_locking", AttrType.scalar(AttrKind.BOOL),
                          AttrValue.ofBool(false)))
        .build();
  }

  /** Two list inputs whose lengths must agree */
  public static OpDef pairwise() {
    return OpDef.builder("Pairwise")
        .input(ArgDef.builder("a").typeAttr("T").numberAttr("N").build())
        .input(ArgDef.builder("b").typeAttr("T").numberAttr("N").build())
        .output(ArgDef.builder("sum").typeAttr("T").build())
        .attr(intAttr("N"))
        .attr(typeAttr("T"))
        .build();
  }

  /** Several list inputs sharing one length */
  public static OpDef quantizedConcat() {
    return OpDef.builder("QuantizedConcat")
        .input(ArgDef.builder("concat_dim").type(DataType.INT32).build())
        .input(ArgDef.builder("values").typeAttr("T")
                     .numberAttr("N").build())
        .input(ArgDef.builder("input_mins").type(DataType.FLOAT32)
                     .numberAttr("N").build())
        .input(ArgDef.builder("input_maxes").type(DataType.FLOAT32)
                     .numberAttr("N").build())
        .output(ArgDef.builder("output").typeAttr("T").build())
        .output(ArgDef.builder("output_min").type(DataType.FLOAT32).build())
        .output(ArgDef.builder("output_max").type(DataType.FLOAT32).build())
        .attr(intAttr("N"))
        .attr(typeAttr("T"))
        .build();
  }

  /** Heterogeneous list in, same list out */
  public static OpDef identityN() {
    return OpDef.builder("IdentityN")
        .input(ArgDef.builder("input").typeListAttr("T").build())
        .output(ArgDef.builder("output").typeListAttr("T").build())
        .attr(new AttrDef("T", AttrType.listOf(AttrKind.TYPE)))
        .build();
  }

  /** Attributes of every passable kind, some with defaults */
  public static OpDef attrs() {
    return OpDef.builder("AttrOp")
        .input(ArgDef.builder("x").type(DataType.FLOAT32).build())
        .output(ArgDef.builder("y").type(DataType.FLOAT32).build())
        .attr(new AttrDef("padding", AttrType.scalar(AttrKind.STRING)))
        .attr(new AttrDef("strides", AttrType.listOf(AttrKind.INT)))
        .attr(new AttrDef("alpha", AttrType.scalar(AttrKind.FLOAT),
                          AttrValue.ofFloat(0.2)))
        .attr(new AttrDef("shape", AttrType.scalar(AttrKind.SHAPE),
                          AttrValue.unknownShape()))
        .attr(new AttrDef("value", AttrType.scalar(AttrKind.TENSOR),
              AttrValue.ofTensor("dtype: DT_FLOAT tensor_shape { }")))
        .attr(new AttrDef("data_format", AttrType.scalar(AttrKind.STRING),
                          AttrValue.ofString("NHWC")))
        .build();
  }

  /** Has a func attr, which can't be generated */
  public static OpDef mapFn() {
    return OpDef.builder("MapFn")
        .input(ArgDef.builder("x").type(DataType.FLOAT32).build())
        .output(ArgDef.builder("y").type(DataType.FLOAT32).build())
        .attr(new AttrDef("f", AttrType.scalar(AttrKind.FUNC)))
        .build();
  }

  /** An op whose name is a python keyword */
  public static OpDef forOp() {
    return OpDef.builder("for")
        .input(ArgDef.builder("start").type(DataType.INT32).build())
        .output(ArgDef.builder("output").type(DataType.INT32).build())
        .build();
  }

  static OpDef withoutAttrs(String name) {
    return OpDef.builder(name)
        .input(ArgDef.builder("x").type(DataType.FLOAT32).build())
        .output(ArgDef.builder("y").type(DataType.FLOAT32).build())
        .build();
  }

  private OpFixtures() {
  }
}
