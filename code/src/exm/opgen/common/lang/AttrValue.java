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
package exm.opgen.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.opgen.common.exceptions.OpGenRuntimeError;

/**
 * A constant attribute value, e.g. a default from the schema.
 *
 * Scalars hold a String, Long, Double, Boolean, DataType, Shape or
 * tensor text; lists hold a list of scalar values of one kind.
 */
public final class AttrValue {

  /**
   * Tensor shape.  Dimensions of -1 are unknown.
   */
  public static final class Shape {
    private final List<Long> dims;

    private Shape(List<Long> dims) {
      this.dims = dims;
    }

    public boolean unknownRank() {
      return dims == null;
    }

    public List<Long> dims() {
      if (dims == null) {
        throw new OpGenRuntimeError("shape has unknown rank");
      }
      return dims;
    }

    @Override
    public String toString() {
      return dims == null ? "<unknown>" : dims.toString();
    }
  }

  private final AttrType type;
  private final Object value;

  private AttrValue(AttrType type, Object value) {
    this.type = type;
    this.value = value;
  }

  public static AttrValue ofString(String s) {
    return new AttrValue(AttrType.scalar(AttrKind.STRING), s);
  }

  public static AttrValue ofInt(long i) {
    return new AttrValue(AttrType.scalar(AttrKind.INT), i);
  }

  public static AttrValue ofFloat(double f) {
    return new AttrValue(AttrType.scalar(AttrKind.FLOAT), f);
  }

  public static AttrValue ofBool(boolean b) {
    return new AttrValue(AttrType.scalar(AttrKind.BOOL), b);
  }

  public static AttrValue ofType(DataType t) {
    return new AttrValue(AttrType.scalar(AttrKind.TYPE), t);
  }

  public static AttrValue ofShape(long... dims) {
    List<Long> l = new ArrayList<Long>(dims.length);
    for (long d: dims) {
      l.add(d);
    }
    return new AttrValue(AttrType.scalar(AttrKind.SHAPE),
                         new Shape(Collections.unmodifiableList(l)));
  }

  public static AttrValue unknownShape() {
    return new AttrValue(AttrType.scalar(AttrKind.SHAPE), new Shape(null));
  }

  /**
   * @param text tensor in single-line text form,
   *          e.g. dtype: DT_INT32 tensor_shape { } int_val: 0
   */
  public static AttrValue ofTensor(String text) {
    return new AttrValue(AttrType.scalar(AttrKind.TENSOR), text);
  }

  public static AttrValue listOf(AttrKind kind, List<AttrValue> elems) {
    for (AttrValue e: elems) {
      if (!e.type.is(kind)) {
        throw new OpGenRuntimeError("list(" + kind.schemaName() +
              ") value can't contain " + e.type);
      }
    }
    return new AttrValue(AttrType.listOf(kind),
          Collections.unmodifiableList(new ArrayList<AttrValue>(elems)));
  }

  public static AttrValue listOf(AttrKind kind, AttrValue... elems) {
    return listOf(kind, Arrays.asList(elems));
  }

  public AttrType type() {
    return type;
  }

  public String getString() {
    return (String)checked(AttrKind.STRING);
  }

  public long getInt() {
    return (Long)checked(AttrKind.INT);
  }

  public double getFloat() {
    return (Double)checked(AttrKind.FLOAT);
  }

  public boolean getBool() {
    return (Boolean)checked(AttrKind.BOOL);
  }

  public DataType getDataType() {
    return (DataType)checked(AttrKind.TYPE);
  }

  public Shape getShape() {
    return (Shape)checked(AttrKind.SHAPE);
  }

  public String getTensorText() {
    return (String)checked(AttrKind.TENSOR);
  }

  @SuppressWarnings("unchecked")
  public List<AttrValue> getList() {
    if (!type.isList()) {
      throw new OpGenRuntimeError("not a list value: " + this);
    }
    return (List<AttrValue>)value;
  }

  private Object checked(AttrKind kind) {
    if (!type.is(kind)) {
      throw new OpGenRuntimeError("expected " + kind.schemaName() +
                                  " value but was " + type);
    }
    return value;
  }

  @Override
  public String toString() {
    return type + ":" + value;
  }
}
