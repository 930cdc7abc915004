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

/**
 * An input or output argument of an op.
 *
 * Exactly one of type, typeAttr and typeListAttr is set.
 * numberAttr may be set together with type or typeAttr to make the
 * argument a list of that many tensors.
 */
public final class ArgDef {
  private final String name;
  private final DataType type;
  private final String typeAttr;
  private final String typeListAttr;
  private final String numberAttr;
  private final boolean isRef;
  private final String description;

  private ArgDef(Builder b) {
    this.name = b.name;
    this.type = b.type;
    this.typeAttr = b.typeAttr;
    this.typeListAttr = b.typeListAttr;
    this.numberAttr = b.numberAttr;
    this.isRef = b.isRef;
    this.description = b.description;
  }

  public String name() {
    return name;
  }

  /** Concrete element type, or null */
  public DataType type() {
    return type;
  }

  /** Attribute giving the element type, or null */
  public String typeAttr() {
    return typeAttr;
  }

  /** Attribute giving the list of element types, or null */
  public String typeListAttr() {
    return typeListAttr;
  }

  /** Integer attribute giving the number of elements, or null */
  public String numberAttr() {
    return numberAttr;
  }

  public boolean isRef() {
    return isRef;
  }

  /** Documentation, or empty string */
  public String description() {
    return description;
  }

  /** True if the argument is a sequence of tensors */
  public boolean isList() {
    return typeListAttr != null || numberAttr != null;
  }

  @Override
  public String toString() {
    return name;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static class Builder {
    private final String name;
    private DataType type = null;
    private String typeAttr = null;
    private String typeListAttr = null;
    private String numberAttr = null;
    private boolean isRef = false;
    private String description = "";

    private Builder(String name) {
      this.name = name;
    }

    public Builder type(DataType t) {
      this.type = t;
      return this;
    }

    public Builder typeAttr(String attr) {
      this.typeAttr = attr;
      return this;
    }

    public Builder typeListAttr(String attr) {
      this.typeListAttr = attr;
      return this;
    }

    public Builder numberAttr(String attr) {
      this.numberAttr = attr;
      return this;
    }

    public Builder ref() {
      this.isRef = true;
      return this;
    }

    public Builder description(String d) {
      this.description = d == null ? "" : d;
      return this;
    }

    public ArgDef build() {
      int typeSources = (type != null ? 1 : 0) + (typeAttr != null ? 1 : 0) +
                        (typeListAttr != null ? 1 : 0);
      if (typeSources != 1) {
        throw new IllegalStateException("Argument " + name + " must have " +
            "exactly one of type, type_attr and type_list_attr");
      }
      if (typeListAttr != null && numberAttr != null) {
        throw new IllegalStateException("Argument " + name + " can't have " +
            "both type_list_attr and number_attr");
      }
      return new ArgDef(this);
    }
  }
}
