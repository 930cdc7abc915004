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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative description of one operation.  Immutable once built.
 */
public final class OpDef {
  private final String name;
  private final List<ArgDef> inputs;
  private final List<ArgDef> outputs;
  private final List<AttrDef> attrs;
  private final boolean stateful;

  private OpDef(Builder b) {
    this.name = b.name;
    this.inputs = Collections.unmodifiableList(b.inputs);
    this.outputs = Collections.unmodifiableList(b.outputs);
    this.attrs = Collections.unmodifiableList(b.attrs);
    this.stateful = b.stateful;
  }

  public String name() {
    return name;
  }

  public List<ArgDef> inputs() {
    return inputs;
  }

  public List<ArgDef> outputs() {
    return outputs;
  }

  public List<AttrDef> attrs() {
    return attrs;
  }

  public boolean isStateful() {
    return stateful;
  }

  /**
   * @return null if not found
   */
  public AttrDef findAttr(String attrName) {
    for (AttrDef a: attrs) {
      if (a.name().equals(attrName)) {
        return a;
      }
    }
    return null;
  }

  /**
   * @return null if not found
   */
  public ArgDef findInput(String argName) {
    for (ArgDef a: inputs) {
      if (a.name().equals(argName)) {
        return a;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name + inputs + " -> " + outputs + " " + attrs;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static class Builder {
    private final String name;
    private final List<ArgDef> inputs = new ArrayList<ArgDef>();
    private final List<ArgDef> outputs = new ArrayList<ArgDef>();
    private final List<AttrDef> attrs = new ArrayList<AttrDef>();
    private boolean stateful = false;

    private Builder(String name) {
      this.name = name;
    }

    public Builder input(ArgDef arg) {
      inputs.add(arg);
      return this;
    }

    public Builder output(ArgDef arg) {
      outputs.add(arg);
      return this;
    }

    public Builder attr(AttrDef attr) {
      attrs.add(attr);
      return this;
    }

    public Builder stateful(boolean s) {
      this.stateful = s;
      return this;
    }

    public OpDef build() {
      checkUnique(inputs, "input");
      checkUnique(outputs, "output");
      Set<String> attrNames = new HashSet<String>();
      for (AttrDef a: attrs) {
        if (!attrNames.add(a.name())) {
          throw new IllegalStateException("Duplicate attr " + a.name() +
                                          " in op " + name);
        }
      }
      return new OpDef(this);
    }

    private void checkUnique(List<ArgDef> args, String what) {
      Set<String> names = new HashSet<String>();
      for (ArgDef a: args) {
        if (!names.add(a.name())) {
          throw new IllegalStateException("Duplicate " + what + " " +
                                          a.name() + " in op " + name);
        }
      }
    }
  }
}
