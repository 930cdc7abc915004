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
 * The closed set of element kinds an attribute can have.
 * Every code generation strategy is an exhaustive switch over these.
 */
public enum AttrKind {
  STRING("string"),
  INT("int"),
  FLOAT("float"),
  BOOL("bool"),
  TYPE("type"),
  SHAPE("shape"),
  TENSOR("tensor"),
  /** Function reference: cannot appear in a generated signature */
  FUNC("func");

  private final String schemaName;

  private AttrKind(String schemaName) {
    this.schemaName = schemaName;
  }

  public String schemaName() {
    return schemaName;
  }

  /**
   * @return null if not a known kind
   */
  public static AttrKind fromName(String name) {
    for (AttrKind k: values()) {
      if (k.schemaName.equals(name)) {
        return k;
      }
    }
    return null;
  }
}
