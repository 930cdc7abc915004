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
 * Type of an attribute: a kind, possibly as a list, e.g. list(int)
 */
public final class AttrType {
  private static final String LIST_PREFIX = "list(";

  private final AttrKind kind;
  private final boolean list;

  private AttrType(AttrKind kind, boolean list) {
    this.kind = kind;
    this.list = list;
  }

  public static AttrType scalar(AttrKind kind) {
    return new AttrType(kind, false);
  }

  public static AttrType listOf(AttrKind kind) {
    return new AttrType(kind, true);
  }

  /**
   * Parse the schema spelling, e.g. "int" or "list(type)"
   * @return null if not a valid attribute type
   */
  public static AttrType parse(String s) {
    String str = s.trim();
    if (str.startsWith(LIST_PREFIX) && str.endsWith(")")) {
      AttrKind kind = AttrKind.fromName(
          str.substring(LIST_PREFIX.length(), str.length() - 1).trim());
      return kind == null ? null : listOf(kind);
    }
    AttrKind kind = AttrKind.fromName(str);
    return kind == null ? null : scalar(kind);
  }

  public AttrKind kind() {
    return kind;
  }

  public boolean isList() {
    return list;
  }

  public boolean is(AttrKind k) {
    return !list && kind == k;
  }

  public boolean isListOf(AttrKind k) {
    return list && kind == k;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 2 + (list ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AttrType)) {
      return false;
    }
    AttrType other = (AttrType)obj;
    return kind == other.kind && list == other.list;
  }

  @Override
  public String toString() {
    return list ? LIST_PREFIX + kind.schemaName() + ")" : kind.schemaName();
  }
}
