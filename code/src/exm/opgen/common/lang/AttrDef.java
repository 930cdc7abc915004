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
import java.util.List;

/**
 * An attribute of an op
 */
public final class AttrDef {
  private final String name;
  private final AttrType type;
  private final AttrValue defaultValue;
  private final List<DataType> allowedTypes;
  private final String description;

  public AttrDef(String name, AttrType type, AttrValue defaultValue,
                 List<DataType> allowedTypes, String description) {
    this.name = name;
    this.type = type;
    this.defaultValue = defaultValue;
    this.allowedTypes = Collections.unmodifiableList(
        new ArrayList<DataType>(allowedTypes));
    this.description = description == null ? "" : description;
  }

  public AttrDef(String name, AttrType type, AttrValue defaultValue) {
    this(name, type, defaultValue, Collections.<DataType>emptyList(), "");
  }

  public AttrDef(String name, AttrType type) {
    this(name, type, null);
  }

  public String name() {
    return name;
  }

  public AttrType type() {
    return type;
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  /** Default value, or null */
  public AttrValue defaultValue() {
    return defaultValue;
  }

  /**
   * Types allowed for a type or list(type) attribute.
   * @return empty if any type is allowed
   */
  public List<DataType> allowedTypes() {
    return allowedTypes;
  }

  public String description() {
    return description;
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}
