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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Override layer for one op: how it is presented in the generated API.
 * Anything not overridden falls back to the op's own definition.
 */
public final class ApiDef {

  /**
   * Name under which the op is exported
   */
  public static final class Endpoint {
    private final String name;
    private final boolean deprecated;

    public Endpoint(String name, boolean deprecated) {
      this.name = name;
      this.deprecated = deprecated;
    }

    public String name() {
      return name;
    }

    public boolean deprecated() {
      return deprecated;
    }
  }

  private final String opName;
  private final Visibility visibility;
  private final Map<String, String> inArgRenames;
  private final Map<String, String> outArgRenames;
  private final Map<String, String> attrRenames;
  private final List<String> argOrder;
  private final Map<String, AttrValue> attrDefaults;
  private final List<Endpoint> endpoints;
  private final String summary;
  private final String description;

  private ApiDef(Builder b) {
    this.opName = b.opName;
    this.visibility = b.visibility;
    this.inArgRenames = Collections.unmodifiableMap(b.inArgRenames);
    this.outArgRenames = Collections.unmodifiableMap(b.outArgRenames);
    this.attrRenames = Collections.unmodifiableMap(b.attrRenames);
    this.argOrder = Collections.unmodifiableList(b.argOrder);
    this.attrDefaults = Collections.unmodifiableMap(b.attrDefaults);
    this.endpoints = Collections.unmodifiableList(b.endpoints);
    this.summary = b.summary;
    this.description = b.description;
  }

  /**
   * Override that changes nothing: visible, exported under the op name
   */
  public static ApiDef defaultFor(OpDef op) {
    return builder(op.name()).endpoint(op.name(), false).build();
  }

  public String opName() {
    return opName;
  }

  public Visibility visibility() {
    return visibility;
  }

  public String inArgName(String name) {
    String rename = inArgRenames.get(name);
    return rename != null ? rename : name;
  }

  public String outArgName(String name) {
    String rename = outArgRenames.get(name);
    return rename != null ? rename : name;
  }

  public String attrName(String name) {
    String rename = attrRenames.get(name);
    return rename != null ? rename : name;
  }

  /**
   * Canonical order of input arguments in the generated signature.
   * @return empty if schema order should be used
   */
  public List<String> argOrder() {
    return argOrder;
  }

  /**
   * @return overriding default value, or null
   */
  public AttrValue attrDefault(String attrName) {
    return attrDefaults.get(attrName);
  }

  public List<Endpoint> endpoints() {
    return endpoints;
  }

  public String summary() {
    return summary;
  }

  public String description() {
    return description;
  }

  public static Builder builder(String opName) {
    return new Builder(opName);
  }

  public static class Builder {
    private final String opName;
    private Visibility visibility = Visibility.VISIBLE;
    private final Map<String, String> inArgRenames =
        new HashMap<String, String>();
    private final Map<String, String> outArgRenames =
        new HashMap<String, String>();
    private final Map<String, String> attrRenames =
        new HashMap<String, String>();
    private final List<String> argOrder = new ArrayList<String>();
    private final Map<String, AttrValue> attrDefaults =
        new HashMap<String, AttrValue>();
    private final List<Endpoint> endpoints = new ArrayList<Endpoint>();
    private String summary = "";
    private String description = "";

    private Builder(String opName) {
      this.opName = opName;
    }

    public Builder visibility(Visibility v) {
      this.visibility = v;
      return this;
    }

    public Builder renameInArg(String name, String renameTo) {
      inArgRenames.put(name, renameTo);
      return this;
    }

    public Builder renameOutArg(String name, String renameTo) {
      outArgRenames.put(name, renameTo);
      return this;
    }

    public Builder renameAttr(String name, String renameTo) {
      attrRenames.put(name, renameTo);
      return this;
    }

    public Builder argOrder(List<String> order) {
      argOrder.clear();
      argOrder.addAll(order);
      return this;
    }

    public Builder attrDefault(String attrName, AttrValue value) {
      attrDefaults.put(attrName, value);
      return this;
    }

    public Builder endpoint(String name, boolean deprecated) {
      endpoints.add(new Endpoint(name, deprecated));
      return this;
    }

    public Builder summary(String s) {
      this.summary = s == null ? "" : s;
      return this;
    }

    public Builder description(String d) {
      this.description = d == null ? "" : d;
      return this;
    }

    public ApiDef build() {
      return new ApiDef(this);
    }
  }
}
