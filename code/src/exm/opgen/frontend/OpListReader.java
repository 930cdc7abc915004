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
package exm.opgen.frontend;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

import exm.opgen.common.Logging;
import exm.opgen.common.exceptions.SchemaException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.AttrDef;
import exm.opgen.common.lang.AttrKind;
import exm.opgen.common.lang.AttrType;
import exm.opgen.common.lang.AttrValue;
import exm.opgen.common.lang.DataType;
import exm.opgen.common.lang.OpDef;
import exm.opgen.common.lang.Visibility;

/**
 * Reads ops and overrides from a JSON document of the form
 * <pre>
 * {"ops": [{"name": "Add", "input_arg": [...], "output_arg": [...],
 *           "attr": [...], "is_stateful": false}, ...],
 *  "api_defs": [{"graph_op_name": "Add", "visibility": "HIDDEN", ...}]}
 * </pre>
 * Attribute values are typed by the kind of the attribute they belong
 * to: a list(int) default is a JSON array of numbers, a type default a
 * data type name, and so on.
 */
public class OpListReader {

  private static final Logger logger = Logging.getLogger();

  private static final Gson GSON = new Gson();

  private static final String UNKNOWN_RANK = "unknown_rank";

  public static OpList readFile(String path)
        throws IOException, SchemaException {
    String text = FileUtils.readFileToString(new File(path),
                                             StandardCharsets.UTF_8);
    logger.debug("Read " + text.length() + " characters from " + path);
    return read(new StringReader(text));
  }

  public static OpList read(String json) throws SchemaException {
    return read(new StringReader(json));
  }

  public static OpList read(Reader reader) throws SchemaException {
    JsonObject root;
    try {
      root = GSON.fromJson(reader, JsonObject.class);
    } catch (JsonParseException e) {
      throw new SchemaException("Invalid JSON: " + e.getMessage(), e);
    }
    if (root == null) {
      throw new SchemaException("Empty op list");
    }

    List<OpDef> ops = new ArrayList<OpDef>();
    Map<String, OpDef> byName = new LinkedHashMap<String, OpDef>();
    for (JsonElement e: array(root, "ops")) {
      OpDef op = readOp(object(e, "op"));
      if (byName.put(op.name(), op) != null) {
        throw new SchemaException(op.name(), "defined more than once");
      }
      ops.add(op);
    }

    Map<String, ApiDef> apiDefs = new LinkedHashMap<String, ApiDef>();
    for (JsonElement e: array(root, "api_defs")) {
      JsonObject obj = object(e, "api_def");
      String opName = string(null, obj, "graph_op_name", null);
      if (opName == null) {
        throw new SchemaException("api_def without graph_op_name");
      }
      OpDef op = byName.get(opName);
      if (op == null) {
        throw new SchemaException(opName, "api_def for unknown op");
      }
      if (apiDefs.put(opName, readApiDef(op, obj)) != null) {
        throw new SchemaException(opName, "more than one api_def");
      }
    }
    logger.debug("Read " + ops.size() + " ops and " + apiDefs.size() +
                 " api_defs");
    return new OpList(ops, apiDefs);
  }

  private static OpDef readOp(JsonObject obj) throws SchemaException {
    String name = string(null, obj, "name", null);
    if (name == null || name.isEmpty()) {
      throw new SchemaException("op without name");
    }
    OpDef.Builder b = OpDef.builder(name);
    try {
      for (JsonElement e: array(obj, "input_arg")) {
        b.input(readArg(name, object(e, "input_arg")));
      }
      for (JsonElement e: array(obj, "output_arg")) {
        b.output(readArg(name, object(e, "output_arg")));
      }
      for (JsonElement e: array(obj, "attr")) {
        b.attr(readAttr(name, object(e, "attr")));
      }
      b.stateful(bool(name, obj, "is_stateful"));
      return b.build();
    } catch (IllegalStateException e) {
      throw new SchemaException(name, e.getMessage());
    }
  }

  private static ArgDef readArg(String opName, JsonObject obj)
        throws SchemaException {
    String name = string(opName, obj, "name", null);
    if (name == null) {
      throw new SchemaException(opName, "argument without name");
    }
    ArgDef.Builder b = ArgDef.builder(name);
    String type = string(opName, obj, "type", null);
    if (type != null) {
      b.type(dataType(opName, type));
    }
    b.typeAttr(string(opName, obj, "type_attr", null));
    b.typeListAttr(string(opName, obj, "type_list_attr", null));
    b.numberAttr(string(opName, obj, "number_attr", null));
    if (bool(opName, obj, "is_ref")) {
      b.ref();
    }
    b.description(string(opName, obj, "description", ""));
    return b.build();
  }

  private static AttrDef readAttr(String opName, JsonObject obj)
        throws SchemaException {
    String name = string(opName, obj, "name", null);
    String typeName = string(opName, obj, "type", null);
    if (name == null || typeName == null) {
      throw new SchemaException(opName, "attr needs name and type");
    }
    AttrType type = AttrType.parse(typeName);
    if (type == null) {
      throw new SchemaException(opName, "attr " + name +
                                " has unknown type " + typeName);
    }
    AttrValue dflt = null;
    if (obj.has("default_value") && type.kind() != AttrKind.FUNC) {
      dflt = value(opName, name, type, obj.get("default_value"));
    }
    List<DataType> allowed = new ArrayList<DataType>();
    for (JsonElement e: array(obj, "allowed_values")) {
      allowed.add(dataType(opName, primitive(opName, e).getAsString()));
    }
    return new AttrDef(name, type, dflt, allowed,
                       string(opName, obj, "description", ""));
  }

  private static ApiDef readApiDef(OpDef op, JsonObject obj)
        throws SchemaException {
    ApiDef.Builder b = ApiDef.builder(op.name());
    String vis = string(op.name(), obj, "visibility", null);
    if (vis != null) {
      try {
        b.visibility(Visibility.valueOf(vis.toUpperCase()));
      } catch (IllegalArgumentException e) {
        throw new SchemaException(op.name(), "unknown visibility " + vis);
      }
    }
    for (JsonElement e: array(obj, "in_arg")) {
      JsonObject arg = object(e, "in_arg");
      String name = string(op.name(), arg, "name", null);
      if (op.findInput(name) == null) {
        throw new SchemaException(op.name(), "in_arg for unknown input " +
                                  name);
      }
      String renameTo = string(op.name(), arg, "rename_to", null);
      if (renameTo != null) {
        b.renameInArg(name, renameTo);
      }
    }
    for (JsonElement e: array(obj, "out_arg")) {
      JsonObject arg = object(e, "out_arg");
      String renameTo = string(op.name(), arg, "rename_to", null);
      if (renameTo != null) {
        b.renameOutArg(string(op.name(), arg, "name", null), renameTo);
      }
    }
    for (JsonElement e: array(obj, "attr")) {
      JsonObject attr = object(e, "attr");
      String name = string(op.name(), attr, "name", null);
      AttrDef def = op.findAttr(name);
      if (def == null) {
        throw new SchemaException(op.name(), "api_def for unknown attr " +
                                  name);
      }
      String renameTo = string(op.name(), attr, "rename_to", null);
      if (renameTo != null) {
        b.renameAttr(name, renameTo);
      }
      if (attr.has("default_value") && def.type().kind() != AttrKind.FUNC) {
        b.attrDefault(name, value(op.name(), name, def.type(),
                                  attr.get("default_value")));
      }
    }
    List<String> order = new ArrayList<String>();
    for (JsonElement e: array(obj, "arg_order")) {
      order.add(primitive(op.name(), e).getAsString());
    }
    b.argOrder(order);
    if (obj.has("endpoint")) {
      for (JsonElement e: array(obj, "endpoint")) {
        JsonObject ep = object(e, "endpoint");
        b.endpoint(string(op.name(), ep, "name", op.name()),
                   bool(op.name(), ep, "deprecated"));
      }
    } else {
      b.endpoint(op.name(), false);
    }
    b.summary(string(op.name(), obj, "summary", ""));
    b.description(string(op.name(), obj, "description", ""));
    return b.build();
  }

  /**
   * Convert a JSON value to an attribute value of the given type
   */
  static AttrValue value(String opName, String attrName, AttrType type,
                         JsonElement json) throws SchemaException {
    try {
      if (type.isList()) {
        if (!json.isJsonArray()) {
          throw new SchemaException(opName, "default for " + attrName +
                                    " must be a list");
        }
        List<AttrValue> elems = new ArrayList<AttrValue>();
        for (JsonElement e: json.getAsJsonArray()) {
          elems.add(scalar(opName, type.kind(), e));
        }
        return AttrValue.listOf(type.kind(), elems);
      }
      return scalar(opName, type.kind(), json);
    } catch (NumberFormatException | UnsupportedOperationException |
             IllegalStateException e) {
      throw new SchemaException(opName, "bad value for attr " + attrName +
                                ": " + json, e);
    }
  }

  private static AttrValue scalar(String opName, AttrKind kind,
                                  JsonElement json) throws SchemaException {
    switch (kind) {
      case STRING:
        return AttrValue.ofString(primitive(opName, json).getAsString());
      case INT:
        return AttrValue.ofInt(primitive(opName, json).getAsLong());
      case FLOAT:
        return AttrValue.ofFloat(floatValue(primitive(opName, json)));
      case BOOL:
        return AttrValue.ofBool(primitive(opName, json).getAsBoolean());
      case TYPE:
        return AttrValue.ofType(
              dataType(opName, primitive(opName, json).getAsString()));
      case SHAPE:
        return shape(opName, json);
      case TENSOR:
        return AttrValue.ofTensor(primitive(opName, json).getAsString());
      case FUNC:
        throw new SchemaException(opName, "func values are not supported");
      default:
        throw new IllegalStateException("Unknown attr kind " + kind);
    }
  }

  private static double floatValue(JsonPrimitive p) {
    if (p.isString()) {
      String s = p.getAsString().toLowerCase();
      if (s.equals("nan")) {
        return Double.NaN;
      } else if (s.equals("inf") || s.equals("+inf")) {
        return Double.POSITIVE_INFINITY;
      } else if (s.equals("-inf")) {
        return Double.NEGATIVE_INFINITY;
      }
      return Double.parseDouble(s);
    }
    return p.getAsDouble();
  }

  /**
   * A shape is a list of dimensions or the string "unknown_rank"
   */
  private static AttrValue shape(String opName, JsonElement json)
        throws SchemaException {
    if (json.isJsonPrimitive() &&
        json.getAsString().equals(UNKNOWN_RANK)) {
      return AttrValue.unknownShape();
    }
    if (!json.isJsonArray()) {
      throw new SchemaException(opName, "shape must be a list or \"" +
                                UNKNOWN_RANK + "\": " + json);
    }
    JsonArray arr = json.getAsJsonArray();
    long dims[] = new long[arr.size()];
    for (int i = 0; i < dims.length; i++) {
      dims[i] = arr.get(i).getAsLong();
    }
    return AttrValue.ofShape(dims);
  }

  private static DataType dataType(String opName, String name)
        throws SchemaException {
    DataType t = DataType.fromName(name);
    if (t == null) {
      throw new SchemaException(opName, "unknown data type " + name);
    }
    return t;
  }

  private static JsonArray array(JsonObject obj, String key)
        throws SchemaException {
    JsonElement e = obj.get(key);
    if (e == null || e.isJsonNull()) {
      return new JsonArray();
    }
    if (!e.isJsonArray()) {
      throw new SchemaException("\"" + key + "\" must be a list");
    }
    return e.getAsJsonArray();
  }

  private static JsonObject object(JsonElement e, String what)
        throws SchemaException {
    if (!e.isJsonObject()) {
      throw new SchemaException(what + " must be an object: " + e);
    }
    return e.getAsJsonObject();
  }

  private static JsonPrimitive primitive(String opName, JsonElement e)
        throws SchemaException {
    if (!e.isJsonPrimitive()) {
      throw new SchemaException(opName, "expected a single value: " + e);
    }
    return e.getAsJsonPrimitive();
  }

  /**
   * @param opName op being read, or null before its name is known
   */
  private static JsonPrimitive field(String opName, String key,
                                     JsonElement e) throws SchemaException {
    if (!e.isJsonPrimitive()) {
      String msg = "\"" + key + "\" must be a single value: " + e;
      throw opName == null ? new SchemaException(msg)
                           : new SchemaException(opName, msg);
    }
    return e.getAsJsonPrimitive();
  }

  private static String string(String opName, JsonObject obj, String key,
                               String dflt) throws SchemaException {
    JsonElement e = obj.get(key);
    if (e == null || e.isJsonNull()) {
      return dflt;
    }
    return field(opName, key, e).getAsString();
  }

  private static boolean bool(String opName, JsonObject obj, String key)
        throws SchemaException {
    JsonElement e = obj.get(key);
    if (e == null || e.isJsonNull()) {
      return false;
    }
    JsonPrimitive p = field(opName, key, e);
    if (!p.isBoolean()) {
      throw new SchemaException(opName, "\"" + key + "\" must be true or " +
                                "false: " + e);
    }
    return p.getAsBoolean();
  }
}
