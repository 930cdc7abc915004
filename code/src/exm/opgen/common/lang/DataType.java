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
 * Element types of tensors that can appear in an op schema.
 */
public enum DataType {
  FLOAT16("float16", "Float16"),
  BFLOAT16("bfloat16", "BFloat16"),
  FLOAT32("float32", "Float32"),
  FLOAT64("float64", "Float64"),
  COMPLEX64("complex64", "Complex64"),
  COMPLEX128("complex128", "Complex128"),
  INT8("int8", "Int8"),
  INT16("int16", "Int16"),
  INT32("int32", "Int32"),
  INT64("int64", "Int64"),
  UINT8("uint8", "UInt8"),
  UINT16("uint16", "UInt16"),
  UINT32("uint32", "UInt32"),
  UINT64("uint64", "UInt64"),
  BOOL("bool", "Bool"),
  STRING("string", "String"),
  QINT8("qint8", "QInt8"),
  QUINT8("quint8", "QUInt8"),
  QINT16("qint16", "QInt16"),
  QUINT16("quint16", "QUInt16"),
  QINT32("qint32", "QInt32"),
  RESOURCE("resource", "Resource"),
  VARIANT("variant", "Variant");

  private static final String DTYPES_MODULE = "_dtypes.";

  private final String schemaName;
  private final String className;

  private DataType(String schemaName, String className) {
    this.schemaName = schemaName;
    this.className = className;
  }

  /** Name as written in schemas, e.g. float32 */
  public String schemaName() {
    return schemaName;
  }

  /** Python expression for the dtype object, e.g. _dtypes.float32 */
  public String pythonName() {
    return DTYPES_MODULE + schemaName;
  }

  /** Python expression for the dtype class used in annotations */
  public String annotationName() {
    return DTYPES_MODULE + className;
  }

  /**
   * @param name schema name, with or without the legacy "DT_" prefix
   * @return null if not a known type
   */
  public static DataType fromName(String name) {
    String n = name.toLowerCase();
    if (n.startsWith("dt_")) {
      n = n.substring(3);
      if (n.equals("float")) {
        n = "float32";
      } else if (n.equals("double")) {
        n = "float64";
      } else if (n.equals("half")) {
        n = "float16";
      }
    }
    for (DataType t: values()) {
      if (t.schemaName.equals(n)) {
        return t;
      }
    }
    return null;
  }

  /**
   * @return annotation class names of all types, sorted
   */
  public static List<String> allAnnotationNames() {
    List<String> result = new ArrayList<String>();
    for (DataType t: values()) {
      result.add(t.annotationName());
    }
    Collections.sort(result);
    return result;
  }
}
