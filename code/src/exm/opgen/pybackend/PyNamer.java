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
package exm.opgen.pybackend;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Naming rules for generated Python: op name to function name,
 * and avoiding clashes with Python keywords and builtins.
 */
public class PyNamer {
  private static final char JOINER = '_';
  private static final char NAMESPACE_SEPARATOR = '>';

  private static final Set<String> KEYWORDS = new HashSet<String>(
      Arrays.asList(
      "and", "as", "assert", "async", "await", "break", "class",
      "continue", "def", "del", "elif", "else", "except", "exec",
      "False", "finally", "for", "from", "global", "if", "import", "in",
      "is", "lambda", "None", "nonlocal", "not", "or", "pass", "print",
      "raise", "return", "True", "try", "while", "with", "yield"));

  private static final Set<String> BUILTINS = new HashSet<String>(
      Arrays.asList(
      "abs", "all", "any", "apply", "bin", "bool", "buffer", "bytearray",
      "bytes", "callable", "chr", "classmethod", "cmp", "coerce",
      "compile", "complex", "copyright", "credits", "delattr", "dict",
      "dir", "divmod", "enumerate", "eval", "execfile", "exit", "file",
      "filter", "float", "format", "frozenset", "getattr", "globals",
      "hasattr", "hash", "help", "hex", "id", "input", "int", "intern",
      "isinstance", "issubclass", "iter", "len", "license", "list",
      "locals", "long", "map", "max", "memoryview", "min", "next",
      "object", "oct", "open", "ord", "pow", "property", "quit", "range",
      "raw_input", "reduce", "reload", "repr", "reversed", "round", "set",
      "setattr", "slice", "sorted", "staticmethod", "str", "sum", "super",
      "tuple", "type", "unichr", "unicode", "vars", "xrange", "zip",
      "__import__"));

  /** Hidden ops that always get the underscore prefix */
  private static final Set<String> UNDERSCORE_PREFIX_OPS =
      new HashSet<String>(Arrays.asList(
      "fused_batch_norm", "histogram_fixed_width", "stack",
      "batch_norm_with_global_normalization", "clip_by_value"));

  /**
   * Convert CamelCase op name to snake_case function name.
   * A joiner is added at a lower-to-upper transition, or before an
   * upper followed by a lower (MatMul -> mat_mul, BiasAddV1 ->
   * bias_add_v1, LRN -> lrn, _Arg -> __arg).  Namespace separators
   * become joiners.
   */
  public static String lowerCaseOpName(String opName) {
    StringBuilder result = new StringBuilder(opName.length() + 4);
    final int last = opName.length() - 1;
    for (int i = 0; i <= last; i++) {
      char c = opName.charAt(i);
      if (c == NAMESPACE_SEPARATOR) {
        result.append(JOINER);
        continue;
      }
      if (Character.isUpperCase(c) && i > 0) {
        char prev = opName.charAt(i - 1);
        boolean nextLower = i < last &&
                            Character.isLowerCase(opName.charAt(i + 1));
        if ((Character.isLowerCase(prev) || nextLower) &&
            prev != NAMESPACE_SEPARATOR) {
          result.append(JOINER);
        }
      }
      result.append(Character.toLowerCase(c));
    }
    return result.toString();
  }

  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  /**
   * @return true if name is a keyword or builtin
   */
  public static boolean isReserved(String name) {
    return KEYWORDS.contains(name) || BUILTINS.contains(name);
  }

  public static boolean isUnderscorePrefixOp(String functionName) {
    return UNDERSCORE_PREFIX_OPS.contains(functionName);
  }

  /**
   * Make a name safe to define at module level
   */
  public static String avoidReserved(String name) {
    String result = name.replace(NAMESPACE_SEPARATOR, JOINER);
    if (isReserved(result)) {
      return result + JOINER;
    }
    return result;
  }

  /**
   * Make a name safe to use as a parameter or keyword argument.
   * Builtins may be shadowed by parameters, keywords may not.
   */
  public static String avoidKeyword(String name) {
    if (isKeyword(name)) {
      return name + JOINER;
    }
    return name;
  }

  /** Name of the private variable holding an inferred attribute */
  public static String attrVarName(String attrName) {
    return "_attr_" + attrName;
  }

  /** Name of the named tuple class for ops with several outputs */
  public static String outputTupleName(String opName) {
    return "_" + avoidReserved(opName) + "Output";
  }

  public static String fallbackFunctionName(String functionName) {
    return functionName + PyRuntime.EAGER_FALLBACK_SUFFIX;
  }

  public static String dispatcherAlias(String functionName) {
    return "_dispatcher_for_" + functionName;
  }

  public static String typeVarName(String opName, String attrName) {
    return "TV_" + opName + "_" + attrName;
  }
}
