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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.opgen.common.lang.ArgDef;

/**
 * Attributes whose values are determined by the inputs passed in:
 * element types of typed inputs, and lengths of list inputs.
 * Inferred attributes never appear in the generated signature.
 */
public class AttrInference {

  /** attribute name -> indices of inputs, in canonical order */
  private final ListMultimap<String, Integer> attrToArgs;

  /** attribute name -> parameter name of first input that infers it */
  private final Map<String, String> firstArg;

  private AttrInference(ListMultimap<String, Integer> attrToArgs,
                        Map<String, String> firstArg) {
    this.attrToArgs = attrToArgs;
    this.firstArg = firstArg;
  }

  /**
   * @param inputs inputs in canonical (signature) order
   * @param paramNames parameter name of each input
   */
  public static AttrInference resolve(List<ArgDef> inputs,
                                      List<String> paramNames) {
    assert(inputs.size() == paramNames.size());
    ListMultimap<String, Integer> attrToArgs = ArrayListMultimap.create();
    Map<String, String> firstArg = new HashMap<String, String>();
    for (int i = 0; i < inputs.size(); i++) {
      ArgDef arg = inputs.get(i);
      if (arg.typeAttr() != null) {
        add(attrToArgs, firstArg, arg.typeAttr(), i, paramNames.get(i));
      } else if (arg.typeListAttr() != null) {
        add(attrToArgs, firstArg, arg.typeListAttr(), i, paramNames.get(i));
      }
      if (arg.numberAttr() != null) {
        add(attrToArgs, firstArg, arg.numberAttr(), i, paramNames.get(i));
      }
    }
    return new AttrInference(attrToArgs, firstArg);
  }

  private static void add(ListMultimap<String, Integer> attrToArgs,
        Map<String, String> firstArg, String attr, int index, String param) {
    attrToArgs.put(attr, index);
    if (!firstArg.containsKey(attr)) {
      firstArg.put(attr, param);
    }
  }

  public boolean isInferred(String attrName) {
    return attrToArgs.containsKey(attrName);
  }

  /**
   * @return indices of inputs inferring the attribute, empty if none
   */
  public List<Integer> argIndices(String attrName) {
    return attrToArgs.get(attrName);
  }

  /**
   * @return parameter name of the first input inferring the attribute,
   *          or null
   */
  public String firstArgName(String attrName) {
    return firstArg.get(attrName);
  }

  public Set<String> inferredAttrs() {
    return attrToArgs.keySet();
  }

  @Override
  public String toString() {
    return attrToArgs.toString();
  }
}
