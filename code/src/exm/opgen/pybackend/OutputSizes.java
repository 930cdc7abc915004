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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.lang.ArgDef;
import exm.opgen.common.lang.OpDef;

/**
 * Run-time lengths of an op's outputs, as python expressions.
 */
public class OutputSizes {
  private final List<String> sizes;
  private final String countExpr;

  private OutputSizes(List<String> sizes, String countExpr) {
    this.sizes = Collections.unmodifiableList(sizes);
    this.countExpr = countExpr;
  }

  /**
   * @param attrExpressions schema attr name -> python expression for
   *        its value inside the generated function
   * @param inference for list(type) outputs, the length is taken from
   *        the inferring input where there is one
   */
  public static OutputSizes compute(OpDef op,
        Map<String, String> attrExpressions, AttrInference inference)
              throws GenerationException {
    List<String> sizes = new ArrayList<String>();
    StringBuilder count = new StringBuilder();
    int fixed = 0;
    for (ArgDef out: op.outputs()) {
      if (out.numberAttr() != null) {
        String size = lookup(op, attrExpressions, out.numberAttr());
        sizes.add(size);
        appendTerm(count, size);
      } else if (out.typeListAttr() != null) {
        String inferring = inference.firstArgName(out.typeListAttr());
        String size;
        if (inferring != null) {
          size = "len(" + inferring + ")";
        } else {
          size = "len(" + lookup(op, attrExpressions, out.typeListAttr()) +
                 ")";
        }
        sizes.add(size);
        appendTerm(count, size);
      } else {
        sizes.add(ArgFlattener.SCALAR);
        fixed++;
      }
    }
    if (fixed > 0) {
      appendTerm(count, Integer.toString(fixed));
    } else if (count.length() == 0) {
      count.append("0");
    }
    return new OutputSizes(sizes, count.toString());
  }

  private static String lookup(OpDef op, Map<String, String> attrExpressions,
                               String attr) throws GenerationException {
    String expr = attrExpressions.get(attr);
    if (expr == null) {
      throw new GenerationException(op.name(),
            "output refers to unknown attr " + attr);
    }
    return expr;
  }

  private static void appendTerm(StringBuilder count, String term) {
    if (count.length() > 0) {
      count.append(" + ");
    }
    count.append(term);
  }

  /** One entry per output: {@link ArgFlattener#SCALAR} or a length */
  public List<String> sizes() {
    return sizes;
  }

  /** Expression for the total number of output tensors */
  public String countExpr() {
    return countExpr;
  }

  public int size() {
    return sizes.size();
  }

  /** True if output i is a list */
  public boolean isList(int i) {
    return !sizes.get(i).isEmpty();
  }
}
