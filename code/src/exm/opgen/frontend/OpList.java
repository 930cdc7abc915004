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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.OpDef;

/**
 * Ops in file order plus the overrides read alongside them
 */
public class OpList {
  private final List<OpDef> ops;
  private final Map<String, ApiDef> apiDefs;

  public OpList(List<OpDef> ops, Map<String, ApiDef> apiDefs) {
    this.ops = Collections.unmodifiableList(ops);
    this.apiDefs = Collections.unmodifiableMap(apiDefs);
  }

  public List<OpDef> ops() {
    return ops;
  }

  /** op name -> override; ops without one are absent */
  public Map<String, ApiDef> apiDefs() {
    return apiDefs;
  }
}
