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

/**
 * Stages of generating one op, in order
 */
public enum EmitPath {
  /** Immediate execution through the runtime's fast path */
  FAST_PATH,
  /** Immediate execution with python-side argument conversion */
  FALLBACK,
  /** Staging into a graph */
  DEFERRED,
  /** Done */
  EMITTED;

  public EmitPath next() {
    switch (this) {
      case FAST_PATH:
        return FALLBACK;
      case FALLBACK:
        return DEFERRED;
      case DEFERRED:
        return EMITTED;
      case EMITTED:
        throw new IllegalStateException("Nothing follows " + this);
      default:
        throw new IllegalStateException("Unknown path " + this);
    }
  }
}
