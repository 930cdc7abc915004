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
package exm.opgen.common.exceptions;

/**
 * Code for one operation could not be generated.  The batch continues
 * with the next operation; the message ends up in a comment in the
 * generated file.
 */
public class GenerationException extends Exception {
  private final String opName;

  public GenerationException(String opName, String message) {
    super(message);
    this.opName = opName;
  }

  public String opName() {
    return opName;
  }

  private static final long serialVersionUID = 1L;
}
