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
 * Represents an error in the operation schema supplied by the user.
 * Thus, this should contain good error message information
 * */
public class SchemaException
extends Exception
{
  public SchemaException(String opName, String message)
  {
    super("op " + opName + ": " + message);
  }

  public SchemaException(String opName, String message, Throwable cause)
  {
    super("op " + opName + ": " + message, cause);
  }

  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }

  private static final long serialVersionUID = 1L;
}
