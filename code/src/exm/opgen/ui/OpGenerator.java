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
package exm.opgen.ui;

import java.io.IOException;
import java.io.OutputStream;

import org.apache.log4j.Logger;

import exm.opgen.common.exceptions.InvalidOptionException;
import exm.opgen.common.exceptions.OpGenFatal;
import exm.opgen.common.exceptions.SchemaException;
import exm.opgen.frontend.OpList;
import exm.opgen.frontend.OpListReader;
import exm.opgen.pybackend.PyOpsGenerator;

/**
 * Entry point for generating a wrapper module from an op list file.
 * Errors are reported to the user and turned into {@link OpGenFatal}
 * carrying the exit code.
 */
public class OpGenerator {

  private final Logger logger;

  public OpGenerator(Logger logger) {
    this.logger = logger;
  }

  /**
   * Read ops from inputFile and write python wrappers to output.
   * The output stream is closed on success.
   */
  public void generate(String inputFile, OutputStream output) {
    try {
      logger.debug("opgen starting on " + inputFile);
      OpList ops = OpListReader.readFile(inputFile);
      PyOpsGenerator gen = PyOpsGenerator.fromSettings();
      gen.generate(ops.ops(), ops.apiDefs(), output);
      output.close();
      logger.debug("opgen done");
    } catch (OpGenFatal e) {
      throw e;
    } catch (SchemaException e) {
      System.err.println("opgen error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled()) {
        logger.debug("Schema error", e);
      }
      throw new OpGenFatal(ExitCode.ERROR_USER.code());
    } catch (InvalidOptionException e) {
      System.err.println("opgen error: " + e.getMessage());
      throw new OpGenFatal(ExitCode.ERROR_COMMAND.code());
    } catch (IOException e) {
      System.err.println("I/O error: " + e.getMessage());
      throw new OpGenFatal(ExitCode.ERROR_IO.code());
    } catch (AssertionError e) {
      reportInternalError(e);
      throw new OpGenFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (RuntimeException e) {
      reportInternalError(e);
      throw new OpGenFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("OPGEN INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
