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

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.opgen.common.Logging;
import exm.opgen.common.Settings;
import exm.opgen.common.exceptions.InvalidOptionException;
import exm.opgen.common.exceptions.OpGenFatal;

/**
 * Command line interface to the wrapper generator.  Some options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String HIDDEN_FLAG = "H";
  private static final String ANNOTATE_FLAG = "A";
  private static final String SOURCE_FLAG = "S";
  private static final String UPDATE_FLAG = "u";
  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {

    Args opgenArgs = processArgs(args);

    try {
      Settings.initProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File input = new File(opgenArgs.inputFilename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    File finalOutput = selectOutputFile(opgenArgs);

    if (skipGenerate(opgenArgs, finalOutput)) {
      System.exit(ExitCode.SUCCESS.code());
    }

    // Use intermediate file so we don't leave partial output behind
    File tmpOutput = setupTmpOutput();
    OutputStream outStream = openForOutput(tmpOutput);

    try {
      OpGenerator gen = new OpGenerator(logger);
      gen.generate(input.getPath(), outStream);
      copyToOutput(tmpOutput, finalOutput);
      cleanupFiles(true, opgenArgs);
    } catch (OpGenFatal ex) {
      cleanupFiles(false, opgenArgs);
      System.exit(ex.exitCode);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option hidden = new Option(HIDDEN_FLAG, "hidden", true,
                               "Comma-separated ops to generate as hidden");
    opts.addOption(hidden);

    Option annotate = new Option(ANNOTATE_FLAG, "annotate", true,
                    "Comma-separated ops to generate with type annotations");
    opts.addOption(annotate);

    Option source = new Option(SOURCE_FLAG, "source", true,
                    "Comma-separated source files to name in the header");
    opts.addOption(source);

    opts.addOption(UPDATE_FLAG, false, "Update output only if out of date");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    addListOption(cmd, HIDDEN_FLAG, Settings.HIDDEN_OPS);
    addListOption(cmd, ANNOTATE_FLAG, Settings.TYPE_ANNOTATE_OPS);
    addListOption(cmd, SOURCE_FLAG, Settings.SOURCE_FILES);

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
              "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    Args result = new Args(input, output, cmd.hasOption(UPDATE_FLAG));
    recordArgValues(result);
    return result;
  }

  private static void addListOption(CommandLine cmd, String flag,
                                    String key) {
    if (cmd.hasOption(flag)) {
      for (String value: cmd.getOptionValues(flag)) {
        Settings.addToList(key, Arrays.asList(value.split(",")));
      }
    }
  }

  /**
   * Store in properties for later logging
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  private static boolean skipGenerate(Args args, File outfile) {
    if (args.updateOutput && outfile.exists() &&
        !olderThan(outfile, new File(args.inputFilename))) {
      Logging.getLogger().debug("Output up to date. Done.");
      return true;
    }
    return false;
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("opgen", opts, true);
    System.out.println("requires arguments: <input.json> [output.py]");
  }

  static File selectOutputFile(Args args) {
    String outputFilename;
    if (args.outputFilename != null) {
      outputFilename = args.outputFilename;
    } else {
      String infile = args.inputFilename;
      String ext = ".json";
      String prefix;
      if (infile.endsWith(ext)) {
        prefix = infile.substring(0, infile.length() - ext.length());
      } else {
        prefix = infile;
      }
      outputFilename = prefix + "_ops.py";
    }
    return new File(outputFilename);
  }

  private static File setupTmpOutput() {
    try {
      File result = File.createTempFile("opgen-out", ".py");
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: "
          + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  private static OutputStream openForOutput(File outfile) {
    try {
      FileOutputStream stream = new FileOutputStream(outfile);
      return new BufferedOutputStream(stream);
    } catch (FileNotFoundException e) {
      System.err.println("Unexpected error opening " +
                         outfile.getAbsolutePath() + " for output: " +
                         e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  /**
   * Copy generated file to output.  In event of failure, throw a fatal
   * error
   */
  private static void copyToOutput(File generated, File output) {
    // Use output stream since it works with non-seekable
    // devices such as /dev/stdout
    try (PrintStream outStream =
            new PrintStream(new FileOutputStream(output))) {
      FileUtils.copyFile(generated, outStream);
    } catch (IOException e) {
      System.err.println("Error copying " + generated + " to " + output +
                         ": " + e.getMessage());
      throw new OpGenFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static boolean olderThan(File file1, File file2) {
    return file1.lastModified() < file2.lastModified();
  }

  private static void cleanupFiles(boolean success, Args args) {
    if (!success && args.outputFilename != null) {
      File outFile = new File(args.outputFilename);
      if (outFile.exists()) {
        outFile.delete();
      }
    }
    for (File temp: temporaries) {
      if (temp.exists()) {
        temp.delete();
      }
    }
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean updateOutput;

    Args(String inputFilename, String outputFilename, boolean updateOutput) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.updateOutput = updateOutput;
    }
  }
}
