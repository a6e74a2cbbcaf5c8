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

package exm.pylower.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.pylower.common.Logging;
import exm.pylower.common.Settings;
import exm.pylower.common.exceptions.InvalidOptionException;
import exm.pylower.common.exceptions.PyLowerFatal;
import exm.pylower.common.lang.TargetVersion;
import exm.pylower.pyast.AstDump;

/**
 * Command line interface to pylower.  Options can also be given
 * as Java properties.  See Settings.java for handling of these options.
 */
public class Main {
  private static final String TARGET_FLAG = "t";
  private static final String CODE_FLAG = "c";
  private static final String NO_ATTRIBUTES_FLAG = "n";
  private static final String HIDE_EMPTY_FLAG = "e";
  private static final String OUTPUT_FLAG = "o";
  private static final String TYPE_COMMENTS_FLAG = "type-comments";

  public static void main(String[] args) {

    try {
      Settings.initSettings();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args pyArgs = processArgs(args);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      TargetVersion version = Settings.getTargetVersion();
      boolean typeComments = Settings.getBoolean(Settings.TYPE_COMMENTS);
      AstDump dump = new AstDump(
                  Settings.getBoolean(Settings.INCLUDE_ATTRIBUTES),
                  Settings.getBoolean(Settings.SHOW_EMPTY), version);

      String source = readSource(pyArgs);
      PrintStream output = openOutput(pyArgs);
      PyLower pyLower = new PyLower(logger, typeComments);
      pyLower.run(pyArgs.inputFilename, source, version, dump, output);
      if (output != System.out) {
        output.close();
      }
    } catch (InvalidOptionException ex) {
      System.err.println(ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    } catch (PyLowerFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(TARGET_FLAG, "target-version", true,
        "Python version to accept syntax of, e.g. 3.8 (default " +
        TargetVersion.LATEST + ")"));
    opts.addOption(new Option(CODE_FLAG, "code", true,
        "Lower this source text instead of a file"));
    opts.addOption(new Option(NO_ATTRIBUTES_FLAG, "no-attributes", false,
        "Omit source positions from output"));
    opts.addOption(new Option(HIDE_EMPTY_FLAG, "hide-empty", false,
        "Omit empty list fields from output"));
    opts.addOption(new Option(OUTPUT_FLAG, "output", true,
        "Write output to file instead of stdout"));
    opts.addOption(new Option(null, TYPE_COMMENTS_FLAG, false,
        "Collect \"# type: ignore\" comments"));
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

    if (cmd.hasOption(TARGET_FLAG)) {
      Settings.set(Settings.TARGET_VERSION, cmd.getOptionValue(TARGET_FLAG));
    }
    if (cmd.hasOption(NO_ATTRIBUTES_FLAG)) {
      Settings.set(Settings.INCLUDE_ATTRIBUTES, "false");
    }
    if (cmd.hasOption(HIDE_EMPTY_FLAG)) {
      Settings.set(Settings.SHOW_EMPTY, "false");
    }
    if (cmd.hasOption(TYPE_COMMENTS_FLAG)) {
      Settings.set(Settings.TYPE_COMMENTS, "true");
    }

    String[] remainingArgs = cmd.getArgs();
    String code = cmd.getOptionValue(CODE_FLAG);
    int expected = (code == null) ? 1 : 0;
    if (remainingArgs.length != expected) {
      System.err.println("Expected " + (code == null ? "an input file" :
              "no input file with -c") + ", but got " +
              remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = (code == null) ? remainingArgs[0] : PyLower.DEFAULT_FILENAME;
    Args result = new Args(input, code, cmd.getOptionValue(OUTPUT_FLAG));
    recordArgValues(result);
    return result;
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

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("pylower [options] <input.py>", opts, false);
  }

  private static String readSource(Args args) {
    if (args.code != null) {
      return args.code;
    }
    File input = new File(args.inputFilename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      throw new PyLowerFatal(ExitCode.ERROR_IO.code());
    }
    try {
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error reading " + input + ": " + e.getMessage());
      throw new PyLowerFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static PrintStream openOutput(Args args) {
    if (args.outputFilename == null) {
      return System.out;
    }
    try {
      return new PrintStream(FileUtils.openOutputStream(
                     new File(args.outputFilename)), false, "UTF-8");
    } catch (IOException e) {
      System.err.println("Could not open " + args.outputFilename +
                         " for output: " + e.getMessage());
      throw new PyLowerFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static class Args {
    public final String inputFilename;
    /** Source text given on the command line, or null */
    public final String code;
    public final String outputFilename;

    public Args(String inputFilename, String code, String outputFilename) {
      this.inputFilename = inputFilename;
      this.code = code;
      this.outputFilename = outputFilename;
    }
  }
}
