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
package exm.thorc.ui;

import java.io.File;
import java.io.IOException;
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

import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.Settings;
import exm.thorc.common.exceptions.InvalidOptionException;
import exm.thorc.common.exceptions.ThorFatal;
import exm.thorc.frontend.ImportResolver;

/**
 * Command line interface to thorc.  Some compiler options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String INCLUDE_FLAG = "I";
  private static final String UPDATE_FLAG = "u";
  private static final String C_EXTENSION = ".c";

  public static void main(String[] args) {
    Args thorcArgs = processArgs(args);

    try {
      Settings.initThorProperties();
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

    File inputFile = new File(thorcArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.err.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    File finalOutput = selectOutputFile(thorcArgs);

    if (skipCompile(thorcArgs, inputFile, finalOutput)) {
      System.exit(ExitCode.SUCCESS.code());
    }

    try {
      run(logger, inputFile, finalOutput);
    } catch (ThorFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  /**
   * Compile and write output.  Output only appears if compilation
   * succeeded.
   * @throws ThorFatal on any failure
   */
  private static void run(Logger logger, File inputFile, File finalOutput) {
    CompileResult result;
    try {
      result = new ThorCompiler(logger).compile(inputFile);
    } catch (Throwable t) {
      ThorCompiler.reportInternalError(logger, t);
      throw new ThorFatal(ExitCode.ERROR_INTERNAL.code());
    }

    // Warnings were already logged as they were found
    if (!result.succeeded()) {
      System.err.println("thorc error:");
      for (Diagnostic d: result.errors()) {
        System.err.println(d);
      }
      throw new ThorFatal(result.exitCode().code());
    }

    // Use intermediate file so we don't leave partial output behind
    File tmpOutput = null;
    try {
      tmpOutput = File.createTempFile("thorc-out", C_EXTENSION);
      FileUtils.writeStringToFile(tmpOutput, result.output(),
                                  StandardCharsets.UTF_8);
      FileUtils.copyFile(tmpOutput, finalOutput);
      logger.debug("Wrote " + finalOutput);
    } catch (IOException e) {
      System.err.println("Error writing output " + finalOutput + ": " +
                         e.getMessage());
      throw new ThorFatal(ExitCode.ERROR_IO.code());
    } finally {
      if (tmpOutput != null) {
        FileUtils.deleteQuietly(tmpOutput);
      }
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option module = new Option(INCLUDE_FLAG, "include", true,
                                    "Add to import search path");
    opts.addOption(module);

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

    boolean updateOutput = cmd.hasOption(UPDATE_FLAG);

    if (cmd.hasOption(INCLUDE_FLAG)) {
      for (String dir: cmd.getOptionValues(INCLUDE_FLAG)) {
        Settings.addModulePath(dir);
      }
    }

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
    Args result = new Args(input, output, updateOutput);
    recordArgValues(result);
    return result;
  }

  /**
   * Check conditions for skipping compilation entirely
   */
  private static boolean skipCompile(Args args, File infile, File outfile) {
    if (args.updateOutput && outfile.exists() &&
        !olderThan(outfile, infile)) {
      Logging.getThorLogger().debug("Output up to date. Done.");
      return true;
    }
    return false;
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
    fmt.printHelp("thorc [options] <input.thor> [output.c]", opts);
  }

  static File selectOutputFile(Args args) {
    String outputFilename;
    if (args.outputFilename != null) {
      outputFilename = args.outputFilename;
    } else {
      String infile = args.inputFilename;
      String prefix;
      String ext = ImportResolver.THOR_EXTENSION;
      if (infile.endsWith(ext)) {
        prefix = infile.substring(0, infile.length() - ext.length());
      } else {
        prefix = infile;
      }
      outputFilename = prefix + C_EXTENSION;
    }
    return new File(outputFilename);
  }

  private static boolean olderThan(File file1, File file2) {
    long modTime1 = file1.lastModified();
    long modTime2 = file2.lastModified();
    return modTime1 < modTime2;
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean updateOutput;

    public Args(String inputFilename, String outputFilename,
                boolean updateOutput) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.updateOutput = updateOutput;
    }
  }
}
