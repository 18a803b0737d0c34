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
package exm.sfc.ui;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
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
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.sfc.common.Logging;
import exm.sfc.common.Settings;
import exm.sfc.common.exceptions.InvalidOptionException;
import exm.sfc.common.exceptions.SFCFatal;

/**
 * Command line interface to SFC compiler.  Settings can also be passed
 * through Java properties or a JSON configuration file.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String OUTPUT_DIR_FLAG = "o";
  private static final String CONFIG_FLAG = "c";
  private static final String DEFINE_FLAG = "D";
  private static final String LOG_FILE_FLAG = "l";
  private static final String VERBOSE_FLAG = "v";
  private static final String HELP_FLAG = "h";
  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Run compiler with command line arguments
   * @param args
   * @return exit code
   */
  public static int run(String[] args) {
    Args sfcArgs;
    try {
      sfcArgs = processArgs(args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(initOptions());
      return ExitCode.ERROR_COMMAND.code();
    }
    if (sfcArgs == null) {
      return ExitCode.SUCCESS.code();
    }

    Settings settings = new Settings();
    try {
      initSettings(settings, sfcArgs);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    Logger logger;
    try {
      logger = Logging.setupLogging(settings.get(Settings.LOG_FILE),
                          settings.getBoolean(Settings.LOG_VERBOSE));
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }
    if (logger.isDebugEnabled()) {
      for (String key: settings.getKeys()) {
        logger.debug("Setting " + key + "=" + settings.get(key));
      }
    }

    File inputFile = new File(sfcArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.err.println("Input file \"" + inputFile + "\" is not readable");
      return ExitCode.ERROR_IO.code();
    }
    File outputDir = new File(settings.get(Settings.OUTPUT_DIR));

    try {
      // Use intermediate directory so we don't create invalid output in
      // case of compilation errors
      File tmpOutput = setupTmpOutput(inputFile);
      SFCompiler sfc = new SFCompiler(logger, settings);
      sfc.compile(inputFile, tmpOutput);
      copyToOutput(tmpOutput, outputDir);
      logger.debug("Wrote output to " + outputDir.getAbsolutePath());
      return ExitCode.SUCCESS.code();
    } catch (SFCFatal ex) {
      return ex.exitCode;
    } finally {
      cleanupFiles();
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(OUTPUT_DIR_FLAG, "output", true,
                              "Build directory (default: build)"));
    opts.addOption(new Option(CONFIG_FLAG, "config", true,
                              "JSON configuration file"));

    // May be repeated
    opts.addOption(new Option(DEFINE_FLAG, true,
                              "Setting definition key=value"));

    opts.addOption(new Option(LOG_FILE_FLAG, "log", true, "Log file"));
    opts.addOption(VERBOSE_FLAG, "verbose", false, "Verbose logging");
    opts.addOption(HELP_FLAG, "help", false, "Print usage");
    return opts;
  }

  /**
   * @return parsed arguments, or null if only help was requested
   */
  private static Args processArgs(String[] args) throws ParseException {
    Options opts = initOptions();

    CommandLineParser parser = new GnuParser();
    CommandLine cmd = parser.parse(opts, args);

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      throw new ParseException("Expected one input file, but got " +
                               remainingArgs.length + " arguments");
    }

    List<String> defines = new ArrayList<String>();
    if (cmd.hasOption(DEFINE_FLAG)) {
      defines.addAll(Arrays.asList(cmd.getOptionValues(DEFINE_FLAG)));
    }
    return new Args(remainingArgs[0], cmd.getOptionValue(OUTPUT_DIR_FLAG),
            cmd.getOptionValue(CONFIG_FLAG), defines,
            cmd.getOptionValue(LOG_FILE_FLAG), cmd.hasOption(VERBOSE_FLAG));
  }

  /**
   * Apply settings in increasing priority: defaults, system properties,
   * configuration file, definitions, then explicit flags
   */
  private static void initSettings(Settings settings, Args args)
                                        throws InvalidOptionException {
    settings.initFromSystemProperties();
    if (args.configFilename != null) {
      settings.loadConfigFile(new File(args.configFilename));
    }
    for (String def: args.definitions) {
      settings.define(def);
    }
    settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputDir != null) {
      settings.set(Settings.OUTPUT_DIR, args.outputDir);
    }
    if (args.logFilename != null) {
      settings.set(Settings.LOG_FILE, args.logFilename);
    }
    if (args.verbose) {
      settings.set(Settings.LOG_VERBOSE, "true");
    }
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("sfc [options] <source>", opts);
  }

  private static File setupTmpOutput(File inputFile) {
    try {
      String prefix = "sfc-" + FilenameUtils.getBaseName(inputFile.getName());
      File result = Files.createTempDirectory(prefix).toFile();
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: "
          + e.getMessage());
      throw new SFCFatal(ExitCode.ERROR_IO.code());
    }
  }

  /**
   * Copy compiled artifacts to output directory.  In event of failure,
   * throw a fatal error
   * @param tmpOutput
   * @param outputDir
   */
  private static void copyToOutput(File tmpOutput, File outputDir) {
    try {
      FileUtils.forceMkdir(outputDir);
      FileUtils.copyDirectory(tmpOutput, outputDir);
    } catch (IOException e) {
      System.err.println("Error copying output to " + outputDir + ": " +
                         e.getMessage());
      throw new SFCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void cleanupFiles() {
    for (File temp: temporaries) {
      if (temp.exists() && !FileUtils.deleteQuietly(temp)) {
        Logging.getSFCLogger().warn("Could not delete temporary " + temp);
      }
    }
    temporaries.clear();
  }

  private static class Args {
    public final String inputFilename;
    public final String outputDir;
    public final String configFilename;
    public final List<String> definitions;
    public final String logFilename;
    public final boolean verbose;

    public Args(String inputFilename, String outputDir,
                String configFilename, List<String> definitions,
                String logFilename, boolean verbose) {
      super();
      this.inputFilename = inputFilename;
      this.outputDir = outputDir;
      this.configFilename = configFilename;
      this.definitions = definitions;
      this.logFilename = logFilename;
      this.verbose = verbose;
    }
  }
}
