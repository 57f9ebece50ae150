/*
 * Copyright (c) 2011, Cloudera, Inc. All Rights Reserved.
 *
 * Cloudera, Inc. licenses this file to you under the Apache License,
 * Version 2.0 (the "License"). You may not use this file except in
 * compliance with the License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * This software is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied. See the License for
 * the specific language governing permissions and limitations under the
 * License.
 */
package com.cloudera.xml2code;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import com.cloudera.xml2code.analysis.AnalysisException;
import com.cloudera.xml2code.inference.TypeOverrides;

/******************************************
 * Command-line front end: analyzes sample XML files and writes a typed
 * Java reader for them.
 *
 * <pre>
 *   Xml2Code -o Reader.java [-p package] [-t overrides.properties] [-a schema.avsc] [-f] [-s] [-r] input.xml...
 * </pre>
 ******************************************/
public class Xml2Code {
  static final String USAGE = "Required input: <input.xml> ...";

  static Options createOptions() {
    Options options = new Options();
    options.addOption("?", false, "Help for command-line");
    options.addOption("o", true, "Output Java file");
    options.addOption("p", true, "Package of the generated reader");
    options.addOption("t", true, "Type override properties (e_<element>=TYPE, a_<attribute>=TYPE)");
    options.addOption("a", true, "Also write an Avro schema to this file");
    options.addOption("f", false, "Fail if any input cannot be analyzed");
    options.addOption("s", false, "Regenerate even if the output is up to date");
    options.addOption("r", false, "Print the analysis report");
    return options;
  }

  static void printHelp(Options options, PrintStream err) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter pw = new PrintWriter(err);
    fmt.printHelp(pw, fmt.getWidth(), "Xml2Code", null, options, fmt.getLeftPadding(), fmt.getDescPadding(), null, true);
    pw.flush();
    err.println(USAGE);
  }

  /**
   * Runs the tool and returns the process exit code.
   */
  public static int run(String argv[], PrintStream err) throws IOException {
    CommandLine cmd = null;
    Options options = createOptions();
    try {
      CommandLineParser parser = new PosixParser();
      cmd = parser.parse(options, argv);
    } catch (ParseException e) {
      printHelp(options, err);
      return -1;
    }

    if (cmd.hasOption("?")) {
      printHelp(options, err);
      return 0;
    }
    if (! cmd.hasOption("o")) {
      err.println("No output file provided.");
      printHelp(options, err);
      return -1;
    }

    String[] argArray = cmd.getArgs();
    if (argArray.length == 0) {
      err.println("No input files provided.");
      printHelp(options, err);
      return -1;
    }
    List<File> inputs = new ArrayList<File>();
    for (int i = 0; i < argArray.length; i++) {
      inputs.add(new File(argArray[i]).getCanonicalFile());
    }

    GenerateCodeCommand command = new GenerateCodeCommand(new File(cmd.getOptionValue("o")).getCanonicalFile(), inputs);
    if (cmd.hasOption("p")) {
      command.setPackageName(cmd.getOptionValue("p"));
    }
    if (cmd.hasOption("t")) {
      command.setOverrides(TypeOverrides.load(new File(cmd.getOptionValue("t"))));
    }
    if (cmd.hasOption("a")) {
      command.setAvroSchemaFile(new File(cmd.getOptionValue("a")).getCanonicalFile());
    }
    command.setFailIfAnalysisFails(cmd.hasOption("f"));
    command.setSkipHashTest(cmd.hasOption("s"));

    try {
      boolean generated = command.run();
      if (cmd.hasOption("r") && generated) {
        err.println(command.getConverter().describe());
      }
    } catch (AnalysisException ae) {
      err.println("Analysis failed: " + ae.getMessage());
      return 1;
    }
    return 0;
  }

  //////////////////////////////////////////
  // main()
  //////////////////////////////////////////
  public static void main(String argv[]) throws IOException {
    System.exit(run(argv, System.err));
  }
}
