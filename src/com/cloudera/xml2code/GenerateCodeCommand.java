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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import com.cloudera.xml2code.analysis.AnalysisException;
import com.cloudera.xml2code.inference.TypeOverrides;

/*********************************************************
 * GenerateCodeCommand is the build step around an Xml2CodeConverter:
 * it analyzes a set of sample files and writes the generated reader to
 * an output file, unless that file is already up to date.
 *
 * The output starts with a hash signature line over the inputs.  When
 * the existing output carries the same signature, nothing is done.
 * The generated text is rendered in memory first, so a failing run
 * never leaves a half-written file behind.
 *********************************************************/
public class GenerateCodeCommand {
  private static final Logger LOG = Logger.getLogger(GenerateCodeCommand.class);

  public static final String HASH_PREFIX = "//hash_signature:";

  private final File outputFile;
  private final List<File> inputs;
  private TypeOverrides overrides = TypeOverrides.none();
  private String packageName = "";
  private boolean failIfAnalysisFails = false;
  private boolean skipHashTest = false;
  private File avroSchemaFile = null;
  private Xml2CodeConverter converter = null;

  public GenerateCodeCommand(File outputFile, List<File> inputs) {
    this.outputFile = outputFile;
    this.inputs = new ArrayList<File>(inputs);
  }

  public GenerateCodeCommand setOverrides(TypeOverrides overrides) {
    this.overrides = overrides;
    return this;
  }

  public GenerateCodeCommand setPackageName(String packageName) {
    this.packageName = packageName;
    return this;
  }

  /**
   * When set, the first input that cannot be analyzed aborts the run.
   * Otherwise it is logged and skipped.
   */
  public GenerateCodeCommand setFailIfAnalysisFails(boolean failIfAnalysisFails) {
    this.failIfAnalysisFails = failIfAnalysisFails;
    return this;
  }

  /**
   * When set, the output is regenerated even if its signature matches.
   */
  public GenerateCodeCommand setSkipHashTest(boolean skipHashTest) {
    this.skipHashTest = skipHashTest;
    return this;
  }

  public GenerateCodeCommand setAvroSchemaFile(File avroSchemaFile) {
    this.avroSchemaFile = avroSchemaFile;
    return this;
  }

  /**
   * The session of the last run that generated output; null otherwise.
   */
  public Xml2CodeConverter getConverter() {
    return converter;
  }

  /**
   * Returns true if output was written, false if it was up to date.
   */
  public boolean run() throws IOException, AnalysisException {
    if (inputs.size() == 0) {
      throw new IllegalArgumentException("No input files given");
    }
    List<File> sorted = sortedInputs(inputs);
    String signature = hashSignature(sorted);
    if (! skipHashTest && outputFile.exists() && signature.equals(readSignature(outputFile))) {
      LOG.info(outputFile + " is up to date");
      converter = null;
      return false;
    }

    Xml2CodeConverter session = new Xml2CodeConverter();
    int processed = 0;
    for (File input: sorted) {
      try {
        session.analyze(input);
        processed++;
      } catch (AnalysisException ae) {
        if (failIfAnalysisFails) {
          throw ae;
        }
        LOG.error("Could not analyze " + input + ", skipping it", ae);
      }
    }
    if (processed < sorted.size()) {
      LOG.warn("Only " + processed + " of " + sorted.size() + " inputs were analyzed");
    }
    if (processed == 0) {
      throw new AnalysisException("None of the " + sorted.size() + " inputs could be analyzed");
    }

    StringBuilder code = new StringBuilder();
    code.append(HASH_PREFIX).append(signature).append('\n');
    session.generateCode(code, overrides, packageName);
    String avro = null;
    if (avroSchemaFile != null) {
      avro = session.generateAvroSchema(overrides, packageName).toString(true);
    }

    write(outputFile, code.toString());
    LOG.info("Wrote " + outputFile);
    if (avro != null) {
      write(avroSchemaFile, avro);
      LOG.info("Wrote " + avroSchemaFile);
    }
    converter = session;
    return true;
  }

  static List<File> sortedInputs(List<File> inputs) {
    List<File> sorted = new ArrayList<File>(inputs);
    Collections.sort(sorted, new Comparator<File>() {
      public int compare(File a, File b) {
        return a.getPath().compareTo(b.getPath());
      }
    });
    return sorted;
  }

  /**
   * SHA-256 over the length and contents of every input, in order, as Base64.
   */
  public static String hashSignature(List<File> inputs) throws IOException {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException nsae) {
      throw new IOException("SHA-256 is not available", nsae);
    }
    byte[] buf = new byte[8192];
    for (File f: inputs) {
      digest.update(ByteBuffer.allocate(8).putLong(f.length()).array());
      InputStream in = new FileInputStream(f);
      try {
        int n;
        while ((n = in.read(buf)) > 0) {
          digest.update(buf, 0, n);
        }
      } finally {
        in.close();
      }
    }
    return Base64.getEncoder().encodeToString(digest.digest());
  }

  /**
   * The signature on the first line of an earlier output, or null.
   */
  static String readSignature(File f) throws IOException {
    BufferedReader in = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8));
    try {
      String line = in.readLine();
      if (line == null || ! line.startsWith(HASH_PREFIX)) {
        return null;
      }
      return line.substring(HASH_PREFIX.length()).trim();
    } finally {
      in.close();
    }
  }

  static void write(File f, String text) throws IOException {
    File parent = f.getAbsoluteFile().getParentFile();
    if (parent != null && ! parent.exists()) {
      if (! parent.mkdirs()) {
        throw new IOException("Could not create: " + parent);
      }
    }
    Writer out = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8);
    try {
      out.write(text);
    } finally {
      out.close();
    }
  }
}
