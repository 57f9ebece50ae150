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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

import org.apache.avro.Schema;
import org.apache.log4j.Logger;

import com.cloudera.xml2code.analysis.AnalysisException;
import com.cloudera.xml2code.analysis.ElementNode;
import com.cloudera.xml2code.analysis.NameRegistry;
import com.cloudera.xml2code.analysis.SchemaReport;
import com.cloudera.xml2code.analysis.StaxEventSource;
import com.cloudera.xml2code.analysis.XmlAnalyzer;
import com.cloudera.xml2code.analysis.XmlEventSource;
import com.cloudera.xml2code.codegen.AvroSchemaEmitter;
import com.cloudera.xml2code.codegen.ParserGenerator;
import com.cloudera.xml2code.inference.InferredModel;
import com.cloudera.xml2code.inference.TypeOverrides;

/*********************************************************
 * An Xml2CodeConverter is one analysis session.  Sample documents are
 * analyzed one after the other into the same schema graph; afterwards
 * the graph can be turned into a typed Java reader, an Avro schema or a
 * diagnostic report as often as needed.
 *
 * All documents of a session must share the same root element.
 *********************************************************/
public class Xml2CodeConverter {
  private static final Logger LOG = Logger.getLogger(Xml2CodeConverter.class);

  private final NameRegistry registry = new NameRegistry();
  private final XmlAnalyzer analyzer = new XmlAnalyzer(registry);

  public Xml2CodeConverter() {
  }

  /////////////////////////////////////////////
  // Analysis
  /////////////////////////////////////////////
  public void analyze(XmlEventSource source) throws AnalysisException {
    analyzer.analyze(source);
  }

  /**
   * Analyzes the document on the stream.  The caller closes the stream.
   */
  public void analyze(InputStream in) throws AnalysisException {
    analyze(new StaxEventSource(in));
  }

  /**
   * Analyzes the document on the reader.  The caller closes the reader.
   */
  public void analyze(Reader in) throws AnalysisException {
    analyze(new StaxEventSource(in));
  }

  public void analyze(File f) throws IOException, AnalysisException {
    LOG.info("Analyzing " + f);
    InputStream in = new FileInputStream(f);
    try {
      analyze(in);
    } finally {
      in.close();
    }
  }

  public ElementNode getRoot() {
    return analyzer.getRoot();
  }

  public NameRegistry getRegistry() {
    return registry;
  }

  public int getDocumentCount() {
    return analyzer.getDocumentCount();
  }

  /////////////////////////////////////////////
  // Output
  /////////////////////////////////////////////
  /**
   * Runs type and shape inference over everything analyzed so far.
   */
  public InferredModel infer(TypeOverrides overrides) {
    if (getRoot() == null) {
      throw new IllegalStateException("No document has been analyzed");
    }
    return InferredModel.infer(getRoot(), overrides);
  }

  public void generateCode(Appendable out, TypeOverrides overrides) throws IOException {
    generateCode(out, overrides, "");
  }

  /**
   * Writes the typed reader as one Java compilation unit.  Writes
   * nothing if no document was analyzed.
   */
  public void generateCode(Appendable out, TypeOverrides overrides, String packageName) throws IOException {
    if (getRoot() == null) {
      LOG.warn("No document has been analyzed, no code generated");
      return;
    }
    new ParserGenerator(infer(overrides), packageName).writeTo(out);
  }

  public Schema generateAvroSchema(TypeOverrides overrides, String namespace) {
    return new AvroSchemaEmitter(infer(overrides), namespace).emit();
  }

  /**
   * The indented dump of the schema graph.
   */
  public String describe() {
    return new SchemaReport(getRoot()).toString();
  }
}
