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
package com.cloudera.xml2code.test;

import java.io.StringReader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.cloudera.xml2code.Xml2CodeConverter;
import com.cloudera.xml2code.analysis.MultipleRootsException;
import com.cloudera.xml2code.inference.ContentType;
import com.cloudera.xml2code.inference.TypeOverrides;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.failBecauseExceptionWasNotThrown;

public class Xml2CodeConverterTest {
  Xml2CodeConverter converter;

  @BeforeEach
  public void setUp() {
    converter = new Xml2CodeConverter();
  }

  @Test
  public void nothingIsGeneratedBeforeAnyDocument() throws Exception {
    StringBuilder out = new StringBuilder();
    converter.generateCode(out, TypeOverrides.none());

    assertThat(out.toString()).isEmpty();
    assertThat(converter.getRoot()).isNull();
    assertThat(converter.describe()).contains("no documents analyzed");
    try {
      converter.infer(TypeOverrides.none());
      failBecauseExceptionWasNotThrown(IllegalStateException.class);
    } catch (IllegalStateException expected) {
      assertThat(expected.getMessage()).contains("No document");
    }
  }

  @Test
  public void documentsAccumulateIntoOneSession() throws Exception {
    converter.analyze(new StringReader("<log><line level=\"info\">started</line></log>"));
    converter.analyze(new StringReader("<log><line level=\"warn\">disk low</line><line level=\"info\">ok</line></log>"));

    assertThat(converter.getDocumentCount()).isEqualTo(2);
    assertThat(converter.getRegistry().findElement("line").getEncounters()).isEqualTo(3);
    assertThat(converter.infer(null).findAttributeType("level").getVariants().getConstants())
      .containsExactly("INFO", "WARN");

    StringBuilder out = new StringBuilder();
    converter.generateCode(out, TypeOverrides.none(), "org.example.log");
    assertThat(out.toString()).contains("package org.example.log;");
    assertThat(out.toString()).contains("public final class LogReader");
    assertThat(out.toString()).contains("addLineElement(");
  }

  @Test
  public void overridesReachTheGeneratedCode() throws Exception {
    converter.analyze(new StringReader("<log><line level=\"info\">7</line></log>"));
    StringBuilder out = new StringBuilder();
    converter.generateCode(out, new TypeOverrides().putElement("line", ContentType.STRING).putAttribute("level", ContentType.STRING));

    assertThat(out.toString()).doesNotContain("enum LevelAttribute");
    assertThat(out.toString()).contains("public String getContent()");
  }

  @Test
  public void rejectsADifferentRoot() throws Exception {
    converter.analyze(new StringReader("<log/>"));
    try {
      converter.analyze(new StringReader("<journal/>"));
      failBecauseExceptionWasNotThrown(MultipleRootsException.class);
    } catch (MultipleRootsException expected) {
      assertThat(converter.getDocumentCount()).isEqualTo(1);
    }
  }

  @Test
  public void describesTheGraph() throws Exception {
    converter.analyze(new StringReader("<log><line level=\"info\">started</line></log>"));
    String report = converter.describe();

    assertThat(report).contains("E\"log\"");
    assertThat(report).contains("E\"line\"");
    assertThat(report).contains("@A\"level\"");
  }
}
