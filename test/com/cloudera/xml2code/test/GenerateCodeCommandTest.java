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

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.avro.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cloudera.xml2code.GenerateCodeCommand;
import com.cloudera.xml2code.analysis.AnalysisException;
import com.cloudera.xml2code.analysis.MalformedDocumentException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.failBecauseExceptionWasNotThrown;

public class GenerateCodeCommandTest {
  @TempDir
  Path dir;

  File copy(String resource) throws Exception {
    return copy(resource, resource.substring(resource.lastIndexOf('/') + 1));
  }

  File copy(String resource, String name) throws Exception {
    Path target = dir.resolve(name);
    InputStream in = getClass().getResourceAsStream(resource);
    try {
      Files.copy(in, target);
    } finally {
      in.close();
    }
    return target.toFile();
  }

  String read(File f) throws Exception {
    return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
  }

  @Test
  public void writesTheSignatureAndTheReader() throws Exception {
    List<File> inputs = Arrays.asList(copy("/dictionary/sample-b.xml"), copy("/dictionary/sample-a.xml"));
    File out = dir.resolve("gen").resolve("DictionaryReader.java").toFile();

    GenerateCodeCommand command = new GenerateCodeCommand(out, inputs).setPackageName("gen");
    assertThat(command.run()).isTrue();

    String code = read(out);
    assertThat(code).startsWith(GenerateCodeCommand.HASH_PREFIX + GenerateCodeCommand.hashSignature(
      Arrays.asList(inputs.get(1), inputs.get(0))) + "\n");
    assertThat(code).contains("package gen;");
    assertThat(code).contains("public final class DictionaryReader");
    assertThat(code).contains("class NoteElement");
    assertThat(command.getConverter().getDocumentCount()).isEqualTo(2);
  }

  @Test
  public void upToDateOutputIsLeftAlone() throws Exception {
    List<File> inputs = Arrays.asList(copy("/dictionary/sample-a.xml"));
    File out = dir.resolve("DictionaryReader.java").toFile();

    assertThat(new GenerateCodeCommand(out, inputs).run()).isTrue();
    Files.write(out.toPath(), (read(out) + "// local edit\n").getBytes(StandardCharsets.UTF_8));

    GenerateCodeCommand second = new GenerateCodeCommand(out, inputs);
    assertThat(second.run()).isFalse();
    assertThat(second.getConverter()).isNull();
    assertThat(read(out)).endsWith("// local edit\n");

    assertThat(new GenerateCodeCommand(out, inputs).setSkipHashTest(true).run()).isTrue();
    assertThat(read(out)).doesNotContain("// local edit");
  }

  @Test
  public void changedInputsAreRegenerated() throws Exception {
    File sample = copy("/dictionary/sample-a.xml");
    File out = dir.resolve("DictionaryReader.java").toFile();
    assertThat(new GenerateCodeCommand(out, Arrays.asList(sample)).run()).isTrue();

    Files.write(sample.toPath(), "<dictionary version=\"1\"/>".getBytes(StandardCharsets.UTF_8));
    assertThat(new GenerateCodeCommand(out, Arrays.asList(sample)).run()).isTrue();
    assertThat(read(out)).doesNotContain("EntryElement");
  }

  @Test
  public void unusableInputsAreSkipped() throws Exception {
    List<File> inputs = new ArrayList<File>();
    inputs.add(copy("/dictionary-bad/other-root.xml", "3-other-root.xml"));
    inputs.add(copy("/dictionary-bad/broken.xml", "2-broken.xml"));
    inputs.add(copy("/dictionary/sample-a.xml", "1-sample-a.xml"));
    File out = dir.resolve("DictionaryReader.java").toFile();

    GenerateCodeCommand command = new GenerateCodeCommand(out, inputs);
    assertThat(command.run()).isTrue();
    assertThat(command.getConverter().getDocumentCount()).isEqualTo(1);
    assertThat(read(out)).contains("public final class DictionaryReader");
  }

  @Test
  public void unusableInputsFailTheRunWhenAsked() throws Exception {
    List<File> inputs = Arrays.asList(copy("/dictionary/sample-a.xml"), copy("/dictionary-bad/broken.xml"));
    File out = dir.resolve("DictionaryReader.java").toFile();

    try {
      new GenerateCodeCommand(out, inputs).setFailIfAnalysisFails(true).run();
      failBecauseExceptionWasNotThrown(MalformedDocumentException.class);
    } catch (MalformedDocumentException expected) {
      assertThat(out).doesNotExist();
    }
  }

  @Test
  public void failsWhenNothingCouldBeAnalyzed() throws Exception {
    File out = dir.resolve("Reader.java").toFile();
    try {
      new GenerateCodeCommand(out, Arrays.asList(copy("/dictionary-bad/broken.xml"))).run();
      failBecauseExceptionWasNotThrown(AnalysisException.class);
    } catch (AnalysisException expected) {
      assertThat(expected.getMessage()).contains("None of the 1 inputs");
      assertThat(out).doesNotExist();
    }
  }

  @Test
  public void needsInputs() throws Exception {
    try {
      new GenerateCodeCommand(dir.resolve("Reader.java").toFile(), new ArrayList<File>()).run();
      failBecauseExceptionWasNotThrown(IllegalArgumentException.class);
    } catch (IllegalArgumentException expected) {
      assertThat(expected.getMessage()).contains("No input");
    }
  }

  @Test
  public void writesTheAvroSchemaAlongside() throws Exception {
    File avro = dir.resolve("schema").resolve("dictionary.avsc").toFile();
    GenerateCodeCommand command = new GenerateCodeCommand(dir.resolve("DictionaryReader.java").toFile(),
                                                          Arrays.asList(copy("/dictionary/sample-a.xml")))
      .setPackageName("org.example")
      .setAvroSchemaFile(avro);
    assertThat(command.run()).isTrue();

    Schema schema = new Schema.Parser().parse(avro);
    assertThat(schema.getFullName()).isEqualTo("org.example.DictionaryElement");
  }

  @Test
  public void signatureDependsOnContentAndOrder() throws Exception {
    File a = copy("/dictionary/sample-a.xml");
    File b = copy("/dictionary/sample-b.xml");

    String ab = GenerateCodeCommand.hashSignature(Arrays.asList(a, b));
    assertThat(GenerateCodeCommand.hashSignature(Arrays.asList(a, b))).isEqualTo(ab);
    assertThat(GenerateCodeCommand.hashSignature(Arrays.asList(b, a))).isNotEqualTo(ab);
    assertThat(GenerateCodeCommand.hashSignature(Arrays.asList(a))).isNotEqualTo(ab);
  }
}
