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
package com.cloudera.xml2code.inference.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.cloudera.xml2code.inference.ContentType;

import static org.assertj.core.api.Assertions.assertThat;

public class ContentTypeTest {

  @Test
  public void classifiesSingleSamples() {
    assertThat(ContentType.classify("true")).isEqualTo(ContentType.BOOL);
    assertThat(ContentType.classify("FALSE")).isEqualTo(ContentType.BOOL);
    assertThat(ContentType.classify("42")).isEqualTo(ContentType.UINT);
    assertThat(ContentType.classify(" 42 ")).isEqualTo(ContentType.UINT);
    assertThat(ContentType.classify("-7")).isEqualTo(ContentType.INT);
    assertThat(ContentType.classify("3.25")).isEqualTo(ContentType.FLOAT);
    assertThat(ContentType.classify("-3,25")).isEqualTo(ContentType.FLOAT);
    assertThat(ContentType.classify("noun")).isEqualTo(ContentType.ENUM);
    assertThat(ContentType.classify("x86")).isEqualTo(ContentType.ENUM);
    assertThat(ContentType.classify("a b")).isEqualTo(ContentType.STRING);
    assertThat(ContentType.classify("")).isEqualTo(ContentType.STRING);
    assertThat(ContentType.classify("1.2.3")).isEqualTo(ContentType.STRING);
  }

  @Test
  public void digitsBeyondSixtyFourBitsAreText() {
    assertThat(ContentType.classify("18446744073709551615")).isEqualTo(ContentType.UINT);
    assertThat(ContentType.classify("18446744073709551616")).isEqualTo(ContentType.STRING);
  }

  @Test
  public void onlyAMinusSignIsAccepted() {
    assertThat(ContentType.classify("+5")).isEqualTo(ContentType.STRING);
    assertThat(ContentType.classify("+1.5")).isEqualTo(ContentType.STRING);
    assertThat(ContentType.classify("-1.5")).isEqualTo(ContentType.FLOAT);
  }

  @Test
  public void largeUnsignedMixedWithNegativesIsText() {
    assertThat(ContentType.infer(Arrays.asList("18446744073709551615", "-1"))).isEqualTo(ContentType.STRING);
    assertThat(ContentType.infer(Arrays.asList("-1", "18446744073709551615"))).isEqualTo(ContentType.STRING);
    assertThat(ContentType.infer(Arrays.asList("9223372036854775807", "-1"))).isEqualTo(ContentType.INT);
    assertThat(ContentType.infer(Arrays.asList("18446744073709551615", "7"))).isEqualTo(ContentType.UINT);
    assertThat(ContentType.infer(Arrays.asList("18446744073709551615", "-1", "0.5"))).isEqualTo(ContentType.STRING);
  }

  @Test
  public void infersTheWidestTypeOfAllSamples() {
    assertThat(ContentType.infer(Arrays.asList("12", "34"))).isEqualTo(ContentType.UINT);
    assertThat(ContentType.infer(Arrays.asList("12", "-3"))).isEqualTo(ContentType.INT);
    assertThat(ContentType.infer(Arrays.asList("12", "3.5"))).isEqualTo(ContentType.FLOAT);
    assertThat(ContentType.infer(Arrays.asList("12", "abc"))).isEqualTo(ContentType.ENUM);
    assertThat(ContentType.infer(Arrays.asList("12", "a b"))).isEqualTo(ContentType.STRING);
    assertThat(ContentType.infer(Arrays.asList("true", "false"))).isEqualTo(ContentType.BOOL);
  }

  @Test
  public void boolWidensByPositionOnTheLadder() {
    assertThat(ContentType.infer(Arrays.asList("true", "12"))).isEqualTo(ContentType.UINT);
  }

  @Test
  public void noSamplesMeansString() {
    assertThat(ContentType.infer(Collections.<String>emptyList())).isEqualTo(ContentType.STRING);
  }

  @Test
  public void inferenceNeverNarrowsAsSamplesAreAdded() {
    List<String> samples = new ArrayList<String>();
    ContentType previous = ContentType.BOOL;
    for (String sample: Arrays.asList("true", "1", "-1", "0.5", "word", "two words", "7")) {
      samples.add(sample);
      ContentType current = ContentType.infer(samples);
      assertThat(current.compareTo(previous)).isGreaterThanOrEqualTo(0);
      previous = current;
    }
    assertThat(previous).isEqualTo(ContentType.STRING);
  }

  @Test
  public void widenIsSymmetric() {
    for (ContentType a: ContentType.values()) {
      for (ContentType b: ContentType.values()) {
        assertThat(a.widen(b)).isEqualTo(b.widen(a));
      }
    }
  }
}
