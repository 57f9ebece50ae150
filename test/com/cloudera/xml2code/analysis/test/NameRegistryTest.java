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
package com.cloudera.xml2code.analysis.test;

import org.junit.jupiter.api.Test;

import com.cloudera.xml2code.analysis.AttributeNode;
import com.cloudera.xml2code.analysis.ElementNode;
import com.cloudera.xml2code.analysis.NameRegistry;

import static org.assertj.core.api.Assertions.assertThat;

public class NameRegistryTest {

  @Test
  public void internReturnsTheSameNodeAndCountsEveryCall() {
    NameRegistry registry = new NameRegistry();
    ElementNode first = registry.internElement("entry", 1);
    ElementNode second = registry.internElement("entry", 3);
    ElementNode third = registry.internElement("entry", 1);

    assertThat(second).isSameAs(first);
    assertThat(third).isSameAs(first);
    assertThat(first.getEncounters()).isEqualTo(3);
    assertThat(first.getEncountersAtDepth()).containsEntry(1, 2L).containsEntry(3, 1L).hasSize(2);
    assertThat(registry.getElements()).containsExactly(first);
  }

  @Test
  public void elementsAndAttributesAreSeparateNameSpaces() {
    NameRegistry registry = new NameRegistry();
    ElementNode element = registry.internElement("type", 0);
    AttributeNode attribute = registry.internAttribute("type");

    assertThat(registry.getElements()).containsExactly(element);
    assertThat(registry.getAttributes()).containsExactly(attribute);
    assertThat(element.getName()).isEqualTo(attribute.getName());
    assertThat(element.getId()).isNotEqualTo(attribute.getId());
  }

  @Test
  public void namesMatchExactly() {
    NameRegistry registry = new NameRegistry();
    ElementNode lower = registry.internElement("entry", 0);
    ElementNode upper = registry.internElement("Entry", 0);

    assertThat(upper).isNotSameAs(lower);
    assertThat(registry.getElements()).containsExactly(lower, upper);
  }

  @Test
  public void attributeEncountersGrowWithEachIntern() {
    NameRegistry registry = new NameRegistry();
    registry.internAttribute("id");
    registry.internAttribute("id");
    assertThat(registry.findAttribute("id").getEncounters()).isEqualTo(2);
  }

  @Test
  public void findDoesNotCount() {
    NameRegistry registry = new NameRegistry();
    ElementNode node = registry.internElement("a", 0);

    assertThat(registry.findElement("a")).isSameAs(node);
    assertThat(registry.findElement("b")).isNull();
    assertThat(registry.findAttribute("a")).isNull();
    assertThat(node.getEncounters()).isEqualTo(1);
  }

  @Test
  public void handlesAreInterned() {
    NameRegistry registry = new NameRegistry();
    assertThat(registry.handle("orth")).isSameAs(registry.handle("orth"));
    assertThat(registry.handle("orth").getName()).isEqualTo("orth");
  }
}
