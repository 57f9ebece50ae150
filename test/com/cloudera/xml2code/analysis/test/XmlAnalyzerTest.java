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

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.cloudera.xml2code.analysis.AnalysisException;
import com.cloudera.xml2code.analysis.AttributeNode;
import com.cloudera.xml2code.analysis.Cardinality;
import com.cloudera.xml2code.analysis.ChildEdge;
import com.cloudera.xml2code.analysis.ElementNode;
import com.cloudera.xml2code.analysis.MalformedDocumentException;
import com.cloudera.xml2code.analysis.MultipleRootsException;
import com.cloudera.xml2code.analysis.NameRegistry;
import com.cloudera.xml2code.analysis.NoRootFoundException;
import com.cloudera.xml2code.analysis.SchemaReport;
import com.cloudera.xml2code.analysis.StaxEventSource;
import com.cloudera.xml2code.analysis.XmlAnalyzer;
import com.cloudera.xml2code.analysis.XmlEvent;
import com.cloudera.xml2code.analysis.XmlEventSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.failBecauseExceptionWasNotThrown;

public class XmlAnalyzerTest {
  NameRegistry registry;
  XmlAnalyzer analyzer;

  @BeforeEach
  public void setUp() {
    registry = new NameRegistry();
    analyzer = new XmlAnalyzer(registry);
  }

  void analyze(String xml) throws AnalysisException {
    analyzer.analyze(new StaxEventSource(new StringReader(xml)));
  }

  ChildEdge edge(String parent, String child) {
    return registry.findElement(parent).getChildEdge(registry.findElement(child));
  }

  /**
   * Replays a fixed list of events, then EOF forever.
   */
  static class ListEventSource implements XmlEventSource {
    final List<XmlEvent> events;
    int pos = 0;

    ListEventSource(XmlEvent... events) {
      this.events = Arrays.asList(events);
    }

    public XmlEvent next() {
      return pos < events.size() ? events.get(pos++) : XmlEvent.eof();
    }
  }

  @Test
  @DisplayName("analyzing the same document twice keeps the nodes and doubles the counters")
  public void reanalysisIsIdempotentOnIdentity() throws Exception {
    String xml = "<r a=\"1\"><p><c/><c/></p><p>text</p></r>";
    analyze(xml);
    List<ElementNode> elements = registry.getElements();
    List<AttributeNode> attributes = registry.getAttributes();
    List<Long> counts = new ArrayList<Long>();
    for (ElementNode node: elements) {
      counts.add(node.getEncounters());
    }

    analyze(xml);

    assertThat(registry.getElements()).containsExactlyElementsOf(elements);
    assertThat(registry.getAttributes()).containsExactlyElementsOf(attributes);
    for (int i = 0; i < elements.size(); i++) {
      assertThat(elements.get(i).getEncounters()).isEqualTo(2 * counts.get(i));
    }
    assertThat(attributes.get(0).getEncounters()).isEqualTo(2);
    assertThat(analyzer.getDocumentCount()).isEqualTo(2);
  }

  @Test
  public void repeatedChildNeedsVector() throws Exception {
    analyze("<r><p><c/><c/></p><p><c/></p></r>");

    ChildEdge pc = edge("p", "c");
    assertThat(pc.needsVector()).isTrue();
    assertThat(pc.wasInADiff()).isFalse();
    assertThat(pc.getMinMaxPerDepth()).containsEntry(1, new Cardinality(1, 2)).hasSize(1);
    assertThat(pc.getDepthOccurrenceCounts()).containsEntry(2, 3L);
    assertThat(edge("r", "p").needsVector()).isTrue();
  }

  @Test
  public void missingChildIsRecordedAsDiffAndZeroMinimum() throws Exception {
    analyze("<r><p><x/></p><p/></r>");

    ChildEdge px = edge("p", "x");
    assertThat(px.wasInADiff()).isTrue();
    assertThat(px.needsVector()).isFalse();
    assertThat(px.getMinMaxPerDepth()).containsEntry(1, new Cardinality(0, 1));
  }

  @Test
  public void childFirstSeenInALaterOccurrenceIsOptional() throws Exception {
    analyze("<r><p/><p><c/></p></r>");

    ChildEdge pc = edge("p", "c");
    assertThat(pc.wasInADiff()).isTrue();
    assertThat(pc.getMinMaxPerDepth()).containsEntry(1, new Cardinality(0, 1));
  }

  @Test
  public void windowsNarrowOnlyTowardsTheObservedExtremes() throws Exception {
    analyze("<r><p><c/></p><p><c/><c/><c/></p></r>");
    assertThat(edge("p", "c").getMinMaxPerDepth().get(1)).isEqualTo(new Cardinality(1, 3));

    analyze("<r><p><c/><c/></p></r>");
    assertThat(edge("p", "c").getMinMaxPerDepth().get(1)).isEqualTo(new Cardinality(1, 3));

    analyze("<r><p/></r>");
    assertThat(edge("p", "c").getMinMaxPerDepth().get(1)).isEqualTo(new Cardinality(0, 3));
  }

  @Test
  public void windowsAreKeptPerParentDepth() throws Exception {
    analyze("<r><p><c/></p><q><p/></q></r>");

    ChildEdge pc = edge("p", "c");
    assertThat(pc.getMinMaxPerDepth())
      .containsEntry(1, new Cardinality(1, 1))
      .containsEntry(2, new Cardinality(0, 0));
    assertThat(registry.findElement("p").getEncountersAtDepth()).containsEntry(1, 1L).containsEntry(2, 1L);
  }

  @Test
  public void selfContainingElementIsFlagged() throws Exception {
    analyze("<node><node/></node>");

    ElementNode node = registry.findElement("node");
    assertThat(node.containsSelf()).isTrue();
    assertThat(node.getParents()).containsExactly(node);
    assertThat(registry.getElements()).hasSize(1);
    assertThat(edge("node", "node").getMinMaxPerDepth())
      .containsEntry(0, new Cardinality(1, 1))
      .containsEntry(1, new Cardinality(0, 0));
  }

  @Test
  public void nestedOccurrencesCountAsPriorOccurrences() throws Exception {
    analyze("<x><x/><y/></x>");

    // the inner x completed before y was known
    assertThat(edge("x", "y").getMinMaxPerDepth())
      .containsEntry(0, new Cardinality(1, 1))
      .containsEntry(1, new Cardinality(0, 0));
  }

  @Test
  @DisplayName("a nested occurrence that completes first is compared against the enclosing one")
  public void diffIsRecordedAcrossNestedOccurrences() throws Exception {
    analyze("<a><b><a/></b><x/></a>");

    assertThat(edge("a", "x").wasInADiff()).isTrue();
    assertThat(edge("a", "b").wasInADiff()).isTrue();
    assertThat(edge("b", "a").wasInADiff()).isFalse();
    assertThat(edge("a", "x").getMinMaxPerDepth())
      .containsEntry(0, new Cardinality(1, 1))
      .containsEntry(2, new Cardinality(0, 0));
  }

  @Test
  public void diffNeedsTwoCompletedOccurrences() throws Exception {
    analyze("<a><x/></a>");
    assertThat(edge("a", "x").wasInADiff()).isFalse();

    analyze("<a><x/></a>");
    assertThat(edge("a", "x").wasInADiff()).isFalse();

    analyze("<a/>");
    assertThat(edge("a", "x").wasInADiff()).isTrue();
  }

  @Test
  public void attributesAreCountedPerOwner() throws Exception {
    analyze("<r><e a=\"1\"/><e a=\"2\" b=\"x\"/><f a=\"1\"/></r>");

    ElementNode e = registry.findElement("e");
    ElementNode f = registry.findElement("f");
    AttributeNode a = registry.findAttribute("a");
    AttributeNode b = registry.findAttribute("b");

    assertThat(e.getAttributes()).containsExactly(a, b);
    assertThat(a.getEncounters()).isEqualTo(3);
    assertThat(a.getValues()).containsExactly("1", "2");
    assertThat(a.getCountOn(e)).isEqualTo(2);
    assertThat(a.getCountOn(f)).isEqualTo(1);
    assertThat(b.getCountOn(e)).isEqualTo(1);
    assertThat(a.getHistogramOn(e)).containsEntry("1", 1L).containsEntry("2", 1L);
    assertThat(a.getHistogramByDepthOn(f)).containsKey(1);
  }

  @Test
  public void textIsTrimmedAndBlankTextIgnored() throws Exception {
    analyze("<r>\n  <t> hi </t>\n  <t>   </t>\n</r>");

    ElementNode t = registry.findElement("t");
    assertThat(t.getTexts()).containsExactly("hi");
    assertThat(t.getCompletedOccurrences()).isEqualTo(2);
    assertThat(t.getOccurrencesWithText()).isEqualTo(1);
    assertThat(registry.findElement("r").hasTexts()).isFalse();
  }

  @Test
  public void emptyElementsWithoutContentAreFlags() throws Exception {
    analyze("<r><marker/><t>x</t></r>");
    assertThat(registry.findElement("marker").isFlag()).isTrue();
    assertThat(registry.findElement("t").isFlag()).isFalse();
    assertThat(registry.findElement("r").isFlag()).isFalse();
  }

  @Test
  public void secondRootIsRejectedWithoutTouchingTheGraph() throws Exception {
    analyze("<a><b/></a>");
    ElementNode a = registry.getElements().get(0);

    try {
      analyze("<c><b/></c>");
      failBecauseExceptionWasNotThrown(MultipleRootsException.class);
    } catch (MultipleRootsException expected) {
      assertThat(expected.getExpectedRoot()).isEqualTo("a");
      assertThat(expected.getFoundRoot()).isEqualTo("c");
    }

    assertThat(registry.getElements()).hasSize(2);
    assertThat(registry.findElement("c")).isNull();
    assertThat(registry.findElement("b").getEncounters()).isEqualTo(1);
    assertThat(analyzer.getRoot()).isSameAs(a);
    assertThat(analyzer.getDocumentCount()).isEqualTo(1);
  }

  @Test
  public void failedDocumentKeepsWhatWasRecorded() throws Exception {
    try {
      analyze("<a><b x=\"1\"/><c>");
      failBecauseExceptionWasNotThrown(MalformedDocumentException.class);
    } catch (MalformedDocumentException expected) {
      assertThat(expected.getMessage()).isNotEmpty();
    }

    assertThat(analyzer.getRoot().getName().getName()).isEqualTo("a");
    assertThat(registry.findElement("b").getEncounters()).isEqualTo(1);
    assertThat(registry.findAttribute("x").getValues()).containsExactly("1");
    assertThat(analyzer.getDocumentCount()).isEqualTo(0);

    analyze("<a><b x=\"2\"/></a>");
    assertThat(registry.findElement("b").getEncounters()).isEqualTo(2);
    assertThat(analyzer.getDocumentCount()).isEqualTo(1);
  }

  @Test
  public void documentWithoutElementsHasNoRoot() throws Exception {
    try {
      analyzer.analyze(new ListEventSource(XmlEvent.text("  ")));
      failBecauseExceptionWasNotThrown(NoRootFoundException.class);
    } catch (NoRootFoundException expected) {
      assertThat(analyzer.getRoot()).isNull();
    }
  }

  @Test
  public void handBuiltEventsAreAnalyzedLikeParsedOnes() throws Exception {
    List<XmlEvent.Attribute> none = Collections.emptyList();
    analyzer.analyze(new ListEventSource(
      XmlEvent.start("r", none),
      XmlEvent.empty("c", Arrays.asList(new XmlEvent.Attribute("k", "v"))),
      XmlEvent.start("c", none),
      XmlEvent.text("body"),
      XmlEvent.end("c"),
      XmlEvent.end("r")));

    ElementNode c = registry.findElement("c");
    assertThat(c.getEncounters()).isEqualTo(2);
    assertThat(c.getTexts()).containsExactly("body");
    assertThat(edge("r", "c").needsVector()).isTrue();
    assertThat(registry.findAttribute("k").getCountOn(c)).isEqualTo(1);
  }

  @Test
  public void mismatchedEndTagIsMalformed() throws Exception {
    List<XmlEvent.Attribute> none = Collections.emptyList();
    try {
      analyzer.analyze(new ListEventSource(XmlEvent.start("r", none), XmlEvent.end("q")));
      failBecauseExceptionWasNotThrown(MalformedDocumentException.class);
    } catch (MalformedDocumentException expected) {
      assertThat(expected.getMessage()).contains("</q>");
    }
  }

  @Test
  public void reportMarksSelfReferences() throws Exception {
    analyze("<node id=\"1\"><node id=\"2\">leaf</node></node>");

    String report = new SchemaReport(analyzer.getRoot()).toString();
    assertThat(report).startsWith("E\"node\" encounters=2");
    assertThat(report).contains("-SELF-");
    assertThat(report).contains("@A\"id\" count=2");
    assertThat(report).contains("texts(1)=[leaf]");
    assertThat(new SchemaReport(null).toString()).contains("no documents");
  }
}
