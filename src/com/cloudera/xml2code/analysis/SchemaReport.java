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
package com.cloudera.xml2code.analysis;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*********************************************************
 * SchemaReport renders the accumulated graph as an indented text dump,
 * starting from the root.  A self reference is printed as -SELF-, and
 * an element that was already described is only named.
 *********************************************************/
public class SchemaReport {
  static final int MAX_TEXT_SAMPLES = 10;

  private final ElementNode root;

  public SchemaReport(ElementNode root) {
    this.root = root;
  }

  public String toString() {
    StringBuffer buf = new StringBuffer();
    if (root == null) {
      buf.append("(no documents analyzed)\n");
    } else {
      describe(root, 0, buf, new HashSet<ElementNode>());
    }
    return buf.toString();
  }

  void describe(ElementNode node, int indent, StringBuffer buf, Set<ElementNode> described) {
    indent(buf, indent);
    buf.append(node);
    if (! described.add(node)) {
      buf.append(" (see above)\n");
      return;
    }
    buf.append(" encounters=" + node.getEncounters());
    buf.append(" depths=" + node.getEncountersAtDepth());
    buf.append(" occurrences=" + node.getCompletedOccurrences());
    buf.append(" withText=" + node.getOccurrencesWithText());
    buf.append("\n");

    for (AttributeNode attribute: node.getAttributes()) {
      indent(buf, indent + 1);
      buf.append("@" + attribute + " count=" + attribute.getCountOn(node) + " values=" + attribute.getHistogramOn(node) + "\n");
    }
    List<String> texts = node.getTexts();
    if (texts.size() > 0) {
      indent(buf, indent + 1);
      buf.append("texts(" + texts.size() + ")=" + texts.subList(0, Math.min(texts.size(), MAX_TEXT_SAMPLES)) + "\n");
    }
    for (ChildEdge edge: node.getChildEdges()) {
      indent(buf, indent + 1);
      buf.append("-> needsVector=" + edge.needsVector());
      buf.append(" wasInADiff=" + edge.wasInADiff());
      buf.append(" counts=" + edge.getDepthOccurrenceCounts());
      buf.append(" minMax=" + edge.getMinMaxPerDepth());
      buf.append("\n");
      if (edge.getChild() == node) {
        indent(buf, indent + 2);
        buf.append("-SELF-\n");
      } else {
        describe(edge.getChild(), indent + 2, buf, described);
      }
    }
  }

  static void indent(StringBuffer buf, int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append("  ");
    }
  }
}
