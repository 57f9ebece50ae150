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

import org.apache.log4j.Logger;

/*********************************************************
 * XmlAnalyzer walks XML event streams and folds what it sees into the
 * schema node graph of its NameRegistry.
 *
 * The walk is recursive and depth-tracked, with the root at depth 0.
 * Every element occurrence is bracketed by an ElementNode.Occurrence,
 * which turns the children seen in that occurrence into the repetition,
 * optionality and min/max evidence of the parent's child edges.
 *
 * Any number of documents can be analyzed into the same graph, but
 * they must all share one root element name.  A failing document
 * aborts only its own call; whatever was recorded before the failure
 * stays in the graph.
 *********************************************************/
public class XmlAnalyzer {
  private static final Logger LOG = Logger.getLogger(XmlAnalyzer.class);

  private final NameRegistry registry;
  private ElementNode root = null;
  private int documentCount = 0;

  public XmlAnalyzer(NameRegistry registry) {
    this.registry = registry;
  }

  public NameRegistry getRegistry() {
    return registry;
  }

  /**
   * The root element, or null if no document has been analyzed yet.
   */
  public synchronized ElementNode getRoot() {
    return root;
  }

  /**
   * Number of documents that were analyzed to completion.
   */
  public synchronized int getDocumentCount() {
    return documentCount;
  }

  /**
   * Analyzes one document.
   */
  public synchronized void analyze(XmlEventSource source) throws AnalysisException {
    XmlEvent event = source.next();
    while (event.getKind() == XmlEvent.Kind.TEXT) {
      event = source.next();
    }
    switch (event.getKind()) {
    case EOF:
      throw new NoRootFoundException();
    case END:
      throw new MalformedDocumentException("Unexpected end tag </" + event.getName() + "> before the root element");
    default:
      break;
    }

    String name = event.getName();
    if (root != null && ! root.getName().getName().equals(name)) {
      throw new MultipleRootsException(root.getName().getName(), name);
    }
    ElementNode node = registry.internElement(name, 0);
    if (root == null) {
      root = node;
      LOG.info("Root element is <" + name + ">");
    }
    analyzeAttributes(node, event, 0);
    ElementNode.Occurrence occurrence = node.beginOccurrence(0);
    if (event.getKind() == XmlEvent.Kind.START) {
      analyzeElement(source, node, occurrence);
    } else {
      occurrence.complete();
    }

    // Only whitespace may follow the root
    for (event = source.next(); event.getKind() != XmlEvent.Kind.EOF; event = source.next()) {
      if (event.getKind() != XmlEvent.Kind.TEXT || event.getText().trim().length() > 0) {
        throw new MalformedDocumentException("Unexpected content after the root element: " + event);
      }
    }
    documentCount++;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Analyzed document " + documentCount + ", " + registry.getElements().size() + " elements and "
                + registry.getAttributes().size() + " attributes known");
    }
  }

  /**
   * Consumes the body of the element whose start tag was just read,
   * up to and including its end tag.
   */
  void analyzeElement(XmlEventSource source, ElementNode node, ElementNode.Occurrence occurrence) throws AnalysisException {
    int depth = occurrence.getDepth();
    while (true) {
      XmlEvent event = source.next();
      switch (event.getKind()) {
      case START: {
        ElementNode child = registry.internElement(event.getName(), depth + 1);
        node.registerChild(child);
        analyzeAttributes(child, event, depth + 1);
        analyzeElement(source, child, child.beginOccurrence(depth + 1));
        node.recordChildOccurrence(child, depth + 1);
        occurrence.sawChild(child);
        break;
      }
      case EMPTY: {
        ElementNode child = registry.internElement(event.getName(), depth + 1);
        node.registerChild(child);
        analyzeAttributes(child, event, depth + 1);
        child.beginOccurrence(depth + 1).complete();
        node.recordChildOccurrence(child, depth + 1);
        occurrence.sawChild(child);
        break;
      }
      case TEXT: {
        String text = event.getText().trim();
        if (text.length() > 0) {
          node.addText(text);
          occurrence.sawText();
        }
        break;
      }
      case END:
        if (! node.getName().getName().equals(event.getName())) {
          throw new MalformedDocumentException("Expected </" + node.getName() + "> but found </" + event.getName() + ">");
        }
        occurrence.complete();
        return;
      default:
        // EOF ends the walk at every level
        occurrence.complete();
        return;
      }
    }
  }

  void analyzeAttributes(ElementNode owner, XmlEvent event, int depth) {
    for (XmlEvent.Attribute attribute: event.getAttributes()) {
      AttributeNode node = registry.internAttribute(attribute.getLocalName());
      owner.addAttribute(node);
      node.record(owner, depth, attribute.getValue());
    }
  }
}
