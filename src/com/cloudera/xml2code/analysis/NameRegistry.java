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

import java.util.*;

import org.apache.log4j.Logger;

/*********************************************************
 * NameRegistry interns element and attribute local names, so that the
 * same name anywhere in the corpus resolves to one shared node.
 *
 * Elements and attributes live in separate name spaces.  Names are
 * matched exactly; there is no namespace folding.  Iteration order is
 * the order in which names were first seen.
 *
 * One registry backs one analysis session.
 *********************************************************/
public class NameRegistry {
  private static final Logger LOG = Logger.getLogger(NameRegistry.class);

  private final Map<String, NameHandle> handles = new HashMap<String, NameHandle>();
  private final Map<NameHandle, ElementNode> elements = new LinkedHashMap<NameHandle, ElementNode>();
  private final Map<NameHandle, AttributeNode> attributes = new LinkedHashMap<NameHandle, AttributeNode>();
  private long nextId = 0;

  public synchronized NameHandle handle(String name) {
    NameHandle handle = handles.get(name);
    if (handle == null) {
      handle = new NameHandle(name);
      handles.put(name, handle);
    }
    return handle;
  }

  /**
   * Returns the node for the element name, creating it on first use.
   * Either way the node's encounter count and its histogram for the
   * given depth are incremented.
   */
  public synchronized ElementNode internElement(String name, int depth) {
    NameHandle handle = handle(name);
    ElementNode node = elements.get(handle);
    if (node == null) {
      node = new ElementNode(nextId++, handle);
      elements.put(handle, node);
      if (LOG.isDebugEnabled()) {
        LOG.debug("New element " + name + " at depth " + depth);
      }
    }
    node.encounter(depth);
    return node;
  }

  /**
   * Returns the node for the attribute name, creating it on first use,
   * and counts the encounter.
   */
  public synchronized AttributeNode internAttribute(String name) {
    NameHandle handle = handle(name);
    AttributeNode node = attributes.get(handle);
    if (node == null) {
      node = new AttributeNode(nextId++, handle);
      attributes.put(handle, node);
      if (LOG.isDebugEnabled()) {
        LOG.debug("New attribute " + name);
      }
    }
    node.encounter();
    return node;
  }

  /**
   * Lookup without counting; null if the element was never seen.
   */
  public synchronized ElementNode findElement(String name) {
    return elements.get(handles.get(name));
  }

  public synchronized AttributeNode findAttribute(String name) {
    return attributes.get(handles.get(name));
  }

  public synchronized List<ElementNode> getElements() {
    return new ArrayList<ElementNode>(elements.values());
  }

  public synchronized List<AttributeNode> getAttributes() {
    return new ArrayList<AttributeNode>(attributes.values());
  }
}
