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
import java.util.concurrent.atomic.AtomicLong;

/*********************************************************
 * ElementNode accumulates everything observed about one element
 * local name across all analyzed documents.
 *
 * A node is created once by its NameRegistry and lives as long as the
 * registry does.  Its statistics only ever grow.  Nodes are compared by
 * identity, so they can be used as keys for the child edges, including
 * an edge from a node to itself.
 *
 * All mutable state is guarded by the node's monitor, so a finished
 * graph can be read from any thread.
 *********************************************************/
public class ElementNode {
  private final long id;
  private final NameHandle name;
  private final AtomicLong encounters = new AtomicLong(0);
  private final SortedMap<Integer, Long> encountersAtDepth = new TreeMap<Integer, Long>();
  private final Set<AttributeNode> attributes = new LinkedHashSet<AttributeNode>();
  private final Map<ElementNode, ChildEdge> children = new LinkedHashMap<ElementNode, ChildEdge>();
  private final Set<ElementNode> parents = new LinkedHashSet<ElementNode>();
  private final SortedMap<Integer, Long> completedAtDepth = new TreeMap<Integer, Long>();
  private final Set<ElementNode> childrenOfCompleted = new HashSet<ElementNode>();
  private List<String> texts = null;
  private boolean containsSelf = false;
  private long completedOccurrences = 0;
  private long occurrencesWithText = 0;

  ElementNode(long id, NameHandle name) {
    this.id = id;
    this.name = name;
  }

  /////////////////////////////////////
  // Accessors
  /////////////////////////////////////
  public long getId() {
    return id;
  }

  public NameHandle getName() {
    return name;
  }

  public long getEncounters() {
    return encounters.get();
  }

  public synchronized SortedMap<Integer, Long> getEncountersAtDepth() {
    return new TreeMap<Integer, Long>(encountersAtDepth);
  }

  public synchronized List<AttributeNode> getAttributes() {
    return new ArrayList<AttributeNode>(attributes);
  }

  public synchronized List<ChildEdge> getChildEdges() {
    return new ArrayList<ChildEdge>(children.values());
  }

  public synchronized ChildEdge getChildEdge(ElementNode child) {
    return children.get(child);
  }

  public synchronized List<ElementNode> getParents() {
    return new ArrayList<ElementNode>(parents);
  }

  /**
   * The trimmed text samples, in the order they were observed.  Empty if
   * the element never carried text.
   */
  public synchronized List<String> getTexts() {
    if (texts == null) {
      return Collections.emptyList();
    }
    return new ArrayList<String>(texts);
  }

  public synchronized boolean hasTexts() {
    return texts != null && texts.size() > 0;
  }

  public synchronized boolean containsSelf() {
    return containsSelf;
  }

  public synchronized long getCompletedOccurrences() {
    return completedOccurrences;
  }

  public synchronized long getOccurrencesWithText() {
    return occurrencesWithText;
  }

  /**
   * An element that never had attributes, children or text.  Such an
   * element only matters by its presence.
   */
  public synchronized boolean isFlag() {
    return ! containsSelf && attributes.isEmpty() && children.isEmpty() && (texts == null || texts.isEmpty());
  }

  /////////////////////////////////////
  // Mutators
  /////////////////////////////////////
  synchronized void encounter(int depth) {
    encounters.incrementAndGet();
    Long old = encountersAtDepth.get(depth);
    encountersAtDepth.put(depth, old == null ? 1L : old + 1);
  }

  /**
   * Registers the edge to the given child without counting an occurrence.
   */
  public ChildEdge registerChild(ElementNode child) {
    ChildEdge edge;
    synchronized (this) {
      edge = children.get(child);
      if (edge == null) {
        edge = new ChildEdge(this, child);
        // Every occurrence completed so far lacked the child
        for (Integer depth: completedAtDepth.keySet()) {
          edge.recordAbsence(depth);
        }
        children.put(child, edge);
      }
      if (child == this) {
        containsSelf = true;
      }
    }
    child.addParent(this);
    return edge;
  }

  /**
   * Counts one completed occurrence of the child at the child's depth.
   */
  public void recordChildOccurrence(ElementNode child, int childDepth) {
    ChildEdge edge = registerChild(child);
    synchronized (this) {
      edge.countOccurrence(childDepth);
    }
  }

  public synchronized void addAttribute(AttributeNode attribute) {
    attributes.add(attribute);
  }

  public synchronized void addText(String text) {
    if (texts == null) {
      texts = new ArrayList<String>();
    }
    texts.add(text);
  }

  synchronized void addParent(ElementNode parent) {
    parents.add(parent);
  }

  /**
   * Starts the bookkeeping for one occurrence of this element.  The
   * returned Occurrence must be completed once the element's end tag
   * (or its empty tag) has been consumed.
   */
  public synchronized Occurrence beginOccurrence(int depth) {
    return new Occurrence(depth);
  }

  /*********************************************************
   * The per-occurrence state of one visit to the element.  Nested
   * visits of the same element (recursion) each get their own.
   *********************************************************/
  public class Occurrence {
    final int depth;
    final Map<ElementNode, Long> seen = new LinkedHashMap<ElementNode, Long>();
    boolean hadText = false;
    boolean completed = false;

    Occurrence(int depth) {
      this.depth = depth;
    }

    public int getDepth() {
      return depth;
    }

    public void sawChild(ElementNode child) {
      Long count = seen.get(child);
      seen.put(child, count == null ? 1L : count + 1);
    }

    public void sawText() {
      hadText = true;
    }

    /**
     * Folds this occurrence into the element's multiplicity evidence.
     */
    public void complete() {
      synchronized (ElementNode.this) {
        if (completed) {
          throw new IllegalStateException("Occurrence of " + name + " completed twice");
        }
        completed = true;

        // 1. Optionality: compare against the children of the occurrences
        // completed so far.  A nested occurrence of the same element
        // completes before the one enclosing it.
        if (completedOccurrences > 0) {
          Set<ElementNode> union = new LinkedHashSet<ElementNode>(childrenOfCompleted);
          union.addAll(seen.keySet());
          for (ElementNode candidate: union) {
            if (childrenOfCompleted.contains(candidate) != seen.containsKey(candidate)) {
              children.get(candidate).markInDiff();
            }
          }
        }
        childrenOfCompleted.addAll(seen.keySet());

        // 2. Repetition within this occurrence
        for (Map.Entry<ElementNode, Long> pair: seen.entrySet()) {
          if (pair.getValue() > 1) {
            children.get(pair.getKey()).markNeedsVector();
          }
        }

        // 3. Min/max window for every known child, absent ones count 0
        for (Map.Entry<ElementNode, ChildEdge> pair: children.entrySet()) {
          Long count = seen.get(pair.getKey());
          pair.getValue().recordWindow(depth, count == null ? 0 : count);
        }

        Long before = completedAtDepth.get(depth);
        completedOccurrences++;
        completedAtDepth.put(depth, before == null ? 1L : before + 1);
        if (hadText) {
          occurrencesWithText++;
        }
      }
    }
  }

  public String toString() {
    return "E\"" + name + "\"";
  }
}
