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

/*********************************************************
 * ChildEdge holds the evidence collected for one parent->child
 * relationship.  All mutation goes through the owning ElementNode,
 * which holds the lock; the accessors here return copies.
 *********************************************************/
public class ChildEdge {
  private final ElementNode owner;
  private final ElementNode child;
  private boolean needsVector = false;
  private boolean wasInADiff = false;
  private final SortedMap<Integer, Long> depthOccurrenceCounts = new TreeMap<Integer, Long>();
  private final SortedMap<Integer, Cardinality> minMaxPerDepth = new TreeMap<Integer, Cardinality>();

  ChildEdge(ElementNode owner, ElementNode child) {
    this.owner = owner;
    this.child = child;
  }

  public ElementNode getOwner() {
    return owner;
  }

  public ElementNode getChild() {
    return child;
  }

  /**
   * True once the child was seen more than once within a single
   * occurrence of the parent.
   */
  public boolean needsVector() {
    synchronized (owner) {
      return needsVector;
    }
  }

  /**
   * True once two occurrences of the parent disagreed on whether
   * this child was present.
   */
  public boolean wasInADiff() {
    synchronized (owner) {
      return wasInADiff;
    }
  }

  /**
   * Number of completed child occurrences, keyed by the child's depth.
   */
  public SortedMap<Integer, Long> getDepthOccurrenceCounts() {
    synchronized (owner) {
      return new TreeMap<Integer, Long>(depthOccurrenceCounts);
    }
  }

  /**
   * The occurrence window per parent occurrence, keyed by the parent's depth.
   */
  public SortedMap<Integer, Cardinality> getMinMaxPerDepth() {
    synchronized (owner) {
      return new TreeMap<Integer, Cardinality>(minMaxPerDepth);
    }
  }

  ////////////////////////////////////////
  // Mutators, called with the parent's lock held
  ////////////////////////////////////////
  void markNeedsVector() {
    needsVector = true;
  }

  void markInDiff() {
    wasInADiff = true;
  }

  void countOccurrence(int depth) {
    Long old = depthOccurrenceCounts.get(depth);
    depthOccurrenceCounts.put(depth, old == null ? 1L : old + 1);
  }

  void recordWindow(int parentDepth, long count) {
    Cardinality window = minMaxPerDepth.get(parentDepth);
    minMaxPerDepth.put(parentDepth, window == null ? Cardinality.exactly(count) : window.include(count));
  }

  /**
   * Notes that occurrences of the parent at the given depth went by
   * without this child.
   */
  void recordAbsence(int parentDepth) {
    recordWindow(parentDepth, 0);
  }
}
