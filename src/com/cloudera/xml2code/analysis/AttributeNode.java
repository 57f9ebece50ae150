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
 * AttributeNode accumulates the values of one attribute local name.
 * A single node is shared by every element that uses an attribute
 * with that name; the per-element statistics are kept apart so the
 * field shape can still be decided per owning element.
 *********************************************************/
public class AttributeNode {
  private final long id;
  private final NameHandle name;
  private final AtomicLong encounters = new AtomicLong(0);
  private final Set<String> values = new LinkedHashSet<String>();
  private final Map<Long, OwnerStats> elementStats = new LinkedHashMap<Long, OwnerStats>();

  /**
   * How an attribute was used on one owning element.
   */
  static class OwnerStats {
    long count = 0;
    SortedMap<Integer, Map<String, Long>> valuesByDepth = new TreeMap<Integer, Map<String, Long>>();

    void record(int depth, String value) {
      count++;
      Map<String, Long> histogram = valuesByDepth.get(depth);
      if (histogram == null) {
        histogram = new LinkedHashMap<String, Long>();
        valuesByDepth.put(depth, histogram);
      }
      Long old = histogram.get(value);
      histogram.put(value, old == null ? 1L : old + 1);
    }
  }

  AttributeNode(long id, NameHandle name) {
    this.id = id;
    this.name = name;
  }

  public long getId() {
    return id;
  }

  public NameHandle getName() {
    return name;
  }

  public long getEncounters() {
    return encounters.get();
  }

  /**
   * Distinct literal values, in first-seen order.
   */
  public synchronized List<String> getValues() {
    return new ArrayList<String>(values);
  }

  void encounter() {
    encounters.incrementAndGet();
  }

  /**
   * Records one occurrence of this attribute on the given element.
   */
  public synchronized void record(ElementNode owner, int depth, String value) {
    values.add(value);
    OwnerStats stats = elementStats.get(owner.getId());
    if (stats == null) {
      stats = new OwnerStats();
      elementStats.put(owner.getId(), stats);
    }
    stats.record(depth, value);
  }

  /**
   * How often this attribute was seen on the given element.
   */
  public synchronized long getCountOn(ElementNode owner) {
    OwnerStats stats = elementStats.get(owner.getId());
    return stats == null ? 0 : stats.count;
  }

  /**
   * The value histogram on the given element, summed over all depths.
   */
  public synchronized Map<String, Long> getHistogramOn(ElementNode owner) {
    Map<String, Long> result = new LinkedHashMap<String, Long>();
    OwnerStats stats = elementStats.get(owner.getId());
    if (stats == null) {
      return result;
    }
    for (Map<String, Long> histogram: stats.valuesByDepth.values()) {
      for (Map.Entry<String, Long> pair: histogram.entrySet()) {
        Long old = result.get(pair.getKey());
        result.put(pair.getKey(), old == null ? pair.getValue() : old + pair.getValue());
      }
    }
    return result;
  }

  /**
   * The value histogram on the given element, per depth.
   */
  public synchronized SortedMap<Integer, Map<String, Long>> getHistogramByDepthOn(ElementNode owner) {
    SortedMap<Integer, Map<String, Long>> result = new TreeMap<Integer, Map<String, Long>>();
    OwnerStats stats = elementStats.get(owner.getId());
    if (stats != null) {
      for (Map.Entry<Integer, Map<String, Long>> pair: stats.valuesByDepth.entrySet()) {
        result.put(pair.getKey(), new LinkedHashMap<String, Long>(pair.getValue()));
      }
    }
    return result;
  }

  public String toString() {
    return "A\"" + name + "\"";
  }
}
