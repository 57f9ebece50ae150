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

/*********************************************************
 * Cardinality is the (min, max) window of how often a child element
 * occurred within single occurrences of its parent.  Instances are
 * immutable; include() returns the widened window.
 *********************************************************/
public final class Cardinality {
  private final long min;
  private final long max;

  public Cardinality(long min, long max) {
    if (min < 0 || max < min) {
      throw new IllegalArgumentException("Illegal cardinality window [" + min + ", " + max + "]");
    }
    this.min = min;
    this.max = max;
  }

  public static Cardinality exactly(long count) {
    return new Cardinality(count, count);
  }

  public long getMin() {
    return min;
  }

  public long getMax() {
    return max;
  }

  /**
   * The smallest window covering this window and the given count.
   */
  public Cardinality include(long count) {
    if (count >= min && count <= max) {
      return this;
    }
    return new Cardinality(Math.min(min, count), Math.max(max, count));
  }

  public boolean allowsAbsence() {
    return min == 0;
  }

  public boolean allowsRepetition() {
    return max > 1;
  }

  public boolean equals(Object o) {
    if (! (o instanceof Cardinality)) {
      return false;
    }
    Cardinality other = (Cardinality) o;
    return min == other.min && max == other.max;
  }

  public int hashCode() {
    return (int) (31 * min + max);
  }

  public String toString() {
    return "[" + min + ", " + max + "]";
  }
}
