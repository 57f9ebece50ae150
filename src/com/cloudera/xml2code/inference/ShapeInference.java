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
package com.cloudera.xml2code.inference;

import java.util.Map;
import java.util.SortedMap;

import com.cloudera.xml2code.analysis.AttributeNode;
import com.cloudera.xml2code.analysis.Cardinality;
import com.cloudera.xml2code.analysis.ChildEdge;
import com.cloudera.xml2code.analysis.ElementNode;

/*********************************************************
 * ShapeInference decides how each field of a generated type holds its
 * value, from the multiplicity evidence the analyzer left on the
 * child edges and attribute nodes.
 *
 * For a child edge the evidence is consulted in order of reliability:
 * <ol>
 * <li>repetition within one parent occurrence means VEC;
 * <li>otherwise the per-depth min/max windows decide optionality;
 * <li>without windows, a recorded diff between two parent occurrences
 *     means optional;
 * <li>without either, the child's occurrence count at every depth must
 *     match the parent's count one level up.
 * </ol>
 * A child that is its own parent is boxed.
 *********************************************************/
public class ShapeInference {
  private ShapeInference() {
  }

  public static FieldShape childShape(ChildEdge edge) {
    if (edge.needsVector()) {
      return FieldShape.VEC;
    }
    boolean optional = isOptional(edge);
    if (edge.getChild() == edge.getOwner()) {
      return optional ? FieldShape.BOXED_OPTION : FieldShape.BOXED;
    }
    return optional ? FieldShape.OPTION : FieldShape.REQUIRED;
  }

  static boolean isOptional(ChildEdge edge) {
    SortedMap<Integer, Cardinality> windows = edge.getMinMaxPerDepth();
    if (! windows.isEmpty()) {
      for (Cardinality window: windows.values()) {
        if (window.allowsAbsence()) {
          return true;
        }
      }
      return false;
    }
    if (edge.wasInADiff()) {
      return true;
    }
    SortedMap<Integer, Long> childCounts = edge.getDepthOccurrenceCounts();
    for (Map.Entry<Integer, Long> pair: edge.getOwner().getEncountersAtDepth().entrySet()) {
      Long count = childCounts.get(pair.getKey() + 1);
      if (count == null || count.longValue() != pair.getValue().longValue()) {
        return true;
      }
    }
    return false;
  }

  /**
   * REQUIRED if the attribute was present on every encounter of the owner.
   */
  public static FieldShape attributeShape(AttributeNode attribute, ElementNode owner) {
    return attribute.getCountOn(owner) == owner.getEncounters() ? FieldShape.REQUIRED : FieldShape.OPTION;
  }

  /**
   * True if every completed occurrence of the element carried text.
   */
  public static boolean isContentRequired(ElementNode node) {
    return node.getCompletedOccurrences() > 0 && node.getOccurrencesWithText() == node.getCompletedOccurrences();
  }
}
