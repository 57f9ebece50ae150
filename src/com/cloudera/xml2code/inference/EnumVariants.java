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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*********************************************************
 * EnumVariants maps the distinct literals of an enum-typed node to
 * Java constant names.  Literals keep their first-seen order, so the
 * generated enum is stable across runs over the same corpus.
 *********************************************************/
public class EnumVariants {
  static final String PREFIX = "V_";

  private final Map<String, String> constants = new LinkedHashMap<String, String>();

  public EnumVariants(Collection<String> literals) {
    Set<String> used = new HashSet<String>();
    for (String literal: literals) {
      if (constants.containsKey(literal)) {
        continue;
      }
      String base = toConstantName(literal);
      String name = base;
      for (int i = 2; used.contains(name); i++) {
        name = base + "_" + i;
      }
      used.add(name);
      constants.put(literal, name);
    }
  }

  public List<String> getLiterals() {
    return new ArrayList<String>(constants.keySet());
  }

  public List<String> getConstants() {
    return new ArrayList<String>(constants.values());
  }

  public String getConstant(String literal) {
    return constants.get(literal);
  }

  public Map<String, String> asMap() {
    return new LinkedHashMap<String, String>(constants);
  }

  public int size() {
    return constants.size();
  }

  /**
   * Upper snake case, ASCII only.  Camel humps are split, anything that
   * is not a letter or digit becomes a single underscore.
   */
  public static String toConstantName(String literal) {
    StringBuilder buf = new StringBuilder();
    boolean pendingBreak = false;
    for (int i = 0; i < literal.length(); i++) {
      char c = literal.charAt(i);
      if (! isAsciiLetterOrDigit(c)) {
        pendingBreak = buf.length() > 0;
        continue;
      }
      if (buf.length() > 0 && ! pendingBreak && Character.isUpperCase(c)) {
        char prev = literal.charAt(i - 1);
        boolean nextIsLower = i + 1 < literal.length() && Character.isLowerCase(literal.charAt(i + 1))
          && isAsciiLetterOrDigit(literal.charAt(i + 1));
        if (Character.isLowerCase(prev) || Character.isDigit(prev) || (Character.isUpperCase(prev) && nextIsLower)) {
          pendingBreak = true;
        }
      }
      if (pendingBreak) {
        buf.append('_');
        pendingBreak = false;
      }
      buf.append(Character.toUpperCase(c));
    }
    if (buf.length() == 0) {
      return PREFIX + "EMPTY";
    }
    if (! Character.isLetter(buf.charAt(0))) {
      buf.insert(0, PREFIX);
    }
    return buf.toString();
  }

  static boolean isAsciiLetterOrDigit(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
