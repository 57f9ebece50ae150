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

import java.util.Collection;
import java.util.regex.Pattern;

/*********************************************************
 * ContentType is the ladder of scalar types a text or attribute value
 * can be inferred as.  The declaration order is the widening order:
 * a node's type is the widest type any of its samples needs.
 *********************************************************/
public enum ContentType {
  BOOL("(?i)true|false"),
  UINT("\\d+"),
  INT("-\\d+"),
  FLOAT("-?\\d+[.,]\\d+"),
  ENUM("[A-Za-z][A-Za-z0-9]*"),
  STRING(null);

  private final Pattern pattern;

  ContentType(String regex) {
    this.pattern = (regex == null) ? null : Pattern.compile(regex);
  }

  /**
   * The narrowest type that accepts the (trimmed) sample.
   */
  public static ContentType classify(String sample) {
    String s = sample.trim();
    for (ContentType type: values()) {
      if (type.accepts(s)) {
        return type;
      }
    }
    return STRING;
  }

  /**
   * Folds the samples along the ladder.  No samples at all gives STRING.
   * Unsigned samples beyond the signed 64-bit range cannot be read as a
   * signed value, so mixing them with negative samples gives STRING.
   */
  public static ContentType infer(Collection<String> samples) {
    if (samples.isEmpty()) {
      return STRING;
    }
    ContentType result = BOOL;
    boolean signed = false;
    boolean beyondSigned = false;
    for (String sample: samples) {
      ContentType type = classify(sample);
      if (type == INT) {
        signed = true;
      } else if (type == UINT && ! fitsSigned(sample.trim())) {
        beyondSigned = true;
      }
      result = result.widen(type);
      if (result == STRING || (signed && beyondSigned)) {
        return STRING;
      }
    }
    return result;
  }

  static boolean fitsSigned(String digits) {
    try {
      Long.parseLong(digits);
      return true;
    } catch (NumberFormatException nfe) {
      return false;
    }
  }

  public ContentType widen(ContentType other) {
    return other.ordinal() > ordinal() ? other : this;
  }

  boolean accepts(String s) {
    if (pattern == null) {
      return true;
    }
    if (! pattern.matcher(s).matches()) {
      return false;
    }
    // Digit strings that do not fit into 64 bits stay text
    try {
      if (this == UINT) {
        Long.parseUnsignedLong(s);
      } else if (this == INT) {
        Long.parseLong(s);
      }
    } catch (NumberFormatException nfe) {
      return false;
    }
    return true;
  }

  public boolean isNumeric() {
    return this == UINT || this == INT || this == FLOAT;
  }
}
