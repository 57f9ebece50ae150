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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/*********************************************************
 * TypeOverrides lets a human force the content type of an element or
 * attribute that inference gets wrong.  Keys are the qualified node
 * names: <code>e_&lt;name&gt;</code> for elements and
 * <code>a_&lt;name&gt;</code> for attributes.  An override always wins
 * over the inferred type.
 *
 * Overrides can be read from a properties file:
 * <pre>
 *   e_title = STRING
 *   a_type = ENUM
 * </pre>
 *********************************************************/
public class TypeOverrides {
  public static final String ELEMENT_PREFIX = "e_";
  public static final String ATTRIBUTE_PREFIX = "a_";

  private final Map<String, ContentType> overrides = new TreeMap<String, ContentType>();

  public TypeOverrides() {
  }

  public static TypeOverrides none() {
    return new TypeOverrides();
  }

  public static TypeOverrides load(File f) throws IOException {
    InputStream in = new FileInputStream(f);
    try {
      return load(in);
    } finally {
      in.close();
    }
  }

  public static TypeOverrides load(InputStream in) throws IOException {
    Properties props = new Properties();
    props.load(in);
    return fromProperties(props);
  }

  public static TypeOverrides fromProperties(Properties props) {
    TypeOverrides result = new TypeOverrides();
    for (String key: props.stringPropertyNames()) {
      String value = props.getProperty(key).trim();
      ContentType type;
      try {
        type = ContentType.valueOf(value.toUpperCase());
      } catch (IllegalArgumentException iae) {
        throw new IllegalArgumentException("Unknown content type '" + value + "' for override " + key, iae);
      }
      result.put(key.trim(), type);
    }
    return result;
  }

  /**
   * Adds an override under a qualified key.
   */
  public TypeOverrides put(String key, ContentType type) {
    if (! key.startsWith(ELEMENT_PREFIX) && ! key.startsWith(ATTRIBUTE_PREFIX)) {
      throw new IllegalArgumentException("Override key must start with " + ELEMENT_PREFIX + " or " + ATTRIBUTE_PREFIX + ": " + key);
    }
    overrides.put(key, type);
    return this;
  }

  public TypeOverrides putElement(String name, ContentType type) {
    return put(ELEMENT_PREFIX + name, type);
  }

  public TypeOverrides putAttribute(String name, ContentType type) {
    return put(ATTRIBUTE_PREFIX + name, type);
  }

  /**
   * The forced type of the element, or null.
   */
  public ContentType forElement(String name) {
    return overrides.get(ELEMENT_PREFIX + name);
  }

  /**
   * The forced type of the attribute, or null.
   */
  public ContentType forAttribute(String name) {
    return overrides.get(ATTRIBUTE_PREFIX + name);
  }

  public Map<String, ContentType> asMap() {
    return Collections.unmodifiableMap(overrides);
  }

  public int size() {
    return overrides.size();
  }

  public String toString() {
    return overrides.toString();
  }
}
