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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/*********************************************************
 * One event of an XML pull stream, reduced to what the analyzer needs:
 * local names, attribute pairs and character content.
 *********************************************************/
public class XmlEvent {
  public enum Kind {
    START, EMPTY, END, TEXT, EOF
  }

  /**
   * One attribute of a start or empty tag.  The value is already unescaped.
   */
  public static class Attribute {
    private final String localName;
    private final String value;

    public Attribute(String localName, String value) {
      this.localName = localName;
      this.value = value;
    }

    public String getLocalName() {
      return localName;
    }

    public String getValue() {
      return value;
    }

    public String toString() {
      return localName + "=\"" + value + "\"";
    }
  }

  private static final XmlEvent EOF_EVENT = new XmlEvent(Kind.EOF, null, Collections.<Attribute>emptyList(), null);

  private final Kind kind;
  private final String name;
  private final List<Attribute> attributes;
  private final String text;

  private XmlEvent(Kind kind, String name, List<Attribute> attributes, String text) {
    this.kind = kind;
    this.name = name;
    this.attributes = attributes;
    this.text = text;
  }

  public static XmlEvent start(String name, List<Attribute> attributes) {
    return new XmlEvent(Kind.START, name, Collections.unmodifiableList(new ArrayList<Attribute>(attributes)), null);
  }

  public static XmlEvent empty(String name, List<Attribute> attributes) {
    return new XmlEvent(Kind.EMPTY, name, Collections.unmodifiableList(new ArrayList<Attribute>(attributes)), null);
  }

  public static XmlEvent end(String name) {
    return new XmlEvent(Kind.END, name, Collections.<Attribute>emptyList(), null);
  }

  public static XmlEvent text(String text) {
    return new XmlEvent(Kind.TEXT, null, Collections.<Attribute>emptyList(), text);
  }

  public static XmlEvent eof() {
    return EOF_EVENT;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The local name for START, EMPTY and END; null otherwise.
   */
  public String getName() {
    return name;
  }

  public List<Attribute> getAttributes() {
    return attributes;
  }

  /**
   * The raw character content for TEXT; null otherwise.
   */
  public String getText() {
    return text;
  }

  public String toString() {
    switch (kind) {
    case START:
      return "<" + name + attributes + ">";
    case EMPTY:
      return "<" + name + attributes + "/>";
    case END:
      return "</" + name + ">";
    case TEXT:
      return "TEXT(" + text + ")";
    default:
      return "EOF";
    }
  }
}
