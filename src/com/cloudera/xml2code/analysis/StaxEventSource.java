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

import java.io.CharConversionException;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.apache.log4j.Logger;

/*********************************************************
 * StaxEventSource adapts a StAX XMLStreamReader to the XmlEventSource
 * pull interface.
 *
 * Only local names are reported; namespace prefixes are dropped.
 * A start tag that is directly followed by its end tag is delivered as
 * a single EMPTY event.  Comments, processing instructions and the
 * DOCTYPE are skipped.
 *********************************************************/
public class StaxEventSource implements XmlEventSource, Closeable {
  private static final Logger LOG = Logger.getLogger(StaxEventSource.class);

  private final XMLStreamReader reader;
  private boolean advanced = false;
  private boolean finished = false;

  public StaxEventSource(InputStream in) throws AnalysisException {
    try {
      this.reader = createFactory().createXMLStreamReader(in);
    } catch (XMLStreamException xse) {
      throw translate(xse);
    }
  }

  public StaxEventSource(Reader in) throws AnalysisException {
    try {
      this.reader = createFactory().createXMLStreamReader(in);
    } catch (XMLStreamException xse) {
      throw translate(xse);
    }
  }

  public StaxEventSource(XMLStreamReader reader) {
    this.reader = reader;
  }

  /**
   * A factory that coalesces text and never resolves external entities.
   */
  public static XMLInputFactory createFactory() {
    XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    return factory;
  }

  public XmlEvent next() throws AnalysisException {
    if (finished) {
      return XmlEvent.eof();
    }
    try {
      while (true) {
        int type;
        if (advanced) {
          type = reader.getEventType();
          advanced = false;
        } else if (reader.hasNext()) {
          type = reader.next();
        } else {
          type = XMLStreamConstants.END_DOCUMENT;
        }

        switch (type) {
        case XMLStreamConstants.START_ELEMENT: {
          String name = reader.getLocalName();
          List<XmlEvent.Attribute> attributes = new ArrayList<XmlEvent.Attribute>();
          for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.add(new XmlEvent.Attribute(reader.getAttributeLocalName(i), reader.getAttributeValue(i)));
          }
          if (reader.next() == XMLStreamConstants.END_ELEMENT) {
            return XmlEvent.empty(name, attributes);
          }
          advanced = true;
          return XmlEvent.start(name, attributes);
        }
        case XMLStreamConstants.END_ELEMENT:
          return XmlEvent.end(reader.getLocalName());
        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          return XmlEvent.text(reader.getText());
        case XMLStreamConstants.END_DOCUMENT:
          finished = true;
          return XmlEvent.eof();
        default:
          if (LOG.isTraceEnabled()) {
            LOG.trace("Skipping StAX event " + type);
          }
        }
      }
    } catch (XMLStreamException xse) {
      throw translate(xse);
    }
  }

  public void close() throws IOException {
    try {
      reader.close();
    } catch (XMLStreamException xse) {
      throw new IOException("Could not close XML stream", xse);
    }
  }

  /**
   * Maps a StAX failure onto the analysis taxonomy: decoding problems
   * become DocumentEncodingException, everything else is malformed XML.
   */
  static AnalysisException translate(XMLStreamException xse) {
    if (isEncodingProblem(xse)) {
      return new DocumentEncodingException("Could not decode XML document: " + xse.getMessage(), xse);
    }
    return new MalformedDocumentException("Malformed XML document: " + xse.getMessage(), xse);
  }

  static boolean isEncodingProblem(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof CharConversionException || cur instanceof CharacterCodingException) {
        return true;
      }
      if (cur instanceof XMLStreamException && ((XMLStreamException) cur).getNestedException() != null
          && ((XMLStreamException) cur).getNestedException() != cur.getCause()) {
        if (isEncodingProblem(((XMLStreamException) cur).getNestedException())) {
          return true;
        }
      }
      String msg = cur.getMessage();
      if (msg != null && msg.contains("UTF-8") && msg.contains("byte")) {
        return true;
      }
      if (cur.getCause() == cur) {
        break;
      }
    }
    return false;
  }
}
