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

import java.util.*;

import org.apache.log4j.Logger;

import com.cloudera.xml2code.analysis.AttributeNode;
import com.cloudera.xml2code.analysis.ChildEdge;
import com.cloudera.xml2code.analysis.ElementNode;

/*********************************************************
 * InferredModel is the finished graph read through type and shape
 * inference: one ElementType per element that needs a generated type,
 * one AttributeType per attribute name, and for every type its fields
 * with their shapes and Java names.
 *
 * Building a model only reads the graph.  The code generators work
 * from the model alone.
 *********************************************************/
public class InferredModel {
  private static final Logger LOG = Logger.getLogger(InferredModel.class);

  public static final String UNCHECKED_EXCEPTION_NAME = "UncheckedReaderException";
  public static final String ITERATOR_NAME = "ReaderIterator";
  public static final String ROOT_FUNCTION_NAME = "RootFunction";

  private final ElementType root;
  private final List<ElementType> elements = new ArrayList<ElementType>();
  private final Map<ElementNode, ElementType> elementsByNode = new HashMap<ElementNode, ElementType>();
  private final List<AttributeType> attributes = new ArrayList<AttributeType>();
  private final Map<AttributeNode, AttributeType> attributesByNode = new HashMap<AttributeNode, AttributeType>();
  private final String readerClassName;
  private final String exceptionClassName;

  /*********************************************************
   * The generated type of one element.
   *********************************************************/
  public static class ElementType {
    final ElementNode node;
    final String typeName;
    final String builderExceptionName;
    ContentType contentType = null;
    boolean contentRequired = false;
    String contentEnumName = null;
    EnumVariants contentVariants = null;
    final List<AttributeField> attributeFields = new ArrayList<AttributeField>();
    final List<ChildField> childFields = new ArrayList<ChildField>();

    ElementType(ElementNode node, String typeName, String builderExceptionName) {
      this.node = node;
      this.typeName = typeName;
      this.builderExceptionName = builderExceptionName;
    }

    public ElementNode getNode() {
      return node;
    }

    public String getXmlName() {
      return node.getName().getName();
    }

    public String getTypeName() {
      return typeName;
    }

    public String getBuilderExceptionName() {
      return builderExceptionName;
    }

    public String getReadMethodName() {
      return "read" + typeName;
    }

    public String getReadAsRootMethodName() {
      return "readAsRoot" + typeName;
    }

    public String getIterMethodName() {
      return "iter" + typeName;
    }

    public boolean hasContent() {
      return contentType != null;
    }

    /**
     * The type of the text content, or null if the element never had text.
     */
    public ContentType getContentType() {
      return contentType;
    }

    public boolean isContentRequired() {
      return contentRequired;
    }

    public String getContentEnumName() {
      return contentEnumName;
    }

    public EnumVariants getContentVariants() {
      return contentVariants;
    }

    public List<AttributeField> getAttributeFields() {
      return Collections.unmodifiableList(attributeFields);
    }

    public List<ChildField> getChildFields() {
      return Collections.unmodifiableList(childFields);
    }

    public String toString() {
      return typeName + "<" + getXmlName() + ">";
    }
  }

  /*********************************************************
   * The corpus-wide type of one attribute name.
   *********************************************************/
  public static class AttributeType {
    final AttributeNode node;
    final ContentType contentType;
    final String baseName;
    final EnumVariants variants;

    AttributeType(AttributeNode node, ContentType contentType, String baseName, EnumVariants variants) {
      this.node = node;
      this.contentType = contentType;
      this.baseName = baseName;
      this.variants = variants;
    }

    public AttributeNode getNode() {
      return node;
    }

    public String getXmlName() {
      return node.getName().getName();
    }

    public ContentType getContentType() {
      return contentType;
    }

    /**
     * The name of the generated enum; only meaningful for ENUM attributes.
     */
    public String getEnumName() {
      return baseName;
    }

    public String getConverterName() {
      return "read" + baseName;
    }

    public EnumVariants getVariants() {
      return variants;
    }
  }

  /**
   * An attribute as a field of one element type.
   */
  public static class AttributeField {
    final AttributeType type;
    final String fieldName;
    final FieldShape shape;
    final Map<String, Long> histogram;

    AttributeField(AttributeType type, String fieldName, FieldShape shape, Map<String, Long> histogram) {
      this.type = type;
      this.fieldName = fieldName;
      this.shape = shape;
      this.histogram = histogram;
    }

    public AttributeType getType() {
      return type;
    }

    public String getFieldName() {
      return fieldName;
    }

    public FieldShape getShape() {
      return shape;
    }

    /**
     * Observed values on the owning element with their counts.
     */
    public Map<String, Long> getHistogram() {
      return histogram;
    }
  }

  /**
   * A child element as a field of its parent's type.  A flag child has
   * no type of its own and is held as a boolean.
   */
  public static class ChildField {
    final ChildEdge edge;
    final String fieldName;
    final FieldShape shape;
    final boolean flag;
    ElementType childType = null;

    ChildField(ChildEdge edge, String fieldName, FieldShape shape, boolean flag) {
      this.edge = edge;
      this.fieldName = fieldName;
      this.shape = shape;
      this.flag = flag;
    }

    public ChildEdge getEdge() {
      return edge;
    }

    public String getXmlName() {
      return edge.getChild().getName().getName();
    }

    public String getFieldName() {
      return fieldName;
    }

    public FieldShape getShape() {
      return shape;
    }

    public boolean isFlag() {
      return flag;
    }

    /**
     * The generated type of the child; null for flags.
     */
    public ElementType getChildType() {
      return childType;
    }
  }

  ////////////////////////////////////////////////
  // Construction
  ////////////////////////////////////////////////
  InferredModel(ElementNode rootNode, TypeOverrides overrides) {
    JavaNames typeNames = new JavaNames();
    String rootBase = JavaNames.pascalCase(rootNode.getName().getName());
    this.readerClassName = typeNames.allocate(rootBase + "Reader");
    this.exceptionClassName = typeNames.allocate(readerClassName + "Exception");
    typeNames.reserve(UNCHECKED_EXCEPTION_NAME);
    typeNames.reserve(ITERATOR_NAME);
    typeNames.reserve(ROOT_FUNCTION_NAME);

    // Breadth-first from the root; flags do not get a type of their own
    List<ElementNode> order = new ArrayList<ElementNode>();
    Set<ElementNode> typed = new HashSet<ElementNode>();
    Set<ElementNode> visited = new HashSet<ElementNode>();
    LinkedList<ElementNode> queue = new LinkedList<ElementNode>();
    queue.add(rootNode);
    visited.add(rootNode);
    typed.add(rootNode);
    while (queue.size() > 0) {
      ElementNode node = queue.removeFirst();
      order.add(node);
      for (ChildEdge edge: node.getChildEdges()) {
        ElementNode child = edge.getChild();
        if (! isFlagField(edge, ShapeInference.childShape(edge))) {
          typed.add(child);
        }
        if (visited.add(child)) {
          queue.add(child);
        }
      }
    }

    for (ElementNode node: order) {
      if (! typed.contains(node)) {
        continue;
      }
      String typeName = typeNames.allocate(JavaNames.pascalCase(node.getName().getName()) + "Element");
      ElementType type = new ElementType(node, typeName, typeNames.allocate(typeName + "BuilderException"));
      if (node.hasTexts()) {
        ContentType forced = overrides.forElement(type.getXmlName());
        type.contentType = (forced != null) ? forced : ContentType.infer(node.getTexts());
        type.contentRequired = ShapeInference.isContentRequired(node);
        if (type.contentType == ContentType.ENUM) {
          type.contentEnumName = typeNames.allocate(typeName + "Content");
          type.contentVariants = new EnumVariants(trimmed(node.getTexts()));
        }
      }
      elements.add(type);
      elementsByNode.put(node, type);
    }
    this.root = elementsByNode.get(rootNode);

    for (ElementType type: elements) {
      JavaNames fieldNames = new JavaNames();
      fieldNames.reserve("content");
      for (AttributeNode attributeNode: type.node.getAttributes()) {
        AttributeType attributeType = attributesByNode.get(attributeNode);
        if (attributeType == null) {
          attributeType = createAttributeType(attributeNode, overrides, typeNames);
        }
        FieldShape shape = ShapeInference.attributeShape(attributeNode, type.node);
        String fieldName = fieldNames.allocate(JavaNames.camelCase(attributeType.getXmlName()) + "Attribute");
        type.attributeFields.add(new AttributeField(attributeType, fieldName, shape, attributeNode.getHistogramOn(type.node)));
      }
      for (ChildEdge edge: type.node.getChildEdges()) {
        FieldShape shape = ShapeInference.childShape(edge);
        boolean flag = isFlagField(edge, shape);
        String suffix = shape.isVector() ? "Elements" : "Element";
        String fieldName = fieldNames.allocate(JavaNames.camelCase(edge.getChild().getName().getName()) + suffix);
        ChildField field = new ChildField(edge, fieldName, shape, flag);
        if (! flag) {
          field.childType = elementsByNode.get(edge.getChild());
        }
        type.childFields.add(field);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Inferred " + type + " with " + type.attributeFields.size() + " attributes and "
                  + type.childFields.size() + " children");
      }
    }
  }

  AttributeType createAttributeType(AttributeNode node, TypeOverrides overrides, JavaNames typeNames) {
    String xmlName = node.getName().getName();
    ContentType forced = overrides.forAttribute(xmlName);
    ContentType contentType = (forced != null) ? forced : ContentType.infer(node.getValues());
    String baseName = typeNames.allocate(JavaNames.pascalCase(xmlName) + "Attribute");
    EnumVariants variants = null;
    if (contentType == ContentType.ENUM) {
      variants = new EnumVariants(trimmed(node.getValues()));
    }
    AttributeType type = new AttributeType(node, contentType, baseName, variants);
    attributes.add(type);
    attributesByNode.put(node, type);
    return type;
  }

  static List<String> trimmed(Collection<String> samples) {
    List<String> result = new ArrayList<String>();
    for (String s: samples) {
      result.add(s.trim());
    }
    return result;
  }

  /**
   * A child that never had attributes, children or text is only a
   * presence flag, unless it repeats.
   */
  static boolean isFlagField(ChildEdge edge, FieldShape shape) {
    return edge.getChild().isFlag() && ! shape.isVector() && edge.getChild() != edge.getOwner();
  }

  /**
   * Runs type and shape inference over the graph below the given root.
   */
  public static InferredModel infer(ElementNode root, TypeOverrides overrides) {
    return new InferredModel(root, overrides == null ? TypeOverrides.none() : overrides);
  }

  ////////////////////////////////////////////////
  // Accessors
  ////////////////////////////////////////////////
  public ElementType getRoot() {
    return root;
  }

  public List<ElementType> getElements() {
    return Collections.unmodifiableList(elements);
  }

  public ElementType getElementType(ElementNode node) {
    return elementsByNode.get(node);
  }

  public ElementType findElementType(String xmlName) {
    for (ElementType type: elements) {
      if (type.getXmlName().equals(xmlName)) {
        return type;
      }
    }
    return null;
  }

  public List<AttributeType> getAttributes() {
    return Collections.unmodifiableList(attributes);
  }

  public AttributeType findAttributeType(String xmlName) {
    for (AttributeType type: attributes) {
      if (type.getXmlName().equals(xmlName)) {
        return type;
      }
    }
    return null;
  }

  public String getReaderClassName() {
    return readerClassName;
  }

  public String getExceptionClassName() {
    return exceptionClassName;
  }
}
