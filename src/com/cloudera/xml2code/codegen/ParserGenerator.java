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
package com.cloudera.xml2code.codegen;

import java.io.CharConversionException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import javax.lang.model.element.Modifier;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.apache.log4j.Logger;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

import com.cloudera.xml2code.inference.ContentType;
import com.cloudera.xml2code.inference.EnumVariants;
import com.cloudera.xml2code.inference.InferredModel;
import com.cloudera.xml2code.inference.InferredModel.AttributeField;
import com.cloudera.xml2code.inference.InferredModel.AttributeType;
import com.cloudera.xml2code.inference.InferredModel.ChildField;
import com.cloudera.xml2code.inference.InferredModel.ElementType;

/*********************************************************
 * ParserGenerator writes the Java source of a typed reader for an
 * InferredModel.
 *
 * The output is a single compilation unit: one public final class
 * named after the root element, with every model type, enum, builder
 * and exception as a static nested type.  Nesting makes declaration
 * order irrelevant, so forward and self references need no sorting.
 *
 * For each element type the reader offers three entry points:
 * <ul>
 * <li><code>readX(reader)</code> parses the element whose start tag the
 *     reader is positioned on;
 * <li><code>readAsRootX(reader)</code> scans forward to the next start
 *     tag of the element and parses it, or returns null at the end of
 *     the document;
 * <li><code>iterX(reader)</code> is a lazy Iterator over all such
 *     elements, calling readAsRootX until it returns null.
 * </ul>
 *********************************************************/
public class ParserGenerator {
  private static final Logger LOG = Logger.getLogger(ParserGenerator.class);

  static final int MAX_HISTOGRAM_ENTRIES = 20;
  static final ClassName LOGGER = ClassName.get(Logger.class);
  static final ClassName STREAM_READER = ClassName.get(XMLStreamReader.class);
  static final ClassName STREAM_CONSTANTS = ClassName.get(XMLStreamConstants.class);
  static final ClassName STREAM_EXCEPTION = ClassName.get(XMLStreamException.class);
  static final ClassName LIST = ClassName.get(List.class);
  static final ClassName ARRAY_LIST = ClassName.get(ArrayList.class);
  static final ClassName COLLECTIONS = ClassName.get(Collections.class);
  static final ClassName STRING = ClassName.get(String.class);

  private final InferredModel model;
  private final String packageName;
  private final ClassName readerClass;
  private final ClassName exceptionClass;
  private final ClassName kindClass;
  private final ClassName uncheckedClass;
  private final ClassName iteratorClass;
  private final ClassName rootFunctionClass;

  public ParserGenerator(InferredModel model, String packageName) {
    this.model = model;
    this.packageName = (packageName == null) ? "" : packageName;
    this.readerClass = ClassName.get(this.packageName, model.getReaderClassName());
    this.exceptionClass = readerClass.nestedClass(model.getExceptionClassName());
    this.kindClass = exceptionClass.nestedClass("Kind");
    this.uncheckedClass = readerClass.nestedClass(InferredModel.UNCHECKED_EXCEPTION_NAME);
    this.iteratorClass = readerClass.nestedClass(InferredModel.ITERATOR_NAME);
    this.rootFunctionClass = readerClass.nestedClass(InferredModel.ROOT_FUNCTION_NAME);
  }

  /**
   * The fully qualified name of the generated reader class.
   */
  public String getQualifiedReaderName() {
    return readerClass.reflectionName();
  }

  public void writeTo(Appendable out) throws IOException {
    generate().writeTo(out);
  }

  public JavaFile generate() {
    TypeSpec.Builder reader = TypeSpec.classBuilder(readerClass)
      .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
      .addJavadoc("Typed reader for &lt;$L&gt; documents.\n", javadoc(model.getRoot().getXmlName()))
      .addJavadoc("\n")
      .addJavadoc("<p>Generated by xml2code. Do not edit.\n")
      .addField(FieldSpec.builder(LOGGER, "LOG", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                .initializer("$T.getLogger($T.class)", LOGGER, readerClass)
                .build())
      .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());

    reader.addType(exceptionType());
    reader.addType(uncheckedType());
    reader.addType(rootFunctionType());
    reader.addType(iteratorType());
    addHelpers(reader);

    for (AttributeType attribute: model.getAttributes()) {
      if (attribute.getContentType() == ContentType.ENUM) {
        reader.addType(enumType(attribute.getEnumName(), attribute.getVariants(),
                                "Values of the " + attribute.getXmlName() + " attribute."));
      }
      reader.addMethod(attributeConverter(attribute));
    }
    for (ElementType element: model.getElements()) {
      if (element.getContentType() == ContentType.ENUM) {
        reader.addType(enumType(element.getContentEnumName(), element.getContentVariants(),
                                "Text content of the " + element.getXmlName() + " element."));
      }
      reader.addType(builderExceptionType(element));
      reader.addType(elementType(element));
      reader.addMethod(readMethod(element));
      reader.addMethod(readAsRootMethod(element));
      reader.addMethod(iterMethod(element));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Generated " + readerClass + " with " + model.getElements().size() + " element types");
    }
    return JavaFile.builder(packageName, reader.build())
      .skipJavaLangImports(true)
      .indent("  ")
      .build();
  }

  ////////////////////////////////////////////////
  // Shared scaffolding
  ////////////////////////////////////////////////
  TypeSpec exceptionType() {
    TypeSpec kind = TypeSpec.enumBuilder("Kind")
      .addModifiers(Modifier.PUBLIC)
      .addEnumConstant("XML_STREAM")
      .addEnumConstant("ENCODING")
      .addEnumConstant("NUMBER_FORMAT")
      .addEnumConstant("BOOLEAN_FORMAT")
      .addEnumConstant("ILLEGAL_ENUM_VALUE")
      .addEnumConstant("MISSING_FIELD")
      .addEnumConstant("DUPLICATE_FIELD")
      .build();
    return TypeSpec.classBuilder(exceptionClass)
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .superclass(Exception.class)
      .addJavadoc("Any failure while reading a document. Field and value name the offending input, if any.\n")
      .addType(kind)
      .addField(kindClass, "kind", Modifier.PRIVATE, Modifier.FINAL)
      .addField(STRING, "field", Modifier.PRIVATE, Modifier.FINAL)
      .addField(STRING, "value", Modifier.PRIVATE, Modifier.FINAL)
      .addMethod(MethodSpec.constructorBuilder()
                 .addModifiers(Modifier.PUBLIC)
                 .addParameter(kindClass, "kind")
                 .addParameter(STRING, "field")
                 .addParameter(STRING, "value")
                 .addParameter(STRING, "message")
                 .addParameter(Throwable.class, "cause")
                 .addStatement("super(message, cause)")
                 .addStatement("this.kind = kind")
                 .addStatement("this.field = field")
                 .addStatement("this.value = value")
                 .build())
      .addMethod(getter(kindClass, "getKind", "kind"))
      .addMethod(getter(STRING, "getField", "field"))
      .addMethod(getter(STRING, "getValue", "value"))
      .build();
  }

  TypeSpec uncheckedType() {
    return TypeSpec.classBuilder(uncheckedClass)
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .superclass(RuntimeException.class)
      .addJavadoc("Carries a $T out of an Iterator.\n", exceptionClass)
      .addMethod(MethodSpec.constructorBuilder()
                 .addModifiers(Modifier.PUBLIC)
                 .addParameter(exceptionClass, "cause")
                 .addStatement("super(cause.getMessage(), cause)")
                 .build())
      .addMethod(MethodSpec.methodBuilder("getReaderException")
                 .addModifiers(Modifier.PUBLIC)
                 .returns(exceptionClass)
                 .addStatement("return ($T) getCause()", exceptionClass)
                 .build())
      .build();
  }

  TypeSpec rootFunctionType() {
    TypeVariableName t = TypeVariableName.get("T");
    return TypeSpec.interfaceBuilder(rootFunctionClass)
      .addModifiers(Modifier.PUBLIC)
      .addTypeVariable(t)
      .addMethod(MethodSpec.methodBuilder("read")
                 .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
                 .addParameter(STREAM_READER, "reader")
                 .addException(exceptionClass)
                 .returns(t)
                 .build())
      .build();
  }

  TypeSpec iteratorType() {
    TypeVariableName t = TypeVariableName.get("T");
    return TypeSpec.classBuilder(iteratorClass)
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .addTypeVariable(t)
      .addSuperinterface(ParameterizedTypeName.get(ClassName.get(Iterator.class), t))
      .addJavadoc("Lazily reads one root value after the other from the same stream.\n")
      .addField(STREAM_READER, "reader", Modifier.PRIVATE, Modifier.FINAL)
      .addField(ParameterizedTypeName.get(rootFunctionClass, t), "function", Modifier.PRIVATE, Modifier.FINAL)
      .addField(t, "next", Modifier.PRIVATE)
      .addField(TypeName.BOOLEAN, "done", Modifier.PRIVATE)
      .addMethod(MethodSpec.constructorBuilder()
                 .addModifiers(Modifier.PUBLIC)
                 .addParameter(STREAM_READER, "reader")
                 .addParameter(ParameterizedTypeName.get(rootFunctionClass, t), "function")
                 .addStatement("this.reader = reader")
                 .addStatement("this.function = function")
                 .build())
      .addMethod(getter(STREAM_READER, "getReader", "reader"))
      .addMethod(MethodSpec.methodBuilder("hasNext")
                 .addAnnotation(Override.class)
                 .addModifiers(Modifier.PUBLIC)
                 .returns(TypeName.BOOLEAN)
                 .beginControlFlow("if (next == null && !done)")
                 .beginControlFlow("try")
                 .addStatement("next = function.read(reader)")
                 .nextControlFlow("catch ($T e)", exceptionClass)
                 .addStatement("done = true")
                 .addStatement("throw new $T(e)", uncheckedClass)
                 .endControlFlow()
                 .beginControlFlow("if (next == null)")
                 .addStatement("done = true")
                 .endControlFlow()
                 .endControlFlow()
                 .addStatement("return next != null")
                 .build())
      .addMethod(MethodSpec.methodBuilder("next")
                 .addAnnotation(Override.class)
                 .addModifiers(Modifier.PUBLIC)
                 .returns(t)
                 .beginControlFlow("if (!hasNext())")
                 .addStatement("throw new $T()", NoSuchElementException.class)
                 .endControlFlow()
                 .addStatement("$T result = next", t)
                 .addStatement("next = null")
                 .addStatement("return result")
                 .build())
      .build();
  }

  void addHelpers(TypeSpec.Builder reader) {
    reader.addMethod(MethodSpec.methodBuilder("streamError")
                     .addModifiers(Modifier.STATIC)
                     .addParameter(STREAM_EXCEPTION, "e")
                     .returns(exceptionClass)
                     .beginControlFlow("for ($T cur = e; cur != null; cur = cur.getCause())", Throwable.class)
                     .addStatement("$T msg = cur.getMessage()", STRING)
                     .beginControlFlow("if (cur instanceof $T || cur instanceof $T\n|| (msg != null && msg.contains($S) && msg.contains($S)))",
                                       CharConversionException.class, CharacterCodingException.class, "UTF-8", "byte")
                     .addStatement("return new $T($T.ENCODING, null, null, $S + e.getMessage(), e)",
                                   exceptionClass, kindClass, "Could not decode document: ")
                     .endControlFlow()
                     .endControlFlow()
                     .addStatement("return new $T($T.XML_STREAM, null, null, $S + e.getMessage(), e)",
                                   exceptionClass, kindClass, "XML stream error: ")
                     .build());

    reader.addMethod(numberHelper("parseUnsigned", TypeName.LONG,
                                  CodeBlock.of("$T.parseUnsignedLong(value.trim())", Long.class)));
    reader.addMethod(numberHelper("parseSigned", TypeName.LONG,
                                  CodeBlock.of("$T.parseLong(value.trim())", Long.class)));
    reader.addMethod(numberHelper("parseFloat", TypeName.DOUBLE,
                                  CodeBlock.of("$T.parseDouble(value.trim().replace(',', '.'))", Double.class)));

    reader.addMethod(MethodSpec.methodBuilder("parseBool")
                     .addModifiers(Modifier.STATIC)
                     .addParameter(STRING, "field")
                     .addParameter(STRING, "value")
                     .addException(exceptionClass)
                     .returns(TypeName.BOOLEAN)
                     .addStatement("$T s = value.trim()", STRING)
                     .beginControlFlow("if (s.equalsIgnoreCase($S))", "true")
                     .addStatement("return true")
                     .endControlFlow()
                     .beginControlFlow("if (s.equalsIgnoreCase($S))", "false")
                     .addStatement("return false")
                     .endControlFlow()
                     .addStatement("throw new $T($T.BOOLEAN_FORMAT, field, value, $S + field + $S + value + $S, null)",
                                   exceptionClass, kindClass, "Field ", " is not a boolean: '", "'")
                     .build());

    TypeVariableName e = TypeVariableName.get("E");
    reader.addMethod(MethodSpec.methodBuilder("checkEnum")
                     .addModifiers(Modifier.STATIC)
                     .addTypeVariable(e)
                     .addParameter(e, "constant")
                     .addParameter(STRING, "field")
                     .addParameter(STRING, "value")
                     .addException(exceptionClass)
                     .returns(e)
                     .beginControlFlow("if (constant == null)")
                     .addStatement("throw new $T($T.ILLEGAL_ENUM_VALUE, field, value, $S + value + $S + field, "
                                   + "new $T($S + value + $S))",
                                   exceptionClass, kindClass, "Illegal value '", "' for ",
                                   IllegalArgumentException.class, "No literal matches '", "'")
                     .endControlFlow()
                     .addStatement("return constant")
                     .build());

    reader.addMethod(MethodSpec.methodBuilder("skipElement")
                     .addModifiers(Modifier.STATIC)
                     .addParameter(STREAM_READER, "reader")
                     .addException(STREAM_EXCEPTION)
                     .addStatement("int depth = 1")
                     .beginControlFlow("while (depth > 0 && reader.hasNext())")
                     .addStatement("int event = reader.next()")
                     .beginControlFlow("if (event == $T.START_ELEMENT)", STREAM_CONSTANTS)
                     .addStatement("depth++")
                     .nextControlFlow("else if (event == $T.END_ELEMENT)", STREAM_CONSTANTS)
                     .addStatement("depth--")
                     .endControlFlow()
                     .endControlFlow()
                     .build());
  }

  MethodSpec numberHelper(String name, TypeName returns, CodeBlock parse) {
    return MethodSpec.methodBuilder(name)
      .addModifiers(Modifier.STATIC)
      .addParameter(STRING, "field")
      .addParameter(STRING, "value")
      .addException(exceptionClass)
      .returns(returns)
      .beginControlFlow("try")
      .addStatement("return $L", parse)
      .nextControlFlow("catch ($T nfe)", NumberFormatException.class)
      .addStatement("throw new $T($T.NUMBER_FORMAT, field, value, $S + field + $S + value + $S, nfe)",
                    exceptionClass, kindClass, "Field ", " is not a number: '", "'")
      .endControlFlow()
      .build();
  }

  /**
   * An enum with one constant per observed literal.  fromLiteral()
   * tries an exact match first, then ignores case, and returns null
   * for unknown literals.
   */
  TypeSpec enumType(String name, EnumVariants variants, String doc) {
    ClassName enumClass = readerClass.nestedClass(name);
    TypeSpec.Builder builder = TypeSpec.enumBuilder(enumClass)
      .addModifiers(Modifier.PUBLIC)
      .addJavadoc("$L\n", javadoc(doc));
    for (Map.Entry<String, String> pair: variants.asMap().entrySet()) {
      builder.addEnumConstant(pair.getValue(), TypeSpec.anonymousClassBuilder("$S", pair.getKey()).build());
    }
    return builder
      .addField(STRING, "literal", Modifier.PRIVATE, Modifier.FINAL)
      .addMethod(MethodSpec.constructorBuilder()
                 .addParameter(STRING, "literal")
                 .addStatement("this.literal = literal")
                 .build())
      .addMethod(getter(STRING, "getLiteral", "literal"))
      .addMethod(MethodSpec.methodBuilder("fromLiteral")
                 .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                 .addParameter(STRING, "literal")
                 .returns(enumClass)
                 .beginControlFlow("for ($T constant : values())", enumClass)
                 .beginControlFlow("if (constant.literal.equals(literal))")
                 .addStatement("return constant")
                 .endControlFlow()
                 .endControlFlow()
                 .beginControlFlow("for ($T constant : values())", enumClass)
                 .beginControlFlow("if (constant.literal.equalsIgnoreCase(literal))")
                 .addStatement("return constant")
                 .endControlFlow()
                 .endControlFlow()
                 .addStatement("return null")
                 .build())
      .build();
  }

  MethodSpec attributeConverter(AttributeType attribute) {
    TypeName type = scalarType(attribute.getContentType(), attributeEnum(attribute), true);
    return MethodSpec.methodBuilder(attribute.getConverterName())
      .addModifiers(Modifier.STATIC)
      .addParameter(STRING, "value")
      .addException(exceptionClass)
      .returns(type)
      .addStatement("return $L", convert(attribute.getContentType(), attributeEnum(attribute), attribute.getXmlName(), "value"))
      .build();
  }

  ////////////////////////////////////////////////
  // Per element
  ////////////////////////////////////////////////
  TypeSpec builderExceptionType(ElementType element) {
    return TypeSpec.classBuilder(readerClass.nestedClass(element.getBuilderExceptionName()))
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .superclass(exceptionClass)
      .addJavadoc("A field of $L was set twice or never.\n", element.getTypeName())
      .addMethod(MethodSpec.constructorBuilder()
                 .addModifiers(Modifier.PUBLIC)
                 .addParameter(kindClass, "kind")
                 .addParameter(STRING, "field")
                 .addParameter(STRING, "message")
                 .addStatement("super(kind, field, null, message, null)")
                 .build())
      .build();
  }

  TypeSpec elementType(ElementType element) {
    ClassName typeClass = typeClass(element);
    ClassName builderClass = typeClass.nestedClass("Builder");
    ClassName builderException = readerClass.nestedClass(element.getBuilderExceptionName());

    TypeSpec.Builder type = TypeSpec.classBuilder(typeClass)
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
      .addJavadoc("The &lt;$L&gt; element.\n", javadoc(element.getXmlName()));
    TypeSpec.Builder builder = TypeSpec.classBuilder(builderClass)
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL);
    MethodSpec.Builder constructor = MethodSpec.constructorBuilder()
      .addModifiers(Modifier.PRIVATE)
      .addParameter(builderClass, "builder");
    MethodSpec.Builder build = MethodSpec.methodBuilder("build")
      .addModifiers(Modifier.PUBLIC)
      .addException(builderException)
      .returns(typeClass);

    for (AttributeField field: element.getAttributeFields()) {
      AttributeType attribute = field.getType();
      String doc = "Attribute " + attribute.getXmlName() + ", " + attribute.getContentType()
        + ". Observed: " + histogram(field.getHistogram());
      addValueField(type, builder, builderClass, constructor, build, builderException, field.getFieldName(), attribute.getXmlName(),
                    scalarType(attribute.getContentType(), attributeEnum(attribute), true),
                    field.getShape().isOptional(), doc);
    }
    for (ChildField field: element.getChildFields()) {
      if (field.isFlag()) {
        addFlagField(type, builder, builderClass, constructor, builderException, field);
      } else if (field.getShape().isVector()) {
        addListField(type, builder, builderClass, constructor, field);
      } else {
        String doc = "Child element " + field.getXmlName() + ", " + field.getShape() + ".";
        addValueField(type, builder, builderClass, constructor, build, builderException, field.getFieldName(), field.getXmlName(),
                      typeClass(field.getChildType()), field.getShape().isOptional(), doc);
      }
    }
    if (element.hasContent()) {
      String doc = "Text content, " + element.getContentType() + ".";
      addValueField(type, builder, builderClass, constructor, build, builderException, "content", element.getXmlName(),
                    scalarType(element.getContentType(), contentEnum(element), true),
                    ! element.isContentRequired(), doc);
    }

    build.addStatement("return new $T(this)", typeClass);
    builder.addMethod(build.build());
    return type
      .addMethod(constructor.build())
      .addMethod(MethodSpec.methodBuilder("builder")
                 .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                 .returns(builderClass)
                 .addStatement("return new $T()", builderClass)
                 .build())
      .addType(builder.build())
      .build();
  }

  /**
   * A singleton field.  Required scalars are held as primitives, all
   * other values as nullable references.  The builder holds everything
   * boxed so that "not set" is null.
   */
  void addValueField(TypeSpec.Builder type, TypeSpec.Builder builder, ClassName builderClass, MethodSpec.Builder constructor,
                     MethodSpec.Builder build, ClassName builderException, String fieldName, String xmlName,
                     TypeName valueType, boolean optional, String doc) {
    TypeName boxed = valueType.box();
    TypeName held = optional ? boxed : valueType;
    String cap = capitalize(fieldName);

    type.addField(FieldSpec.builder(held, fieldName, Modifier.PRIVATE, Modifier.FINAL)
                  .addJavadoc("$L\n", javadoc(doc))
                  .build());
    constructor.addStatement("this.$N = builder.$N", fieldName, fieldName);
    type.addMethod(MethodSpec.methodBuilder("get" + cap)
                   .addModifiers(Modifier.PUBLIC)
                   .returns(held)
                   .addStatement("return $N", fieldName)
                   .build());
    if (optional) {
      type.addMethod(MethodSpec.methodBuilder("has" + cap)
                     .addModifiers(Modifier.PUBLIC)
                     .returns(TypeName.BOOLEAN)
                     .addStatement("return $N != null", fieldName)
                     .build());
    }

    builder.addField(boxed, fieldName, Modifier.PRIVATE);
    builder.addMethod(MethodSpec.methodBuilder("set" + cap)
                      .addModifiers(Modifier.PUBLIC)
                      .addParameter(valueType, "value")
                      .addException(builderException)
                      .returns(builderClass)
                      .beginControlFlow("if (this.$N != null)", fieldName)
                      .addStatement("throw new $T($T.DUPLICATE_FIELD, $S, $S)", builderException, kindClass, xmlName,
                                    "Field " + xmlName + " set twice")
                      .endControlFlow()
                      .addStatement("this.$N = value", fieldName)
                      .addStatement("return this")
                      .build());
    if (! optional) {
      build.beginControlFlow("if ($N == null)", fieldName)
        .addStatement("throw new $T($T.MISSING_FIELD, $S, $S)", builderException, kindClass, xmlName,
                      "Required field " + xmlName + " is missing")
        .endControlFlow();
    }
  }

  void addFlagField(TypeSpec.Builder type, TypeSpec.Builder builder, ClassName builderClass, MethodSpec.Builder constructor,
                    ClassName builderException, ChildField field) {
    String fieldName = field.getFieldName();
    String cap = capitalize(fieldName);
    type.addField(FieldSpec.builder(TypeName.BOOLEAN, fieldName, Modifier.PRIVATE, Modifier.FINAL)
                  .addJavadoc("True if the empty element $L was present.\n", javadoc(field.getXmlName()))
                  .build());
    constructor.addStatement("this.$N = $T.TRUE.equals(builder.$N)", fieldName, Boolean.class, fieldName);
    type.addMethod(MethodSpec.methodBuilder("has" + cap)
                   .addModifiers(Modifier.PUBLIC)
                   .returns(TypeName.BOOLEAN)
                   .addStatement("return $N", fieldName)
                   .build());
    builder.addField(TypeName.BOOLEAN.box(), fieldName, Modifier.PRIVATE);
    builder.addMethod(MethodSpec.methodBuilder("set" + cap)
                      .addModifiers(Modifier.PUBLIC)
                      .addParameter(TypeName.BOOLEAN, "value")
                      .addException(builderException)
                      .returns(builderClass)
                      .beginControlFlow("if (this.$N != null)", fieldName)
                      .addStatement("throw new $T($T.DUPLICATE_FIELD, $S, $S)", builderException, kindClass,
                                    field.getXmlName(), "Field " + field.getXmlName() + " set twice")
                      .endControlFlow()
                      .addStatement("this.$N = value", fieldName)
                      .addStatement("return this")
                      .build());
  }

  void addListField(TypeSpec.Builder type, TypeSpec.Builder builder, ClassName builderClass, MethodSpec.Builder constructor, ChildField field) {
    String fieldName = field.getFieldName();
    ClassName childClass = typeClass(field.getChildType());
    TypeName listType = ParameterizedTypeName.get(LIST, childClass);
    type.addField(FieldSpec.builder(listType, fieldName, Modifier.PRIVATE, Modifier.FINAL)
                  .addJavadoc("Child elements $L, in document order.\n", javadoc(field.getXmlName()))
                  .build());
    constructor.addStatement("this.$N = $T.unmodifiableList(new $T(builder.$N))", fieldName, COLLECTIONS,
                             ParameterizedTypeName.get(ARRAY_LIST, childClass), fieldName);
    type.addMethod(MethodSpec.methodBuilder("get" + capitalize(fieldName))
                   .addModifiers(Modifier.PUBLIC)
                   .returns(listType)
                   .addStatement("return $N", fieldName)
                   .build());
    builder.addField(FieldSpec.builder(listType, fieldName, Modifier.PRIVATE, Modifier.FINAL)
                     .initializer("new $T()", ParameterizedTypeName.get(ARRAY_LIST, childClass))
                     .build());
    builder.addMethod(MethodSpec.methodBuilder(adderName(fieldName))
                      .addModifiers(Modifier.PUBLIC)
                      .addParameter(childClass, "value")
                      .returns(builderClass)
                      .addStatement("this.$N.add(value)", fieldName)
                      .addStatement("return this")
                      .build());
  }

  MethodSpec readMethod(ElementType element) {
    ClassName typeClass = typeClass(element);
    String xmlName = element.getXmlName();
    CodeBlock.Builder code = CodeBlock.builder();
    code.addStatement("$T builder = $T.builder()", typeClass.nestedClass("Builder"), typeClass);
    if (element.hasContent()) {
      code.addStatement("$T content = new $T()", StringBuilder.class, StringBuilder.class);
    }
    code.beginControlFlow("try");

    code.beginControlFlow("for (int i = 0; i < reader.getAttributeCount(); i++)");
    code.addStatement("$T name = reader.getAttributeLocalName(i)", STRING);
    code.beginControlFlow("switch (name)");
    for (AttributeField field: element.getAttributeFields()) {
      code.add("case $S:\n", field.getType().getXmlName()).indent();
      code.addStatement("builder.$L($L(reader.getAttributeValue(i)))", "set" + capitalize(field.getFieldName()),
                        field.getType().getConverterName());
      code.addStatement("break").unindent();
    }
    code.add("default:\n").indent();
    code.addStatement("LOG.warn($S + name + $S)", "Unknown attribute ", " on <" + xmlName + ">");
    code.unindent();
    code.endControlFlow();
    code.endControlFlow();

    code.addStatement("boolean finished = false");
    code.beginControlFlow("while (!finished && reader.hasNext())");
    code.beginControlFlow("switch (reader.next())");
    code.add("case $T.START_ELEMENT:\n", STREAM_CONSTANTS).indent();
    code.beginControlFlow("switch (reader.getLocalName())");
    for (ChildField field: element.getChildFields()) {
      code.add("case $S:\n", field.getXmlName()).indent();
      if (field.isFlag()) {
        code.addStatement("builder.$L(true)", "set" + capitalize(field.getFieldName()));
        code.addStatement("skipElement(reader)");
      } else if (field.getShape().isVector()) {
        code.addStatement("builder.$L($L(reader))", adderName(field.getFieldName()),
                          field.getChildType().getReadMethodName());
      } else {
        code.addStatement("builder.$L($L(reader))", "set" + capitalize(field.getFieldName()),
                          field.getChildType().getReadMethodName());
      }
      code.addStatement("break").unindent();
    }
    code.add("default:\n").indent();
    code.addStatement("LOG.warn($S + reader.getLocalName() + $S)", "Unknown element <", "> in <" + xmlName + ">");
    code.addStatement("skipElement(reader)");
    code.unindent();
    code.endControlFlow();
    code.addStatement("break").unindent();
    if (element.hasContent()) {
      code.add("case $T.CHARACTERS:\n", STREAM_CONSTANTS);
      code.add("case $T.CDATA:\n", STREAM_CONSTANTS);
      code.add("case $T.SPACE:\n", STREAM_CONSTANTS).indent();
      code.addStatement("content.append(reader.getText())");
      code.addStatement("break").unindent();
    }
    code.add("case $T.END_ELEMENT:\n", STREAM_CONSTANTS);
    code.add("case $T.END_DOCUMENT:\n", STREAM_CONSTANTS).indent();
    code.addStatement("finished = true");
    code.addStatement("break").unindent();
    code.add("default:\n").indent();
    code.addStatement("break").unindent();
    code.endControlFlow();
    code.endControlFlow();

    code.nextControlFlow("catch ($T e)", STREAM_EXCEPTION);
    code.addStatement("throw streamError(e)");
    code.endControlFlow();

    if (element.hasContent()) {
      code.addStatement("$T text = content.toString().trim()", STRING);
      code.beginControlFlow("if (text.length() > 0)");
      code.addStatement("builder.setContent($L)", convert(element.getContentType(), contentEnum(element), xmlName, "text"));
      code.endControlFlow();
    }
    code.addStatement("return builder.build()");

    return MethodSpec.methodBuilder(element.getReadMethodName())
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .addJavadoc("Reads the &lt;$L&gt; element whose start tag the reader is positioned on, up to its end tag.\n",
                  javadoc(xmlName))
      .addParameter(STREAM_READER, "reader")
      .addException(exceptionClass)
      .returns(typeClass)
      .addCode(code.build())
      .build();
  }

  MethodSpec readAsRootMethod(ElementType element) {
    ClassName typeClass = typeClass(element);
    return MethodSpec.methodBuilder(element.getReadAsRootMethodName())
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .addJavadoc("Skips forward to the next &lt;$L&gt; element and reads it; null at the end of the document.\n",
                  javadoc(element.getXmlName()))
      .addParameter(STREAM_READER, "reader")
      .addException(exceptionClass)
      .returns(typeClass)
      .beginControlFlow("try")
      .beginControlFlow("while (true)")
      .beginControlFlow("if (reader.getEventType() == $T.START_ELEMENT && $S.equals(reader.getLocalName()))",
                        STREAM_CONSTANTS, element.getXmlName())
      .addStatement("return $L(reader)", element.getReadMethodName())
      .endControlFlow()
      .beginControlFlow("if (!reader.hasNext())")
      .addStatement("return null")
      .endControlFlow()
      .addStatement("reader.next()")
      .endControlFlow()
      .nextControlFlow("catch ($T e)", STREAM_EXCEPTION)
      .addStatement("throw streamError(e)")
      .endControlFlow()
      .build();
  }

  MethodSpec iterMethod(ElementType element) {
    ClassName typeClass = typeClass(element);
    TypeSpec function = TypeSpec.anonymousClassBuilder("")
      .addSuperinterface(ParameterizedTypeName.get(rootFunctionClass, typeClass))
      .addMethod(MethodSpec.methodBuilder("read")
                 .addAnnotation(Override.class)
                 .addModifiers(Modifier.PUBLIC)
                 .addParameter(STREAM_READER, "reader")
                 .addException(exceptionClass)
                 .returns(typeClass)
                 .addStatement("return $L(reader)", element.getReadAsRootMethodName())
                 .build())
      .build();
    TypeName iterator = ParameterizedTypeName.get(iteratorClass, typeClass);
    return MethodSpec.methodBuilder(element.getIterMethodName())
      .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
      .addJavadoc("All &lt;$L&gt; elements of the stream, read lazily.\n", javadoc(element.getXmlName()))
      .addParameter(STREAM_READER, "reader")
      .returns(iterator)
      .addStatement("return new $T(reader, $L)", iterator, function)
      .build();
  }

  ////////////////////////////////////////////////
  // Types and conversions
  ////////////////////////////////////////////////
  ClassName typeClass(ElementType element) {
    return readerClass.nestedClass(element.getTypeName());
  }

  ClassName attributeEnum(AttributeType attribute) {
    return attribute.getContentType() == ContentType.ENUM ? readerClass.nestedClass(attribute.getEnumName()) : null;
  }

  ClassName contentEnum(ElementType element) {
    return element.getContentType() == ContentType.ENUM ? readerClass.nestedClass(element.getContentEnumName()) : null;
  }

  static TypeName scalarType(ContentType type, ClassName enumClass, boolean primitive) {
    TypeName result;
    switch (type) {
    case BOOL:
      result = TypeName.BOOLEAN;
      break;
    case UINT:
    case INT:
      result = TypeName.LONG;
      break;
    case FLOAT:
      result = TypeName.DOUBLE;
      break;
    case ENUM:
      return enumClass;
    default:
      return STRING;
    }
    return primitive ? result : result.box();
  }

  /**
   * The expression that turns the string in the given variable into a
   * value of the content type.
   */
  static CodeBlock convert(ContentType type, ClassName enumClass, String field, String var) {
    switch (type) {
    case BOOL:
      return CodeBlock.of("parseBool($S, $N)", field, var);
    case UINT:
      return CodeBlock.of("parseUnsigned($S, $N)", field, var);
    case INT:
      return CodeBlock.of("parseSigned($S, $N)", field, var);
    case FLOAT:
      return CodeBlock.of("parseFloat($S, $N)", field, var);
    case ENUM:
      return CodeBlock.of("checkEnum($T.fromLiteral($N.trim()), $S, $N)", enumClass, var, field, var);
    default:
      return CodeBlock.of("$N", var);
    }
  }

  MethodSpec getter(TypeName type, String name, String field) {
    return MethodSpec.methodBuilder(name)
      .addModifiers(Modifier.PUBLIC)
      .returns(type)
      .addStatement("return $N", field)
      .build();
  }

  static String capitalize(String s) {
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }

  static String adderName(String fieldName) {
    String base = fieldName.endsWith("s") ? fieldName.substring(0, fieldName.length() - 1) : fieldName;
    return "add" + capitalize(base);
  }

  static String histogram(Map<String, Long> histogram) {
    StringBuilder buf = new StringBuilder("{");
    int i = 0;
    for (Map.Entry<String, Long> pair: histogram.entrySet()) {
      if (i == MAX_HISTOGRAM_ENTRIES) {
        buf.append(", ...");
        break;
      }
      if (i > 0) {
        buf.append(", ");
      }
      buf.append('"').append(pair.getKey()).append("\"=").append(pair.getValue());
      i++;
    }
    return buf.append("}").toString();
  }

  /**
   * Makes observed text safe inside a javadoc comment.
   */
  static String javadoc(String text) {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
      case '<':
        buf.append("&lt;");
        break;
      case '>':
        buf.append("&gt;");
        break;
      case '&':
        buf.append("&amp;");
        break;
      case '\\':
        buf.append("&#92;");
        break;
      case '@':
        buf.append("&#64;");
        break;
      case '\n':
      case '\r':
        buf.append(' ');
        break;
      case '/':
        if (i > 0 && text.charAt(i - 1) == '*') {
          buf.append("&#47;");
        } else {
          buf.append(c);
        }
        break;
      default:
        buf.append(c);
      }
    }
    return buf.toString();
  }
}
